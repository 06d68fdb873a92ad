/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * Tool configuration. The defaults are loaded from the "reglex.properties"
 * resource. A property can be overridden by a system property with the
 * same name, or by an environment variable named by the upper-cased key
 * with dots replaced by underscores.
 */
public final class Config {
    private Config() {}

    private static final Properties DEFAULTS = load("/reglex.properties");

    private static Properties load(String resource) {
        Properties props = new Properties();
        try (InputStream ins = Config.class.getResourceAsStream(resource)) {
            if (ins != null)
                props.load(ins);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return props;
    }

    static String envName(String key) {
        return key.toUpperCase().replace('.', '_');
    }

    public static Optional<String> get(String key) {
        String value = System.getProperty(key);
        if (value == null)
            value = System.getenv(envName(key));
        if (value == null)
            value = DEFAULTS.getProperty(key);
        return Optional.ofNullable(value).filter(s -> !s.isEmpty());
    }

    public static String get(String key, String deflt) {
        return get(key).orElse(deflt);
    }

    public static Supplier<String> property(String key, String deflt) {
        return () -> get(key, deflt);
    }

    /**
     * The version of the tool.
     */
    public static final Supplier<String> VERSION = property("reglex.version", "unknown");

    /**
     * The name of the generated class if it is not derived from the
     * output file name.
     */
    public static final Supplier<String> CLASS_NAME = property("reglex.class.name", "Lexer");

    /**
     * The package of the generated class, empty for the unnamed package.
     */
    public static final Supplier<String> PACKAGE = property("reglex.package", "");

    /**
     * The display name of the standard input.
     */
    public static final Supplier<String> INPUT_NAME = property("reglex.input.name", "<stdin>");
}
