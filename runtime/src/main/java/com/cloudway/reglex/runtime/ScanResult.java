/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

/**
 * The outcome of one token scan.
 */
public enum ScanResult {
    /**
     * A token was completed and its action performed. More input may follow.
     */
    TOKEN,

    /**
     * The input is exhausted and no characters are pending.
     */
    END,

    /**
     * No pattern matches the pending input at the current position.
     */
    STUCK
}
