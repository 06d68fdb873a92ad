/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.automaton;

import java.util.Arrays;

/**
 * Encapsulate a DFA transition table. Rows are states and columns are
 * alphabet characters or character classes.
 */
final class TransitionTable {
    static final int FAIL = -1;     /* Marks failure states in the table */

    private int[]     table;        /* The transition table                  */
    private final int ncols;        /* number of columns in transition table */
    private int       nrows;        /* number of rows in transition table    */

    TransitionTable(int ncols, int nrows) {
        this.table = new int[Math.max(nrows, 1) * ncols];
        this.ncols = ncols;
        Arrays.fill(table, FAIL);
    }

    TransitionTable(int ncols) {
        this(ncols, 16);
    }

    int columns() {
        return ncols;
    }

    int rows() {
        return nrows;
    }

    /**
     * Get transition from current state and input.
     */
    int get(int row, int col) {
        return table[row * ncols + col];
    }

    /**
     * Add a transition.
     */
    void set(int row, int col, int val) {
        ensureCapacity(row + 1);
        table[row * ncols + col] = val;
    }

    private void ensureCapacity(int rows) {
        int minCapacity = rows * ncols;
        if (minCapacity > table.length) {
            int oldCapacity = table.length;
            int newCapacity = oldCapacity * 2;
            if (newCapacity < minCapacity)
                newCapacity = minCapacity;
            table = Arrays.copyOf(table, newCapacity);
            Arrays.fill(table, oldCapacity, newCapacity, FAIL);
        }
        if (rows > nrows)
            nrows = rows;
    }

    /**
     * Returns true if the two columns are equivalent, else return false.
     */
    boolean colEquiv(int col1, int col2) {
        int[] tab = table;
        int n = nrows;
        while (--n >= 0 && tab[col1] == tab[col2]) {
            col1 += ncols;
            col2 += ncols;
        }
        return n < 0;
    }

    /**
     * Compute a column map where equivalent columns share the same class
     * number. Class numbers are assigned in order of the first column of
     * each class. Returns the number of classes, the map is filled in.
     */
    int classify(int[] colMap) {
        int nclasses = 0;

        Arrays.fill(colMap, -1);
        for (int i = 0; i < ncols; i++) {
            if (colMap[i] != -1)
                continue;

            colMap[i] = nclasses;
            for (int j = i; ++j < ncols; ) {
                if (colMap[j] == -1 && colEquiv(i, j))
                    colMap[j] = nclasses;
            }
            nclasses++;
        }
        return nclasses;
    }

    /**
     * Build a compressed table that keeps one column for each class.
     */
    TransitionTable squash(int[] colMap, int nclasses) {
        TransitionTable compressed = new TransitionTable(nclasses, nrows);
        for (int col = 0; col < ncols; col++) {
            for (int row = 0; row < nrows; row++) {
                compressed.set(row, colMap[col], get(row, col));
            }
        }
        return compressed;
    }
}
