/*
 * FrequencyTable.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of huffman, a Huffman entropy coding library.
 *
 * huffman is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * huffman is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with huffman.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.huffman.tree;

import java.text.MessageFormat;
import java.util.Arrays;
import java.util.ResourceBundle;

import org.bluezoo.huffman.HuffmanConstants;

/**
 * Number of occurrences of each byte value in an input.
 *
 * <p>A table is built once per input and is immutable afterwards. Only
 * symbols that occur at least once are considered part of the table:
 * {@link #getDistinctSymbols()} counts them and {@link #symbols()}
 * lists them in ascending order. An empty input gives an empty table,
 * which {@link #isEmpty()} reports.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FrequencyTable {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.huffman.tree.L10N");

    private static final double LN_2 = Math.log(2.0);

    private final long[] counts;
    private final int distinct;
    private final long total;

    private FrequencyTable(long[] counts) {
        this.counts = counts;
        int d = 0;
        long t = 0L;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0L) {
                d++;
                t += counts[i];
            }
        }
        this.distinct = d;
        this.total = t;
    }

    /**
     * Counts the symbols of the given data.
     *
     * @param data the input bytes
     * @return the frequency table
     */
    public static FrequencyTable count(byte[] data) {
        return count(data, 0, data.length);
    }

    /**
     * Counts the symbols of a region of the given data.
     *
     * @param data the input bytes
     * @param off the offset of the first byte to count
     * @param len the number of bytes to count
     * @return the frequency table
     */
    public static FrequencyTable count(byte[] data, int off, int len) {
        if (off < 0 || len < 0 || len > data.length - off) {
            throw new IndexOutOfBoundsException();
        }
        long[] counts = new long[HuffmanConstants.ALPHABET_SIZE];
        int end = off + len;
        for (int i = off; i < end; i++) {
            counts[data[i] & 0xff]++;
        }
        return new FrequencyTable(counts);
    }

    /**
     * Creates a table from explicit counts indexed by symbol value.
     * This is used to rebuild the tree of an input from its transmitted
     * counts instead of its serialized structure.
     *
     * @param counts up to 256 non-negative counts
     * @return the frequency table
     * @throws IllegalArgumentException if there are too many counts, a
     * count is negative, or the counts sum to more than a long holds
     */
    public static FrequencyTable of(long[] counts) {
        if (counts.length > HuffmanConstants.ALPHABET_SIZE) {
            String msg = MessageFormat.format(L10N.getString("err.too_many_counts"), counts.length);
            throw new IllegalArgumentException(msg);
        }
        long[] copy = new long[HuffmanConstants.ALPHABET_SIZE];
        long total = 0L;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] < 0L) {
                String msg = MessageFormat.format(L10N.getString("err.negative_count"), i, counts[i]);
                throw new IllegalArgumentException(msg);
            }
            try {
                total = Math.addExact(total, counts[i]);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException(L10N.getString("err.total_overflow"), e);
            }
            copy[i] = counts[i];
        }
        return new FrequencyTable(copy);
    }

    /**
     * Indicates whether no symbol occurs in this table.
     *
     * @return true if the input was empty
     */
    public boolean isEmpty() {
        return distinct == 0;
    }

    /**
     * Returns the number of occurrences of the given symbol.
     *
     * @param symbol the symbol value (0-255)
     * @return the count, 0 if the symbol does not occur
     */
    public long getCount(int symbol) {
        checkSymbol(symbol);
        return counts[symbol];
    }

    /**
     * Indicates whether the given symbol occurs at least once.
     *
     * @param symbol the symbol value (0-255)
     * @return true if the symbol has an entry
     */
    public boolean contains(int symbol) {
        checkSymbol(symbol);
        return counts[symbol] > 0L;
    }

    /**
     * Returns the number of distinct symbols.
     *
     * @return the number of entries
     */
    public int getDistinctSymbols() {
        return distinct;
    }

    /**
     * Returns the total number of symbols counted.
     *
     * @return the sum of all counts
     */
    public long getTotal() {
        return total;
    }

    /**
     * Returns the symbols that occur, in ascending order.
     *
     * @return the symbol values
     */
    public int[] symbols() {
        int[] symbols = new int[distinct];
        int j = 0;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0L) {
                symbols[j++] = i;
            }
        }
        return symbols;
    }

    /**
     * Returns the Shannon entropy of the distribution in bits per symbol.
     * This is the lower bound of the average code length of any prefix
     * code for the counted data.
     *
     * @return the entropy, 0 for an empty or single-symbol table
     */
    public double entropy() {
        if (total == 0L) {
            return 0.0;
        }
        double entropy = 0.0;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0L) {
                double p = (double) counts[i] / (double) total;
                entropy -= p * Math.log(p) / LN_2;
            }
        }
        // A single symbol computes as -0.0
        return entropy <= 0.0 ? 0.0 : entropy;
    }

    static void checkSymbol(int symbol) {
        if (symbol < 0 || symbol >= HuffmanConstants.ALPHABET_SIZE) {
            String msg = MessageFormat.format(L10N.getString("err.symbol_range"), symbol);
            throw new IllegalArgumentException(msg);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FrequencyTable)) {
            return false;
        }
        return Arrays.equals(counts, ((FrequencyTable) other).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("FrequencyTable{");
        boolean first = true;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0L) {
                if (!first) {
                    buf.append(", ");
                }
                buf.append(HuffmanNode.symbolToString(i));
                buf.append('=');
                buf.append(counts[i]);
                first = false;
            }
        }
        buf.append('}');
        return buf.toString();
    }

}
