/*
 * Codebook.java
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
import java.util.BitSet;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.bluezoo.huffman.HuffmanConstants;

/**
 * Mapping from each symbol of a tree to its code.
 *
 * <p>Codes are derived by a depth-first walk from the root, appending
 * {@link HuffmanConstants#LEFT_BIT} for each left edge and
 * {@link HuffmanConstants#RIGHT_BIT} for each right edge, and recording
 * the accumulated bits at each leaf. Internal nodes never receive a code,
 * so the codes of a strict binary tree always form a prefix code.
 *
 * <p>The only symbol of a single-leaf tree gets the one-bit code
 * {@link HuffmanConstants#SINGLE_SYMBOL_BIT}.
 *
 * <p>A codebook is specific to the tree, and so to the input, it was
 * derived from.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Codebook {

    /** Codebook of the empty input: it has no codes. */
    public static final Codebook EMPTY = new Codebook(new Code[HuffmanConstants.ALPHABET_SIZE], 0);

    private final Code[] codes;
    private final int size;

    private Codebook(Code[] codes, int size) {
        this.codes = codes;
        this.size = size;
    }

    /**
     * Derives the codebook of a tree.
     *
     * @param root the root of the tree
     * @return the codebook
     * @throws IllegalArgumentException if a symbol appears at more than
     * one leaf
     */
    public static Codebook from(HuffmanNode root) {
        Code[] codes = new Code[HuffmanConstants.ALPHABET_SIZE];
        if (root.isLeaf()) {
            BitSet bits = new BitSet(1);
            if (HuffmanConstants.SINGLE_SYMBOL_BIT == 1) {
                bits.set(0);
            }
            codes[((HuffmanNode.Leaf) root).getSymbol()] = new Code(bits, 1);
            return new Codebook(codes, 1);
        }
        int size = walk(root, new BitSet(), 0, codes);
        return new Codebook(codes, size);
    }

    // Depth-first walk recording the path to each leaf. Returns the number
    // of leaves below node.
    private static int walk(HuffmanNode node, BitSet path, int depth, Code[] codes) {
        if (node.isLeaf()) {
            int symbol = ((HuffmanNode.Leaf) node).getSymbol();
            if (codes[symbol] != null) {
                String msg = MessageFormat.format(FrequencyTable.L10N.getString("err.duplicate_leaf"),
                        HuffmanNode.symbolToString(symbol));
                throw new IllegalArgumentException(msg);
            }
            codes[symbol] = new Code((BitSet) path.clone(), depth);
            return 1;
        }
        HuffmanNode.Internal internal = (HuffmanNode.Internal) node;
        path.set(depth, HuffmanConstants.LEFT_BIT == 1);
        int count = walk(internal.getLeft(), path, depth + 1, codes);
        path.set(depth, HuffmanConstants.RIGHT_BIT == 1);
        count += walk(internal.getRight(), path, depth + 1, codes);
        path.clear(depth);
        return count;
    }

    /**
     * Returns the code of the given symbol.
     *
     * @param symbol the symbol value (0-255)
     * @return the code, or null if the symbol has none
     */
    public Code getCode(int symbol) {
        FrequencyTable.checkSymbol(symbol);
        return codes[symbol];
    }

    /**
     * Indicates whether the given symbol has a code.
     *
     * @param symbol the symbol value (0-255)
     * @return true if the symbol can be encoded with this codebook
     */
    public boolean contains(int symbol) {
        return getCode(symbol) != null;
    }

    /**
     * Returns the length in bits of the code of the given symbol.
     *
     * @param symbol the symbol value (0-255)
     * @return the code length, 0 if the symbol has no code
     */
    public int getCodeLength(int symbol) {
        Code code = getCode(symbol);
        return (code == null) ? 0 : code.length();
    }

    /**
     * Returns the number of symbols with a code.
     *
     * @return the number of codes
     */
    public int size() {
        return size;
    }

    /**
     * Indicates whether this codebook has no codes.
     *
     * @return true for the codebook of an empty input
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the symbols with a code, in ascending order.
     *
     * @return the symbol values
     */
    public int[] symbols() {
        int[] symbols = new int[size];
        int j = 0;
        for (int i = 0; i < codes.length; i++) {
            if (codes[i] != null) {
                symbols[j++] = i;
            }
        }
        return symbols;
    }

    /**
     * Returns the number of bits needed to encode data with the given
     * symbol counts.
     *
     * @param table the symbol counts
     * @return the total encoded length in bits
     * @throws IllegalArgumentException if a counted symbol has no code
     */
    public long getEncodedLength(FrequencyTable table) {
        long bits = 0L;
        int[] symbols = table.symbols();
        for (int i = 0; i < symbols.length; i++) {
            Code code = codes[symbols[i]];
            if (code == null) {
                throw new IllegalArgumentException("No code for " + HuffmanNode.symbolToString(symbols[i]));
            }
            bits += table.getCount(symbols[i]) * code.length();
        }
        return bits;
    }

    /**
     * Checks that no code is a prefix of the code of another symbol.
     *
     * @return true if the codes form a prefix code
     */
    public boolean isPrefixFree() {
        int[] symbols = symbols();
        for (int i = 0; i < symbols.length; i++) {
            Code a = codes[symbols[i]];
            if (a.length() == 0) {
                return false;
            }
            for (int j = 0; j < symbols.length; j++) {
                if (i != j && a.isPrefixOf(codes[symbols[j]])) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns the codes as bit strings, keyed by symbol value.
     *
     * @return an unmodifiable sorted map of symbol to code such as "010"
     */
    public Map<Integer, String> toMap() {
        Map<Integer, String> map = new TreeMap<Integer, String>();
        for (int i = 0; i < codes.length; i++) {
            if (codes[i] != null) {
                map.put(Integer.valueOf(i), codes[i].toString());
            }
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("Codebook{");
        boolean first = true;
        for (int i = 0; i < codes.length; i++) {
            if (codes[i] != null) {
                if (!first) {
                    buf.append(", ");
                }
                buf.append(HuffmanNode.symbolToString(i));
                buf.append('=');
                buf.append(codes[i]);
                first = false;
            }
        }
        buf.append('}');
        return buf.toString();
    }

    /**
     * The code of one symbol: a sequence of bits, first bit first.
     */
    public static final class Code {

        private final BitSet bits;
        private final int length;

        Code(BitSet bits, int length) {
            this.bits = bits;
            this.length = length;
        }

        /**
         * Returns the number of bits in this code.
         *
         * @return the code length
         */
        public int length() {
            return length;
        }

        /**
         * Returns the bit at the given position.
         *
         * @param index the position, 0 for the first bit
         * @return 0 or 1
         */
        public int bit(int index) {
            if (index < 0 || index >= length) {
                throw new IndexOutOfBoundsException(Integer.toString(index));
            }
            return bits.get(index) ? 1 : 0;
        }

        /**
         * Indicates whether this code is a prefix of (or equal to) another.
         *
         * @param other the other code
         * @return true if the first bits of other are this code
         */
        public boolean isPrefixOf(Code other) {
            if (length > other.length) {
                return false;
            }
            for (int i = 0; i < length; i++) {
                if (bits.get(i) != other.bits.get(i)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Code)) {
                return false;
            }
            Code o = (Code) other;
            return length == o.length && bits.equals(o.bits);
        }

        @Override
        public int hashCode() {
            return bits.hashCode() * 31 + length;
        }

        @Override
        public String toString() {
            StringBuilder buf = new StringBuilder(length);
            for (int i = 0; i < length; i++) {
                buf.append(bits.get(i) ? '1' : '0');
            }
            return buf.toString();
        }

    }

}
