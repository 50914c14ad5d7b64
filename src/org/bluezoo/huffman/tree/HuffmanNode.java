/*
 * HuffmanNode.java
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

/**
 * A node of a Huffman code tree.
 *
 * <p>A node is either a {@link Leaf}, carrying one symbol and its
 * frequency, or an {@link Internal} node with exactly two children whose
 * frequency is the sum of theirs. There are no other kinds of node, and
 * the constructors are not accessible outside this class, so a tree is
 * always a strict binary tree. Nodes are immutable; each internal node
 * owns its two subtrees.
 *
 * <p>Equality is structural: two trees are equal when they have the same
 * shape, the same symbols at the same leaves and the same frequencies.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class HuffmanNode {

    private final long frequency;

    private HuffmanNode(long frequency) {
        this.frequency = frequency;
    }

    /**
     * Creates a leaf node.
     *
     * @param symbol the symbol value (0-255)
     * @param frequency the number of occurrences of the symbol
     * @return the leaf
     */
    public static Leaf leaf(int symbol, long frequency) {
        return new Leaf(symbol, frequency);
    }

    /**
     * Creates an internal node over two subtrees.
     * Its frequency is the sum of the children's frequencies.
     *
     * @param left the subtree reached by a left bit
     * @param right the subtree reached by a right bit
     * @return the internal node
     * @throws ArithmeticException if the sum overflows a long
     */
    public static Internal internal(HuffmanNode left, HuffmanNode right) {
        return new Internal(left, right);
    }

    /**
     * Returns the frequency of this node.
     * For a leaf this is the count of its symbol, for an internal node the
     * total count of all symbols below it.
     *
     * @return the frequency
     */
    public final long getFrequency() {
        return frequency;
    }

    /**
     * Indicates whether this node is a leaf.
     *
     * @return true for a leaf, false for an internal node
     */
    public abstract boolean isLeaf();

    static String symbolToString(int symbol) {
        if (symbol >= 0x20 && symbol < 0x7f) {
            return "'" + (char) symbol + "'";
        }
        return String.format("0x%02x", symbol);
    }

    /**
     * A node carrying a symbol.
     */
    public static final class Leaf extends HuffmanNode {

        private final int symbol;

        Leaf(int symbol, long frequency) {
            super(frequency);
            FrequencyTable.checkSymbol(symbol);
            if (frequency < 0L) {
                throw new IllegalArgumentException("frequency: " + frequency);
            }
            this.symbol = symbol;
        }

        /**
         * Returns the symbol of this leaf.
         *
         * @return the symbol value (0-255)
         */
        public int getSymbol() {
            return symbol;
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Leaf)) {
                return false;
            }
            Leaf o = (Leaf) other;
            return symbol == o.symbol && getFrequency() == o.getFrequency();
        }

        @Override
        public int hashCode() {
            return symbol * 31 + Long.hashCode(getFrequency());
        }

        @Override
        public String toString() {
            return "Leaf(" + symbolToString(symbol) + ": " + getFrequency() + ")";
        }

    }

    /**
     * A node with two children.
     */
    public static final class Internal extends HuffmanNode {

        private final HuffmanNode left;
        private final HuffmanNode right;

        Internal(HuffmanNode left, HuffmanNode right) {
            super(Math.addExact(left.getFrequency(), right.getFrequency()));
            this.left = left;
            this.right = right;
        }

        /**
         * Returns the child reached by a left bit.
         *
         * @return the left child, never null
         */
        public HuffmanNode getLeft() {
            return left;
        }

        /**
         * Returns the child reached by a right bit.
         *
         * @return the right child, never null
         */
        public HuffmanNode getRight() {
            return right;
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Internal)) {
                return false;
            }
            Internal o = (Internal) other;
            return getFrequency() == o.getFrequency()
                    && left.equals(o.left)
                    && right.equals(o.right);
        }

        @Override
        public int hashCode() {
            return (left.hashCode() * 31 + right.hashCode()) * 31 + Long.hashCode(getFrequency());
        }

        @Override
        public String toString() {
            return "Internal(" + getFrequency() + ")";
        }

    }

}
