/*
 * HuffmanTreeBuilder.java
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

import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.huffman.InvalidInputException;

/**
 * Builds an optimal Huffman code tree from a frequency table.
 *
 * <p>One leaf per distinct symbol is placed in a priority queue. The two
 * lowest-frequency nodes are repeatedly removed and replaced by an
 * internal node over them until a single root remains.
 *
 * <h4>Tie-breaking</h4>
 * <p>Nodes are ordered by frequency, then by creation sequence. Leaves
 * are created first, in ascending symbol order, and each merged node is
 * numbered after every node created before it. The first node removed in
 * a merge becomes the left child and the second the right child. The
 * resulting tree is therefore a function of the frequency table alone.
 *
 * <p>A table with a single symbol yields a tree consisting of one leaf.
 * The builder is stateless and may be shared between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HuffmanTreeBuilder {

    private static final Logger LOGGER = Logger.getLogger(HuffmanTreeBuilder.class.getName());

    // Queue entry: a node and its creation sequence for tie-breaking.
    private static class Entry {

        final HuffmanNode node;
        final int sequence;

        Entry(HuffmanNode node, int sequence) {
            this.node = node;
            this.sequence = sequence;
        }
    }

    private static final Comparator<Entry> ORDER = new Comparator<Entry>() {
        @Override
        public int compare(Entry a, Entry b) {
            int c = Long.compare(a.node.getFrequency(), b.node.getFrequency());
            if (c != 0) {
                return c;
            }
            return Integer.compare(a.sequence, b.sequence);
        }
    };

    /**
     * Creates a new tree builder.
     */
    public HuffmanTreeBuilder() {
    }

    /**
     * Builds the code tree for the given frequencies.
     *
     * @param table the symbol frequencies
     * @return the root of the tree
     * @throws InvalidInputException if the table is empty
     */
    public HuffmanNode build(FrequencyTable table) throws InvalidInputException {
        if (table.isEmpty()) {
            throw new InvalidInputException(FrequencyTable.L10N.getString("err.empty_table"));
        }
        int[] symbols = table.symbols();
        if (symbols.length == 1) {
            int symbol = symbols[0];
            return HuffmanNode.leaf(symbol, table.getCount(symbol));
        }

        PriorityQueue<Entry> queue = new PriorityQueue<Entry>(symbols.length, ORDER);
        int sequence = 0;
        for (int i = 0; i < symbols.length; i++) {
            HuffmanNode leaf = HuffmanNode.leaf(symbols[i], table.getCount(symbols[i]));
            queue.add(new Entry(leaf, sequence++));
        }

        while (queue.size() > 1) {
            Entry left = queue.poll();
            Entry right = queue.poll();
            HuffmanNode parent = HuffmanNode.internal(left.node, right.node);
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest("Merged " + left.node + " and " + right.node + " into " + parent);
            }
            queue.add(new Entry(parent, sequence++));
        }

        HuffmanNode root = queue.poll().node;
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Built tree over " + symbols.length + " symbols, frequency " + root.getFrequency());
        }
        return root;
    }

}
