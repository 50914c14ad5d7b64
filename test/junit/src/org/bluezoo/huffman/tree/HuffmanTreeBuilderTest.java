/*
 * HuffmanTreeBuilderTest.java
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

import org.bluezoo.huffman.InvalidInputException;
import org.junit.Before;
import org.junit.Test;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link HuffmanTreeBuilder}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HuffmanTreeBuilderTest {

    private HuffmanTreeBuilder builder;

    @Before
    public void setUp() {
        builder = new HuffmanTreeBuilder();
    }

    private HuffmanNode build(String s) throws InvalidInputException {
        return builder.build(FrequencyTable.count(s.getBytes(StandardCharsets.US_ASCII)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Degenerate tables
    // ─────────────────────────────────────────────────────────────────────────

    @Test(expected = InvalidInputException.class)
    public void testEmptyTable() throws InvalidInputException {
        builder.build(FrequencyTable.count(new byte[0]));
    }

    @Test
    public void testSingleSymbol() throws InvalidInputException {
        HuffmanNode root = build("AAAA");
        assertTrue(root.isLeaf());
        assertEquals('A', ((HuffmanNode.Leaf) root).getSymbol());
        assertEquals(4L, root.getFrequency());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Tree shape and tie-breaking
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testTwoSymbolsLowestFrequencyOnLeft() throws InvalidInputException {
        HuffmanNode root = build("AAAAAAAB");
        HuffmanNode expected = HuffmanNode.internal(HuffmanNode.leaf('B', 1L), HuffmanNode.leaf('A', 7L));
        assertEquals(expected, root);
    }

    @Test
    public void testEqualFrequenciesLowerSymbolOnLeft() throws InvalidInputException {
        HuffmanNode root = build("BA");
        HuffmanNode expected = HuffmanNode.internal(HuffmanNode.leaf('A', 1L), HuffmanNode.leaf('B', 1L));
        assertEquals(expected, root);
    }

    @Test
    public void testLeafBeforeMergedNodeOnTie() throws InvalidInputException {
        // B and C merge into a node of frequency 2, which ties with A;
        // A was created first so it is taken first and becomes the left child.
        HuffmanNode root = build("AABC");
        HuffmanNode expected = HuffmanNode.internal(
                HuffmanNode.leaf('A', 2L),
                HuffmanNode.internal(HuffmanNode.leaf('B', 1L), HuffmanNode.leaf('C', 1L)));
        assertEquals(expected, root);
    }

    @Test
    public void testBalancedTreeForUniformFrequencies() throws InvalidInputException {
        HuffmanNode root = build("ABCDEFGH");
        HuffmanNode ab = HuffmanNode.internal(HuffmanNode.leaf('A', 1L), HuffmanNode.leaf('B', 1L));
        HuffmanNode cd = HuffmanNode.internal(HuffmanNode.leaf('C', 1L), HuffmanNode.leaf('D', 1L));
        HuffmanNode ef = HuffmanNode.internal(HuffmanNode.leaf('E', 1L), HuffmanNode.leaf('F', 1L));
        HuffmanNode gh = HuffmanNode.internal(HuffmanNode.leaf('G', 1L), HuffmanNode.leaf('H', 1L));
        HuffmanNode expected = HuffmanNode.internal(HuffmanNode.internal(ab, cd), HuffmanNode.internal(ef, gh));
        assertEquals(expected, root);
    }

    @Test
    public void testDeterministic() throws InvalidInputException {
        Random random = new Random(42L);
        for (int round = 0; round < 20; round++) {
            long[] counts = new long[256];
            for (int i = 0; i < counts.length; i++) {
                // Small range so that ties are common
                counts[i] = random.nextInt(4);
            }
            if (FrequencyTable.of(counts).isEmpty()) {
                continue;
            }
            HuffmanNode first = builder.build(FrequencyTable.of(counts));
            HuffmanNode second = new HuffmanTreeBuilder().build(FrequencyTable.of(counts));
            assertEquals(first, second);
        }
    }

    @Test
    public void testSkewedFrequenciesBuildChain() throws InvalidInputException {
        long[] counts = new long[12];
        counts[0] = 1L;
        for (int i = 1; i < counts.length; i++) {
            counts[i] = 1L << (i - 1);
        }
        HuffmanNode root = builder.build(FrequencyTable.of(counts));
        TreeStatistics stats = TreeStatistics.of(root, Codebook.from(root));
        assertEquals(11, stats.getHeight());
        assertEquals(12, stats.getLeafCount());
        assertEquals(11, stats.getInternalNodeCount());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Invariants
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testFrequencyInvariant() throws InvalidInputException {
        Random random = new Random(7L);
        for (int round = 0; round < 50; round++) {
            long[] counts = randomCounts(random, 1 + random.nextInt(256), 1000);
            FrequencyTable table = FrequencyTable.of(counts);
            HuffmanNode root = builder.build(table);
            assertEquals(table.getTotal(), root.getFrequency());
            boolean[] seen = new boolean[256];
            checkFrequencies(root, table, seen);
            for (int s = 0; s < 256; s++) {
                assertEquals("leaf for symbol " + s, table.contains(s), seen[s]);
            }
        }
    }

    private static void checkFrequencies(HuffmanNode node, FrequencyTable table, boolean[] seen) {
        if (node.isLeaf()) {
            int symbol = ((HuffmanNode.Leaf) node).getSymbol();
            assertFalse("duplicate leaf " + symbol, seen[symbol]);
            seen[symbol] = true;
            assertEquals(table.getCount(symbol), node.getFrequency());
            return;
        }
        HuffmanNode.Internal internal = (HuffmanNode.Internal) node;
        assertEquals(internal.getLeft().getFrequency() + internal.getRight().getFrequency(),
                internal.getFrequency());
        checkFrequencies(internal.getLeft(), table, seen);
        checkFrequencies(internal.getRight(), table, seen);
    }

    /**
     * The encoded length of a Huffman code is minimal: compare it with the
     * best of every length assignment that satisfies the Kraft inequality.
     */
    @Test
    public void testOptimalAgainstExhaustiveSearch() throws InvalidInputException {
        Random random = new Random(2025L);
        for (int round = 0; round < 40; round++) {
            int k = 2 + random.nextInt(5); // 2..6 symbols
            long[] counts = new long[k];
            for (int i = 0; i < k; i++) {
                counts[i] = 1 + random.nextInt(50);
            }
            FrequencyTable table = FrequencyTable.of(counts);
            HuffmanNode root = builder.build(table);
            long huffman = Codebook.from(root).getEncodedLength(table);
            assertEquals("counts " + java.util.Arrays.toString(counts),
                    bestPrefixCodeLength(counts), huffman);
        }
    }

    @Test
    public void testEncodedLengthEqualsSumOfInternalWeights() throws InvalidInputException {
        Random random = new Random(99L);
        for (int round = 0; round < 30; round++) {
            FrequencyTable table = FrequencyTable.of(randomCounts(random, 2 + random.nextInt(200), 500));
            if (table.getDistinctSymbols() < 2) {
                continue;
            }
            HuffmanNode root = builder.build(table);
            assertEquals(internalWeight(root), Codebook.from(root).getEncodedLength(table));
        }
    }

    private static long internalWeight(HuffmanNode node) {
        if (node.isLeaf()) {
            return 0L;
        }
        HuffmanNode.Internal internal = (HuffmanNode.Internal) node;
        return node.getFrequency() + internalWeight(internal.getLeft()) + internalWeight(internal.getRight());
    }

    private static long[] randomCounts(Random random, int symbols, int max) {
        long[] counts = new long[256];
        for (int i = 0; i < symbols; i++) {
            counts[random.nextInt(256)] = 1 + random.nextInt(max);
        }
        return counts;
    }

    // Minimum total length over all code length vectors with lengths in
    // 1..k-1 satisfying sum(2^-l) <= 1.
    private static long bestPrefixCodeLength(long[] counts) {
        int k = counts.length;
        int maxLength = k - 1;
        int[] lengths = new int[k];
        java.util.Arrays.fill(lengths, 1);
        long best = Long.MAX_VALUE;
        while (true) {
            long kraft = 0L;
            long cost = 0L;
            for (int i = 0; i < k; i++) {
                kraft += 1L << (maxLength - lengths[i]);
                cost += counts[i] * lengths[i];
            }
            if (kraft <= (1L << maxLength) && cost < best) {
                best = cost;
            }
            int i = 0;
            while (i < k && lengths[i] == maxLength) {
                lengths[i] = 1;
                i++;
            }
            if (i == k) {
                return best;
            }
            lengths[i]++;
        }
    }

}
