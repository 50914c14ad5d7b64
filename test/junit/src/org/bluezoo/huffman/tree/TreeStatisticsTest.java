package org.bluezoo.huffman.tree;

import org.bluezoo.huffman.InvalidInputException;
import org.junit.Test;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class TreeStatisticsTest {

    private static TreeStatistics stats(String s) throws InvalidInputException {
        HuffmanNode root = new HuffmanTreeBuilder().build(
                FrequencyTable.count(s.getBytes(StandardCharsets.US_ASCII)));
        return TreeStatistics.of(root, Codebook.from(root));
    }

    @Test
    public void testEmpty() {
        assertEquals(0, TreeStatistics.EMPTY.getHeight());
        assertEquals(0, TreeStatistics.EMPTY.getLeafCount());
        assertEquals(0, TreeStatistics.EMPTY.getInternalNodeCount());
        assertEquals(0.0, TreeStatistics.EMPTY.getAverageCodeLength(), 0.0);
        assertEquals(0.0, TreeStatistics.EMPTY.getWeightedCodeLength(), 0.0);
    }

    @Test
    public void testSingleLeaf() throws InvalidInputException {
        TreeStatistics stats = stats("AAAA");
        assertEquals(0, stats.getHeight());
        assertEquals(1, stats.getLeafCount());
        assertEquals(0, stats.getInternalNodeCount());
        // The lone symbol still costs one bit
        assertEquals(1.0, stats.getAverageCodeLength(), 1e-12);
        assertEquals(1.0, stats.getWeightedCodeLength(), 1e-12);
    }

    @Test
    public void testThreeSymbols() throws InvalidInputException {
        TreeStatistics stats = stats("AABC");
        assertEquals(2, stats.getHeight());
        assertEquals(3, stats.getLeafCount());
        assertEquals(2, stats.getInternalNodeCount());
        assertEquals(5.0 / 3.0, stats.getAverageCodeLength(), 1e-12);
        assertEquals(1.5, stats.getWeightedCodeLength(), 1e-12);
    }

    @Test
    public void testInternalNodesOneFewerThanLeaves() throws InvalidInputException {
        TreeStatistics stats = stats("the quick brown fox jumps over the lazy dog");
        assertEquals(stats.getLeafCount() - 1, stats.getInternalNodeCount());
        assertTrue(stats.getHeight() >= 5);
    }

}
