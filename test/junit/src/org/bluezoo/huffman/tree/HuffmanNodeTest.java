package org.bluezoo.huffman.tree;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link HuffmanNode}.
 */
public class HuffmanNodeTest {

    @Test
    public void testLeaf() {
        HuffmanNode.Leaf leaf = HuffmanNode.leaf('A', 5L);
        assertTrue(leaf.isLeaf());
        assertEquals('A', leaf.getSymbol());
        assertEquals(5L, leaf.getFrequency());
    }

    @Test
    public void testInternalFrequencyIsSumOfChildren() {
        HuffmanNode a = HuffmanNode.leaf('A', 3L);
        HuffmanNode b = HuffmanNode.leaf('B', 2L);
        HuffmanNode.Internal node = HuffmanNode.internal(a, b);
        assertFalse(node.isLeaf());
        assertEquals(5L, node.getFrequency());
        assertSame(a, node.getLeft());
        assertSame(b, node.getRight());
    }

    @Test(expected = NullPointerException.class)
    public void testInternalRequiresChildren() {
        HuffmanNode.internal(HuffmanNode.leaf('A', 1L), null);
    }

    @Test(expected = ArithmeticException.class)
    public void testInternalFrequencyOverflow() {
        HuffmanNode.internal(HuffmanNode.leaf('A', Long.MAX_VALUE), HuffmanNode.leaf('B', 1L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLeafSymbolRange() {
        HuffmanNode.leaf(300, 1L);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLeafNegativeFrequency() {
        HuffmanNode.leaf('A', -1L);
    }

    @Test
    public void testStructuralEquality() {
        HuffmanNode t1 = HuffmanNode.internal(HuffmanNode.leaf('A', 1L), HuffmanNode.leaf('B', 2L));
        HuffmanNode t2 = HuffmanNode.internal(HuffmanNode.leaf('A', 1L), HuffmanNode.leaf('B', 2L));
        HuffmanNode t3 = HuffmanNode.internal(HuffmanNode.leaf('B', 2L), HuffmanNode.leaf('A', 1L));
        assertEquals(t1, t2);
        assertEquals(t1.hashCode(), t2.hashCode());
        assertNotEquals(t1, t3);
        assertNotEquals(HuffmanNode.leaf('A', 1L), HuffmanNode.leaf('A', 2L));
        assertNotEquals(t1, HuffmanNode.leaf('A', 3L));
    }

    @Test
    public void testToString() {
        assertEquals("Leaf('A': 5)", HuffmanNode.leaf('A', 5L).toString());
        assertEquals("Leaf(0x00: 1)", HuffmanNode.leaf(0, 1L).toString());
        HuffmanNode node = HuffmanNode.internal(HuffmanNode.leaf('A', 1L), HuffmanNode.leaf('B', 2L));
        assertEquals("Internal(3)", node.toString());
    }

}
