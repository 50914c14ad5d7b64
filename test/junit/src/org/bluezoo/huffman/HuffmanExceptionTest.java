package org.bluezoo.huffman;

import org.junit.Test;
import java.io.IOException;

import static org.junit.Assert.*;

public class HuffmanExceptionTest {

    @Test
    public void testMessageAndCause() {
        IOException cause = new IOException("underlying");
        HuffmanException e = new HuffmanException("failed", cause);
        assertEquals("failed", e.getMessage());
        assertSame(cause, e.getCause());
        assertNull(new HuffmanException("failed").getCause());
    }

    @Test
    public void testSubclasses() {
        assertTrue(new InvalidInputException("empty") instanceof HuffmanException);
        assertTrue(new MalformedPayloadException("bad") instanceof HuffmanException);
        UnsupportedSymbolException e = new UnsupportedSymbolException("no code", 0xfe);
        assertTrue(e instanceof HuffmanException);
        assertEquals(0xfe, e.getSymbol());
    }

    @Test
    public void testSubclassCause() {
        RuntimeException cause = new RuntimeException();
        assertSame(cause, new MalformedPayloadException("bad", cause).getCause());
        assertSame(cause, new InvalidInputException("empty", cause).getCause());
    }

}
