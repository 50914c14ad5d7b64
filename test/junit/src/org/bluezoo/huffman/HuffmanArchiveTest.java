/*
 * HuffmanArchiveTest.java
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

package org.bluezoo.huffman;

import org.bluezoo.huffman.bits.CompressedPayload;
import org.bluezoo.huffman.tree.SerializedTree;
import org.junit.Before;
import org.junit.Test;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link HuffmanArchive}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HuffmanArchiveTest {

    private HuffmanCompressor compressor;

    @Before
    public void setUp() {
        compressor = new HuffmanCompressor();
    }

    @Test
    public void testLayout() throws HuffmanException {
        byte[] archive = HuffmanArchive.write(compressor.compress("AABC"));
        assertEquals(21 + 8 + 1, archive.length);
        ByteBuffer buf = ByteBuffer.wrap(archive);
        assertEquals('H', buf.get());
        assertEquals('U', buf.get());
        assertEquals('F', buf.get());
        assertEquals(HuffmanArchive.VERSION, buf.get());
        assertEquals(4L, buf.getLong());
        assertEquals(6, buf.get());
        assertEquals(8, buf.getInt());
        buf.position(buf.position() + 8);
        assertEquals(1, buf.getInt());
        assertEquals(0x2c, buf.get());
        assertFalse(buf.hasRemaining());
    }

    @Test
    public void testReadBack() throws HuffmanException {
        CompressionResult result = compressor.compress("the rain in spain");
        HuffmanArchive archive = HuffmanArchive.read(HuffmanArchive.write(result));
        assertEquals(result.getPayload(), archive.getPayload());
        assertEquals(result.getSerializedTree(), archive.getTree());
        byte[] data = HuffmanArchive.decompress(HuffmanArchive.write(result), compressor);
        assertEquals("the rain in spain", new String(data, StandardCharsets.UTF_8));
    }

    @Test
    public void testEmpty() throws HuffmanException {
        byte[] bytes = HuffmanArchive.write(compressor.compress(new byte[0]));
        assertEquals(21, bytes.length);
        HuffmanArchive archive = HuffmanArchive.read(bytes);
        assertTrue(archive.getPayload().isEmpty());
        assertTrue(archive.getTree().isEmpty());
        assertEquals(0, HuffmanArchive.decompress(bytes, compressor).length);
    }

    @Test
    public void testBadMagic() throws HuffmanException {
        byte[] bytes = HuffmanArchive.write(compressor.compress("AABC"));
        bytes[0] = 'X';
        try {
            HuffmanArchive.read(bytes);
            fail("Expected MalformedPayloadException");
        } catch (MalformedPayloadException e) {
            assertEquals("Not a Huffman archive", e.getMessage());
        }
    }

    @Test(expected = MalformedPayloadException.class)
    public void testUnsupportedVersion() throws HuffmanException {
        byte[] bytes = HuffmanArchive.write(compressor.compress("AABC"));
        bytes[3] = 2;
        HuffmanArchive.read(bytes);
    }

    @Test
    public void testTruncated() throws HuffmanException {
        byte[] bytes = HuffmanArchive.write(compressor.compress("AABC"));
        for (int length = 0; length < bytes.length; length++) {
            try {
                HuffmanArchive.read(Arrays.copyOf(bytes, length));
                fail("Expected MalformedPayloadException for length " + length);
            } catch (MalformedPayloadException e) {
                // expected
            }
        }
    }

    @Test(expected = MalformedPayloadException.class)
    public void testTrailingBytes() throws HuffmanException {
        byte[] bytes = HuffmanArchive.write(compressor.compress("AABC"));
        HuffmanArchive.read(Arrays.copyOf(bytes, bytes.length + 1));
    }

    @Test(expected = MalformedPayloadException.class)
    public void testNegativeBlockLength() throws HuffmanException {
        byte[] bytes = HuffmanArchive.write(CompressedPayload.EMPTY, SerializedTree.EMPTY);
        ByteBuffer.wrap(bytes).putInt(13, -1);
        HuffmanArchive.read(bytes);
    }

    @Test
    public void testTruncatedCause() throws HuffmanException {
        try {
            HuffmanArchive.read(new byte[] { 'H', 'U', 'F', 1, 0 });
            fail("Expected MalformedPayloadException");
        } catch (MalformedPayloadException e) {
            assertNotNull(e.getCause());
        }
    }

}
