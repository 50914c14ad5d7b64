/*
 * DecoderTest.java
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
import org.bluezoo.huffman.tree.FrequencyTable;
import org.bluezoo.huffman.tree.HuffmanNode;
import org.bluezoo.huffman.tree.HuffmanTreeBuilder;
import org.junit.Before;
import org.junit.Test;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link Decoder}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DecoderTest {

    private Decoder decoder;
    private HuffmanNode aabc;
    private HuffmanNode single;

    @Before
    public void setUp() throws InvalidInputException {
        decoder = new Decoder();
        HuffmanTreeBuilder builder = new HuffmanTreeBuilder();
        aabc = builder.build(FrequencyTable.count("AABC".getBytes(StandardCharsets.US_ASCII)));
        single = builder.build(FrequencyTable.count("A".getBytes(StandardCharsets.US_ASCII)));
    }

    private static String ascii(byte[] data) {
        return new String(data, StandardCharsets.US_ASCII);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Well-formed payloads
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testDecodeThreeSymbols() throws MalformedPayloadException {
        CompressedPayload payload = CompressedPayload.of(new byte[] { 0x2c }, 6, 4L);
        assertEquals("AABC", ascii(decoder.decode(payload, aabc)));
    }

    @Test
    public void testDecodeOtherOrder() throws MalformedPayloadException {
        // C A B A = 11 0 10 0
        CompressedPayload payload = CompressedPayload.of(new byte[] { (byte) 0xd0 }, 6, 4L);
        assertEquals("CABA", ascii(decoder.decode(payload, aabc)));
    }

    @Test
    public void testDecodeSingleSymbol() throws MalformedPayloadException {
        CompressedPayload payload = CompressedPayload.of(new byte[] { 0x00 }, 5, 5L);
        assertEquals("AAAAA", ascii(decoder.decode(payload, single)));
    }

    @Test
    public void testDecodeEmpty() throws MalformedPayloadException {
        assertEquals(0, decoder.decode(CompressedPayload.EMPTY, null).length);
        assertEquals(0, decoder.decode(CompressedPayload.EMPTY, aabc).length);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Malformed payloads
    // ─────────────────────────────────────────────────────────────────────────

    @Test(expected = MalformedPayloadException.class)
    public void testPayloadEndsInsideCode() throws MalformedPayloadException {
        // 00101: the final 1 is the first half of B or C
        decoder.decode(CompressedPayload.of(new byte[] { 0x2c }, 5, 4L), aabc);
    }

    @Test(expected = MalformedPayloadException.class)
    public void testOneBitForSingleSymbolTree() throws MalformedPayloadException {
        decoder.decode(CompressedPayload.of(new byte[] { (byte) 0x80 }, 1, 1L), single);
    }

    @Test(expected = MalformedPayloadException.class)
    public void testNoTree() throws MalformedPayloadException {
        decoder.decode(CompressedPayload.of(new byte[] { 0x2c }, 6, 4L), null);
    }

    @Test(expected = MalformedPayloadException.class)
    public void testSymbolsWithoutBits() throws MalformedPayloadException {
        decoder.decode(CompressedPayload.of(new byte[0], 0, 3L), aabc);
    }

    @Test(expected = MalformedPayloadException.class)
    public void testNegativeSymbolCount() throws MalformedPayloadException {
        decoder.decode(CompressedPayload.of(new byte[] { 0x2c }, 6, -1L), aabc);
    }

    @Test(expected = MalformedPayloadException.class)
    public void testMoreSymbolsThanBits() throws MalformedPayloadException {
        decoder.decode(CompressedPayload.of(new byte[] { 0x00 }, 2, 3L), single);
    }

    @Test
    public void testDecodedCountMismatch() {
        try {
            decoder.decode(CompressedPayload.of(new byte[] { 0x2c }, 6, 3L), aabc);
            fail("Expected MalformedPayloadException");
        } catch (MalformedPayloadException e) {
            assertEquals("Decoded 4 symbols but payload declares 3", e.getMessage());
        }
    }

    @Test(expected = MalformedPayloadException.class)
    public void testInvalidLastByteBits() throws MalformedPayloadException {
        decoder.decode(CompressedPayload.of(new byte[] { 0x2c }, 0, 4L), aabc);
    }

}
