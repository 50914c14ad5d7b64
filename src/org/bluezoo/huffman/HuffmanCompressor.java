/*
 * HuffmanCompressor.java
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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.huffman.bits.CompressedPayload;
import org.bluezoo.huffman.tree.Codebook;
import org.bluezoo.huffman.tree.FrequencyTable;
import org.bluezoo.huffman.tree.HuffmanNode;
import org.bluezoo.huffman.tree.HuffmanTreeBuilder;
import org.bluezoo.huffman.tree.SerializedTree;
import org.bluezoo.huffman.tree.TreeCodec;
import org.bluezoo.huffman.tree.TreeStatistics;

/**
 * Compresses and decompresses data with a Huffman code built for it.
 *
 * <p>Compression counts the input symbols, builds the code tree, derives
 * the codebook from it and encodes the input. An empty input is returned
 * at once as an empty payload with no tree. An input made of a single
 * distinct symbol is coded with one bit per occurrence.
 *
 * <p>Each call works only on values it creates itself, so an instance can
 * be shared between threads; it holds nothing but its settings, and a
 * change to a setting is seen by calls that start after it.
 *
 * <h4>Configuration</h4>
 * <p>The settings default to these system properties:
 * <ul>
 *   <li>{@code org.bluezoo.huffman.verifyCodebook} - check that each
 *       generated codebook is a prefix code</li>
 *   <li>{@code org.bluezoo.huffman.verifyRoundTrip} - decode each result
 *       and compare it with the input</li>
 *   <li>{@code org.bluezoo.huffman.maxTreeDepth} - the deepest serialized
 *       tree accepted by {@link #decompress(CompressedPayload, SerializedTree)}</li>
 * </ul>
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * HuffmanCompressor compressor = new HuffmanCompressor();
 * CompressionResult result = compressor.compress(data);
 *
 * CompressedPayload payload = result.getPayload();
 * SerializedTree tree = result.getSerializedTree();
 * // store or transmit payload and tree together
 *
 * byte[] restored = compressor.decompress(payload, tree);
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HuffmanCompressor {

    private static final Logger LOGGER = Logger.getLogger(HuffmanCompressor.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.huffman.L10N");

    private static final Charset UTF_8 = StandardCharsets.UTF_8;

    private final HuffmanTreeBuilder treeBuilder = new HuffmanTreeBuilder();
    private final Encoder encoder = new Encoder();
    private final Decoder decoder = new Decoder();
    private final TreeCodec treeCodec = new TreeCodec();

    private volatile boolean verifyCodebook;
    private volatile boolean verifyRoundTrip;

    /**
     * Creates a new compressor configured from the system properties.
     */
    public HuffmanCompressor() {
        verifyCodebook = Boolean.getBoolean(HuffmanConstants.VERIFY_CODEBOOK_PROPERTY);
        verifyRoundTrip = Boolean.getBoolean(HuffmanConstants.VERIFY_ROUND_TRIP_PROPERTY);
    }

    /**
     * Indicates whether generated codebooks are checked to be prefix codes.
     *
     * @return true if codebooks are verified
     */
    public boolean isVerifyCodebook() {
        return verifyCodebook;
    }

    /**
     * Sets whether generated codebooks are checked to be prefix codes.
     *
     * @param verifyCodebook true to verify codebooks
     */
    public void setVerifyCodebook(boolean verifyCodebook) {
        this.verifyCodebook = verifyCodebook;
    }

    /**
     * Indicates whether each result is decoded and compared with its input.
     *
     * @return true if results are verified
     */
    public boolean isVerifyRoundTrip() {
        return verifyRoundTrip;
    }

    /**
     * Sets whether each result is decoded and compared with its input.
     *
     * @param verifyRoundTrip true to verify results
     */
    public void setVerifyRoundTrip(boolean verifyRoundTrip) {
        this.verifyRoundTrip = verifyRoundTrip;
    }

    /**
     * Returns the deepest serialized tree accepted on decompression.
     *
     * @return the maximum tree depth
     */
    public int getMaxTreeDepth() {
        return treeCodec.getMaxDepth();
    }

    /**
     * Sets the deepest serialized tree accepted on decompression.
     *
     * @param maxTreeDepth the maximum tree depth
     */
    public void setMaxTreeDepth(int maxTreeDepth) {
        treeCodec.setMaxDepth(maxTreeDepth);
    }

    /**
     * Compresses text, encoded as UTF-8.
     *
     * @param text the text to compress
     * @return the compression result
     * @throws HuffmanException if compression fails
     */
    public CompressionResult compress(String text) throws HuffmanException {
        return compress(text.getBytes(UTF_8));
    }

    /**
     * Compresses data.
     *
     * @param data the symbols to compress
     * @return the compression result
     * @throws HuffmanException if compression fails
     */
    public CompressionResult compress(byte[] data) throws HuffmanException {
        long start = System.nanoTime();
        if (data.length == 0) {
            LOGGER.fine(L10N.getString("log.compress_empty"));
            return new CompressionResult(CompressedPayload.EMPTY, null, SerializedTree.EMPTY,
                    Codebook.EMPTY, FrequencyTable.count(data),
                    CompressionStats.empty(System.nanoTime() - start));
        }

        FrequencyTable frequencies = FrequencyTable.count(data);
        HuffmanNode tree = treeBuilder.build(frequencies);
        Codebook codebook = Codebook.from(tree);
        if (verifyCodebook && !codebook.isPrefixFree()) {
            String msg = MessageFormat.format(L10N.getString("err.not_prefix_free"), codebook);
            LOGGER.warning(msg);
            throw new IllegalStateException(msg);
        }
        CompressedPayload payload = encoder.encode(data, codebook);
        SerializedTree serializedTree = treeCodec.serialize(tree);
        TreeStatistics treeStatistics = TreeStatistics.of(tree, codebook);
        long elapsed = System.nanoTime() - start;
        CompressionStats stats = new CompressionStats(data.length, frequencies.getDistinctSymbols(),
                payload.getBitLength(), frequencies.entropy(), treeStatistics, elapsed);

        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("log.compressed"),
                    data.length, frequencies.getDistinctSymbols(),
                    stats.getOriginalBits(), stats.getCompressedBits(),
                    String.format("%.2f", stats.getCompressionRate()));
            LOGGER.fine(msg);
        }

        if (verifyRoundTrip) {
            byte[] decoded = decoder.decode(payload, tree);
            if (!validateIntegrity(data, decoded)) {
                String msg = L10N.getString("err.round_trip");
                LOGGER.warning(msg);
                throw new IllegalStateException(msg);
            }
        }
        return new CompressionResult(payload, tree, serializedTree, codebook, frequencies, stats);
    }

    /**
     * Decompresses a payload using a tree in serialized form.
     *
     * @param payload the packed code bits
     * @param tree the serialized tree the payload was encoded with
     * @return the original data
     * @throws MalformedPayloadException if the tree or the payload is invalid,
     * or they do not belong together
     */
    public byte[] decompress(CompressedPayload payload, SerializedTree tree) throws MalformedPayloadException {
        return decompress(payload, treeCodec.deserialize(tree));
    }

    /**
     * Decompresses a payload using the tree it was encoded with.
     *
     * @param payload the packed code bits
     * @param tree the root of the tree, or null for an empty payload
     * @return the original data
     * @throws MalformedPayloadException if the payload does not decode
     * cleanly against the tree
     */
    public byte[] decompress(CompressedPayload payload, HuffmanNode tree) throws MalformedPayloadException {
        long start = System.nanoTime();
        byte[] data = decoder.decode(payload, tree);
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("log.decompressed"),
                    payload.getBitLength(), data.length, System.nanoTime() - start);
            LOGGER.fine(msg);
        }
        return data;
    }

    /**
     * Decompresses a payload holding UTF-8 text.
     *
     * @param payload the packed code bits
     * @param tree the serialized tree the payload was encoded with
     * @return the original text
     * @throws MalformedPayloadException if the payload cannot be decoded
     */
    public String decompressToString(CompressedPayload payload, SerializedTree tree)
            throws MalformedPayloadException {
        return new String(decompress(payload, tree), UTF_8);
    }

    /**
     * Checks that decompressed data is identical to the original.
     *
     * @param original the data that was compressed
     * @param decoded the data that was decompressed
     * @return true if both are identical
     */
    public boolean validateIntegrity(byte[] original, byte[] decoded) {
        return Arrays.equals(original, decoded);
    }

}
