/*
 * HuffmanArchive.java
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

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.ResourceBundle;

import org.bluezoo.huffman.bits.CompressedPayload;
import org.bluezoo.huffman.tree.SerializedTree;

/**
 * Frames a serialized tree and its payload as a single byte array.
 *
 * <p>This is the form in which a compression result is stored or
 * transmitted. All integers are big-endian:
 * <pre>
 * +-------+---------+--------------+--------------+
 * | "HUF" | version | symbol count | last bits    |
 * | 3     | 1       | 8            | 1            |
 * +-------+---------+--------------+--------------+
 * | tree length | tree bytes | payload length | payload bytes |
 * | 4           | n          | 4              | m             |
 * +-------------+------------+----------------+---------------+
 * </pre>
 * An empty input is stored with zero-length tree and payload.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HuffmanArchive {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.huffman.L10N");

    private static final byte[] MAGIC = new byte[] { 'H', 'U', 'F' };

    /** Current format version. */
    public static final int VERSION = 1;

    private static final int HEADER_LENGTH = MAGIC.length + 1 + 8 + 1 + 4 + 4;

    private final CompressedPayload payload;
    private final SerializedTree tree;

    private HuffmanArchive(CompressedPayload payload, SerializedTree tree) {
        this.payload = payload;
        this.tree = tree;
    }

    /**
     * Returns the payload read from the archive.
     *
     * @return the payload
     */
    public CompressedPayload getPayload() {
        return payload;
    }

    /**
     * Returns the serialized tree read from the archive.
     *
     * @return the serialized tree
     */
    public SerializedTree getTree() {
        return tree;
    }

    /**
     * Frames a compression result.
     *
     * @param result the compression result
     * @return the archive bytes
     */
    public static byte[] write(CompressionResult result) {
        return write(result.getPayload(), result.getSerializedTree());
    }

    /**
     * Frames a payload and the serialized tree it was encoded with.
     *
     * @param payload the payload
     * @param tree the serialized tree
     * @return the archive bytes
     */
    public static byte[] write(CompressedPayload payload, SerializedTree tree) {
        byte[] treeBytes = tree.toByteArray();
        byte[] data = payload.getData();
        ByteBuffer buf = ByteBuffer.allocate(HEADER_LENGTH + treeBytes.length + data.length);
        buf.put(MAGIC);
        buf.put((byte) VERSION);
        buf.putLong(payload.getSymbolCount());
        buf.put((byte) payload.getLastByteBits());
        buf.putInt(treeBytes.length);
        buf.put(treeBytes);
        buf.putInt(data.length);
        buf.put(data);
        return buf.array();
    }

    /**
     * Reads an archive. The tree and payload are not decoded.
     *
     * @param archive the archive bytes
     * @return the archive contents
     * @throws MalformedPayloadException if the framing is invalid
     */
    public static HuffmanArchive read(byte[] archive) throws MalformedPayloadException {
        ByteBuffer buf = ByteBuffer.wrap(archive);
        try {
            for (int i = 0; i < MAGIC.length; i++) {
                if (buf.get() != MAGIC[i]) {
                    throw new MalformedPayloadException(L10N.getString("err.archive_magic"));
                }
            }
            int version = buf.get() & 0xff;
            if (version != VERSION) {
                String msg = MessageFormat.format(L10N.getString("err.archive_version"), version);
                throw new MalformedPayloadException(msg);
            }
            long symbolCount = buf.getLong();
            int lastByteBits = buf.get() & 0xff;
            byte[] treeBytes = readBlock(buf);
            byte[] data = readBlock(buf);
            if (buf.hasRemaining()) {
                String msg = MessageFormat.format(L10N.getString("err.archive_trailing"), buf.remaining());
                throw new MalformedPayloadException(msg);
            }
            return new HuffmanArchive(CompressedPayload.of(data, lastByteBits, symbolCount),
                    SerializedTree.wrap(treeBytes));
        } catch (BufferUnderflowException e) {
            throw new MalformedPayloadException(L10N.getString("err.archive_truncated"), e);
        }
    }

    private static byte[] readBlock(ByteBuffer buf) throws MalformedPayloadException {
        int length = buf.getInt();
        if (length < 0 || length > buf.remaining()) {
            String msg = MessageFormat.format(L10N.getString("err.archive_block_length"), length);
            throw new MalformedPayloadException(msg);
        }
        byte[] block = new byte[length];
        buf.get(block);
        return block;
    }

    /**
     * Reads and decompresses an archive.
     *
     * @param archive the archive bytes
     * @param compressor the compressor to decode with
     * @return the original data
     * @throws MalformedPayloadException if the archive cannot be decoded
     */
    public static byte[] decompress(byte[] archive, HuffmanCompressor compressor)
            throws MalformedPayloadException {
        HuffmanArchive contents = read(archive);
        return compressor.decompress(contents.getPayload(), contents.getTree());
    }

}
