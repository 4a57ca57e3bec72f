///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Locates the records, blocks, and HDUs of a FITS byte stream.
 * <p>
 * Every method is a fresh scan of the channel: nothing is cached between calls.  Each method positions the channel
 * before every read it makes, so it doesn't depend on the channel's position when it is called, and it leaves the
 * channel at an unspecified position.  The channel is not closed.
 * </p>
 * <p>
 * A FITS file is a whole number of 2880-byte blocks.  Rather than ignoring a partial block at the end of a stream,
 * these methods throw a {@link FitsFormatException}.
 * </p>
 */
public final class BlockAddressing {

    /** The number of bytes in a record. */
    public static final int RECORD_SIZE = HeaderRecord.LENGTH;

    /** The number of records in a block. */
    public static final int RECORDS_PER_BLOCK = 36;

    /** The number of bytes in a block. */
    public static final int BLOCK_SIZE = RECORD_SIZE * RECORDS_PER_BLOCK;

    private static final String SIMPLE_KEYWORD = "SIMPLE  ";
    private static final String XTENSION_KEYWORD = "XTENSION";
    private static final String END_KEYWORD = "END     ";

    // private constructor to prevent anyone from instantiating the class.
    private BlockAddressing() {
    }

    /**
     * Reads bytes from an absolute position of a channel.
     *
     * @param channel
     *     The channel to read.
     * @param position
     *     The offset of the first byte to read.
     * @param length
     *     The number of bytes to read.
     *
     * @return The bytes.
     *
     * @throws FitsFormatException
     *     if the channel ends before {@code length} bytes were read.
     * @throws IOException
     *     if the channel couldn't be read.
     */
    static byte[] read(SeekableByteChannel channel, long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        channel.position(position);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                throw new FitsFormatException(
                    "stream ended at offset " + (position + buffer.position()) + " while reading " + length +
                        " bytes from offset " + position);
            }
        }
        return buffer.array();
    }

    private static String readKeyword(SeekableByteChannel channel, long position) throws IOException {
        return new String(read(channel, position, 8), StandardCharsets.ISO_8859_1);
    }

    private static long checkedSize(SeekableByteChannel channel, int unitSize, String unitName) throws IOException {
        ArgumentUtil.checkNotNull(channel, "channel");
        long size = channel.size();
        if (size % unitSize != 0) {
            throw new FitsFormatException(
                "stream length " + size + " is not a whole number of " + unitSize + "-byte " + unitName + "s (" +
                    size % unitSize + " bytes remain)");
        }
        return size;
    }

    private static List<Long> multiples(long size, int unitSize) {
        List<Long> pointers = new ArrayList<>((int) (size / unitSize));
        for (long offset = 0; offset < size; offset += unitSize) {
            pointers.add(offset);
        }
        return Collections.unmodifiableList(pointers);
    }

    /**
     * Gets the offset of every 80-byte record in a stream.
     *
     * @param channel
     *     The stream.
     *
     * @return The offsets {@code 0, 80, 160, ...}.
     *
     * @throws FitsFormatException
     *     if the stream's length is not a multiple of 80.
     * @throws IOException
     *     if the channel couldn't be read.
     */
    public static List<Long> recordPointers(SeekableByteChannel channel) throws IOException {
        return multiples(checkedSize(channel, RECORD_SIZE, "record"), RECORD_SIZE);
    }

    /**
     * Gets the offset of every 2880-byte block in a stream.
     *
     * @param channel
     *     The stream.
     *
     * @return The offsets {@code 0, 2880, 5760, ...}.
     *
     * @throws FitsFormatException
     *     if the stream's length is not a multiple of 2880.
     * @throws IOException
     *     if the channel couldn't be read.
     */
    public static List<Long> blockPointers(SeekableByteChannel channel) throws IOException {
        return multiples(checkedSize(channel, BLOCK_SIZE, "block"), BLOCK_SIZE);
    }

    /**
     * Gets the offset of every header in a stream: every block that starts with {@code SIMPLE} or {@code XTENSION}.
     *
     * @param channel
     *     The stream.
     *
     * @return The offsets of the headers.
     *
     * @throws FitsFormatException
     *     if the stream's length is not a multiple of 2880.
     * @throws IOException
     *     if the channel couldn't be read.
     */
    public static List<Long> headerPointers(SeekableByteChannel channel) throws IOException {
        List<Long> pointers = new ArrayList<>();
        for (long blockPointer : blockPointers(channel)) {
            String keyword = readKeyword(channel, blockPointer);
            if (keyword.equals(SIMPLE_KEYWORD) || keyword.equals(XTENSION_KEYWORD)) {
                pointers.add(blockPointer);
            }
        }
        return Collections.unmodifiableList(pointers);
    }

    /**
     * Gets the offset at which every HDU in a stream starts.  This is the same as its header's offset.
     *
     * @param channel
     *     The stream.
     *
     * @return The offsets of the HDUs.
     *
     * @throws FitsFormatException
     *     if the stream's length is not a multiple of 2880.
     * @throws IOException
     *     if the channel couldn't be read.
     */
    public static List<Long> hduPointers(SeekableByteChannel channel) throws IOException {
        return headerPointers(channel);
    }

    /**
     * Gets the offset of every HDU's data segment in a stream.
     * <p>
     * The records of each header are scanned until the END record is found, continuing into the following blocks if
     * the header spans more than one block, but never past the start of the next header.  The data starts at the
     * first block boundary after the END record.
     * </p>
     *
     * @param channel
     *     The stream.
     *
     * @return The offsets of the data segments, one for each header.
     *
     * @throws FitsFormatException
     *     if the stream's length is not a multiple of 2880 or if a header has no END record.
     * @throws IOException
     *     if the channel couldn't be read.
     */
    public static List<Long> dataPointers(SeekableByteChannel channel) throws IOException {
        List<Long> headerPointers = headerPointers(channel);
        final long size = channel.size();
        List<Long> pointers = new ArrayList<>(headerPointers.size());
        for (int i = 0; i < headerPointers.size(); i++) {
            long headerPointer = headerPointers.get(i);
            // the scan must not run into the next HDU's header
            long limit = i + 1 < headerPointers.size() ? headerPointers.get(i + 1) : size;
            long recordPointer = headerPointer;
            while (true) {
                if (limit <= recordPointer) {
                    throw new FitsFormatException("header at offset " + headerPointer + " has no END record");
                }
                if (readKeyword(channel, recordPointer).equals(END_KEYWORD)) {
                    break;
                }
                recordPointer += RECORD_SIZE;
            }
            pointers.add(MathUtil.align(recordPointer + RECORD_SIZE, BLOCK_SIZE));
        }
        return Collections.unmodifiableList(pointers);
    }

    /**
     * Gets the offset just past the end of every HDU in a stream: the start of the next HDU or, for the last HDU, the
     * length of the stream.
     *
     * @param channel
     *     The stream.
     *
     * @return The end offsets, one for each header.
     *
     * @throws FitsFormatException
     *     if the stream's length is not a multiple of 2880.
     * @throws IOException
     *     if the channel couldn't be read.
     */
    public static List<Long> endPointers(SeekableByteChannel channel) throws IOException {
        List<Long> hduPointers = hduPointers(channel);
        List<Long> pointers = new ArrayList<>(hduPointers.size());
        for (int i = 1; i < hduPointers.size(); i++) {
            pointers.add(hduPointers.get(i));
        }
        if (!hduPointers.isEmpty()) {
            pointers.add(channel.size());
        }
        return Collections.unmodifiableList(pointers);
    }
}
