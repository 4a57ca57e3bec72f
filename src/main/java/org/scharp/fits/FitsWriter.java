///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Serializes HDUs as a FITS file.
 * <p>
 * Each HDU is written as its header records followed by its data, which is padded to the next 2880-byte block
 * boundary.  Image data is padded with zero bytes and table data with spaces.
 * </p>
 * <pre>
 * List&lt;Hdu&gt; hdus = List.of(
 *     HeaderBuilder.primary(ImageData.of(new short[] { 1, 2, 3, 4, 5, 6 }, 3, 2)),
 *     HeaderBuilder.table(List.of(
 *         new TableColumn("CITY", List.of("Seattle", "Tacoma")),
 *         new TableColumn("HIGH", List.of(58.5, 61.25)))));
 *
 * FitsWriter.write(Path.of("weather.fits"), hdus);
 * </pre>
 */
public final class FitsWriter {

    private static final Logger log = LoggerFactory.getLogger(FitsWriter.class);

    // private constructor to prevent anyone from instantiating the class.
    private FitsWriter() {
    }

    private static void checkHdus(List<Hdu> hdus) {
        ArgumentUtil.checkNotNull(hdus, "hdus");
        if (hdus.isEmpty()) {
            throw new IllegalArgumentException("a FITS file must have a primary HDU");
        }
        for (int i = 0; i < hdus.size(); i++) {
            Hdu hdu = hdus.get(i);
            if (hdu == null) {
                throw new NullPointerException("hdus must not contain null");
            }
            if ((i == 0) != (hdu.type() == HduType.PRIMARY)) {
                throw new IllegalArgumentException(
                    i == 0 ? "the first HDU must be a primary HDU, not " + hdu.type() :
                        "HDU " + (i + 1) + " is a primary HDU but only the first HDU may be one");
            }
            if (hdu.header().size() % BlockAddressing.RECORDS_PER_BLOCK != 0) {
                throw new IllegalArgumentException(
                    "the header of HDU " + (i + 1) + " is not a whole number of blocks");
            }
            for (String record : hdu.header().records()) {
                if (record.length() != HeaderRecord.LENGTH || !ArgumentUtil.isAsciiText(record)) {
                    throw new IllegalArgumentException(
                        "the header of HDU " + (i + 1) + " has a record that is not 80 characters of ASCII text");
                }
            }
        }
    }

    /**
     * Writes HDUs to a stream.
     *
     * @param outputStream
     *     The stream to write to.  This is not closed.
     * @param hdus
     *     The HDUs, starting with the primary HDU.
     *
     * @throws NullPointerException
     *     if {@code outputStream} or {@code hdus} is {@code null}, or if {@code hdus} contains {@code null}.
     * @throws IllegalArgumentException
     *     if the first HDU isn't a primary HDU, if any other HDU is, or if a header is not a whole number of blocks
     *     of ASCII text records.
     * @throws IOException
     *     if the stream couldn't be written.
     */
    public static void write(OutputStream outputStream, List<Hdu> hdus) throws IOException {
        ArgumentUtil.checkNotNull(outputStream, "outputStream");
        checkHdus(hdus);

        final byte[] recordBuffer = new byte[BlockAddressing.RECORD_SIZE];
        for (int i = 0; i < hdus.size(); i++) {
            Hdu hdu = hdus.get(i);

            for (String record : hdu.header().records()) {
                WriteUtil.writeAscii(recordBuffer, 0, record, recordBuffer.length);
                outputStream.write(recordBuffer);
            }

            HduData data = hdu.data();
            long dataSize = data.sizeInBytes();
            data.writeTo(outputStream);

            int paddingSize = (int) (MathUtil.align(dataSize, BlockAddressing.BLOCK_SIZE) - dataSize);
            byte[] padding = new byte[paddingSize];
            Arrays.fill(padding, data.paddingByte());
            outputStream.write(padding);

            log.debug("wrote {} HDU {}: {} header records, {} data bytes", hdu.type(), i + 1, hdu.header().size(),
                dataSize);
        }
    }

    /**
     * Writes HDUs to a file.
     *
     * @param targetLocation
     *     The path to the file to write.  If the file doesn't exist, then it will be created.  If the file does exist,
     *     then its contents will be replaced.
     * @param hdus
     *     The HDUs, starting with the primary HDU.
     *
     * @throws NullPointerException
     *     if {@code targetLocation} or {@code hdus} is {@code null}, or if {@code hdus} contains {@code null}.
     * @throws IllegalArgumentException
     *     if the first HDU isn't a primary HDU, if any other HDU is, or if a header is not a whole number of blocks
     *     of ASCII text records.
     * @throws IOException
     *     if the file couldn't be written.
     */
    public static void write(Path targetLocation, List<Hdu> hdus) throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        checkHdus(hdus);

        try (OutputStream outputStream = new BufferedOutputStream(Files.newOutputStream(targetLocation))) {
            write(outputStream, hdus);
        }
    }
}
