///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the HDUs of a FITS byte stream.
 * <p>
 * The HDUs are located with {@link BlockAddressing}.  Like those methods, the reader positions the channel before
 * each read and doesn't close it.
 * </p>
 */
public final class FitsReader {

    private static final Logger log = LoggerFactory.getLogger(FitsReader.class);

    // private constructor to prevent anyone from instantiating the class.
    private FitsReader() {
    }

    /**
     * Reads the header of every HDU in a stream.
     * <p>
     * A header consists of all records from the start of the HDU to the start of its data, so it includes the END
     * record and the blank records that follow it.  The records are taken as they are, one character per byte, so
     * that a header which breaks the format's rules can be validated with {@link FormatValidator}.
     * </p>
     *
     * @param channel
     *     The stream.
     *
     * @return The headers, in the order in which they appear.
     *
     * @throws FitsFormatException
     *     if the stream's length is not a whole number of blocks or if a header has no END record.
     * @throws IOException
     *     if the channel couldn't be read.
     */
    public static List<Header> readHeaders(SeekableByteChannel channel) throws IOException {
        List<Long> headerPointers = BlockAddressing.headerPointers(channel);
        List<Long> dataPointers = BlockAddressing.dataPointers(channel);
        assert headerPointers.size() == dataPointers.size();

        List<Header> headers = new ArrayList<>(headerPointers.size());
        for (int i = 0; i < headerPointers.size(); i++) {
            long headerPointer = headerPointers.get(i);
            int headerSize = (int) (dataPointers.get(i) - headerPointer);
            byte[] bytes = BlockAddressing.read(channel, headerPointer, headerSize);

            List<String> records = new ArrayList<>(headerSize / BlockAddressing.RECORD_SIZE);
            for (int offset = 0; offset < bytes.length; offset += BlockAddressing.RECORD_SIZE) {
                records.add(new String(bytes, offset, BlockAddressing.RECORD_SIZE, StandardCharsets.ISO_8859_1));
            }
            headers.add(Header.of(records));
        }
        return Collections.unmodifiableList(headers);
    }

    /**
     * Reads every HDU in a stream, including its data.
     *
     * @param channel
     *     The stream.
     *
     * @return The HDUs, in the order in which they appear.
     *
     * @throws FitsFormatException
     *     if the stream is not a well-formed FITS file, if it doesn't start with a primary HDU, or if it contains an
     *     extension other than an image or an ASCII table.
     * @throws IOException
     *     if the channel couldn't be read.
     */
    public static List<Hdu> read(SeekableByteChannel channel) throws IOException {
        List<Header> headers = readHeaders(channel);
        List<Long> dataPointers = BlockAddressing.dataPointers(channel);
        List<Long> endPointers = BlockAddressing.endPointers(channel);
        if (headers.isEmpty()) {
            throw new FitsFormatException("stream has no HDU");
        }

        List<Hdu> hdus = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            Header header = headers.get(i);
            HduType type = HduType.forHeader(header);
            if ((i == 0) != (type == HduType.PRIMARY)) {
                throw new FitsFormatException(
                    i == 0 ? "stream does not start with a primary HDU" :
                        "HDU " + (i + 1) + " starts with SIMPLE but only the first HDU may");
            }

            long dataPointer = dataPointers.get(i);
            long available = endPointers.get(i) - dataPointer;
            final HduData data;
            if (type == HduType.TABLE) {
                data = readTable(channel, header, dataPointer, available);
            } else {
                data = readImage(channel, header, dataPointer, available);
            }
            hdus.add(new Hdu(type, header, data));

            log.debug("read {} HDU {} with {} data bytes", type, i + 1, data.sizeInBytes());
        }
        return Collections.unmodifiableList(hdus);
    }

    private static int checkedDataSize(long dataSize, long available) throws FitsFormatException {
        if (available < dataSize) {
            throw new FitsFormatException(
                "header declares " + dataSize + " data bytes but only " + available + " are present");
        }
        if (Integer.MAX_VALUE - 8 < dataSize) {
            throw new FitsFormatException("data segment of " + dataSize + " bytes is too large to read");
        }
        return (int) dataSize;
    }

    private static int checkedCount(Header header, String keyword, int maximum) throws FitsFormatException {
        long value = header.integerValue(keyword);
        if (value < 0 || maximum < value) {
            throw new FitsFormatException(keyword + " value " + value + " is out of range");
        }
        return (int) value;
    }

    private static ImageData readImage(SeekableByteChannel channel, Header header, long dataPointer, long available)
        throws IOException {

        int naxis = checkedCount(header, "NAXIS", 999);
        if (naxis == 0) {
            return ImageData.NONE;
        }

        int[] axes = new int[naxis];
        long elementCount = 1;
        for (int i = 0; i < naxis; i++) {
            axes[i] = checkedCount(header, "NAXIS" + (i + 1), Integer.MAX_VALUE);
            elementCount *= axes[i];
            if (Integer.MAX_VALUE < elementCount) {
                throw new FitsFormatException("image of more than " + Integer.MAX_VALUE + " elements is too large");
            }
        }

        int bitpix = (int) header.integerValue("BITPIX");
        BigDecimal bzero = header.decimalValue("BZERO", BigDecimal.ZERO);
        ElementType type = ElementType.forBitpix(bitpix, bzero);

        int dataSize = checkedDataSize(elementCount * type.sizeInBytes(), available);
        return ImageData.decode(type, axes, BlockAddressing.read(channel, dataPointer, dataSize));
    }

    private static AsciiTableData readTable(SeekableByteChannel channel, Header header, long dataPointer,
        long available) throws IOException {

        int rowLength = checkedCount(header, "NAXIS1", Integer.MAX_VALUE);
        int totalRows = checkedCount(header, "NAXIS2", Integer.MAX_VALUE);

        int dataSize = checkedDataSize((long) rowLength * totalRows, available);
        byte[] bytes = BlockAddressing.read(channel, dataPointer, dataSize);

        List<String> rows = new ArrayList<>(totalRows);
        for (int i = 0; i < totalRows; i++) {
            rows.add(new String(bytes, i * rowLength, rowLength, StandardCharsets.US_ASCII));
        }
        return new AsciiTableData(rows, rowLength);
    }

    /**
     * Splits the rows of an ASCII table HDU into columns, using the {@code TBCOLn} and {@code TFORMn} keywords of its
     * header.
     * <p>
     * Fields of type {@code A} become {@code String}s without trailing spaces, fields of type {@code I} become
     * {@code Long}s, and fields of type {@code F}, {@code E}, and {@code D} become {@code Double}s. Fields of any
     * other type are kept as {@code String}s.
     * </p>
     *
     * @param hdu
     *     An ASCII table HDU.
     *
     * @return The columns, named by their {@code TTYPEn} keyword.
     *
     * @throws NullPointerException
     *     if {@code hdu} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code hdu} is not an ASCII table.
     * @throws FitsFormatException
     *     if a column is not described correctly by the header or if a field can't be parsed.
     */
    public static List<TableColumn> parseTable(Hdu hdu) throws FitsFormatException {
        ArgumentUtil.checkNotNull(hdu, "hdu");
        if (hdu.type() != HduType.TABLE) {
            throw new IllegalArgumentException("cannot parse columns of a " + hdu.type() + " HDU");
        }

        Header header = hdu.header();
        AsciiTableData data = (AsciiTableData) hdu.data();
        int totalColumns = checkedCount(header, "TFIELDS", HeaderBuilder.MAX_COLUMNS);

        List<TableColumn> columns = new ArrayList<>(totalColumns);
        for (int n = 1; n <= totalColumns; n++) {
            int fieldStart = checkedCount(header, "TBCOL" + n, data.rowLength()) - 1;
            TableFormat format = TableFormat.parse(header.stringValue("TFORM" + n));
            if (fieldStart < 0 || data.rowLength() < fieldStart + format.width()) {
                throw new FitsFormatException("column " + n + " does not fit in a row of " + data.rowLength());
            }
            Object name = header.value("TTYPE" + n);

            List<Object> values = new ArrayList<>(data.rows().size());
            for (String row : data.rows()) {
                String field = row.substring(fieldStart, fieldStart + format.width());
                values.add(parseField(field, format, n));
            }
            columns.add(new TableColumn(name instanceof String ? (String) name : null, values));
        }
        return columns;
    }

    private static Object parseField(String field, TableFormat format, int columnNumber) throws FitsFormatException {
        try {
            switch (format.typeCode()) {
            case 'I':
                return Long.parseLong(field.strip());
            case 'F':
            case 'E':
            case 'D':
                // FORTRAN double precision uses 'D' as the exponent marker.
                return Double.parseDouble(field.strip().replace('D', 'E'));
            default:
                return field.stripTrailing();
            }
        } catch (NumberFormatException exception) {
            throw new FitsFormatException(
                "column " + columnNumber + " has a field \"" + field + "\" that is not of type " + format, exception);
        }
    }
}
