///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.scharp.fits.CheckResult.Check;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Checks that a FITS stream obeys the structural rules of the format.
 * <p>
 * Every check is made, even after one has failed, and a structural problem never causes an exception: it is reported
 * as a failed {@link CheckResult}.  The results are reported in this order:
 * </p>
 * <ol>
 *     <li>the stream is a whole number of 2880-byte blocks</li>
 *     <li>for each HDU, the header is a whole number of 36-record blocks</li>
 *     <li>for each HDU, the header contains only ASCII text characters, decimal 32 through 126</li>
 *     <li>for each HDU, the mandatory keywords are present and in order</li>
 * </ol>
 * <p>
 * The headers are normally obtained with {@link FitsReader#readHeaders}.  Because that method needs a stream that is
 * a whole number of blocks, an empty list of headers may be given for a stream that fails the block test.
 * </p>
 */
public final class FormatValidator {

    private static final Logger log = LoggerFactory.getLogger(FormatValidator.class);

    // private constructor to prevent anyone from instantiating the class.
    private FormatValidator() {
    }

    private static String blockText(long count) {
        return count == 1 ? "block" : "blocks";
    }

    /**
     * Checks that a stream is a whole number of 2880-byte blocks.
     *
     * @param channel
     *     The stream.
     *
     * @return The result of the check.
     *
     * @throws IOException
     *     if the size of the channel couldn't be determined.
     */
    public static CheckResult checkBlockCount(SeekableByteChannel channel) throws IOException {
        ArgumentUtil.checkNotNull(channel, "channel");
        long size = channel.size();
        long blockCount = size / BlockAddressing.BLOCK_SIZE;
        long remainder = size % BlockAddressing.BLOCK_SIZE;

        if (remainder != 0) {
            return new CheckResult(Check.BLOCK, 0, false,
                "stream - failed block test: non-integer block count (" + size + " bytes, " + blockCount + " " +
                    blockText(blockCount) + " and a remainder of " + remainder + " bytes)");
        }
        return new CheckResult(Check.BLOCK, 0, true,
            "stream - passed block test: stream consists of exactly " + blockCount + " " + blockText(blockCount) +
                " (of 2880 bytes)");
    }

    /**
     * Checks that a header is a whole number of 36-record blocks.
     *
     * @param hduIndex
     *     The 1-based index of the HDU whose header is checked.
     * @param header
     *     The header.
     *
     * @return The result of the check.
     */
    public static CheckResult checkHeaderBlockCount(int hduIndex, Header header) {
        checkArguments(hduIndex, header);
        int recordCount = header.size();
        int blockCount = recordCount / BlockAddressing.RECORDS_PER_BLOCK;
        int remainder = recordCount % BlockAddressing.RECORDS_PER_BLOCK;

        if (remainder != 0) {
            return new CheckResult(Check.HEADER_BLOCK, hduIndex, false,
                "HDU" + hduIndex + " - header failed block test: header is not a whole number of blocks - nrec = " +
                    recordCount + ", nblock = " + blockCount + ", remainder = " + remainder);
        }
        return new CheckResult(Check.HEADER_BLOCK, hduIndex, true,
            "HDU" + hduIndex + " - header passed block test: header consists of exactly " + blockCount + " " +
                blockText(blockCount) + " (of 36 records of 80 bytes)");
    }

    /**
     * Checks that a header contains only the restricted set of ASCII text characters, decimal 32 through 126.
     *
     * @param hduIndex
     *     The 1-based index of the HDU whose header is checked.
     * @param header
     *     The header.
     *
     * @return The result of the check.
     */
    public static CheckResult checkAsciiText(int hduIndex, Header header) {
        checkArguments(hduIndex, header);
        List<String> records = header.records();
        for (int i = 0; i < records.size(); i++) {
            if (!ArgumentUtil.isAsciiText(records.get(i))) {
                return new CheckResult(Check.ASCII, hduIndex, false,
                    "HDU" + hduIndex + " - header failed ASCII test: record " + (i + 1) +
                        " contains a character outside of decimal 32 through 126");
            }
        }
        return new CheckResult(Check.ASCII, hduIndex, true,
            "HDU" + hduIndex + " - header passed ASCII test: header contains only the restricted set of ASCII text " +
                "characters, decimal 32 through 126");
    }

    /**
     * Checks that a header starts with the mandatory keywords of its HDU, in order.
     * <p>
     * The header of the first HDU must start with {@code SIMPLE}, {@code BITPIX}, {@code NAXIS}, and {@code NAXIS1}
     * through {@code NAXISn}.  The header of any other HDU must start with {@code XTENSION}, {@code BITPIX},
     * {@code NAXIS}, {@code NAXIS1} through {@code NAXISn}, {@code PCOUNT}, and {@code GCOUNT}.
     * </p>
     *
     * @param hduIndex
     *     The 1-based index of the HDU whose header is checked.
     * @param header
     *     The header.
     *
     * @return The result of the check.  If it failed, the diagnostic names the first mandatory keyword that is
     *     missing or out of order.
     */
    public static CheckResult checkMandatoryKeywords(int hduIndex, Header header) {
        checkArguments(hduIndex, header);

        List<String> expected = new ArrayList<>();
        expected.add(hduIndex == 1 ? "SIMPLE" : "XTENSION");
        expected.add("BITPIX");
        expected.add("NAXIS");
        String failure = firstMissingKeyword(header, expected);

        if (failure == null) {
            try {
                Object naxis = HeaderRecord.value(header.records().get(2));
                if (!(naxis instanceof Long) || (Long) naxis < 0 || 999 < (Long) naxis) {
                    failure = "NAXIS value is not an integer between 0 and 999";
                } else {
                    for (int i = 1; i <= (Long) naxis; i++) {
                        expected.add("NAXIS" + i);
                    }
                    if (hduIndex != 1) {
                        expected.add("PCOUNT");
                        expected.add("GCOUNT");
                    }
                    failure = firstMissingKeyword(header, expected);
                }
            } catch (FitsFormatException exception) {
                failure = exception.getMessage();
            }
        }

        if (failure != null) {
            return new CheckResult(Check.KEYWORD, hduIndex, false,
                "HDU" + hduIndex + " - header failed keyword test: " + failure);
        }
        return new CheckResult(Check.KEYWORD, hduIndex, true,
            "HDU" + hduIndex + " - header passed keyword test: mandatory keywords all present and in proper order");
    }

    private static String firstMissingKeyword(Header header, List<String> expected) {
        for (int i = 0; i < expected.size(); i++) {
            String actual = i < header.size() ? header.keyword(i) : null;
            if (!expected.get(i).equals(actual)) {
                return "mandatory keyword " + expected.get(i) + " not present or out of order";
            }
        }
        return null;
    }

    private static void checkArguments(int hduIndex, Header header) {
        ArgumentUtil.checkNotNull(header, "header");
        if (hduIndex < 1) {
            throw new IllegalArgumentException("hduIndex must be positive");
        }
    }

    /**
     * Validates a stream, delivering each result to a sink as soon as it is known.
     *
     * @param channel
     *     The stream.
     * @param headers
     *     The headers of the HDUs in the stream, in order.
     * @param sink
     *     The consumer of the results.
     *
     * @return The results, in the order in which they were delivered.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws IOException
     *     if the size of the channel couldn't be determined.
     */
    public static ValidationReport validate(SeekableByteChannel channel, List<Header> headers,
        Consumer<CheckResult> sink) throws IOException {
        ArgumentUtil.checkNotNull(channel, "channel");
        ArgumentUtil.checkNotNull(headers, "headers");
        ArgumentUtil.checkNotNull(sink, "sink");

        List<CheckResult> results = new ArrayList<>(1 + 3 * headers.size());
        Consumer<CheckResult> collector = result -> {
            results.add(result);
            sink.accept(result);
        };

        collector.accept(checkBlockCount(channel));
        for (int i = 0; i < headers.size(); i++) {
            collector.accept(checkHeaderBlockCount(i + 1, headers.get(i)));
        }
        for (int i = 0; i < headers.size(); i++) {
            collector.accept(checkAsciiText(i + 1, headers.get(i)));
        }
        for (int i = 0; i < headers.size(); i++) {
            collector.accept(checkMandatoryKeywords(i + 1, headers.get(i)));
        }

        return new ValidationReport(results);
    }

    /**
     * Validates a stream, logging each result.  Passed checks are logged at INFO level and failed checks at WARN
     * level.
     *
     * @param channel
     *     The stream.
     * @param headers
     *     The headers of the HDUs in the stream, in order.
     *
     * @return The results.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws IOException
     *     if the size of the channel couldn't be determined.
     */
    public static ValidationReport validate(SeekableByteChannel channel, List<Header> headers) throws IOException {
        return validate(channel, headers, result -> {
            if (result.passed()) {
                log.info(result.diagnostic());
            } else {
                log.warn(result.diagnostic());
            }
        });
    }
}
