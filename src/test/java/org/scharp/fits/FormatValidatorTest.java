///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.scharp.fits.CheckResult.Check;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link FormatValidator}. */
public class FormatValidatorTest {

    private static List<Hdu> sampleHdus() {
        return List.of(
            HeaderBuilder.primary(ImageData.of(new float[] { 1, 2, 3, 4, 5, 6 }, 3, 2)),
            HeaderBuilder.image(ImageData.unsigned(new short[] { 1, 2, 3 })),
            HeaderBuilder.table(List.of(
                new TableColumn("CITY", List.of("Seattle", "Tacoma")),
                new TableColumn("HIGH", List.of(58.5, 61.25)))));
    }

    /** Creates a header from records, padding it with blank records to {@code size}. */
    private static Header header(int size, String... records) {
        List<String> list = new ArrayList<>(List.of(records));
        list.addAll(Collections.nCopies(size - records.length, HeaderRecord.BLANK));
        return Header.of(list);
    }

    @Test
    void testValidFile() throws IOException {
        Path path = Files.createTempFile("format-validator-", ".fits");
        try {
            FitsWriter.write(path, sampleHdus());

            try (SeekableByteChannel channel = Files.newByteChannel(path)) {
                List<CheckResult> delivered = new ArrayList<>();
                ValidationReport report = FormatValidator.validate(channel, FitsReader.readHeaders(channel),
                    delivered::add);

                assertTrue(report.passed(), report.toString());
                assertEquals(Collections.nCopies(10, true), report.outcomes());
                assertEquals(delivered, report.results());

                // block test, then the header block tests, then the ASCII tests, then the keyword tests
                List<CheckResult> results = report.results();
                assertEquals(Check.BLOCK, results.get(0).check());
                assertEquals(0, results.get(0).hduIndex());
                Check[] checks = { Check.HEADER_BLOCK, Check.ASCII, Check.KEYWORD };
                for (int i = 0; i < checks.length; i++) {
                    for (int hdu = 1; hdu <= 3; hdu++) {
                        CheckResult result = results.get(1 + 3 * i + (hdu - 1));
                        assertEquals(checks[i], result.check());
                        assertEquals(hdu, result.hduIndex());
                    }
                }

                assertEquals(
                    "stream - passed block test: stream consists of exactly 6 blocks (of 2880 bytes)",
                    results.get(0).diagnostic());
                assertEquals(
                    "HDU2 - header passed block test: header consists of exactly 1 block (of 36 records of 80 bytes)",
                    results.get(2).diagnostic());
                assertEquals(
                    "HDU3 - header passed keyword test: mandatory keywords all present and in proper order",
                    results.get(9).diagnostic());
            }
        } finally {
            Files.delete(path);
        }
    }

    @Test
    void testPartialBlock() throws IOException {
        Path path = Files.createTempFile("format-validator-", ".fits");
        try {
            Files.write(path, new byte[2881]);
            try (SeekableByteChannel channel = Files.newByteChannel(path)) {
                CheckResult result = FormatValidator.checkBlockCount(channel);
                assertFalse(result.passed());
                assertEquals(Check.BLOCK, result.check());
                assertThat(result.diagnostic(), containsString("non-integer block count"));
                assertEquals(
                    "stream - failed block test: non-integer block count (2881 bytes, 1 block and a remainder of 1 " +
                        "bytes)",
                    result.diagnostic());

                // With no headers, only the block test is made.
                ValidationReport report = FormatValidator.validate(channel, List.of(), r -> { });
                assertEquals(List.of(false), report.outcomes());
                assertFalse(report.passed());

                // The other checks are made even though the block test failed.
                Header header = HeaderBuilder.primary(ImageData.of(new int[] { 1 })).header();
                report = FormatValidator.validate(channel, List.of(header), r -> { });
                assertEquals(List.of(false, true, true, true), report.outcomes());
            }
        } finally {
            Files.delete(path);
        }
    }

    @Test
    void testHeaderBlockCount() {
        Header header = header(35, HeaderRecord.logical("SIMPLE", true, ""), HeaderRecord.END);
        CheckResult result = FormatValidator.checkHeaderBlockCount(1, header);
        assertFalse(result.passed());
        assertEquals(
            "HDU1 - header failed block test: header is not a whole number of blocks - nrec = 35, nblock = 0, " +
                "remainder = 35",
            result.diagnostic());

        header = header(73, HeaderRecord.logical("SIMPLE", true, ""), HeaderRecord.END);
        result = FormatValidator.checkHeaderBlockCount(4, header);
        assertFalse(result.passed());
        assertThat(result.diagnostic(), containsString("HDU4 - header failed block test"));
        assertThat(result.diagnostic(), containsString("nrec = 73, nblock = 2, remainder = 1"));

        header = header(72, HeaderRecord.logical("SIMPLE", true, ""), HeaderRecord.END);
        result = FormatValidator.checkHeaderBlockCount(1, header);
        assertTrue(result.passed());
        assertEquals(
            "HDU1 - header passed block test: header consists of exactly 2 blocks (of 36 records of 80 bytes)",
            result.diagnostic());
    }

    @Test
    void testAsciiText() {
        Header header = header(36,
            HeaderRecord.logical("SIMPLE", true, ""),
            HeaderRecord.integer("BITPIX", 8, "bits per data value"),
            HeaderRecord.END);
        assertTrue(FormatValidator.checkAsciiText(1, header).passed());

        header = header(36,
            HeaderRecord.logical("SIMPLE", true, ""),
            "BITPIX  =                    8 \t" + " ".repeat(47),
            HeaderRecord.END);
        CheckResult result = FormatValidator.checkAsciiText(2, header);
        assertFalse(result.passed());
        assertEquals(Check.ASCII, result.check());
        assertEquals(
            "HDU2 - header failed ASCII test: record 2 contains a character outside of decimal 32 through 126",
            result.diagnostic());

        // characters above 126 fail too
        header = header(36, HeaderRecord.logical("SIMPLE", true, ""), "COMMENT é" + " ".repeat(71));
        assertFalse(FormatValidator.checkAsciiText(1, header).passed());
    }

    @Test
    void testMandatoryKeywordsOfPrimary() {
        Header header = header(36,
            HeaderRecord.logical("SIMPLE", true, ""),
            HeaderRecord.integer("BITPIX", 16, ""),
            HeaderRecord.integer("NAXIS", 2, ""),
            HeaderRecord.integer("NAXIS1", 5, ""),
            HeaderRecord.integer("NAXIS2", 5, ""),
            HeaderRecord.END);
        assertTrue(FormatValidator.checkMandatoryKeywords(1, header).passed());

        // out of order
        header = header(36,
            HeaderRecord.logical("SIMPLE", true, ""),
            HeaderRecord.integer("NAXIS", 2, ""),
            HeaderRecord.integer("BITPIX", 16, ""),
            HeaderRecord.integer("NAXIS1", 5, ""),
            HeaderRecord.integer("NAXIS2", 5, ""),
            HeaderRecord.END);
        CheckResult result = FormatValidator.checkMandatoryKeywords(1, header);
        assertFalse(result.passed());
        assertEquals(
            "HDU1 - header failed keyword test: mandatory keyword BITPIX not present or out of order",
            result.diagnostic());

        // missing an axis
        header = header(36,
            HeaderRecord.logical("SIMPLE", true, ""),
            HeaderRecord.integer("BITPIX", 16, ""),
            HeaderRecord.integer("NAXIS", 2, ""),
            HeaderRecord.integer("NAXIS1", 5, ""),
            HeaderRecord.END);
        result = FormatValidator.checkMandatoryKeywords(1, header);
        assertThat(result.diagnostic(), containsString("mandatory keyword NAXIS2 not present or out of order"));

        // the first HDU must start with SIMPLE
        Header image = HeaderBuilder.image(ImageData.of(new int[] { 1 })).header();
        result = FormatValidator.checkMandatoryKeywords(1, image);
        assertThat(result.diagnostic(), containsString("mandatory keyword SIMPLE not present or out of order"));
    }

    @Test
    void testMandatoryKeywordsOfExtension() {
        // PCOUNT is missing after the NAXISn keywords
        Header header = header(36,
            HeaderRecord.string("XTENSION", "TABLE", ""),
            HeaderRecord.integer("BITPIX", 8, ""),
            HeaderRecord.integer("NAXIS", 2, ""),
            HeaderRecord.integer("NAXIS1", 20, ""),
            HeaderRecord.integer("NAXIS2", 3, ""),
            HeaderRecord.integer("GCOUNT", 1, ""),
            HeaderRecord.integer("TFIELDS", 1, ""),
            HeaderRecord.END);
        CheckResult result = FormatValidator.checkMandatoryKeywords(2, header);
        assertFalse(result.passed());
        assertEquals(Check.KEYWORD, result.check());
        assertEquals(2, result.hduIndex());
        assertEquals(
            "HDU2 - header failed keyword test: mandatory keyword PCOUNT not present or out of order",
            result.diagnostic());

        // a later HDU must start with XTENSION
        Header primary = HeaderBuilder.primary(ImageData.of(new int[] { 1 })).header();
        result = FormatValidator.checkMandatoryKeywords(2, primary);
        assertThat(result.diagnostic(), containsString("mandatory keyword XTENSION not present or out of order"));

        // headers that were built are valid
        for (Hdu hdu : sampleHdus().subList(1, 3)) {
            assertTrue(FormatValidator.checkMandatoryKeywords(2, hdu.header()).passed());
        }
    }

    @Test
    void testMandatoryKeywordsBadNaxis() {
        Header header = header(36,
            HeaderRecord.logical("SIMPLE", true, ""),
            HeaderRecord.integer("BITPIX", 16, ""),
            HeaderRecord.string("NAXIS", "two", ""),
            HeaderRecord.END);
        CheckResult result = FormatValidator.checkMandatoryKeywords(1, header);
        assertFalse(result.passed());
        assertEquals(
            "HDU1 - header failed keyword test: NAXIS value is not an integer between 0 and 999",
            result.diagnostic());

        header = header(36,
            HeaderRecord.logical("SIMPLE", true, ""),
            HeaderRecord.integer("BITPIX", 16, ""),
            HeaderRecord.integer("NAXIS", 1000, ""),
            HeaderRecord.END);
        assertFalse(FormatValidator.checkMandatoryKeywords(1, header).passed());

        // an unparsable value is reported, not thrown
        header = header(36,
            HeaderRecord.logical("SIMPLE", true, ""),
            HeaderRecord.integer("BITPIX", 16, ""),
            "NAXIS   = two" + " ".repeat(67),
            HeaderRecord.END);
        result = FormatValidator.checkMandatoryKeywords(1, header);
        assertFalse(result.passed());
        assertEquals(
            "HDU1 - header failed keyword test: cannot parse value of record \"NAXIS   = two\"",
            result.diagnostic());

        // a header that ends early
        header = Header.of(List.of(HeaderRecord.logical("SIMPLE", true, "")));
        result = FormatValidator.checkMandatoryKeywords(1, header);
        assertThat(result.diagnostic(), containsString("mandatory keyword BITPIX not present or out of order"));
    }

    @Test
    void testPrimaryWithoutDataHasNoBitpix() {
        // A primary header without data is written without BITPIX, which the keyword test reports.
        Header header = HeaderBuilder.primary(ImageData.NONE).header();

        assertTrue(FormatValidator.checkHeaderBlockCount(1, header).passed());
        assertTrue(FormatValidator.checkAsciiText(1, header).passed());
        CheckResult result = FormatValidator.checkMandatoryKeywords(1, header);
        assertFalse(result.passed());
        assertThat(result.diagnostic(), containsString("mandatory keyword BITPIX not present or out of order"));
    }

    @Test
    void testBadArguments() {
        Header header = HeaderBuilder.primary(ImageData.NONE).header();

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> FormatValidator.checkAsciiText(0, header));
        assertEquals("hduIndex must be positive", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> FormatValidator.checkHeaderBlockCount(1, null));
        assertEquals("header must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> FormatValidator.checkBlockCount(null));
        assertEquals("channel must not be null", exception.getMessage());
    }

    @Test
    void testValidateLogs() throws IOException {
        Logger logger = (Logger) LoggerFactory.getLogger(FormatValidator.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);

        Path path = Files.createTempFile("format-validator-", ".fits");
        try {
            FitsWriter.write(path, List.of(HeaderBuilder.primary(ImageData.NONE)));
            try (SeekableByteChannel channel = Files.newByteChannel(path)) {
                ValidationReport report = FormatValidator.validate(channel, FitsReader.readHeaders(channel));
                assertEquals(List.of(true, true, true, false), report.outcomes());
            }

            // passed checks are logged as INFO and failed checks as WARN
            assertEquals(4, appender.list.size());
            assertEquals(Level.INFO, appender.list.get(0).getLevel());
            assertEquals(Level.INFO, appender.list.get(1).getLevel());
            assertEquals(Level.INFO, appender.list.get(2).getLevel());
            assertEquals(Level.WARN, appender.list.get(3).getLevel());
            assertThat(appender.list.get(3).getFormattedMessage(), containsString("HDU1 - header failed keyword test"));
        } finally {
            logger.detachAppender(appender);
            Files.delete(path);
        }
    }
}
