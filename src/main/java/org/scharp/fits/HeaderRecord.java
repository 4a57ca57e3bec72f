///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Formats and parses the 80-character records of a FITS header.
 * <p>
 * A value record has the layout
 * </p>
 * <pre>
 * KEYWORD = value                / comment
 * </pre>
 * <p>
 * with the keyword left-justified in columns 1-8, the value indicator {@code "= "} in columns 9-10, and a value
 * field of 20 characters in columns 11-30.  Numbers and logical values are right-justified in the value field.
 * Strings are quoted, with at least 8 characters between the quotes, and left-justified.
 * </p>
 */
public final class HeaderRecord {

    /** The number of characters in a record. */
    public static final int LENGTH = 80;

    /** The number of characters in a keyword. */
    static final int KEYWORD_LENGTH = 8;

    /** The width of a fixed-format value field. */
    static final int VALUE_LENGTH = 20;

    /** The longest string value that can fit in a record, not counting the quotes. */
    static final int MAX_STRING_LENGTH = 68;

    /** The record that terminates a header. */
    public static final String END = pad("END");

    /** The record that fills a header block after the END record. */
    public static final String BLANK = " ".repeat(LENGTH);

    // private constructor to prevent anyone from instantiating the class.
    private HeaderRecord() {
    }

    private static String pad(String record) {
        return record.length() < LENGTH ? record + " ".repeat(LENGTH - record.length()) : record.substring(0, LENGTH);
    }

    private static String leftPad(String value, int length) {
        return value.length() < length ? " ".repeat(length - value.length()) + value : value;
    }

    private static String rightPad(String value, int length) {
        return value.length() < length ? value + " ".repeat(length - value.length()) : value;
    }

    /**
     * Checks that a keyword is permitted by the FITS standard: at most 8 characters, each an uppercase letter, a
     * digit, a hyphen, or an underscore.
     */
    static void checkKeyword(String keyword) {
        ArgumentUtil.checkNotNull(keyword, "keyword");
        if (keyword.isEmpty() || KEYWORD_LENGTH < keyword.length()) {
            throw new IllegalArgumentException("keyword must have between 1 and 8 characters: \"" + keyword + "\"");
        }
        for (int i = 0; i < keyword.length(); i++) {
            char c = keyword.charAt(i);
            if (!(('A' <= c && c <= 'Z') || ('0' <= c && c <= '9') || c == '-' || c == '_')) {
                throw new IllegalArgumentException("keyword contains an illegal character: \"" + keyword + "\"");
            }
        }
    }

    private static String valueRecord(String keyword, String valueField, String comment) {
        checkKeyword(keyword);
        ArgumentUtil.checkNotNull(comment, "comment");
        ArgumentUtil.checkAsciiText(comment, LENGTH, "comment");
        assert valueField.length() <= LENGTH - KEYWORD_LENGTH - 2 : "value field too long";

        String record = rightPad(keyword, KEYWORD_LENGTH) + "= " + valueField;
        if (!comment.isEmpty()) {
            record += " / " + comment;
        }

        // comments that don't fit are truncated
        return pad(record);
    }

    /**
     * Formats a record with a numeric value that has already been rendered.
     *
     * @param keyword
     *     The keyword.
     * @param renderedNumber
     *     The rendering of the number, such as {@code "1.0"} or {@code "32768"}.
     * @param comment
     *     The comment, which is truncated if it doesn't fit.
     *
     * @return The record.
     */
    static String numeric(String keyword, String renderedNumber, String comment) {
        assert renderedNumber.length() <= VALUE_LENGTH : "number too long: " + renderedNumber;
        return valueRecord(keyword, leftPad(renderedNumber, VALUE_LENGTH), comment);
    }

    /**
     * Formats a record with an integer value.
     *
     * @param keyword
     *     The keyword.  This must be at most 8 characters, each an uppercase letter, a digit, a hyphen, or an
     *     underscore.
     * @param value
     *     The value.
     * @param comment
     *     The comment, which is truncated if it doesn't fit.
     *
     * @return The 80-character record.
     *
     * @throws NullPointerException
     *     if {@code keyword} or {@code comment} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code keyword} is not permitted or if {@code comment} contains characters other than ASCII text.
     */
    public static String integer(String keyword, long value, String comment) {
        return numeric(keyword, Long.toString(value), comment);
    }

    /**
     * Formats a record with a real value.
     *
     * @param keyword
     *     The keyword.
     * @param value
     *     The value.  If its shortest exact rendering is longer than the 20-character value field, it is rounded to
     *     fit.
     * @param comment
     *     The comment, which is truncated if it doesn't fit.
     *
     * @return The 80-character record.
     *
     * @throws NullPointerException
     *     if {@code keyword} or {@code comment} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code keyword} is not permitted, if {@code comment} contains characters other than ASCII text, or if
     *     {@code value} is not finite.
     */
    public static String real(String keyword, double value, String comment) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("a header value must be finite");
        }
        return numeric(keyword, renderReal(value), comment);
    }

    /**
     * Renders a real number in at most 20 characters.  The shortest exact rendering is used when it fits; otherwise
     * the number is rounded to as many significant digits as fit, with an explicit exponent.
     */
    static String renderReal(double value) {
        String rendering = Double.toString(value);
        // "-d." and "E-308" take 8 characters, which leaves room for 12 more digits.
        for (int digits = 15; VALUE_LENGTH < rendering.length(); digits--) {
            rendering = String.format(Locale.ROOT, "%." + digits + "E", value);
        }
        return rendering;
    }

    /**
     * Formats a record with a logical value, {@code T} or {@code F}.
     *
     * @param keyword
     *     The keyword.
     * @param value
     *     The value.
     * @param comment
     *     The comment, which is truncated if it doesn't fit.
     *
     * @return The 80-character record.
     *
     * @throws NullPointerException
     *     if {@code keyword} or {@code comment} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code keyword} is not permitted or if {@code comment} contains characters other than ASCII text.
     */
    public static String logical(String keyword, boolean value, String comment) {
        return numeric(keyword, value ? "T" : "F", comment);
    }

    /**
     * Formats a record with a character string value.
     *
     * @param keyword
     *     The keyword.
     * @param value
     *     The value.  This must be ASCII text of at most 68 characters, counting a quote as two characters.
     * @param comment
     *     The comment, which is truncated if it doesn't fit.
     *
     * @return The 80-character record.
     *
     * @throws NullPointerException
     *     if {@code keyword}, {@code value} or {@code comment} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code keyword} is not permitted, or if {@code value} or {@code comment} is not ASCII text, or if
     *     {@code value} is too long.
     */
    public static String string(String keyword, String value, String comment) {
        ArgumentUtil.checkNotNull(value, "value");
        String escaped = value.replace("'", "''");
        ArgumentUtil.checkAsciiText(escaped, MAX_STRING_LENGTH, "value");

        // A string value has at least 8 characters between the quotes.
        return valueRecord(keyword, rightPad("'" + rightPad(escaped, 8) + "'", VALUE_LENGTH), comment);
    }

    /**
     * Formats a {@code COMMENT} record.
     *
     * @param text
     *     The text of the comment, which is truncated if it doesn't fit.
     *
     * @return The 80-character record.
     *
     * @throws NullPointerException
     *     if {@code text} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code text} contains characters other than ASCII text.
     */
    public static String comment(String text) {
        ArgumentUtil.checkNotNull(text, "text");
        ArgumentUtil.checkAsciiText(text, LENGTH, "text");
        return pad("COMMENT " + text);
    }

    /**
     * Gets the keyword of a record: its first eight characters without trailing spaces.
     *
     * @param record
     *     The record.
     *
     * @return The keyword. This is empty for a blank record.
     */
    public static String keyword(String record) {
        String keyword = record.length() < KEYWORD_LENGTH ? record : record.substring(0, KEYWORD_LENGTH);
        return keyword.stripTrailing();
    }

    /**
     * Gets whether a record has a value indicator, {@code "= "} in columns 9 and 10.
     *
     * @param record
     *     The record.
     *
     * @return {@code true}, if the record has a value; {@code false}, otherwise.
     */
    static boolean hasValue(String record) {
        return record.startsWith("= ", KEYWORD_LENGTH);
    }

    /**
     * Parses the value of a record.
     *
     * @param record
     *     The record.
     *
     * @return A {@code String} for a character string value, a {@code Boolean} for a logical value, a {@code Long}
     *     (or {@code BigInteger} if it's too large) for an integer value, a {@code BigDecimal} for a real value, or
     *     {@code null} if the record doesn't have a value.
     *
     * @throws FitsFormatException
     *     if the value can't be parsed.
     */
    static Object value(String record) throws FitsFormatException {
        if (!hasValue(record)) {
            return null;
        }
        String field = record.substring(KEYWORD_LENGTH + 2).stripLeading();
        if (field.isEmpty()) {
            return null;
        }

        if (field.charAt(0) == '\'') {
            // A quote within a string is written as two quotes.
            StringBuilder value = new StringBuilder();
            int i = 1;
            while (true) {
                if (field.length() <= i) {
                    throw new FitsFormatException("unterminated string in record \"" + record.stripTrailing() + "\"");
                }
                char c = field.charAt(i);
                if (c == '\'') {
                    if (i + 1 < field.length() && field.charAt(i + 1) == '\'') {
                        value.append('\'');
                        i += 2;
                        continue;
                    }
                    break;
                }
                value.append(c);
                i++;
            }
            return value.toString().stripTrailing();
        }

        int slash = field.indexOf('/');
        String token = (slash < 0 ? field : field.substring(0, slash)).strip();
        if (token.isEmpty()) {
            return null;
        }
        if (token.equals("T")) {
            return Boolean.TRUE;
        }
        if (token.equals("F")) {
            return Boolean.FALSE;
        }
        try {
            if (token.matches("[+-]?\\d+")) {
                BigInteger integer = new BigInteger(token);
                return integer.bitLength() < Long.SIZE ? (Object) integer.longValue() : integer;
            }
            // FORTRAN double precision uses 'D' as the exponent marker.
            return new BigDecimal(token.replace('D', 'E').replace('d', 'e'));
        } catch (NumberFormatException exception) {
            throw new FitsFormatException(
                "cannot parse value of record \"" + record.stripTrailing() + "\"",
                exception);
        }
    }
}
