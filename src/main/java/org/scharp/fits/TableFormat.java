///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.HashMap;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The format of an ASCII table column, as given by its {@code TFORMn} keyword.
 *
 * <p>
 * The format is a FORTRAN-style token {@code Tw} or {@code Tw.d}, where {@code T} is the type code, {@code w} is the
 * width of the field and {@code d} is the number of digits to the right of the decimal point.  The type codes are
 * </p>
 * <ul>
 *     <li>{@code A} - character</li>
 *     <li>{@code I} - integer</li>
 *     <li>{@code F} - real number in fixed decimal notation</li>
 *     <li>{@code E} - real number in exponential notation</li>
 *     <li>{@code D} - double precision real number in exponential notation</li>
 *     <li>{@code X} - anything else</li>
 * </ul>
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a HashMap.
 * </p>
 */
public final class TableFormat {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("([AIFEDX])(\\d+)(?:\\.(\\d+))?");

    private final char typeCode;
    private final int width;
    private final int numberOfDigits;

    /**
     * Creates a new format.
     *
     * @param typeCode
     *     The type code.
     * @param width
     *     The width of the field. In a token {@code Tw.d}, this is the "w".
     * @param numberOfDigits
     *     The number of digits to the right of the decimal point. In a token {@code Tw.d}, this is the "d".  This is
     *     only written for the {@code F} type code.
     *
     * @throws IllegalArgumentException
     *     if {@code typeCode} is not a known code, or if {@code width} or {@code numberOfDigits} is negative.
     */
    public TableFormat(char typeCode, int width, int numberOfDigits) {
        if ("AIFEDX".indexOf(typeCode) < 0) {
            throw new IllegalArgumentException("unknown type code: " + typeCode);
        }
        ArgumentUtil.checkNotNegative(width, "format width");
        ArgumentUtil.checkNotNegative(numberOfDigits, "format numberOfDigits");

        this.typeCode = typeCode;
        this.width = width;
        this.numberOfDigits = numberOfDigits;
    }

    /**
     * Parses a format token such as {@code "I5"} or {@code "F8.3"}.
     *
     * @param token
     *     The token, with surrounding spaces permitted.
     *
     * @return The format.
     *
     * @throws FitsFormatException
     *     if {@code token} is not a valid format.
     */
    public static TableFormat parse(String token) throws FitsFormatException {
        ArgumentUtil.checkNotNull(token, "token");
        Matcher matcher = TOKEN_PATTERN.matcher(token.strip());
        if (!matcher.matches()) {
            throw new FitsFormatException("not a valid table column format: \"" + token + "\"");
        }
        try {
            int width = Integer.parseInt(matcher.group(2));
            int numberOfDigits = matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3));
            return new TableFormat(matcher.group(1).charAt(0), width, numberOfDigits);
        } catch (NumberFormatException exception) {
            throw new FitsFormatException("not a valid table column format: \"" + token + "\"", exception);
        }
    }

    /**
     * Gets the type code of this format.
     *
     * @return The type code.
     */
    public char typeCode() {
        return typeCode;
    }

    /**
     * Gets the width of this format.
     *
     * @return The width.
     */
    public int width() {
        return width;
    }

    /**
     * Gets this format's number of digits to the right of the decimal point.
     *
     * @return The number of digits.
     */
    public int numberOfDigits() {
        return numberOfDigits;
    }

    /**
     * Gets a hash code for this format.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return this format's hash code
     */
    @Override
    public int hashCode() {
        return Objects.hash(typeCode, width, numberOfDigits);
    }

    /**
     * Determines if this format is equal to another object.
     * <p>
     * Two formats are equal if their type code, width, and numberOfDigits are all equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this format
     *
     * @return {@code true}, if this format is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TableFormat otherFormat)) {
            return false;
        }

        return typeCode == otherFormat.typeCode &&
            width == otherFormat.width &&
            numberOfDigits == otherFormat.numberOfDigits;
    }

    /**
     * Gets this format as the token written to {@code TFORMn}.
     *
     * <p>
     * For example "I5" or "F8.3".  Only the {@code F} type code includes the number of digits.
     * </p>
     *
     * @return A string representing this format.
     */
    @Override
    public String toString() {
        return typeCode == 'F' ? "F" + width + '.' + numberOfDigits : String.valueOf(typeCode) + width;
    }
}
