///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ArgumentUtil() {
    }

    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Determines whether a string is composed entirely of the restricted set of ASCII text characters, decimal 32
     * through 126.
     *
     * @param text
     *     The string to check.
     *
     * @return {@code true}, if every character of {@code text} is ASCII text; {@code false}, otherwise.
     */
    static boolean isAsciiText(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 32 || 126 < c) {
                return false;
            }
        }
        return true;
    }

    /**
     * Throws an exception if {@code argument} contains any character outside of the restricted set of ASCII text
     * characters or if it is longer than a given number of characters.
     *
     * @param argument
     *     The string to check
     * @param maximumLength
     *     The maximum number of characters that {@code argument} may have.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is not ASCII text or is longer than {@code maximumLength}.
     */
    static void checkAsciiText(String argument, int maximumLength, String argumentName) {
        assert 0 <= maximumLength : "maximumLength must not be negative";
        assert argumentName != null : "argumentName must not be null";

        if (!isAsciiText(argument)) {
            throw new IllegalArgumentException(argumentName + " must only contain ASCII text characters");
        }
        if (maximumLength < argument.length()) {
            if (maximumLength == 1) {
                throw new IllegalArgumentException(
                    argumentName + " must not be longer than " + maximumLength + " character");
            } else {
                throw new IllegalArgumentException(
                    argumentName + " must not be longer than " + maximumLength + " characters");
            }
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(int argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }
}
