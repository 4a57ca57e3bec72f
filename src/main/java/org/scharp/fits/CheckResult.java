///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Objects;

/**
 * The outcome of one structural check made by {@link FormatValidator}.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class CheckResult {

    /**
     * The structural checks, in the order in which their results are reported.
     */
    public enum Check {
        /** The stream is a whole number of 2880-byte blocks. */
        BLOCK,

        /** A header is a whole number of 36-record blocks. */
        HEADER_BLOCK,

        /** A header contains only ASCII text characters. */
        ASCII,

        /** A header's mandatory keywords are present and in order. */
        KEYWORD,
    }

    private final Check check;
    private final int hduIndex;
    private final boolean passed;
    private final String diagnostic;

    CheckResult(Check check, int hduIndex, boolean passed, String diagnostic) {
        assert check != null : "check must not be null";
        assert diagnostic != null : "diagnostic must not be null";
        assert (check == Check.BLOCK) == (hduIndex == 0) : "only the block check applies to the whole stream";

        this.check = check;
        this.hduIndex = hduIndex;
        this.passed = passed;
        this.diagnostic = diagnostic;
    }

    /**
     * Gets which check was made.
     *
     * @return The check.
     */
    public Check check() {
        return check;
    }

    /**
     * Gets the HDU that was checked.
     *
     * @return The 1-based index of the HDU, or 0 if the check applies to the whole stream.
     */
    public int hduIndex() {
        return hduIndex;
    }

    /**
     * @return {@code true}, if the check passed; {@code false}, otherwise.
     */
    public boolean passed() {
        return passed;
    }

    /**
     * Gets a one-line, human-readable description of the outcome.
     *
     * @return The diagnostic.
     */
    public String diagnostic() {
        return diagnostic;
    }

    @Override
    public int hashCode() {
        return Objects.hash(check, hduIndex, passed, diagnostic);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        CheckResult that = (CheckResult) other;
        return check == that.check && hduIndex == that.hduIndex && passed == that.passed &&
            diagnostic.equals(that.diagnostic);
    }

    @Override
    public String toString() {
        return diagnostic;
    }
}
