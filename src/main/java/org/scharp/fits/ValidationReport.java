///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered results of validating a FITS stream with {@link FormatValidator}.
 */
public final class ValidationReport {

    private final List<CheckResult> results;

    ValidationReport(List<CheckResult> results) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    /**
     * Gets the results of every check: the block test, then the header block test of each HDU, then the ASCII test
     * of each HDU, then the keyword test of each HDU.
     *
     * @return An unmodifiable list of results.
     */
    public List<CheckResult> results() {
        return results;
    }

    /**
     * Gets whether each check passed, in the same order as {@link #results()}.
     *
     * @return An unmodifiable list of outcomes.
     */
    public List<Boolean> outcomes() {
        List<Boolean> outcomes = new ArrayList<>(results.size());
        for (CheckResult result : results) {
            outcomes.add(result.passed());
        }
        return Collections.unmodifiableList(outcomes);
    }

    /**
     * @return {@code true}, if every check passed; {@code false}, otherwise.
     */
    public boolean passed() {
        for (CheckResult result : results) {
            if (!result.passed()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (CheckResult result : results) {
            builder.append(result.diagnostic()).append('\n');
        }
        return builder.toString();
    }
}
