/*
 * The MIT License
 *
 * Copyright (c) 2025 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package genescore.validation;

import htsjdk.samtools.metrics.MetricBase;

import java.util.OptionalDouble;

/**
 * Summary of one control-set check against the percentile-ranked population.
 */
public class ControlValidationMetrics extends MetricBase {
    /** Name of the control set. */
    public String CONTROL_SET;
    /** Whether the controls are expected to rank high (POSITIVE) or low (NEGATIVE). */
    public ControlRole ROLE;
    /** Number of canonical genes with a composite score. */
    public int POPULATION_SIZE;
    /** Number of control symbols in the set. */
    public int EXPECTED;
    /** Control symbols found among the scored genes. */
    public int FOUND;
    /** Control symbols not in the universe or without a score. */
    public int MISSING;
    /** Median percentile of the found controls; empty when none were found. */
    public Double MEDIAN_PERCENTILE;
    /** Found controls at or above the top-quartile percentile. */
    public int TOP_QUARTILE_COUNT;
    /** TOP_QUARTILE_COUNT / FOUND; empty when none were found. */
    public Double TOP_QUARTILE_FRACTION;
    /** Found controls classified HIGH; only reported for negative controls. */
    public Integer HIGH_TIER_COUNT;
    public ControlOutcome OUTCOME;

    public static ControlValidationMetrics of(final ControlValidationResult result) {
        final ControlValidationMetrics metrics = new ControlValidationMetrics();
        metrics.CONTROL_SET = result.getControlSet().getName();
        metrics.ROLE = result.getControlSet().getRole();
        metrics.POPULATION_SIZE = result.getPopulationSize();
        metrics.EXPECTED = result.getExpected();
        metrics.FOUND = result.getFound();
        metrics.MISSING = result.getMissingControls().size();
        metrics.MEDIAN_PERCENTILE = orNull(result.getMedianPercentile());
        metrics.TOP_QUARTILE_COUNT = result.getTopQuartileCount();
        metrics.TOP_QUARTILE_FRACTION = orNull(result.getTopQuartileFraction());
        if (result instanceof NegativeControlResult) {
            metrics.HIGH_TIER_COUNT = ((NegativeControlResult) result).getHighTierCount();
        }
        metrics.OUTCOME = result.getOutcome();
        return metrics;
    }

    static Double orNull(final OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
