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

import com.google.common.collect.ImmutableList;
import genescore.ConfigurationException;

import java.util.List;

/**
 * Pass criteria and recall cutoffs for control validation.
 */
public final class ControlValidationParameters {
    public static final ControlValidationParameters DEFAULT = new ControlValidationParameters(0.75, 0.50, 0.75,
            ImmutableList.of(100, 500, 1000, 2000), ImmutableList.of(5.0, 10.0, 20.0));

    private final double positiveMinMedianPercentile;
    private final double negativeMaxMedianPercentile;
    private final double topQuartilePercentile;
    private final ImmutableList<Integer> recallKAbsolute;
    private final ImmutableList<Double> recallKPercent;

    /**
     * @param positiveMinMedianPercentile positive controls pass when their median percentile is at least this
     * @param negativeMaxMedianPercentile negative controls pass when their median percentile is below this
     * @param topQuartilePercentile genes at or above this percentile count as top quartile
     * @param recallKAbsolute fixed top-k cutoffs, in increasing order
     * @param recallKPercent top-k cutoffs as percentages of the population, in increasing order
     */
    public ControlValidationParameters(final double positiveMinMedianPercentile,
                                       final double negativeMaxMedianPercentile,
                                       final double topQuartilePercentile,
                                       final List<Integer> recallKAbsolute,
                                       final List<Double> recallKPercent) {
        checkFraction("controls.positive.min_median_percentile", positiveMinMedianPercentile);
        checkFraction("controls.negative.max_median_percentile", negativeMaxMedianPercentile);
        checkFraction("controls.top_quartile_percentile", topQuartilePercentile);
        for (final Integer k : recallKAbsolute) {
            if (k == null || k < 1) throw new ConfigurationException("controls.recall.k_absolute values must be positive but got " + k);
        }
        for (final Double p : recallKPercent) {
            if (p == null || !(p > 0 && p <= 100)) {
                throw new ConfigurationException("controls.recall.k_percent values must be in (0,100] but got " + p);
            }
        }
        this.positiveMinMedianPercentile = positiveMinMedianPercentile;
        this.negativeMaxMedianPercentile = negativeMaxMedianPercentile;
        this.topQuartilePercentile = topQuartilePercentile;
        this.recallKAbsolute = ImmutableList.sortedCopyOf(recallKAbsolute);
        this.recallKPercent = ImmutableList.sortedCopyOf(recallKPercent);
    }

    private static void checkFraction(final String key, final double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new ConfigurationException(String.format("%s must be in [0,1] but was %s", key, value));
        }
    }

    public double getPositiveMinMedianPercentile() {
        return positiveMinMedianPercentile;
    }

    public double getNegativeMaxMedianPercentile() {
        return negativeMaxMedianPercentile;
    }

    public double getTopQuartilePercentile() {
        return topQuartilePercentile;
    }

    public ImmutableList<Integer> getRecallKAbsolute() {
        return recallKAbsolute;
    }

    public ImmutableList<Double> getRecallKPercent() {
        return recallKPercent;
    }
}
