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

package genescore.qc;

import genescore.util.MathUtil;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Optional;

/**
 * Summary statistics of a set of values. The standard deviation is the population one; percentiles use linear
 * interpolation between closest ranks.
 */
public final class DistributionStats {
    private final int count;
    private final double mean;
    private final double median;
    private final double std;
    private final double min;
    private final double max;
    private final double p10;
    private final double p25;
    private final double p75;
    private final double p90;

    private DistributionStats(final double[] values) {
        this.count = values.length;
        this.mean = MathUtil.mean(values);
        this.median = MathUtil.median(values);
        this.std = MathUtil.stddev(values);
        this.min = MathUtil.min(values);
        this.max = MathUtil.max(values);

        final Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        this.p10 = percentile.evaluate(10);
        this.p25 = percentile.evaluate(25);
        this.p75 = percentile.evaluate(75);
        this.p90 = percentile.evaluate(90);
    }

    /** @return empty for an empty array */
    public static Optional<DistributionStats> of(final double[] values) {
        return values.length == 0 ? Optional.empty() : Optional.of(new DistributionStats(values));
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStd() {
        return std;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getP10() {
        return p10;
    }

    public double getP25() {
        return p25;
    }

    public double getP50() {
        return median;
    }

    public double getP75() {
        return p75;
    }

    public double getP90() {
        return p90;
    }
}
