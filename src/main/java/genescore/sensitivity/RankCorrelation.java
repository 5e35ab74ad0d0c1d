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

package genescore.sensitivity;

import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;

import java.util.Optional;

/**
 * Spearman rank correlation with its two-sided p-value from the t distribution with n-2 degrees of freedom. The
 * p-value is an asymptotic approximation and is unreliable for small samples; it is reported, never used to decide.
 */
public final class RankCorrelation {
    private final double rho;
    private final double pValue;
    private final int n;

    private RankCorrelation(final double rho, final double pValue, final int n) {
        this.rho = rho;
        this.pValue = pValue;
        this.n = n;
    }

    /**
     * @return empty when there are fewer than three pairs or the correlation is undefined (a constant vector)
     */
    public static Optional<RankCorrelation> spearman(final double[] x, final double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Vectors differ in length: " + x.length + " vs " + y.length);
        }
        final int n = x.length;
        if (n < 3) return Optional.empty();

        final double rho = new SpearmansCorrelation().correlation(x, y);
        if (!Double.isFinite(rho)) return Optional.empty();

        final double pValue;
        if (Math.abs(rho) >= 1.0) {
            pValue = 0.0;
        } else {
            final double t = rho * Math.sqrt((n - 2) / (1 - rho * rho));
            final TDistribution distribution = new TDistribution(n - 2);
            pValue = Math.min(1.0, 2 * distribution.cumulativeProbability(-Math.abs(t)));
        }
        return Optional.of(new RankCorrelation(rho, pValue, n));
    }

    public double getRho() {
        return rho;
    }

    public double getPValue() {
        return pValue;
    }

    public int getN() {
        return n;
    }
}
