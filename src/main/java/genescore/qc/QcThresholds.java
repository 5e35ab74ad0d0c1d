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

import genescore.ConfigurationException;

/**
 * Limits used by {@link QualityControl}.
 */
public final class QcThresholds {
    public static final QcThresholds DEFAULT = new QcThresholds(0.5, 0.8, 0.01, 3.0);

    private final double missingWarnRate;
    private final double missingErrorRate;
    private final double minStd;
    private final double madMultiplier;

    public QcThresholds(final double missingWarnRate, final double missingErrorRate, final double minStd, final double madMultiplier) {
        if (!(missingWarnRate >= 0 && missingWarnRate <= 1) || !(missingErrorRate >= 0 && missingErrorRate <= 1)) {
            throw new ConfigurationException(String.format("qc.missing rates must be in [0,1] but were %s and %s", missingWarnRate, missingErrorRate));
        }
        if (missingWarnRate > missingErrorRate) {
            throw new ConfigurationException(String.format("qc.missing.warn_rate (%s) must not exceed qc.missing.error_rate (%s)", missingWarnRate, missingErrorRate));
        }
        if (!(minStd >= 0) || Double.isInfinite(minStd)) {
            throw new ConfigurationException("qc.min_std must be a non-negative number but was " + minStd);
        }
        if (!(madMultiplier > 0) || Double.isInfinite(madMultiplier)) {
            throw new ConfigurationException("qc.outlier.mad_multiplier must be positive but was " + madMultiplier);
        }
        this.missingWarnRate = missingWarnRate;
        this.missingErrorRate = missingErrorRate;
        this.minStd = minStd;
        this.madMultiplier = madMultiplier;
    }

    public double getMissingWarnRate() {
        return missingWarnRate;
    }

    public double getMissingErrorRate() {
        return missingErrorRate;
    }

    public double getMinStd() {
        return minStd;
    }

    public double getMadMultiplier() {
        return madMultiplier;
    }
}
