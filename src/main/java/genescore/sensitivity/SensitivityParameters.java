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

import com.google.common.collect.ImmutableList;
import genescore.ConfigurationException;

import java.util.List;

/**
 * Settings of the weight perturbation sweep.
 */
public final class SensitivityParameters {
    public static final int MIN_ALLOWED_OVERLAP = 3;

    public static final SensitivityParameters DEFAULT =
            new SensitivityParameters(ImmutableList.of(-0.10, -0.05, 0.05, 0.10), 100, 10, 0.85);

    private final ImmutableList<Double> deltas;
    private final int topN;
    private final int minOverlap;
    private final double stabilityThreshold;

    /**
     * @param deltas amounts added to a layer's weight before renormalizing; each finite with magnitude below 1
     * @param topN number of top genes compared between baseline and perturbed rankings
     * @param minOverlap smallest top-N intersection for which a correlation is computed, at least 3
     * @param stabilityThreshold rho at or above which a perturbation is stable, in (-1,1]
     */
    public SensitivityParameters(final List<Double> deltas, final int topN, final int minOverlap, final double stabilityThreshold) {
        if (deltas == null || deltas.isEmpty()) {
            throw new ConfigurationException("sensitivity.deltas must contain at least one value");
        }
        for (final Double delta : deltas) {
            if (delta == null || !Double.isFinite(delta) || Math.abs(delta) >= 1) {
                throw new ConfigurationException("sensitivity.deltas values must be finite with magnitude below 1 but got " + delta);
            }
        }
        if (topN < 1) {
            throw new ConfigurationException("sensitivity.top_n must be at least 1 but was " + topN);
        }
        if (minOverlap < MIN_ALLOWED_OVERLAP) {
            throw new ConfigurationException("sensitivity.min_overlap must be at least " + MIN_ALLOWED_OVERLAP + " but was " + minOverlap);
        }
        if (!(stabilityThreshold > -1 && stabilityThreshold <= 1)) {
            throw new ConfigurationException("sensitivity.stability_threshold must be in (-1,1] but was " + stabilityThreshold);
        }
        this.deltas = ImmutableList.copyOf(deltas);
        this.topN = topN;
        this.minOverlap = minOverlap;
        this.stabilityThreshold = stabilityThreshold;
    }

    public SensitivityParameters withDeltas(final List<Double> newDeltas) {
        return new SensitivityParameters(newDeltas, topN, minOverlap, stabilityThreshold);
    }

    public SensitivityParameters withTopN(final int newTopN) {
        return new SensitivityParameters(deltas, newTopN, minOverlap, stabilityThreshold);
    }

    public ImmutableList<Double> getDeltas() {
        return deltas;
    }

    public int getTopN() {
        return topN;
    }

    public int getMinOverlap() {
        return minOverlap;
    }

    public double getStabilityThreshold() {
        return stabilityThreshold;
    }
}
