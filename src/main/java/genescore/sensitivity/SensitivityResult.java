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

import genescore.scoring.EvidenceLayer;
import genescore.scoring.ScoringWeights;

import java.util.OptionalDouble;

/**
 * Outcome of perturbing one layer's weight by one delta.
 */
public final class SensitivityResult {
    private final EvidenceLayer layer;
    private final double delta;
    private final ScoringWeights perturbedWeights;
    private final int overlap;
    private final OptionalDouble rho;
    private final OptionalDouble pValue;
    private final Stability stability;

    public SensitivityResult(final EvidenceLayer layer, final double delta, final ScoringWeights perturbedWeights, final int overlap,
                             final OptionalDouble rho, final OptionalDouble pValue, final Stability stability) {
        this.layer = layer;
        this.delta = delta;
        this.perturbedWeights = perturbedWeights;
        this.overlap = overlap;
        this.rho = rho;
        this.pValue = pValue;
        this.stability = stability;
    }

    public EvidenceLayer getLayer() {
        return layer;
    }

    public double getDelta() {
        return delta;
    }

    public ScoringWeights getPerturbedWeights() {
        return perturbedWeights;
    }

    /** Genes in both the baseline and the perturbed top N. */
    public int getOverlap() {
        return overlap;
    }

    /** Empty when the overlap was below the minimum or the correlation was undefined. */
    public OptionalDouble getRho() {
        return rho;
    }

    public OptionalDouble getPValue() {
        return pValue;
    }

    public Stability getStability() {
        return stability;
    }
}
