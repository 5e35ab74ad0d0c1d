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

import htsjdk.samtools.metrics.MetricBase;

/**
 * One weight perturbation of the sensitivity sweep and how much the top-ranked genes moved.
 */
public class SensitivityMetrics extends MetricBase {
    /** The perturbed evidence layer. */
    public String LAYER;
    /** Amount added to the layer's weight before renormalization. */
    public double DELTA;
    /** The layer's weight after perturbation and renormalization. */
    public double PERTURBED_WEIGHT;
    /** Genes in both the baseline and perturbed top N. */
    public int OVERLAP;
    /** Spearman correlation of the overlapping genes' scores; empty when too few overlap. */
    public Double SPEARMAN_RHO;
    /** Two-sided p-value of SPEARMAN_RHO, advisory only. */
    public Double P_VALUE;
    public Stability STABILITY;

    public static SensitivityMetrics of(final SensitivityResult result) {
        final SensitivityMetrics metrics = new SensitivityMetrics();
        metrics.LAYER = result.getLayer().getKey();
        metrics.DELTA = result.getDelta();
        metrics.PERTURBED_WEIGHT = result.getPerturbedWeights().get(result.getLayer());
        metrics.OVERLAP = result.getOverlap();
        metrics.SPEARMAN_RHO = result.getRho().isPresent() ? result.getRho().getAsDouble() : null;
        metrics.P_VALUE = result.getPValue().isPresent() ? result.getPValue().getAsDouble() : null;
        metrics.STABILITY = result.getStability();
        return metrics;
    }
}
