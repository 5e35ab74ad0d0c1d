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
import genescore.scoring.ScoringWeights;

import java.util.List;

/**
 * Every perturbation result, in layer-then-delta order, with the summary over them.
 */
public final class SensitivityAnalysisResult {
    private final ScoringWeights baselineWeights;
    private final SensitivityParameters parameters;
    private final int baselineTopN;
    private final ImmutableList<SensitivityResult> results;
    private final SensitivitySummary summary;

    public SensitivityAnalysisResult(final ScoringWeights baselineWeights, final SensitivityParameters parameters, final int baselineTopN,
                                     final List<SensitivityResult> results) {
        this.baselineWeights = baselineWeights;
        this.parameters = parameters;
        this.baselineTopN = baselineTopN;
        this.results = ImmutableList.copyOf(results);
        this.summary = new SensitivitySummary(results);
    }

    public ScoringWeights getBaselineWeights() {
        return baselineWeights;
    }

    public SensitivityParameters getParameters() {
        return parameters;
    }

    /** Size of the baseline top-N, smaller than N when fewer genes are scored. */
    public int getBaselineTopN() {
        return baselineTopN;
    }

    public ImmutableList<SensitivityResult> getResults() {
        return results;
    }

    public SensitivitySummary getSummary() {
        return summary;
    }
}
