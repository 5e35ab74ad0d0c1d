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

package genescore.report;

import com.google.common.collect.ImmutableList;
import genescore.qc.QcReport;
import genescore.sensitivity.SensitivityAnalysisResult;
import genescore.tier.TierSummary;
import genescore.validation.NegativeControlResult;
import genescore.validation.PositiveControlResult;

import java.util.List;
import java.util.Optional;

/**
 * Everything the validation run found, with the verdict, recommendations and caveats derived from it.
 */
public final class ValidationReport {
    private final Verdict verdict;
    private final QcReport qc;
    private final TierSummary tiers;
    private final PositiveControlResult positive;
    private final NegativeControlResult negative;
    private final Optional<SensitivityAnalysisResult> sensitivity;
    private final ImmutableList<WeightRecommendation> recommendations;
    private final ImmutableList<String> caveats;

    ValidationReport(final Verdict verdict, final QcReport qc, final TierSummary tiers, final PositiveControlResult positive,
                     final NegativeControlResult negative, final Optional<SensitivityAnalysisResult> sensitivity,
                     final List<WeightRecommendation> recommendations, final List<String> caveats) {
        this.verdict = verdict;
        this.qc = qc;
        this.tiers = tiers;
        this.positive = positive;
        this.negative = negative;
        this.sensitivity = sensitivity;
        this.recommendations = ImmutableList.copyOf(recommendations);
        this.caveats = ImmutableList.copyOf(caveats);
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public QcReport getQc() {
        return qc;
    }

    public TierSummary getTiers() {
        return tiers;
    }

    public PositiveControlResult getPositive() {
        return positive;
    }

    public NegativeControlResult getNegative() {
        return negative;
    }

    /** Empty when the sensitivity sweep was not run. */
    public Optional<SensitivityAnalysisResult> getSensitivity() {
        return sensitivity;
    }

    public ImmutableList<WeightRecommendation> getRecommendations() {
        return recommendations;
    }

    public ImmutableList<String> getCaveats() {
        return caveats;
    }
}
