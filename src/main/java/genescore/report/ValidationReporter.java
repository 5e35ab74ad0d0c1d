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

import com.google.common.annotations.VisibleForTesting;
import genescore.qc.QcReport;
import genescore.scoring.DataIssue;
import genescore.scoring.EvidenceLayer;
import genescore.sensitivity.SensitivityAnalysisResult;
import genescore.sensitivity.SensitivitySummary;
import genescore.tier.TierSummary;
import genescore.validation.ControlOutcome;
import genescore.validation.ControlValidationResult;
import genescore.validation.MissingControl;
import genescore.validation.NegativeControlResult;
import genescore.validation.PositiveControlResult;
import genescore.validation.RecallAtK;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns the individual validation results into a verdict, weight guidance and a list of caveats.
 *
 * <p>The verdict is decided top-down:</p>
 * <ol>
 *     <li>positive controls FAILED: FAIL</li>
 *     <li>positive controls INDETERMINATE: INCONCLUSIVE</li>
 *     <li>negative controls not PASSED: PARTIAL</li>
 *     <li>sensitivity not run, or not overall stable: PARTIAL</li>
 *     <li>otherwise PASS</li>
 * </ol>
 */
public class ValidationReporter {
    private static final Log log = Log.getInstance(ValidationReporter.class);

    public ValidationReport report(final QcReport qc, final TierSummary tiers, final PositiveControlResult positive,
                                   final NegativeControlResult negative, final Optional<SensitivityAnalysisResult> sensitivity) {
        return report(qc, tiers, positive, negative, sensitivity, Collections.emptyList());
    }

    /**
     * @param sensitivity empty when the sweep was skipped
     * @param dataIssues issues recorded while scoring, listed as caveats
     */
    public ValidationReport report(final QcReport qc, final TierSummary tiers, final PositiveControlResult positive,
                                   final NegativeControlResult negative, final Optional<SensitivityAnalysisResult> sensitivity,
                                   final List<DataIssue> dataIssues) {
        final Optional<SensitivitySummary> summary = sensitivity.map(SensitivityAnalysisResult::getSummary);
        final Verdict verdict = decide(positive.getOutcome(), negative.getOutcome(), summary);
        final List<WeightRecommendation> recommendations = recommend(positive, negative, summary);
        final List<String> caveats = caveats(qc, positive, negative, sensitivity, dataIssues);

        log.info("Validation verdict ", verdict, " with ", recommendations.size(), " recommendations and ", caveats.size(), " caveats");
        return new ValidationReport(verdict, qc, tiers, positive, negative, sensitivity, recommendations, caveats);
    }

    @VisibleForTesting
    static Verdict decide(final ControlOutcome positive, final ControlOutcome negative, final Optional<SensitivitySummary> sensitivity) {
        if (positive == ControlOutcome.FAILED) return Verdict.FAIL;
        if (positive == ControlOutcome.INDETERMINATE) return Verdict.INCONCLUSIVE;
        if (negative != ControlOutcome.PASSED) return Verdict.PARTIAL;
        if (!sensitivity.isPresent() || !sensitivity.get().isOverallStable()) return Verdict.PARTIAL;
        return Verdict.PASS;
    }

    @VisibleForTesting
    static List<WeightRecommendation> recommend(final PositiveControlResult positive, final NegativeControlResult negative,
                                                final Optional<SensitivitySummary> sensitivity) {
        final List<WeightRecommendation> recommendations = new ArrayList<>();

        if (positive.getOutcome() == ControlOutcome.FAILED) {
            largestDelta(positive).ifPresent(layer -> recommendations.add(new WeightRecommendation(
                    WeightRecommendation.Trigger.POSITIVE_CONTROLS_FAILED, layer, WeightRecommendation.Direction.INCREASE,
                    String.format("known genes exceed the population most in %s (mean score difference %+.3f)",
                            layer.getKey(), positive.getLayerScoreDeltas().get(layer).getAsDouble()))));
        }
        if (negative.getOutcome() == ControlOutcome.FAILED) {
            largestDelta(negative).ifPresent(layer -> recommendations.add(new WeightRecommendation(
                    WeightRecommendation.Trigger.NEGATIVE_CONTROLS_FAILED, layer, WeightRecommendation.Direction.DECREASE,
                    String.format("%s elevates housekeeping genes the most (mean score difference %+.3f)",
                            layer.getKey(), negative.getLayerScoreDeltas().get(layer).getAsDouble()))));
        }
        if (sensitivity.isPresent() && sensitivity.get().getUnstableCount() > 0) {
            final SensitivitySummary summary = sensitivity.get();
            summary.getMostSensitiveLayer().ifPresent(layer -> recommendations.add(new WeightRecommendation(
                    WeightRecommendation.Trigger.SENSITIVITY_UNSTABLE, layer, WeightRecommendation.Direction.DECREASE,
                    String.format("%s is the most sensitive layer (mean rho %.4f) across %d unstable perturbations",
                            layer.getKey(), summary.getMeanRhoByLayer().get(layer).getAsDouble(), summary.getUnstableCount()))));
        }
        return recommendations;
    }

    /** The layer in which the controls most exceed the population; first in layer order on ties. */
    private static Optional<EvidenceLayer> largestDelta(final ControlValidationResult result) {
        EvidenceLayer best = null;
        double bestDelta = 0;
        for (final Map.Entry<EvidenceLayer, OptionalDouble> entry : result.getLayerScoreDeltas().entrySet()) {
            if (!entry.getValue().isPresent()) continue;
            if (best == null || entry.getValue().getAsDouble() > bestDelta) {
                best = entry.getKey();
                bestDelta = entry.getValue().getAsDouble();
            }
        }
        return Optional.ofNullable(best);
    }

    private static List<String> caveats(final QcReport qc, final PositiveControlResult positive, final NegativeControlResult negative,
                                        final Optional<SensitivityAnalysisResult> sensitivity, final List<DataIssue> dataIssues) {
        final List<String> caveats = new ArrayList<>();
        for (final DataIssue issue : dataIssues) {
            caveats.add("Data issue: " + issue);
        }
        for (final String error : qc.getErrors()) {
            caveats.add("QC error: " + error);
        }
        for (final String warning : qc.getWarnings()) {
            caveats.add("QC warning: " + warning);
        }
        for (final ControlValidationResult result : new ControlValidationResult[]{positive, negative}) {
            final String role = result == positive ? "Positive" : "Negative";
            for (final MissingControl missing : result.getMissingControls()) {
                caveats.add("Data issue: " + new DataIssue(DataIssue.Kind.MISSING_CONTROL_GENE, null, missing.getSymbol(),
                        role.toLowerCase() + " control not ranked, " + missing.getReason()));
            }
            if (result.getOutcome() == ControlOutcome.INDETERMINATE) {
                caveats.add(role + " controls indeterminate: no control gene was found in the scored population");
            }
        }
        for (final RecallAtK recall : positive.getRecall()) {
            if (!recall.getRecall().isPresent()) {
                caveats.add("Recall@" + recall.getLabel() + " undefined: no known gene present");
                break;
            }
        }
        if (!sensitivity.isPresent()) {
            caveats.add("Sensitivity analysis was not run; ranking stability is unverified");
        } else {
            final SensitivitySummary summary = sensitivity.get().getSummary();
            if (summary.getIndeterminateCount() > 0) {
                caveats.add(String.format("%d perturbations had a top-%d overlap below %d or undefined correlation; rho not computed",
                        summary.getIndeterminateCount(), sensitivity.get().getParameters().getTopN(),
                        sensitivity.get().getParameters().getMinOverlap()));
            }
            caveats.add("Spearman p-values are asymptotic approximations and are advisory only");
        }
        return caveats;
    }
}
