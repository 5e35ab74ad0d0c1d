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

import genescore.GeneScoreException;
import genescore.qc.DistributionStats;
import genescore.qc.LayerQcMetrics;
import genescore.qc.QcReport;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.QualityFlag;
import genescore.sensitivity.SensitivityAnalysisResult;
import genescore.sensitivity.SensitivityResult;
import genescore.sensitivity.SensitivitySummary;
import genescore.tier.Tier;
import genescore.tier.TierSummary;
import genescore.validation.ControlValidationResult;
import genescore.validation.NegativeControlResult;
import genescore.validation.PositiveControlResult;
import genescore.validation.RankedGene;
import genescore.validation.RecallAtK;
import genescore.validation.SourceBreakdown;
import htsjdk.samtools.util.IOUtil;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Renders a {@link ValidationReport} as a Markdown document.
 */
public class MarkdownReportWriter {
    /** Number of control genes listed in each detail table. */
    public static final int CONTROL_DETAIL_ROWS = 20;

    private static final String NA = "N/A";

    private final String configurationFingerprint;

    /**
     * @param configurationFingerprint identifies the effective configuration; may be null
     */
    public MarkdownReportWriter(final String configurationFingerprint) {
        this.configurationFingerprint = configurationFingerprint;
    }

    public void write(final ValidationReport report, final File output) {
        IOUtil.assertFileIsWritable(output);
        try (final Writer writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            writer.write(render(report));
        } catch (final IOException e) {
            throw new GeneScoreException("Error writing validation report to " + output, e);
        }
    }

    public String render(final ValidationReport report) {
        final StringBuilder md = new StringBuilder();
        md.append("# Validation Report\n\n");
        md.append("**Verdict:** ").append(report.getVerdict()).append("\n\n");
        if (configurationFingerprint != null) {
            md.append("Configuration fingerprint: `").append(configurationFingerprint).append("`\n\n");
        }

        renderQc(md, report.getQc());
        renderTiers(md, report.getTiers());
        renderPositive(md, report.getPositive());
        renderNegative(md, report.getNegative());
        renderSensitivity(md, report);
        renderRecommendations(md, report);

        md.append("## Caveats\n\n");
        if (report.getCaveats().isEmpty()) {
            md.append("None.\n");
        } else {
            for (final String caveat : report.getCaveats()) {
                md.append("- ").append(caveat).append('\n');
            }
        }
        return md.toString();
    }

    private static void renderQc(final StringBuilder md, final QcReport qc) {
        md.append("## Quality Control\n\n");
        md.append("**Status:** ").append(qc.passed() ? "PASSED" : "FAILED").append("\n\n");
        md.append("| Layer | Missing rate | Count | Mean | Median | Std | Min | Max | Outliers |\n");
        md.append("|-------|--------------|-------|------|--------|-----|-----|-----|----------|\n");
        for (final LayerQcMetrics layer : qc.getLayers().values()) {
            final DistributionStats d = layer.getDistribution().orElse(null);
            md.append(String.format("| %s | %s | %s | %s | %s | %s | %s | %s | %s |\n",
                    layer.getLayer().getKey(),
                    layer.getMissingRate().isPresent() ? String.format("%.3f", layer.getMissingRate().getAsDouble()) : NA,
                    d == null ? "0" : String.valueOf(d.getCount()),
                    d == null ? NA : fmt(d.getMean()), d == null ? NA : fmt(d.getMedian()), d == null ? NA : fmt(d.getStd()),
                    d == null ? NA : fmt(d.getMin()), d == null ? NA : fmt(d.getMax()),
                    layer.getOutliers().isPerformed() ? String.valueOf(layer.getOutliers().getCount()) : NA));
        }
        md.append('\n');

        final DistributionStats c = qc.getCompositeDistribution().orElse(null);
        md.append(String.format("Composite score: %d genes, %d with a score", qc.getTotalGenes(), qc.getCompositeNonNullCount()));
        if (c != null) {
            md.append(String.format("; mean %s, median %s, std %s, range [%s, %s]; p10 %s, p25 %s, p50 %s, p75 %s, p90 %s",
                    fmt(c.getMean()), fmt(c.getMedian()), fmt(c.getStd()), fmt(c.getMin()), fmt(c.getMax()),
                    fmt(c.getP10()), fmt(c.getP25()), fmt(c.getP50()), fmt(c.getP75()), fmt(c.getP90())));
        }
        md.append(".\n\n");
    }

    private static void renderTiers(final StringBuilder md, final TierSummary tiers) {
        md.append("## Tiers\n\n");
        md.append("| Tier | Genes |");
        for (final QualityFlag flag : QualityFlag.values()) md.append(' ').append(flag).append(" |");
        md.append("\n|------|-------|");
        for (int i = 0; i < QualityFlag.values().length; ++i) md.append("------|");
        md.append('\n');
        for (final Tier tier : Tier.values()) {
            md.append("| ").append(tier).append(" | ").append(tiers.getCount(tier)).append(" |");
            for (final QualityFlag flag : QualityFlag.values()) md.append(' ').append(tiers.getCount(tier, flag)).append(" |");
            md.append('\n');
        }
        md.append('\n');
    }

    private static void renderPositive(final StringBuilder md, final PositiveControlResult positive) {
        md.append("## Positive Controls\n\n");
        renderControlSummary(md, positive);

        md.append("| Top k | k | Found | Recall |\n");
        md.append("|-------|---|-------|--------|\n");
        for (final RecallAtK recall : positive.getRecall()) {
            md.append(String.format("| %s | %d | %d/%d | %s |\n", recall.getLabel(), recall.getK(), recall.getFoundInTopK(),
                    recall.getKnownPresent(), pct(recall.getRecall())));
        }
        md.append('\n');

        if (!positive.getSourceBreakdown().isEmpty()) {
            md.append("| Source | Expected | Found | Median percentile | Top quartile |");
            final List<RecallAtK> labels = positive.getSourceBreakdown().get(0).getRecall();
            for (final RecallAtK recall : labels) md.append(" Recall@").append(recall.getLabel()).append(" |");
            md.append("\n|--------|----------|-------|-------------------|--------------|");
            for (int i = 0; i < labels.size(); ++i) md.append("------|");
            md.append('\n');
            for (final SourceBreakdown source : positive.getSourceBreakdown()) {
                md.append(String.format("| %s | %d | %d | %s | %d |", source.getSource(), source.getExpected(), source.getFound(),
                        pct(source.getMedianPercentile()), source.getTopQuartileCount()));
                for (final RecallAtK recall : source.getRecall()) md.append(' ').append(pct(recall.getRecall())).append(" |");
                md.append('\n');
            }
            md.append('\n');
        }

        renderControlDetail(md, positive.getFoundControls());
    }

    private static void renderNegative(final StringBuilder md, final NegativeControlResult negative) {
        md.append("## Negative Controls\n\n");
        renderControlSummary(md, negative);
        md.append("- HIGH tier count: ").append(negative.getHighTierCount()).append("\n\n");

        final List<RankedGene> lowestFirst = new ArrayList<>(negative.getFoundControls());
        Collections.reverse(lowestFirst);
        renderControlDetail(md, lowestFirst);
    }

    private static void renderControlSummary(final StringBuilder md, final ControlValidationResult result) {
        md.append("**Status:** ").append(result.getOutcome()).append("\n\n");
        md.append("- Control set: ").append(result.getControlSet().getName()).append('\n');
        md.append("- Expected: ").append(result.getExpected()).append(", found: ").append(result.getFound()).append('\n');
        md.append("- Median percentile: ").append(pct(result.getMedianPercentile())).append('\n');
        md.append("- Top quartile: ").append(result.getTopQuartileCount())
                .append(" (").append(pct(result.getTopQuartileFraction())).append(")\n");
        if (!result.getMissingControls().isEmpty()) {
            md.append("- Not ranked: ");
            final List<String> missing = new ArrayList<>();
            result.getMissingControls().forEach(m -> missing.add(m.toString()));
            md.append(String.join(", ", missing)).append('\n');
        }
        md.append('\n');
    }

    private static void renderControlDetail(final StringBuilder md, final List<RankedGene> genes) {
        if (genes.isEmpty()) return;
        md.append("| Symbol | Gene ID | Score | Percentile | Evidence |\n");
        md.append("|--------|---------|-------|------------|----------|\n");
        for (final RankedGene gene : genes.subList(0, Math.min(CONTROL_DETAIL_ROWS, genes.size()))) {
            md.append(String.format("| %s | %s | %s | %s | %d |\n", gene.getSymbol(), gene.getGeneId(), fmt(gene.getScore()),
                    pct(OptionalDouble.of(gene.getPercentile())), gene.getRecord().getEvidenceCount()));
        }
        md.append('\n');
    }

    private static void renderSensitivity(final StringBuilder md, final ValidationReport report) {
        md.append("## Sensitivity Analysis\n\n");
        if (!report.getSensitivity().isPresent()) {
            md.append("Not run.\n\n");
            return;
        }
        final SensitivityAnalysisResult sensitivity = report.getSensitivity().get();
        final SensitivitySummary summary = sensitivity.getSummary();
        md.append("**Status:** ").append(summary.isOverallStable() ? "STABLE" : "NOT STABLE").append("\n\n");
        md.append(String.format("- Baseline weights: %s\n", sensitivity.getBaselineWeights()));
        md.append(String.format("- Top N: %d, minimum overlap: %d, stability threshold: %.2f\n",
                sensitivity.getParameters().getTopN(), sensitivity.getParameters().getMinOverlap(),
                sensitivity.getParameters().getStabilityThreshold()));
        md.append(String.format("- Stable: %d, unstable: %d, indeterminate: %d\n",
                summary.getStableCount(), summary.getUnstableCount(), summary.getIndeterminateCount()));
        md.append(String.format("- Rho min / mean / max: %s / %s / %s\n",
                fmt(summary.getMinRho()), fmt(summary.getMeanRho()), fmt(summary.getMaxRho())));
        md.append("- Most sensitive layer: ").append(summary.getMostSensitiveLayer().map(EvidenceLayer::getKey).orElse(NA)).append('\n');
        md.append("- Most robust layer: ").append(summary.getMostRobustLayer().map(EvidenceLayer::getKey).orElse(NA)).append("\n\n");

        md.append("| Layer | Delta | Perturbed weight | Overlap | Spearman rho | p-value | Stability |\n");
        md.append("|-------|-------|------------------|---------|--------------|---------|-----------|\n");
        for (final SensitivityResult result : sensitivity.getResults()) {
            md.append(String.format("| %s | %+.2f | %.4f | %d | %s | %s | %s |\n", result.getLayer().getKey(), result.getDelta(),
                    result.getPerturbedWeights().get(result.getLayer()), result.getOverlap(), fmt(result.getRho()),
                    result.getPValue().isPresent() ? String.format("%.3g", result.getPValue().getAsDouble()) : NA,
                    result.getStability()));
        }
        md.append('\n');
    }

    private static void renderRecommendations(final StringBuilder md, final ValidationReport report) {
        md.append("## Weight Tuning Recommendations\n\n");
        if (report.getRecommendations().isEmpty()) {
            md.append("No weight changes suggested.\n\n");
            return;
        }
        for (final WeightRecommendation recommendation : report.getRecommendations()) {
            md.append(String.format("- **%s %s** (%s): %s. Requires independent re-validation.\n",
                    recommendation.getDirection(), recommendation.getLayer().getKey(), recommendation.getTrigger(),
                    recommendation.getRationale()));
        }
        md.append("\n> **WARNING:** ").append(WeightRecommendation.CIRCULAR_VALIDATION_WARNING).append("\n\n");
    }

    private static String fmt(final double value) {
        return String.format("%.4f", value);
    }

    private static String fmt(final OptionalDouble value) {
        return value.isPresent() ? fmt(value.getAsDouble()) : NA;
    }

    private static String pct(final OptionalDouble value) {
        return value.isPresent() ? String.format("%.1f%%", 100 * value.getAsDouble()) : NA;
    }
}
