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

import genescore.scoring.CompositeScoreRecord;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.LayerEvidence;
import genescore.scoring.ScoringResult;
import genescore.util.MathUtil;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Layer-level and composite-level diagnostics over a scoring pass: missing-data rates, distribution shape and
 * MAD-based outliers. Findings are advisory.
 */
public class QualityControl {
    /** LAYER value of the composite-score row in QC metrics. */
    public static final String COMPOSITE = "composite";

    private static final Log log = Log.getInstance(QualityControl.class);

    private final QcThresholds thresholds;

    public QualityControl(final QcThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public QcReport runQc(final ScoringResult scores, final Map<EvidenceLayer, LayerEvidence> evidenceByLayer) {
        final List<CompositeScoreRecord> records = scores.getRecords();
        final Set<String> universe = records.stream().map(r -> r.getGene().getGeneId()).collect(Collectors.toSet());
        final int total = records.size();

        final List<String> warnings = new ArrayList<>();
        final List<String> errors = new ArrayList<>();
        final Map<EvidenceLayer, LayerQcMetrics> layers = new EnumMap<>(EvidenceLayer.class);

        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            final List<GeneValue> present = new ArrayList<>();
            for (final CompositeScoreRecord record : records) {
                final OptionalDouble s = record.getLayerScore(layer);
                if (s.isPresent()) present.add(new GeneValue(record.getGene().getGeneId(), s.getAsDouble()));
            }

            int outOfRange = 0;
            final LayerEvidence evidence = evidenceByLayer.get(layer);
            if (evidence != null) {
                for (final Map.Entry<String, OptionalDouble> row : evidence.getScores().entrySet()) {
                    if (!universe.contains(row.getKey()) || !row.getValue().isPresent()) continue;
                    final double v = row.getValue().getAsDouble();
                    if (!Double.isFinite(v) || v < 0 || v > 1) ++outOfRange;
                }
            }

            final double[] values = present.stream().mapToDouble(GeneValue::getValue).toArray();
            final Optional<DistributionStats> distribution = DistributionStats.of(values);
            final LayerQcMetrics metrics = new LayerQcMetrics(layer, total, total - present.size(), outOfRange,
                    distribution, detectOutliers(present));
            layers.put(layer, metrics);

            // no rate for an empty universe
            final double missingRate = metrics.getMissingRate().orElse(0);
            if (missingRate > thresholds.getMissingErrorRate()) {
                errors.add(String.format("Layer %s: missing rate %.3f exceeds %.2f", layer.getKey(), missingRate, thresholds.getMissingErrorRate()));
            } else if (missingRate > thresholds.getMissingWarnRate()) {
                warnings.add(String.format("Layer %s: missing rate %.3f exceeds %.2f", layer.getKey(), missingRate, thresholds.getMissingWarnRate()));
            }
            if (distribution.isEmpty()) {
                warnings.add(String.format("Layer %s: no data", layer.getKey()));
            } else if (distribution.get().getStd() < thresholds.getMinStd()) {
                warnings.add(String.format("Layer %s: no variation (std %.4f below %.4f)", layer.getKey(), distribution.get().getStd(), thresholds.getMinStd()));
            }
            if (outOfRange > 0) {
                errors.add(String.format("Layer %s: %d values outside [0,1]", layer.getKey(), outOfRange));
            }
            if (metrics.getOutliers().getCount() > 0) {
                warnings.add(String.format("Layer %s: %d MAD outliers (e.g. %s)", layer.getKey(), metrics.getOutliers().getCount(),
                        String.join(", ", metrics.getOutliers().getExampleGeneIds())));
            }
        }

        final List<GeneValue> composite = new ArrayList<>();
        for (final CompositeScoreRecord record : records) {
            if (record.getCompositeScore().isPresent()) {
                composite.add(new GeneValue(record.getGene().getGeneId(), record.getCompositeScore().getAsDouble()));
            }
        }
        final Optional<DistributionStats> compositeDistribution = DistributionStats.of(composite.stream().mapToDouble(GeneValue::getValue).toArray());
        final OutlierSummary compositeOutliers = detectOutliers(composite);
        if (compositeDistribution.isEmpty()) {
            warnings.add("Composite score: no gene has a score");
        }
        if (compositeOutliers.getCount() > 0) {
            warnings.add(String.format("Composite score: %d MAD outliers (e.g. %s)", compositeOutliers.getCount(),
                    String.join(", ", compositeOutliers.getExampleGeneIds())));
        }

        final QcReport report = new QcReport(layers, total, compositeDistribution, compositeOutliers, warnings, errors);
        log.info("QC ", report.passed() ? "passed" : "failed", " with ", warnings.size(), " warnings and ", errors.size(), " errors");
        return report;
    }

    /**
     * Flags values with |x - median| > k * MAD, where MAD is scaled to be comparable to a standard deviation.
     * Skipped when there are no values or the MAD is zero.
     */
    OutlierSummary detectOutliers(final List<GeneValue> values) {
        if (values.isEmpty()) return OutlierSummary.skipped(OptionalDouble.empty(), OptionalDouble.empty());

        final double[] data = values.stream().mapToDouble(GeneValue::getValue).toArray();
        final double median = MathUtil.median(data);
        final double mad = MathUtil.scaledMedianAbsoluteDeviation(data);
        if (mad == 0) return OutlierSummary.skipped(OptionalDouble.of(median), OptionalDouble.of(mad));

        final double limit = thresholds.getMadMultiplier() * mad;
        final List<GeneValue> outliers = values.stream()
                .filter(v -> Math.abs(v.getValue() - median) > limit)
                .sorted(Comparator.comparingDouble((GeneValue v) -> Math.abs(v.getValue() - median)).reversed()
                        .thenComparing(GeneValue::getGeneId))
                .collect(Collectors.toList());
        final List<String> examples = outliers.stream()
                .limit(OutlierSummary.MAX_EXAMPLES)
                .map(GeneValue::getGeneId)
                .collect(Collectors.toList());
        return new OutlierSummary(true, OptionalDouble.of(median), OptionalDouble.of(mad), outliers.size(), examples);
    }

    public QcThresholds getThresholds() {
        return thresholds;
    }

    static final class GeneValue {
        private final String geneId;
        private final double value;

        GeneValue(final String geneId, final double value) {
            this.geneId = geneId;
            this.value = value;
        }

        String getGeneId() {
            return geneId;
        }

        double getValue() {
            return value;
        }
    }
}
