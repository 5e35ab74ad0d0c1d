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

package genescore.scoring;

import genescore.util.MathUtil;
import htsjdk.samtools.util.Log;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Headline numbers for one scoring pass: coverage, central tendency of the composite and how evidence is spread
 * across quality flags and layers.
 */
public final class ScoringSummary {
    private final int totalGenes;
    private final int scoredGenes;
    private final Double meanScore;
    private final Double medianScore;
    private final Map<QualityFlag, Integer> qualityFlagCounts = new EnumMap<>(QualityFlag.class);
    private final Map<EvidenceLayer, Double> layerMissingRates = new EnumMap<>(EvidenceLayer.class);

    public ScoringSummary(final ScoringResult result) {
        final List<CompositeScoreRecord> records = result.getRecords();
        this.totalGenes = records.size();
        final double[] scores = records.stream()
                .filter(r -> r.getCompositeScore().isPresent())
                .mapToDouble(r -> r.getCompositeScore().getAsDouble())
                .toArray();
        this.scoredGenes = scores.length;
        this.meanScore = scores.length == 0 ? null : MathUtil.mean(scores);
        this.medianScore = scores.length == 0 ? null : MathUtil.median(scores);

        for (final QualityFlag flag : QualityFlag.values()) {
            qualityFlagCounts.put(flag, 0);
        }
        for (final CompositeScoreRecord record : records) {
            qualityFlagCounts.merge(record.getQualityFlag(), 1, Integer::sum);
        }
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            final long missing = records.stream().filter(r -> !r.getLayerScore(layer).isPresent()).count();
            layerMissingRates.put(layer, totalGenes == 0 ? 1.0 : missing / (double) totalGenes);
        }
    }

    public int getTotalGenes() {
        return totalGenes;
    }

    public int getScoredGenes() {
        return scoredGenes;
    }

    /** Null when no gene has a score. */
    public Double getMeanScore() {
        return meanScore;
    }

    /** Null when no gene has a score. */
    public Double getMedianScore() {
        return medianScore;
    }

    public Map<QualityFlag, Integer> getQualityFlagCounts() {
        return qualityFlagCounts;
    }

    public Map<EvidenceLayer, Double> getLayerMissingRates() {
        return layerMissingRates;
    }

    public void log(final Log log) {
        log.info(String.format("Scored %d of %d genes (%.1f%% coverage)", scoredGenes, totalGenes,
                totalGenes == 0 ? 0.0 : 100.0 * scoredGenes / totalGenes));
        if (meanScore != null) {
            log.info(String.format("Composite score mean %.4f, median %.4f", meanScore, medianScore));
        }
        log.info("Quality flags: " + qualityFlagCounts.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ")));
        log.info("Layer missing rates: " + layerMissingRates.entrySet().stream()
                .map(e -> String.format("%s=%.3f", e.getKey().getKey(), e.getValue()))
                .collect(Collectors.joining(", ")));
    }
}
