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

import genescore.tier.Tier;
import htsjdk.samtools.metrics.MetricBase;

import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * One row per gene of the composite-score table. Absent scores and contributions are left empty.
 */
public class ScoredGeneMetrics extends MetricBase {
    /** The stable gene identifier. */
    public String GENE_ID;
    /** The gene symbol, or the identifier when the universe gives none. */
    public String GENE_SYMBOL;
    /** Weighted average of the present layer scores, renormalized by the weight available to this gene. */
    public Double COMPOSITE_SCORE;
    /** Number of layers with a present score. */
    public int EVIDENCE_COUNT;
    /** Evidence breadth category derived from EVIDENCE_COUNT. */
    public QualityFlag QUALITY_FLAG;
    /** Confidence tier from the composite score and evidence breadth. */
    public Tier TIER;

    public Double GNOMAD_SCORE;
    public Double EXPRESSION_SCORE;
    public Double ANNOTATION_SCORE;
    public Double LOCALIZATION_SCORE;
    public Double ANIMAL_MODEL_SCORE;
    public Double LITERATURE_SCORE;

    /** Layer score times layer weight, for present layers. */
    public Double GNOMAD_CONTRIBUTION;
    public Double EXPRESSION_CONTRIBUTION;
    public Double ANNOTATION_CONTRIBUTION;
    public Double LOCALIZATION_CONTRIBUTION;
    public Double ANIMAL_MODEL_CONTRIBUTION;
    public Double LITERATURE_CONTRIBUTION;

    /** Comma-separated layers with a score. */
    public String SUPPORTING_LAYERS;
    /** Comma-separated layers without a score. */
    public String EVIDENCE_GAPS;

    public static ScoredGeneMetrics of(final CompositeScoreRecord record, final Tier tier) {
        final ScoredGeneMetrics metrics = new ScoredGeneMetrics();
        metrics.GENE_ID = record.getGene().getGeneId();
        metrics.GENE_SYMBOL = record.getGene().getSymbol();
        metrics.COMPOSITE_SCORE = orNull(record.getCompositeScore());
        metrics.EVIDENCE_COUNT = record.getEvidenceCount();
        metrics.QUALITY_FLAG = record.getQualityFlag();
        metrics.TIER = tier;

        metrics.GNOMAD_SCORE = orNull(record.getLayerScore(EvidenceLayer.GNOMAD));
        metrics.EXPRESSION_SCORE = orNull(record.getLayerScore(EvidenceLayer.EXPRESSION));
        metrics.ANNOTATION_SCORE = orNull(record.getLayerScore(EvidenceLayer.ANNOTATION));
        metrics.LOCALIZATION_SCORE = orNull(record.getLayerScore(EvidenceLayer.LOCALIZATION));
        metrics.ANIMAL_MODEL_SCORE = orNull(record.getLayerScore(EvidenceLayer.ANIMAL_MODEL));
        metrics.LITERATURE_SCORE = orNull(record.getLayerScore(EvidenceLayer.LITERATURE));

        metrics.GNOMAD_CONTRIBUTION = record.getContributions().get(EvidenceLayer.GNOMAD);
        metrics.EXPRESSION_CONTRIBUTION = record.getContributions().get(EvidenceLayer.EXPRESSION);
        metrics.ANNOTATION_CONTRIBUTION = record.getContributions().get(EvidenceLayer.ANNOTATION);
        metrics.LOCALIZATION_CONTRIBUTION = record.getContributions().get(EvidenceLayer.LOCALIZATION);
        metrics.ANIMAL_MODEL_CONTRIBUTION = record.getContributions().get(EvidenceLayer.ANIMAL_MODEL);
        metrics.LITERATURE_CONTRIBUTION = record.getContributions().get(EvidenceLayer.LITERATURE);

        metrics.SUPPORTING_LAYERS = joinKeys(record.getSupportingLayers());
        metrics.EVIDENCE_GAPS = joinKeys(record.getEvidenceGaps());
        return metrics;
    }

    private static Double orNull(final OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static String joinKeys(final List<EvidenceLayer> layers) {
        return layers.stream().map(EvidenceLayer::getKey).collect(Collectors.joining(","));
    }
}
