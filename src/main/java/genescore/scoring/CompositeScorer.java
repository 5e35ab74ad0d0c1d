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

import genescore.ConfigurationException;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Combines per-layer evidence into one composite score per gene.
 *
 * <p>The composite is the weighted mean over the layers that are present for the gene:
 * <pre>
 *     composite = sum(w[l] * s[l]) / sum(w[l])     for l in present layers
 * </pre>
 * Dividing by the available weight rather than the total weight means a missing layer does not count as a zero.
 * The consequence is that a gene with one high-scoring layer can outrank a gene with six moderate ones; callers
 * should look at the evidence count (tiering applies a breadth floor) rather than the score alone.</p>
 *
 * <p>If every present layer has weight zero there is no weight to average over and the composite is absent, while
 * the evidence count still counts the present layers.</p>
 *
 * <p>Scoring is a pure function of its inputs. Layers are always visited in {@link EvidenceLayer} order.</p>
 */
public class CompositeScorer {
    private static final Log log = Log.getInstance(CompositeScorer.class);

    private final QualityFlagThresholds qualityFlagThresholds;

    public CompositeScorer() {
        this(QualityFlagThresholds.DEFAULT);
    }

    public CompositeScorer(final QualityFlagThresholds qualityFlagThresholds) {
        if (qualityFlagThresholds == null) throw new ConfigurationException("Quality flag thresholds must be given");
        this.qualityFlagThresholds = qualityFlagThresholds;
    }

    /**
     * Scores every gene in the universe.
     *
     * @param genes the gene universe; duplicated identifiers keep their first occurrence
     * @param evidenceByLayer evidence tables keyed by their layer; layers without a table are absent for every gene
     * @param weights validated weights
     * @throws ConfigurationException if weights are missing or a table is keyed under the wrong layer
     */
    public ScoringResult score(final List<Gene> genes, final Map<EvidenceLayer, LayerEvidence> evidenceByLayer, final ScoringWeights weights) {
        if (weights == null) throw new ConfigurationException("Scoring weights must be given");
        for (final Map.Entry<EvidenceLayer, LayerEvidence> entry : evidenceByLayer.entrySet()) {
            if (entry.getKey() == null) {
                throw new ConfigurationException("Evidence table given without a layer");
            }
            if (entry.getValue().getLayer() != entry.getKey()) {
                throw new ConfigurationException(String.format("Evidence table for layer %s was supplied as layer %s",
                        entry.getValue().getLayer().getKey(), entry.getKey().getKey()));
            }
        }

        final List<DataIssue> issues = new ArrayList<>();
        final Map<String, Gene> universe = new LinkedHashMap<>();
        for (final Gene gene : genes) {
            if (universe.containsKey(gene.getGeneId())) {
                issues.add(new DataIssue(DataIssue.Kind.DUPLICATE_GENE_ID, null, gene.getGeneId(),
                        "listed more than once in the gene universe; first occurrence kept"));
            } else {
                universe.put(gene.getGeneId(), gene);
            }
        }

        final Map<EvidenceLayer, Map<String, Double>> usable = new EnumMap<>(EvidenceLayer.class);
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            final LayerEvidence evidence = evidenceByLayer.get(layer);
            final Map<String, Double> values = new HashMap<>();
            usable.put(layer, values);
            if (evidence == null) continue;

            for (final String duplicate : evidence.getDuplicateGeneIds()) {
                issues.add(new DataIssue(DataIssue.Kind.DUPLICATE_EVIDENCE_ROW, layer, duplicate, "first row kept"));
            }

            int outsideUniverse = 0;
            for (final Map.Entry<String, OptionalDouble> row : evidence.getScores().entrySet()) {
                if (!universe.containsKey(row.getKey())) {
                    ++outsideUniverse;
                    continue;
                }
                if (!row.getValue().isPresent()) continue;

                final double value = row.getValue().getAsDouble();
                if (!Double.isFinite(value) || value < 0 || value > 1) {
                    issues.add(new DataIssue(DataIssue.Kind.OUT_OF_RANGE, layer, row.getKey(),
                            "score " + value + " is outside [0,1] and was treated as absent"));
                } else {
                    values.put(row.getKey(), value);
                }
            }
            if (outsideUniverse > 0) {
                issues.add(new DataIssue(DataIssue.Kind.GENE_NOT_IN_UNIVERSE, layer, null,
                        outsideUniverse + " evidence rows for genes outside the universe were ignored"));
            }
        }

        final List<CompositeScoreRecord> records = new ArrayList<>(universe.size());
        for (final Gene gene : universe.values()) {
            records.add(scoreGene(gene, usable, weights));
        }

        log.debug("Scored ", records.size(), " genes with weights ", weights);
        return new ScoringResult(records, issues, weights);
    }

    private CompositeScoreRecord scoreGene(final Gene gene, final Map<EvidenceLayer, Map<String, Double>> usable, final ScoringWeights weights) {
        final Map<EvidenceLayer, OptionalDouble> layerScores = new EnumMap<>(EvidenceLayer.class);
        final Map<EvidenceLayer, Double> contributions = new EnumMap<>(EvidenceLayer.class);
        double availableWeight = 0;
        double weightedSum = 0;
        int evidenceCount = 0;

        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            final Double score = usable.get(layer).get(gene.getGeneId());
            if (score == null) {
                layerScores.put(layer, OptionalDouble.empty());
                continue;
            }
            final double weight = weights.get(layer);
            layerScores.put(layer, OptionalDouble.of(score));
            contributions.put(layer, weight * score);
            availableWeight += weight;
            weightedSum += weight * score;
            ++evidenceCount;
        }

        final OptionalDouble composite;
        if (evidenceCount == 0 || availableWeight == 0) {
            composite = OptionalDouble.empty();
        } else {
            // guard against rounding pushing a mean of values in [0,1] just outside the interval
            composite = OptionalDouble.of(Math.max(0.0, Math.min(1.0, weightedSum / availableWeight)));
        }

        return new CompositeScoreRecord(gene, composite, evidenceCount, qualityFlagThresholds.flagFor(evidenceCount),
                layerScores, contributions);
    }

    public QualityFlagThresholds getQualityFlagThresholds() {
        return qualityFlagThresholds;
    }
}
