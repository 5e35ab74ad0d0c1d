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

import genescore.scoring.CompositeScoreRecord;
import genescore.scoring.CompositeScorer;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.Gene;
import genescore.scoring.LayerEvidence;
import genescore.scoring.ScoringResult;
import genescore.scoring.ScoringWeights;
import genescore.util.ThreadPoolExecutorWithExceptions;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;

/**
 * Measures how stable the top of the ranking is when one layer's weight is nudged.
 *
 * <p>For every layer and every delta the weights are perturbed and renormalized (see
 * {@link ScoringWeights#perturb(EvidenceLayer, double)}), all genes are rescored, and the perturbed top N is compared
 * with the baseline top N. Spearman's rho is computed over the baseline and perturbed scores of the genes in both
 * lists, provided there are at least the minimum number of them.</p>
 *
 * <p>Perturbations are independent and may run on a thread pool. Results are always returned in layer-then-delta
 * order and do not depend on the number of threads.</p>
 */
public class SensitivityAnalysis {
    private static final Log log = Log.getInstance(SensitivityAnalysis.class);

    private final CompositeScorer scorer;
    private final SensitivityParameters parameters;
    private final int threads;

    public SensitivityAnalysis(final CompositeScorer scorer, final SensitivityParameters parameters) {
        this(scorer, parameters, 1);
    }

    public SensitivityAnalysis(final CompositeScorer scorer, final SensitivityParameters parameters, final int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be at least 1 but was " + threads);
        this.scorer = scorer;
        this.parameters = parameters;
        this.threads = threads;
    }

    /** Runs the sweep with explicit deltas and top N; other settings come from this analysis's parameters. */
    public SensitivityAnalysisResult analyze(final List<Gene> genes, final Map<EvidenceLayer, LayerEvidence> evidenceByLayer,
                                             final ScoringWeights baselineWeights, final List<Double> deltas, final int topN) {
        return new SensitivityAnalysis(scorer, parameters.withDeltas(deltas).withTopN(topN), threads)
                .analyze(genes, evidenceByLayer, baselineWeights);
    }

    public SensitivityAnalysisResult analyze(final List<Gene> genes, final Map<EvidenceLayer, LayerEvidence> evidenceByLayer,
                                             final ScoringWeights baselineWeights) {
        final Map<String, Double> baselineTop = topN(scorer.score(genes, evidenceByLayer, baselineWeights));
        log.info("Sensitivity analysis over ", EvidenceLayer.values().length * parameters.getDeltas().size(),
                " perturbations; baseline top ", baselineTop.size(), " genes");

        final List<Callable<SensitivityResult>> tasks = new ArrayList<>();
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            for (final double delta : parameters.getDeltas()) {
                tasks.add(() -> perturbAndCompare(genes, evidenceByLayer, baselineWeights, baselineTop, layer, delta));
            }
        }

        final List<SensitivityResult> results = ThreadPoolExecutorWithExceptions.invokeInOrder(tasks, threads, "sensitivity-sweep");

        return new SensitivityAnalysisResult(baselineWeights, parameters, baselineTop.size(), results);
    }

    private SensitivityResult perturbAndCompare(final List<Gene> genes, final Map<EvidenceLayer, LayerEvidence> evidenceByLayer,
                                                final ScoringWeights baselineWeights, final Map<String, Double> baselineTop,
                                                final EvidenceLayer layer, final double delta) {
        final ScoringWeights perturbed = baselineWeights.perturb(layer, delta);
        final Map<String, Double> perturbedTop = topN(scorer.score(genes, evidenceByLayer, perturbed));

        final List<Double> baselineScores = new ArrayList<>();
        final List<Double> perturbedScores = new ArrayList<>();
        for (final Map.Entry<String, Double> entry : baselineTop.entrySet()) {
            final Double other = perturbedTop.get(entry.getKey());
            if (other != null) {
                baselineScores.add(entry.getValue());
                perturbedScores.add(other);
            }
        }
        final int overlap = baselineScores.size();

        OptionalDouble rho = OptionalDouble.empty();
        OptionalDouble pValue = OptionalDouble.empty();
        if (overlap >= parameters.getMinOverlap()) {
            final Optional<RankCorrelation> correlation = RankCorrelation.spearman(
                    baselineScores.stream().mapToDouble(Double::doubleValue).toArray(),
                    perturbedScores.stream().mapToDouble(Double::doubleValue).toArray());
            if (correlation.isPresent()) {
                rho = OptionalDouble.of(correlation.get().getRho());
                pValue = OptionalDouble.of(correlation.get().getPValue());
            }
        }

        final Stability stability = !rho.isPresent() ? Stability.INDETERMINATE
                : rho.getAsDouble() >= parameters.getStabilityThreshold() ? Stability.STABLE : Stability.UNSTABLE;

        log.info(String.format("Perturbed %s by %+.2f: overlap %d, rho %s, %s", layer.getKey(), delta, overlap,
                rho.isPresent() ? String.format("%.4f", rho.getAsDouble()) : "NA", stability));
        return new SensitivityResult(layer, delta, perturbed, overlap, rho, pValue, stability);
    }

    /** Gene identifier to score for the first N scored genes, in ranking order. */
    private Map<String, Double> topN(final ScoringResult result) {
        final Map<String, Double> top = new LinkedHashMap<>();
        for (final CompositeScoreRecord record : result.getRecords()) {
            if (top.size() >= parameters.getTopN()) break;
            if (!record.getCompositeScore().isPresent()) break;
            top.put(record.getGene().getGeneId(), record.getCompositeScore().getAsDouble());
        }
        return top;
    }

    public SensitivityParameters getParameters() {
        return parameters;
    }
}
