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

package genescore.validation;

import genescore.scoring.CompositeScoreRecord;
import genescore.scoring.EvidenceLayer;
import genescore.tier.Tier;
import genescore.tier.TierClassifier;
import genescore.util.MathUtil;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Positive and negative control checks. Both use the same {@link PercentileRanker} population; only the pass
 * criterion differs.
 */
public class ControlValidator {
    private static final Log log = Log.getInstance(ControlValidator.class);

    private final ControlValidationParameters parameters;
    private final TierClassifier tierClassifier;

    public ControlValidator(final ControlValidationParameters parameters, final TierClassifier tierClassifier) {
        this.parameters = parameters;
        this.tierClassifier = tierClassifier;
    }

    public PositiveControlResult validatePositive(final Collection<CompositeScoreRecord> records, final ControlSet controls) {
        return validatePositive(new PercentileRanker(records), controls);
    }

    public NegativeControlResult validateNegative(final Collection<CompositeScoreRecord> records, final ControlSet controls) {
        return validateNegative(new PercentileRanker(records), controls);
    }

    /**
     * Known genes pass when their median percentile is at least the configured minimum. Recall is reported at every
     * absolute and percentage cutoff, overall and per source.
     */
    public PositiveControlResult validatePositive(final PercentileRanker ranker, final ControlSet controls) {
        final List<RankedGene> found = new ArrayList<>();
        final List<MissingControl> missing = new ArrayList<>();
        locate(ranker, controls, found, missing);

        final OptionalDouble median = medianPercentile(found);
        final ControlOutcome outcome = !median.isPresent() ? ControlOutcome.INDETERMINATE
                : median.getAsDouble() >= parameters.getPositiveMinMedianPercentile() ? ControlOutcome.PASSED : ControlOutcome.FAILED;

        final Set<String> foundSymbols = symbols(found);
        final List<RecallAtK> recall = new ArrayList<>();
        for (final int k : parameters.getRecallKAbsolute()) {
            recall.add(recallAt(ranker, String.valueOf(k), Math.min(k, ranker.getPopulationSize()), foundSymbols));
        }
        recall.addAll(percentRecall(ranker, foundSymbols));

        final List<SourceBreakdown> breakdown = new ArrayList<>();
        for (final String source : controls.getAllSources()) {
            final Set<String> sourceSymbols = controls.getSymbolsForSource(source);
            final List<RankedGene> sourceFound = new ArrayList<>();
            for (final RankedGene gene : found) {
                if (sourceSymbols.contains(gene.getSymbol())) sourceFound.add(gene);
            }
            breakdown.add(new SourceBreakdown(source, sourceSymbols.size(), sourceFound.size(), medianPercentile(sourceFound),
                    topQuartileCount(sourceFound), percentRecall(ranker, symbols(sourceFound))));
        }

        final PositiveControlResult result = new PositiveControlResult(controls, ranker.getPopulationSize(), found, missing, median,
                topQuartileCount(found), outcome, layerScoreDeltas(ranker, found), recall, breakdown);
        log.info(String.format("Positive controls %s: %d of %d found, median percentile %s -> %s", controls.getName(),
                found.size(), controls.size(), format(median), outcome));
        return result;
    }

    /**
     * Housekeeping genes pass when their median percentile is below the configured maximum.
     */
    public NegativeControlResult validateNegative(final PercentileRanker ranker, final ControlSet controls) {
        final List<RankedGene> found = new ArrayList<>();
        final List<MissingControl> missing = new ArrayList<>();
        locate(ranker, controls, found, missing);

        final OptionalDouble median = medianPercentile(found);
        final ControlOutcome outcome = !median.isPresent() ? ControlOutcome.INDETERMINATE
                : median.getAsDouble() < parameters.getNegativeMaxMedianPercentile() ? ControlOutcome.PASSED : ControlOutcome.FAILED;

        int highTier = 0;
        for (final RankedGene gene : found) {
            if (tierClassifier.classify(gene.getRecord()) == Tier.HIGH) ++highTier;
        }

        final NegativeControlResult result = new NegativeControlResult(controls, ranker.getPopulationSize(), found, missing, median,
                topQuartileCount(found), outcome, layerScoreDeltas(ranker, found), highTier);
        log.info(String.format("Negative controls %s: %d of %d found, median percentile %s -> %s", controls.getName(),
                found.size(), controls.size(), format(median), outcome));
        return result;
    }

    private static void locate(final PercentileRanker ranker, final ControlSet controls, final List<RankedGene> found,
                               final List<MissingControl> missing) {
        for (final String symbol : controls.getSymbols()) {
            final RankedGene gene = ranker.get(symbol);
            if (gene != null) {
                found.add(gene);
            } else {
                final MissingControl.Reason reason = ranker.getCanonical(symbol) == null
                        ? MissingControl.Reason.NOT_IN_UNIVERSE : MissingControl.Reason.NO_SCORE;
                missing.add(new MissingControl(symbol, controls.getSources(symbol), reason));
            }
        }
        found.sort((a, b) -> CompositeScoreRecord.BY_SCORE_DESCENDING.compare(a.getRecord(), b.getRecord()));
    }

    private List<RecallAtK> percentRecall(final PercentileRanker ranker, final Set<String> knownPresent) {
        final List<RecallAtK> recall = new ArrayList<>();
        for (final double percent : parameters.getRecallKPercent()) {
            recall.add(recallAt(ranker, formatPercent(percent), ranker.topKForPercent(percent), knownPresent));
        }
        return recall;
    }

    static RecallAtK recallAt(final PercentileRanker ranker, final String label, final int k, final Set<String> knownPresent) {
        int hits = 0;
        final List<RankedGene> ranked = ranker.getRanked();
        for (int i = 0; i < k && i < ranked.size(); ++i) {
            if (knownPresent.contains(ranked.get(i).getSymbol())) ++hits;
        }
        return new RecallAtK(label, k, hits, knownPresent.size());
    }

    private int topQuartileCount(final List<RankedGene> genes) {
        int count = 0;
        for (final RankedGene gene : genes) {
            if (gene.getPercentile() >= parameters.getTopQuartilePercentile()) ++count;
        }
        return count;
    }

    private static OptionalDouble medianPercentile(final List<RankedGene> genes) {
        if (genes.isEmpty()) return OptionalDouble.empty();
        return OptionalDouble.of(MathUtil.median(genes.stream().mapToDouble(RankedGene::getPercentile).toArray()));
    }

    private static Map<EvidenceLayer, OptionalDouble> layerScoreDeltas(final PercentileRanker ranker, final List<RankedGene> found) {
        final Map<EvidenceLayer, OptionalDouble> deltas = new EnumMap<>(EvidenceLayer.class);
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            final OptionalDouble controlMean = meanLayerScore(found, layer);
            final OptionalDouble populationMean = meanLayerScore(ranker.getRanked(), layer);
            deltas.put(layer, controlMean.isPresent() && populationMean.isPresent()
                    ? OptionalDouble.of(controlMean.getAsDouble() - populationMean.getAsDouble())
                    : OptionalDouble.empty());
        }
        return deltas;
    }

    private static OptionalDouble meanLayerScore(final List<RankedGene> genes, final EvidenceLayer layer) {
        final double[] values = genes.stream()
                .map(g -> g.getRecord().getLayerScore(layer))
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .toArray();
        return values.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(MathUtil.mean(values));
    }

    private static Set<String> symbols(final List<RankedGene> genes) {
        final Set<String> symbols = new HashSet<>();
        for (final RankedGene gene : genes) symbols.add(gene.getSymbol());
        return symbols;
    }

    static String formatPercent(final double percent) {
        return (percent == Math.rint(percent) ? String.valueOf((long) percent) : String.valueOf(percent)) + "%";
    }

    private static String format(final OptionalDouble value) {
        return value.isPresent() ? String.format("%.3f", value.getAsDouble()) : "NA";
    }

    public ControlValidationParameters getParameters() {
        return parameters;
    }
}
