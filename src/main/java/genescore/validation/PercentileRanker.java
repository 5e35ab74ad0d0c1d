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

import genescore.scoring.CanonicalGeneSelector;
import genescore.scoring.CompositeScoreRecord;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The ranking primitive shared by positive and negative control validation. The population is the canonical record
 * of every symbol that has a composite score.
 */
public final class PercentileRanker {
    private final List<RankedGene> ranked;
    private final Map<String, RankedGene> bySymbol = new LinkedHashMap<>();
    private final Map<String, CompositeScoreRecord> canonicalBySymbol = new LinkedHashMap<>();

    /**
     * @param records every scored record, possibly with several identifiers per symbol
     */
    public PercentileRanker(final Collection<CompositeScoreRecord> records) {
        final List<CompositeScoreRecord> canonical = CanonicalGeneSelector.select(records);
        final List<CompositeScoreRecord> scored = new ArrayList<>();
        for (final CompositeScoreRecord record : canonical) {
            canonicalBySymbol.put(record.getGene().getSymbol(), record);
            if (record.getCompositeScore().isPresent()) scored.add(record);
        }

        final double[] scores = scored.stream().mapToDouble(r -> r.getCompositeScore().getAsDouble()).toArray();
        final double[] ranks = new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.AVERAGE).rank(scores);
        final int n = scored.size();

        this.ranked = new ArrayList<>(n);
        for (int i = 0; i < n; ++i) {
            final RankedGene gene = new RankedGene(scored.get(i), ranks[i], ranks[i] / n);
            ranked.add(gene);
            bySymbol.put(gene.getSymbol(), gene);
        }
    }

    /** Ranked population ordered by score descending, then gene identifier ascending. */
    public List<RankedGene> getRanked() {
        return ranked;
    }

    public int getPopulationSize() {
        return ranked.size();
    }

    /** @return the ranked gene for the symbol, or null if the symbol has no scored canonical record */
    public RankedGene get(final String symbol) {
        return bySymbol.get(symbol);
    }

    /** @return the canonical record for the symbol whether or not it is scored, or null if not in the universe */
    public CompositeScoreRecord getCanonical(final String symbol) {
        return canonicalBySymbol.get(symbol);
    }

    /**
     * The number of genes in the top k percent of the population, rounded up and never more than the population.
     */
    public int topKForPercent(final double percent) {
        final int n = ranked.size();
        return (int) Math.min(n, Math.ceil(percent * n / 100.0));
    }
}
