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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses records that share a gene symbol to one canonical record per symbol. The record with the most evidence
 * layers wins, then the one with the higher composite score (a present score beats an absent one), then the one with
 * the smaller identifier.
 */
public final class CanonicalGeneSelector {
    static final Comparator<CompositeScoreRecord> PREFERENCE =
            Comparator.comparingInt(CompositeScoreRecord::getEvidenceCount).reversed()
                    .thenComparing((a, b) -> {
                        final boolean pa = a.getCompositeScore().isPresent();
                        final boolean pb = b.getCompositeScore().isPresent();
                        if (pa && pb) return Double.compare(b.getCompositeScore().getAsDouble(), a.getCompositeScore().getAsDouble());
                        if (pa) return -1;
                        if (pb) return 1;
                        return 0;
                    })
                    .thenComparing(r -> r.getGene().getGeneId());

    private CanonicalGeneSelector() {}

    /**
     * @return one record per symbol, sorted by {@link CompositeScoreRecord#BY_SCORE_DESCENDING}
     */
    public static List<CompositeScoreRecord> select(final Collection<CompositeScoreRecord> records) {
        final Map<String, CompositeScoreRecord> best = new HashMap<>();
        for (final CompositeScoreRecord record : records) {
            best.merge(record.getGene().getSymbol(), record, (a, b) -> PREFERENCE.compare(a, b) <= 0 ? a : b);
        }
        final List<CompositeScoreRecord> canonical = new ArrayList<>(best.values());
        canonical.sort(CompositeScoreRecord.BY_SCORE_DESCENDING);
        return canonical;
    }
}
