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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * The scores of one evidence layer keyed by gene identifier. A gene may be listed with an absent score, meaning the
 * layer was not measured for it, which is different from a measured score of zero. Values are stored as given; range
 * checking happens at scoring time.
 */
public final class LayerEvidence {
    private final EvidenceLayer layer;
    private final ImmutableMap<String, OptionalDouble> scores;
    private final ImmutableList<String> duplicateGeneIds;

    private LayerEvidence(final EvidenceLayer layer, final Map<String, OptionalDouble> scores, final List<String> duplicates) {
        this.layer = layer;
        this.scores = ImmutableMap.copyOf(scores);
        this.duplicateGeneIds = ImmutableList.copyOf(duplicates);
    }

    public static Builder builder(final EvidenceLayer layer) {
        return new Builder(layer);
    }

    public EvidenceLayer getLayer() {
        return layer;
    }

    /** @return the score for the gene, empty when the gene is not listed or listed as absent */
    public OptionalDouble getScore(final String geneId) {
        final OptionalDouble score = scores.get(geneId);
        return score == null ? OptionalDouble.empty() : score;
    }

    /** All rows in input order. */
    public ImmutableMap<String, OptionalDouble> getScores() {
        return scores;
    }

    /** Gene identifiers that appeared more than once; only the first row for each was kept. */
    public ImmutableList<String> getDuplicateGeneIds() {
        return duplicateGeneIds;
    }

    public static class Builder {
        private final EvidenceLayer layer;
        private final Map<String, OptionalDouble> scores = new LinkedHashMap<>();
        private final List<String> duplicates = new ArrayList<>();

        private Builder(final EvidenceLayer layer) {
            this.layer = layer;
        }

        public Builder add(final String geneId, final double score) {
            return put(geneId, OptionalDouble.of(score));
        }

        public Builder addAbsent(final String geneId) {
            return put(geneId, OptionalDouble.empty());
        }

        public Builder put(final String geneId, final OptionalDouble score) {
            if (scores.containsKey(geneId)) {
                duplicates.add(geneId);
            } else {
                scores.put(geneId, score);
            }
            return this;
        }

        public LayerEvidence build() {
            return new LayerEvidence(layer, scores, duplicates);
        }
    }
}
