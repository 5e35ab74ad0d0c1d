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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Output of one scoring pass: one record per universe gene, sorted by {@link CompositeScoreRecord#BY_SCORE_DESCENDING},
 * plus the data issues found while reading the evidence.
 */
public final class ScoringResult {
    private final ImmutableList<CompositeScoreRecord> records;
    private final ImmutableList<DataIssue> dataIssues;
    private final ScoringWeights weights;

    public ScoringResult(final List<CompositeScoreRecord> records, final List<DataIssue> dataIssues, final ScoringWeights weights) {
        final List<CompositeScoreRecord> sorted = new ArrayList<>(records);
        sorted.sort(CompositeScoreRecord.BY_SCORE_DESCENDING);
        this.records = ImmutableList.copyOf(sorted);
        this.dataIssues = ImmutableList.copyOf(dataIssues);
        this.weights = weights;
    }

    public ImmutableList<CompositeScoreRecord> getRecords() {
        return records;
    }

    public ImmutableList<DataIssue> getDataIssues() {
        return dataIssues;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    /** Records with a present composite score, in ranking order. */
    public List<CompositeScoreRecord> getScoredRecords() {
        return records.stream().filter(r -> r.getCompositeScore().isPresent()).collect(Collectors.toList());
    }

    public Map<String, CompositeScoreRecord> byGeneId() {
        return records.stream().collect(Collectors.toMap(r -> r.getGene().getGeneId(), Function.identity()));
    }
}
