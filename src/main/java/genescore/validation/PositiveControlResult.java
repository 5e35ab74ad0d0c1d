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

import com.google.common.collect.ImmutableList;
import genescore.scoring.EvidenceLayer;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Result of checking that known genes rank high.
 */
public final class PositiveControlResult extends ControlValidationResult {
    private final ImmutableList<RecallAtK> recall;
    private final ImmutableList<SourceBreakdown> sourceBreakdown;

    PositiveControlResult(final ControlSet controlSet, final int populationSize, final List<RankedGene> foundControls,
                          final List<MissingControl> missingControls, final OptionalDouble medianPercentile,
                          final int topQuartileCount, final ControlOutcome outcome,
                          final Map<EvidenceLayer, OptionalDouble> layerScoreDeltas,
                          final List<RecallAtK> recall, final List<SourceBreakdown> sourceBreakdown) {
        super(controlSet, populationSize, foundControls, missingControls, medianPercentile, topQuartileCount, outcome, layerScoreDeltas);
        this.recall = ImmutableList.copyOf(recall);
        this.sourceBreakdown = ImmutableList.copyOf(sourceBreakdown);
    }

    /** Recall at the absolute cutoffs followed by the percentage cutoffs. */
    public ImmutableList<RecallAtK> getRecall() {
        return recall;
    }

    public ImmutableList<SourceBreakdown> getSourceBreakdown() {
        return sourceBreakdown;
    }
}
