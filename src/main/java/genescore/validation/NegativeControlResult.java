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

import genescore.scoring.EvidenceLayer;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Result of checking that housekeeping genes rank low.
 */
public final class NegativeControlResult extends ControlValidationResult {
    private final int highTierCount;

    NegativeControlResult(final ControlSet controlSet, final int populationSize, final List<RankedGene> foundControls,
                          final List<MissingControl> missingControls, final OptionalDouble medianPercentile,
                          final int topQuartileCount, final ControlOutcome outcome,
                          final Map<EvidenceLayer, OptionalDouble> layerScoreDeltas, final int highTierCount) {
        super(controlSet, populationSize, foundControls, missingControls, medianPercentile, topQuartileCount, outcome, layerScoreDeltas);
        this.highTierCount = highTierCount;
    }

    /** Negative controls classified HIGH; should be close to zero. */
    public int getHighTierCount() {
        return highTierCount;
    }
}
