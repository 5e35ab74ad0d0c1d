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
import com.google.common.collect.ImmutableMap;
import genescore.scoring.EvidenceLayer;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * What positive and negative control checks have in common.
 */
public abstract class ControlValidationResult {
    private final ControlSet controlSet;
    private final int populationSize;
    private final ImmutableList<RankedGene> foundControls;
    private final ImmutableList<MissingControl> missingControls;
    private final OptionalDouble medianPercentile;
    private final int topQuartileCount;
    private final ControlOutcome outcome;
    private final ImmutableMap<EvidenceLayer, OptionalDouble> layerScoreDeltas;

    protected ControlValidationResult(final ControlSet controlSet,
                                      final int populationSize,
                                      final List<RankedGene> foundControls,
                                      final List<MissingControl> missingControls,
                                      final OptionalDouble medianPercentile,
                                      final int topQuartileCount,
                                      final ControlOutcome outcome,
                                      final Map<EvidenceLayer, OptionalDouble> layerScoreDeltas) {
        this.controlSet = controlSet;
        this.populationSize = populationSize;
        this.foundControls = ImmutableList.copyOf(foundControls);
        this.missingControls = ImmutableList.copyOf(missingControls);
        this.medianPercentile = medianPercentile;
        this.topQuartileCount = topQuartileCount;
        this.outcome = outcome;
        this.layerScoreDeltas = ImmutableMap.copyOf(layerScoreDeltas);
    }

    public ControlSet getControlSet() {
        return controlSet;
    }

    public int getPopulationSize() {
        return populationSize;
    }

    public int getExpected() {
        return controlSet.size();
    }

    public int getFound() {
        return foundControls.size();
    }

    /** Control genes that were ranked, ordered by score descending. */
    public ImmutableList<RankedGene> getFoundControls() {
        return foundControls;
    }

    public ImmutableList<MissingControl> getMissingControls() {
        return missingControls;
    }

    /** Empty when no control gene was found. */
    public OptionalDouble getMedianPercentile() {
        return medianPercentile;
    }

    public int getTopQuartileCount() {
        return topQuartileCount;
    }

    /** Empty when no control gene was found. */
    public OptionalDouble getTopQuartileFraction() {
        return foundControls.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(topQuartileCount / (double) foundControls.size());
    }

    public ControlOutcome getOutcome() {
        return outcome;
    }

    /**
     * Per layer, the mean score of the found controls minus the mean score of the population. Positive values mean
     * the layer scores the controls above the population. Empty where either side has no scores in that layer.
     */
    public ImmutableMap<EvidenceLayer, OptionalDouble> getLayerScoreDeltas() {
        return layerScoreDeltas;
    }
}
