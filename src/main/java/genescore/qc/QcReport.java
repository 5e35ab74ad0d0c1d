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

package genescore.qc;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import genescore.scoring.EvidenceLayer;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Advisory diagnostics over a scoring pass. Errors fail QC but never stop the pipeline.
 */
public final class QcReport {
    private final ImmutableMap<EvidenceLayer, LayerQcMetrics> layers;
    private final int totalGenes;
    private final Optional<DistributionStats> compositeDistribution;
    private final OutlierSummary compositeOutliers;
    private final ImmutableList<String> warnings;
    private final ImmutableList<String> errors;

    QcReport(final Map<EvidenceLayer, LayerQcMetrics> layers, final int totalGenes, final Optional<DistributionStats> compositeDistribution,
             final OutlierSummary compositeOutliers, final List<String> warnings, final List<String> errors) {
        this.layers = ImmutableMap.copyOf(layers);
        this.totalGenes = totalGenes;
        this.compositeDistribution = compositeDistribution;
        this.compositeOutliers = compositeOutliers;
        this.warnings = ImmutableList.copyOf(warnings);
        this.errors = ImmutableList.copyOf(errors);
    }

    public ImmutableMap<EvidenceLayer, LayerQcMetrics> getLayers() {
        return layers;
    }

    public LayerQcMetrics getLayer(final EvidenceLayer layer) {
        return layers.get(layer);
    }

    public int getTotalGenes() {
        return totalGenes;
    }

    /** Empty when no gene has a composite score. */
    public Optional<DistributionStats> getCompositeDistribution() {
        return compositeDistribution;
    }

    public int getCompositeNonNullCount() {
        return compositeDistribution.map(DistributionStats::getCount).orElse(0);
    }

    public OutlierSummary getCompositeOutliers() {
        return compositeOutliers;
    }

    public ImmutableList<String> getWarnings() {
        return warnings;
    }

    public ImmutableList<String> getErrors() {
        return errors;
    }

    public boolean passed() {
        return errors.isEmpty();
    }
}
