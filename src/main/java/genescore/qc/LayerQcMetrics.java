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

import genescore.scoring.EvidenceLayer;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * QC findings for one evidence layer.
 */
public final class LayerQcMetrics {
    private final EvidenceLayer layer;
    private final int totalGenes;
    private final int missingCount;
    private final int outOfRangeCount;
    private final Optional<DistributionStats> distribution;
    private final OutlierSummary outliers;

    LayerQcMetrics(final EvidenceLayer layer, final int totalGenes, final int missingCount, final int outOfRangeCount,
                   final Optional<DistributionStats> distribution, final OutlierSummary outliers) {
        this.layer = layer;
        this.totalGenes = totalGenes;
        this.missingCount = missingCount;
        this.outOfRangeCount = outOfRangeCount;
        this.distribution = distribution;
        this.outliers = outliers;
    }

    public EvidenceLayer getLayer() {
        return layer;
    }

    public int getTotalGenes() {
        return totalGenes;
    }

    public int getMissingCount() {
        return missingCount;
    }

    /** Fraction of universe genes without a usable score; empty for an empty universe. */
    public OptionalDouble getMissingRate() {
        return totalGenes == 0 ? OptionalDouble.empty() : OptionalDouble.of(missingCount / (double) totalGenes);
    }

    public int getOutOfRangeCount() {
        return outOfRangeCount;
    }

    /** Empty when the layer has no present scores. */
    public Optional<DistributionStats> getDistribution() {
        return distribution;
    }

    public OutlierSummary getOutliers() {
        return outliers;
    }
}
