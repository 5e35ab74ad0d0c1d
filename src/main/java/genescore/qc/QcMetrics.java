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

import htsjdk.samtools.metrics.MetricBase;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Distribution and missingness metrics for one evidence layer, or for the composite score when LAYER is
 * {@value QualityControl#COMPOSITE}. Distribution fields are empty when the layer has no values.
 */
public class QcMetrics extends MetricBase {

    /** The evidence layer key, or "composite". */
    public String LAYER;
    /** Number of genes in the universe. */
    public int TOTAL_GENES;
    /** Genes with no usable value. */
    public int MISSING_COUNT;
    /** MISSING_COUNT / TOTAL_GENES; empty for an empty universe. */
    public Double MISSING_RATE;
    /** Values outside [0, 1] that were excluded. */
    public int OUT_OF_RANGE_COUNT;

    public Double MEAN;
    public Double MEDIAN;
    /** Population standard deviation. */
    public Double STD;
    public Double MIN;
    public Double MAX;
    public Double P10;
    public Double P25;
    public Double P75;
    public Double P90;

    /** Number of MAD outliers; empty when detection was skipped. */
    public Integer OUTLIER_COUNT;
    /** Median absolute deviation scaled to be comparable with a standard deviation. */
    public Double SCALED_MAD;
    /** Up to five outlying gene identifiers, most extreme first. */
    public String OUTLIER_EXAMPLES;

    public static QcMetrics forLayer(final LayerQcMetrics layer) {
        final QcMetrics metrics = new QcMetrics();
        metrics.LAYER = layer.getLayer().getKey();
        metrics.TOTAL_GENES = layer.getTotalGenes();
        metrics.MISSING_COUNT = layer.getMissingCount();
        metrics.MISSING_RATE = toNullable(layer.getMissingRate());
        metrics.OUT_OF_RANGE_COUNT = layer.getOutOfRangeCount();
        metrics.fillDistribution(layer.getDistribution(), layer.getOutliers());
        return metrics;
    }

    public static QcMetrics forComposite(final QcReport report) {
        final QcMetrics metrics = new QcMetrics();
        metrics.LAYER = QualityControl.COMPOSITE;
        metrics.TOTAL_GENES = report.getTotalGenes();
        metrics.MISSING_COUNT = report.getTotalGenes() - report.getCompositeNonNullCount();
        metrics.MISSING_RATE = report.getTotalGenes() == 0 ? null : metrics.MISSING_COUNT / (double) report.getTotalGenes();
        metrics.OUT_OF_RANGE_COUNT = 0;
        metrics.fillDistribution(report.getCompositeDistribution(), report.getCompositeOutliers());
        return metrics;
    }

    private void fillDistribution(final Optional<DistributionStats> distribution, final OutlierSummary outliers) {
        if (distribution.isPresent()) {
            final DistributionStats stats = distribution.get();
            MEAN = stats.getMean();
            MEDIAN = stats.getMedian();
            STD = stats.getStd();
            MIN = stats.getMin();
            MAX = stats.getMax();
            P10 = stats.getP10();
            P25 = stats.getP25();
            P75 = stats.getP75();
            P90 = stats.getP90();
        }
        SCALED_MAD = toNullable(outliers.getScaledMad());
        if (outliers.isPerformed()) {
            OUTLIER_COUNT = outliers.getCount();
            OUTLIER_EXAMPLES = String.join(",", outliers.getExampleGeneIds());
        }
    }

    private static Double toNullable(final OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
