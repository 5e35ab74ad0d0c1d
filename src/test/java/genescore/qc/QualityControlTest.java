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

import genescore.scoring.CompositeScorer;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.Gene;
import genescore.scoring.LayerEvidence;
import genescore.scoring.ScoringResult;
import genescore.scoring.ScoringWeights;
import htsjdk.samtools.metrics.MetricsFile;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

public class QualityControlTest {
    private static final double EPSILON = 1e-9;

    private final QualityControl qc = new QualityControl(QcThresholds.DEFAULT);

    private static List<Gene> universe(final int n) {
        final List<Gene> genes = new ArrayList<>();
        for (int i = 0; i < n; ++i) {
            genes.add(new Gene(String.format("G%03d", i), "S" + i));
        }
        return genes;
    }

    @Test
    public void testMissingRateThresholds() {
        final List<Gene> genes = universe(10);
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        final LayerEvidence.Builder gnomad = LayerEvidence.builder(EvidenceLayer.GNOMAD);
        final LayerEvidence.Builder expression = LayerEvidence.builder(EvidenceLayer.EXPRESSION);
        for (int i = 0; i < 10; ++i) {
            gnomad.add(genes.get(i).getGeneId(), i / 10.0);
            if (i < 4) expression.add(genes.get(i).getGeneId(), i / 5.0);
        }
        evidence.put(EvidenceLayer.GNOMAD, gnomad.build());
        evidence.put(EvidenceLayer.EXPRESSION, expression.build());

        final ScoringResult result = new CompositeScorer().score(genes, evidence, ScoringWeights.defaults());
        final QcReport report = qc.runQc(result, evidence);

        Assert.assertEquals(report.getTotalGenes(), 10);
        Assert.assertEquals(report.getLayer(EvidenceLayer.GNOMAD).getMissingRate().getAsDouble(), 0.0, EPSILON);
        Assert.assertEquals(report.getLayer(EvidenceLayer.EXPRESSION).getMissingRate().getAsDouble(), 0.6, EPSILON);
        Assert.assertEquals(report.getLayer(EvidenceLayer.ANNOTATION).getMissingRate().getAsDouble(), 1.0, EPSILON);
        Assert.assertFalse(report.getLayer(EvidenceLayer.ANNOTATION).getDistribution().isPresent());

        Assert.assertTrue(report.getWarnings().stream().anyMatch(w -> w.startsWith("Layer expression: missing rate")));
        Assert.assertTrue(report.getErrors().stream().anyMatch(e -> e.startsWith("Layer annotation: missing rate")));
        Assert.assertTrue(report.getWarnings().contains("Layer annotation: no data"));
        Assert.assertFalse(report.passed());

        Assert.assertEquals(report.getCompositeNonNullCount(), 10);
        Assert.assertEquals(report.getCompositeDistribution().get().getCount(), 10);
    }

    @Test
    public void testEmptyUniverseHasNoMissingRate() {
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        final QcReport report = qc.runQc(new CompositeScorer().score(universe(0), evidence, ScoringWeights.defaults()), evidence);

        Assert.assertEquals(report.getTotalGenes(), 0);
        for (final LayerQcMetrics layer : report.getLayers().values()) {
            Assert.assertFalse(layer.getMissingRate().isPresent(), layer.getLayer().getKey());
        }
        Assert.assertTrue(report.getErrors().stream().noneMatch(e -> e.contains("missing rate")), report.getErrors().toString());
        Assert.assertTrue(report.getWarnings().contains("Composite score: no gene has a score"));
        Assert.assertFalse(report.getCompositeDistribution().isPresent());

        final QcMetrics composite = QcMetrics.forComposite(report);
        Assert.assertEquals(composite.LAYER, QualityControl.COMPOSITE);
        Assert.assertNull(composite.MISSING_RATE);
        Assert.assertNull(composite.MEAN);
    }

    @Test
    public void testQcMetricsFileColumns() throws IOException {
        final List<Gene> genes = universe(4);
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        final LayerEvidence.Builder gnomad = LayerEvidence.builder(EvidenceLayer.GNOMAD);
        genes.forEach(g -> gnomad.add(g.getGeneId(), 0.25));
        evidence.put(EvidenceLayer.GNOMAD, gnomad.build());
        final QcReport report = qc.runQc(new CompositeScorer().score(genes, evidence, ScoringWeights.defaults()), evidence);

        final MetricsFile<QcMetrics, Integer> file = new MetricsFile<>();
        report.getLayers().values().forEach(layer -> file.addMetric(QcMetrics.forLayer(layer)));
        file.addMetric(QcMetrics.forComposite(report));
        final StringWriter text = new StringWriter();
        file.write(text);

        final String[] lines = text.toString().split("\n");
        int classLine = 0;
        while (!lines[classLine].startsWith("## METRICS CLASS")) ++classLine;
        Assert.assertTrue(lines[classLine + 1].startsWith("LAYER\tTOTAL_GENES\t"), lines[classLine + 1]);

        final MetricsFile<QcMetrics, Integer> reread = new MetricsFile<>();
        reread.read(new StringReader(text.toString()));
        Assert.assertEquals(reread.getMetrics().size(), EvidenceLayer.values().length + 1);
        final QcMetrics gnomadRow = reread.getMetrics().get(0);
        Assert.assertEquals(gnomadRow.LAYER, EvidenceLayer.GNOMAD.getKey());
        Assert.assertEquals(gnomadRow.MISSING_RATE, 0.0, EPSILON);
        Assert.assertEquals(reread.getMetrics().get(EvidenceLayer.values().length).LAYER, QualityControl.COMPOSITE);
    }

    @Test
    public void testNoVariationWarning() {
        final List<Gene> genes = universe(5);
        final LayerEvidence.Builder builder = LayerEvidence.builder(EvidenceLayer.LITERATURE);
        genes.forEach(g -> builder.add(g.getGeneId(), 0.5));
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        evidence.put(EvidenceLayer.LITERATURE, builder.build());

        final QcReport report = qc.runQc(new CompositeScorer().score(genes, evidence, ScoringWeights.defaults()), evidence);
        Assert.assertTrue(report.getWarnings().stream().anyMatch(w -> w.startsWith("Layer literature: no variation")));
        Assert.assertFalse(report.getLayer(EvidenceLayer.LITERATURE).getOutliers().isPerformed());
    }

    @Test
    public void testOutOfRangeValuesAreErrors() {
        final List<Gene> genes = universe(3);
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        evidence.put(EvidenceLayer.GNOMAD, LayerEvidence.builder(EvidenceLayer.GNOMAD)
                .add("G000", 0.2).add("G001", -0.5).add("G002", 0.9).build());

        final QcReport report = qc.runQc(new CompositeScorer().score(genes, evidence, ScoringWeights.defaults()), evidence);
        Assert.assertEquals(report.getLayer(EvidenceLayer.GNOMAD).getOutOfRangeCount(), 1);
        Assert.assertEquals(report.getLayer(EvidenceLayer.GNOMAD).getMissingCount(), 1);
        Assert.assertTrue(report.getErrors().contains("Layer gnomad: 1 values outside [0,1]"));
    }

    @Test
    public void testOutlierDetection() {
        final List<QualityControl.GeneValue> values = new ArrayList<>();
        final double[] data = {0.40, 0.42, 0.44, 0.46, 0.48, 0.50, 0.52, 0.99, 0.01};
        for (int i = 0; i < data.length; ++i) {
            values.add(new QualityControl.GeneValue("G" + i, data[i]));
        }
        final OutlierSummary summary = qc.detectOutliers(values);
        Assert.assertTrue(summary.isPerformed());
        Assert.assertEquals(summary.getMedian().getAsDouble(), 0.46, EPSILON);
        Assert.assertEquals(summary.getCount(), 2);
        Assert.assertEquals(summary.getExampleGeneIds(), Arrays.asList("G7", "G8"));
    }

    @Test
    public void testOutlierDetectionSkippedWhenEmpty() {
        final OutlierSummary summary = qc.detectOutliers(new ArrayList<>());
        Assert.assertFalse(summary.isPerformed());
        Assert.assertEquals(summary.getMedian(), OptionalDouble.empty());
        Assert.assertEquals(summary.getCount(), 0);
    }

    @Test
    public void testDistributionStats() {
        final DistributionStats stats = DistributionStats.of(new double[]{1, 2, 3, 4, 5}).get();
        Assert.assertEquals(stats.getCount(), 5);
        Assert.assertEquals(stats.getMean(), 3.0, EPSILON);
        Assert.assertEquals(stats.getMedian(), 3.0, EPSILON);
        Assert.assertEquals(stats.getStd(), Math.sqrt(2.0), EPSILON);
        Assert.assertEquals(stats.getMin(), 1.0, EPSILON);
        Assert.assertEquals(stats.getMax(), 5.0, EPSILON);
        Assert.assertEquals(stats.getP25(), 2.0, EPSILON);
        Assert.assertEquals(stats.getP90(), 4.6, EPSILON);
        Assert.assertFalse(DistributionStats.of(new double[0]).isPresent());
    }
}
