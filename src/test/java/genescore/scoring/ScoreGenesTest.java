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

import genescore.ConfigurationException;
import genescore.cmdline.CommandLineProgramTest;
import genescore.qc.QcMetrics;
import genescore.qc.QualityControl;
import genescore.tier.Tier;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.metrics.StringHeader;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class ScoreGenesTest extends CommandLineProgramTest {

    @Override
    public String getCommandLineProgramName() {
        return ScoreGenes.class.getSimpleName();
    }

    private File genes() throws IOException {
        return writeTempFile("genes.tsv",
                "gene_id\tgene_symbol",
                "ENSG1\tMYO7A",
                "ENSG2\tUSH2A",
                "ENSG3\tGAPDH",
                "ENSG4\tORPHAN");
    }

    private List<String> args(final File output, final String... extra) throws IOException {
        final File gnomad = writeTempFile("gnomad.tsv",
                "gene_id\tscore",
                "ENSG1\t0.9",
                "ENSG2\t0.5",
                "ENSG3\t0.1",
                "ENSG4\tNA",
                "ENSG99\t0.7");
        final File expression = writeTempFile("expression.tsv",
                "gene_id\tscore",
                "ENSG1\t0.7",
                "ENSG2\t1.5",
                "ENSG3\t0.3");
        final List<String> args = new ArrayList<>(Arrays.asList(
                "-G", genes().getAbsolutePath(),
                "-E", "gnomad:" + gnomad.getAbsolutePath(),
                "-E", "expression:" + expression.getAbsolutePath(),
                "-O", output.getAbsolutePath()));
        args.addAll(Arrays.asList(extra));
        return args;
    }

    @Test
    public void testScoreGenes() throws IOException {
        final File output = getTempOutputFile("scored", ".metrics");
        final File qcOutput = getTempOutputFile("scored", ".qc_metrics");
        Assert.assertEquals(runCommandLine(args(output, "-M", qcOutput.getAbsolutePath())), 0);

        final List<ScoredGeneMetrics> scored = MetricsFile.readBeans(output);
        Assert.assertEquals(scored.size(), 4);

        final ScoredGeneMetrics first = scored.get(0);
        Assert.assertEquals(first.GENE_ID, "ENSG1");
        Assert.assertEquals(first.GENE_SYMBOL, "MYO7A");
        // equal default weights for gnomad and expression
        Assert.assertEquals(first.COMPOSITE_SCORE, 0.8, 1e-6);
        Assert.assertEquals(first.EVIDENCE_COUNT, 2);
        Assert.assertEquals(first.QUALITY_FLAG, QualityFlag.MODERATE);
        Assert.assertEquals(first.TIER, Tier.MEDIUM);
        Assert.assertEquals(first.SUPPORTING_LAYERS, "gnomad,expression");
        Assert.assertNull(first.ANNOTATION_SCORE);

        final ScoredGeneMetrics outOfRange = scored.stream().filter(m -> m.GENE_ID.equals("ENSG2")).findFirst().get();
        Assert.assertEquals(outOfRange.EVIDENCE_COUNT, 1, "the out-of-range expression score is excluded");
        Assert.assertEquals(outOfRange.QUALITY_FLAG, QualityFlag.SPARSE);
        Assert.assertEquals(outOfRange.COMPOSITE_SCORE, 0.5, 1e-6);
        Assert.assertNull(outOfRange.EXPRESSION_SCORE);

        final ScoredGeneMetrics last = scored.get(3);
        Assert.assertEquals(last.GENE_ID, "ENSG4");
        Assert.assertNull(last.COMPOSITE_SCORE);
        Assert.assertEquals(last.EVIDENCE_COUNT, 0);
        Assert.assertEquals(last.QUALITY_FLAG, QualityFlag.NONE);
        Assert.assertEquals(last.TIER, Tier.LOW);

        final MetricsFile<QcMetrics, Integer> qc = new MetricsFile<>();
        try (final FileReader reader = new FileReader(qcOutput)) {
            qc.read(reader);
        }
        Assert.assertTrue(qc.getHeaders().stream().anyMatch(h ->
                h instanceof StringHeader && ((StringHeader) h).getValue().startsWith("Configuration fingerprint: ")));
        final List<QcMetrics> rows = qc.getMetrics();
        Assert.assertEquals(rows.size(), EvidenceLayer.values().length + 1);
        Assert.assertEquals(rows.get(rows.size() - 1).LAYER, QualityControl.COMPOSITE);
        final QcMetrics expression = rows.stream().filter(r -> r.LAYER.equals("expression")).findFirst().get();
        Assert.assertEquals(expression.OUT_OF_RANGE_COUNT, 1);
    }

    @Test
    public void testConfigOverride() throws IOException {
        final File config = writeTempFile("weights.properties",
                "weights.gnomad=0.30",
                "weights.expression=0.10");
        final File output = getTempOutputFile("scored", ".metrics");
        Assert.assertEquals(runCommandLine(args(output, "-C", config.getAbsolutePath())), 0);

        final List<ScoredGeneMetrics> scored = MetricsFile.readBeans(output);
        final ScoredGeneMetrics myo7a = scored.stream().filter(m -> m.GENE_ID.equals("ENSG1")).findFirst().get();
        Assert.assertEquals(myo7a.COMPOSITE_SCORE, (0.3 * 0.9 + 0.1 * 0.7) / 0.4, 1e-6);
    }

    @Test
    public void testInvalidConfigFails() throws IOException {
        final File config = writeTempFile("bad.properties", "weights.gnomad=lots");
        final File output = getTempOutputFile("scored", ".metrics");
        try {
            runCommandLine(args(output, "-C", config.getAbsolutePath()));
            Assert.fail("an invalid configuration must stop the run");
        } catch (final ConfigurationException e) {
            Assert.assertTrue(e.getMessage().contains("weights.gnomad"), e.getMessage());
        }
    }

    @Test
    public void testMissingEvidenceFileIsUsageError() throws IOException {
        final File output = getTempOutputFile("scored", ".metrics");
        Assert.assertEquals(runCommandLine(Arrays.asList(
                "-G", genes().getAbsolutePath(),
                "-E", "gnomad:" + new File(getTempOutputDir(), "missing.tsv").getAbsolutePath(),
                "-O", output.getAbsolutePath())), 1);
    }

    @Test
    public void testUnknownLayerIsUsageError() throws IOException {
        final File output = getTempOutputFile("scored", ".metrics");
        Assert.assertEquals(runCommandLine(Arrays.asList(
                "-G", genes().getAbsolutePath(),
                "-E", "proteomics:" + genes().getAbsolutePath(),
                "-O", output.getAbsolutePath())), 1);
    }
}
