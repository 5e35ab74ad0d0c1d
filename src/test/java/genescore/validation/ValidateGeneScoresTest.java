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

import genescore.cmdline.CommandLineProgramTest;
import genescore.qc.QcMetrics;
import genescore.scoring.EvidenceLayer;
import genescore.sensitivity.SensitivityMetrics;
import genescore.sensitivity.Stability;
import htsjdk.samtools.metrics.MetricsFile;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class ValidateGeneScoresTest extends CommandLineProgramTest {
    private static final int GENES = 30;

    @Override
    public String getCommandLineProgramName() {
        return ValidateGeneScores.class.getSimpleName();
    }

    /** Thirty genes S0..S29 scoring i/30 in both gnomad and expression. */
    private List<String> inputArgs() throws IOException {
        final List<String> universe = new ArrayList<>();
        final List<String> scores = new ArrayList<>();
        universe.add("gene_id\tgene_symbol");
        scores.add("gene_id\tscore");
        for (int i = 0; i < GENES; ++i) {
            universe.add("G" + i + "\tS" + i);
            scores.add("G" + i + "\t" + (i / (double) GENES));
        }
        final File genes = writeTempFile("universe.tsv", universe.toArray(new String[0]));
        final File gnomad = writeTempFile("gnomad.tsv", scores.toArray(new String[0]));
        final File expression = writeTempFile("expression.tsv", scores.toArray(new String[0]));
        return new ArrayList<>(Arrays.asList(
                "-G", genes.getAbsolutePath(),
                "-E", "gnomad:" + gnomad.getAbsolutePath(),
                "-E", "expression:" + expression.getAbsolutePath()));
    }

    private File controls(final String name, final String... symbols) throws IOException {
        final List<String> lines = new ArrayList<>();
        lines.add("gene_symbol\tsource");
        for (final String symbol : symbols) lines.add(symbol + "\tomim");
        return writeTempFile(name, lines.toArray(new String[0]));
    }

    private static String read(final File file) throws IOException {
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    }

    /** The column header line that follows the metrics class line. */
    private static String metricsColumns(final File metricsFile) throws IOException {
        final List<String> lines = Files.readAllLines(metricsFile.toPath(), StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size() - 1; ++i) {
            if (lines.get(i).startsWith("## METRICS CLASS")) return lines.get(i + 1);
        }
        throw new AssertionError("No metrics section in " + metricsFile);
    }

    @Test
    public void testPassingValidation() throws IOException {
        final File report = getTempOutputFile("report", ".md");
        final String prefix = new File(getTempOutputDir(), "validation").getAbsolutePath();
        final List<String> args = inputArgs();
        args.addAll(Arrays.asList(
                "-R", report.getAbsolutePath(),
                "-M", prefix,
                "--POSITIVE_CONTROLS", controls("known_genes.tsv", "S29", "S28", "S27", "S26").getAbsolutePath(),
                "--NEGATIVE_CONTROLS", controls("housekeeping.tsv", "S0", "S1", "S2").getAbsolutePath(),
                "--THREADS", "2"));
        Assert.assertEquals(runCommandLine(args), 0);

        final String markdown = read(report);
        Assert.assertTrue(markdown.contains("**Verdict:** PASS"), markdown);
        Assert.assertTrue(markdown.contains("Configuration fingerprint: `"));
        Assert.assertTrue(markdown.contains("No weight changes suggested."));

        final List<ControlValidationMetrics> control = MetricsFile.readBeans(new File(prefix + ValidateGeneScores.CONTROL_METRICS_EXTENSION));
        Assert.assertEquals(control.size(), 2);
        Assert.assertEquals(control.get(0).CONTROL_SET, "known_genes");
        Assert.assertEquals(control.get(0).ROLE, ControlRole.POSITIVE);
        Assert.assertEquals(control.get(0).OUTCOME, ControlOutcome.PASSED);
        Assert.assertEquals(control.get(0).POPULATION_SIZE, GENES);
        Assert.assertEquals(control.get(0).MEDIAN_PERCENTILE, 28.5 / GENES, 1e-6);
        Assert.assertNull(control.get(0).HIGH_TIER_COUNT);
        Assert.assertEquals(control.get(1).CONTROL_SET, "housekeeping");
        Assert.assertEquals(control.get(1).OUTCOME, ControlOutcome.PASSED);
        Assert.assertEquals(control.get(1).HIGH_TIER_COUNT, Integer.valueOf(0));

        final List<RecallMetrics> recall = MetricsFile.readBeans(new File(prefix + ValidateGeneScores.RECALL_METRICS_EXTENSION));
        Assert.assertTrue(recall.stream().anyMatch(r -> r.SOURCE.equals(ValidateGeneScores.ALL_SOURCES)));
        Assert.assertTrue(recall.stream().anyMatch(r -> r.SOURCE.equals("omim")));
        final RecallMetrics top100 = recall.stream()
                .filter(r -> r.SOURCE.equals(ValidateGeneScores.ALL_SOURCES) && r.CUTOFF.equals("100")).findFirst().get();
        Assert.assertEquals(top100.K, GENES, "an absolute cutoff is clamped to the population size");
        Assert.assertEquals(top100.RECALL, 1.0, 1e-12);
        Assert.assertTrue(metricsColumns(new File(prefix + ValidateGeneScores.RECALL_METRICS_EXTENSION)).startsWith("CONTROL_SET\tSOURCE\t"));
        Assert.assertTrue(metricsColumns(new File(prefix + ValidateGeneScores.QC_METRICS_EXTENSION)).startsWith("LAYER\tTOTAL_GENES\t"));

        final List<QcMetrics> qc = MetricsFile.readBeans(new File(prefix + ValidateGeneScores.QC_METRICS_EXTENSION));
        Assert.assertEquals(qc.size(), EvidenceLayer.values().length + 1);

        final List<SensitivityMetrics> sensitivity = MetricsFile.readBeans(new File(prefix + ValidateGeneScores.SENSITIVITY_METRICS_EXTENSION));
        Assert.assertEquals(sensitivity.size(), EvidenceLayer.values().length * 4);
        for (final SensitivityMetrics row : sensitivity) {
            Assert.assertEquals(row.STABILITY, Stability.STABLE);
            Assert.assertEquals(row.SPEARMAN_RHO, 1.0, 1e-9);
        }
    }

    @Test
    public void testFailingPositiveControls() throws IOException {
        final File report = getTempOutputFile("report", ".md");
        final List<String> args = inputArgs();
        args.addAll(Arrays.asList(
                "-R", report.getAbsolutePath(),
                "--POSITIVE_CONTROLS", controls("known_genes.tsv", "S0", "S1", "S2").getAbsolutePath(),
                "--NEGATIVE_CONTROLS", controls("housekeeping.tsv", "S3").getAbsolutePath(),
                "--SKIP_SENSITIVITY", "true"));
        Assert.assertEquals(runCommandLine(args), 0, "a FAIL verdict is not an error unless requested");
        Assert.assertTrue(read(report).contains("**Verdict:** FAIL"));

        args.addAll(Arrays.asList("--FAIL_ON_VALIDATION_FAILURE", "true"));
        Assert.assertEquals(runCommandLine(args), 1);
        final String markdown = read(report);
        Assert.assertTrue(markdown.contains("**INCREASE gnomad**"), markdown);
        Assert.assertTrue(markdown.contains("## Sensitivity Analysis\n\nNot run."));
    }

    @Test
    public void testBuiltinControlsAbsentFromUniverse() throws IOException {
        final File report = getTempOutputFile("report", ".md");
        final List<String> args = inputArgs();
        args.addAll(Arrays.asList(
                "-R", report.getAbsolutePath(),
                "--SKIP_SENSITIVITY", "true",
                "--FAIL_ON_VALIDATION_FAILURE", "true"));
        Assert.assertEquals(runCommandLine(args), 0);
        final String markdown = read(report);
        Assert.assertTrue(markdown.contains("**Verdict:** INCONCLUSIVE"), markdown);
        Assert.assertTrue(markdown.contains("- Control set: " + ControlSets.BUILTIN_POSITIVE));
        Assert.assertTrue(markdown.contains("Data issue: MISSING_CONTROL_GENE MYO7A"));
    }

    @Test
    public void testUnreadableControlsIsUsageError() throws IOException {
        final List<String> args = inputArgs();
        args.addAll(Arrays.asList(
                "-R", getTempOutputFile("report", ".md").getAbsolutePath(),
                "--POSITIVE_CONTROLS", new File(getTempOutputDir(), "no_such_controls.tsv").getAbsolutePath()));
        Assert.assertEquals(runCommandLine(args), 1);
    }
}
