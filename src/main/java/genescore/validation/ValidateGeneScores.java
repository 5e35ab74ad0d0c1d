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

import genescore.cmdline.CommandLineProgram;
import genescore.cmdline.StandardOptionDefinitions;
import genescore.cmdline.argumentcollections.EvidenceInputArgumentCollection;
import genescore.cmdline.programgroups.GenePrioritizationProgramGroup;
import genescore.config.ScoringConfiguration;
import genescore.io.EvidenceTableReader;
import genescore.qc.QcMetrics;
import genescore.qc.QcReport;
import genescore.qc.QualityControl;
import genescore.report.MarkdownReportWriter;
import genescore.report.ValidationReport;
import genescore.report.ValidationReporter;
import genescore.report.Verdict;
import genescore.scoring.CompositeScorer;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.Gene;
import genescore.scoring.LayerEvidence;
import genescore.scoring.ScoringResult;
import genescore.scoring.ScoringSummary;
import genescore.sensitivity.SensitivityAnalysis;
import genescore.sensitivity.SensitivityAnalysisResult;
import genescore.sensitivity.SensitivityMetrics;
import genescore.tier.TierClassifier;
import genescore.tier.TierSummary;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that a scoring configuration ranks known disease genes high and housekeeping genes low, and that the
 * ranking survives small changes to the weights. The outcome is written as a Markdown report with a verdict.
 */
@DocumentedFeature
@CommandLineProgramProperties(
        summary = ValidateGeneScores.USAGE_SUMMARY + ValidateGeneScores.USAGE_DETAILS,
        oneLineSummary = ValidateGeneScores.USAGE_SUMMARY,
        programGroup = GenePrioritizationProgramGroup.class
)
public class ValidateGeneScores extends CommandLineProgram {
    static final String USAGE_SUMMARY = "Validates composite gene scores against control genes and weight perturbations.  ";
    static final String USAGE_DETAILS = "<p>Scores the gene universe exactly as ScoreGenes does, then runs QC, ranks the scored " +
            "genes by percentile and checks where the positive and negative control genes fall. Unless skipped, each layer " +
            "weight is perturbed and the top-ranked genes are compared with the baseline by Spearman correlation. The " +
            "verdict is PASS, PARTIAL, FAIL or INCONCLUSIVE. Any weight recommendations it makes must be re-validated on " +
            "independent controls, since tuning on the same controls is circular.</p>" +
            "<p>Control tables have a gene_symbol column and an optional source column. The built-in positive controls " +
            "are the OMIM Usher syndrome genes and the SYSCILIA gold standard core ciliary genes; the built-in negative " +
            "controls are housekeeping genes.</p>" +
            "<h4>Usage example:</h4>" +
            "<pre>" +
            "java -jar genescore.jar ValidateGeneScores \\<br />" +
            "      -G universe.tsv \\<br />" +
            "      -E gnomad:gnomad.tsv \\<br />" +
            "      -E expression:expression.tsv \\<br />" +
            "      -R validation_report.md \\<br />" +
            "      -M validation" +
            "</pre>" +
            "<hr />";

    public static final String QC_METRICS_EXTENSION = ".qc_metrics";
    public static final String CONTROL_METRICS_EXTENSION = ".control_metrics";
    public static final String RECALL_METRICS_EXTENSION = ".recall_metrics";
    public static final String SENSITIVITY_METRICS_EXTENSION = ".sensitivity_metrics";

    /** SOURCE value of recall rows covering a whole control set. */
    public static final String ALL_SOURCES = "all";

    @ArgumentCollection
    public EvidenceInputArgumentCollection INPUTS = new EvidenceInputArgumentCollection();

    @Argument(shortName = StandardOptionDefinitions.REPORT_SHORT_NAME, doc = "Write the Markdown validation report to this file.")
    public File REPORT;

    @Argument(shortName = StandardOptionDefinitions.METRICS_FILE_SHORT_NAME,
            doc = "Path prefix for the metrics files. Writes " + QC_METRICS_EXTENSION + ", " + CONTROL_METRICS_EXTENSION + ", " +
                    RECALL_METRICS_EXTENSION + " and, unless skipped, " + SENSITIVITY_METRICS_EXTENSION + ".", optional = true)
    public String METRICS_PREFIX;

    @Argument(doc = "Positive control table. Defaults to the built-in positive controls.", optional = true)
    public File POSITIVE_CONTROLS;

    @Argument(doc = "Negative control table. Defaults to the built-in negative controls.", optional = true)
    public File NEGATIVE_CONTROLS;

    @Argument(doc = "Skip the weight sensitivity sweep. The verdict can then be at best PARTIAL.", optional = true)
    public boolean SKIP_SENSITIVITY = false;

    @Argument(doc = "Number of threads used for the sensitivity sweep.", optional = true, minValue = 1)
    public int THREADS = 1;

    @Argument(doc = "Return a non-zero exit status when the verdict is FAIL.", optional = true)
    public boolean FAIL_ON_VALIDATION_FAILURE = false;

    private static final Log log = Log.getInstance(ValidateGeneScores.class);

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>(INPUTS.validate());
        if (POSITIVE_CONTROLS != null && !POSITIVE_CONTROLS.canRead()) {
            errors.add("Cannot read POSITIVE_CONTROLS file " + POSITIVE_CONTROLS);
        }
        if (NEGATIVE_CONTROLS != null && !NEGATIVE_CONTROLS.canRead()) {
            errors.add("Cannot read NEGATIVE_CONTROLS file " + NEGATIVE_CONTROLS);
        }
        if (!errors.isEmpty()) {
            return errors.toArray(new String[0]);
        }
        return super.customCommandLineValidation();
    }

    @Override
    protected int doWork() {
        IOUtil.assertFileIsWritable(REPORT);

        final ScoringConfiguration configuration = loadConfiguration(INPUTS.CONFIG);

        final ControlSet positiveControls = loadControls(POSITIVE_CONTROLS, ControlRole.POSITIVE);
        final ControlSet negativeControls = loadControls(NEGATIVE_CONTROLS, ControlRole.NEGATIVE);

        final List<Gene> genes = INPUTS.readGenes();
        final Map<EvidenceLayer, LayerEvidence> evidence = INPUTS.readEvidence();

        final CompositeScorer scorer = new CompositeScorer(configuration.getQualityFlagThresholds());
        final ScoringResult result = scorer.score(genes, evidence, configuration.getWeights());
        new ScoringSummary(result).log(log);

        final QcReport qc = new QualityControl(configuration.getQcThresholds()).runQc(result, evidence);
        final TierClassifier classifier = new TierClassifier(configuration.getTierThresholds());
        final TierSummary tiers = new TierSummary(result.getRecords(), classifier);

        final ControlValidator validator = new ControlValidator(configuration.getControlValidationParameters(), classifier);
        final PercentileRanker ranker = new PercentileRanker(result.getRecords());
        final PositiveControlResult positive = validator.validatePositive(ranker, positiveControls);
        final NegativeControlResult negative = validator.validateNegative(ranker, negativeControls);

        final Optional<SensitivityAnalysisResult> sensitivity;
        if (SKIP_SENSITIVITY) {
            log.info("Skipping sensitivity analysis");
            sensitivity = Optional.empty();
        } else {
            sensitivity = Optional.of(new SensitivityAnalysis(scorer, configuration.getSensitivityParameters(), THREADS)
                    .analyze(genes, evidence, configuration.getWeights()));
        }

        final ValidationReport report = new ValidationReporter()
                .report(qc, tiers, positive, negative, sensitivity, result.getDataIssues());
        new MarkdownReportWriter(configuration.getFingerprint()).write(report, REPORT);
        log.info("Wrote validation report to ", REPORT);

        if (METRICS_PREFIX != null) {
            writeMetrics(qc, positive, negative, sensitivity);
        }

        if (FAIL_ON_VALIDATION_FAILURE && report.getVerdict() == Verdict.FAIL) {
            log.error("Validation verdict is FAIL");
            return 1;
        }
        return 0;
    }

    private ControlSet loadControls(final File file, final ControlRole role) {
        if (file == null) {
            return role == ControlRole.POSITIVE ? ControlSets.builtinPositive() : ControlSets.builtinNegative();
        }
        final String name = file.getName().replaceFirst("\\.[^.]*$", "");
        return EvidenceTableReader.readControlSet(name, role, file);
    }

    private void writeMetrics(final QcReport qc, final PositiveControlResult positive, final NegativeControlResult negative,
                              final Optional<SensitivityAnalysisResult> sensitivity) {
        final MetricsFile<QcMetrics, Integer> qcFile = getMetricsFile();
        qc.getLayers().values().forEach(layer -> qcFile.addMetric(QcMetrics.forLayer(layer)));
        qcFile.addMetric(QcMetrics.forComposite(qc));
        qcFile.write(new File(METRICS_PREFIX + QC_METRICS_EXTENSION));

        final MetricsFile<ControlValidationMetrics, Integer> controlFile = getMetricsFile();
        controlFile.addMetric(ControlValidationMetrics.of(positive));
        controlFile.addMetric(ControlValidationMetrics.of(negative));
        controlFile.write(new File(METRICS_PREFIX + CONTROL_METRICS_EXTENSION));

        final String setName = positive.getControlSet().getName();
        final MetricsFile<RecallMetrics, Integer> recallFile = getMetricsFile();
        positive.getRecall().forEach(recall -> recallFile.addMetric(RecallMetrics.of(setName, ALL_SOURCES, recall)));
        for (final SourceBreakdown source : positive.getSourceBreakdown()) {
            source.getRecall().forEach(recall -> recallFile.addMetric(RecallMetrics.of(setName, source.getSource(), recall)));
        }
        recallFile.write(new File(METRICS_PREFIX + RECALL_METRICS_EXTENSION));

        sensitivity.ifPresent(analysis -> {
            final MetricsFile<SensitivityMetrics, Integer> sensitivityFile = getMetricsFile();
            analysis.getResults().forEach(r -> sensitivityFile.addMetric(SensitivityMetrics.of(r)));
            sensitivityFile.write(new File(METRICS_PREFIX + SENSITIVITY_METRICS_EXTENSION));
        });
    }
}
