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

import genescore.cmdline.CommandLineProgram;
import genescore.cmdline.StandardOptionDefinitions;
import genescore.cmdline.argumentcollections.EvidenceInputArgumentCollection;
import genescore.cmdline.programgroups.GenePrioritizationProgramGroup;
import genescore.config.ScoringConfiguration;
import genescore.qc.QcMetrics;
import genescore.qc.QcReport;
import genescore.qc.QualityControl;
import genescore.tier.Tier;
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
import java.util.List;
import java.util.Map;

/**
 * Scores every gene in a universe by combining per-layer evidence into a weighted composite, assigns confidence
 * tiers and runs data-quality checks on the inputs and the result.
 */
@DocumentedFeature
@CommandLineProgramProperties(
        summary = ScoreGenes.USAGE_SUMMARY + ScoreGenes.USAGE_DETAILS,
        oneLineSummary = ScoreGenes.USAGE_SUMMARY,
        programGroup = GenePrioritizationProgramGroup.class
)
public class ScoreGenes extends CommandLineProgram {
    static final String USAGE_SUMMARY = "Computes weighted composite scores and confidence tiers for a gene universe.  ";
    static final String USAGE_DETAILS = "<p>Each evidence layer is a table of per-gene scores in [0, 1]. The composite score of " +
            "a gene is the weighted average of the layers that have a score for it, divided by the total weight of those " +
            "layers, so missing evidence is neither penalized nor rewarded. Genes are then tiered by score and by the " +
            "number of layers supporting them.</p>" +
            "<h4>Usage example:</h4>" +
            "<pre>" +
            "java -jar genescore.jar ScoreGenes \\<br />" +
            "      -G universe.tsv \\<br />" +
            "      -E gnomad:gnomad.tsv \\<br />" +
            "      -E expression:expression.tsv \\<br />" +
            "      -O scored_genes.metrics \\<br />" +
            "      -M qc.metrics" +
            "</pre>" +
            "<hr />";

    @ArgumentCollection
    public EvidenceInputArgumentCollection INPUTS = new EvidenceInputArgumentCollection();

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME, doc = "Write one row of scores per gene to this metrics file.")
    public File OUTPUT;

    @Argument(shortName = StandardOptionDefinitions.METRICS_FILE_SHORT_NAME,
            doc = "Write per-layer and composite QC metrics to this file.", optional = true)
    public File QC_METRICS;

    private static final Log log = Log.getInstance(ScoreGenes.class);

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = INPUTS.validate();
        if (!errors.isEmpty()) {
            return errors.toArray(new String[0]);
        }
        return super.customCommandLineValidation();
    }

    @Override
    protected int doWork() {
        IOUtil.assertFileIsWritable(OUTPUT);
        if (QC_METRICS != null) IOUtil.assertFileIsWritable(QC_METRICS);

        final ScoringConfiguration configuration = loadConfiguration(INPUTS.CONFIG);

        final List<Gene> genes = INPUTS.readGenes();
        final Map<EvidenceLayer, LayerEvidence> evidence = INPUTS.readEvidence();

        final ScoringResult result = new CompositeScorer(configuration.getQualityFlagThresholds())
                .score(genes, evidence, configuration.getWeights());
        new ScoringSummary(result).log(log);
        for (final DataIssue issue : result.getDataIssues()) {
            log.warn(issue);
        }

        final TierClassifier classifier = new TierClassifier(configuration.getTierThresholds());
        final TierSummary tiers = new TierSummary(result.getRecords(), classifier);
        log.info("Tiers: HIGH=", tiers.getCount(Tier.HIGH), ", MEDIUM=", tiers.getCount(Tier.MEDIUM), ", LOW=", tiers.getCount(Tier.LOW));

        final QcReport qc = new QualityControl(configuration.getQcThresholds()).runQc(result, evidence);
        qc.getErrors().forEach(error -> log.error("QC error: ", error));
        qc.getWarnings().forEach(warning -> log.warn("QC warning: ", warning));

        final MetricsFile<ScoredGeneMetrics, Integer> scoredFile = getMetricsFile();
        for (final CompositeScoreRecord record : result.getRecords()) {
            scoredFile.addMetric(ScoredGeneMetrics.of(record, classifier.classify(record)));
        }
        scoredFile.write(OUTPUT);

        if (QC_METRICS != null) {
            final MetricsFile<QcMetrics, Integer> qcFile = getMetricsFile();
            qc.getLayers().values().forEach(layer -> qcFile.addMetric(QcMetrics.forLayer(layer)));
            qcFile.addMetric(QcMetrics.forComposite(qc));
            qcFile.write(QC_METRICS);
        }

        return 0;
    }
}
