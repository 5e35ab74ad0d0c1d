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

package genescore.config;

import genescore.ConfigurationException;
import genescore.qc.QcThresholds;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.QualityFlagThresholds;
import genescore.scoring.ScoringWeights;
import genescore.sensitivity.SensitivityParameters;
import genescore.tier.TierThresholds;
import genescore.validation.ControlValidationParameters;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.Properties;

public class ScoringConfigurationTest {

    private static Properties properties(final String... keysAndValues) {
        final Properties properties = new Properties();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            properties.setProperty(keysAndValues[i], keysAndValues[i + 1]);
        }
        return properties;
    }

    @Test
    public void testDefaults() {
        final ScoringConfiguration configuration = ScoringConfiguration.defaults();
        Assert.assertEquals(configuration.getWeights(), ScoringWeights.defaults());
        Assert.assertEquals(configuration.getTierThresholds().getHighMinScore(), TierThresholds.DEFAULT.getHighMinScore());
        Assert.assertEquals(configuration.getTierThresholds().getMediumMinEvidence(), TierThresholds.DEFAULT.getMediumMinEvidence());
        Assert.assertEquals(configuration.getQcThresholds().getMissingErrorRate(), QcThresholds.DEFAULT.getMissingErrorRate());
        Assert.assertEquals(configuration.getQcThresholds().getMadMultiplier(), QcThresholds.DEFAULT.getMadMultiplier());
        Assert.assertEquals(configuration.getControlValidationParameters().getRecallKAbsolute(),
                ControlValidationParameters.DEFAULT.getRecallKAbsolute());
        Assert.assertEquals(configuration.getControlValidationParameters().getRecallKPercent(),
                ControlValidationParameters.DEFAULT.getRecallKPercent());
        Assert.assertEquals(configuration.getSensitivityParameters().getDeltas(), SensitivityParameters.DEFAULT.getDeltas());
        Assert.assertEquals(configuration.getSensitivityParameters().getTopN(), SensitivityParameters.DEFAULT.getTopN());
        Assert.assertEquals(configuration.getQualityFlagThresholds().getSufficientMinEvidence(),
                QualityFlagThresholds.DEFAULT.getSufficientMinEvidence());
        Assert.assertEquals(ScoringConfiguration.load(null).getFingerprint(), configuration.getFingerprint());
    }

    @Test
    public void testOverrides() {
        final ScoringConfiguration configuration = ScoringConfiguration.fromProperties(properties(
                "weights.gnomad", "0.30",
                "weights.expression", " 0.10 ",
                "tier.high.min_score", "0.8",
                "sensitivity.deltas", "-0.2, 0.2",
                "some.other.tool", "ignored"));
        Assert.assertEquals(configuration.getWeights().get(EvidenceLayer.GNOMAD), 0.30, 1e-12);
        Assert.assertEquals(configuration.getWeights().get(EvidenceLayer.EXPRESSION), 0.10, 1e-12);
        Assert.assertEquals(configuration.getTierThresholds().getHighMinScore(), 0.8);
        Assert.assertEquals(configuration.getSensitivityParameters().getDeltas(), Arrays.asList(-0.2, 0.2));
        Assert.assertFalse(configuration.getValues().containsKey("some.other.tool"));
        Assert.assertEquals(configuration.getValues().get("weights.expression"), "0.10");
    }

    @DataProvider
    public Object[][] invalidOverrides() {
        return new Object[][]{
                {properties("weights.gnomda", "0.2")},
                {properties("tier.high.min_score", "high")},
                {properties("tier.high.min_evidence", "3.5")},
                {properties("weights.gnomad", "0.5")},
                {properties("controls.recall.k_absolute", "100,lots")},
                {properties("qc.min_std", "")},
                {properties("sensitivity.top_n", "0")},
        };
    }

    @Test(dataProvider = "invalidOverrides", expectedExceptions = ConfigurationException.class)
    public void testInvalidOverrides(final Properties overrides) {
        ScoringConfiguration.fromProperties(overrides);
    }

    @Test
    public void testFingerprint() {
        final String defaults = ScoringConfiguration.defaults().getFingerprint();
        Assert.assertEquals(defaults.length(), 64);
        Assert.assertEquals(ScoringConfiguration.fromProperties(properties("weights.gnomad", "0.20")).getFingerprint(), defaults,
                "overriding a key with its default value does not change the fingerprint");
        Assert.assertNotEquals(ScoringConfiguration.fromProperties(properties("tier.high.min_score", "0.75")).getFingerprint(), defaults);
    }

    @Test
    public void testLoadFile() throws IOException {
        final File file = File.createTempFile("ScoringConfigurationTest.", ".properties");
        file.deleteOnExit();
        try (final Writer writer = new FileWriter(file)) {
            writer.write("# overrides\nqc.missing.warn_rate=0.4\n");
        }
        Assert.assertEquals(ScoringConfiguration.load(file).getQcThresholds().getMissingWarnRate(), 0.4);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testLoadMissingFile() {
        ScoringConfiguration.load(new File("/no/such/dir/scoring.properties"));
    }
}
