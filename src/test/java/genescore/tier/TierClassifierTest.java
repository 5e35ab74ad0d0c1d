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

package genescore.tier;

import genescore.ConfigurationException;
import genescore.scoring.CompositeScoreRecord;
import genescore.scoring.QualityFlag;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;

import static genescore.scoring.ScoringTestUtils.record;
import static genescore.scoring.ScoringTestUtils.unscored;

public class TierClassifierTest {
    private final TierClassifier classifier = new TierClassifier(TierThresholds.DEFAULT);

    @DataProvider
    public Object[][] tierCases() {
        return new Object[][]{
                {0.70, 3, Tier.HIGH},
                {0.95, 6, Tier.HIGH},
                {0.95, 2, Tier.MEDIUM},
                {0.69, 3, Tier.MEDIUM},
                {0.40, 2, Tier.MEDIUM},
                {0.90, 1, Tier.LOW},
                {0.39, 5, Tier.LOW},
        };
    }

    @Test(dataProvider = "tierCases")
    public void testClassify(final double score, final int evidence, final Tier expected) {
        Assert.assertEquals(classifier.classify(record("G", "G", score, evidence)), expected);
    }

    @Test
    public void testAbsentScoreIsLow() {
        Assert.assertEquals(classifier.classify(unscored("G", "G")), Tier.LOW);
    }

    @Test
    public void testSummaryCounts() {
        final CompositeScoreRecord high = record("A", "A", 0.9, 4);
        final CompositeScoreRecord medium = record("B", "B", 0.5, 2);
        final CompositeScoreRecord low = unscored("C", "C");
        final TierSummary summary = new TierSummary(Arrays.asList(high, medium, low), classifier);
        Assert.assertEquals(summary.getTotal(), 3);
        Assert.assertEquals(summary.getCount(Tier.HIGH), 1);
        Assert.assertEquals(summary.getCount(Tier.MEDIUM), 1);
        Assert.assertEquals(summary.getCount(Tier.LOW), 1);
        Assert.assertEquals(summary.getCount(Tier.HIGH, QualityFlag.SUFFICIENT), 1);
        Assert.assertEquals(summary.getCount(Tier.MEDIUM, QualityFlag.MODERATE), 1);
        Assert.assertEquals(summary.getCount(Tier.LOW, QualityFlag.NONE), 1);
        Assert.assertEquals(summary.getCount(Tier.LOW, QualityFlag.SPARSE), 0);
    }

    @DataProvider
    public Object[][] invalidThresholds() {
        return new Object[][]{
                {1.1, 3, 0.4, 2},
                {0.7, 7, 0.4, 2},
                {0.3, 3, 0.4, 2},
                {0.7, 1, 0.4, 2},
                {0.7, 3, -0.1, 2},
        };
    }

    @Test(dataProvider = "invalidThresholds", expectedExceptions = ConfigurationException.class)
    public void testInvalidThresholds(final double highScore, final int highEvidence, final double mediumScore, final int mediumEvidence) {
        new TierThresholds(highScore, highEvidence, mediumScore, mediumEvidence);
    }
}
