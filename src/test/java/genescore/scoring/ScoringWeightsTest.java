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
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.EnumMap;
import java.util.Map;

public class ScoringWeightsTest {
    private static final double EPSILON = 1e-9;

    @Test
    public void testDefaultsSumToOne() {
        final ScoringWeights weights = ScoringWeights.defaults();
        Assert.assertEquals(weights.sum(), 1.0, EPSILON);
        Assert.assertEquals(weights.get(EvidenceLayer.GNOMAD), 0.20, EPSILON);
        Assert.assertEquals(weights.get(EvidenceLayer.LITERATURE), 0.15, EPSILON);
    }

    @Test
    public void testUniform() {
        final ScoringWeights weights = ScoringWeights.uniform();
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            Assert.assertEquals(weights.get(layer), 1.0 / 6, EPSILON);
        }
    }

    @Test
    public void testPerturbRenormalizes() {
        final ScoringWeights perturbed = ScoringWeights.defaults().perturb(EvidenceLayer.GNOMAD, 0.10);
        Assert.assertEquals(perturbed.get(EvidenceLayer.GNOMAD), 0.30 / 1.10, EPSILON);
        Assert.assertEquals(perturbed.get(EvidenceLayer.EXPRESSION), 0.20 / 1.10, EPSILON);
        Assert.assertEquals(perturbed.get(EvidenceLayer.ANNOTATION), 0.15 / 1.10, EPSILON);
        Assert.assertEquals(perturbed.sum(), 1.0, ScoringWeights.SUM_TOLERANCE);
    }

    @Test
    public void testPerturbClampsAtZero() {
        final ScoringWeights perturbed = ScoringWeights.defaults().perturb(EvidenceLayer.ANNOTATION, -0.5);
        Assert.assertEquals(perturbed.get(EvidenceLayer.ANNOTATION), 0.0, EPSILON);
        Assert.assertEquals(perturbed.get(EvidenceLayer.GNOMAD), 0.20 / 0.85, EPSILON);
        Assert.assertEquals(perturbed.sum(), 1.0, ScoringWeights.SUM_TOLERANCE);
    }

    @Test
    public void testPerturbByZeroReturnsSameWeights() {
        final ScoringWeights weights = ScoringWeights.defaults();
        Assert.assertSame(weights.perturb(EvidenceLayer.EXPRESSION, 0.0), weights);
    }

    @Test
    public void testPerturbingTheOnlyWeightToZeroGivesUniform() {
        final ScoringWeights single = ScoringWeights.builder().weight(EvidenceLayer.LITERATURE, 1.0).build();
        Assert.assertEquals(single.perturb(EvidenceLayer.LITERATURE, -1.0), ScoringWeights.uniform());
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testPerturbRejectsNonFiniteDelta() {
        ScoringWeights.defaults().perturb(EvidenceLayer.GNOMAD, Double.NaN);
    }

    @DataProvider
    public Object[][] invalidWeights() {
        return new Object[][]{
                {new double[]{0.2, 0.2, 0.2, 0.2, 0.2, 0.2}},
                {new double[]{0.5, 0.5, 0.0, 0.0, 0.0, 0.1}},
                {new double[]{1.2, -0.2, 0.0, 0.0, 0.0, 0.0}},
                {new double[]{Double.NaN, 0.2, 0.2, 0.2, 0.2, 0.2}},
                {new double[]{0.2, 0.2, 0.15, 0.15, 0.15, 0.149}},
        };
    }

    @Test(dataProvider = "invalidWeights", expectedExceptions = ConfigurationException.class)
    public void testInvalidWeightsRejected(final double[] values) {
        final Map<EvidenceLayer, Double> weights = new EnumMap<>(EvidenceLayer.class);
        for (int i = 0; i < values.length; ++i) {
            weights.put(EvidenceLayer.values()[i], values[i]);
        }
        ScoringWeights.of(weights);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testMissingLayerRejected() {
        final Map<EvidenceLayer, Double> weights = new EnumMap<>(EvidenceLayer.class);
        weights.put(EvidenceLayer.GNOMAD, 1.0);
        ScoringWeights.of(weights);
    }

    @Test
    public void testSumWithinTolerance() {
        final ScoringWeights weights = ScoringWeights.builder()
                .weight(EvidenceLayer.GNOMAD, 0.5)
                .weight(EvidenceLayer.EXPRESSION, 0.5 + 5e-7)
                .build();
        Assert.assertEquals(weights.sum(), 1.0, ScoringWeights.SUM_TOLERANCE);
    }

    @Test
    public void testEquality() {
        Assert.assertEquals(ScoringWeights.defaults(), ScoringWeights.defaults());
        Assert.assertEquals(ScoringWeights.defaults().hashCode(), ScoringWeights.defaults().hashCode());
        Assert.assertNotEquals(ScoringWeights.defaults(), ScoringWeights.uniform());
    }
}
