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

import com.google.common.collect.ImmutableMap;
import genescore.ConfigurationException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class CompositeScorerTest {
    private static final double EPSILON = 1e-9;

    private static final ScoringWeights TWO_LAYER_WEIGHTS = ScoringWeights.builder()
            .weight(EvidenceLayer.GNOMAD, 0.6)
            .weight(EvidenceLayer.EXPRESSION, 0.4)
            .build();

    private static List<Gene> genes(final String... ids) {
        return Arrays.stream(ids).map(id -> new Gene(id, "SYM_" + id)).collect(Collectors.toList());
    }

    @Test
    public void testNullPreservingWeightedAverage() {
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        evidence.put(EvidenceLayer.GNOMAD, LayerEvidence.builder(EvidenceLayer.GNOMAD).add("X", 0.8).add("Y", 0.5).build());
        evidence.put(EvidenceLayer.EXPRESSION, LayerEvidence.builder(EvidenceLayer.EXPRESSION).addAbsent("X").add("Y", 0.5).build());

        final ScoringResult result = new CompositeScorer().score(genes("X", "Y", "Z"), evidence, TWO_LAYER_WEIGHTS);
        final Map<String, CompositeScoreRecord> byId = result.byGeneId();

        final CompositeScoreRecord x = byId.get("X");
        Assert.assertEquals(x.getCompositeScore().getAsDouble(), 0.8, EPSILON);
        Assert.assertEquals(x.getEvidenceCount(), 1);
        Assert.assertEquals(x.getQualityFlag(), QualityFlag.SPARSE);
        Assert.assertEquals(x.getContributions().get(EvidenceLayer.GNOMAD), 0.48, EPSILON);
        Assert.assertFalse(x.getContributions().containsKey(EvidenceLayer.EXPRESSION));

        final CompositeScoreRecord y = byId.get("Y");
        Assert.assertEquals(y.getCompositeScore().getAsDouble(), 0.5, EPSILON);
        Assert.assertEquals(y.getEvidenceCount(), 2);
        Assert.assertEquals(y.getQualityFlag(), QualityFlag.MODERATE);
        Assert.assertEquals(y.getSupportingLayers(), Arrays.asList(EvidenceLayer.GNOMAD, EvidenceLayer.EXPRESSION));

        final CompositeScoreRecord z = byId.get("Z");
        Assert.assertFalse(z.getCompositeScore().isPresent());
        Assert.assertEquals(z.getEvidenceCount(), 0);
        Assert.assertEquals(z.getQualityFlag(), QualityFlag.NONE);
        Assert.assertEquals(z.getEvidenceGaps().size(), EvidenceLayer.values().length);

        Assert.assertEquals(result.getRecords().stream().map(r -> r.getGene().getGeneId()).collect(Collectors.toList()),
                Arrays.asList("X", "Y", "Z"));
        Assert.assertTrue(result.getDataIssues().isEmpty());
    }

    @Test
    public void testZeroAvailableWeightGivesAbsentScore() {
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        evidence.put(EvidenceLayer.LITERATURE, LayerEvidence.builder(EvidenceLayer.LITERATURE).add("A", 0.9).build());

        final CompositeScoreRecord a = new CompositeScorer().score(genes("A"), evidence, TWO_LAYER_WEIGHTS).getRecords().get(0);
        Assert.assertFalse(a.getCompositeScore().isPresent());
        Assert.assertEquals(a.getEvidenceCount(), 1);
        Assert.assertEquals(a.getContributions().get(EvidenceLayer.LITERATURE), 0.0, EPSILON);
    }

    @Test
    public void testCompositeStaysInUnitInterval() {
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            evidence.put(layer, LayerEvidence.builder(layer).add("ONE", 1.0).add("ZERO", 0.0).build());
        }
        final Map<String, CompositeScoreRecord> byId = new CompositeScorer().score(genes("ONE", "ZERO"), evidence, ScoringWeights.defaults()).byGeneId();
        Assert.assertEquals(byId.get("ONE").getCompositeScore().getAsDouble(), 1.0, EPSILON);
        Assert.assertEquals(byId.get("ZERO").getCompositeScore().getAsDouble(), 0.0, EPSILON);
        Assert.assertEquals(byId.get("ONE").getQualityFlag(), QualityFlag.SUFFICIENT);
    }

    @Test
    public void testDataIssuesAreRecordedAndExcluded() {
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        evidence.put(EvidenceLayer.GNOMAD, LayerEvidence.builder(EvidenceLayer.GNOMAD)
                .add("A", 1.5)
                .add("B", 0.4)
                .add("B", 0.9)
                .add("OUTSIDE1", 0.3)
                .add("OUTSIDE2", 0.3)
                .build());
        evidence.put(EvidenceLayer.EXPRESSION, LayerEvidence.builder(EvidenceLayer.EXPRESSION).add("A", 0.2).build());

        final List<Gene> universe = Arrays.asList(new Gene("A", "GA"), new Gene("B", "GB"), new Gene("A", "GA2"));
        final ScoringResult result = new CompositeScorer().score(universe, evidence, TWO_LAYER_WEIGHTS);

        Assert.assertEquals(result.getRecords().size(), 2);
        final Map<String, CompositeScoreRecord> byId = result.byGeneId();
        Assert.assertEquals(byId.get("A").getGene().getSymbol(), "GA");
        Assert.assertFalse(byId.get("A").getLayerScore(EvidenceLayer.GNOMAD).isPresent());
        Assert.assertEquals(byId.get("A").getCompositeScore().getAsDouble(), 0.2, EPSILON);
        Assert.assertEquals(byId.get("B").getCompositeScore().getAsDouble(), 0.4, EPSILON);

        final Map<DataIssue.Kind, Long> kinds = result.getDataIssues().stream()
                .collect(Collectors.groupingBy(DataIssue::getKind, Collectors.counting()));
        Assert.assertEquals(kinds, ImmutableMap.of(
                DataIssue.Kind.DUPLICATE_GENE_ID, 1L,
                DataIssue.Kind.DUPLICATE_EVIDENCE_ROW, 1L,
                DataIssue.Kind.OUT_OF_RANGE, 1L,
                DataIssue.Kind.GENE_NOT_IN_UNIVERSE, 1L));
    }

    @Test
    public void testTiesBrokenByGeneId() {
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        evidence.put(EvidenceLayer.GNOMAD, LayerEvidence.builder(EvidenceLayer.GNOMAD).add("B", 0.5).add("A", 0.5).add("C", 0.7).build());
        final ScoringResult result = new CompositeScorer().score(genes("B", "A", "C"), evidence, TWO_LAYER_WEIGHTS);
        Assert.assertEquals(result.getRecords().stream().map(r -> r.getGene().getGeneId()).collect(Collectors.toList()),
                Arrays.asList("C", "A", "B"));
    }

    @Test
    public void testScoringIsDeterministic() {
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        evidence.put(EvidenceLayer.GNOMAD, LayerEvidence.builder(EvidenceLayer.GNOMAD).add("A", 0.1).add("B", 0.2).build());
        evidence.put(EvidenceLayer.ANIMAL_MODEL, LayerEvidence.builder(EvidenceLayer.ANIMAL_MODEL).add("B", 0.3).build());
        final CompositeScorer scorer = new CompositeScorer();
        final ScoringResult first = scorer.score(genes("A", "B"), evidence, ScoringWeights.defaults());
        final ScoringResult second = scorer.score(genes("A", "B"), evidence, ScoringWeights.defaults());
        for (int i = 0; i < first.getRecords().size(); ++i) {
            Assert.assertEquals(first.getRecords().get(i).getCompositeScore(), second.getRecords().get(i).getCompositeScore());
        }
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testMissingWeightsRejected() {
        new CompositeScorer().score(genes("A"), Collections.emptyMap(), null);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testEvidenceUnderWrongLayerRejected() {
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        evidence.put(EvidenceLayer.GNOMAD, LayerEvidence.builder(EvidenceLayer.EXPRESSION).add("A", 0.5).build());
        new CompositeScorer().score(genes("A"), evidence, ScoringWeights.defaults());
    }
}
