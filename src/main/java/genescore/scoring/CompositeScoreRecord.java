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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * The composite score of one gene together with everything needed to explain it: the per-layer scores that went in,
 * each present layer's weighted contribution, and how many layers were present.
 */
public final class CompositeScoreRecord {
    /** Composite descending with absent scores last, then gene identifier ascending. */
    public static final Comparator<CompositeScoreRecord> BY_SCORE_DESCENDING = (a, b) -> {
        final OptionalDouble sa = a.getCompositeScore();
        final OptionalDouble sb = b.getCompositeScore();
        if (sa.isPresent() && sb.isPresent()) {
            final int cmp = Double.compare(sb.getAsDouble(), sa.getAsDouble());
            if (cmp != 0) return cmp;
        } else if (sa.isPresent()) {
            return -1;
        } else if (sb.isPresent()) {
            return 1;
        }
        return a.getGene().getGeneId().compareTo(b.getGene().getGeneId());
    };

    private final Gene gene;
    private final OptionalDouble compositeScore;
    private final int evidenceCount;
    private final QualityFlag qualityFlag;
    private final ImmutableMap<EvidenceLayer, OptionalDouble> layerScores;
    private final ImmutableMap<EvidenceLayer, Double> contributions;

    public CompositeScoreRecord(final Gene gene,
                                final OptionalDouble compositeScore,
                                final int evidenceCount,
                                final QualityFlag qualityFlag,
                                final Map<EvidenceLayer, OptionalDouble> layerScores,
                                final Map<EvidenceLayer, Double> contributions) {
        this.gene = gene;
        this.compositeScore = compositeScore;
        this.evidenceCount = evidenceCount;
        this.qualityFlag = qualityFlag;
        this.layerScores = ImmutableMap.copyOf(layerScores);
        this.contributions = ImmutableMap.copyOf(contributions);
    }

    public Gene getGene() {
        return gene;
    }

    /** Empty when no layer had a score, or when every present layer had weight zero. */
    public OptionalDouble getCompositeScore() {
        return compositeScore;
    }

    public int getEvidenceCount() {
        return evidenceCount;
    }

    public QualityFlag getQualityFlag() {
        return qualityFlag;
    }

    public OptionalDouble getLayerScore(final EvidenceLayer layer) {
        final OptionalDouble score = layerScores.get(layer);
        return score == null ? OptionalDouble.empty() : score;
    }

    /** Score times weight, for present layers only. */
    public ImmutableMap<EvidenceLayer, Double> getContributions() {
        return contributions;
    }

    /** Layers with a present score, in layer order. */
    public List<EvidenceLayer> getSupportingLayers() {
        final List<EvidenceLayer> supporting = new ArrayList<>();
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            if (getLayerScore(layer).isPresent()) supporting.add(layer);
        }
        return ImmutableList.copyOf(supporting);
    }

    /** Layers with no score, in layer order. */
    public List<EvidenceLayer> getEvidenceGaps() {
        final List<EvidenceLayer> gaps = new ArrayList<>();
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            if (!getLayerScore(layer).isPresent()) gaps.add(layer);
        }
        return ImmutableList.copyOf(gaps);
    }

    @Override
    public String toString() {
        return gene + " score=" + (compositeScore.isPresent() ? compositeScore.getAsDouble() : "NA") +
                " evidence=" + evidenceCount + " " + qualityFlag;
    }
}
