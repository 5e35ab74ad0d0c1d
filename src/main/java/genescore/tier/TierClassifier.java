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

import genescore.scoring.CompositeScoreRecord;

import java.util.OptionalDouble;

/**
 * Assigns tiers. A gene needs both a high enough score and enough supporting layers, so a single lucky layer cannot
 * reach HIGH on its own. Genes without a score are always LOW.
 */
public class TierClassifier {
    private final TierThresholds thresholds;

    public TierClassifier(final TierThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Tier classify(final CompositeScoreRecord record) {
        return classify(record, thresholds);
    }

    public static Tier classify(final CompositeScoreRecord record, final TierThresholds thresholds) {
        final OptionalDouble score = record.getCompositeScore();
        if (!score.isPresent()) return Tier.LOW;

        final double s = score.getAsDouble();
        final int evidence = record.getEvidenceCount();
        if (s >= thresholds.getHighMinScore() && evidence >= thresholds.getHighMinEvidence()) return Tier.HIGH;
        if (s >= thresholds.getMediumMinScore() && evidence >= thresholds.getMediumMinEvidence()) return Tier.MEDIUM;
        return Tier.LOW;
    }

    public TierThresholds getThresholds() {
        return thresholds;
    }
}
