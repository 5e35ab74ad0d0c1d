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
import genescore.scoring.EvidenceLayer;

/**
 * Score cutoffs and evidence-breadth minimums for the HIGH and MEDIUM tiers.
 */
public final class TierThresholds {
    public static final TierThresholds DEFAULT = new TierThresholds(0.7, 3, 0.4, 2);

    private final double highMinScore;
    private final int highMinEvidence;
    private final double mediumMinScore;
    private final int mediumMinEvidence;

    /**
     * @throws ConfigurationException if a cutoff lies outside [0,1], a breadth outside 0..6, or HIGH is looser than MEDIUM
     */
    public TierThresholds(final double highMinScore, final int highMinEvidence, final double mediumMinScore, final int mediumMinEvidence) {
        checkScore("tier.high.min_score", highMinScore);
        checkScore("tier.medium.min_score", mediumMinScore);
        checkBreadth("tier.high.min_evidence", highMinEvidence);
        checkBreadth("tier.medium.min_evidence", mediumMinEvidence);
        if (highMinScore < mediumMinScore) {
            throw new ConfigurationException(String.format("tier.high.min_score (%s) must not be below tier.medium.min_score (%s)", highMinScore, mediumMinScore));
        }
        if (highMinEvidence < mediumMinEvidence) {
            throw new ConfigurationException(String.format("tier.high.min_evidence (%d) must not be below tier.medium.min_evidence (%d)", highMinEvidence, mediumMinEvidence));
        }
        this.highMinScore = highMinScore;
        this.highMinEvidence = highMinEvidence;
        this.mediumMinScore = mediumMinScore;
        this.mediumMinEvidence = mediumMinEvidence;
    }

    private static void checkScore(final String key, final double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new ConfigurationException(String.format("%s must be in [0,1] but was %s", key, value));
        }
    }

    private static void checkBreadth(final String key, final int value) {
        if (value < 0 || value > EvidenceLayer.values().length) {
            throw new ConfigurationException(String.format("%s must be in 0..%d but was %d", key, EvidenceLayer.values().length, value));
        }
    }

    public double getHighMinScore() {
        return highMinScore;
    }

    public int getHighMinEvidence() {
        return highMinEvidence;
    }

    public double getMediumMinScore() {
        return mediumMinScore;
    }

    public int getMediumMinEvidence() {
        return mediumMinEvidence;
    }
}
