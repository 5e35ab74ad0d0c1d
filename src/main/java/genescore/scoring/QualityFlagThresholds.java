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

/**
 * Minimum evidence counts for each quality flag. A gene with fewer layers than the sparse minimum is flagged NONE.
 */
public final class QualityFlagThresholds {
    public static final QualityFlagThresholds DEFAULT = new QualityFlagThresholds(4, 2, 1);

    private final int sufficientMinEvidence;
    private final int moderateMinEvidence;
    private final int sparseMinEvidence;

    public QualityFlagThresholds(final int sufficientMinEvidence, final int moderateMinEvidence, final int sparseMinEvidence) {
        final int layers = EvidenceLayer.values().length;
        if (sparseMinEvidence < 1 || sufficientMinEvidence > layers) {
            throw new ConfigurationException(String.format("Quality flag evidence minimums must lie in 1..%d but were %d/%d/%d",
                    layers, sufficientMinEvidence, moderateMinEvidence, sparseMinEvidence));
        }
        if (sparseMinEvidence > moderateMinEvidence || moderateMinEvidence > sufficientMinEvidence) {
            throw new ConfigurationException(String.format("Quality flag evidence minimums must satisfy sparse <= moderate <= sufficient but were %d/%d/%d",
                    sufficientMinEvidence, moderateMinEvidence, sparseMinEvidence));
        }
        this.sufficientMinEvidence = sufficientMinEvidence;
        this.moderateMinEvidence = moderateMinEvidence;
        this.sparseMinEvidence = sparseMinEvidence;
    }

    public QualityFlag flagFor(final int evidenceCount) {
        if (evidenceCount >= sufficientMinEvidence) return QualityFlag.SUFFICIENT;
        if (evidenceCount >= moderateMinEvidence) return QualityFlag.MODERATE;
        if (evidenceCount >= sparseMinEvidence) return QualityFlag.SPARSE;
        return QualityFlag.NONE;
    }

    public int getSufficientMinEvidence() {
        return sufficientMinEvidence;
    }

    public int getModerateMinEvidence() {
        return moderateMinEvidence;
    }

    public int getSparseMinEvidence() {
        return sparseMinEvidence;
    }
}
