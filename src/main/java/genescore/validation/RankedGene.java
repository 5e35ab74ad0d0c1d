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

import genescore.scoring.CompositeScoreRecord;

/**
 * A scored canonical gene with its position in the population. Percentile is the average ascending rank divided by
 * the population size, so the top gene has percentile 1.0.
 */
public final class RankedGene {
    private final CompositeScoreRecord record;
    private final double rank;
    private final double percentile;

    RankedGene(final CompositeScoreRecord record, final double rank, final double percentile) {
        this.record = record;
        this.rank = rank;
        this.percentile = percentile;
    }

    public CompositeScoreRecord getRecord() {
        return record;
    }

    public String getSymbol() {
        return record.getGene().getSymbol();
    }

    public String getGeneId() {
        return record.getGene().getGeneId();
    }

    public double getScore() {
        return record.getCompositeScore().getAsDouble();
    }

    /** 1-based ascending rank; tied genes share the average of their positions. */
    public double getRank() {
        return rank;
    }

    public double getPercentile() {
        return percentile;
    }
}
