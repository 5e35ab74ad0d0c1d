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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Positive-control performance restricted to the genes of one provenance source.
 */
public final class SourceBreakdown {
    private final String source;
    private final int expected;
    private final int found;
    private final OptionalDouble medianPercentile;
    private final int topQuartileCount;
    private final ImmutableList<RecallAtK> recall;

    public SourceBreakdown(final String source, final int expected, final int found, final OptionalDouble medianPercentile,
                           final int topQuartileCount, final List<RecallAtK> recall) {
        this.source = source;
        this.expected = expected;
        this.found = found;
        this.medianPercentile = medianPercentile;
        this.topQuartileCount = topQuartileCount;
        this.recall = ImmutableList.copyOf(recall);
    }

    public String getSource() {
        return source;
    }

    public int getExpected() {
        return expected;
    }

    public int getFound() {
        return found;
    }

    public OptionalDouble getMedianPercentile() {
        return medianPercentile;
    }

    public int getTopQuartileCount() {
        return topQuartileCount;
    }

    /** Recall at each percentage k. */
    public ImmutableList<RecallAtK> getRecall() {
        return recall;
    }
}
