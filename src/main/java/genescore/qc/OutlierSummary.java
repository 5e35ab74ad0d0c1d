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

package genescore.qc;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Result of MAD-based outlier detection over one set of values.
 */
public final class OutlierSummary {
    public static final int MAX_EXAMPLES = 5;

    private final boolean performed;
    private final OptionalDouble median;
    private final OptionalDouble scaledMad;
    private final int count;
    private final ImmutableList<String> exampleGeneIds;

    OutlierSummary(final boolean performed, final OptionalDouble median, final OptionalDouble scaledMad, final int count, final List<String> exampleGeneIds) {
        this.performed = performed;
        this.median = median;
        this.scaledMad = scaledMad;
        this.count = count;
        this.exampleGeneIds = ImmutableList.copyOf(exampleGeneIds);
    }

    static OutlierSummary skipped(final OptionalDouble median, final OptionalDouble scaledMad) {
        return new OutlierSummary(false, median, scaledMad, 0, ImmutableList.of());
    }

    /** False when there were no values or the MAD was zero. */
    public boolean isPerformed() {
        return performed;
    }

    /** Empty when there were no values. */
    public OptionalDouble getMedian() {
        return median;
    }

    /** MAD multiplied by 1.4826, empty when there were no values. */
    public OptionalDouble getScaledMad() {
        return scaledMad;
    }

    public int getCount() {
        return count;
    }

    /** Up to {@link #MAX_EXAMPLES} outlying genes, most extreme first. */
    public ImmutableList<String> getExampleGeneIds() {
        return exampleGeneIds;
    }
}
