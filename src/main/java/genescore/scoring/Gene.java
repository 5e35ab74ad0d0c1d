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

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A member of the gene universe: a stable primary identifier plus a human-readable symbol. Several identifiers may
 * share one symbol.
 */
public final class Gene implements Comparable<Gene> {
    private final String geneId;
    private final String symbol;

    public Gene(final String geneId, final String symbol) {
        Preconditions.checkArgument(geneId != null && !geneId.isEmpty(), "gene id must not be empty");
        this.geneId = geneId;
        this.symbol = symbol == null || symbol.isEmpty() ? geneId : symbol;
    }

    public String getGeneId() {
        return geneId;
    }

    public String getSymbol() {
        return symbol;
    }

    /** Genes sort by identifier. */
    @Override
    public int compareTo(final Gene other) {
        return geneId.compareTo(other.geneId);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Gene gene = (Gene) o;
        return geneId.equals(gene.geneId) && symbol.equals(gene.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(geneId, symbol);
    }

    @Override
    public String toString() {
        return geneId + "(" + symbol + ")";
    }
}
