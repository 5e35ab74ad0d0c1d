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

import java.util.Objects;

/**
 * A non-fatal problem found in the input data. The affected value or row is excluded from computation and the issue
 * is carried through to the validation report.
 */
public final class DataIssue {
    public enum Kind {
        /** A layer score outside [0,1], or not a finite number. */
        OUT_OF_RANGE,
        /** An evidence row whose gene is not in the universe. */
        GENE_NOT_IN_UNIVERSE,
        /** A gene identifier listed more than once in the universe. */
        DUPLICATE_GENE_ID,
        /** A gene identifier listed more than once in one evidence table. */
        DUPLICATE_EVIDENCE_ROW,
        /** A control gene symbol with no scored gene. */
        MISSING_CONTROL_GENE
    }

    private final Kind kind;
    private final EvidenceLayer layer;
    private final String geneId;
    private final String detail;

    /**
     * @param layer may be null when the issue is not tied to a layer
     * @param geneId gene identifier or symbol, may be null for aggregated issues
     */
    public DataIssue(final Kind kind, final EvidenceLayer layer, final String geneId, final String detail) {
        this.kind = kind;
        this.layer = layer;
        this.geneId = geneId;
        this.detail = detail;
    }

    public Kind getKind() {
        return kind;
    }

    public EvidenceLayer getLayer() {
        return layer;
    }

    public String getGeneId() {
        return geneId;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final DataIssue that = (DataIssue) o;
        return kind == that.kind && layer == that.layer && Objects.equals(geneId, that.geneId) && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, layer, geneId, detail);
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder(kind.name());
        if (layer != null) builder.append(" [").append(layer.getKey()).append(']');
        if (geneId != null) builder.append(' ').append(geneId);
        if (detail != null) builder.append(": ").append(detail);
        return builder.toString();
    }
}
