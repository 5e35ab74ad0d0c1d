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

import genescore.GeneScoreException;
import genescore.io.EvidenceTableReader;

import java.io.IOException;
import java.io.InputStream;

/**
 * The control gene lists shipped with GeneScore. Positive controls combine the OMIM Usher syndrome genes with the
 * SYSCILIA gold standard core ciliary genes; negative controls are literature-validated housekeeping genes.
 */
public final class ControlSets {
    public static final String BUILTIN_POSITIVE = "builtin_positive";
    public static final String BUILTIN_NEGATIVE = "builtin_negative";

    private static final String RESOURCE_DIR = "genescore/controls/";
    private static final String[] POSITIVE_RESOURCES = {"omim_usher.tsv", "syscilia_scgs_v2.tsv"};
    private static final String[] NEGATIVE_RESOURCES = {"housekeeping.tsv"};

    private ControlSets() {}

    public static ControlSet builtinPositive() {
        return load(BUILTIN_POSITIVE, ControlRole.POSITIVE, POSITIVE_RESOURCES);
    }

    public static ControlSet builtinNegative() {
        return load(BUILTIN_NEGATIVE, ControlRole.NEGATIVE, NEGATIVE_RESOURCES);
    }

    private static ControlSet load(final String name, final ControlRole role, final String[] resources) {
        ControlSet combined = ControlSet.builder(name, role).build();
        for (final String resource : resources) {
            final String path = RESOURCE_DIR + resource;
            try (final InputStream stream = ControlSets.class.getClassLoader().getResourceAsStream(path)) {
                if (stream == null) throw new GeneScoreException("Control set resource not found: " + path);
                combined = combined.union(EvidenceTableReader.readControlSet(name, role, stream, path));
            } catch (final IOException e) {
                throw new GeneScoreException("Error reading control set resource " + path, e);
            }
        }
        return combined;
    }
}
