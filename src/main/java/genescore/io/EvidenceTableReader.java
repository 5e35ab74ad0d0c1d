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

package genescore.io;

import com.google.common.collect.ImmutableSet;
import genescore.ConfigurationException;
import genescore.GeneScoreException;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.Gene;
import genescore.scoring.LayerEvidence;
import genescore.util.DelimitedTextFileWithHeaderIterator;
import genescore.util.TabbedInputParser;
import genescore.validation.ControlRole;
import genescore.validation.ControlSet;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Reads the tab-delimited inputs: the gene universe, one evidence table per layer and control gene lists. Every file
 * starts with a header line; columns are found by name.
 */
public final class EvidenceTableReader {
    private static final Log log = Log.getInstance(EvidenceTableReader.class);

    public static final String GENE_ID_COLUMN = "gene_id";
    public static final String GENE_SYMBOL_COLUMN = "gene_symbol";
    public static final String SCORE_COLUMN = "score";
    public static final String SOURCE_COLUMN = "source";

    /** Cell values meaning "not measured". Matching ignores case. */
    public static final Set<String> ABSENT_VALUES = ImmutableSet.of("", "NA", "NULL", "NONE");

    private EvidenceTableReader() {}

    /** Reads gene_id and gene_symbol columns. Rows with an empty identifier are skipped. */
    public static List<Gene> readGeneUniverse(final File file) {
        IOUtil.assertFileIsReadable(file);
        final List<Gene> genes = new ArrayList<>();
        try (final DelimitedTextFileWithHeaderIterator it = new DelimitedTextFileWithHeaderIterator(new TabbedInputParser(file))) {
            requireColumns(it, GENE_ID_COLUMN, GENE_SYMBOL_COLUMN);
            while (it.hasNext()) {
                final DelimitedTextFileWithHeaderIterator.Row row = it.next();
                final String id = row.getField(GENE_ID_COLUMN);
                if (id == null || id.isEmpty()) continue;
                genes.add(new Gene(id, row.getField(GENE_SYMBOL_COLUMN)));
            }
        }
        log.info("Read ", genes.size(), " genes from ", file);
        return genes;
    }

    /**
     * Reads gene_id and score columns for one layer. Empty, NA, NULL and None scores are read as absent. Values are not
     * range checked here.
     *
     * @throws GeneScoreException if a score is neither absent nor a number
     */
    public static LayerEvidence readLayerEvidence(final EvidenceLayer layer, final File file) {
        IOUtil.assertFileIsReadable(file);
        final LayerEvidence.Builder builder = LayerEvidence.builder(layer);
        int rows = 0;
        try (final DelimitedTextFileWithHeaderIterator it = new DelimitedTextFileWithHeaderIterator(new TabbedInputParser(file))) {
            requireColumns(it, GENE_ID_COLUMN, SCORE_COLUMN);
            while (it.hasNext()) {
                final DelimitedTextFileWithHeaderIterator.Row row = it.next();
                final String id = row.getField(GENE_ID_COLUMN);
                if (id == null || id.isEmpty()) continue;
                builder.put(id, parseScore(row.getField(SCORE_COLUMN), it.getFileName(), row.getLineNumber()));
                ++rows;
            }
        }
        log.info("Read ", rows, " ", layer.getKey(), " evidence rows from ", file);
        return builder.build();
    }

    /**
     * Reads every layer given as a {@code layer:path} pair.
     *
     * @throws ConfigurationException for an unknown layer, a malformed pair or a layer given twice
     */
    public static Map<EvidenceLayer, LayerEvidence> readEvidence(final List<String> layerSpecs) {
        final Map<EvidenceLayer, LayerEvidence> evidence = new EnumMap<>(EvidenceLayer.class);
        parseLayerSpecs(layerSpecs).forEach((layer, file) -> evidence.put(layer, readLayerEvidence(layer, file)));
        return evidence;
    }

    /**
     * Parses {@code layer:path} pairs without reading the files.
     *
     * @throws ConfigurationException for an unknown layer, a malformed pair or a layer given twice
     */
    public static Map<EvidenceLayer, File> parseLayerSpecs(final List<String> layerSpecs) {
        final Map<EvidenceLayer, File> files = new EnumMap<>(EvidenceLayer.class);
        for (final String spec : layerSpecs) {
            final int colon = spec.indexOf(':');
            if (colon <= 0 || colon == spec.length() - 1) {
                throw new ConfigurationException("Evidence must be given as layer:path but got '" + spec + "'");
            }
            final EvidenceLayer layer = EvidenceLayer.fromKey(spec.substring(0, colon));
            if (files.put(layer, new File(spec.substring(colon + 1))) != null) {
                throw new ConfigurationException("Evidence for layer " + layer.getKey() + " given more than once");
            }
        }
        return files;
    }

    /** Reads a control list with a gene_symbol column and an optional source column. */
    public static ControlSet readControlSet(final String name, final ControlRole role, final File file) {
        IOUtil.assertFileIsReadable(file);
        return readControlSet(name, role, new TabbedInputParser(file));
    }

    public static ControlSet readControlSet(final String name, final ControlRole role, final InputStream stream, final String streamName) {
        return readControlSet(name, role, new TabbedInputParser(stream, streamName));
    }

    private static ControlSet readControlSet(final String name, final ControlRole role, final TabbedInputParser parser) {
        final ControlSet.Builder builder = ControlSet.builder(name, role);
        try (final DelimitedTextFileWithHeaderIterator it = new DelimitedTextFileWithHeaderIterator(parser)) {
            requireColumns(it, GENE_SYMBOL_COLUMN);
            final boolean hasSource = it.hasColumn(SOURCE_COLUMN);
            while (it.hasNext()) {
                final DelimitedTextFileWithHeaderIterator.Row row = it.next();
                final String symbol = row.getField(GENE_SYMBOL_COLUMN);
                if (symbol == null || symbol.isEmpty()) continue;
                builder.add(symbol, hasSource ? row.getField(SOURCE_COLUMN) : null);
            }
        }
        return builder.build();
    }

    static OptionalDouble parseScore(final String value, final String fileName, final int lineNumber) {
        if (value == null || ABSENT_VALUES.contains(value.toUpperCase())) return OptionalDouble.empty();
        try {
            return OptionalDouble.of(Double.parseDouble(value));
        } catch (final NumberFormatException e) {
            throw new GeneScoreException(String.format("Invalid score '%s' at line %d of %s", value, lineNumber, fileName), e);
        }
    }

    private static void requireColumns(final DelimitedTextFileWithHeaderIterator it, final String... columns) {
        for (final String column : columns) {
            if (!it.hasColumn(column)) {
                throw new GeneScoreException(String.format("%s is missing required column '%s'; found %s", it.getFileName(), column, it.getColumnNames()));
            }
        }
    }
}
