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

import genescore.ConfigurationException;
import genescore.GeneScoreException;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.Gene;
import genescore.scoring.LayerEvidence;
import genescore.validation.ControlRole;
import genescore.validation.ControlSet;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

public class EvidenceTableReaderTest {

    static File tsv(final String... lines) throws IOException {
        final File file = File.createTempFile("EvidenceTableReaderTest.", ".tsv");
        file.deleteOnExit();
        Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void testReadGeneUniverse() throws IOException {
        final List<Gene> genes = EvidenceTableReader.readGeneUniverse(tsv(
                "gene_id\tgene_symbol\tbiotype",
                "# comment",
                "ENSG1\tMYO7A\tprotein_coding",
                "\tORPHAN\tprotein_coding",
                "",
                "ENSG2\tUSH2A\tprotein_coding"));
        Assert.assertEquals(genes, Arrays.asList(new Gene("ENSG1", "MYO7A"), new Gene("ENSG2", "USH2A")));
    }

    @Test
    public void testReadLayerEvidence() throws IOException {
        final LayerEvidence evidence = EvidenceTableReader.readLayerEvidence(EvidenceLayer.GNOMAD, tsv(
                "score\tgene_id",
                "0.5\tENSG1",
                "NA\tENSG2",
                "none\tENSG3",
                "\tENSG4",
                "1.7\tENSG5",
                "0.1\tENSG1"));
        Assert.assertEquals(evidence.getLayer(), EvidenceLayer.GNOMAD);
        Assert.assertEquals(evidence.getScore("ENSG1"), OptionalDouble.of(0.5));
        Assert.assertEquals(evidence.getScore("ENSG2"), OptionalDouble.empty());
        Assert.assertEquals(evidence.getScore("ENSG3"), OptionalDouble.empty());
        Assert.assertEquals(evidence.getScore("ENSG4"), OptionalDouble.empty());
        Assert.assertEquals(evidence.getScore("ENSG5"), OptionalDouble.of(1.7), "range is checked while scoring, not while reading");
        Assert.assertEquals(evidence.getScores().size(), 5);
        Assert.assertEquals(evidence.getDuplicateGeneIds(), Collections.singletonList("ENSG1"));
    }

    @Test
    public void testInvalidScore() throws IOException {
        final File file = tsv("gene_id\tscore", "ENSG1\t0.5", "ENSG2\thigh");
        try {
            EvidenceTableReader.readLayerEvidence(EvidenceLayer.EXPRESSION, file);
            Assert.fail("expected an exception for a non-numeric score");
        } catch (final GeneScoreException e) {
            Assert.assertTrue(e.getMessage().contains("'high' at line 3"), e.getMessage());
        }
    }

    @Test(expectedExceptions = GeneScoreException.class)
    public void testMissingColumn() throws IOException {
        EvidenceTableReader.readLayerEvidence(EvidenceLayer.EXPRESSION, tsv("gene_id\tvalue", "ENSG1\t0.5"));
    }

    @Test(expectedExceptions = GeneScoreException.class)
    public void testEmptyFile() throws IOException {
        EvidenceTableReader.readGeneUniverse(tsv("# only a comment"));
    }

    @Test
    public void testParseLayerSpecs() {
        final Map<EvidenceLayer, File> files = EvidenceTableReader.parseLayerSpecs(
                Arrays.asList("gnomad:/data/gnomad.tsv", "Animal_Model:/data/mouse.tsv"));
        Assert.assertEquals(files.size(), 2);
        Assert.assertEquals(files.get(EvidenceLayer.GNOMAD), new File("/data/gnomad.tsv"));
        Assert.assertEquals(files.get(EvidenceLayer.ANIMAL_MODEL), new File("/data/mouse.tsv"));
    }

    @DataProvider
    public Object[][] badLayerSpecs() {
        return new Object[][]{
                {Collections.singletonList("gnomad")},
                {Collections.singletonList(":/data/gnomad.tsv")},
                {Collections.singletonList("gnomad:")},
                {Collections.singletonList("proteomics:/data/p.tsv")},
                {Arrays.asList("gnomad:/a.tsv", "GNOMAD:/b.tsv")},
        };
    }

    @Test(dataProvider = "badLayerSpecs", expectedExceptions = ConfigurationException.class)
    public void testBadLayerSpecs(final List<String> specs) {
        EvidenceTableReader.parseLayerSpecs(specs);
    }

    @Test
    public void testReadControlSet() throws IOException {
        final ControlSet withSources = EvidenceTableReader.readControlSet("known", ControlRole.POSITIVE, tsv(
                "gene_symbol\tsource",
                "MYO7A\tomim",
                "MYO7A\tsyscilia",
                "IFT88\t"));
        Assert.assertEquals(withSources.size(), 2);
        Assert.assertEquals(withSources.getSources("MYO7A").asList(), Arrays.asList("omim", "syscilia"));
        Assert.assertEquals(withSources.getSources("IFT88").asList(), Collections.singletonList("known"));

        final ControlSet withoutSources = EvidenceTableReader.readControlSet("housekeeping", ControlRole.NEGATIVE, tsv(
                "gene_symbol", "GAPDH", "ACTB"));
        Assert.assertEquals(withoutSources.getSymbols().asList(), Arrays.asList("GAPDH", "ACTB"));
        Assert.assertEquals(withoutSources.getAllSources(), Collections.singleton("housekeeping"));
    }
}
