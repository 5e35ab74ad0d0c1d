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

package genescore.cmdline.argumentcollections;

import genescore.ConfigurationException;
import genescore.cmdline.StandardOptionDefinitions;
import genescore.io.EvidenceTableReader;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.Gene;
import genescore.scoring.LayerEvidence;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.util.IOUtil;
import org.broadinstitute.barclay.argparser.Argument;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The inputs every scoring tool reads: the gene universe, the per-layer evidence tables and optional configuration.
 */
public class EvidenceInputArgumentCollection {

    @Argument(shortName = StandardOptionDefinitions.GENES_SHORT_NAME,
            doc = "Gene universe TSV with gene_id and gene_symbol columns.")
    public File GENES;

    @Argument(shortName = StandardOptionDefinitions.EVIDENCE_SHORT_NAME,
            doc = "Evidence table for one layer given as layer:path, where the TSV has gene_id and score columns. " +
                    "Layers are gnomad, expression, annotation, localization, animal_model and literature. " +
                    "May be specified once per layer; layers not given are absent for every gene.")
    public List<String> EVIDENCE = new ArrayList<>();

    @Argument(shortName = StandardOptionDefinitions.CONFIG_SHORT_NAME,
            doc = "Properties file overriding the default weights and thresholds.", optional = true)
    public File CONFIG;

    /** @return error messages for invalid values, empty if all are valid */
    public List<String> validate() {
        final List<String> errors = new ArrayList<>();
        if (EVIDENCE.isEmpty()) {
            errors.add("At least one EVIDENCE table must be given.");
        }
        try {
            EvidenceTableReader.parseLayerSpecs(EVIDENCE).values().forEach(IOUtil::assertFileIsReadable);
            IOUtil.assertFileIsReadable(GENES);
            if (CONFIG != null) IOUtil.assertFileIsReadable(CONFIG);
        } catch (final SAMException | ConfigurationException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    public List<Gene> readGenes() {
        return EvidenceTableReader.readGeneUniverse(GENES);
    }

    public Map<EvidenceLayer, LayerEvidence> readEvidence() {
        return EvidenceTableReader.readEvidence(EVIDENCE);
    }
}
