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

package genescore.util;

import genescore.GeneScoreException;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.IOUtil;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;

/**
 * Parser for tab-delimited text. Blank lines and lines beginning with '#' are skipped. Trailing empty fields
 * are kept so that every row of a well-formed file has the same number of fields as its header.
 */
public class TabbedInputParser implements CloseableIterator<String[]> {
    private static final String COMMENT = "#";

    private final BufferedReader reader;
    private final String fileName;
    private String nextLine;
    private String currentLine;
    private int currentLineNumber = 0;
    private int nextLineNumber = 0;

    public TabbedInputParser(final File file) {
        IOUtil.assertFileIsReadable(file);
        this.reader = IOUtil.openFileForBufferedReading(file);
        this.fileName = file.getAbsolutePath();
        advance();
    }

    /**
     * @param stream input to parse, typically a classpath resource
     * @param name name used in error messages
     */
    public TabbedInputParser(final InputStream stream, final String name) {
        this.reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        this.fileName = name;
        advance();
    }

    private void advance() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                ++nextLineNumber;
                if (!line.trim().isEmpty() && !line.startsWith(COMMENT)) break;
            }
            nextLine = line;
        } catch (final IOException e) {
            throw new GeneScoreException("Error reading " + fileName, e);
        }
    }

    @Override
    public boolean hasNext() {
        return nextLine != null;
    }

    @Override
    public String[] next() {
        if (!hasNext()) throw new NoSuchElementException("No more lines in " + fileName);
        currentLine = nextLine;
        currentLineNumber = nextLineNumber;
        advance();
        final String line = currentLine.endsWith("\r") ? currentLine.substring(0, currentLine.length() - 1) : currentLine;
        final String[] fields = line.split("\t", -1);
        for (int i = 0; i < fields.length; ++i) {
            fields[i] = fields[i].trim();
        }
        return fields;
    }

    public String getFileName() {
        return fileName;
    }

    /** @return the 1-based line number of the line most recently returned by {@link #next()} */
    public int getCurrentLineNumber() {
        return currentLineNumber;
    }

    public String getCurrentLine() {
        return currentLine;
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (final IOException e) {
            throw new GeneScoreException("Error closing " + fileName, e);
        }
    }
}
