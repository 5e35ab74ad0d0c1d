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

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;

public class TabbedInputParserTest {

    private static TabbedInputParser parser(final String text) {
        return new TabbedInputParser(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), "test input");
    }

    @Test
    public void testSkipsBlankAndCommentLines() {
        try (final TabbedInputParser parser = parser("# header comment\na\tb\n\n   \nc\td\n")) {
            Assert.assertEquals(parser.next(), new String[]{"a", "b"});
            Assert.assertEquals(parser.getCurrentLineNumber(), 2);
            Assert.assertEquals(parser.next(), new String[]{"c", "d"});
            Assert.assertEquals(parser.getCurrentLineNumber(), 5);
            Assert.assertEquals(parser.getCurrentLine(), "c\td");
            Assert.assertFalse(parser.hasNext());
        }
    }

    @Test
    public void testKeepsTrailingEmptyFieldsAndTrims() {
        try (final TabbedInputParser parser = parser("x \t y\t\t\r\n")) {
            Assert.assertEquals(parser.next(), new String[]{"x", "y", "", ""});
        }
    }

    @Test(expectedExceptions = NoSuchElementException.class)
    public void testNextPastEnd() {
        try (final TabbedInputParser parser = parser("only\n")) {
            parser.next();
            parser.next();
        }
    }
}
