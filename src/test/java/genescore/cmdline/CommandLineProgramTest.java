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

package genescore.cmdline;

import genescore.GeneScoreException;
import org.apache.commons.io.FileUtils;
import org.testng.annotations.AfterClass;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

/**
 * Utility class for CommandLine Program testing.
 */
public abstract class CommandLineProgramTest {

    // A per-test-class directory that will be deleted after the tests are complete.
    private File tempOutputDir;

    /**
     * returns a directory designated for output which will be deleted after the test class is tested
     */
    public File getTempOutputDir() {
        if (tempOutputDir == null) {
            try {
                tempOutputDir = Files.createTempDirectory(this.getClass().getName()).toFile();
            } catch (IOException e) {
                throw new GeneScoreException("Couldn't create temp directory", e);
            }
        }
        return tempOutputDir;
    }

    public File getTempOutputFile(final String prefix, final String extension) throws IOException {
        return File.createTempFile(prefix, extension, getTempOutputDir());
    }

    /** Writes the lines to a new file in the temp directory. */
    public File writeTempFile(final String name, final String... lines) throws IOException {
        final File file = new File(getTempOutputDir(), name);
        Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }

    @AfterClass
    final void cleanup_temp_dir() throws IOException {
        if (tempOutputDir != null) {
            FileUtils.deleteDirectory(tempOutputDir);
        }
    }

    public abstract String getCommandLineProgramName();

    /**
     * Given a program name and its arguments, builds the arguments for calling the program through GeneScoreCommandLine.
     */
    public String[] makeCommandLineArgs(final String programName, final List<String> args) {
        final String[] commandLineArgs = new String[args.size() + 1];
        commandLineArgs[0] = programName;
        int i = 1;
        for (final String arg : args) {
            commandLineArgs[i++] = arg;
        }
        return commandLineArgs;
    }

    public String[] makeCommandLineArgs(final List<String> args) {
        return makeCommandLineArgs(getCommandLineProgramName(), args);
    }

    public int runCommandLine(final List<String> args) {
        return new GeneScoreCommandLine().instanceMain(makeCommandLineArgs(args));
    }

    public int runCommandLine(final String[] args) {
        return runCommandLine(Arrays.asList(args));
    }
}
