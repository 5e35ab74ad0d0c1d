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

import genescore.config.ScoringConfiguration;
import htsjdk.samtools.metrics.Header;
import htsjdk.samtools.metrics.MetricBase;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.metrics.StringHeader;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.CommandLineParserOptions;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;

import java.io.File;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.List;

/**
 * Base class of the GeneScore command line programs.
 *
 * A program is a concrete subclass annotated with @CommandLineProgramProperties whose public fields carry @Argument
 * or @ArgumentCollection. After parsing, {@link #customCommandLineValidation()} may reject the values; then
 * {@link #doWork()} runs and its return value is the exit status. Unchecked exceptions thrown by doWork() propagate
 * to the caller.
 *
 * Every metrics file a program writes through {@link #getMetricsFile()} carries the command line, the start time
 * and, once {@link #loadConfiguration(File)} has run, the configuration fingerprint.
 */
public abstract class CommandLineProgram {
    public static final String FINGERPRINT_HEADER_PREFIX = "Configuration fingerprint: ";

    @Argument(doc = "Control verbosity of logging.", common = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(doc = "Whether to suppress the start and finish lines on System.err.", common = true)
    public Boolean QUIET = false;

    @ArgumentCollection(doc = "Special Arguments that have meaning to the argument parsing system.  " +
            "It is unlikely these will ever need to be accessed by the command line program")
    public Object specialArgumentsCollection = new SpecialArgumentsCollection();

    private static final Log log = Log.getInstance(CommandLineProgram.class);

    private CommandLineParser commandLineParser;
    private final List<Header> defaultHeaders = new ArrayList<>();
    private String commandLine;

    /**
     * Do the work after the command line has been parsed and validated.
     * @return program exit status.
     */
    protected abstract int doWork();

    public int instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            return 1;
        }

        final Date startDate = new Date();
        defaultHeaders.add(new StringHeader(commandLine));
        defaultHeaders.add(new StringHeader("Started on: " + startDate));

        Log.setGlobalLogLevel(VERBOSITY);
        if (!QUIET) {
            System.err.println("[" + startDate + "] " + commandLine);
            System.err.println(String.format("[%s] GeneScore version %s on %s %s; Java %s",
                    startDate, getVersion(), System.getProperty("os.name"), System.getProperty("os.arch"),
                    System.getProperty("java.runtime.version")));
        }

        try {
            return doWork();
        } finally {
            // reported even when doWork throws
            if (!QUIET) {
                final Date endDate = new Date();
                final double elapsedMinutes = (endDate.getTime() - startDate.getTime()) / (1000d * 60d);
                System.err.println("[" + endDate + "] " + getClass().getSimpleName() + " done. Elapsed time: " +
                        new DecimalFormat("#,##0.00").format(elapsedMinutes) + " minutes.");
            }
        }
    }

    /**
     * Override to check argument values after parsing.
     * @return null if the command line is valid, otherwise the error messages to print after the usage
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /** @return true if the command line is valid */
    protected boolean parseArgs(final String[] argv) {
        commandLineParser = getCommandLineParser();

        boolean valid;
        try {
            valid = commandLineParser.parseArguments(System.err, argv);
        } catch (final CommandLineException e) {
            System.err.println(commandLineParser.usage(false, false));
            System.err.println(e.getMessage());
            valid = false;
        }

        commandLine = commandLineParser.getCommandLine();
        if (!valid) {
            return false;
        }

        final String[] customErrorMessages = customCommandLineValidation();
        if (customErrorMessages != null) {
            System.err.print(commandLineParser.usage(false, false));
            for (final String msg : customErrorMessages) {
                System.err.println(msg);
            }
            return false;
        }
        return true;
    }

    /**
     * Loads the defaults plus the overrides in {@code overrides}, if given, and records the fingerprint of the result
     * in the default metrics headers.
     *
     * @throws genescore.ConfigurationException if the configuration is invalid
     */
    protected ScoringConfiguration loadConfiguration(final File overrides) {
        final ScoringConfiguration configuration = ScoringConfiguration.load(overrides);
        log.info(FINGERPRINT_HEADER_PREFIX, configuration.getFingerprint());
        defaultHeaders.add(new StringHeader(FINGERPRINT_HEADER_PREFIX + configuration.getFingerprint()));
        return configuration;
    }

    /** Gets a MetricsFile with the default headers already written into it. */
    protected <A extends MetricBase, B extends Comparable<?>> MetricsFile<A, B> getMetricsFile() {
        final MetricsFile<A, B> file = new MetricsFile<>();
        for (final Header h : defaultHeaders) {
            file.addHeader(h);
        }
        return file;
    }

    public CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this,
                    Collections.emptyList(),
                    new HashSet<>(Collections.singleton(CommandLineParserOptions.APPEND_TO_COLLECTIONS)));
        }
        return commandLineParser;
    }

    /** @return the version in the jar manifest */
    public String getVersion() {
        return getCommandLineParser().getVersion();
    }
}
