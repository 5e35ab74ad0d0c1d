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
import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;

import java.io.PrintStream;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Entry point of the GeneScore jar. The first argument names the program to run, by simple class name; the remaining
 * arguments are handed to that program's parser.
 *
 * Programs are the concrete {@link CommandLineProgram} subclasses found under the packages returned by
 * {@link #getPackageList()}. Each must carry @CommandLineProgramProperties.
 */
public class GeneScoreCommandLine {
    private static final String COMMAND_LINE_NAME = GeneScoreCommandLine.class.getSimpleName();
    private static final String LIST_COMMANDS = "--list-commands";

    // suggestions are printed only for names closer than this
    private static final int SUGGESTION_MAX_DISTANCE = 7;
    private static final int MIN_SUBSTRING_MATCH = 5;

    protected static List<String> getPackageList() {
        return Collections.singletonList("genescore");
    }

    public static void main(final String[] args) {
        System.exit(new GeneScoreCommandLine().instanceMain(args));
    }

    protected int instanceMain(final String[] args) {
        final SortedMap<String, Class<CommandLineProgram>> programs = findPrograms(getPackageList());

        if (args.length == 0 || args[0].equals("-h")) {
            printProgramTable(programs, System.err);
            return 1;
        }
        if (args[0].equals(LIST_COMMANDS)) {
            programs.keySet().forEach(System.out::println);
            return 1;
        }

        final Class<CommandLineProgram> programClass = programs.get(args[0]);
        if (programClass == null) {
            printProgramTable(programs, System.err);
            printSuggestions(programs.keySet(), args[0], System.err);
            return 1;
        }
        return newInstance(programClass).instanceMain(Arrays.copyOfRange(args, 1, args.length));
    }

    /**
     * Visits every concrete CommandLineProgram class in {@code packageList}. The annotation passed to
     * {@code visitor} is null when the class lacks @CommandLineProgramProperties.
     */
    @SuppressWarnings("unchecked")
    public static void processAllCommandLinePrograms(
            final List<String> packageList,
            final BiConsumer<Class<CommandLineProgram>, CommandLineProgramProperties> visitor) {
        final ClassFinder classFinder = new ClassFinder();
        for (final String pkg : packageList) {
            classFinder.find(pkg, CommandLineProgram.class);
        }
        for (final Class<?> clazz : classFinder.getClasses()) {
            if (clazz.isInterface() || clazz.isSynthetic() || clazz.isLocalClass() || clazz.isAnonymousClass()
                    || Modifier.isAbstract(clazz.getModifiers())) {
                continue;
            }
            visitor.accept((Class<CommandLineProgram>) clazz, clazz.getAnnotation(CommandLineProgramProperties.class));
        }
    }

    private static SortedMap<String, Class<CommandLineProgram>> findPrograms(final List<String> packageList) {
        final SortedMap<String, Class<CommandLineProgram>> programs = new TreeMap<>();
        final List<String> unannotated = new ArrayList<>();
        processAllCommandLinePrograms(packageList, (clazz, properties) -> {
            if (properties == null) {
                unannotated.add(clazz.getName());
            } else if (!properties.omitFromCommandLine()
                    && programs.put(clazz.getSimpleName(), clazz) != null) {
                throw new GeneScoreException("Two programs are named " + clazz.getSimpleName());
            }
        });
        if (!unannotated.isEmpty()) {
            throw new GeneScoreException("Missing @CommandLineProgramProperties: " + String.join(", ", unannotated));
        }
        return programs;
    }

    private static <T> T newInstance(final Class<T> clazz) {
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final ReflectiveOperationException e) {
            throw new GeneScoreException("Could not instantiate " + clazz.getName(), e);
        }
    }

    private static void printProgramTable(final Map<String, Class<CommandLineProgram>> programs, final PrintStream out) {
        final Map<Class<? extends CommandLineProgramGroup>, CommandLineProgramGroup> groups = new HashMap<>();
        final Map<CommandLineProgramGroup, List<String>> namesByGroup = new TreeMap<>(CommandLineProgramGroup.comparator);
        programs.forEach((name, clazz) -> {
            final Class<? extends CommandLineProgramGroup> groupClass =
                    clazz.getAnnotation(CommandLineProgramProperties.class).programGroup();
            final CommandLineProgramGroup group = groups.computeIfAbsent(groupClass, GeneScoreCommandLine::newInstance);
            namesByGroup.computeIfAbsent(group, g -> new ArrayList<>()).add(name);
        });

        final String rule = "-".repeat(86);
        out.println("USAGE: " + COMMAND_LINE_NAME + " <program name> [-h]");
        out.println();
        out.println("Available Programs:");
        namesByGroup.forEach((group, names) -> {
            out.println(rule);
            out.println(String.format("%-48s %s", group.getName() + ":", group.getDescription()));
            for (final String name : names) {
                final String summary = programs.get(name).getAnnotation(CommandLineProgramProperties.class).oneLineSummary();
                out.println(String.format("    %-45s%s", name, summary));
            }
            out.println();
        });
        out.println(rule);
    }

    /** Prints the program names within a small edit distance of {@code command}, the way git suggests commands. */
    static void printSuggestions(final Iterable<String> names, final String command, final PrintStream out) {
        final SortedMap<Integer, List<String>> byDistance = new TreeMap<>();
        int count = 0;
        for (final String name : names) {
            final boolean partial = name.startsWith(command)
                    || (command.length() >= MIN_SUBSTRING_MATCH && name.contains(command));
            final int distance = partial ? 0 : StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            byDistance.computeIfAbsent(distance, d -> new ArrayList<>()).add(name);
            count++;
        }

        out.println(String.format("'%s' is not a valid command. See %s -h for more information.", command, COMMAND_LINE_NAME));
        if (byDistance.isEmpty() || byDistance.firstKey() >= SUGGESTION_MAX_DISTANCE) {
            return;
        }
        final List<String> closest = byDistance.get(byDistance.firstKey());
        // a prefix shared by every program says nothing
        if (byDistance.firstKey() == 0 && closest.size() == count) {
            return;
        }
        out.println(closest.size() == 1 ? "Did you mean this?" : "Did you mean one of these?");
        out.println(closest.stream().map(name -> "        " + name).collect(Collectors.joining("\n")));
    }
}
