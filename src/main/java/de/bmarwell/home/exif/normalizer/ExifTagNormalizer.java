/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer;

import com.drew.imaging.ImageProcessingException;
import de.bmarwell.home.exif.normalizer.tags.ExifToolJson;
import de.bmarwell.home.exif.normalizer.tags.MetadataExtractorTags;
import de.bmarwell.home.exif.normalizer.tags.NormalizedTags;
import de.bmarwell.home.exif.normalizer.tags.RawTags;
import de.bmarwell.home.exif.normalizer.tags.TagNormalizer;
import de.bmarwell.home.exif.normalizer.tz.TzOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.jspecify.annotations.Nullable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "exif-tag-normalizer",
        description = "Normalizes date, time and GPS tags and prints them as JSON, one object per file.")
public class ExifTagNormalizer implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(
            names = {"-h", "--help"},
            usageHelp = true,
            description = "Display this help message and exit.")
    boolean usageHelpRequested;

    @Option(
            names = {"-i", "--input"},
            required = true,
            arity = "1..*",
            description = """
        Input files.
        Either the output of `exiftool -json` (*.json) or media files to read directly.""")
    List<Path> inputFiles;

    @Option(
            names = {"--no-ignore-zero-zero"},
            description = """
        Keep GPS positions at 0,0.
        By default they are treated as "no GPS fix".""")
    boolean keepZeroZero;

    @Option(
            names = {"--prefer-gps"},
            description = "Use the GPS position for the timezone before explicit offset tags.")
    boolean preferGps;

    @Option(
            names = {"--infer-from-datestamps"},
            description = "Use offsets found in the captured-at date values.")
    boolean inferFromDatestamps;

    @Option(
            names = {"--infer-from-timestamp"},
            description = "Compare the TimeStamp tag with the captured-at date values.")
    boolean inferFromTimestamp;

    @Option(
            names = {"--no-default-videos-to-utc"},
            description = "Do not assume UTC for videos without any zone information.")
    boolean noDefaultVideosToUtc;

    @Option(
            names = {"-v", "--verbose"},
            description = """
            Print warnings and progress to stderr""")
    boolean verbose;

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new ExifTagNormalizer());
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Reads and normalizes all input files.
     *
     * <p>Files are read on a bounded pool. Output is printed in input order once all files are done, so the JSON
     * of two files never interleaves.</p>
     *
     * @return 0 if every file was read, 1 otherwise
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    @Override
    public Integer call() throws InterruptedException {
        final TagNormalizer normalizer = new TagNormalizer(toOptions());
        final List<Callable<FileResult>> tasks = new ArrayList<>();
        for (final Path inputFile : this.inputFiles) {
            tasks.add(() -> processFile(normalizer, inputFile));
        }

        final ExecutorService executor =
                Executors.newFixedThreadPool(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        int failures = 0;

        try {
            final List<Future<FileResult>> results = executor.invokeAll(tasks);

            for (int i = 0; i < results.size(); i++) {
                if (!report(this.inputFiles.get(i), results.get(i))) {
                    failures++;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        if (this.verbose) {
            this.spec
                    .commandLine()
                    .getErr()
                    .println(String.format(
                            Locale.ROOT,
                            "Normalized %d of %d files.",
                            this.inputFiles.size() - failures,
                            this.inputFiles.size()));
        }

        return failures == 0 ? 0 : 1;
    }

    TzOptions toOptions() {
        return TzOptions.defaults()
                .withIgnoreZeroZeroLatLon(!this.keepZeroZero)
                .withPreferTimezoneInferenceFromGps(this.preferGps)
                .withInferTimezoneFromDatestamps(this.inferFromDatestamps)
                .withInferTimezoneFromTimeStamp(this.inferFromTimestamp)
                .withDefaultVideosToUtc(!this.noDefaultVideosToUtc);
    }

    /// Reads one input file and renders each of its tag sets.
    ///
    /// A file that cannot be read yields a [FileResult] with an error message, so one bad file never
    /// stops the others.
    ///
    /// @param normalizer the normalizer shared by all workers
    /// @param path the file to read
    /// @return the rendered JSON objects, or the error
    FileResult processFile(TagNormalizer normalizer, Path path) {
        try {
            final List<String> json = new ArrayList<>();
            final List<String> warnings = new ArrayList<>();

            for (final RawTags tags : readTags(path)) {
                final NormalizedTags normalized = normalizer.normalize(tags);
                json.add(ExifToolJson.toJsonString(normalized));
                normalized.warnings().forEach(warning -> warnings.add(describe(tags, path) + ": " + warning));
            }

            return new FileResult(json, warnings, null);
        } catch (IOException | ImageProcessingException ioEx) {
            return new FileResult(List.of(), List.of(), ioEx.getMessage());
        }
    }

    static List<RawTags> readTags(Path path) throws IOException, ImageProcessingException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + path);
        }

        if (isJsonFile(path)) {
            return ExifToolJson.read(path);
        }

        return List.of(MetadataExtractorTags.read(path));
    }

    private boolean report(Path path, Future<FileResult> future) throws InterruptedException {
        final FileResult result;
        try {
            result = future.get();
        } catch (ExecutionException executionException) {
            this.spec
                    .commandLine()
                    .getErr()
                    .println("Error normalizing [" + path + "]: " + executionException.getCause());
            return false;
        }

        if (result.error() != null) {
            this.spec.commandLine().getErr().println("Error reading metadata for [" + path + "]: " + result.error());
            return false;
        }

        result.json().forEach(this.spec.commandLine().getOut()::println);

        if (this.verbose) {
            result.warnings().forEach(this.spec.commandLine().getErr()::println);
        }

        return true;
    }

    private static String describe(RawTags tags, Path path) {
        final String sourceFile = tags.sourceFile();
        return "[" + (sourceFile == null ? path.toString() : sourceFile) + "]";
    }

    private static boolean isJsonFile(Path p) {
        return p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    /**
     * The outcome of reading one input file.
     *
     * @param json one rendered object per tag set
     * @param warnings normalization warnings, prefixed with the source file
     * @param error why the file could not be read, or {@code null}
     */
    record FileResult(List<String> json, List<String> warnings, @Nullable String error) {}
}
