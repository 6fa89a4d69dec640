package kulim;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * CLI entry point for the analyzer.
 * Usage: java -jar kulim-java.jar --input &lt;file&gt; [--output &lt;file&gt;] [options]
 */
public class Main {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public static void main(String[] args) {
        Options options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            usage();
            System.exit(1);
            return;
        }

        if (options.inputPath == null && options.buildPath == null && !options.stats && options.learnPath == null) {
            usage();
            System.exit(1);
        }

        try {
            run(options);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * @throws IllegalArgumentException on an unknown option, a missing value or a malformed one
     */
    static Options parseArgs(String[] args) {
        Options options = new Options();

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--lexicon":
                case "-x":
                    options.lexiconPaths.add(value(args, ++i, flag));
                    break;
                case "--freq":
                case "-f":
                    options.freqPath = value(args, ++i, flag);
                    break;
                case "--dict":
                case "-d":
                    options.dictPath = value(args, ++i, flag);
                    break;
                case "--config":
                case "-c":
                    options.configPath = value(args, ++i, flag);
                    break;
                case "--input":
                case "-i":
                    options.inputPath = value(args, ++i, flag);
                    break;
                case "--output":
                case "-o":
                    options.outputPath = value(args, ++i, flag);
                    break;
                case "--limit":
                case "-l":
                    options.limit = intValue(args, ++i, flag);
                    break;
                case "--threads":
                case "-t":
                    options.threads = intValue(args, ++i, flag);
                    break;
                case "--learn":
                    options.learnPath = value(args, ++i, flag);
                    break;
                case "--rollback":
                    options.rollback = true;
                    break;
                case "--build":
                case "-b":
                    options.buildPath = value(args, ++i, flag);
                    break;
                case "--stats":
                    options.stats = true;
                    break;
                case "--decoder":
                    String kind = value(args, ++i, flag);
                    try {
                        options.decoder = DecoderKind.valueOf(kind.toUpperCase());
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Unknown decoder for " + flag + ": " + kind, e);
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }
        return options;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[i];
    }

    private static int intValue(String[] args, int i, String flag) {
        String raw = value(args, i, flag);
        int parsed;
        try {
            parsed = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number for " + flag + ": " + raw, e);
        }
        if (parsed < 0) {
            throw new IllegalArgumentException("Expected a non-negative number for " + flag + ": " + raw);
        }
        return parsed;
    }

    private static void usage() {
        System.err.println("Usage: java kulim.Main --input <file> [--output <file>] [options]");
        System.err.println("Options:");
        System.err.println("  --lexicon, -x <path> Lexicon TSV/CSV, repeatable (default: bundled base lexicon)");
        System.err.println("  --freq, -f <path>    Frequency JSON used to re-cost entries");
        System.err.println("  --dict, -d <path>    Dictionary container to load instead of lexicons");
        System.err.println("  --config, -c <path>  Analyzer configuration JSON");
        System.err.println("  --output, -o <path>  Output JSON lines (optional, skip to benchmark only)");
        System.err.println("  --limit, -l <n>      Limit number of lines to process");
        System.err.println("  --threads, -t <n>    Number of threads (0 = auto)");
        System.err.println("  --learn <path>       JSON lines of {surface, morphs} to force-learn first");
        System.err.println("  --rollback           Undo the whole learning batch if an example diverges");
        System.err.println("  --build, -b <path>   Write the resulting dictionary container");
        System.err.println("  --decoder <kind>     REFERENCE or BUFFERED");
        System.err.println("  --stats              Print dictionary statistics");
    }

    private static void run(Options options) throws IOException {
        System.out.println("Initializing analyzer...");
        long startLoad = System.currentTimeMillis();

        AnalyzerConfig config = options.configPath != null
            ? AnalyzerConfig.load(Path.of(options.configPath))
            : AnalyzerConfig.defaults();
        if (options.decoder != null) {
            config = config.toBuilder().decoder(options.decoder).build();
        }

        MorphAnalyzer analyzer;
        if (options.dictPath != null) {
            System.out.println("Dictionary: " + options.dictPath);
            analyzer = MorphAnalyzer.load(Path.of(options.dictPath), config);
        } else {
            DictionaryStore store = new DictionaryStore();
            LexiconLoader loader = new LexiconLoader(store);
            if (options.lexiconPaths.isEmpty()) {
                loader.loadBaseLexicon();
            }
            for (String lexicon : options.lexiconPaths) {
                System.out.println("Lexicon: " + lexicon);
                loader.load(Path.of(lexicon));
            }
            if (options.freqPath != null) {
                System.out.println("Frequencies: " + options.freqPath);
                loader.loadFrequencies(Path.of(options.freqPath));
            }
            analyzer = MorphAnalyzer.create(store, TransitionCostTable.bundled(config), config);
        }

        long loadTime = System.currentTimeMillis() - startLoad;
        System.out.printf("Model loaded in %.2fs (%d entries)%n", loadTime / 1000.0, analyzer.store().size());

        if (options.learnPath != null) {
            learn(analyzer, Path.of(options.learnPath), options.rollback);
        }
        if (options.stats) {
            printStats(analyzer);
        }
        if (options.inputPath != null) {
            analyze(analyzer, options);
        }
        if (options.buildPath != null) {
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("createdAt", java.time.Instant.now().toString());
            analyzer.save(Path.of(options.buildPath), metadata);
            System.out.println("Dictionary written to " + options.buildPath);
        }
    }

    private static void learn(MorphAnalyzer analyzer, Path path, boolean rollback) throws IOException {
        List<LearningExample> examples = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    ExampleJson json = GSON.fromJson(line, ExampleJson.class);
                    if (json == null) {
                        throw new IllegalArgumentException("empty example");
                    }
                    examples.add(json.toExample());
                } catch (JsonParseException | IllegalArgumentException e) {
                    throw new IOException(path + ":" + lineNo + ": invalid learning example: " + e.getMessage(), e);
                }
            }
        }
        List<LearningResult> results = analyzer.learnBatch(examples, rollback);
        int[] counts = new int[LearningResult.Status.values().length];
        for (LearningResult result : results) {
            counts[result.status().ordinal()]++;
        }
        System.out.printf("Learned %d examples: %d converged, %d unchanged, %d diverged%s%n",
            results.size(),
            counts[LearningResult.Status.CONVERGED.ordinal()],
            counts[LearningResult.Status.UNCHANGED.ordinal()],
            counts[LearningResult.Status.DIVERGED.ordinal()],
            !results.isEmpty() && results.get(0).rolledBack() ? " (batch rolled back)" : "");
    }

    private static void printStats(MorphAnalyzer analyzer) {
        DictionaryStore.Stats stats = analyzer.stats();
        System.out.println("Entries: " + stats.entries());
        System.out.println("Trie nodes: " + stats.nodes());
        System.out.println("Max surface length: " + stats.maxSurfaceLength());
        System.out.println("Transitions: " + analyzer.transitions().size());
        System.out.println("POS distribution:");
        for (Map.Entry<String, Integer> e : stats.posDistribution().entrySet()) {
            System.out.printf("  %-8s %d%n", e.getKey(), e.getValue());
        }
    }

    private static void analyze(MorphAnalyzer analyzer, Options options) throws IOException {
        System.out.println("Reading source: " + options.inputPath);

        List<String> lines;
        try (BufferedReader reader = Files.newBufferedReader(Path.of(options.inputPath), StandardCharsets.UTF_8)) {
            if (options.limit != null) {
                lines = reader.lines().filter(l -> !l.isBlank()).limit(options.limit).toList();
            } else {
                lines = reader.lines().filter(l -> !l.isBlank()).toList();
            }
        }

        int numLines = lines.size();
        int numThreads = options.threads > 0 ? options.threads : Runtime.getRuntime().availableProcessors();
        System.out.println("Processing " + numLines + " lines with " + numThreads + " threads...");

        String[] lineArray = new String[numLines];
        for (int i = 0; i < numLines; i++) {
            lineArray[i] = lines.get(i).strip();
        }

        // JIT warmup on the first lines
        int warmupSize = Math.min(100, numLines);
        for (int i = 0; i < warmupSize; i++) {
            analyzer.analyzePath(lineArray[i]);
        }

        String[] results = new String[numLines];
        long startProcess = System.currentTimeMillis();

        ForkJoinPool pool = new ForkJoinPool(numThreads);
        try {
            pool.submit(() ->
                IntStream.range(0, numLines)
                    .parallel()
                    .forEach(i -> results[i] = GSON.toJson(new OutputJson(i, lineArray[i], analyzer.analyze(lineArray[i]))))
            ).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while analyzing", e);
        } catch (Exception e) {
            throw new IOException("Parallel processing failed", e);
        } finally {
            pool.shutdown();
        }

        if (options.outputPath != null) {
            try (BufferedWriter writer = Files.newBufferedWriter(Path.of(options.outputPath), StandardCharsets.UTF_8)) {
                for (String json : results) {
                    writer.write(json);
                    writer.newLine();
                }
            }
        }

        double duration = (System.currentTimeMillis() - startProcess) / 1000.0;
        if (options.outputPath != null) {
            System.out.println("Done. Saved to " + options.outputPath);
        }
        System.out.printf("Time taken: %.2fs%n", duration);
        System.out.printf("Speed: %.2f lines/sec%n", numLines / Math.max(duration, 0.001));
    }

    static final class Options {
        final List<String> lexiconPaths = new ArrayList<>();
        String freqPath;
        String dictPath;
        String configPath;
        String inputPath;
        String outputPath;
        Integer limit;
        int threads;
        String learnPath;
        boolean rollback;
        String buildPath;
        boolean stats;
        DecoderKind decoder;
    }

    static final class OutputJson {
        final int id;
        final String input;
        final List<MorphJson> morphs;

        OutputJson(int id, String input, List<Morph> analysis) {
            this.id = id;
            this.input = input;
            this.morphs = new ArrayList<>(analysis.size());
            for (Morph m : analysis) {
                morphs.add(new MorphJson(m));
            }
        }
    }

    static final class MorphJson {
        String surface;
        String pos;
        String lemma;
        int start;
        int end;
        List<MorphJson> components;

        MorphJson() {
        }

        MorphJson(Morph m) {
            this.surface = m.surface();
            this.pos = m.pos();
            this.lemma = m.lemma();
            this.start = m.start();
            this.end = m.end();
            if (!m.components().isEmpty()) {
                components = new ArrayList<>();
                for (Morph c : m.components()) {
                    components.add(new MorphJson(c));
                }
            }
        }
    }

    static final class ExampleJson {
        String surface;
        List<MorphJson> morphs;

        LearningExample toExample() {
            if (surface == null || morphs == null || morphs.isEmpty()) {
                throw new IllegalArgumentException("expected {\"surface\": ..., \"morphs\": [...]}");
            }
            List<Morph> parsed = new ArrayList<>(morphs.size());
            for (MorphJson m : morphs) {
                if (m.surface == null || m.pos == null) {
                    throw new IllegalArgumentException("morph without surface or pos");
                }
                parsed.add(Morph.of(m.surface, m.pos, m.lemma != null ? m.lemma : m.surface));
            }
            return new LearningExample(surface, parsed);
        }
    }
}
