package kulim;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Fills a {@link DictionaryStore} from lexicon files.
 *
 * <ul>
 *   <li>TSV: {@code surface<TAB>pos[<TAB>lemma[<TAB>cost]]}, {@code #} starts a comment</li>
 *   <li>CSV (Sejong export): header row, then {@code word,pos,lemma}</li>
 *   <li>Frequency JSON: {@code [{"surface": .., "pos": .., "count": ..}, ...]}; re-costs
 *       entries with {@code -log10} of their relative frequency</li>
 * </ul>
 */
public final class LexiconLoader {

    private static final Logger log = LoggerFactory.getLogger(LexiconLoader.class);

    public static final String BASE_LEXICON = "/kulim/base_lexicon.tsv";

    private final DictionaryStore store;
    private final EntryCostEstimator estimator;

    public LexiconLoader(DictionaryStore store) {
        this(store, new EntryCostEstimator());
    }

    public LexiconLoader(DictionaryStore store, EntryCostEstimator estimator) {
        this.store = store;
        this.estimator = estimator;
    }

    /**
     * Loads the lexicon bundled with the analyzer.
     */
    public int loadBaseLexicon() throws IOException {
        try (InputStream in = LexiconLoader.class.getResourceAsStream(BASE_LEXICON)) {
            if (in == null) {
                throw new IOException("Missing resource " + BASE_LEXICON);
            }
            int added = loadTsv(new InputStreamReader(in, StandardCharsets.UTF_8), BASE_LEXICON);
            log.info("Loaded {} base lexicon entries", added);
            return added;
        }
    }

    /**
     * Loads a lexicon file; {@code .csv} files are read as Sejong exports, anything else as TSV.
     * Returns the number of new entries.
     */
    public int load(Path path) throws IOException {
        long start = System.currentTimeMillis();
        int added;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            if (path.getFileName().toString().toLowerCase().endsWith(".csv")) {
                added = loadCsv(reader, path.toString());
            } else {
                added = loadTsv(reader, path.toString());
            }
        }
        log.info("Loaded {} entries from {} in {} ms (max surface length {})",
            added, path, System.currentTimeMillis() - start, store.maxSurfaceLength());
        return added;
    }

    public int loadTsv(Reader source, String name) throws IOException {
        BufferedReader reader = new BufferedReader(source);
        int added = 0;
        int lineNo = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            String[] fields = line.split("\t", -1);
            if (fields.length < 2 || fields[0].isEmpty() || fields[1].isBlank()) {
                throw new IOException(name + ":" + lineNo + ": expected surface<TAB>pos[<TAB>lemma[<TAB>cost]]");
            }
            String surface = fields[0];
            String pos = fields[1].strip();
            String lemma = fields.length > 2 && !fields[2].isBlank() ? fields[2].strip() : surface;
            int cost;
            if (fields.length > 3 && !fields[3].isBlank()) {
                try {
                    cost = Integer.parseInt(fields[3].strip());
                } catch (NumberFormatException e) {
                    throw new IOException(name + ":" + lineNo + ": invalid cost '" + fields[3] + "'", e);
                }
            } else {
                cost = estimator.estimate(surface, pos);
            }
            if (add(surface, pos, lemma, cost)) added++;
        }
        return added;
    }

    public int loadCsv(Reader source, String name) throws IOException {
        BufferedReader reader = new BufferedReader(source);
        String header = reader.readLine();
        if (header == null) {
            return 0;
        }
        int added = 0;
        int lineNo = 1;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) continue;
            String[] fields = line.split(",", -1);
            if (fields.length < 3) {
                log.debug("{}:{}: skipping short row", name, lineNo);
                continue;
            }
            String surface = fields[0].strip();
            String pos = fields[1].strip();
            String lemma = fields[2].strip();
            if (surface.isEmpty() || pos.isEmpty()) {
                throw new IOException(name + ":" + lineNo + ": empty word or tag");
            }
            if (add(surface, pos, lemma.isEmpty() ? surface : lemma, estimator.estimate(surface, pos))) added++;
        }
        return added;
    }

    /**
     * Re-costs entries from observed counts; unseen (surface, pos) pairs are registered.
     * Returns the number of entries updated.
     */
    public int loadFrequencies(Path path) throws IOException {
        List<FrequencyRecord> records;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Type listType = new TypeToken<List<FrequencyRecord>>() {}.getType();
            records = new Gson().fromJson(reader, listType);
        } catch (JsonParseException e) {
            throw new IOException("Invalid frequency file " + path + ": " + e.getMessage(), e);
        }
        if (records == null || records.isEmpty()) {
            log.warn("Frequency file {} is empty; keeping estimated costs", path);
            return 0;
        }
        double total = 0;
        for (FrequencyRecord r : records) {
            if (r.surface == null || r.surface.isEmpty() || r.pos == null || r.count < 0) {
                throw new IOException("Invalid frequency record in " + path + ": " + r.surface + "/" + r.pos);
            }
            total += Math.max(r.count, EntryCostEstimator.MIN_FREQ_FLOOR);
        }
        double sum = total;
        int updated = store.write(s -> {
            int n = 0;
            for (FrequencyRecord r : records) {
                int cost = estimator.fromFrequency(r.count, sum);
                DictionaryEntry entry = s.getOrCreate(r.surface, r.pos, r.lemma, cost);
                s.setCost(entry.id(), cost);
                n++;
            }
            return n;
        });
        log.info("Loaded frequencies for {} entries (floor {}, unseen cost {})", updated,
            EntryCostEstimator.MIN_FREQ_FLOOR, estimator.fromFrequency(0, sum));
        return updated;
    }

    private boolean add(String surface, String pos, String lemma, int cost) {
        if (store.find(surface, pos) != null) {
            return false;
        }
        store.getOrCreate(surface, pos, lemma, cost);
        return true;
    }

    static final class FrequencyRecord {
        String surface;
        String pos;
        String lemma;
        double count;
    }
}
