package kulim;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunable costs and learning rates of an analyzer.
 *
 * Immutable once built. Loadable from JSON: fields missing from the file keep
 * their defaults.
 */
public final class AnalyzerConfig {

    private int unknownCost = 50;
    private int unknownCharPenalty = 10;
    private int symbolCost = 0;
    private int maxUnknownLength = 16;
    private int defaultTransitionCost = 10;
    private int boundaryCost = 0;
    private int learnDefaultCost = 10;
    private int learnPenalty = 2;
    private int learnReward = 1;
    private int minimumCost = -100;
    private int forceLearnMaxRounds = 32;
    private double scorerWeight = 1.0;
    private DecoderKind decoder = DecoderKind.BUFFERED;
    private int cacheCapacity = 1024;

    private AnalyzerConfig() {
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    public static Builder builder() {
        return new Builder(new AnalyzerConfig());
    }

    /**
     * Reads a JSON configuration file.
     *
     * @throws IOException if the file cannot be read or is not a valid configuration
     */
    public static AnalyzerConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    public static AnalyzerConfig fromJson(Reader reader) throws IOException {
        AnalyzerConfig config;
        try {
            config = new Gson().fromJson(reader, AnalyzerConfig.class);
        } catch (JsonParseException e) {
            throw new IOException("Invalid analyzer configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            return defaults();
        }
        if (config.decoder == null) {
            config.decoder = DecoderKind.BUFFERED;
        }
        config.validate();
        return config;
    }

    public Builder toBuilder() {
        return new Builder(copy());
    }

    public int unknownCost() {
        return unknownCost;
    }

    public int unknownCharPenalty() {
        return unknownCharPenalty;
    }

    public int symbolCost() {
        return symbolCost;
    }

    public int maxUnknownLength() {
        return maxUnknownLength;
    }

    public int defaultTransitionCost() {
        return defaultTransitionCost;
    }

    public int boundaryCost() {
        return boundaryCost;
    }

    /**
     * Cost given to entries the learner inserts.
     */
    public int learnDefaultCost() {
        return learnDefaultCost;
    }

    public int learnPenalty() {
        return learnPenalty;
    }

    public int learnReward() {
        return learnReward;
    }

    /**
     * Floor for costs lowered by learning.
     */
    public int minimumCost() {
        return minimumCost;
    }

    public int forceLearnMaxRounds() {
        return forceLearnMaxRounds;
    }

    public double scorerWeight() {
        return scorerWeight;
    }

    public DecoderKind decoder() {
        return decoder;
    }

    /**
     * Maximum number of cached analyses; 0 disables the cache.
     */
    public int cacheCapacity() {
        return cacheCapacity;
    }

    private AnalyzerConfig copy() {
        AnalyzerConfig c = new AnalyzerConfig();
        c.unknownCost = unknownCost;
        c.unknownCharPenalty = unknownCharPenalty;
        c.symbolCost = symbolCost;
        c.maxUnknownLength = maxUnknownLength;
        c.defaultTransitionCost = defaultTransitionCost;
        c.boundaryCost = boundaryCost;
        c.learnDefaultCost = learnDefaultCost;
        c.learnPenalty = learnPenalty;
        c.learnReward = learnReward;
        c.minimumCost = minimumCost;
        c.forceLearnMaxRounds = forceLearnMaxRounds;
        c.scorerWeight = scorerWeight;
        c.decoder = decoder;
        c.cacheCapacity = cacheCapacity;
        return c;
    }

    private void validate() {
        if (maxUnknownLength < 1) {
            throw new IllegalArgumentException("maxUnknownLength must be positive: " + maxUnknownLength);
        }
        if (learnPenalty < 0 || learnReward < 0) {
            throw new IllegalArgumentException("Learning penalty and reward must not be negative");
        }
        if (learnPenalty == 0 && learnReward == 0) {
            throw new IllegalArgumentException("Learning penalty and reward cannot both be zero");
        }
        if (forceLearnMaxRounds < 1) {
            throw new IllegalArgumentException("forceLearnMaxRounds must be positive: " + forceLearnMaxRounds);
        }
        if (cacheCapacity < 0) {
            throw new IllegalArgumentException("cacheCapacity must not be negative: " + cacheCapacity);
        }
        if (Double.isNaN(scorerWeight) || Double.isInfinite(scorerWeight)) {
            throw new IllegalArgumentException("scorerWeight must be finite");
        }
    }

    @Override
    public String toString() {
        return new Gson().toJson(this);
    }

    public static final class Builder {
        private final AnalyzerConfig config;

        private Builder(AnalyzerConfig config) {
            this.config = config;
        }

        public Builder unknownCost(int value) {
            config.unknownCost = value;
            return this;
        }

        public Builder unknownCharPenalty(int value) {
            config.unknownCharPenalty = value;
            return this;
        }

        public Builder symbolCost(int value) {
            config.symbolCost = value;
            return this;
        }

        public Builder maxUnknownLength(int value) {
            config.maxUnknownLength = value;
            return this;
        }

        public Builder defaultTransitionCost(int value) {
            config.defaultTransitionCost = value;
            return this;
        }

        public Builder boundaryCost(int value) {
            config.boundaryCost = value;
            return this;
        }

        public Builder learnDefaultCost(int value) {
            config.learnDefaultCost = value;
            return this;
        }

        public Builder learnPenalty(int value) {
            config.learnPenalty = value;
            return this;
        }

        public Builder learnReward(int value) {
            config.learnReward = value;
            return this;
        }

        public Builder minimumCost(int value) {
            config.minimumCost = value;
            return this;
        }

        public Builder forceLearnMaxRounds(int value) {
            config.forceLearnMaxRounds = value;
            return this;
        }

        public Builder scorerWeight(double value) {
            config.scorerWeight = value;
            return this;
        }

        public Builder decoder(DecoderKind value) {
            config.decoder = java.util.Objects.requireNonNull(value, "decoder");
            return this;
        }

        public Builder cacheCapacity(int value) {
            config.cacheCapacity = value;
            return this;
        }

        public AnalyzerConfig build() {
            AnalyzerConfig built = config.copy();
            built.validate();
            return built;
        }
    }
}
