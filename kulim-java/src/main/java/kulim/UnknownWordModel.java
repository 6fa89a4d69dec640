package kulim;

import java.util.ArrayList;
import java.util.List;

/**
 * Fallback candidates for spans the dictionary does not cover.
 *
 * At a position it offers the run of same-class characters starting there
 * and, if that run is longer than one character, the single character alone
 * at an extra penalty. Content runs stop at {@code maxUnknownLength} code
 * points; whitespace and punctuation runs are not capped. Classes that
 * do not group (brackets, commas, symbols) only ever yield single characters.
 * Surrogate pairs are never split.
 */
public final class UnknownWordModel {

    private final int unknownCost;
    private final int unknownCharPenalty;
    private final int symbolCost;
    private final int maxUnknownLength;

    public UnknownWordModel(AnalyzerConfig config) {
        this(config.unknownCost(), config.unknownCharPenalty(), config.symbolCost(), config.maxUnknownLength());
    }

    public UnknownWordModel(int unknownCost, int unknownCharPenalty, int symbolCost, int maxUnknownLength) {
        if (maxUnknownLength < 1) {
            throw new IllegalArgumentException("maxUnknownLength must be positive: " + maxUnknownLength);
        }
        this.unknownCost = unknownCost;
        this.unknownCharPenalty = unknownCharPenalty;
        this.symbolCost = symbolCost;
        this.maxUnknownLength = maxUnknownLength;
    }

    /**
     * Candidates starting at {@code start}, shortest first. Never empty while {@code start < text.length()}.
     */
    public List<UnknownCandidate> candidates(CharSequence text, int start) {
        int n = text.length();
        if (start < 0 || start >= n) {
            throw new IndexOutOfBoundsException("start " + start + " outside text of length " + n);
        }
        int first = Character.codePointAt(text, start);
        CharClass cls = CharClass.of(first);
        int cost = cls.symbolic() ? symbolCost : unknownCost;
        int singleEnd = start + Character.charCount(first);

        int runEnd = singleEnd;
        if (cls.groups()) {
            int codePoints = 1;
            while (runEnd < n && (codePoints < maxUnknownLength || cls.symbolic())) {
                int cp = Character.codePointAt(text, runEnd);
                if (CharClass.of(cp) != cls) break;
                runEnd += Character.charCount(cp);
                codePoints++;
            }
        }

        List<UnknownCandidate> candidates = new ArrayList<>(2);
        if (runEnd == singleEnd) {
            candidates.add(candidate(text, start, singleEnd, cls, cost));
        } else {
            candidates.add(candidate(text, start, singleEnd, cls, cost + unknownCharPenalty));
            candidates.add(candidate(text, start, runEnd, cls, cost));
        }
        return candidates;
    }

    private static UnknownCandidate candidate(CharSequence text, int start, int end, CharClass cls, int cost) {
        String surface = text.subSequence(start, end).toString();
        return new UnknownCandidate(end, DictionaryEntry.synthetic(surface, cls.pos(), cost));
    }
}
