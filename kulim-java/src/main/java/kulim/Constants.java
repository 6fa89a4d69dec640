package kulim;

/**
 * Unicode character classification utilities for Korean text.
 * Hangul Syllables: U+AC00 - U+D7A3, Compatibility Jamo: U+3131 - U+318E,
 * Jamo: U+1100 - U+11FF.
 *
 * Optimized with lookup tables for the ASCII/Latin-1 hot path.
 */
public final class Constants {

    private Constants() {} // Utility class

    // Hangul Unicode range constants
    public static final int HANGUL_BASE = 0xAC00;
    public static final int HANGUL_END = 0xD7A3;
    public static final int JAMO_START = 0x1100;
    public static final int JAMO_END = 0x11FF;
    public static final int COMPAT_JAMO_START = 0x3131;
    public static final int COMPAT_JAMO_END = 0x318E;

    // Punctuation classes for the Latin-1 range (0-255)
    private static final byte TERMINAL = 1;
    private static final byte PAUSE = 2;
    private static final byte ENCLOSING = 3;
    private static final byte SYMBOL = 4;

    private static final byte[] PUNCT_LATIN1 = new byte[256];
    static {
        for (char c : ".!?".toCharArray()) PUNCT_LATIN1[c] = TERMINAL;
        for (char c : ",;:/".toCharArray()) PUNCT_LATIN1[c] = PAUSE;
        for (char c : "\"'()[]{}<>".toCharArray()) PUNCT_LATIN1[c] = ENCLOSING;
        for (char c : "#$%&*+-=@\\^_`|~".toCharArray()) PUNCT_LATIN1[c] = SYMBOL;
        PUNCT_LATIN1[0x00AB] = ENCLOSING; // «
        PUNCT_LATIN1[0x00BB] = ENCLOSING; // »
        PUNCT_LATIN1[0x00B7] = PAUSE;     // · middle dot
    }

    /**
     * Check if codepoint is a precomposed Hangul syllable.
     */
    public static boolean isHangulSyllable(int cp) {
        return cp >= HANGUL_BASE && cp <= HANGUL_END;
    }

    /**
     * Check if codepoint is a Hangul jamo (conjoining or compatibility).
     */
    public static boolean isJamo(int cp) {
        return (cp >= JAMO_START && cp <= JAMO_END) || (cp >= COMPAT_JAMO_START && cp <= COMPAT_JAMO_END);
    }

    public static boolean isDigit(int cp) {
        return (cp >= '0' && cp <= '9') || (cp >= 0xFF10 && cp <= 0xFF19);
    }

    public static boolean isLatin(int cp) {
        return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z')
            || (cp >= 0xFF21 && cp <= 0xFF3A) || (cp >= 0xFF41 && cp <= 0xFF5A)
            || (cp >= 0x00C0 && cp <= 0x024F && cp != 0x00D7 && cp != 0x00F7);
    }

    /**
     * CJK Unified Ideographs, Extension A and the compatibility block.
     */
    public static boolean isHanja(int cp) {
        return (cp >= 0x4E00 && cp <= 0x9FFF) || (cp >= 0x3400 && cp <= 0x4DBF)
            || (cp >= 0xF900 && cp <= 0xFAFF);
    }

    public static boolean isWhitespace(int cp) {
        return cp == ' ' || cp == '\t' || cp == '\n' || cp == '\r' || cp == 0x3000
            || cp == 0x00A0 || Character.isWhitespace(cp);
    }

    /**
     * Sentence-final punctuation (. ! ? and their ideographic/ellipsis forms).
     */
    public static boolean isTerminalPunctuation(int cp) {
        if (cp < 256) return PUNCT_LATIN1[cp] == TERMINAL;
        return cp == 0x3002 || cp == 0xFF01 || cp == 0xFF1F || cp == 0x2026;
    }

    public static boolean isPausePunctuation(int cp) {
        if (cp < 256) return PUNCT_LATIN1[cp] == PAUSE;
        return cp == 0x3001 || cp == 0xFF0C || cp == 0x30FB;
    }

    public static boolean isEnclosingPunctuation(int cp) {
        if (cp < 256) return PUNCT_LATIN1[cp] == ENCLOSING;
        return (cp >= 0x2018 && cp <= 0x201F) || (cp >= 0x3008 && cp <= 0x3011)
            || cp == 0x2015 || cp == 0x2014;
    }

    public static boolean isSymbol(int cp) {
        if (cp < 256) return PUNCT_LATIN1[cp] == SYMBOL;
        int type = Character.getType(cp);
        return type == Character.MATH_SYMBOL || type == Character.CURRENCY_SYMBOL
            || type == Character.OTHER_SYMBOL || type == Character.MODIFIER_SYMBOL
            || type == Character.OTHER_PUNCTUATION || type == Character.DASH_PUNCTUATION;
    }
}
