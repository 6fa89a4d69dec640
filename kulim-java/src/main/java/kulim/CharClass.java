package kulim;

/**
 * Character classes used to group out-of-vocabulary runs.
 */
public enum CharClass {
    HANGUL(PosTags.NNG, true, false),
    JAMO(PosTags.NNG, true, false),
    DIGIT(PosTags.SN, true, false),
    LATIN(PosTags.SL, true, false),
    HANJA(PosTags.SH, true, false),
    WHITESPACE(PosTags.SPACE, true, true),
    TERMINAL(PosTags.SF, true, true),
    PAUSE(PosTags.SP, false, true),
    ENCLOSING(PosTags.SS, false, true),
    SYMBOL(PosTags.SW, false, true),
    OTHER(PosTags.NA, true, false);

    private final String pos;
    private final boolean groups;
    private final boolean symbolic;

    CharClass(String pos, boolean groups, boolean symbolic) {
        this.pos = pos;
        this.groups = groups;
        this.symbolic = symbolic;
    }

    /**
     * POS tag guessed for an unknown span of this class.
     */
    public String pos() {
        return pos;
    }

    /**
     * Whether consecutive characters of this class form one candidate span.
     */
    public boolean groups() {
        return groups;
    }

    /**
     * Whitespace and punctuation: priced with the symbol cost instead of the unknown cost.
     */
    public boolean symbolic() {
        return symbolic;
    }

    public static CharClass of(int cp) {
        if (Constants.isHangulSyllable(cp)) return HANGUL;
        if (Constants.isJamo(cp)) return JAMO;
        if (Constants.isDigit(cp)) return DIGIT;
        if (Constants.isWhitespace(cp)) return WHITESPACE;
        if (Constants.isLatin(cp)) return LATIN;
        if (Constants.isHanja(cp)) return HANJA;
        if (Constants.isTerminalPunctuation(cp)) return TERMINAL;
        if (Constants.isPausePunctuation(cp)) return PAUSE;
        if (Constants.isEnclosingPunctuation(cp)) return ENCLOSING;
        if (Constants.isSymbol(cp)) return SYMBOL;
        return OTHER;
    }
}
