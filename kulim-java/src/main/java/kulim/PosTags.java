package kulim;

import java.util.Set;

/**
 * Part-of-speech tag set (TTA standard TTAK.KO-11.0010/R1) plus the virtual
 * tags used by the lattice.
 *
 * Tags are plain strings: learned entries may carry tags outside this set,
 * and compound entries join their component tags with {@code '+'}.
 */
public final class PosTags {

    private PosTags() {} // Utility class

    // Lattice boundaries and whitespace
    public static final String BOS = "BOS";
    public static final String EOS = "EOS";
    public static final String SPACE = "SPACE";

    // Nominals
    public static final String NNG = "NNG";
    public static final String NNP = "NNP";
    public static final String NNB = "NNB";
    public static final String NR = "NR";
    public static final String NP = "NP";

    // Predicates
    public static final String VV = "VV";
    public static final String VA = "VA";
    public static final String VX = "VX";
    public static final String VCP = "VCP";
    public static final String VCN = "VCN";

    // Modifiers and interjections
    public static final String MM = "MM";
    public static final String MAG = "MAG";
    public static final String MAJ = "MAJ";
    public static final String IC = "IC";

    // Particles
    public static final String JKS = "JKS";
    public static final String JKC = "JKC";
    public static final String JKG = "JKG";
    public static final String JKO = "JKO";
    public static final String JKB = "JKB";
    public static final String JKV = "JKV";
    public static final String JKQ = "JKQ";
    public static final String JX = "JX";
    public static final String JC = "JC";

    // Endings
    public static final String EP = "EP";
    public static final String EF = "EF";
    public static final String EC = "EC";
    public static final String ETN = "ETN";
    public static final String ETM = "ETM";

    // Affixes and roots
    public static final String XPN = "XPN";
    public static final String XSN = "XSN";
    public static final String XSV = "XSV";
    public static final String XSA = "XSA";
    public static final String XR = "XR";

    // Symbols, foreign text, numbers
    public static final String SF = "SF";
    public static final String SP = "SP";
    public static final String SS = "SS";
    public static final String SE = "SE";
    public static final String SO = "SO";
    public static final String SW = "SW";
    public static final String SL = "SL";
    public static final String SH = "SH";
    public static final String SN = "SN";
    public static final String NA = "NA";

    public static final Set<String> SYMBOLS = Set.of(SF, SP, SS, SE, SO, SW);

    /**
     * Separator used in the tag of a compound entry, e.g. {@code VV+EP+EF}.
     */
    public static final char COMPOUND_SEPARATOR = '+';

    public static boolean isBoundary(String pos) {
        return BOS.equals(pos) || EOS.equals(pos) || SPACE.equals(pos);
    }

    /**
     * Content morpheme: nominals, predicates (copulas included), modifiers,
     * interjections, roots, foreign words, hanja and numbers.
     */
    public static boolean isLexical(String pos) {
        if (pos.startsWith("N") && !NA.equals(pos)) return true;
        if (pos.startsWith("V")) return true;
        if (pos.startsWith("M") || pos.startsWith("I")) return true;
        return XR.equals(pos) || SL.equals(pos) || SH.equals(pos) || SN.equals(pos);
    }

    /**
     * Grammatical morpheme: particles, endings, affixes (roots excluded) and symbols.
     */
    public static boolean isFunctional(String pos) {
        if (pos.startsWith("J") || pos.startsWith("E")) return true;
        if (pos.startsWith("X")) return !XR.equals(pos);
        return pos.startsWith("S") && !SL.equals(pos) && !SH.equals(pos) && !SN.equals(pos)
            && !SPACE.equals(pos);
    }

    /**
     * Free morpheme: can stand alone as a word.
     */
    public static boolean isFree(String pos) {
        if (pos.startsWith("N") && !NA.equals(pos)) return true;
        if (pos.startsWith("M") || pos.startsWith("I")) return true;
        return SL.equals(pos) || SH.equals(pos) || SN.equals(pos);
    }

    /**
     * Bound morpheme: predicate stems, particles, endings, affixes and symbols.
     */
    public static boolean isBound(String pos) {
        if (pos.startsWith("V") || pos.startsWith("J") || pos.startsWith("E") || pos.startsWith("X")) {
            return true;
        }
        return SYMBOLS.contains(pos);
    }
}
