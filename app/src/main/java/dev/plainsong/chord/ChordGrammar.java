package dev.plainsong.chord;

import java.util.regex.Pattern;

/**
 * Surface grammar of chord names such as {@code Am}, {@code F#m7b5}, {@code Csus4add9} or {@code D/F#}.
 *
 * <p>The whole token must match. No musical validation is performed beyond the grammar.
 */
public final class ChordGrammar {

    private static final String ROOT = "[CDEFGAB]";
    private static final String ACCIDENTAL = "[b#]";
    private static final String QUALITY = "(?:m|M|min|maj|dim|Δ|°|ø|Ø)";
    private static final String DEGREE = "(?:2|4|5|6|7|9|10|11|13)";
    private static final String EXTENSION = "(?:(?:sus|add)?" + ACCIDENTAL + "?" + DEGREE + "?)";
    private static final String ALTERATION = "(?:\\+|aug|alt)";
    private static final String SLASH = "(?:/" + ROOT + ACCIDENTAL + "?)";

    // Possessive extension loop: no alteration or slash bass begins with text an extension accepts,
    // and a possessive loop does not recurse once per repetition.
    static final String CHORD_REGEX = ROOT + ACCIDENTAL + "?" + QUALITY + "?"
            + EXTENSION + "*+" + ALTERATION + "?" + SLASH + "?";

    private static final Pattern CHORD = Pattern.compile(CHORD_REGEX);

    private ChordGrammar() {
    }

    public static boolean isChord(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        return CHORD.matcher(token).matches();
    }
}
