package de.mirkosertic.bayes.util;

import java.util.regex.Pattern;

/**
 * Strips characters that would otherwise end up inside terms: NUL and other control
 * characters (tab, line feed and carriage return excepted), zero-width characters,
 * the byte order mark and the Unicode replacement character left behind by failed decoding.
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +             // NULL and control chars before TAB
        "\u000B-\u000C" +             // VT, FF
        "\u000E-\u001F" +             // control chars after CR
        "\u200B-\u200D" +             // zero-width space, non-joiner, joiner
        "\uFEFF" +                    // byte order mark
        "\uFFFD" +                    // replacement character
        "]"
    );

    private static final Pattern MULTIPLE_WHITESPACE = Pattern.compile("\\s{2,}");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * Removes invalid characters, collapses whitespace runs into a single space and trims.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, or null if input was null
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        final String cleaned = INVALID_CHARS.matcher(text).replaceAll("");
        return MULTIPLE_WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }
}
