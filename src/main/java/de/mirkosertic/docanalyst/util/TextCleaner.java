package de.mirkosertic.docanalyst.util;

import java.util.regex.Pattern;

/**
 * Removes characters that PDF and Office extraction leaves behind but that carry no text:
 * control characters, zero-width characters, byte order marks and replacement characters.
 *
 * <p>Line structure is kept intact because paragraph segmentation relies on blank lines.
 * Windows and old Mac line endings are converted to {@code \n}.</p>
 */
public final class TextCleaner {

    /**
     * Pattern matching characters to remove:
     * <ul>
     *   <li>U+0000-U+0008, U+000B-U+000C, U+000E-U+001F: control characters except tab, LF and CR</li>
     *   <li>U+007F: delete</li>
     *   <li>U+200B-U+200D: zero-width space, non-joiner and joiner</li>
     *   <li>U+FEFF: byte order mark</li>
     *   <li>U+FFFD: replacement character</li>
     * </ul>
     */
    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +
        "\u000B-\u000C" +
        "\u000E-\u001F" +
        "\u007F" +
        "\u200B-\u200D" +
        "\uFEFF" +
        "\uFFFD" +
        "]"
    );

    private static final Pattern LINE_ENDINGS = Pattern.compile("\r\n?");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * @param text extracted text (may be null)
     * @return cleaned text with line breaks normalized to {@code \n}, or null if input was null
     */
    public static String cleanPreservingLines(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        final String withoutInvalid = INVALID_CHARS.matcher(text).replaceAll("");
        return LINE_ENDINGS.matcher(withoutInvalid).replaceAll("\n");
    }
}
