package eu.virtualparadox.techrag.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

@Component
public class TextCleaner {

    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF]");
    private static final Pattern FORMAT_CHARS = Pattern.compile("\\p{Cf}");
    private static final Pattern CONTROL_CHARS_EXCEPT_NEWLINE = Pattern.compile("[\\p{Cc}&&[^\\n]]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t\\x0B\\f \\u00A0\\u2000-\\u200A\\u202F\\u205F\\u3000]+");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");
    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");

    /**
     * Cleans extracted text into a single line: removes control characters and zero-width
     * spaces, and collapses every whitespace run (line breaks included) into one space.
     *
     * @param input raw text, may be null
     * @return cleaned text, never null
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        final String stripped = removeInvisibles(input.replace("\r", "\n"));
        return ANY_WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Cleans extracted text while keeping its line structure: spaces inside a line are
     * collapsed, trailing spaces are dropped and runs of blank lines become a single
     * blank line, so paragraph breaks survive for the chunker.
     *
     * @param input raw text, may be null
     * @return cleaned text, never null
     */
    public String cleanPreservingLines(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        final String unixLines = input.replace("\r\n", "\n").replace('\r', '\n');
        final String stripped = removeInvisibles(unixLines);

        final StringBuilder sb = new StringBuilder(stripped.length());
        for (final String line : stripped.split("\n", -1)) {
            sb.append(HORIZONTAL_WHITESPACE.matcher(line).replaceAll(" ").trim()).append('\n');
        }
        return BLANK_LINE_RUN.matcher(sb).replaceAll("\n\n").trim();
    }

    private static String removeInvisibles(final String input) {
        String text = Normalizer.normalize(input, Normalizer.Form.NFC);
        // soft hyphen -> remove
        text = text.replace("\u00AD", "");
        // zero-width and other format chars -> SPACE
        text = ZERO_WIDTH.matcher(text).replaceAll(" ");
        text = FORMAT_CHARS.matcher(text).replaceAll(" ");
        // non-breaking space -> SPACE
        text = text.replace('\u00A0', ' ');
        // tabs become spaces, other control chars are dropped
        text = text.replace('\t', ' ');
        return CONTROL_CHARS_EXCEPT_NEWLINE.matcher(text).replaceAll("");
    }
}
