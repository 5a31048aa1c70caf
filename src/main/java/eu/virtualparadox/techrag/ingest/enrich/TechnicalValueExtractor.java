package eu.virtualparadox.techrag.ingest.enrich;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Mines component designators and electrical readings from raw OCR text.
 * <p>
 * Each labeled matcher runs independently over the whole text; all matches of a category are
 * kept in order of appearance. The result is rendered as a plain-text enrichment block that is
 * appended to (never substituted for) the OCR text before chunking.
 * </p>
 */
@Component
public class TechnicalValueExtractor {

    public static final String NO_VALUES = "No technical values detected";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Map<String, Pattern> MATCHERS = buildMatchers();

    private static Map<String, Pattern> buildMatchers() {
        final Map<String, Pattern> matchers = new LinkedHashMap<>();
        matchers.put("resistors", Pattern.compile("R\\d+\\s*[=:]?\\s*(\\d+\\.?\\d*\\s*[kKmM]?Ω?)", FLAGS));
        matchers.put("capacitors", Pattern.compile("C\\d+\\s*[=:]?\\s*(\\d+\\.?\\d*\\s*[pnumμ]?F?)", FLAGS));
        matchers.put("inductors", Pattern.compile("L\\d+\\s*[=:]?\\s*(\\d+\\.?\\d*\\s*[pnumμmH]?H?)", FLAGS));
        matchers.put("frequencies", Pattern.compile("(\\d+\\.?\\d*\\s*[kKmMgG]?[Hh][Zz])", FLAGS));
        matchers.put("voltages", Pattern.compile("(\\d+\\.?\\d*\\s*[mμnpkKM]?[Vv])", FLAGS));
        matchers.put("currents", Pattern.compile("(\\d+\\.?\\d*\\s*[mμnpkKM]?[Aa])", FLAGS));
        matchers.put("power", Pattern.compile("(\\d+\\.?\\d*\\s*[mμnpkKM]?[Ww])", FLAGS));
        matchers.put("impedance", Pattern.compile("(\\d+\\.?\\d*\\s*Ω)", FLAGS));
        return Collections.unmodifiableMap(matchers);
    }

    /**
     * @param ocrText raw OCR output, may be null
     * @return category → matched values, only categories with at least one match, in a fixed order
     */
    public Map<String, List<String>> extract(final String ocrText) {
        final Map<String, List<String>> found = new LinkedHashMap<>();
        if (ocrText == null || ocrText.isBlank()) {
            return found;
        }
        for (final Map.Entry<String, Pattern> entry : MATCHERS.entrySet()) {
            final List<String> values = new ArrayList<>();
            final Matcher m = entry.getValue().matcher(ocrText);
            while (m.find()) {
                values.add(m.group(1).trim());
            }
            if (!values.isEmpty()) {
                found.put(entry.getKey(), values);
            }
        }
        return found;
    }

    /**
     * Human-readable enrichment block: one {@code category: v1, v2} line per category.
     */
    public String describe(final String ocrText) {
        final Map<String, List<String>> found = extract(ocrText);
        if (found.isEmpty()) {
            return NO_VALUES;
        }
        return found.entrySet().stream()
                .map(e -> e.getKey() + ": " + String.join(", ", e.getValue()))
                .collect(Collectors.joining("\n"));
    }
}
