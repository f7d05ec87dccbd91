package dev.pekelund.menuscan.menuparser.extraction;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decoded menu text prepared for the extraction strategies.
 *
 * @param rawText  text as produced by the decoder
 * @param lines    non-blank lines, trimmed, in reading order
 * @param currency dominant currency of the document
 */
public record MenuText(String rawText, List<String> lines, String currency) {

    public MenuText {
        rawText = rawText == null ? "" : rawText;
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static MenuText of(String rawText, String currency) {
        String text = rawText == null ? "" : rawText;
        List<String> lines = Arrays.stream(text.split("\\r?\\n"))
            .map(line -> line.replace('\u00A0', ' ').strip())
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toList());
        return new MenuText(text, lines, currency);
    }
}
