package dev.pekelund.menuscan.menuparser.extraction;

import dev.pekelund.menuscan.items.MenuItemConstants;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the dominant currency marker of a document.
 */
@Component
public class CurrencyDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(CurrencyDetector.class);

    // Order breaks ties.
    private static final List<CurrencyMarker> LEXICON = List.of(
        symbol("$"),
        symbol("₹"),
        symbol("€"),
        symbol("£"),
        symbol("¥"),
        code("AED"),
        code("USD"),
        code("INR"),
        code("EUR"),
        code("GBP"),
        code("Rs")
    );

    public String detect(String text) {
        if (text == null || text.isEmpty()) {
            return MenuItemConstants.DEFAULT_CURRENCY;
        }
        String best = MenuItemConstants.DEFAULT_CURRENCY;
        int bestCount = 0;
        for (CurrencyMarker marker : LEXICON) {
            int count = marker.countIn(text);
            if (count > bestCount) {
                best = marker.symbol();
                bestCount = count;
            }
        }
        LOGGER.debug("Detected document currency '{}' ({} occurrences)", best, bestCount);
        return best;
    }

    /**
     * Canonical form of a currency captured next to a price, e.g. {@code Rs.} becomes {@code Rs}.
     */
    public static String normalize(String captured) {
        if (captured == null || captured.isBlank()) {
            return null;
        }
        String trimmed = captured.trim();
        return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static CurrencyMarker symbol(String symbol) {
        return new CurrencyMarker(symbol, Pattern.compile(Pattern.quote(symbol)));
    }

    private static CurrencyMarker code(String code) {
        return new CurrencyMarker(code, Pattern.compile("\\b" + code + "(?![A-Za-z])"));
    }

    private record CurrencyMarker(String symbol, Pattern pattern) {

        int countIn(String text) {
            Matcher matcher = pattern.matcher(text);
            int count = 0;
            while (matcher.find()) {
                count++;
            }
            return count;
        }
    }
}
