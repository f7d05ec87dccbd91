package dev.pekelund.menuscan.menuparser.extraction;

import dev.pekelund.menuscan.items.ParsedItem;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Last resort extraction that pairs every price-like token with the words printed just before it.
 * Only used when the structured strategies found nothing, so a malformed document still yields
 * something to correct by hand.
 */
@Component
public class FallbackExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(FallbackExtractor.class);

    public static final int CONFIDENCE = 50;

    static final int LOOKBEHIND_CHARS = 100;
    static final int MAX_NAME_WORDS = 5;

    private static final Pattern PRICE_TOKEN = Pattern.compile(
        "(?<![\\d.,])(?<price>\\d+(?:[.,]\\d+)*)(?![\\d\\p{L}])"
    );

    private final CategoryInferrer categoryInferrer;

    public FallbackExtractor(CategoryInferrer categoryInferrer) {
        this.categoryInferrer = categoryInferrer;
    }

    public List<ParsedItem> extract(MenuText text) {
        String raw = text.rawText();
        List<ParsedItem> items = new ArrayList<>();
        Matcher matcher = PRICE_TOKEN.matcher(raw);
        while (matcher.find()) {
            BigDecimal price = PriceParser.parse(matcher.group("price"));
            if (price == null || price.signum() <= 0) {
                continue;
            }
            String window = raw.substring(Math.max(0, matcher.start() - LOOKBEHIND_CHARS), matcher.start());
            List<String> words = Arrays.stream(window.split("\\s+"))
                .filter(word -> word.length() > 2)
                .filter(word -> word.chars().anyMatch(Character::isLetter))
                .collect(Collectors.toList());
            if (words.isEmpty()) {
                continue;
            }
            List<String> tail = words.subList(Math.max(0, words.size() - MAX_NAME_WORDS), words.size());
            String name = NameCleaner.clean(String.join(" ", tail));
            if (name.isEmpty()) {
                continue;
            }
            items.add(ParsedItem.of(name, price, text.currency(), categoryInferrer.infer(name), CONFIDENCE));
        }
        LOGGER.debug("Fallback pass produced {} candidate items", items.size());
        return items;
    }
}
