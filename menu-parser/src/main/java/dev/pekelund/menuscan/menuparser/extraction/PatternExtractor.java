package dev.pekelund.menuscan.menuparser.extraction;

import static dev.pekelund.menuscan.menuparser.extraction.MenuPatterns.CURRENCY;
import static dev.pekelund.menuscan.menuparser.extraction.MenuPatterns.PRICE;
import static dev.pekelund.menuscan.menuparser.extraction.MenuPatterns.PRICE_SUFFIX;

import dev.pekelund.menuscan.items.ParsedItem;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recovers name and price pairs that sit on a single line.
 */
@Component
public class PatternExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatternExtractor.class);

    public static final int CONFIDENCE = 85;

    // Longest valid name plus leaders and an amount; longer lines are left to the other strategies.
    static final int MAX_LINE_LENGTH = 200;

    private static final String NAME = "(?<name>.*?\\p{L}.*?)";
    private static final String AMOUNT = "(?<currency>" + CURRENCY + ")?\\s*(?<price>" + PRICE + ")" + PRICE_SUFFIX;

    // A line that opens with an amount followed by words is price-first, even when the name ends in a number.
    private static final String NO_LEADING_AMOUNT = "(?!" + CURRENCY + "?\\s*" + PRICE + PRICE_SUFFIX + "\\s+\\p{L})";

    private static final Pattern NAME_THEN_PRICE = Pattern.compile(
        "^" + NO_LEADING_AMOUNT + NAME + "\\s+" + AMOUNT + "$"
    );
    private static final Pattern PRICE_THEN_NAME = Pattern.compile(
        "^" + AMOUNT + "\\s*[-:|]?\\s+(?<name>\\p{L}.*)$"
    );
    private static final Pattern SEPARATED = Pattern.compile(
        "^" + NAME + "\\s*[|:\u2013\u2014-]\\s*" + AMOUNT + "$"
    );
    private static final Pattern COLUMNS = Pattern.compile(
        "^" + NAME + "\\s{2,}" + AMOUNT + "$"
    );
    private static final Pattern DOT_LEADERS = Pattern.compile(
        "^" + NAME + "\\s*[.…·]{2,}\\s*" + AMOUNT + "$"
    );

    // Priority order.
    private static final List<Pattern> LINE_PATTERNS = List.of(
        NAME_THEN_PRICE,
        PRICE_THEN_NAME,
        SEPARATED,
        COLUMNS,
        DOT_LEADERS
    );

    private final CategoryInferrer categoryInferrer;
    private final ItemValidator itemValidator;

    public PatternExtractor(CategoryInferrer categoryInferrer, ItemValidator itemValidator) {
        this.categoryInferrer = categoryInferrer;
        this.itemValidator = itemValidator;
    }

    public List<ParsedItem> extract(MenuText text) {
        List<ParsedItem> items = new ArrayList<>();
        for (String line : text.lines()) {
            if (line.length() > MAX_LINE_LENGTH) {
                LOGGER.debug("Skipping {}-character line for inline patterns", line.length());
                continue;
            }
            matchLine(line, text.currency()).ifPresent(items::add);
        }
        LOGGER.debug("Inline patterns recovered {} items from {} lines", items.size(), text.lines().size());
        return items;
    }

    private Optional<ParsedItem> matchLine(String line, String defaultCurrency) {
        for (Pattern pattern : LINE_PATTERNS) {
            Matcher matcher = pattern.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            Optional<ParsedItem> item = extractFromMatch(matcher, defaultCurrency)
                .filter(itemValidator::isValidItem);
            if (item.isPresent()) {
                return item;
            }
        }
        return Optional.empty();
    }

    Optional<ParsedItem> extractFromMatch(Matcher matcher, String defaultCurrency) {
        String name = NameCleaner.clean(matcher.group("name"));
        BigDecimal price = PriceParser.parse(matcher.group("price"));
        if (name.isEmpty() || price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        String currency = CurrencyDetector.normalize(matcher.group("currency"));
        return Optional.of(ParsedItem.of(name, price, currency != null ? currency : defaultCurrency,
            categoryInferrer.infer(name), CONFIDENCE));
    }
}
