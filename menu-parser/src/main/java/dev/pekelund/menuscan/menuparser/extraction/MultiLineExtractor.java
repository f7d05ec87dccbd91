package dev.pekelund.menuscan.menuparser.extraction;

import dev.pekelund.menuscan.items.ParsedItem;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recovers items whose name and price were printed on two consecutive lines.
 */
@Component
public class MultiLineExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiLineExtractor.class);

    public static final int CONFIDENCE = 70;

    private final LineClassifier lineClassifier;
    private final CategoryInferrer categoryInferrer;

    public MultiLineExtractor(LineClassifier lineClassifier, CategoryInferrer categoryInferrer) {
        this.lineClassifier = lineClassifier;
        this.categoryInferrer = categoryInferrer;
    }

    public List<ParsedItem> extract(MenuText text) {
        List<String> lines = text.lines();
        List<ParsedItem> items = new ArrayList<>();
        for (int index = 0; index < lines.size() - 1; index++) {
            String line = lines.get(index);
            if (lineClassifier.containsPrice(line) || !lineClassifier.isLikelyItemName(line)) {
                continue;
            }
            Matcher priceLine = MenuPatterns.PRICE_ONLY.matcher(lines.get(index + 1));
            if (!priceLine.matches()) {
                continue;
            }
            BigDecimal price = PriceParser.parse(priceLine.group("price"));
            String name = NameCleaner.clean(line);
            if (price == null || price.signum() <= 0 || name.isEmpty()) {
                continue;
            }
            String currency = CurrencyDetector.normalize(priceLine.group("currency"));
            items.add(ParsedItem.of(name, price, currency != null ? currency : text.currency(),
                categoryInferrer.infer(name), CONFIDENCE));
            // The price line belongs to this item.
            index++;
        }
        LOGGER.debug("Multi-line pass recovered {} items", items.size());
        return items;
    }
}
