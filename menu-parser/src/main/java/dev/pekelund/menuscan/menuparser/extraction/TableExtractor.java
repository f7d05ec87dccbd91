package dev.pekelund.menuscan.menuparser.extraction;

import dev.pekelund.menuscan.items.ParsedItem;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recovers items from column aligned or tab separated text where the price is the last column.
 */
@Component
public class TableExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableExtractor.class);

    public static final int CONFIDENCE = 80;

    private static final Pattern COLUMN_SEPARATOR = Pattern.compile("\\t+|\\s{3,}");

    private final LineClassifier lineClassifier;
    private final CategoryInferrer categoryInferrer;

    public TableExtractor(LineClassifier lineClassifier, CategoryInferrer categoryInferrer) {
        this.lineClassifier = lineClassifier;
        this.categoryInferrer = categoryInferrer;
    }

    public List<ParsedItem> extract(MenuText text) {
        List<ParsedItem> items = new ArrayList<>();
        for (String line : text.lines()) {
            String[] columns = COLUMN_SEPARATOR.split(line.strip());
            if (columns.length < 2) {
                continue;
            }
            Matcher priceColumn = MenuPatterns.PRICE_ONLY.matcher(columns[columns.length - 1].strip());
            if (!priceColumn.matches()) {
                continue;
            }
            String joined = String.join(" ", Arrays.copyOf(columns, columns.length - 1)).strip();
            if (!lineClassifier.isLikelyItemName(joined)) {
                continue;
            }
            BigDecimal price = PriceParser.parse(priceColumn.group("price"));
            String name = NameCleaner.clean(joined);
            if (price == null || price.signum() <= 0 || name.isEmpty()) {
                continue;
            }
            String currency = CurrencyDetector.normalize(priceColumn.group("currency"));
            items.add(ParsedItem.of(name, price, currency != null ? currency : text.currency(),
                categoryInferrer.infer(name), CONFIDENCE));
        }
        LOGGER.debug("Table pass recovered {} items", items.size());
        return items;
    }
}
