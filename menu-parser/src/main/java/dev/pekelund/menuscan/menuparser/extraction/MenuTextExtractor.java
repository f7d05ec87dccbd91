package dev.pekelund.menuscan.menuparser.extraction;

import dev.pekelund.menuscan.items.ParsedItem;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the text strategies in their fixed priority order and merges the outcome through the
 * deduplicating validator. The fallback pass only runs when the structured passes found nothing.
 */
@Component
public class MenuTextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(MenuTextExtractor.class);

    private final CurrencyDetector currencyDetector;
    private final ItemValidator itemValidator;
    private final List<ExtractionPass> structuredPasses;
    private final ExtractionPass fallbackPass;

    public MenuTextExtractor(CurrencyDetector currencyDetector, ItemValidator itemValidator,
        PatternExtractor patternExtractor, MultiLineExtractor multiLineExtractor, TableExtractor tableExtractor,
        FallbackExtractor fallbackExtractor) {

        this.currencyDetector = currencyDetector;
        this.itemValidator = itemValidator;
        this.structuredPasses = List.of(
            new ExtractionPass("inline", patternExtractor::extract),
            new ExtractionPass("multi-line", multiLineExtractor::extract),
            new ExtractionPass("table", tableExtractor::extract)
        );
        this.fallbackPass = new ExtractionPass("fallback", fallbackExtractor::extract);
    }

    public TextExtractionResult extract(String rawText) {
        MenuText text = MenuText.of(rawText, currencyDetector.detect(rawText));

        List<List<ParsedItem>> outputs = new ArrayList<>();
        for (ExtractionPass pass : structuredPasses) {
            List<ParsedItem> found = pass.strategy().apply(text);
            LOGGER.debug("Extraction pass '{}' produced {} candidates", pass.name(), found.size());
            outputs.add(found);
        }
        List<ParsedItem> items = itemValidator.mergeInPriorityOrder(outputs);
        if (!items.isEmpty()) {
            LOGGER.info("Structured passes recovered {} items from {} lines (currency {})", items.size(),
                text.lines().size(), text.currency());
            return new TextExtractionResult(items, text.currency(), false);
        }

        List<ParsedItem> fallbackItems = itemValidator.mergeInPriorityOrder(List.of(fallbackPass.strategy().apply(text)));
        LOGGER.info("Structured passes found no items; fallback recovered {} items", fallbackItems.size());
        return new TextExtractionResult(fallbackItems, text.currency(), true);
    }

    private record ExtractionPass(String name, Function<MenuText, List<ParsedItem>> strategy) { }

    /**
     * Items recovered from one document's text.
     *
     * @param items        validated, deduplicated items in priority order
     * @param currency     dominant currency of the document
     * @param usedFallback whether only the fallback pass produced the items
     */
    public record TextExtractionResult(List<ParsedItem> items, String currency, boolean usedFallback) {

        public TextExtractionResult {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }
}
