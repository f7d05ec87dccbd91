package dev.pekelund.menuscan.menuparser.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import dev.pekelund.menuscan.items.ParsedItem;
import dev.pekelund.menuscan.menuparser.extraction.MenuTextExtractor.TextExtractionResult;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MenuTextExtractorTest {

    private MenuTextExtractor extractor;

    @BeforeEach
    void setUp() {
        CategoryInferrer categoryInferrer = new CategoryInferrer();
        ItemValidator itemValidator = new ItemValidator();
        LineClassifier lineClassifier = new LineClassifier();
        extractor = new MenuTextExtractor(new CurrencyDetector(), itemValidator,
            new PatternExtractor(categoryInferrer, itemValidator),
            new MultiLineExtractor(lineClassifier, categoryInferrer),
            new TableExtractor(lineClassifier, categoryInferrer),
            new FallbackExtractor(categoryInferrer));
    }

    @Test
    void extractsItemsAndDropsTotals() {
        TextExtractionResult result = extractor.extract("""
            Chicken Biryani .......... 250
            Naan 2 45
            Total 340
            """);

        assertThat(result.usedFallback()).isFalse();
        assertThat(result.currency()).isEqualTo("$");
        assertThat(result.items()).extracting(ParsedItem::name).containsExactly("Chicken Biryani", "Naan 2");
        assertThat(result.items()).extracting(item -> item.price().toPlainString()).containsExactly("250", "45");
        assertThat(result.items()).extracting(ParsedItem::category).containsExactly("Main Course", "Bread");
    }

    @Test
    void combinesStructuredPassesWithoutDuplicates() {
        TextExtractionResult result = extractor.extract("""
            Masala Dosa\t₹120
            Filter Coffee
            ₹45
            """);

        assertThat(result.currency()).isEqualTo("₹");
        assertThat(result.items()).extracting(ParsedItem::name).containsExactly("Masala Dosa", "Filter Coffee");
        assertThat(result.items()).extracting(ParsedItem::confidence)
            .containsExactly(PatternExtractor.CONFIDENCE, MultiLineExtractor.CONFIDENCE);
    }

    @Test
    void fallsBackWhenStructuredPassesFindNothing() {
        TextExtractionResult result = extractor.extract("Todays special Lamb Shank 450 served with rice");

        assertThat(result.usedFallback()).isTrue();
        assertThat(result.items()).singleElement().satisfies(item -> {
            assertThat(item.name()).isEqualTo("Todays special Lamb Shank");
            assertThat(item.confidence()).isEqualTo(FallbackExtractor.CONFIDENCE);
        });
    }

    @Test
    void returnsNoItemsForTextWithoutPrices() {
        TextExtractionResult result = extractor.extract("Welcome to our restaurant\nOpen daily");

        assertThat(result.items()).isEmpty();
        assertThat(result.usedFallback()).isTrue();
    }

    @Test
    void handlesLongUnpricedParagraphWithinBudget() {
        String paragraph = "ab ".repeat(3000) + "x";

        TextExtractionResult result = assertTimeoutPreemptively(Duration.ofSeconds(2),
            () -> extractor.extract(paragraph));

        assertThat(result.items()).isEmpty();
    }
}
