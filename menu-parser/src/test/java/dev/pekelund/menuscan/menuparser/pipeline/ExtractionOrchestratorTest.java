package dev.pekelund.menuscan.menuparser.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.pekelund.menuscan.items.BoundingBox;
import dev.pekelund.menuscan.items.CategoryDetails;
import dev.pekelund.menuscan.items.InputKind;
import dev.pekelund.menuscan.items.OcrWord;
import dev.pekelund.menuscan.items.ParsedItem;
import dev.pekelund.menuscan.menuparser.decoding.DelimitedRowDecoder;
import dev.pekelund.menuscan.menuparser.decoding.ExcelRowDecoder;
import dev.pekelund.menuscan.menuparser.decoding.ImageDecoder;
import dev.pekelund.menuscan.menuparser.decoding.MenuRow;
import dev.pekelund.menuscan.menuparser.decoding.OcrEngine;
import dev.pekelund.menuscan.menuparser.decoding.OcrResult;
import dev.pekelund.menuscan.menuparser.decoding.PdfTextExtractor;
import dev.pekelund.menuscan.menuparser.extraction.CategoryInferrer;
import dev.pekelund.menuscan.menuparser.extraction.CurrencyDetector;
import dev.pekelund.menuscan.menuparser.extraction.FallbackExtractor;
import dev.pekelund.menuscan.menuparser.extraction.ItemValidator;
import dev.pekelund.menuscan.menuparser.extraction.LineClassifier;
import dev.pekelund.menuscan.menuparser.extraction.MenuTextExtractor;
import dev.pekelund.menuscan.menuparser.extraction.MultiLineExtractor;
import dev.pekelund.menuscan.menuparser.extraction.PatternExtractor;
import dev.pekelund.menuscan.menuparser.extraction.TableExtractor;
import dev.pekelund.menuscan.menuparser.imaging.ImageRegionDetector;
import dev.pekelund.menuscan.menuparser.imaging.SpatialMatcher;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExtractionOrchestratorTest {

    private final OcrEngine ocrEngine = mock(OcrEngine.class);
    private ExecutorService executor;
    private MenuExtractionProperties properties;
    private ExtractionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        properties = new MenuExtractionProperties();
        properties.setDecodeTimeout(Duration.ofSeconds(5));

        CategoryInferrer categoryInferrer = new CategoryInferrer();
        CurrencyDetector currencyDetector = new CurrencyDetector();
        ItemValidator itemValidator = new ItemValidator();
        LineClassifier lineClassifier = new LineClassifier();
        MenuTextExtractor menuTextExtractor = new MenuTextExtractor(currencyDetector, itemValidator,
            new PatternExtractor(categoryInferrer, itemValidator),
            new MultiLineExtractor(lineClassifier, categoryInferrer),
            new TableExtractor(lineClassifier, categoryInferrer),
            new FallbackExtractor(categoryInferrer));

        orchestrator = new ExtractionOrchestrator(new ImageDecoder(), ocrEngine, new PdfTextExtractor(),
            new ExcelRowDecoder(), new DelimitedRowDecoder(), menuTextExtractor, currencyDetector, categoryInferrer,
            itemValidator, new ImageRegionDetector(), new SpatialMatcher(), executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void extractsPastedTextAndNumbersItems() {
        MenuExtractionResult result = orchestrator.extract(ExtractionRequest.ofText("""
            Chicken Biryani .......... 250
            Naan 2 45
            Total 340
            """, null));

        assertThat(result.state()).isEqualTo(ExtractionState.DONE);
        assertThat(result.failure()).isNull();
        assertThat(result.items()).extracting(ParsedItem::id).containsExactly("1", "2");
        assertThat(result.items()).extracting(ParsedItem::name).containsExactly("Chicken Biryani", "Naan 2");
        assertThat(result.items()).noneMatch(ParsedItem::lowConfidence);
        assertThat(result.overallConfidence()).isEqualTo(85);
        assertThat(result.regions()).isEmpty();
    }

    @Test
    void flagsItemsBelowRequestedConfidenceFloor() {
        MenuExtractionResult result = orchestrator.extract(ExtractionRequest.ofText("""
            Paneer Tikka 250
            Garlic Naan
            60
            """, 80));

        assertThat(result.items()).extracting(ParsedItem::name, ParsedItem::lowConfidence)
            .containsExactly(
                tuple("Paneer Tikka", false),
                tuple("Garlic Naan", true));
        assertThat(result.overallConfidence()).isEqualTo(78);
    }

    @Test
    void reportsNoItemsWithRawText() {
        MenuExtractionResult result = orchestrator.extract(ExtractionRequest.ofText("Welcome to our cafe", null));

        assertThat(result.state()).isEqualTo(ExtractionState.FAILED);
        assertThat(result.failure()).isEqualTo(ExtractionFailure.NO_ITEMS_FOUND);
        assertThat(result.rawText()).isEqualTo("Welcome to our cafe");
        assertThat(result.items()).isEmpty();
    }

    @Test
    void reportsDecodeFailureForUnreadablePdf() {
        MenuExtractionResult result = orchestrator.extract(new ExtractionRequest(InputKind.PDF,
            "broken".getBytes(StandardCharsets.UTF_8), "menu.pdf", null));

        assertThat(result.state()).isEqualTo(ExtractionState.FAILED);
        assertThat(result.failure()).isEqualTo(ExtractionFailure.DECODE_FAILURE);
        assertThat(result.message()).contains("PDF");
    }

    @Test
    void reportsUnexpectedDecoderErrorsAsDecodeFailure() throws IOException {
        when(ocrEngine.recognize(any())).thenThrow(new IllegalStateException("engine crashed"));

        MenuExtractionResult result = orchestrator.extract(imageRequest(blankPage()));

        assertThat(result.failure()).isEqualTo(ExtractionFailure.DECODE_FAILURE);
        assertThat(result.message()).contains("engine crashed");
    }

    @Test
    void reportsTimeoutWhenDecodingExceedsBudget() throws IOException {
        properties.setDecodeTimeout(Duration.ofMillis(200));
        when(ocrEngine.recognize(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return new OcrResult("", 0, List.of());
        });

        MenuExtractionResult result = orchestrator.extract(imageRequest(blankPage()));

        assertThat(result.state()).isEqualTo(ExtractionState.FAILED);
        assertThat(result.failure()).isEqualTo(ExtractionFailure.TIMEOUT);
    }

    @Test
    void reportsSupersededRunsWithoutFinishing() {
        MenuExtractionResult result = orchestrator.extract(ExtractionRequest.ofText("Paneer Tikka 250", null),
            () -> true);

        assertThat(result.failure()).isEqualTo(ExtractionFailure.SUPERSEDED);
        assertThat(result.items()).isEmpty();
    }

    @Test
    void matchesPhotographsToItemsOnImageMenus() throws IOException {
        BufferedImage page = blankPage();
        for (int row = 0; row < 150; row++) {
            for (int column = 0; column < 150; column++) {
                page.setRGB(100 + column, 100 + row, (row + column) % 2 == 0 ? 0x000000 : 0xFFFFFF);
            }
        }
        when(ocrEngine.recognize(any())).thenReturn(new OcrResult("Chicken Biryani 250\nMango Lassi 90\n", 88,
            List.of(
                new OcrWord("Chicken", new BoundingBox(260, 160, 300, 190), 90),
                new OcrWord("Biryani", new BoundingBox(305, 160, 350, 190), 90),
                new OcrWord("Mango", new BoundingBox(400, 420, 430, 440), 85),
                new OcrWord("Lassi", new BoundingBox(435, 420, 470, 440), 85))));

        MenuExtractionResult result = orchestrator.extract(imageRequest(page));

        assertThat(result.state()).isEqualTo(ExtractionState.DONE);
        assertThat(result.regions()).singleElement().satisfies(region -> {
            assertThat(region.x()).isEqualTo(100);
            assertThat(region.y()).isEqualTo(100);
        });
        assertThat(result.items()).extracting(ParsedItem::name).containsExactly("Chicken Biryani", "Mango Lassi");
        assertThat(result.items().get(0).image()).isSameAs(result.regions().get(0));
        assertThat(result.items().get(1).hasImage()).isFalse();
    }

    @Test
    void trustsSpreadsheetRowsButStillValidatesAndDeduplicates() {
        byte[] csv = """
            name,price,category
            Masala Dosa,₹120,
            Total,₹240,
            Masala Dosa,120,
            Cold Coffee,₹90,Drinks
            """.getBytes(StandardCharsets.UTF_8);

        MenuExtractionResult result = orchestrator.extract(
            new ExtractionRequest(InputKind.DELIMITED_TEXT, csv, "menu.csv", null));

        assertThat(result.state()).isEqualTo(ExtractionState.DONE);
        assertThat(result.items()).extracting(ParsedItem::name).containsExactly("Masala Dosa", "Cold Coffee");
        assertThat(result.items()).extracting(ParsedItem::category).containsExactly("Main Course", "Drinks");
        assertThat(result.items()).allSatisfy(item -> {
            assertThat(item.confidence()).isEqualTo(ExtractionOrchestrator.SPREADSHEET_CONFIDENCE);
            assertThat(item.currency()).isEqualTo("₹");
        });
        assertThat(result.overallConfidence()).isEqualTo(100);
    }

    @Test
    void carriesCategoryDetailsFromSpreadsheetRows() {
        CategoryDetails mains = CategoryDetails.of("Served with rice", "#228B22");

        List<ParsedItem> items = orchestrator.itemsFromRows(List.of(
            new MenuRow("Dal Makhani", "1250", "Mains", null, mains),
            new MenuRow("Sweet Lassi", "90", null, null)));

        assertThat(items).extracting(ParsedItem::name).containsExactly("Dal Makhani", "Sweet Lassi");
        assertThat(items.get(0).price()).isEqualByComparingTo("1250");
        assertThat(items.get(0).categoryDetails()).isEqualTo(mains);
        assertThat(items.get(1).categoryDetails()).isNull();
    }

    private static BufferedImage blankPage() {
        BufferedImage page = new BufferedImage(500, 450, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < page.getHeight(); y++) {
            for (int x = 0; x < page.getWidth(); x++) {
                page.setRGB(x, y, 0xFFFFFF);
            }
        }
        return page;
    }

    private static ExtractionRequest imageRequest(BufferedImage page) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(page, "png", output);
        return new ExtractionRequest(InputKind.IMAGE, output.toByteArray(), "menu.png", null);
    }
}
