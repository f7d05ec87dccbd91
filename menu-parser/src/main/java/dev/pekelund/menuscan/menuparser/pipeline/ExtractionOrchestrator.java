package dev.pekelund.menuscan.menuparser.pipeline;

import dev.pekelund.menuscan.items.ImageRegion;
import dev.pekelund.menuscan.items.InputKind;
import dev.pekelund.menuscan.items.OcrWord;
import dev.pekelund.menuscan.items.ParsedItem;
import dev.pekelund.menuscan.menuparser.decoding.DelimitedRowDecoder;
import dev.pekelund.menuscan.menuparser.decoding.ExcelRowDecoder;
import dev.pekelund.menuscan.menuparser.decoding.ImageDecoder;
import dev.pekelund.menuscan.menuparser.decoding.MenuDecodingException;
import dev.pekelund.menuscan.menuparser.decoding.MenuRow;
import dev.pekelund.menuscan.menuparser.decoding.OcrEngine;
import dev.pekelund.menuscan.menuparser.decoding.OcrResult;
import dev.pekelund.menuscan.menuparser.decoding.PdfTextExtractor;
import dev.pekelund.menuscan.menuparser.extraction.CategoryInferrer;
import dev.pekelund.menuscan.menuparser.extraction.CurrencyDetector;
import dev.pekelund.menuscan.menuparser.extraction.ItemValidator;
import dev.pekelund.menuscan.menuparser.extraction.MenuTextExtractor;
import dev.pekelund.menuscan.menuparser.extraction.NameCleaner;
import dev.pekelund.menuscan.menuparser.extraction.PriceParser;
import dev.pekelund.menuscan.menuparser.imaging.ImageRegionDetector;
import dev.pekelund.menuscan.menuparser.imaging.SpatialMatcher;
import java.awt.image.BufferedImage;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Drives one upload through decoding, text extraction and, for photographs, image region matching.
 *
 * <p>Every run ends in a {@link MenuExtractionResult}; decoder errors, empty results, timeouts and
 * supersession are reported as {@link ExtractionState#FAILED} results rather than exceptions.</p>
 */
@Service
public class ExtractionOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    static final int SPREADSHEET_CONFIDENCE = 100;
    private static final long CANCELLATION_POLL_MILLIS = 100;

    private final ImageDecoder imageDecoder;
    private final OcrEngine ocrEngine;
    private final PdfTextExtractor pdfTextExtractor;
    private final ExcelRowDecoder excelRowDecoder;
    private final DelimitedRowDecoder delimitedRowDecoder;
    private final MenuTextExtractor menuTextExtractor;
    private final CurrencyDetector currencyDetector;
    private final CategoryInferrer categoryInferrer;
    private final ItemValidator itemValidator;
    private final ImageRegionDetector imageRegionDetector;
    private final SpatialMatcher spatialMatcher;
    private final ExecutorService decodeExecutor;
    private final MenuExtractionProperties properties;

    public ExtractionOrchestrator(ImageDecoder imageDecoder, OcrEngine ocrEngine, PdfTextExtractor pdfTextExtractor,
        ExcelRowDecoder excelRowDecoder, DelimitedRowDecoder delimitedRowDecoder, MenuTextExtractor menuTextExtractor,
        CurrencyDetector currencyDetector, CategoryInferrer categoryInferrer, ItemValidator itemValidator,
        ImageRegionDetector imageRegionDetector, SpatialMatcher spatialMatcher,
        @Qualifier("menuDecodeExecutor") ExecutorService decodeExecutor, MenuExtractionProperties properties) {

        this.imageDecoder = imageDecoder;
        this.ocrEngine = ocrEngine;
        this.pdfTextExtractor = pdfTextExtractor;
        this.excelRowDecoder = excelRowDecoder;
        this.delimitedRowDecoder = delimitedRowDecoder;
        this.menuTextExtractor = menuTextExtractor;
        this.currencyDetector = currencyDetector;
        this.categoryInferrer = categoryInferrer;
        this.itemValidator = itemValidator;
        this.imageRegionDetector = imageRegionDetector;
        this.spatialMatcher = spatialMatcher;
        this.decodeExecutor = decodeExecutor;
        this.properties = properties;
    }

    public MenuExtractionResult extract(ExtractionRequest request) {
        return extract(request, () -> false);
    }

    /**
     * Runs the pipeline, checking {@code superseded} between stages and while waiting on the decoder.
     */
    public MenuExtractionResult extract(ExtractionRequest request, BooleanSupplier superseded) {
        try (MenuProcessingMdc.Context ignored = MenuProcessingMdc.openRequest(request)) {
            MenuProcessingMdc.setStage(ExtractionState.IDLE);
            LOGGER.info("Starting extraction of '{}' ({} bytes)", request.fileName(), request.content().length);
            MenuExtractionResult result = run(request, superseded);
            MenuProcessingMdc.setStage(result.state());
            if (result.isDone()) {
                LOGGER.info("Extraction finished with {} items (overall confidence {})", result.items().size(),
                    result.overallConfidence());
            } else {
                LOGGER.warn("Extraction failed with {}: {}", result.failure(), result.message());
            }
            return result;
        }
    }

    private MenuExtractionResult run(ExtractionRequest request, BooleanSupplier superseded) {
        MenuProcessingMdc.setStage(ExtractionState.DECODING);
        DecodedMenu decoded;
        try {
            decoded = decodeWithinBudget(request, superseded);
        } catch (MenuDecodingException ex) {
            return MenuExtractionResult.failed(ExtractionFailure.DECODE_FAILURE, ex.getMessage(), null);
        } catch (TimeoutException ex) {
            return MenuExtractionResult.failed(ExtractionFailure.TIMEOUT,
                "Decoding did not finish within " + properties.getDecodeTimeout(), null);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return MenuExtractionResult.superseded();
        }
        if (decoded == null || superseded.getAsBoolean()) {
            return MenuExtractionResult.superseded();
        }

        MenuProcessingMdc.setStage(ExtractionState.EXTRACTING);
        List<ParsedItem> items = decoded.rows() != null
            ? itemsFromRows(decoded.rows())
            : menuTextExtractor.extract(decoded.rawText()).items();
        if (items.isEmpty()) {
            return MenuExtractionResult.failed(ExtractionFailure.NO_ITEMS_FOUND,
                "No menu items could be recognised", decoded.rawText());
        }
        items = finalise(items, resolveConfidenceFloor(request));

        List<ImageRegion> regions = List.of();
        if (decoded.page() != null) {
            if (superseded.getAsBoolean()) {
                return MenuExtractionResult.superseded();
            }
            MenuProcessingMdc.setStage(ExtractionState.REGION_DETECTING);
            regions = imageRegionDetector.detect(decoded.page());
            MenuProcessingMdc.setStage(ExtractionState.MATCHING);
            items = spatialMatcher.match(items, decoded.words(), regions);
        }
        if (superseded.getAsBoolean()) {
            return MenuExtractionResult.superseded();
        }
        return MenuExtractionResult.done(items, decoded.rawText(), regions);
    }

    private DecodedMenu decodeWithinBudget(ExtractionRequest request, BooleanSupplier superseded)
        throws TimeoutException, InterruptedException {

        Map<String, String> mdcSnapshot = MDC.getCopyOfContextMap();
        Future<DecodedMenu> future = decodeExecutor.submit(() -> {
            try (MenuProcessingMdc.Context ignored = MenuProcessingMdc.inherit(mdcSnapshot)) {
                return decode(request);
            }
        });

        long deadline = System.nanoTime() + properties.getDecodeTimeout().toNanos();
        long pollNanos = TimeUnit.MILLISECONDS.toNanos(CANCELLATION_POLL_MILLIS);
        try {
            while (true) {
                if (superseded.getAsBoolean()) {
                    future.cancel(true);
                    return null;
                }
                long remaining = Math.max(0, deadline - System.nanoTime());
                try {
                    return future.get(Math.min(remaining, pollNanos), TimeUnit.NANOSECONDS);
                } catch (TimeoutException ex) {
                    if (deadline - System.nanoTime() <= 0) {
                        future.cancel(true);
                        throw ex;
                    }
                }
            }
        } catch (InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof MenuDecodingException decodingException) {
                throw decodingException;
            }
            throw new MenuDecodingException("Decoder failed: " + cause.getMessage(), cause);
        }
    }

    private DecodedMenu decode(ExtractionRequest request) {
        InputKind kind = request.kind();
        return switch (kind) {
            case IMAGE -> {
                BufferedImage page = imageDecoder.read(request.content());
                OcrResult ocr = ocrEngine.recognize(page);
                LOGGER.info("OCR returned {} words with mean confidence {}", ocr.words().size(),
                    Math.round(ocr.confidence()));
                yield new DecodedMenu(ocr.text(), page, ocr.words(), null);
            }
            case PDF -> DecodedMenu.text(pdfTextExtractor.extractText(request.content()));
            case SPREADSHEET -> DecodedMenu.rows(excelRowDecoder.parseRows(request.content()));
            case DELIMITED_TEXT -> DecodedMenu.rows(delimitedRowDecoder.parseRows(request.content()));
            case TEXT -> DecodedMenu.text(new String(request.content(), StandardCharsets.UTF_8));
        };
    }

    /**
     * Tabular imports skip the text heuristics; their rows are trusted but still validated and deduplicated.
     */
    List<ParsedItem> itemsFromRows(List<MenuRow> rows) {
        String currency = currencyDetector.detect(rows.stream()
            .map(MenuRow::price)
            .collect(Collectors.joining("\n")));
        List<ParsedItem> candidates = new ArrayList<>();
        for (MenuRow row : rows) {
            String name = NameCleaner.clean(row.name());
            BigDecimal price = PriceParser.parse(row.price());
            if (!StringUtils.hasText(name) || price == null) {
                LOGGER.debug("Skipping row '{}' with unreadable price '{}'", row.name(), row.price());
                continue;
            }
            String category = StringUtils.hasText(row.category())
                ? row.category().trim()
                : categoryInferrer.infer(name);
            candidates.add(ParsedItem.of(name, price, currency, category, SPREADSHEET_CONFIDENCE)
                .withDescription(row.description())
                .withCategoryDetails(row.categoryDetails()));
        }
        return itemValidator.mergeInPriorityOrder(List.of(candidates));
    }

    private List<ParsedItem> finalise(List<ParsedItem> items, int confidenceFloor) {
        List<ParsedItem> finalised = new ArrayList<>(items.size());
        int sequence = 1;
        for (ParsedItem item : items) {
            finalised.add(item.withId(String.valueOf(sequence++)).flagLowConfidence(confidenceFloor));
        }
        return finalised;
    }

    private int resolveConfidenceFloor(ExtractionRequest request) {
        return request.confidenceFloor() != null ? request.confidenceFloor() : properties.getConfidenceFloor();
    }

    private record DecodedMenu(String rawText, BufferedImage page, List<OcrWord> words, List<MenuRow> rows) {

        static DecodedMenu text(String rawText) {
            return new DecodedMenu(rawText, null, List.of(), null);
        }

        static DecodedMenu rows(List<MenuRow> rows) {
            String rawText = rows.stream()
                .map(row -> row.name() + "\t" + row.price())
                .collect(Collectors.joining("\n"));
            return new DecodedMenu(rawText, null, List.of(), rows);
        }
    }
}
