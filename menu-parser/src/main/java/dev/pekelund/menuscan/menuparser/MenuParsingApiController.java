package dev.pekelund.menuscan.menuparser;

import dev.pekelund.menuscan.catalog.CatalogStore;
import dev.pekelund.menuscan.catalog.CatalogStoreException;
import dev.pekelund.menuscan.items.CategoryDetails;
import dev.pekelund.menuscan.items.ImageRegion;
import dev.pekelund.menuscan.items.InputKind;
import dev.pekelund.menuscan.items.MenuItemConstants;
import dev.pekelund.menuscan.items.ParsedItem;
import dev.pekelund.menuscan.menuparser.pipeline.ExtractionCoordinator;
import dev.pekelund.menuscan.menuparser.pipeline.ExtractionFailure;
import dev.pekelund.menuscan.menuparser.pipeline.ExtractionRequest;
import dev.pekelund.menuscan.menuparser.pipeline.ExtractionState;
import dev.pekelund.menuscan.menuparser.pipeline.MenuExtractionResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Base64;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * Public REST API for menu imports. Clients upload a menu, review the extracted items and post the approved
 * items back to be written to the catalog.
 */
@RestController
@RequestMapping(path = "/api/menus")
public class MenuParsingApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(MenuParsingApiController.class);

    private static final String PNG_DATA_URI_PREFIX = "data:image/png;base64,";

    private final ExtractionCoordinator extractionCoordinator;
    private final CatalogStore catalogStore;

    public MenuParsingApiController(ExtractionCoordinator extractionCoordinator, CatalogStore catalogStore) {
        this.extractionCoordinator = extractionCoordinator;
        this.catalogStore = catalogStore;
    }

    @PostMapping(path = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExtractionResponse> extractMenu(@RequestPart("file") MultipartFile file,
        @RequestParam(value = "kind", required = false) String kind,
        @RequestParam(value = "slot", required = false) String slot,
        @RequestParam(value = "confidenceFloor", required = false) Integer confidenceFloor) throws IOException {

        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty menu must be provided as the 'file' part");
        }
        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : "menu";
        InputKind inputKind = InputKind.resolve(kind, file.getContentType(), fileName)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Unsupported menu format: " + (StringUtils.hasText(kind) ? kind : fileName)));

        LOGGER.info("Extracting menu '{}' as {} (slot '{}')", fileName, inputKind, slot);
        ExtractionRequest request = new ExtractionRequest(inputKind, file.getBytes(), fileName, confidenceFloor);
        return toResponse(extractionCoordinator.submit(slot, request));
    }

    @PostMapping(path = "/extract-text", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExtractionResponse> extractText(@RequestBody TextExtractionRequest body) {
        if (body == null || !StringUtils.hasText(body.text())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Menu text must not be empty");
        }
        LOGGER.info("Extracting pasted menu text ({} characters)", body.text().length());
        ExtractionRequest request = ExtractionRequest.ofText(body.text(), body.confidenceFloor());
        return toResponse(extractionCoordinator.submit(body.slot(), request));
    }

    @GetMapping(path = "/slots/{slot}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ExtractionResponse latestResult(@PathVariable("slot") String slot) {
        return extractionCoordinator.latestResult(slot)
            .map(MenuParsingApiController::toBody)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                "No extraction result for slot " + slot));
    }

    @PostMapping(path = "/{storeId}/items", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SaveItemsResponse> saveItems(@PathVariable("storeId") String storeId,
        @RequestBody List<CatalogItemRequest> items) {

        if (!catalogStore.isEnabled()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Catalog storage is disabled");
        }
        if (items == null || items.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "At least one item must be provided");
        }
        List<ParsedItem> approved = new ArrayList<>(items.size());
        for (CatalogItemRequest item : items) {
            approved.add(item.toParsedItem());
        }
        int saved = catalogStore.saveItems(storeId, approved);
        LOGGER.info("Saved {} reviewed items for store '{}'", saved, storeId);
        return ResponseEntity.status(HttpStatus.CREATED).body(new SaveItemsResponse(storeId, saved));
    }

    @ExceptionHandler(CatalogStoreException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleCatalogStoreException(CatalogStoreException exception) {
        LOGGER.warn("Catalog write failed: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidArgument(IllegalArgumentException exception) {
        LOGGER.warn("Rejected menu request: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    private static ResponseEntity<ExtractionResponse> toResponse(MenuExtractionResult result) {
        return ResponseEntity.status(statusFor(result)).body(toBody(result));
    }

    static HttpStatus statusFor(MenuExtractionResult result) {
        if (result.state() != ExtractionState.FAILED) {
            return HttpStatus.OK;
        }
        return switch (result.failure()) {
            case NO_ITEMS_FOUND -> HttpStatus.OK;
            case DECODE_FAILURE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case SUPERSEDED -> HttpStatus.CONFLICT;
        };
    }

    private static ExtractionResponse toBody(MenuExtractionResult result) {
        Map<ImageRegion, RegionView> encoded = new IdentityHashMap<>();
        List<RegionView> regions = result.regions().stream()
            .map(region -> encoded.computeIfAbsent(region, RegionView::from))
            .collect(Collectors.toList());
        List<ItemView> items = result.items().stream()
            .map(item -> ItemView.from(item,
                item.hasImage() ? encoded.computeIfAbsent(item.image(), RegionView::from) : null))
            .collect(Collectors.toList());
        return new ExtractionResponse(result.state(), result.failure(), result.message(), items,
            result.rawText(), regions, result.overallConfidence());
    }

    public record TextExtractionRequest(String text, String slot, Integer confidenceFloor) { }

    public record ExtractionResponse(ExtractionState status, ExtractionFailure failure, String message,
        List<ItemView> items, String rawText, List<RegionView> regions, int overallConfidence) { }

    public record ItemView(String id, String name, BigDecimal price, String currency, String category,
        String categoryDescription, String categoryColor, int confidence, boolean lowConfidence, String description,
        RegionView image) {

        static ItemView from(ParsedItem item, RegionView image) {
            CategoryDetails details = item.categoryDetails();
            return new ItemView(item.id(), item.name(), item.price(), item.currency(), item.category(),
                details != null ? details.description() : null, details != null ? details.color() : null,
                item.confidence(), item.lowConfidence(), item.description(), image);
        }
    }

    public record RegionView(int x, int y, int width, int height, double score, String dataUri) {

        static RegionView from(ImageRegion region) {
            return new RegionView(region.x(), region.y(), region.width(), region.height(), region.score(),
                toDataUri(region));
        }

        private static String toDataUri(ImageRegion region) {
            if (region.pixelData() == null) {
                return null;
            }
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try {
                ImageIO.write(region.pixelData(), "png", buffer);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to encode image region as PNG", ex);
            }
            return PNG_DATA_URI_PREFIX + Base64.getEncoder().encodeToString(buffer.toByteArray());
        }
    }

    /**
     * An item as approved by the reviewer. Confidence defaults to 100 because a person has confirmed it.
     */
    public record CatalogItemRequest(String name, BigDecimal price, String currency, String category,
        Integer confidence, String description, String categoryDescription, String categoryColor) {

        ParsedItem toParsedItem() {
            String trimmedName = name == null ? "" : name.trim();
            if (trimmedName.length() < MenuItemConstants.MIN_NAME_LENGTH
                || trimmedName.length() > MenuItemConstants.MAX_NAME_LENGTH) {
                throw new IllegalArgumentException("Item name must be between " + MenuItemConstants.MIN_NAME_LENGTH
                    + " and " + MenuItemConstants.MAX_NAME_LENGTH + " characters but was '" + trimmedName + "'");
            }
            if (price == null || price.signum() <= 0 || price.compareTo(MenuItemConstants.MAX_PRICE) > 0) {
                throw new IllegalArgumentException("Price of '" + trimmedName + "' must be above 0 and at most "
                    + MenuItemConstants.MAX_PRICE.toPlainString() + " but was " + price);
            }
            return ParsedItem.of(trimmedName, price, currency, category, confidence != null ? confidence : 100)
                .withDescription(description)
                .withCategoryDetails(CategoryDetails.of(categoryDescription, categoryColor));
        }
    }

    public record SaveItemsResponse(String storeId, int saved) { }
}
