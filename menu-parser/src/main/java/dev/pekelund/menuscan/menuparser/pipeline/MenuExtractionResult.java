package dev.pekelund.menuscan.menuparser.pipeline;

import dev.pekelund.menuscan.items.ImageRegion;
import dev.pekelund.menuscan.items.ParsedItem;
import java.util.List;

/**
 * Terminal outcome of an extraction run. {@code failure} is only set when {@code state} is
 * {@link ExtractionState#FAILED}; a run without items still exposes its raw text for manual review.
 */
public record MenuExtractionResult(
    ExtractionState state,
    ExtractionFailure failure,
    String message,
    List<ParsedItem> items,
    String rawText,
    List<ImageRegion> regions,
    int overallConfidence
) {

    public MenuExtractionResult {
        items = items == null ? List.of() : List.copyOf(items);
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    static MenuExtractionResult done(List<ParsedItem> items, String rawText, List<ImageRegion> regions) {
        int overall = (int) Math.round(items.stream().mapToInt(ParsedItem::confidence).average().orElse(0));
        return new MenuExtractionResult(ExtractionState.DONE, null, null, items, rawText, regions, overall);
    }

    static MenuExtractionResult failed(ExtractionFailure failure, String message, String rawText) {
        return new MenuExtractionResult(ExtractionState.FAILED, failure, message, List.of(), rawText, List.of(), 0);
    }

    public static MenuExtractionResult superseded() {
        return failed(ExtractionFailure.SUPERSEDED, "Extraction was superseded by a newer upload", null);
    }

    public boolean isDone() {
        return state == ExtractionState.DONE;
    }
}
