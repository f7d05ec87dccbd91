package dev.pekelund.menuscan.items;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Item recovered from an uploaded menu. Identifiers are only unique within a single extraction run.
 */
public record ParsedItem(
    String id,
    String name,
    BigDecimal price,
    String currency,
    String category,
    int confidence,
    String description,
    ImageRegion image,
    boolean lowConfidence,
    CategoryDetails categoryDetails
) {

    public ParsedItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(price, "price");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Confidence must be within 0..100 but was " + confidence);
        }
        currency = currency == null ? MenuItemConstants.DEFAULT_CURRENCY : currency;
        category = category == null ? MenuItemConstants.DEFAULT_CATEGORY : category;
    }

    public static ParsedItem of(String name, BigDecimal price, String currency, String category, int confidence) {
        return new ParsedItem(null, name, price, currency, category, confidence, null, null, false, null);
    }

    public ParsedItem withId(String newId) {
        return new ParsedItem(newId, name, price, currency, category, confidence, description, image, lowConfidence,
            categoryDetails);
    }

    public ParsedItem withDescription(String newDescription) {
        return new ParsedItem(id, name, price, currency, category, confidence, newDescription, image, lowConfidence,
            categoryDetails);
    }

    public ParsedItem withImage(ImageRegion region) {
        return new ParsedItem(id, name, price, currency, category, confidence, description, region, lowConfidence,
            categoryDetails);
    }

    public ParsedItem flagLowConfidence(int confidenceFloor) {
        return new ParsedItem(id, name, price, currency, category, confidence, description, image,
            confidence < confidenceFloor, categoryDetails);
    }

    public ParsedItem withCategoryDetails(CategoryDetails details) {
        return new ParsedItem(id, name, price, currency, category, confidence, description, image, lowConfidence,
            details);
    }

    public boolean hasImage() {
        return image != null;
    }
}
