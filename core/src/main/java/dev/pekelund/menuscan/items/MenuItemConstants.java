package dev.pekelund.menuscan.items;

import java.math.BigDecimal;

/**
 * Shared constants describing the bounds of an extracted menu item and the
 * Firestore layout used once items are accepted into the catalog.
 */
public final class MenuItemConstants {

    /**
     * Category assigned when no keyword or import column supplies one.
     */
    public static final String DEFAULT_CATEGORY = "General";

    /**
     * Currency used when a document carries no recognisable currency marker.
     */
    public static final String DEFAULT_CURRENCY = "$";

    public static final int MIN_NAME_LENGTH = 3;

    public static final int MAX_NAME_LENGTH = 100;

    /**
     * Upper bound for a plausible price; anything above is treated as a misread.
     */
    public static final BigDecimal MAX_PRICE = new BigDecimal("100000");

    /**
     * Default Firestore collection receiving reviewed catalog items.
     */
    public static final String DEFAULT_CATALOG_ITEMS_COLLECTION = "catalogItems";

    private MenuItemConstants() {
    }
}
