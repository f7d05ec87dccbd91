package dev.pekelund.menuscan.catalog;

import dev.pekelund.menuscan.items.ParsedItem;
import java.util.List;

/**
 * Destination for items that a person has reviewed after extraction.
 */
public interface CatalogStore {

    boolean isEnabled();

    /**
     * Persist the approved items for the given store.
     * @return number of items written
     */
    int saveItems(String storeId, List<ParsedItem> items);
}
