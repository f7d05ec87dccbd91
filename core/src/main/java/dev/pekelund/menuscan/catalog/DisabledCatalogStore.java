package dev.pekelund.menuscan.catalog;

import dev.pekelund.menuscan.items.ParsedItem;
import java.util.List;

public class DisabledCatalogStore implements CatalogStore {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public int saveItems(String storeId, List<ParsedItem> items) {
        throw new CatalogStoreException("Firestore catalog integration is disabled");
    }
}
