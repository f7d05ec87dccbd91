package dev.pekelund.menuscan.catalog;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.WriteBatch;
import dev.pekelund.menuscan.items.CategoryDetails;
import dev.pekelund.menuscan.items.ParsedItem;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Writes reviewed menu items into a Firestore collection, one document per item.
 */
public class FirestoreCatalogStore implements CatalogStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreCatalogStore.class);

    // Firestore rejects batches with more than 500 writes.
    static final int MAX_BATCH_SIZE = 500;

    private static final String SOURCE = "menu-import";

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreCatalogStore(Firestore firestore, String collectionName) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        LOGGER.info("FirestoreCatalogStore initialized with collection '{}'", collectionName);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public int saveItems(String storeId, List<ParsedItem> items) {
        if (!StringUtils.hasText(storeId)) {
            throw new CatalogStoreException("A store id is required to persist catalog items");
        }
        if (items == null || items.isEmpty()) {
            return 0;
        }

        CollectionReference collection = firestore.collection(collectionName);
        Timestamp createdAt = Timestamp.now();
        int written = 0;
        try {
            for (int start = 0; start < items.size(); start += MAX_BATCH_SIZE) {
                List<ParsedItem> chunk = items.subList(start, Math.min(items.size(), start + MAX_BATCH_SIZE));
                WriteBatch batch = firestore.batch();
                for (ParsedItem item : chunk) {
                    DocumentReference reference = collection.document();
                    batch.set(reference, toPayload(storeId, item, createdAt));
                }
                batch.commit().get();
                written += chunk.size();
                LOGGER.info("Committed {} catalog items for store {} to {}", chunk.size(), storeId, collectionName);
            }
        } catch (InterruptedException ex) {
            LOGGER.error("Interrupted while writing catalog items for store {}", storeId, ex);
            Thread.currentThread().interrupt();
            throw new CatalogStoreException("Interrupted while writing catalog items to Firestore", ex);
        } catch (ExecutionException ex) {
            LOGGER.error("Failed to write catalog items for store {} after {} successful writes", storeId, written, ex);
            throw new CatalogStoreException("Failed to write catalog items to Firestore", ex.getCause());
        }
        return written;
    }

    static Map<String, Object> toPayload(String storeId, ParsedItem item, Timestamp createdAt) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("storeId", storeId);
        payload.put("name", item.name());
        payload.put("price", item.price().doubleValue());
        payload.put("currency", item.currency());
        payload.put("category", item.category());
        payload.put("confidence", item.confidence());
        if (StringUtils.hasText(item.description())) {
            payload.put("description", item.description());
        }
        CategoryDetails details = item.categoryDetails();
        if (details != null) {
            if (details.description() != null) {
                payload.put("categoryDescription", details.description());
            }
            if (details.color() != null) {
                payload.put("categoryColor", details.color());
            }
        }
        payload.put("source", SOURCE);
        payload.put("isActive", true);
        payload.put("createdAt", createdAt);
        return payload;
    }
}
