package dev.pekelund.menuscan.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.api.core.ApiFutures;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.WriteBatch;
import com.google.cloud.firestore.WriteResult;
import dev.pekelund.menuscan.items.CategoryDetails;
import dev.pekelund.menuscan.items.ParsedItem;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class FirestoreCatalogStoreTest {

    private Firestore firestore;
    private CollectionReference collection;
    private DocumentReference document;
    private WriteBatch batch;
    private FirestoreCatalogStore store;

    @BeforeEach
    void setUp() {
        firestore = mock(Firestore.class);
        collection = mock(CollectionReference.class);
        document = mock(DocumentReference.class);
        batch = mock(WriteBatch.class);
        when(firestore.collection("catalogItems")).thenReturn(collection);
        when(collection.document()).thenReturn(document);
        when(firestore.batch()).thenReturn(batch);
        List<WriteResult> noResults = List.of();
        when(batch.commit()).thenReturn(ApiFutures.immediateFuture(noResults));
        store = new FirestoreCatalogStore(firestore, "catalogItems");
    }

    @Test
    void writesOneDocumentPerItem() {
        ParsedItem biryani = ParsedItem.of("Chicken Biryani", new BigDecimal("250"), "₹", "Main Course", 85);
        ParsedItem naan = ParsedItem.of("Butter Naan", new BigDecimal("45"), "₹", "Bread", 70)
            .withDescription("Tandoor baked")
            .withCategoryDetails(CategoryDetails.of("Fresh from the tandoor", "#AA3300"));

        int written = store.saveItems("store-1", List.of(biryani, naan));

        assertThat(written).isEqualTo(2);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payloads = ArgumentCaptor.forClass(Map.class);
        verify(batch, times(2)).set(eq(document), payloads.capture());
        assertThat(payloads.getAllValues().get(0))
            .containsEntry("storeId", "store-1")
            .containsEntry("name", "Chicken Biryani")
            .containsEntry("price", 250.0)
            .containsEntry("category", "Main Course")
            .doesNotContainKey("description")
            .doesNotContainKey("categoryDescription");
        assertThat(payloads.getAllValues().get(1))
            .containsEntry("description", "Tandoor baked")
            .containsEntry("categoryDescription", "Fresh from the tandoor")
            .containsEntry("categoryColor", "#AA3300");
        verify(batch).commit();
    }

    @Test
    void splitsLargeImportsIntoSeveralBatches() {
        List<ParsedItem> items = new ArrayList<>();
        for (int i = 0; i < FirestoreCatalogStore.MAX_BATCH_SIZE + 1; i++) {
            items.add(ParsedItem.of("Item number " + i, BigDecimal.ONE, "$", "General", 100));
        }

        int written = store.saveItems("store-1", items);

        assertThat(written).isEqualTo(501);
        verify(firestore, times(2)).batch();
        verify(batch, times(2)).commit();
    }

    @Test
    void skipsEmptyImports() {
        assertThat(store.saveItems("store-1", List.of())).isZero();
        verify(firestore, never()).batch();
    }

    @Test
    void requiresStoreId() {
        ParsedItem item = ParsedItem.of("Chicken Biryani", new BigDecimal("250"), "₹", "Main Course", 85);

        assertThatThrownBy(() -> store.saveItems(" ", List.of(item)))
            .isInstanceOf(CatalogStoreException.class)
            .hasMessageContaining("store id");
    }

    @Test
    void wrapsCommitFailures() {
        when(batch.commit()).thenReturn(ApiFutures.immediateFailedFuture(new IllegalStateException("quota")));
        ParsedItem item = ParsedItem.of("Chicken Biryani", new BigDecimal("250"), "₹", "Main Course", 85);

        assertThatThrownBy(() -> store.saveItems("store-1", List.of(item)))
            .isInstanceOf(CatalogStoreException.class)
            .hasRootCauseMessage("quota");
    }
}
