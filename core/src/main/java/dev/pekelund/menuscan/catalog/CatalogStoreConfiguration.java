package dev.pekelund.menuscan.catalog;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@EnableConfigurationProperties(CatalogFirestoreProperties.class)
public class CatalogStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CatalogStoreConfiguration.class);

    @Bean
    @ConditionalOnProperty(value = "catalog.firestore.enabled", havingValue = "true")
    @ConditionalOnMissingBean
    public Firestore catalogFirestore(CatalogFirestoreProperties properties) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(properties.getProjectId())) {
            optionsBuilder.setProjectId(properties.getProjectId());
        }
        if (StringUtils.hasText(properties.getDatabaseId())) {
            optionsBuilder.setDatabaseId(properties.getDatabaseId());
        }
        Firestore firestore = optionsBuilder.build().getService();
        log.info("Initialized Firestore client for project '{}' (catalog collection '{}')",
            firestore.getOptions().getProjectId(), properties.getItemsCollection());
        return firestore;
    }

    @Bean
    @ConditionalOnProperty(value = "catalog.firestore.enabled", havingValue = "true")
    public CatalogStore firestoreCatalogStore(Firestore catalogFirestore, CatalogFirestoreProperties properties) {
        return new FirestoreCatalogStore(catalogFirestore, properties.getItemsCollection());
    }

    @Bean
    @ConditionalOnProperty(value = "catalog.firestore.enabled", havingValue = "false", matchIfMissing = true)
    public CatalogStore disabledCatalogStore() {
        log.info("Firestore catalog integration disabled; reviewed items cannot be persisted");
        return new DisabledCatalogStore();
    }
}
