package dev.pekelund.menuscan.catalog;

import dev.pekelund.menuscan.items.MenuItemConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalog.firestore")
public class CatalogFirestoreProperties {

    /**
     * Flag indicating whether reviewed items are written to Firestore.
     */
    private boolean enabled;

    /**
     * Optional Google Cloud project identifier. Application default project is used when omitted.
     */
    private String projectId;

    /**
     * Optional Firestore database id; the default database is used when omitted.
     */
    private String databaseId;

    /**
     * Collection that receives one document per catalog item.
     */
    private String itemsCollection = MenuItemConstants.DEFAULT_CATALOG_ITEMS_COLLECTION;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getDatabaseId() {
        return databaseId;
    }

    public void setDatabaseId(String databaseId) {
        this.databaseId = databaseId;
    }

    public String getItemsCollection() {
        return itemsCollection;
    }

    public void setItemsCollection(String itemsCollection) {
        this.itemsCollection = itemsCollection;
    }
}
