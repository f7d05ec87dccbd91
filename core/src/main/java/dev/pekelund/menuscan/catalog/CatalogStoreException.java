package dev.pekelund.menuscan.catalog;

public class CatalogStoreException extends RuntimeException {

    public CatalogStoreException(String message) {
        super(message);
    }

    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
