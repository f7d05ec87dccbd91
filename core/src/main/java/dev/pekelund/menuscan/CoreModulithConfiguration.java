package dev.pekelund.menuscan;

import dev.pekelund.menuscan.catalog.CatalogStoreConfiguration;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Entry point for the shared core modules. Services import this configuration to obtain the
 * catalog store beans.
 */
@Configuration
@Import(CatalogStoreConfiguration.class)
public class CoreModulithConfiguration {
}
