package dev.pekelund.menuscan.menuparser;

import dev.pekelund.menuscan.CoreModulithConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Spring Boot application entry point for the menu extraction service.
 */
@SpringBootApplication
@Import(CoreModulithConfiguration.class)
public class MenuParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(MenuParserApplication.class, args);
    }
}
