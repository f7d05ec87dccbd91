package dev.pekelund.menuscan.menuparser;

import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModules;

class ModularityVerificationTests {

    @Test
    void modulesShouldRespectDeclaredBoundaries() {
        ApplicationModules.of(MenuParserApplication.class).verify();
    }
}
