package me.golemcore.membank;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class MemoryBankApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(MemoryBankApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(MemoryBankApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(MemoryBankApplication.class.getMethod("main", String[].class));
    }
}
