package me.golemcore.coder;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class CoderApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(CoderApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(CoderApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(CoderApplication.class.getMethod("main", String[].class));
    }
}
