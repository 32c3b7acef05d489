package me.golemcore.council;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class CouncilApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(CouncilApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(CouncilApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(CouncilApplication.class.getMethod("main", String[].class));
    }
}
