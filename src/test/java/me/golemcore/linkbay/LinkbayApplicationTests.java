package me.golemcore.linkbay;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class LinkbayApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(LinkbayApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(LinkbayApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(LinkbayApplication.class.getMethod("main", String[].class));
    }
}
