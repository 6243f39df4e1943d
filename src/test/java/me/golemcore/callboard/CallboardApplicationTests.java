package me.golemcore.callboard;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class CallboardApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(CallboardApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(CallboardApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(CallboardApplication.class.getMethod("main", String[].class));
    }
}
