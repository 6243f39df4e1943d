package me.golemcore.callboard.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CallboardPropertiesTest {

    @Test
    void shouldProvideDefaults() {
        CallboardProperties properties = new CallboardProperties();

        assertEquals("auto", properties.getLogs().getListingStrategy());
        assertEquals(20, properties.getLogs().getDefaultPageSize());
        assertEquals(200, properties.getLogs().getMaxPageSize());
        assertEquals(Duration.ofMinutes(5), properties.getGit().getStatusTtl());
        assertEquals(Duration.ofSeconds(5), properties.getGit().getCommandTimeout());
    }

    @Test
    void shouldExpandUserHomePlaceholder() {
        Path expected = Path.of(System.getProperty("user.home"), ".claude", "projects").toAbsolutePath().normalize();
        assertEquals(expected, CallboardProperties.expandPath("${user.home}/.claude/projects"));
    }
}
