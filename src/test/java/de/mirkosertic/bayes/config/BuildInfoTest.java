package de.mirkosertic.bayes.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BuildInfo Tests")
class BuildInfoTest {

    @Test
    @DisplayName("Should load version and timestamp or fall back to defaults")
    void shouldLoadVersionAndTimestamp() {
        final String version = BuildInfo.getVersion();
        final String timestamp = BuildInfo.getBuildTimestamp();

        // Filtered by Maven, or the fallbacks when run from an IDE
        assertThat(version)
                .isNotEmpty()
                .matches("^(\\d+\\.\\d+\\.\\d+.*|dev)$");
        assertThat(timestamp)
                .isNotEmpty()
                .matches("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z|unknown)$");
    }
}
