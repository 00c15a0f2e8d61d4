package com.retailsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader} and {@link SentinelConfig}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load overrides from classpath and keep defaults for the rest")
    void shouldLoadFromClasspath() {
        SentinelConfig config = ConfigLoader.fromClasspath("test-sentinel.yml");

        assertThat(config.windowDuration()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.allowedLateness()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getQueueLengthThreshold()).isEqualTo(6);
        assertThat(config.getStaffingRatioThreshold()).isEqualTo(0.5);
        assertThat(config.getWeightToleranceGrams()).isEqualTo(50.0);
        assertThat(config.isRuleDisabled("success operation")).isTrue();
    }

    @Test
    @DisplayName("Should load the bundled defaults")
    void shouldLoadBundledDefaults() {
        SentinelConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getWindowSeconds()).isEqualTo(30);
        assertThat(config.getPriceRatioThreshold()).isEqualTo(0.5);
        assertThat(config.getDisabledRules()).isEmpty();
    }

    @Test
    @DisplayName("Should report every invalid value together")
    void shouldReportAllErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("test-sentinel-invalid.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowSeconds")
                .hasMessageContaining("priceRatioThreshold");
    }

    @Test
    @DisplayName("Should refuse duplicate keys")
    void shouldRefuseDuplicateKeys() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("test-sentinel-duplicate.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldDefaultEmptyFile(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("empty.yml"), "");

        SentinelConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.getQueueLengthThreshold()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should throw when the file or resource does not exist")
    void shouldThrowForMissing() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> ConfigLoader.fromFile("/no/such/sentinel.yml"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject an unsupported window policy")
    void shouldRejectUnknownPolicy() {
        SentinelConfig config = new SentinelConfig();
        config.setWindowPolicy("sliding");

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowPolicy");
    }
}
