package com.layoutformatter.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("bundled defaults")
    void defaults() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getPrintWidth()).isEqualTo(80);
        assertThat(config.getIndentSize()).isEqualTo(2);
        assertThat(config.isPassEnabled(FormatterConfig.CALL_SHAPE)).isTrue();
        assertThat(config.isPassEnabled(FormatterConfig.COMPACTION)).isTrue();
        assertThat(config.getPassConfig(FormatterConfig.ALIGNMENT, "comments", false)).isTrue();
        assertThat(config.getPassConfig(FormatterConfig.ALIGNMENT, "caseWhen", true)).isFalse();
    }

    @Test
    @DisplayName("values from a file override the defaults they name")
    void overrides() throws IOException {
        Path file = tempDir.resolve("formatter.yml");
        Files.writeString(file, String.join("\n",
                "general:",
                "  printWidth: 100",
                "passes:",
                "  alignment:",
                "    caseWhen: true",
                "  compaction:",
                "    enabled: false",
                ""));

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getPrintWidth()).isEqualTo(100);
        assertThat(config.getIndentSize()).isEqualTo(2);
        assertThat(config.getPassConfig(FormatterConfig.ALIGNMENT, "caseWhen", false)).isTrue();
        assertThat(config.getPassConfig(FormatterConfig.ALIGNMENT, "comments", false)).isTrue();
        assertThat(config.isPassEnabled(FormatterConfig.COMPACTION)).isFalse();
        assertThat(config.isPassEnabled(FormatterConfig.CALL_SHAPE)).isTrue();
    }

    @Test
    @DisplayName("out-of-range and mistyped values fall back to defaults")
    void invalidValues() throws IOException {
        Path file = tempDir.resolve("formatter.yml");
        Files.writeString(file, String.join("\n",
                "general:",
                "  printWidth: 5",
                "  indentSize: wide",
                "passes:",
                "  callShape: yes please",
                "  unknownPass:",
                "    enabled: true",
                ""));

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getPrintWidth()).isEqualTo(80);
        assertThat(config.getIndentSize()).isEqualTo(2);
        assertThat(config.isPassEnabled(FormatterConfig.CALL_SHAPE)).isTrue();
        assertThat(config.getPassConfigsMap()).doesNotContainKey("unknownPass");
    }

    @Test
    @DisplayName("a missing or unreadable file yields the defaults")
    void missingOrBrokenFile() throws IOException {
        assertThat(ConfigurationLoader.loadConfig(null).getPrintWidth()).isEqualTo(80);
        assertThat(ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml")).getPrintWidth()).isEqualTo(80);

        Path broken = tempDir.resolve("broken.yml");
        Files.writeString(broken, "general: [unclosed\n");
        assertThat(ConfigurationLoader.loadConfig(broken).getIndentSize()).isEqualTo(2);
    }
}
