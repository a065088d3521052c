package com.docrender.core.config;

import com.docrender.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            formats:
              - markdown
              - json

            output:
              directory: "./build/docs"
              baseName: "summary"
              console: true

            pipeline:
              maxOperations: 10
              maxExecutionTime: PT5S

            render:
              timeout: PT1M
            """);

        RenderConfig config = ConfigLoader.load(configFile);

        assertThat(config.formats()).containsExactly("markdown", "json");
        assertThat(config.output().directory()).isEqualTo("./build/docs");
        assertThat(config.output().baseName()).isEqualTo("summary");
        assertThat(config.output().consoleEnabled()).isTrue();
        assertThat(config.pipeline().toOptions().maxOperations()).isEqualTo(10);
        assertThat(config.pipeline().toOptions().maxExecutionTime()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.render().timeoutDuration()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            output:
              directory: "./out"
            """);

        RenderConfig config = ConfigLoader.load(configFile);

        assertThat(config.formats()).containsExactly("markdown");
        assertThat(config.output().directory()).isEqualTo("./out");
        assertThat(config.output().baseName()).isEqualTo("report");
        assertThat(config.output().consoleEnabled()).isFalse();
        assertThat(config.pipeline().toOptions().maxOperations()).isEqualTo(100);
        assertThat(config.render().timeoutDuration()).isNull();
    }

    @Test
    void load_unknownFields_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            formats: [yaml]
            theme: dark
            output:
              colors: 256
            """);

        RenderConfig config = ConfigLoader.load(configFile);

        assertThat(config.formats()).containsExactly("yaml");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        RenderConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(RenderConfig.defaults());
    }

    @Test
    void load_malformedYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "formats: [markdown\noutput: {");

        RenderConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(RenderConfig.defaults());
    }

    @Test
    void loadStrict_missingFile_throws() {
        assertThatThrownBy(() -> ConfigLoader.loadStrict(tempDir.resolve("missing.yaml")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void loadStrict_malformedYaml_throws() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "formats: [markdown\noutput: {");

        assertThatThrownBy(() -> ConfigLoader.loadStrict(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Failed to parse");
    }

    @Test
    void loadStrict_invalidValues_listsEveryProblem() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            output:
              baseName: ""
            pipeline:
              maxOperations: 0
            render:
              timeout: soon
            """);

        assertThatThrownBy(() -> ConfigLoader.loadStrict(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("output.baseName must not be empty")
            .hasMessageContaining("pipeline.maxOperations must be positive")
            .hasMessageContaining("render.timeout is not an ISO-8601 duration: soon");
    }
}
