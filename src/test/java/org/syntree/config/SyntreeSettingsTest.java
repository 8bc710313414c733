package org.syntree.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests reading settings from configuration layers and their validation.
 */
@Tag("unit")
class SyntreeSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsComeFromReferenceConf() {
        SyntreeSettings settings = SyntreeSettings.defaults();

        assertThat(settings.maxDepth()).isEqualTo(2000);
        assertThat(settings.builtins()).contains("print", "len", "range");
        assertThat(settings.validateBetweenPasses()).isTrue();
        assertThat(settings.passes()).containsExactly(
                "constant_folding", "expression_simplification", "dead_code_elimination", "unused_variable_removal");
    }

    @Test
    void missingFileFallsBackToDefaults() {
        SyntreeSettings settings = SyntreeSettings.from(SyntreeConfig.load(tempDir.resolve("absent.conf").toFile()));

        assertThat(settings).isEqualTo(SyntreeSettings.defaults());
    }

    @Test
    void fileOverridesDefaults() throws IOException {
        File file = write("syntree.traversal.max-depth = 50\n"
                + "syntree.pipeline.passes = [\"function_inlining\"]\n");

        SyntreeSettings settings = SyntreeSettings.from(SyntreeConfig.load(file));

        assertThat(settings.maxDepth()).isEqualTo(50);
        assertThat(settings.passes()).containsExactly("function_inlining");
        assertThat(settings.validateBetweenPasses()).isTrue();
    }

    @Test
    void systemPropertyOverridesFile() throws IOException {
        File file = write("syntree.traversal.max-depth = 50\n");
        System.setProperty("syntree.traversal.max-depth", "77");
        ConfigFactory.invalidateCaches();
        try {
            SyntreeSettings settings = SyntreeSettings.from(SyntreeConfig.load(file));

            assertThat(settings.maxDepth()).isEqualTo(77);
        } finally {
            System.clearProperty("syntree.traversal.max-depth");
            ConfigFactory.invalidateCaches();
        }
    }

    @Test
    void wrongTypeIsReported() throws IOException {
        File file = write("syntree.pipeline.validate-between-passes = sometimes\n");

        assertThatThrownBy(() -> SyntreeSettings.from(SyntreeConfig.load(file)))
                .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    void nonPositiveDepthIsRejected() {
        assertThatThrownBy(() -> new SyntreeSettings(0, Set.of(), true, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-depth");
    }

    private File write(String content) throws IOException {
        Path file = tempDir.resolve("syntree.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }
}
