package org.synphot.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.synphot.core.Extrapolation;
import org.synphot.core.SynphotException;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class SynphotConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void resetDefault() {
        SynphotConfig.setDefault(null);
    }

    @Test
    void classpathDefaults() {
        SynphotConfig config = SynphotConfig.getDefault();

        assertThat(config.overlapThreshold).isEqualTo(0.01);
        assertThat(config.renormOverlapThreshold).isEqualTo(0.01);
        assertThat(config.mergeThreshold).isEqualTo(1e-12);
        assertThat(config.extrapolation).isEqualTo(Extrapolation.CONSTANT);
        assertThat(SynphotConfig.getDefault()).isSameAs(config);
    }

    @Test
    void fileOverridesSomeFields() throws Exception {
        Path file = Path.of(getClass().getResource("/config-strict.yml").toURI());

        SynphotConfig config = SynphotConfig.load(file);

        assertThat(config.overlapThreshold).isEqualTo(0.05);
        assertThat(config.extrapolation).isEqualTo(Extrapolation.ZERO);
        assertThat(config.renormOverlapThreshold).isEqualTo(0.01);
    }

    @Test
    void missingResourceGivesBuiltInValues() {
        SynphotConfig config = SynphotConfig.loadResource("no-such-config.yml");

        assertThat(config.overlapThreshold).isEqualTo(0.01);
    }

    @Test
    void emptyFileGivesBuiltInValues() throws Exception {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThat(SynphotConfig.load(file).mergeThreshold).isEqualTo(1e-12);
    }

    @Test
    void missingFile() {
        assertThatThrownBy(() -> SynphotConfig.load(tempDir.resolve("absent.yml")))
            .isInstanceOf(FileNotFoundException.class);
    }

    @Test
    void thresholdsAreValidated() throws Exception {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, "overlapThreshold: 2.0\n");

        assertThatThrownBy(() -> SynphotConfig.load(file))
            .isInstanceOf(SynphotException.class)
            .hasMessageContaining("overlapThreshold");
    }
}
