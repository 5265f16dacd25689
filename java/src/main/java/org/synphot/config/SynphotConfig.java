package org.synphot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.synphot.core.Extrapolation;
import org.synphot.core.SynphotException;
import org.yaml.snakeyaml.Yaml;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Numeric defaults for spectrum operations, loaded from synphot.yml.
 *
 * The classpath copy is read once on first use. Fields not present in the
 * file keep the built-in values below.
 */
public class SynphotConfig {
    private static final Logger log = LoggerFactory.getLogger(SynphotConfig.class);
    private static final String defaultResource = "synphot.yml";

    private static volatile SynphotConfig current;

    /** Fraction of flux outside the overlap still counted as insignificant. */
    public double overlapThreshold = 0.01;

    /** Same fraction, used when renormalizing through a passband. */
    public double renormOverlapThreshold = 0.01;

    /** Merged wavelengths closer than this are collapsed. */
    public double mergeThreshold = 1e-12;

    /** Fill policy outside the sampled range when resampling. */
    public Extrapolation extrapolation = Extrapolation.CONSTANT;

    public static SynphotConfig getDefault() {
        SynphotConfig config = current;
        if (config == null) {
            synchronized (SynphotConfig.class) {
                if (current == null) {
                    current = loadResource(defaultResource);
                }
                config = current;
            }
        }
        return config;
    }

    public static void setDefault(SynphotConfig config) {
        current = config;
    }

    public static SynphotConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException(path.toAbsolutePath().toString());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        }
    }

    static SynphotConfig loadResource(String name) {
        InputStream in = SynphotConfig.class.getClassLoader().getResourceAsStream(name);
        if (in == null) {
            log.debug("No {} on classpath, using built-in defaults", name);
            return new SynphotConfig();
        }
        try (InputStream stream = in) {
            return parse(stream, name);
        } catch (IOException e) {
            throw new SynphotException("Failed to read " + name, e);
        }
    }

    private static SynphotConfig parse(InputStream in, String source) {
        Yaml yaml = new Yaml();
        SynphotConfig config = yaml.loadAs(in, SynphotConfig.class);
        if (config == null) {
            config = new SynphotConfig();
        }
        config.validate(source);
        log.debug("Loaded configuration from {}", source);
        return config;
    }

    void validate(String source) {
        checkFraction("overlapThreshold", overlapThreshold, source);
        checkFraction("renormOverlapThreshold", renormOverlapThreshold, source);
        if (!(mergeThreshold >= 0) || Double.isInfinite(mergeThreshold)) {
            throw new SynphotException(source + ": mergeThreshold must be a finite non-negative number");
        }
        if (extrapolation == null) {
            throw new SynphotException(source + ": extrapolation is missing");
        }
    }

    private static void checkFraction(String name, double value, String source) {
        if (!(value >= 0 && value <= 1)) {
            throw new SynphotException(source + ": " + name + " must be between 0 and 1");
        }
    }
}
