package com.quorum.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link EngineSettings} from YAML.
 *
 * <p>
 * {@link #load()} honours {@value #ENV_CONFIG_PATH} and otherwise reads
 * {@value #DEFAULT_RESOURCE} from the classpath. Every key is optional; an
 * empty document yields the defaults. The result is always validated, and
 * duplicate keys are rejected by the parser.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String ENV_CONFIG_PATH = "QUORUM_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "quorum.yml";

    private SettingsLoader() {
        // utility class, not instantiable
    }

    /**
     * @return validated settings from {@value #ENV_CONFIG_PATH} when set, else
     *         from the bundled {@value #DEFAULT_RESOURCE}
     */
    public static EngineSettings load() {
        String configured = System.getenv(ENV_CONFIG_PATH);
        if (configured == null || configured.isBlank()) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        // a configured path must exist
        return fromFile(Path.of(configured));
    }

    public static EngineSettings fromFile(String path) {
        return fromFile(Path.of(Objects.requireNonNull(path, "Settings file path must not be null")));
    }

    /**
     * @param path YAML file
     * @return validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if a setting is out of range
     * @throws UncheckedIOException     if the file cannot be read
     */
    public static EngineSettings fromFile(Path path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read settings file " + path, e);
        }
    }

    public static EngineSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Settings resource not found on classpath: " + resource);
        }
        try (in) {
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read settings resource " + resource, e);
        }
    }

    private static EngineSettings parse(InputStream in, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        EngineSettings settings = new Yaml(new Constructor(EngineSettings.class, options)).load(in);
        if (settings == null) {
            LOG.warn("{} is empty, using default engine settings", source);
            settings = new EngineSettings();
        }
        settings.validate();
        LOG.info("Engine settings from {}: {}", source, settings);
        return settings;
    }
}
