package work.lcod.assertkit.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.assertkit.shared.ToleranceParser;

/**
 * Reads {@link AssertSettings} from {@code lcod-assert.toml}.
 * <p>
 * The file named by the {@value #CONFIG_PROPERTY} system property wins over the classpath resource.
 * Unreadable or invalid files are logged and replaced by the defaults.
 */
public final class SettingsLoader {
    public static final String CONFIG_PROPERTY = "lcod.assert.config";
    public static final String RESOURCE_NAME = "lcod-assert.toml";

    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    private SettingsLoader() {}

    public static AssertSettings load() {
        var configured = System.getProperty(CONFIG_PROPERTY);
        if (configured != null && !configured.isBlank()) {
            return load(Path.of(configured)).orElseGet(AssertSettings::defaults);
        }
        return loadResource(RESOURCE_NAME).orElseGet(AssertSettings::defaults);
    }

    public static Optional<AssertSettings> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("Assertion settings file {} not found, using defaults", path);
            return Optional.empty();
        }
        try {
            return fromToml(Toml.parse(Files.readString(path)), path.toString());
        } catch (IOException ex) {
            log.warn("Unable to read assertion settings {}: {}", path, ex.getMessage());
            return Optional.empty();
        }
    }

    static Optional<AssertSettings> loadResource(String name) {
        var loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SettingsLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in == null) {
                return Optional.empty();
            }
            return fromToml(Toml.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8)), name);
        } catch (IOException ex) {
            log.warn("Unable to read assertion settings resource {}: {}", name, ex.getMessage());
            return Optional.empty();
        }
    }

    public static Optional<AssertSettings> fromToml(TomlParseResult result, String source) {
        if (result == null) {
            return Optional.empty();
        }
        if (result.hasErrors()) {
            log.warn("Ignoring invalid assertion settings {}: {}", source, result.errors().get(0).toString());
            return Optional.empty();
        }
        var defaults = AssertSettings.defaults();
        try {
            var tolerance = ToleranceParser.parse(result.getString("tolerance.floating-point"))
                .orElse(defaults.floatingPointTolerance());
            Long maxLength = result.getLong("format.max-string-length");
            Boolean reflection = result.getBoolean("comparison.reflection-fallback");
            var settings = new AssertSettings(
                tolerance,
                maxLength == null ? defaults.maxStringLength() : Math.toIntExact(maxLength),
                reflection == null ? defaults.reflectionFallback() : reflection
            );
            log.debug("Loaded assertion settings from {}: {}", source, settings);
            return Optional.of(settings);
        } catch (RuntimeException ex) {
            log.warn("Ignoring invalid assertion settings {}: {}", source, ex.getMessage());
            return Optional.empty();
        }
    }
}
