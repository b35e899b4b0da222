package ai.casedoc.compare.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Reads settings from the process environment, falling back to a JVM system property whose name is the
 * lower-cased, dot-separated form of the key ({@code STORAGE_ROOT} becomes {@code storage.root}).
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        String value = System.getenv(key);
        if (value != null) {
            return Optional.of(value);
        }
        return Optional.ofNullable(System.getProperty(toPropertyName(key)));
    }

    static String toPropertyName(String key) {
        return key.toLowerCase(Locale.ROOT).replace('_', '.');
    }
}
