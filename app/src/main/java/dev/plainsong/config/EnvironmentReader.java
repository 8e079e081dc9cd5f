package dev.plainsong.config;

import java.util.Optional;

/**
 * Source of environment settings, injectable so tests can supply fixed values.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    default Optional<String> getNonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
