package ink.localiser.config;

import java.util.Optional;

/**
 * Source of {@code LOCALISER_*} settings.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * The trimmed value of {@code key}; unset and blank values are both empty.
     */
    default Optional<String> value(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
