package ai.photodesk.batch.config;

import java.util.Optional;

/**
 * Reads settings from the host process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
