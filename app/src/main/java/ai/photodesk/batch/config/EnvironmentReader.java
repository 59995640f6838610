package ai.photodesk.batch.config;

import java.util.Optional;

/**
 * Source of named settings, normally the process environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);
}
