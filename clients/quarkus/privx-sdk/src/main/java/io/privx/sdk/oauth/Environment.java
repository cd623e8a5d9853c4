package io.privx.sdk.oauth;

import java.util.Map;
import java.util.Optional;

/**
 * Lookup of environment variables.
 */
@FunctionalInterface
public interface Environment {

    Environment SYSTEM = name -> Optional.ofNullable(System.getenv(name));

    Optional<String> lookup(String name);

    static Environment of(Map<String, String> variables) {
        return name -> Optional.ofNullable(variables.get(name));
    }
}
