package io.privx.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Authenticated JSON transport used by the endpoint clients.
 *
 * <p>Paths are resource paths relative to the API base URL, with identifiers already
 * escaped (see {@link RestPaths}). Every call may fail with a
 * {@link io.privx.sdk.exception.PrivxException}.
 */
public interface RestConnector {

    <T> T get(String path, TypeReference<T> responseType);

    <T> T post(String path, Object body, TypeReference<T> responseType);

    void put(String path, Object body);

    void delete(String path);
}
