package io.privx.sdk.oauth;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the raw bytes of a credential configuration file.
 */
@FunctionalInterface
public interface ConfigFileReader {

    ConfigFileReader FILE_SYSTEM = Files::readAllBytes;

    byte[] read(Path path) throws IOException;
}
