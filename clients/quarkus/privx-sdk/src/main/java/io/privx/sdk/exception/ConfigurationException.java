package io.privx.sdk.exception;

/**
 * Exception thrown when an explicitly requested configuration source cannot be read.
 *
 * <p>Only I/O failures raise this. Malformed content is tolerated by the credential
 * options and never surfaces here.
 */
public class ConfigurationException extends PrivxException {

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException unreadableFile(String path, Throwable cause) {
        return new ConfigurationException("Unable to read configuration file: " + path, cause);
    }
}
