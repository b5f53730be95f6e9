package com.ordoAetheris.pipeline.config;

/**
 * A pipeline setting is missing, malformed or out of range.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
