package com.example.bulkfile;

/**
 * Invalid engine configuration. Raised before any work is started.
 */
public class ConfigException extends IllegalArgumentException {
    public ConfigException(String message) {
        super(message);
    }
}
