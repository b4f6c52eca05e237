package org.tabula.errors;

/**
 * A required adapter configuration key is missing or holds a value outside its allowed set.
 */
public class ConfigException extends IngestException {

    public ConfigException(String message) {
        super(message);
    }
}
