package edu.brandeis.cosi103a.fantasy.error;

/**
 * Thrown when a JSON configuration file cannot be read or does not describe a valid setup.
 */
public class ConfigurationLoadException extends FantasyException {
    public ConfigurationLoadException(String message) {
        super(message);
    }

    public ConfigurationLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
