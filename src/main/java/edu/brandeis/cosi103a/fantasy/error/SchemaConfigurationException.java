package edu.brandeis.cosi103a.fantasy.error;

/**
 * Thrown when a position schema is built from slot counts that do not match the league's
 * position codes, or that contain a negative count.
 */
public class SchemaConfigurationException extends FantasyException {
    public SchemaConfigurationException(String message) {
        super(message);
    }
}
