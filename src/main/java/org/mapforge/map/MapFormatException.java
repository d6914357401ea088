package org.mapforge.map;

/**
 * Thrown when a level or template document does not have the expected structure.
 */
public class MapFormatException extends Exception {

    public MapFormatException(String message) {
        super(message);
    }

    public MapFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
