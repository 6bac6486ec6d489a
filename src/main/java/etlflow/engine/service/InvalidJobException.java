package etlflow.engine.service;

/**
 * A job definition was rejected before reaching the store: missing name or command,
 * invalid schedule parameter, malformed environment overrides.
 */
public class InvalidJobException extends IllegalArgumentException {

    public InvalidJobException(String message) {
        super(message);
    }

    public InvalidJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
