package hk.edu.hulab.portal.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Root of the portal's error taxonomy. Each subtype maps to one HTTP status.
 */
public abstract class PortalException extends RuntimeException {

    protected PortalException(String message) {
        super(message);
    }

    protected PortalException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus status();
}
