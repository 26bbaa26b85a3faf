package hk.edu.hulab.portal.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * The stored document moved on since the caller read it. Callers should re-read and retry.
 */
public class ConflictException extends PortalException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.CONFLICT;
    }
}
