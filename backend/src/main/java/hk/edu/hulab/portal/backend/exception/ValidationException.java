package hk.edu.hulab.portal.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing or malformed input. Never retried.
 */
public class ValidationException extends PortalException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
