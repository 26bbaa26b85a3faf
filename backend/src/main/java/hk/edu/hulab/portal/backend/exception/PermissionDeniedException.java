package hk.edu.hulab.portal.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Ownership or role check failed in a service sitting above the data layer.
 */
public class PermissionDeniedException extends PortalException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.FORBIDDEN;
    }
}
