package hk.edu.hulab.portal.backend.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends PortalException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String entityType, String id) {
        return new NotFoundException(entityType + " not found: " + id);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_FOUND;
    }
}
