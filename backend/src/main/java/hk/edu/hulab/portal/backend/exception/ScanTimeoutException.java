package hk.edu.hulab.portal.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * A statement scan exceeded its time budget. Raised instead of returning a silently truncated result.
 */
public class ScanTimeoutException extends PortalException {

    public ScanTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.GATEWAY_TIMEOUT;
    }
}
