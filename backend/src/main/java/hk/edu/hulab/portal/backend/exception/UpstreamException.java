package hk.edu.hulab.portal.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Transport or authentication failure talking to the learning record store.
 */
public class UpstreamException extends PortalException {

    private final int upstreamStatus;
    private final boolean retryable;

    public UpstreamException(String message, int upstreamStatus, boolean retryable) {
        super(message);
        this.upstreamStatus = upstreamStatus;
        this.retryable = retryable;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.upstreamStatus = 0;
        this.retryable = true;
    }

    /**
     * HTTP status returned by the store, 0 when no response was received.
     */
    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
