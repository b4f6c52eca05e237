package org.tabula.errors;

/**
 * Transport level failure: an HTTP status outside 2xx, a failed request, or an external tool
 * exiting non-zero or past its deadline.
 */
public class SourceFetchException extends IngestException {

    public static final int NO_STATUS = -1;

    private final int status;
    private final String detail;

    public SourceFetchException(String message, int status, String detail) {
        super(message);
        this.status = status;
        this.detail = detail == null ? "" : detail;
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
        this.status = NO_STATUS;
        this.detail = cause.getMessage() == null ? "" : cause.getMessage();
    }

    /**
     * @return the HTTP status or process exit code, {@link #NO_STATUS} when the failure had none
     */
    public int getStatus() {
        return status;
    }

    /**
     * @return response body excerpt or captured stderr, never null
     */
    public String getDetail() {
        return detail;
    }
}
