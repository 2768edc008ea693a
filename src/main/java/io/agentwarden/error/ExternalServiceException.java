package io.agentwarden.error;

public final class ExternalServiceException extends WardenException {
    public ExternalServiceException(String message) {
        super(ErrorKind.EXTERNAL_SERVICE_ERROR, message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(ErrorKind.EXTERNAL_SERVICE_ERROR, message, cause);
    }
}
