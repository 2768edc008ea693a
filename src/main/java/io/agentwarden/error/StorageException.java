package io.agentwarden.error;

public final class StorageException extends WardenException {
    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_ERROR, message, cause);
    }
}
