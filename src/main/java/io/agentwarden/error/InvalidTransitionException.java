package io.agentwarden.error;

public final class InvalidTransitionException extends WardenException {
    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
    }
}
