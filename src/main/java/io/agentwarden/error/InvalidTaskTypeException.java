package io.agentwarden.error;

public final class InvalidTaskTypeException extends WardenException {
    private final String declaredType;

    public InvalidTaskTypeException(String declaredType) {
        super(ErrorKind.INVALID_TASK_TYPE, "Unsupported task type: " + declaredType);
        this.declaredType = declaredType;
    }

    public String declaredType() {
        return declaredType;
    }
}
