package io.agentwarden.error;

public final class NotClaimedException extends WardenException {
    private final String taskId;

    public NotClaimedException(String taskId, String reason) {
        super(ErrorKind.NOT_CLAIMED, "Task " + taskId + " is not held by this lease: " + reason);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
