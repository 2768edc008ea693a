package io.agentwarden.queue;

import io.agentwarden.model.TaskView;

/** A task together with the lease that lets its holder ack or fail it. */
public record ClaimedTask(TaskView task, String workerId, String leaseToken, long leaseExpiresAtMs) {

    public String taskId() {
        return task.taskId();
    }
}
