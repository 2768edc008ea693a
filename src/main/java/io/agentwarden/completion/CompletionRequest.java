package io.agentwarden.completion;

import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskType;

public record CompletionRequest(TaskType taskType, TaskPayload payload, String prompt, String modelIdentifier) {
}
