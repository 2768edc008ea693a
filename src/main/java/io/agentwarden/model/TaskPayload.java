package io.agentwarden.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What the submitter asked for. {@code filePath} names an input file the task is about,
 * {@code targetPath} the file the generated result should be written to.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskPayload(
        String description,
        String code,
        String filePath,
        String targetPath,
        String language
) {
    public static TaskPayload describe(String description) {
        return new TaskPayload(description, null, null, null, null);
    }

    public TaskPayload withCode(String code, String language) {
        return new TaskPayload(description, code, filePath, targetPath, language);
    }

    public TaskPayload withTarget(String targetPath) {
        return new TaskPayload(description, code, filePath, targetPath, language);
    }

    public boolean hasTarget() {
        return targetPath != null && !targetPath.isBlank();
    }
}
