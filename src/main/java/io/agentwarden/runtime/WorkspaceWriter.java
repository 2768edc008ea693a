package io.agentwarden.runtime;

import io.agentwarden.guardrail.PathContainmentRule;
import io.agentwarden.guardrail.SourceScanner;
import io.agentwarden.util.FileWrites;
import io.agentwarden.util.Hashing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes task results into the workspace. Code targets receive the first fenced block of the
 * generated text when there is one; prose targets receive the text as is.
 */
public final class WorkspaceWriter {
    private final Path workspaceRoot;

    public WorkspaceWriter(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
    }

    public Path workspaceRoot() {
        return workspaceRoot;
    }

    public Path resolve(String targetPath) {
        return PathContainmentRule.resolve(workspaceRoot, targetPath);
    }

    public Written write(Path target, String generatedText) throws IOException {
        if (!PathContainmentRule.isContained(List.of(workspaceRoot), target)) {
            throw new IOException("Refusing to write outside the workspace: " + target);
        }
        String content = contentFor(target.toString(), generatedText);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        FileWrites.writeAtomically(target, bytes);
        return new Written(target, Hashing.sha256Hex(bytes), bytes.length);
    }

    public static String contentFor(String targetPath, String generatedText) {
        if (SourceScanner.PROSE.equals(SourceScanner.languageForPath(targetPath))) {
            return generatedText;
        }
        return SourceScanner.firstFencedBlock(generatedText).orElse(generatedText);
    }

    public record Written(Path path, String sha256, int bytes) {
    }
}
