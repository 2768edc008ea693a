package io.agentwarden.guardrail;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public final class ExtensionAllowlistRule implements GuardrailRule {
    public static final String NAME = "extension_allowlist";

    private final Set<String> allowed;

    public ExtensionAllowlistRule(List<String> allowedExtensions) {
        this.allowed = allowedExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> check(GuardrailContext context) {
        List<Violation> out = new ArrayList<>();
        for (String raw : context.paths()) {
            String ext = extensionOf(raw);
            if (ext == null) {
                out.add(Violation.block(NAME, "File has no extension: " + raw));
            } else if (!allowed.contains(ext)) {
                out.add(Violation.block(NAME, "Extension " + ext + " is not allowed: " + raw));
            }
        }
        return out;
    }

    static String extensionOf(String raw) {
        Path fileName;
        try {
            fileName = Paths.get(raw.trim()).getFileName();
        } catch (InvalidPathException e) {
            return null;
        }
        if (fileName == null) {
            return null;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
