package io.agentwarden.guardrail;

import java.nio.charset.StandardCharsets;
import java.util.List;

public final class SizeLimitRule implements GuardrailRule {
    public static final String NAME = "size_limit";

    private final long maxBytes;

    public SizeLimitRule(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> check(GuardrailContext context) {
        for (String text : context.texts()) {
            long bytes = text.getBytes(StandardCharsets.UTF_8).length;
            if (bytes > maxBytes) {
                return List.of(Violation.block(NAME,
                        "Content is " + bytes + " bytes, limit is " + maxBytes));
            }
        }
        return List.of();
    }
}
