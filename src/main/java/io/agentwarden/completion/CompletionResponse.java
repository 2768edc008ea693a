package io.agentwarden.completion;

public record CompletionResponse(String generatedText, String model, String stopReason) {

    public static CompletionResponse of(String generatedText) {
        return new CompletionResponse(generatedText, null, null);
    }
}
