package com.adlanda.phoneadvisor.generation;

/**
 * Result of one generation attempt: either answer text or a typed failure.
 *
 * @param text          Generated answer, null on failure
 * @param failureReason Failure reason, null on success
 * @param detail        Diagnostic detail for logs, null on success
 */
public record GenerationOutcome(String text, GenerationFailureReason failureReason, String detail) {

    public static GenerationOutcome success(String text) {
        return new GenerationOutcome(text, null, null);
    }

    public static GenerationOutcome failure(GenerationFailureReason reason, String detail) {
        return new GenerationOutcome(null, reason, detail);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
