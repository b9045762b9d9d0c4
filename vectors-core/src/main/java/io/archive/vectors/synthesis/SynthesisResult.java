package io.archive.vectors.synthesis;

import java.util.Optional;

/**
 * Outcome of one summarization call: the synthesized text, or why there is none.
 */
public record SynthesisResult(String answer, String failureReason) {

    public static SynthesisResult success(String answer) {
        return new SynthesisResult(answer, null);
    }

    public static SynthesisResult failure(String reason) {
        return new SynthesisResult(null, reason);
    }

    public boolean isSuccess() {
        return answer != null && !answer.isBlank();
    }

    public Optional<String> text() {
        return isSuccess() ? Optional.of(answer.trim()) : Optional.empty();
    }
}
