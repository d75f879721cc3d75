package com.enterprise.sheetconvert.extraction;

import java.util.Objects;

/**
 * Either a successful {@link ExtractionResult} or a classified failure. Expected
 * document problems are outcomes, not exceptions.
 */
public final class ExtractionOutcome {

    private final ExtractionResult result;
    private final FailureKind failureKind;
    private final String detail;

    private ExtractionOutcome(ExtractionResult result, FailureKind failureKind, String detail) {
        this.result = result;
        this.failureKind = failureKind;
        this.detail = detail;
    }

    public static ExtractionOutcome success(ExtractionResult result) {
        return new ExtractionOutcome(Objects.requireNonNull(result, "result"), null, null);
    }

    public static ExtractionOutcome failure(FailureKind kind, String detail) {
        return new ExtractionOutcome(null, Objects.requireNonNull(kind, "kind"), detail);
    }

    public boolean isSuccess() {
        return result != null;
    }

    /**
     * @throws IllegalStateException when this outcome is a failure
     */
    public ExtractionResult result() {
        if (result == null) {
            throw new IllegalStateException("Extraction failed: " + failureKind);
        }
        return result;
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    public String detail() {
        return detail;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "Success[" + result.tables().size() + " table(s), " + result.strategy() + "]"
                : "Failure[" + failureKind + ": " + detail + "]";
    }
}
