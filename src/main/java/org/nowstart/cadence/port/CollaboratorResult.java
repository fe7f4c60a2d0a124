package org.nowstart.cadence.port;

/**
 * Outcome of a call into an external collaborator: either a value or a failure reason.
 */
public record CollaboratorResult<T>(
        T value,
        String failureReason
) {

    public CollaboratorResult {
        if (value == null && (failureReason == null || failureReason.isBlank())) {
            throw new IllegalArgumentException("failure result requires a reason");
        }
        if (value != null && failureReason != null) {
            throw new IllegalArgumentException("success result must not carry a failure reason");
        }
    }

    public static <T> CollaboratorResult<T> success(T value) {
        if (value == null) {
            throw new IllegalArgumentException("success value is required");
        }
        return new CollaboratorResult<>(value, null);
    }

    public static <T> CollaboratorResult<T> failure(String reason) {
        return new CollaboratorResult<>(null, reason);
    }

    public boolean isSuccess() {
        return value != null;
    }
}
