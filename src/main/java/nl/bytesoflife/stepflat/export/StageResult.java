package nl.bytesoflife.stepflat.export;

import java.util.Objects;

/**
 * Outcome of one export stage: a value, or the failure that sends the face to the next stage.
 */
public record StageResult<T>(T value, ExportFailure failure, String message) {

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(Objects.requireNonNull(value), null, null);
    }

    public static <T> StageResult<T> failure(ExportFailure failure, String message) {
        return new StageResult<>(null, Objects.requireNonNull(failure), message);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Human readable failure, e.g. for notes attached to the export.
     */
    public String describe() {
        if (isSuccess()) return "ok";
        return message == null || message.isEmpty()
                ? failure.getDescription()
                : failure.getDescription() + ": " + message;
    }
}
