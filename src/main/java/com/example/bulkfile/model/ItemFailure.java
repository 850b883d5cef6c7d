package com.example.bulkfile.model;

/**
 * Record of a single item that could not be materialised.
 */
public record ItemFailure(
        String path,
        ItemKind kind,
        String error
) {
    public static ItemFailure of(WorkItem item, Throwable cause) {
        return new ItemFailure(item.targetPath(), item.kind(), describe(cause));
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank()
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + message;
    }
}
