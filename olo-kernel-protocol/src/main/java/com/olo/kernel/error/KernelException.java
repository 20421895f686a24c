package com.olo.kernel.error;

/**
 * Typed failure of a kernel operation. Subsystems throw it; the kernel never swallows it except where
 * a boolean result is the documented contract (interrupt resolve/cancel).
 */
public class KernelException extends RuntimeException {

    private final ErrorKind kind;

    public KernelException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public KernelException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static KernelException validation(String format, Object... args) {
        return new KernelException(ErrorKind.VALIDATION, String.format(format, args));
    }

    public static KernelException notFound(String what, String id) {
        return new KernelException(ErrorKind.NOT_FOUND, String.format("%s not found: %s", what, id));
    }

    public static KernelException stateTransition(String format, Object... args) {
        return new KernelException(ErrorKind.STATE_TRANSITION, String.format(format, args));
    }

    public static KernelException internal(String message, Throwable cause) {
        return new KernelException(ErrorKind.INTERNAL, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Stable category tag, e.g. {@code RESOURCE_EXHAUSTED}. */
    public String getCode() {
        return kind.getCode();
    }
}
