package work.goscript.kernel.shared;

import java.util.Objects;

/**
 * Fatal runtime condition that terminates evaluation of the running script.
 */
public final class KernelPanicException extends RuntimeException {
    private final PanicCode code;
    private final Object data;

    public KernelPanicException(PanicCode code, String message) {
        this(code, message, null);
    }

    public KernelPanicException(PanicCode code, String message, Object data) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
        this.data = data;
    }

    public static KernelPanicException of(PanicCode code, String format, Object... args) {
        return new KernelPanicException(code, String.format(format, args));
    }

    public PanicCode code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
