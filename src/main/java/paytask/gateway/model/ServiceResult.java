package paytask.gateway.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a service operation: either a value with a success message,
 * or a failure message. Domain failures are returned, never thrown.
 */
public final class ServiceResult<T> {

    private final T value;
    private final Message message;

    private ServiceResult(T value, Message message) {
        this.value = value;
        this.message = Objects.requireNonNull(message, "message is required");
    }

    public static <T> ServiceResult<T> ok(T value, String text) {
        return new ServiceResult<>(value, Message.success(text));
    }

    public static <T> ServiceResult<T> ok(T value) {
        return ok(value, "");
    }

    public static <T> ServiceResult<T> failure(Message message) {
        if (message.kind().isSuccess()) {
            throw new IllegalArgumentException("failure requires a non-success kind: " + message.kind());
        }
        return new ServiceResult<>(null, message);
    }

    public static <T> ServiceResult<T> notFound(String text) {
        return failure(Message.notFound(text));
    }

    public static <T> ServiceResult<T> notConfigured(String text) {
        return failure(Message.notConfigured(text));
    }

    public boolean isSuccess() {
        return message.kind().isSuccess();
    }

    public MessageKind kind() {
        return message.kind();
    }

    public Message message() {
        return message;
    }

    /** Value of a successful result, empty for failures. */
    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    /** Value of a successful result; throws for failures. */
    public T orElseThrow() {
        if (!isSuccess()) {
            throw new IllegalStateException(message.kind() + ": " + message.text());
        }
        return value;
    }

    public <R> ServiceResult<R> map(Function<T, R> mapper) {
        if (!isSuccess()) {
            return new ServiceResult<>(null, message);
        }
        return new ServiceResult<>(mapper.apply(value), message);
    }

    @Override
    public String toString() {
        return "ServiceResult{" + message.kind() + ", '" + message.text() + "'}";
    }
}
