package paytask.gateway.model;

import java.util.Objects;

/**
 * Tagged message returned by service operations.
 */
public record Message(MessageKind kind, String text) {

    public Message {
        Objects.requireNonNull(kind, "kind is required");
        text = text != null ? text : "";
    }

    public static Message success(String text) {
        return new Message(MessageKind.SUCCESS, text);
    }

    public static Message notFound(String text) {
        return new Message(MessageKind.NOT_FOUND, text);
    }

    public static Message notConfigured(String text) {
        return new Message(MessageKind.NOT_CONFIGURED, text);
    }
}
