package paytask.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import paytask.gateway.model.Message;
import paytask.gateway.model.MessageKind;

/**
 * Tagged outcome of a mutating operation.
 * Clients should branch on {@code kind}; {@code message} is for humans.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponse(
        @JsonProperty("kind") MessageKind kind,
        @JsonProperty("message") String message,
        @JsonProperty("taskId") String taskId) {

    public static MessageResponse from(Message message) {
        return new MessageResponse(message.kind(), message.text(), null);
    }

    public static MessageResponse from(Message message, String taskId) {
        return new MessageResponse(message.kind(), message.text(), taskId);
    }
}
