package ca.gc.cra.mosaic.domain.msg;

import java.util.Objects;

/**
 * Payload recovered from the frames of one message.
 *
 * @param messageId id of the message selected from the scan
 * @param payload fragment texts joined in index order
 * @since 0.1.0
 */
public record ReassembledMessage(MessageId messageId, String payload) {
  public ReassembledMessage {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(payload, "payload");
  }
}
