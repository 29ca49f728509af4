package msgbus.dead;

import msgbus.Message;

import java.time.Instant;

/**
 * A message whose delivery to one subscriber failed permanently.
 *
 * @param message        the original, unmodified message
 * @param subscriptionId the subscription that failed, or {@code 0} if not recorded
 * @param error          failure description
 * @param errorClass     fully qualified class name of the failure, or {@code null}
 * @param attemptCount   delivery attempts made before giving up
 * @param failedAt       when the message was dead-lettered
 */
public record FailedMessage(Message message, long subscriptionId, String error,
    String errorClass, int attemptCount, Instant failedAt) {

  public String messageId() {
    return message.messageId();
  }

  public int typeCode() {
    return message.typeCode();
  }
}
