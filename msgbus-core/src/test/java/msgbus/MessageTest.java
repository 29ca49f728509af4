package msgbus;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

  @Test
  void defaultsAreApplied() {
    Message message = Message.of(42, "payload");

    assertNotNull(message.messageId());
    assertFalse(message.messageId().isEmpty());
    assertNotNull(message.timestamp());
    assertEquals(Priority.NORMAL, message.priority());
    assertEquals(Message.UNKNOWN_SOURCE, message.source());
    assertNull(message.correlationId());
    assertTrue(message.headers().isEmpty());
  }

  @Test
  void generatedIdsAreUniqueAndOrdered() {
    Message first = Message.of(1, null);
    Message second = Message.of(1, null);

    assertNotEquals(first.messageId(), second.messageId());
    assertTrue(first.messageId().compareTo(second.messageId()) < 0);
  }

  @Test
  void headersAreCopiedAndImmutable() {
    Map<String, String> headers = new HashMap<>();
    headers.put("tenant", "acme");
    Message message = Message.builder(7).headers(headers).header("region", "eu").build();
    headers.put("tenant", "changed");

    assertEquals("acme", message.headers().get("tenant"));
    assertEquals("eu", message.headers().get("region"));
    assertThrows(UnsupportedOperationException.class, () -> message.headers().put("x", "y"));
  }

  @Test
  void nullHeaderValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> Message.builder(7).header("key", null).build());
    assertThrows(IllegalArgumentException.class,
        () -> Message.builder(7).messageId("").build());
  }

  @Test
  void toBuilderKeepsIdentity() {
    Instant created = Instant.parse("2024-01-01T00:00:00Z");
    Message original = Message.builder(SimpleMessageType.of(42, "OrderPlaced"))
        .messageId("m-1")
        .timestamp(created)
        .source("checkout")
        .priority(Priority.HIGH)
        .correlationId("c-1")
        .payload(17)
        .build();

    Message copy = original.toBuilder().build();

    assertEquals("m-1", copy.messageId());
    assertEquals(created, copy.timestamp());
    assertEquals(42, copy.typeCode());
    assertEquals("checkout", copy.source());
    assertEquals(Priority.HIGH, copy.priority());
    assertEquals("c-1", copy.correlationId());
    assertEquals(17, copy.payload(Integer.class));
  }

  @Test
  void typedPayloadAccessChecksType() {
    Message message = Message.of(1, "text");

    assertEquals("text", message.payload(String.class));
    assertThrows(ClassCastException.class, () -> message.payload(Integer.class));
  }

  @Test
  void priorityOrdering() {
    assertTrue(Priority.CRITICAL.isAtLeast(Priority.HIGH));
    assertTrue(Priority.NORMAL.isAtLeast(Priority.NORMAL));
    assertFalse(Priority.LOW.isAtLeast(Priority.NORMAL));
  }
}
