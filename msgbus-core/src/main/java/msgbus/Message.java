package msgbus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable message envelope handed to the {@link MessageBus}.
 *
 * <p>Each message is assigned a ULID-based {@code messageId} by default. The payload is an
 * opaque in-process value; the bus routes on {@link #typeCode()} only and never inspects or
 * mutates the payload. Use the {@linkplain Builder builder} or the {@code of} factory methods
 * to create instances.
 *
 * @see MessageType
 * @see Priority
 */
public final class Message {

  /** Source label used when the publisher does not set one. */
  public static final String UNKNOWN_SOURCE = "unknown";

  private final String messageId;
  private final Instant timestamp;
  private final int typeCode;
  private final String source;
  private final Priority priority;
  private final String correlationId;
  private final Object payload;
  private final Map<String, String> headers;

  private Message(Builder builder) {
    this.messageId = builder.messageId == null ? newMessageId() : builder.messageId;
    if (this.messageId.isEmpty()) {
      throw new IllegalArgumentException("messageId cannot be empty");
    }
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    this.typeCode = builder.typeCode;
    this.source = builder.source == null ? UNKNOWN_SOURCE : builder.source;
    this.priority = builder.priority == null ? Priority.NORMAL : builder.priority;
    this.correlationId = builder.correlationId;
    this.payload = builder.payload;

    Map<String, String> headerCopy = builder.headers == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    if (headerCopy.containsKey(null)) {
      throw new IllegalArgumentException("headers cannot contain null keys");
    }
    if (headerCopy.containsValue(null)) {
      throw new IllegalArgumentException("headers cannot contain null values");
    }
    this.headers = headerCopy;
  }

  /**
   * Creates a builder for the given numeric type code.
   *
   * @param typeCode the message type code
   * @return a new builder
   */
  public static Builder builder(int typeCode) {
    return new Builder(typeCode);
  }

  /**
   * Creates a builder with a type-safe message type.
   *
   * @param type the message type
   * @return a new builder
   */
  public static Builder builder(MessageType type) {
    Objects.requireNonNull(type, "type");
    return new Builder(type.code());
  }

  /**
   * Creates a {@link Priority#NORMAL} message with the given payload.
   *
   * @param typeCode the message type code
   * @param payload  the payload, may be {@code null}
   * @return a new message
   */
  public static Message of(int typeCode, Object payload) {
    return builder(typeCode).payload(payload).build();
  }

  /**
   * Creates a {@link Priority#NORMAL} message with the given payload.
   *
   * @param type    the message type
   * @param payload the payload, may be {@code null}
   * @return a new message
   */
  public static Message of(MessageType type, Object payload) {
    return builder(type).payload(payload).build();
  }

  public String messageId() {
    return messageId;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public int typeCode() {
    return typeCode;
  }

  public String source() {
    return source;
  }

  public Priority priority() {
    return priority;
  }

  /**
   * Returns the correlation identifier for cross-message tracing, or {@code null}.
   *
   * @return the correlation id, or {@code null}
   */
  public String correlationId() {
    return correlationId;
  }

  public Object payload() {
    return payload;
  }

  /**
   * Returns the payload cast to the requested type.
   *
   * @param type the expected payload class
   * @param <T>  the payload type
   * @return the payload, or {@code null} if the message has none
   * @throws ClassCastException if the payload is not an instance of {@code type}
   */
  public <T> T payload(Class<T> type) {
    return type.cast(payload);
  }

  public Map<String, String> headers() {
    return headers;
  }

  /**
   * Returns a builder pre-populated with this message's fields, including its identifier.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder(typeCode)
        .messageId(messageId)
        .timestamp(timestamp)
        .source(source)
        .priority(priority)
        .correlationId(correlationId)
        .payload(payload)
        .headers(headers);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Message{messageId=").append(messageId)
        .append(", typeCode=").append(typeCode)
        .append(", priority=").append(priority)
        .append(", source=").append(source);
    if (correlationId != null) {
      sb.append(", correlationId=").append(correlationId);
    }
    return sb.append('}').toString();
  }

  /**
   * Builder for {@link Message}.
   */
  public static final class Builder {
    private final int typeCode;
    private String messageId;
    private Instant timestamp;
    private String source;
    private Priority priority;
    private String correlationId;
    private Object payload;
    private Map<String, String> headers;

    private Builder(int typeCode) {
      this.typeCode = typeCode;
    }

    /**
     * Sets a custom message identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param messageId the message identifier
     * @return this builder
     */
    public Builder messageId(String messageId) {
      this.messageId = messageId;
      return this;
    }

    /**
     * Sets the creation timestamp.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param timestamp the creation timestamp
     * @return this builder
     */
    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    /**
     * Sets the free-text origin label.
     *
     * <p>Optional. Defaults to {@value Message#UNKNOWN_SOURCE}.
     *
     * @param source the origin label
     * @return this builder
     */
    public Builder source(String source) {
      this.source = source;
      return this;
    }

    /**
     * Sets the priority.
     *
     * <p>Optional. Defaults to {@link Priority#NORMAL}.
     *
     * @param priority the priority
     * @return this builder
     */
    public Builder priority(Priority priority) {
      this.priority = priority;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder payload(Object payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Sets custom key-value metadata headers. The map is copied at build time.
     *
     * <p>Optional. Defaults to an empty map. Null keys and values are rejected at build time.
     *
     * @param headers the metadata headers
     * @return this builder
     */
    public Builder headers(Map<String, String> headers) {
      this.headers = headers == null ? null : new LinkedHashMap<>(headers);
      return this;
    }

    /**
     * Adds a single header.
     *
     * @param key   the header key
     * @param value the header value
     * @return this builder
     */
    public Builder header(String key, String value) {
      if (headers == null) {
        headers = new LinkedHashMap<>();
      }
      headers.put(key, value);
      return this;
    }

    /**
     * Builds an immutable {@link Message}.
     *
     * @return a new message
     * @throws IllegalArgumentException if {@code messageId} is empty or headers contain nulls
     */
    public Message build() {
      return new Message(this);
    }
  }

  private static String newMessageId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
