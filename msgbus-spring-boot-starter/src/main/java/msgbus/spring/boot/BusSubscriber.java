package msgbus.spring.boot;

import msgbus.MessageType;
import msgbus.Priority;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a message bus subscriber.
 *
 * <p>The annotated bean must implement {@link msgbus.MessageHandler} or
 * {@link msgbus.AsyncMessageHandler}. The annotation names the message type it handles.
 *
 * <h2>By type name</h2>
 * <pre>{@code
 * @Component
 * @BusSubscriber(type = "OrderPlaced")
 * public class InventoryHandler implements MessageHandler {
 *   public void onMessage(Message message) { ... }
 * }
 * }</pre>
 *
 * <h2>Type-safe class-based registration</h2>
 * <pre>{@code
 * @Component
 * @BusSubscriber(typeClass = OrderPlaced.class, minPriority = Priority.HIGH)
 * public class PagerHandler implements MessageHandler { ... }
 * }</pre>
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>{@code typeClass} takes precedence over {@code type}, which takes precedence over
 *       {@code code}</li>
 *   <li>A {@code typeClass} is registered with the bus if it is not already</li>
 *   <li>A {@code type} name must already be registered, e.g. via {@code msgbus.types}</li>
 *   <li>Exactly one of {@code code}/{@code type}/{@code typeClass} must be specified</li>
 * </ul>
 *
 * @see BusSubscriberRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface BusSubscriber {

    /**
     * Numeric type code. Negative means unset.
     */
    int code() default -1;

    /**
     * Registered type name.
     */
    String type() default "";

    /**
     * Message type class (type-safe). Takes precedence over {@link #type()} and {@link #code()}.
     * Must have a no-arg constructor (or be an enum).
     */
    Class<? extends MessageType> typeClass() default MessageType.class;

    /**
     * Lowest priority delivered to this subscriber.
     */
    Priority minPriority() default Priority.LOW;
}
