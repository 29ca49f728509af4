package msgbus.spring.boot;

import msgbus.AsyncMessageHandler;
import msgbus.Message;
import msgbus.MessageBus;
import msgbus.MessageHandler;
import msgbus.MessageType;
import msgbus.Priority;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.junit.jupiter.api.Assertions.*;

class BusSubscriberRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner();

  @Test
  void registersCodeBasedSubscriber() {
    runner.withUserConfiguration(CodeSubscriberConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      assertEquals(1, bus.subscriberCount(42));
    });
  }

  @Test
  void registersNameBasedSubscriber() {
    runner.withUserConfiguration(NameSubscriberConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      assertEquals(1, bus.subscriberCount(42));
    });
  }

  @Test
  void registersClassBasedTypeAndSubscriber() {
    runner.withUserConfiguration(ClassSubscriberConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      assertTrue(bus.types().isRegistered(7));
      assertEquals(1, bus.subscriberCount(7));
    });
  }

  @Test
  void registersEnumBasedType() {
    runner.withUserConfiguration(EnumSubscriberConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      assertEquals("ShipmentDispatched", bus.types().lookup(8));
      assertEquals(1, bus.subscriberCount(8));
    });
  }

  @Test
  void classBasedTakesPrecedenceOverName() {
    runner.withUserConfiguration(PrecedenceSubscriberConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      assertEquals(1, bus.subscriberCount(7));
      assertEquals(0, bus.subscriberCount(42));
    });
  }

  @Test
  void registersAsyncSubscriber() {
    runner.withUserConfiguration(AsyncSubscriberConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      var result = bus.publishAsync(Message.of(42, null)).get();
      assertEquals(1, result.delivered());
    });
  }

  @Test
  void appliesMinimumPriority() {
    runner.withUserConfiguration(PrioritySubscriberConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      assertEquals(1, bus.publish(Message.of(42, null)).filtered());
      assertEquals(1, bus.publish(Message.builder(42).priority(Priority.HIGH).build()).delivered());
    });
  }

  @Test
  void failsWhenBeanIsNotAHandler() {
    runner.withUserConfiguration(NotAHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenNoTypeSpecified() {
    runner.withUserConfiguration(NoTypeConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenTypeNameUnknown() {
    runner.withUserConfiguration(UnknownNameConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  public record InvoiceIssued() implements MessageType {
    @Override
    public int code() {
      return 7;
    }

    @Override
    public String name() {
      return "InvoiceIssued";
    }
  }

  public enum ShipmentTypes implements MessageType {
    ShipmentDispatched;

    @Override
    public int code() {
      return 8;
    }
  }

  @BusSubscriber(code = 42)
  static class CodeSubscriber implements MessageHandler {
    @Override
    public void onMessage(Message message) {}
  }

  @BusSubscriber(type = "OrderPlaced")
  static class NameSubscriber implements MessageHandler {
    @Override
    public void onMessage(Message message) {}
  }

  @BusSubscriber(typeClass = InvoiceIssued.class)
  static class ClassSubscriber implements MessageHandler {
    @Override
    public void onMessage(Message message) {}
  }

  @BusSubscriber(typeClass = ShipmentTypes.class)
  static class EnumSubscriber implements MessageHandler {
    @Override
    public void onMessage(Message message) {}
  }

  @BusSubscriber(type = "OrderPlaced", typeClass = InvoiceIssued.class)
  static class PrecedenceSubscriber implements MessageHandler {
    @Override
    public void onMessage(Message message) {}
  }

  @BusSubscriber(code = 42)
  static class AsyncSubscriber implements AsyncMessageHandler {
    @Override
    public CompletionStage<Void> onMessage(Message message) {
      return CompletableFuture.completedFuture(null);
    }
  }

  @BusSubscriber(code = 42, minPriority = Priority.HIGH)
  static class PrioritySubscriber implements MessageHandler {
    @Override
    public void onMessage(Message message) {}
  }

  @BusSubscriber(code = 42)
  static class NotAHandlerBean {
    // Implements neither handler interface
  }

  @BusSubscriber
  static class NoTypeSubscriber implements MessageHandler {
    @Override
    public void onMessage(Message message) {}
  }

  @BusSubscriber(type = "Unknown")
  static class UnknownNameSubscriber implements MessageHandler {
    @Override
    public void onMessage(Message message) {}
  }

  @Configuration
  static class BaseConfig {
    @Bean(destroyMethod = "close")
    MessageBus messageBus() {
      MessageBus bus = MessageBus.builder().healthCheckInterval(Duration.ZERO).build();
      bus.registerType(42, "OrderPlaced");
      return bus;
    }

    @Bean
    BusSubscriberRegistrar registrar(ListableBeanFactory bf, MessageBus bus) {
      return new BusSubscriberRegistrar(bf, bus);
    }
  }

  @Configuration
  static class CodeSubscriberConfig extends BaseConfig {
    @Bean
    CodeSubscriber codeSubscriber() {
      return new CodeSubscriber();
    }
  }

  @Configuration
  static class NameSubscriberConfig extends BaseConfig {
    @Bean
    NameSubscriber nameSubscriber() {
      return new NameSubscriber();
    }
  }

  @Configuration
  static class ClassSubscriberConfig extends BaseConfig {
    @Bean
    ClassSubscriber classSubscriber() {
      return new ClassSubscriber();
    }
  }

  @Configuration
  static class EnumSubscriberConfig extends BaseConfig {
    @Bean
    EnumSubscriber enumSubscriber() {
      return new EnumSubscriber();
    }
  }

  @Configuration
  static class PrecedenceSubscriberConfig extends BaseConfig {
    @Bean
    PrecedenceSubscriber precedenceSubscriber() {
      return new PrecedenceSubscriber();
    }
  }

  @Configuration
  static class AsyncSubscriberConfig extends BaseConfig {
    @Bean
    AsyncSubscriber asyncSubscriber() {
      return new AsyncSubscriber();
    }
  }

  @Configuration
  static class PrioritySubscriberConfig extends BaseConfig {
    @Bean
    PrioritySubscriber prioritySubscriber() {
      return new PrioritySubscriber();
    }
  }

  @Configuration
  static class NotAHandlerConfig extends BaseConfig {
    @Bean
    NotAHandlerBean notAHandlerBean() {
      return new NotAHandlerBean();
    }
  }

  @Configuration
  static class NoTypeConfig extends BaseConfig {
    @Bean
    NoTypeSubscriber noTypeSubscriber() {
      return new NoTypeSubscriber();
    }
  }

  @Configuration
  static class UnknownNameConfig extends BaseConfig {
    @Bean
    UnknownNameSubscriber unknownNameSubscriber() {
      return new UnknownNameSubscriber();
    }
  }
}
