package msgbus.registry;

import msgbus.DuplicateTypeException;
import msgbus.MessageType;
import msgbus.SimpleMessageType;
import msgbus.TypeNotRegisteredException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class DefaultTypeRegistryTest {

  enum OrderTypes implements MessageType {
    ORDER_PLACED(42),
    ORDER_CANCELLED(43);

    private final int code;

    OrderTypes(int code) {
      this.code = code;
    }

    @Override
    public int code() {
      return code;
    }
  }

  @Test
  void lookupReturnsRegisteredName() {
    DefaultTypeRegistry registry = new DefaultTypeRegistry().with(42, "OrderPlaced");

    assertEquals("OrderPlaced", registry.lookup(42));
    assertTrue(registry.isRegistered(42));
    assertEquals(OptionalInt.of(42), registry.codeOf("OrderPlaced"));
  }

  @Test
  void lookupOfUnknownCodeThrows() {
    DefaultTypeRegistry registry = new DefaultTypeRegistry();

    TypeNotRegisteredException ex = assertThrows(TypeNotRegisteredException.class,
        () -> registry.lookup(7));
    assertEquals(7, ex.typeCode());
    assertFalse(registry.isRegistered(7));
    assertTrue(registry.codeOf("Nope").isEmpty());
  }

  @Test
  void reRegisteringIdenticalPairIsNoOp() {
    DefaultTypeRegistry registry = new DefaultTypeRegistry().with(42, "OrderPlaced");

    assertDoesNotThrow(() -> registry.register(42, "OrderPlaced"));
    assertEquals(Map.of(42, "OrderPlaced"), registry.registeredTypes());
  }

  @Test
  void conflictingNameForCodeThrows() {
    DefaultTypeRegistry registry = new DefaultTypeRegistry().with(42, "OrderPlaced");

    DuplicateTypeException ex = assertThrows(DuplicateTypeException.class,
        () -> registry.register(42, "OrderShipped"));
    assertEquals(42, ex.typeCode());
    assertEquals("OrderPlaced", registry.lookup(42));
  }

  @Test
  void conflictingCodeForNameThrows() {
    DefaultTypeRegistry registry = new DefaultTypeRegistry().with(42, "OrderPlaced");

    assertThrows(DuplicateTypeException.class, () -> registry.register(43, "OrderPlaced"));
    assertFalse(registry.isRegistered(43));
  }

  @Test
  void rejectsEmptyName() {
    DefaultTypeRegistry registry = new DefaultTypeRegistry();

    assertThrows(IllegalArgumentException.class, () -> registry.register(1, ""));
    assertThrows(NullPointerException.class, () -> registry.register(1, null));
  }

  @Test
  void registersEnumAndSimpleTypes() {
    DefaultTypeRegistry registry = new DefaultTypeRegistry()
        .with(OrderTypes.ORDER_PLACED)
        .with(SimpleMessageType.of(99, "Heartbeat"));

    assertEquals("ORDER_PLACED", registry.lookup(42));
    assertEquals("Heartbeat", registry.lookup(99));
  }

  @Test
  void registeredTypesIsOrderedSnapshot() {
    DefaultTypeRegistry registry = new DefaultTypeRegistry()
        .with(3, "C")
        .with(1, "A")
        .with(2, "B");

    Map<Integer, String> snapshot = registry.registeredTypes();
    registry.register(4, "D");

    assertEquals(List.of(1, 2, 3), List.copyOf(snapshot.keySet()));
    assertThrows(UnsupportedOperationException.class, () -> snapshot.put(5, "E"));
  }
}
