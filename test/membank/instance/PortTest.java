package membank.instance;

import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PortTest {

  @Test
  void testValidation() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Port(Optional.of(0), 0, 2, 2, 0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Port(Optional.of(0), 0, 2, -1, 0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Port(Optional.of(0), -1, 2, 0, 0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Port(Optional.of(0), 0, 2, 0, -1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Port(Optional.of(-1), 0, 2, 0, 0));
    Assertions.assertDoesNotThrow(() -> new Port(Optional.empty(), 3, 2, 1, 4));
  }

  @Test
  void testEquality() {
    Assertions.assertEquals(new Port(Optional.of(1), 0, 4, 2, 0), new Port(Optional.of(1), 0, 4, 2, 0));
    Assertions.assertNotEquals(new Port(Optional.of(1), 0, 4, 2, 0), new Port(Optional.empty(), 0, 4, 2, 0));
    Assertions.assertEquals("Port(buffer: None, mux: 1, size: 4, ofs: 2, broadcast: 0)", new Port(Optional.empty(), 1, 4, 2, 0).toString());
  }
}
