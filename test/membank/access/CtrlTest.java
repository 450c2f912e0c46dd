package membank.access;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CtrlTest {

  @Test
  void testStages() {
    Ctrl root = new Ctrl("root");
    Ctrl metapipe = root.addChild("mp");
    Ctrl s0 = metapipe.addChild("s0");
    Ctrl s1 = metapipe.addChild("s1");
    Ctrl inner = s1.addChild("inner").addChild("innermost");
    Ctrl outside = root.addChild("outside");

    Assertions.assertEquals(List.of(s0, s1), metapipe.getChildren());
    Assertions.assertEquals(Optional.of(0), s0.stageWithin(metapipe));
    Assertions.assertEquals(Optional.of(1), inner.stageWithin(metapipe));
    Assertions.assertTrue(outside.stageWithin(metapipe).isEmpty());
    Assertions.assertTrue(metapipe.stageWithin(metapipe).isEmpty());
    Assertions.assertTrue(root.stageWithin(metapipe).isEmpty());
  }

  @Test
  void testIsWithin() {
    Ctrl root = new Ctrl("root");
    Ctrl a = root.addChild("a");
    Ctrl b = a.addChild("b");
    Assertions.assertTrue(b.isWithin(root));
    Assertions.assertTrue(b.isWithin(b));
    Assertions.assertFalse(a.isWithin(b));
    Assertions.assertFalse(b.isWithin(root.addChild("a")));
    Assertions.assertEquals(Optional.of(a), b.getParent());
    Assertions.assertEquals("b", b.toString());
  }
}
