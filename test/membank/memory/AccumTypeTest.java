package membank.memory;

import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AccumTypeTest {

  @Test
  void testParse() {
    Assertions.assertEquals(Optional.of(AccumType.None), AccumType.fromString("None"));
    Assertions.assertEquals(Optional.of(AccumType.FMA), AccumType.fromString(" FMA "));
    Assertions.assertEquals(Optional.of(AccumType.reduce(ReduceFunction.Max)), AccumType.fromString("Reduce(max)"));
    Assertions.assertTrue(AccumType.fromString("Reduce(xor)").isEmpty());
    Assertions.assertTrue(AccumType.fromString("Reduce").isEmpty());
    Assertions.assertTrue(AccumType.fromString("").isEmpty());
  }

  @Test
  void testToString() {
    for (var accType : new AccumType[] {AccumType.None, AccumType.FMA, AccumType.Unknown, AccumType.reduce(ReduceFunction.Add),
                                        AccumType.reduce(ReduceFunction.Other)}) {
      Assertions.assertEquals(Optional.of(accType), AccumType.fromString(accType.toString()));
    }
    Assertions.assertEquals("Reduce(mul)", AccumType.reduce(ReduceFunction.Mul).toString());
  }

  @Test
  void testAccumulator() {
    Assertions.assertFalse(AccumType.None.isAccumulator());
    Assertions.assertTrue(AccumType.FMA.isAccumulator());
    Assertions.assertTrue(AccumType.Unknown.isAccumulator());
    Assertions.assertEquals(Optional.of(ReduceFunction.Min), AccumType.reduce(ReduceFunction.Min).getReduceFunction());
    Assertions.assertTrue(AccumType.FMA.getReduceFunction().isEmpty());
    Assertions.assertThrows(NullPointerException.class, () -> AccumType.reduce(null));
  }

  @Test
  void testReduceFunction() {
    Assertions.assertEquals(Optional.of(ReduceFunction.Add), ReduceFunction.fromSerialName("add"));
    Assertions.assertTrue(ReduceFunction.fromSerialName("Add").isEmpty());
  }
}
