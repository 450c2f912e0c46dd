package membank.banking;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ModBankingTest {

  @Test
  void testCyclicPattern() {
    // bank = (3r + 4c) mod 6 tiles as 0 4 2 / 3 1 5
    var banking = new ModBanking(6, 1, List.of(3, 4), List.of(0, 1));
    int[][] expected = {{0, 4, 2, 0, 4, 2}, {3, 1, 5, 3, 1, 5}};
    for (int r = 0; r < 2; ++r) {
      for (int c = 0; c < 6; ++c)
        Assertions.assertEquals(expected[r][c], banking.bankSelect(List.of(r, c)), "bank of (" + r + "," + c + ")");
    }
  }

  @Test
  void testBlockCyclic() {
    var banking = new ModBanking(2, 2, List.of(1), List.of(0));
    Assertions.assertEquals(List.of(0, 0, 1, 1, 0, 0, 1, 1), List.of(0, 1, 2, 3, 4, 5, 6, 7).stream().map(x -> banking.bankSelect(List.of(x))).toList());
  }

  @Test
  void testSelectsOwnDims() {
    // Strategy for dimension 1 of a rank 2 memory ignores dimension 0
    var banking = new ModBanking(3, 1, List.of(1), List.of(1));
    Assertions.assertEquals(2, banking.bankSelect(List.of(7, 5)));
    Assertions.assertEquals(2, banking.bankSelect(List.of(0, 2)));
  }

  @Test
  void testUnit() {
    var unit = ModBanking.unit(3);
    Assertions.assertEquals(1, unit.nBanks());
    Assertions.assertEquals(1, unit.stride());
    Assertions.assertEquals(List.of(0, 1, 2), unit.dims());
    Assertions.assertEquals(List.of(1, 1, 1), unit.alphas());
    Assertions.assertEquals(0, unit.bankSelect(List.of(4, 5, 6)));
  }

  @Test
  void testInvalid() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new ModBanking(0, 1, List.of(1), List.of(0)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new ModBanking(4, 0, List.of(1), List.of(0)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new ModBanking(4, 1, List.of(1, 2), List.of(0)));
  }

  @Test
  void testExpression() {
    var banking = new ModBanking(4, 1, List.of(1, 2), List.of(0, 1));
    Assertions.assertEquals("(a + (b * 2)) % 4", banking.bankSelect(IntLike.EXPR, List.of("a", "b")));
    var blocked = new ModBanking(2, 2, List.of(1), List.of(0));
    Assertions.assertEquals("(x / 2) % 2", blocked.bankSelect(IntLike.EXPR, List.of("x")));
  }

  @Test
  void testToString() {
    Assertions.assertEquals("Dims {0,1}: Cyclic: N=4, B=1, alpha=<1,2>", new ModBanking(4, 1, List.of(1, 2), List.of(0, 1)).toString());
    Assertions.assertEquals("Dims {1}: Block Cyclic: N=2, B=4, alpha=<3>", new ModBanking(2, 4, List.of(3), List.of(1)).toString());
  }

  @Test
  void testEquality() {
    Assertions.assertEquals(new ModBanking(4, 1, List.of(1, 2), List.of(0, 1)), new ModBanking(4, 1, List.of(1, 2), List.of(0, 1)));
    Assertions.assertEquals(new ModBanking(4, 1, List.of(1, 2), List.of(0, 1)).hashCode(),
                            new ModBanking(4, 1, List.of(1, 2), List.of(0, 1)).hashCode());
    Assertions.assertNotEquals(new ModBanking(4, 1, List.of(1, 2), List.of(0, 1)), new ModBanking(4, 2, List.of(1, 2), List.of(0, 1)));
  }
}
