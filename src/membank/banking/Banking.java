package membank.banking;

import java.util.List;

/**
 * A banking strategy for (a group of dimensions of) a memory.
 * The set of strategies is closed; address decomposition switches over all of them.
 */
public sealed interface Banking permits ModBanking {
  /** Number of banks */
  int nBanks();
  /** Block size: number of consecutive addresses mapped to the same bank */
  int stride();
  /** Dimensions of the memory governed by this strategy, in order */
  List<Integer> dims();
  /** Per-dimension factors, one per entry of {@link #dims()} */
  List<Integer> alphas();

  /**
   * Computes the bank index of an address.
   * @param arith the arithmetic to evaluate with
   * @param addr the full address (one entry per memory dimension); only the entries in {@link #dims()} are used
   * @return the bank index in [0, nBanks)
   */
  <T> T bankSelect(IntLike<T> arith, List<T> addr);

  /** Shorthand for {@link #bankSelect(IntLike, List)} on constant addresses. */
  default int bankSelect(List<Integer> addr) { return bankSelect(IntLike.INT, addr); }
}
