package membank.banking;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Modular banking: bank = floor(alpha . A / B) mod N.
 * B == 1 is cyclic banking, B &gt; 1 is block-cyclic banking.
 */
public final class ModBanking implements Banking {
  private final int N;
  private final int B;
  private final List<Integer> alpha;
  private final List<Integer> dims;

  /**
   * @param N number of banks, at least 1
   * @param B block size (stride), at least 1
   * @param alpha per-dimension factors
   * @param dims the dimensions this strategy applies to, same length as alpha
   */
  public ModBanking(int N, int B, List<Integer> alpha, List<Integer> dims) {
    if (N < 1)
      throw new IllegalArgumentException("N must be at least 1, got " + N);
    if (B < 1)
      throw new IllegalArgumentException("B must be at least 1, got " + B);
    if (alpha.size() != dims.size())
      throw new IllegalArgumentException(String.format("alpha (%d entries) must match dims (%d entries)", alpha.size(), dims.size()));
    this.N = N;
    this.B = B;
    this.alpha = List.copyOf(alpha);
    this.dims = List.copyOf(dims);
  }

  /** Single-bank strategy over all dimensions of a memory with the given rank. */
  public static ModBanking unit(int rank) {
    return new ModBanking(1, 1, IntStream.range(0, rank).mapToObj(i -> 1).toList(), IntStream.range(0, rank).boxed().toList());
  }

  @Override
  public int nBanks() {
    return N;
  }
  @Override
  public int stride() {
    return B;
  }
  @Override
  public List<Integer> dims() {
    return dims;
  }
  @Override
  public List<Integer> alphas() {
    return alpha;
  }

  @Override
  public <T> T bankSelect(IntLike<T> arith, List<T> addr) {
    List<T> products = IntStream.range(0, alpha.size()).mapToObj(i -> arith.timesConst(addr.get(dims.get(i)), alpha.get(i))).toList();
    return arith.modConst(arith.divConst(arith.sumTree(products), B), N);
  }

  @Override
  public int hashCode() {
    return Objects.hash(N, B, alpha, dims);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    ModBanking other = (ModBanking)obj;
    return N == other.N && B == other.B && alpha.equals(other.alpha) && dims.equals(other.dims);
  }
  @Override
  public String toString() {
    String name = (B == 1) ? "Cyclic" : "Block Cyclic";
    return String.format("Dims {%s}: %s: N=%d, B=%d, alpha=<%s>", dims.stream().map(String::valueOf).collect(Collectors.joining(",")), name, N, B,
                         alpha.stream().map(String::valueOf).collect(Collectors.joining(",")));
  }
}
