package membank.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;
import membank.banking.Banking;
import membank.banking.IntLike;
import membank.banking.ModBanking;
import membank.metadata.MemoryOps;
import membank.metadata.MetadataStore;
import membank.metadata.Sym;
import membank.metadata.UnsupportedBankingException;

/**
 * Banking configuration of one physical duplicate of a memory, as used outside of the banking analysis.
 * <p>
 * The banking list either holds a single entry (flat banking over all dimensions)
 * or one entry per dimension (hierarchical banking). Address decomposition rejects any other shape.
 */
public final class Memory {
  /** Period of a dimension whose banking factor is zero; larger than any dimension size. */
  static final int INFINITE_PERIOD = Integer.MAX_VALUE;

  private final List<Banking> banking;
  private final int depth;
  private final AccumType accType;
  private final MemoryResource resourceType;

  public Memory(List<Banking> banking, int depth, AccumType accType) { this(banking, depth, accType, null); }
  /**
   * @param banking banking strategies, one for flat banking or one per dimension
   * @param depth buffer depth, at least 1
   * @param accType accumulator classification
   * @param resourceType target resource, or null to use the target default
   */
  public Memory(List<Banking> banking, int depth, AccumType accType, MemoryResource resourceType) {
    if (banking.isEmpty())
      throw new IllegalArgumentException("banking must not be empty");
    if (depth < 1)
      throw new IllegalArgumentException("depth must be at least 1, got " + depth);
    this.banking = List.copyOf(banking);
    this.depth = depth;
    this.accType = Objects.requireNonNull(accType);
    this.resourceType = resourceType;
  }

  /** Unbanked, unbuffered memory of the given rank. */
  public static Memory unit(int rank) { return new Memory(List.of(ModBanking.unit(rank)), 1, AccumType.None); }

  public List<Banking> getBanking() { return banking; }
  public int getDepth() { return depth; }
  public AccumType getAccType() { return accType; }
  public Optional<MemoryResource> getResourceType() { return Optional.ofNullable(resourceType); }
  /** Returns the resource type, or defaultResource if none was chosen. */
  public MemoryResource resource(MemoryResource defaultResource) { return resourceType != null ? resourceType : defaultResource; }
  public Memory withResourceType(MemoryResource resourceType) { return new Memory(banking, depth, accType, resourceType); }

  public boolean isFlat() { return banking.size() == 1; }

  /** Number of banks of each banking group. */
  public List<Integer> nBanks() { return banking.stream().map(Banking::nBanks).toList(); }
  public int totalBanks() { return banking.stream().mapToInt(Banking::nBanks).reduce(1, (a, b) -> a * b); }

  /**
   * Number of words per bank, assuming addresses are evenly divided across banks.
   * @param dims the memory dimensions
   */
  public int bankDepth(List<Integer> dims) {
    int result = 1;
    for (Banking bank : banking) {
      int size = bank.dims().stream().mapToInt(dims::get).reduce(1, (a, b) -> a * b);
      result *= ceilDiv(size, bank.nBanks());
    }
    return result;
  }

  /** Bank index of the address within each banking group. */
  public <T> List<T> bankSelects(IntLike<T> arith, List<T> addr) { return banking.stream().map(bank -> bank.bankSelect(arith, addr)).toList(); }
  public List<Integer> bankSelects(List<Integer> addr) { return bankSelects(IntLike.INT, addr); }

  /**
   * Computes the offset of an address within its bank.
   * <p>
   * For flat banking, offsets are assigned per "offset chunk": the address space is fenced into chunks along the
   * periods P_i = NB / gcd(NB, alpha_i) of the banking pattern (P_i infinite for alpha_i == 0), so that each
   * chunk holds every bank exactly once. If a single dimension already has period NB, it alone spans all banks
   * and the other dimensions get period 1.
   * The chunk index is flattened across dimensions, then combined with the position inside the B-sized block:
   * <pre>
   *   ofs = chunk * B^D + sum_t (x_t mod B) * B^(D-t-1)
   * </pre>
   * For alpha = 3,4, N = 6, B = 1 the pattern below repeats with P = 2,3:
   * <pre>
   *   0 4 2 | 0 4 2
   *   3 1 5 | 3 1 5
   * </pre>
   * For per-dimension banking, each dimension is split independently:
   * ofs_t = floor(x_t / (b_t n_t)) b_t + x_t mod b_t.
   *
   * @param arith the arithmetic to evaluate with
   * @param dims the static dimensions of the memory
   * @param addr the address, one entry per dimension
   * @return the offset within the bank
   * @throws UnsupportedBankingException if the banking is neither flat nor per-dimension
   */
  public <T> T bankOffset(IntLike<T> arith, List<Integer> dims, List<T> addr) {
    return bankOffset(arith, dims, addr, null);
  }
  public int bankOffset(List<Integer> dims, List<Integer> addr) { return bankOffset(IntLike.INT, dims, addr); }
  /**
   * Computes {@link #bankOffset(IntLike, List, List)} using the constant dimensions of mem.
   * @throws UnsupportedBankingException carrying mem if the banking is neither flat nor per-dimension
   */
  public <T> T bankOffset(IntLike<T> arith, MetadataStore store, Sym mem, List<T> addr) {
    return bankOffset(arith, MemoryOps.constDims(store, mem), addr, mem);
  }

  private <T> T bankOffset(IntLike<T> arith, List<Integer> dims, List<T> addr, Sym mem) {
    int D = dims.size();
    if (addr.size() != D)
      throw new IllegalArgumentException(String.format("address has %d entries, memory has rank %d", addr.size(), D));
    if (banking.size() == 1)
      return flatBankOffset(arith, banking.get(0), dims, addr);
    if (banking.size() == D)
      return hierarchicalBankOffset(arith, dims, addr);
    throw new UnsupportedBankingException(mem, banking.size(), D);
  }

  private static <T> T flatBankOffset(IntLike<T> arith, Banking bank, List<Integer> w, List<T> addr) {
    int D = w.size();
    int b = bank.stride();
    int nb = bank.nBanks() * b;

    int[] alpha = new int[D];
    for (int i = 0; i < bank.dims().size(); ++i)
      alpha[bank.dims().get(i)] = bank.alphas().get(i);

    int[] P = IntStream.range(0, D).map(i -> alpha[i] == 0 ? INFINITE_PERIOD : nb / gcd(nb, Math.abs(alpha[i]))).toArray();
    int fullPeriodDim = IntStream.range(0, D).filter(i -> P[i] == nb).findFirst().orElse(-1);
    if (fullPeriodDim >= 0) {
      for (int i = 0; i < D; ++i) {
        if (i != fullPeriodDim)
          P[i] = 1;
      }
    }

    List<T> chunkTerms = new ArrayList<>(D);
    List<T> intrablockTerms = new ArrayList<>(D);
    for (int t = 0; t < D; ++t) {
      int weight = 1;
      for (int k = t + 1; k < D; ++k)
        weight *= ceilDiv(w.get(k), P[k]);
      if (P[t] != INFINITE_PERIOD)
        chunkTerms.add(arith.timesConst(arith.divConst(addr.get(t), P[t]), weight));
      intrablockTerms.add(arith.timesConst(arith.modConst(addr.get(t), b), pow(b, D - t - 1)));
    }
    T chunk = arith.sumTree(chunkTerms);
    T intrablock = arith.sumTree(intrablockTerms);
    return arith.plus(arith.timesConst(chunk, pow(b, D)), intrablock);
  }

  private <T> T hierarchicalBankOffset(IntLike<T> arith, List<Integer> w, List<T> addr) {
    int D = w.size();
    List<T> terms = new ArrayList<>(D);
    for (int t = 0; t < D; ++t) {
      int b = banking.get(t).stride();
      int n = banking.get(t).nBanks();
      int weight = 1;
      for (int k = t + 1; k < D; ++k)
        weight *= ceilDiv(w.get(k), banking.get(k).nBanks());
      T x = addr.get(t);
      T ofs = arith.plus(arith.timesConst(arith.divConst(x, b * n), b), arith.modConst(x, b));
      terms.add(arith.timesConst(ofs, weight));
    }
    return arith.sumTree(terms);
  }

  static int gcd(int a, int b) { return b == 0 ? a : gcd(b, a % b); }
  static int ceilDiv(int a, int b) { return -Math.floorDiv(-a, b); }
  static int pow(int base, int exp) {
    int result = 1;
    for (int i = 0; i < exp; ++i)
      result *= base;
    return result;
  }

  @Override
  public int hashCode() {
    return Objects.hash(banking, depth, accType, resourceType);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Memory other = (Memory)obj;
    return depth == other.depth && banking.equals(other.banking) && accType.equals(other.accType) &&
        Objects.equals(resourceType, other.resourceType);
  }
  @Override
  public String toString() {
    return String.format("Memory(banking: %s <%s>, depth: %d, accum: %s%s)", banking, isFlat() ? "Flat" : "Hierarchical", depth, accType,
                         resourceType != null ? ", resource: " + resourceType : "");
  }
}
