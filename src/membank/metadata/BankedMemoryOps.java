package membank.metadata;

import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import membank.memory.Memory;

/**
 * Banking results of memories.
 * <p>
 * Before unrolling, a memory carries one or more duplicates (physical copies, e.g. to provide read bandwidth).
 * After unrolling, each memory symbol has exactly one duplicate, its instance.
 */
public class BankedMemoryOps {
  private static final MetadataKey<List<Memory>> DUPLICATES = new MetadataKey<>("Duplicates", List.class);
  private static final MetadataKey<List<Integer>> PADDING = new MetadataKey<>("Padding", List.class);
  private static final MetadataKey<Boolean> WRITE_BUFFER = new MetadataKey<>("EnableWriteBuffer", Boolean.class);
  private static final MetadataKey<Boolean> NON_BUFFER = new MetadataKey<>("EnableNonBuffer", Boolean.class);

  /** Flag set by the user to allow buffered writes across metapipeline stages. Defaults to false. */
  public static boolean isWriteBuffer(MetadataStore store, Sym mem) { return store.get(mem, WRITE_BUFFER).orElse(false); }
  public static void setWriteBuffer(MetadataStore store, Sym mem, boolean flag) { store.put(mem, WRITE_BUFFER, flag); }

  /** Flag set by the user to disable N-buffering of a memory. Defaults to false. */
  public static boolean isNonBuffer(MetadataStore store, Sym mem) { return store.get(mem, NON_BUFFER).orElse(false); }
  public static void setNonBuffer(MetadataStore store, Sym mem, boolean flag) { store.put(mem, NON_BUFFER, flag); }

  // Pre-unrolling duplicates

  public static Optional<List<Memory>> getDuplicates(MetadataStore store, Sym mem) { return store.get(mem, DUPLICATES); }
  public static List<Memory> duplicates(MetadataStore store, Sym mem) {
    return getDuplicates(store, mem).orElseThrow(() -> new MissingMetadataException(mem, "No duplicates defined for " + mem));
  }
  public static void setDuplicates(MetadataStore store, Sym mem, List<Memory> duplicates) {
    if (duplicates.isEmpty())
      throw new IllegalArgumentException("a memory needs at least one duplicate");
    store.put(mem, DUPLICATES, List.copyOf(duplicates));
  }

  // Padding chosen by the banking analysis, one entry per dimension

  public static Optional<List<Integer>> getPadding(MetadataStore store, Sym mem) { return store.get(mem, PADDING); }
  public static List<Integer> padding(MetadataStore store, Sym mem) {
    return getPadding(store, mem).orElseThrow(() -> new MissingMetadataException(mem, "No padding defined for " + mem));
  }
  public static void setPadding(MetadataStore store, Sym mem, List<Integer> padding) { store.put(mem, PADDING, List.copyOf(padding)); }

  // Post-unrolling instance

  public static Optional<Memory> getInstance(MetadataStore store, Sym mem) {
    return getDuplicates(store, mem).flatMap(dups -> dups.stream().findFirst());
  }
  /**
   * Returns the single duplicate of an unrolled memory.
   * @throws MissingMetadataException if no duplicates are defined
   * @throws AnalysisInvariantException if the memory still has several duplicates
   */
  public static Memory instance(MetadataStore store, Sym mem) {
    List<Memory> dups = getDuplicates(store, mem).orElseThrow(() -> new MissingMetadataException(mem, "No instance defined for " + mem));
    if (dups.size() != 1)
      throw new AnalysisInvariantException(mem, "Expected exactly one instance for " + mem + " after unrolling, found " + dups.size());
    return dups.get(0);
  }
  public static void setInstance(MetadataStore store, Sym mem, Memory inst) { store.put(mem, DUPLICATES, List.of(inst)); }

  /** Returns the padded dimensions (constant dimensions plus padding, if any). */
  public static List<Integer> paddedDims(MetadataStore store, Sym mem) {
    List<Integer> dims = MemoryOps.constDims(store, mem);
    Optional<List<Integer>> pad = getPadding(store, mem);
    if (pad.isEmpty())
      return dims;
    if (pad.get().size() != dims.size())
      throw new AnalysisInvariantException(mem, String.format("Padding of %s has %d entries, rank is %d", mem, pad.get().size(), dims.size()));
    return IntStream.range(0, dims.size()).mapToObj(i -> dims.get(i) + pad.get().get(i)).toList();
  }
}
