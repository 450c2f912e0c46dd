package membank.metadata;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static shape and kind queries on memory symbols.
 */
public class MemoryOps {
  private static final MetadataKey<List<Integer>> DIMS = new MetadataKey<>("Dims", List.class);
  private static final MetadataKey<Boolean> INITIAL_VALUES = new MetadataKey<>("InitialValues", Boolean.class);

  /** Sets the constant dimensions (and thereby the rank) of a memory. */
  public static void setDims(MetadataStore store, Sym mem, List<Integer> dims) {
    if (dims.stream().anyMatch(dim -> dim < 1))
      throw new IllegalArgumentException("dimensions must be positive: " + dims);
    store.put(mem, DIMS, List.copyOf(dims));
  }

  /** Returns the statically defined rank (number of dimensions) of the given memory. */
  public static int rank(MetadataStore store, Sym mem) {
    return store.get(mem, DIMS).map(List::size).orElseThrow(
        () -> new MissingMetadataException(mem, "Could not statically determine the rank of " + mem));
  }

  /** Returns the constant dimensions of the given memory. */
  public static List<Integer> constDims(MetadataStore store, Sym mem) {
    return store.get(mem, DIMS).orElseThrow(() -> new MissingMetadataException(mem, "Could not get constant dimensions of " + mem));
  }

  /** Returns the constant size of a one-dimensional memory. */
  public static int constSize(MetadataStore store, Sym mem) {
    List<Integer> dims = constDims(store, mem);
    if (dims.size() != 1)
      throw new MissingMetadataException(mem, "Could not get static size of " + mem + " with rank " + dims.size());
    return dims.get(0);
  }

  public static Set<Integer> readWidths(MetadataStore store, Sym mem) {
    return MemoryAccessOps.readers(store, mem).stream().map(rd -> AccessOps.width(store, rd)).collect(Collectors.toSet());
  }
  public static Set<Integer> writeWidths(MetadataStore store, Sym mem) {
    return MemoryAccessOps.writers(store, mem).stream().map(wr -> AccessOps.width(store, wr)).collect(Collectors.toSet());
  }

  public static boolean hasInitialValues(MetadataStore store, Sym mem) {
    return mem.getKind() == SymKind.Reg || mem.getKind() == SymKind.LUT || store.get(mem, INITIAL_VALUES).orElse(false);
  }
  public static void setHasInitialValues(MetadataStore store, Sym mem, boolean flag) { store.put(mem, INITIAL_VALUES, flag); }

  public static boolean isLocalMem(Sym mem) { return mem.getKind().isLocalMem; }
  public static boolean isRemoteMem(Sym mem) { return mem.getKind().isRemoteMem; }
  public static boolean isMem(Sym mem) { return mem.getKind().isMem(); }

  public static boolean isSRAM(Sym mem) { return mem.getKind() == SymKind.SRAM; }
  public static boolean isRegFile(Sym mem) { return mem.getKind() == SymKind.RegFile; }
  public static boolean isFIFO(Sym mem) { return mem.getKind() == SymKind.FIFO; }
  public static boolean isLIFO(Sym mem) { return mem.getKind() == SymKind.LIFO; }
  public static boolean isLUT(Sym mem) { return mem.getKind() == SymKind.LUT; }
  public static boolean isLineBuffer(Sym mem) { return mem.getKind() == SymKind.LineBuffer; }
  public static boolean isReg(Sym mem) {
    return mem.getKind() == SymKind.Reg || mem.getKind() == SymKind.ArgIn || mem.getKind() == SymKind.ArgOut ||
        mem.getKind() == SymKind.HostIO;
  }
  public static boolean isArgIn(Sym mem) { return mem.getKind() == SymKind.ArgIn; }
  public static boolean isArgOut(Sym mem) { return mem.getKind() == SymKind.ArgOut; }
  public static boolean isHostIO(Sym mem) { return mem.getKind() == SymKind.HostIO; }
  public static boolean isDRAM(Sym mem) { return mem.getKind() == SymKind.DRAM; }
  public static boolean isStreamIn(Sym mem) { return mem.getKind() == SymKind.StreamIn; }
  public static boolean isStreamOut(Sym mem) { return mem.getKind() == SymKind.StreamOut; }
}
