package membank.metadata;

import membank.access.Ctrl;

/**
 * Per-access inputs to banking and port assignment, written by the access analysis.
 */
public class AccessOps {
  private static final MetadataKey<Sym> MEMORY = new MetadataKey<>("AccessedMemory", Sym.class);
  private static final MetadataKey<Ctrl> PARENT = new MetadataKey<>("ParentCtrl", Ctrl.class);
  private static final MetadataKey<Integer> WIDTH = new MetadataKey<>("AccessWidth", Integer.class);
  private static final MetadataKey<Integer> TIME_STEP = new MetadataKey<>("TimeStep", Integer.class);

  /** Returns the memory accessed by the given access. */
  public static Sym memory(MetadataStore store, Sym access) {
    return store.get(access, MEMORY).orElseThrow(() -> new MissingMetadataException(access, "No memory defined for access " + access));
  }
  public static void setMemory(MetadataStore store, Sym access, Sym mem) { store.put(access, MEMORY, mem); }

  /** Returns the controller the access is scheduled in. */
  public static Ctrl parent(MetadataStore store, Sym access) {
    return store.get(access, PARENT).orElseThrow(() -> new MissingMetadataException(access, "No parent controller defined for " + access));
  }
  public static void setParent(MetadataStore store, Sym access, Ctrl ctrl) { store.put(access, PARENT, ctrl); }

  /** Number of words accessed in parallel by one unrolled instance of the access. Defaults to 1. */
  public static int width(MetadataStore store, Sym access) { return store.get(access, WIDTH).orElse(1); }
  public static void setWidth(MetadataStore store, Sym access, int width) {
    if (width < 1)
      throw new IllegalArgumentException("width must be at least 1, got " + width);
    store.put(access, WIDTH, width);
  }

  /** Cycle offset of the access relative to the start of its controller's body. Defaults to 0. */
  public static int timeStep(MetadataStore store, Sym access) { return store.get(access, TIME_STEP).orElse(0); }
  public static void setTimeStep(MetadataStore store, Sym access, int timeStep) { store.put(access, TIME_STEP, timeStep); }
}
