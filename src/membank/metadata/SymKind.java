package membank.metadata;

/**
 * Kind of IR value a {@link Sym} stands for.
 */
public enum SymKind {
  SRAM(true, false),
  RegFile(true, false),
  FIFO(true, false),
  LIFO(true, false),
  LUT(true, false),
  LineBuffer(true, false),
  Reg(true, false),
  ArgIn(false, true),
  ArgOut(false, true),
  HostIO(false, true),
  DRAM(false, true),
  StreamIn(false, true),
  StreamOut(false, true),
  /** Memory read, possibly vectorized by unrolling */
  Reader(false, false),
  /** Memory write, possibly vectorized by unrolling */
  Writer(false, false),
  /** Memory reset */
  Resetter(false, false),
  Other(false, false);

  public final boolean isLocalMem;
  public final boolean isRemoteMem;

  private SymKind(boolean isLocalMem, boolean isRemoteMem) {
    this.isLocalMem = isLocalMem;
    this.isRemoteMem = isRemoteMem;
  }

  public boolean isMem() { return isLocalMem || isRemoteMem; }
  public boolean isAccess() { return this == Reader || this == Writer || this == Resetter; }
}
