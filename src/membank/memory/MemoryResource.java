package membank.memory;

/**
 * Target-specific physical memory primitive a memory instance is mapped to (e.g. block RAM, LUT RAM).
 * Only carried along here; interpreted by physical mapping passes.
 */
public record MemoryResource(String name) {
  @Override
  public String toString() {
    return name;
  }
}
