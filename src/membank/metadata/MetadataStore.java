package membank.metadata;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Per-compilation-unit arena of IR values and their metadata.
 * Each symbol owns one slot per {@link MetadataKey}; {@link #put} overwrites any previous value of the same kind.
 * Not thread-safe. Analyses over independent memories must use disjoint symbols.
 */
public class MetadataStore {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final HashMap<Integer, HashMap<MetadataKey<?>, Object>> slots = new HashMap<>();
  private final HashMap<Integer, Sym> syms = new HashMap<>();
  private int nextId = 0;

  public MetadataStore() {}
  /**
   * Constructs a MetadataStore holding a copy of all symbols and metadata of another store.
   * Metadata values themselves are shared, which is fine as long as they are immutable.
   * @param other the store to copy
   */
  public MetadataStore(MetadataStore other) {
    other.slots.forEach((Integer id, HashMap<MetadataKey<?>, Object> val) -> this.slots.put(id, new HashMap<>(val)));
    this.syms.putAll(other.syms);
    this.nextId = other.nextId;
  }

  /**
   * Allocates a new symbol with a fresh id.
   * @param name human-readable name, does not need to be unique
   * @param kind the kind of IR value
   * @return the new symbol
   */
  public Sym newSym(String name, SymKind kind) {
    Sym sym = new Sym(nextId++, name, kind);
    syms.put(sym.getId(), sym);
    return sym;
  }

  /** Looks up a symbol by id. */
  public Optional<Sym> lookupSym(int id) { return Optional.ofNullable(syms.get(id)); }

  /**
   * Reads the most recent value of a metadata kind.
   * @return the value, or an empty Optional if it was never set (or removed)
   */
  public <T> Optional<T> get(Sym sym, MetadataKey<T> key) {
    HashMap<MetadataKey<?>, Object> symSlots = slots.get(sym.getId());
    if (symSlots == null)
      return Optional.empty();
    return Optional.ofNullable(key.cast(symSlots.get(key)));
  }

  /**
   * Sets a metadata value, replacing any previous value of the same kind.
   */
  public <T> void put(Sym sym, MetadataKey<T> key, T value) {
    if (value == null)
      throw new IllegalArgumentException("metadata value must not be null, use remove instead");
    if (!syms.containsKey(sym.getId()))
      throw new IllegalArgumentException("symbol " + sym + " does not belong to this store");
    Object prev = slots.computeIfAbsent(sym.getId(), id -> new HashMap<>()).put(key, value);
    if (prev != null && !prev.equals(value))
      logger.trace("Overwriting {} of {}", key, sym);
  }

  /** Removes a metadata value. Returns true if there was one. */
  public boolean remove(Sym sym, MetadataKey<?> key) {
    HashMap<MetadataKey<?>, Object> symSlots = slots.get(sym.getId());
    return symSlots != null && symSlots.remove(key) != null;
  }

  /**
   * Copies all metadata of one symbol onto another (e.g. when a pass mirrors a node).
   * Existing values of dst are overwritten where src has a value of the same kind.
   */
  public void mirror(Sym src, Sym dst) {
    HashMap<MetadataKey<?>, Object> symSlots = slots.get(src.getId());
    if (symSlots == null)
      return;
    for (Map.Entry<MetadataKey<?>, Object> entry : symSlots.entrySet())
      slots.computeIfAbsent(dst.getId(), id -> new HashMap<>()).put(entry.getKey(), entry.getValue());
  }

  /** Returns the number of symbols allocated so far. */
  public int size() { return syms.size(); }
}
