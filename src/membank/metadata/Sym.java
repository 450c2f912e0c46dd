package membank.metadata;

/**
 * Handle of an IR value. Identity is the id assigned by the {@link MetadataStore} that created it.
 */
public final class Sym implements Comparable<Sym> {
  private final int id;
  private final String name;
  private final SymKind kind;

  Sym(int id, String name, SymKind kind) {
    this.id = id;
    this.name = name;
    this.kind = kind;
  }

  public int getId() { return id; }
  public String getName() { return name; }
  public SymKind getKind() { return kind; }

  public boolean isReader() { return kind == SymKind.Reader; }
  public boolean isWriter() { return kind == SymKind.Writer; }

  @Override
  public int compareTo(Sym other) {
    return Integer.compare(id, other.id);
  }
  @Override
  public int hashCode() {
    return Integer.hashCode(id);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    return id == ((Sym)obj).id;
  }
  @Override
  public String toString() {
    return String.format("x%d (%s)", id, name);
  }
}
