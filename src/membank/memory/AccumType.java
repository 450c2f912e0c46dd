package membank.memory;

import java.util.Objects;
import java.util.Optional;

/**
 * Accumulation classification of a memory instance: not an accumulator, a reduction with a known operator,
 * a fused multiply-add accumulator, or unknown.
 */
public final class AccumType {
  public enum Kind { None, Reduce, FMA, Unknown }

  public static final AccumType None = new AccumType(Kind.None, null);
  public static final AccumType FMA = new AccumType(Kind.FMA, null);
  public static final AccumType Unknown = new AccumType(Kind.Unknown, null);

  private final Kind kind;
  private final ReduceFunction func;

  private AccumType(Kind kind, ReduceFunction func) {
    this.kind = kind;
    this.func = func;
  }

  public static AccumType reduce(ReduceFunction func) { return new AccumType(Kind.Reduce, Objects.requireNonNull(func)); }

  public Kind getKind() { return kind; }
  /** The reduction operator, present iff the kind is {@link Kind#Reduce}. */
  public Optional<ReduceFunction> getReduceFunction() { return Optional.ofNullable(func); }
  public boolean isAccumulator() { return kind != Kind.None; }

  /**
   * Parses the form written by {@link #toString()}, e.g. "None", "FMA", "Reduce(add)".
   */
  public static Optional<AccumType> fromString(String str) {
    String trimmed = str.trim();
    if (trimmed.startsWith("Reduce(") && trimmed.endsWith(")"))
      return ReduceFunction.fromSerialName(trimmed.substring(7, trimmed.length() - 1)).map(AccumType::reduce);
    for (AccumType plain : new AccumType[] {None, FMA, Unknown}) {
      if (plain.kind.name().equals(trimmed))
        return Optional.of(plain);
    }
    return Optional.empty();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, func);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    AccumType other = (AccumType)obj;
    return kind == other.kind && func == other.func;
  }
  @Override
  public String toString() {
    return kind == Kind.Reduce ? "Reduce(" + func.serialName + ")" : kind.name();
  }
}
