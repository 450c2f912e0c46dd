package membank.memory;

import java.util.Optional;
import java.util.stream.Stream;

/** Reduction operator of an accumulating memory. */
public enum ReduceFunction {
  Add("add"),
  Mul("mul"),
  Min("min"),
  Max("max"),
  /** Any user-defined reduction */
  Other("other");

  public final String serialName;

  private ReduceFunction(String serialName) { this.serialName = serialName; }
  public static Optional<ReduceFunction> fromSerialName(String serialName) {
    return Stream.of(ReduceFunction.values()).filter(fn -> fn.serialName.equals(serialName)).findAny();
  }
}
