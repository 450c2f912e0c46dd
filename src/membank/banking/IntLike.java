package membank.banking;

import java.util.List;

/**
 * Integer arithmetic over a value representation, so that banking formulas can be evaluated on constants
 * ({@link #INT}) or turned into HDL expression text ({@link #EXPR}).
 * @param <T> the value representation
 */
public interface IntLike<T> {
  T constant(int value);
  T plus(T a, T b);
  T times(T a, T b);
  /** Floor division. Operands are non-negative in all banking formulas. */
  T div(T a, T b);
  T mod(T a, T b);

  default T timesConst(T a, int b) { return times(a, constant(b)); }
  default T divConst(T a, int b) { return div(a, constant(b)); }
  default T modConst(T a, int b) { return mod(a, constant(b)); }

  /**
   * Sums the values as a balanced tree, keeping the depth of the generated adder logarithmic.
   * @param values the values to sum
   * @return the sum, or constant 0 if values is empty
   */
  default T sumTree(List<T> values) {
    if (values.isEmpty())
      return constant(0);
    if (values.size() == 1)
      return values.get(0);
    int half = values.size() / 2;
    return plus(sumTree(values.subList(0, half)), sumTree(values.subList(half, values.size())));
  }

  /** Plain integer evaluation. */
  IntLike<Integer> INT = new IntLike<Integer>() {
    @Override
    public Integer constant(int value) {
      return value;
    }
    @Override
    public Integer plus(Integer a, Integer b) {
      return a + b;
    }
    @Override
    public Integer times(Integer a, Integer b) {
      return a * b;
    }
    @Override
    public Integer div(Integer a, Integer b) {
      return Math.floorDiv(a, b);
    }
    @Override
    public Integer mod(Integer a, Integer b) {
      return Math.floorMod(a, b);
    }
  };

  /** Verilog-style expression text, with folding of trivial constants. */
  IntLike<String> EXPR = new ExprIntLike();
}
