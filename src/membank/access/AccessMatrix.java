package membank.access;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import membank.metadata.Sym;

/**
 * Affine address of one unrolled instance of an access.
 * Row d of the matrix gives address dimension d as a linear combination of the surrounding iterators,
 * with the constant offset in the last column.
 */
public final class AccessMatrix {
  private final Sym access;
  private final int[][] matrix;
  private final List<Integer> unroll;

  /**
   * @param access the access node
   * @param matrix one row per memory dimension, each with one coefficient per iterator plus a trailing constant
   * @param unroll the unroll id of this instance
   */
  public AccessMatrix(Sym access, int[][] matrix, List<Integer> unroll) {
    if (matrix.length > 0) {
      int cols = matrix[0].length;
      if (cols < 1 || Arrays.stream(matrix).anyMatch(row -> row.length != cols))
        throw new IllegalArgumentException("access matrix rows must have equal, non-zero length");
    }
    this.access = access;
    this.matrix = Arrays.stream(matrix).map(int[]::clone).toArray(int[][]::new);
    this.unroll = List.copyOf(unroll);
  }

  /** Constant address, e.g. for accesses outside of any loop. */
  public static AccessMatrix constant(Sym access, List<Integer> addr, List<Integer> unroll) {
    return new AccessMatrix(access, addr.stream().map(a -> new int[] {a}).toArray(int[][]::new), unroll);
  }

  public Sym getAccess() { return access; }
  public List<Integer> getUnroll() { return unroll; }
  public int rank() { return matrix.length; }
  public int numIterators() { return matrix.length == 0 ? 0 : matrix[0].length - 1; }

  /**
   * Evaluates the address for given iterator values.
   * @param iters one value per iterator
   */
  public List<Integer> address(int... iters) {
    if (iters.length != numIterators())
      throw new IllegalArgumentException(String.format("expected %d iterator values, got %d", numIterators(), iters.length));
    return Arrays.stream(matrix).map(row -> {
      int sum = row[row.length - 1];
      for (int i = 0; i < iters.length; ++i)
        sum += row[i] * iters[i];
      return sum;
    }).toList();
  }

  /** Determines whether both instances always access the same address. */
  public boolean sameAddress(AccessMatrix other) { return Arrays.deepEquals(matrix, other.matrix); }

  @Override
  public int hashCode() {
    return Objects.hash(access, Arrays.deepHashCode(matrix), unroll);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    AccessMatrix other = (AccessMatrix)obj;
    return access.equals(other.access) && unroll.equals(other.unroll) && Arrays.deepEquals(matrix, other.matrix);
  }
  @Override
  public String toString() {
    return String.format("%s {%s} [%s]", access, unroll.stream().map(String::valueOf).collect(Collectors.joining(",")),
                         Arrays.stream(matrix).map(Arrays::toString).collect(Collectors.joining(", ")));
  }
}
