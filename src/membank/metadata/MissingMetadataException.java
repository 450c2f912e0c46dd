package membank.metadata;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Thrown when required metadata (rank, dimensions, duplicates, instance, padding, dispatch, ports) was never set on a symbol.
 */
public class MissingMetadataException extends BankingAnalysisException {
  private static final long serialVersionUID = 1L;

  private final List<Integer> uid;

  public MissingMetadataException(Sym sym, String message) {
    super(sym, message);
    this.uid = null;
  }
  public MissingMetadataException(Sym sym, List<Integer> uid, String message) {
    super(sym, message + " {" + formatUID(uid) + "}");
    this.uid = List.copyOf(uid);
  }

  /** Returns the unroll id of the access the lookup was made for, if any. */
  public Optional<List<Integer>> getUID() { return Optional.ofNullable(uid); }

  static String formatUID(List<Integer> uid) { return uid.stream().map(String::valueOf).collect(Collectors.joining(",")); }
}
