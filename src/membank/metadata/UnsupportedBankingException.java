package membank.metadata;

/**
 * Thrown for banking shapes the address decomposition does not know how to handle
 * (anything other than one flat banking or one banking per dimension).
 */
public class UnsupportedBankingException extends BankingAnalysisException {
  private static final long serialVersionUID = 1L;

  private final int bankingGroups;
  private final int rank;

  public UnsupportedBankingException(Sym mem, int bankingGroups, int rank) {
    super(mem, String.format("Bank address calculation for arbitrary dim groupings unknown (%d banking groups, rank %d)%s", bankingGroups,
                             rank, mem == null ? "" : " for " + mem));
    this.bankingGroups = bankingGroups;
    this.rank = rank;
  }
  public UnsupportedBankingException(int bankingGroups, int rank) { this(null, bankingGroups, rank); }

  public int getBankingGroups() { return bankingGroups; }
  public int getRank() { return rank; }
}
