package membank.banking;

/**
 * {@link IntLike} producing Verilog-style expression strings.
 * Constant operands are folded, and multiplications by 1, additions of 0 and divisions by 1 are dropped.
 * Non-trivial sub-expressions are always parenthesized.
 */
class ExprIntLike implements IntLike<String> {

  private static boolean isConst(String expr) { return expr.matches("-?[0-9]+"); }
  private static int constVal(String expr) { return Integer.parseInt(expr); }
  private static String paren(String expr) {
    if (isConst(expr) || expr.matches("[A-Za-z_][A-Za-z0-9_\\[\\]]*"))
      return expr;
    return "(" + expr + ")";
  }

  @Override
  public String constant(int value) {
    return Integer.toString(value);
  }

  @Override
  public String plus(String a, String b) {
    if (isConst(a) && isConst(b))
      return constant(constVal(a) + constVal(b));
    if (a.equals("0"))
      return b;
    if (b.equals("0"))
      return a;
    return paren(a) + " + " + paren(b);
  }

  @Override
  public String times(String a, String b) {
    if (isConst(a) && isConst(b))
      return constant(constVal(a) * constVal(b));
    if (a.equals("0") || b.equals("0"))
      return "0";
    if (a.equals("1"))
      return b;
    if (b.equals("1"))
      return a;
    return paren(a) + " * " + paren(b);
  }

  @Override
  public String div(String a, String b) {
    if (b.equals("0"))
      throw new ArithmeticException("division by constant zero");
    if (isConst(a) && isConst(b))
      return constant(Math.floorDiv(constVal(a), constVal(b)));
    if (b.equals("1") || a.equals("0"))
      return a;
    return paren(a) + " / " + paren(b);
  }

  @Override
  public String mod(String a, String b) {
    if (b.equals("0"))
      throw new ArithmeticException("modulo by constant zero");
    if (isConst(a) && isConst(b))
      return constant(Math.floorMod(constVal(a), constVal(b)));
    if (b.equals("1") || a.equals("0"))
      return "0";
    return paren(a) + " % " + paren(b);
  }
}
