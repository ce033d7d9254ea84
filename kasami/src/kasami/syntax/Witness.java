package kasami.syntax;

/**
 * Evidence stored with a chart entry: how its non-terminal derives the span.
 * Either a lexical match (A -&gt; a over one token), a binary split
 * (A -&gt; B C with B over [start, mid) and C over [mid, end)), or, for the
 * empty input only, the epsilon rule of the start symbol.
 *
 * @date Oct 14, 2026
 */
public final class Witness {

  public enum Type { LEXICAL, BINARY, EMPTY }

  private Witness(Type type, Rule rule, int mid) {
    _type = type;
    _rule = rule;
    _mid = mid;
  }

  public static Witness lexical(Rule r) {
    return new Witness(Type.LEXICAL, r, -1);
  }
  public static Witness binary(Rule r, int mid) {
    return new Witness(Type.BINARY, r, mid);
  }
  public static Witness empty(Rule r) {
    return new Witness(Type.EMPTY, r, -1);
  }

  public Type type() {
    return _type;
  }
  public boolean isLexical() {
    return _type == Type.LEXICAL;
  }
  public boolean isBinary() {
    return _type == Type.BINARY;
  }
  /** the CNF rule applied at this entry */
  public Rule rule() {
    return _rule;
  }
  /** absolute split position, -1 unless binary */
  public int mid() {
    return _mid;
  }
  /** matched terminal of a lexical witness */
  public Symbol terminal() {
    return isLexical() ? _rule.rhs(0) : null;
  }
  public Symbol left() {
    return isBinary() ? _rule.rhs(0) : null;
  }
  public Symbol right() {
    return isBinary() ? _rule.rhs(1) : null;
  }

  public String toString() {
    switch (_type) {
    case LEXICAL:
      return _rule.lhs() + " -> " + terminal();
    case BINARY:
      return _rule.lhs() + " -> " + left() + " " + right() + " @" + _mid;
    default:
      return _rule.toString();
    }
  }

  private final Type _type;
  private final Rule _rule;
  private final int _mid;
}
