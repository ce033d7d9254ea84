package kasami.syntax;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Production rule <code>lhs -&gt; rhs</code>. An empty right-hand side is an
 * epsilon rule.
 * <p>
 * A rule may also carry a unit chain: the non-terminals that unit-production
 * elimination skipped. <code>A -&gt; B -&gt; C -&gt; x y</code> is kept as
 * <code>A -&gt; x y</code> with chain <code>[B, C]</code>. The chain is
 * ignored by {@link #equals(Object)}.
 *
 * @date Oct 12, 2026
 */
public class Rule implements Serializable {

  private static final long serialVersionUID = 4902245258139401162L;

  public Rule(Symbol lhs, Symbol... rhs) {
    this(lhs, Arrays.asList(rhs), Collections.<Symbol>emptyList());
  }
  public Rule(Symbol lhs, List<Symbol> rhs) {
    this(lhs, rhs, Collections.<Symbol>emptyList());
  }
  public Rule(Symbol lhs, List<Symbol> rhs, List<Symbol> chain) {
    if (lhs == null || lhs.isTerminal())
      throw new IllegalArgumentException("Rule head must be a non-terminal: " + lhs);
    _lhs = lhs;
    _rhs = rhs.toArray(new Symbol[rhs.size()]);
    _chain = Collections.unmodifiableList(new ArrayList<Symbol>(chain));
  }
  public Symbol lhs() {
    return _lhs;
  }
  /** returns a copy of the right-hand side */
  public Symbol[] rhs() {
    return _rhs.clone();
  }
  public Symbol rhs(int i) {
    return _rhs[i];
  }
  public List<Symbol> body() {
    return Collections.unmodifiableList(Arrays.asList(_rhs));
  }
  public List<Symbol> chain() {
    return _chain;
  }
  public int arity() {
    return _rhs.length;
  }
  public boolean isEpsilon() {
    return _rhs.length == 0;
  }
  /** A -&gt; B with B a non-terminal */
  public boolean isUnit() {
    return _rhs.length == 1 && _rhs[0].isNonTerminal();
  }
  /** A -&gt; a with a a terminal */
  public boolean isLexical() {
    return _rhs.length == 1 && _rhs[0].isTerminal();
  }
  public boolean isBinary() {
    return _rhs.length == 2 &&
        _rhs[0].isNonTerminal() && _rhs[1].isNonTerminal();
  }
  /** same rule with a different head and the unit chain prepended */
  Rule lift(Symbol lhs, List<Symbol> prefix) {
    List<Symbol> chain = new ArrayList<Symbol>(prefix);
    chain.addAll(_chain);
    return new Rule(lhs, Arrays.asList(_rhs), chain);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (! (o instanceof Rule))
      return false;
    Rule that = (Rule)o;
    return this._lhs.equals(that._lhs) &&
        Arrays.equals(this._rhs, that._rhs);
  }

  @Override
  public int hashCode() {
    final int prime = 97;
    int result = 1;
    result = prime * result + _lhs.hashCode();
    for (Symbol c : _rhs) {
      result = prime * result + c.hashCode();
    }
    return result;
  }

  public String toString() {
    StringBuffer sb = new StringBuffer();
    sb.append(_lhs);
    sb.append(" ->");
    if (_rhs.length == 0)
      sb.append(" ").append(EPSILON);
    for (Symbol r : _rhs) {
      sb.append(" ");
      sb.append(r);
    }
    return sb.toString();
  }

  public final static String EPSILON = "<eps>";

  private final Symbol _lhs;
  private final Symbol [] _rhs;
  private final List<Symbol> _chain;
}
