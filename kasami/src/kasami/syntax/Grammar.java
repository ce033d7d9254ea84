package kasami.syntax;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.javatuples.Pair;

import kasami.util.CollectionUtils;
import kasami.util.StringUtils;

/**
 * Context-Free Grammar.
 * <p>
 * Immutable once built; instances are only obtained from {@link Builder},
 * whose {@link Builder#build()} runs {@link #validate()}. Rules keep their
 * insertion order, and so do the symbol sets, which makes every pass over a
 * grammar deterministic.
 *
 * @date Oct 12, 2026
 */
public class Grammar implements Serializable {

  private static final long serialVersionUID = 3779488872217828209L;

  private Grammar(Symbol start, Set<Symbol> nts, Set<Symbol> ts, List<Rule> rules) {
    _start = start;
    _nts = Collections.unmodifiableSet(new LinkedHashSet<Symbol>(nts));
    _ts = Collections.unmodifiableSet(new LinkedHashSet<Symbol>(ts));
    _rules = Collections.unmodifiableList(new ArrayList<Rule>(rules));
    indexRules();
  }

  /** Start symbol */
  private final Symbol _start;
  /** Non-terminals */
  private final Set<Symbol> _nts;
  /** Terminals */
  private final Set<Symbol> _ts;
  /** List of rules */
  private final List<Rule> _rules;
  /** Rules indexed by their LHS */
  private final LinkedHashMap<Symbol,List<Rule>> _idx_rules = new LinkedHashMap<Symbol,List<Rule>>();
  /** List of pre-terminal rules */
  private final List<Rule> _trules = new ArrayList<Rule>();
  /** List of binary rules */
  private final List<Rule> _birules = new ArrayList<Rule>();
  /** List of chain/unary rules */
  private final List<Rule> _chainrules = new ArrayList<Rule>();
  /** List of epsilon rules */
  private final List<Rule> _epsrules = new ArrayList<Rule>();

  private void indexRules() {
    for (Rule r : _rules) {
      CollectionUtils.addToValueList(_idx_rules, r.lhs(), r);
      if (r.isEpsilon())
        _epsrules.add(r);
      else if (r.isLexical())
        _trules.add(r);
      else if (r.isUnit())
        _chainrules.add(r);
      else if (r.isBinary())
        _birules.add(r);
    }
  }

  /**
   * Checks that every head and body symbol is declared with its kind, and
   * that the start symbol is a declared non-terminal with at least one rule.
   */
  public void validate() throws GrammarException {
    validate(true);
  }

  void validate(boolean requireStartRules) throws GrammarException {
    if (_start == null)
      throw new GrammarException(GrammarException.Kind.UNREACHABLE_START, null,
          "No start symbol defined");
    if (!_nts.contains(_start))
      throw new GrammarException(GrammarException.Kind.UNDECLARED_SYMBOL, _start.name(),
          "Start symbol " + _start + " is not a declared non-terminal");
    for (Rule r : _rules) {
      if (!_nts.contains(r.lhs()))
        throw new GrammarException(GrammarException.Kind.UNDECLARED_SYMBOL, r.lhs().name(),
            "Undeclared non-terminal " + r.lhs() + " in rule " + r);
      for (Symbol s : r.body()) {
        if (!(s.isTerminal() ? _ts : _nts).contains(s))
          throw new GrammarException(GrammarException.Kind.UNDECLARED_SYMBOL, s.name(),
              "Undeclared " + (s.isTerminal() ? "terminal " : "non-terminal ") + s + " in rule " + r);
      }
    }
    if (requireStartRules && rules(_start).isEmpty())
      throw new GrammarException(GrammarException.Kind.UNREACHABLE_START, _start.name(),
          "Start symbol " + _start + " has no rules");
  }

  /**
   * Every rule is A -&gt; a, A -&gt; B C, or an epsilon rule of the start
   * symbol; if the start has an epsilon rule it may not occur on any
   * right-hand side.
   */
  public boolean isCnf() {
    for (Rule r : _rules) {
      if (r.isLexical() || r.isBinary())
        continue;
      if (r.isEpsilon() && r.lhs().equals(_start))
        continue;
      return false;
    }
    if (hasEmptyRule(_start)) {
      for (Rule r : _rules) {
        if (r.body().contains(_start))
          return false;
      }
    }
    return true;
  }

  public boolean hasEmptyRule(Symbol lhs) {
    for (Rule r : rules(lhs)) {
      if (r.isEpsilon())
        return true;
    }
    return false;
  }

  public Symbol start() {
    return _start;
  }
  public Set<Symbol> nonTerminals() {
    return _nts;
  }
  public Set<Symbol> terminals() {
    return _ts;
  }
  public List<Rule> rules() {
    return _rules;
  }
  public List<Rule> rules(Symbol lhs) {
    return CollectionUtils.getValueList(_idx_rules, lhs);
  }
  /** non-terminals with at least one rule, in order of their first rule */
  public Set<Symbol> heads() {
    return Collections.unmodifiableSet(_idx_rules.keySet());
  }
  public List<Rule> trules() {
    return Collections.unmodifiableList(_trules);
  }
  public List<Rule> birules() {
    return Collections.unmodifiableList(_birules);
  }
  public List<Rule> chainrules() {
    return Collections.unmodifiableList(_chainrules);
  }
  public List<Rule> epsrules() {
    return Collections.unmodifiableList(_epsrules);
  }

  /** one line per head: <code>A -&gt; x y | z</code> */
  public String toString() {
    StringBuffer sb = new StringBuffer();
    for (Symbol lhs : heads()) {
      List<String> alts = new ArrayList<String>();
      for (Rule r : rules(lhs))
        alts.add(r.isEpsilon() ? Rule.EPSILON : StringUtils.join(r.body(), " "));
      sb.append(lhs).append(" -> ").append(StringUtils.join(alts, " | ")).append("\n");
    }
    return sb.toString();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Collects declarations and rules. Rules given by name are resolved on
   * {@link #build()}: a body name declared as a non-terminal becomes one,
   * anything else is taken as a terminal.
   */
  public static class Builder {

    public Builder start(String name) {
      return start(Symbol.NT(name));
    }
    public Builder start(Symbol s) {
      _start = s;
      return this;
    }
    public Builder nonTerminal(String... names) {
      for (String name : names)
        _nts.add(Symbol.NT(name));
      return this;
    }
    public Builder nonTerminal(Symbol s) {
      _nts.add(s);
      return this;
    }
    public Builder terminal(String... names) {
      for (String name : names)
        _ts.add(Symbol.T(name));
      return this;
    }
    public Builder terminal(Symbol s) {
      _ts.add(s);
      return this;
    }
    public Builder rule(String lhs, String... rhs) {
      List<String> body = new ArrayList<String>();
      Collections.addAll(body, rhs);
      return rule(lhs, body);
    }
    public Builder rule(String lhs, List<String> rhs) {
      _pending.add(_rules.size());
      _named.add(Pair.with(lhs, (List<String>)new ArrayList<String>(rhs)));
      _rules.add(null);
      return this;
    }
    public Builder rule(Symbol lhs, Symbol... rhs) {
      return rule(new Rule(lhs, rhs));
    }
    public Builder rule(Rule r) {
      _rules.add(r);
      return this;
    }

    public Grammar build() throws GrammarException {
      return build(true);
    }

    Grammar build(boolean requireStartRules) throws GrammarException {
      List<Rule> rules = new ArrayList<Rule>(_rules);
      for (int i = 0; i < _pending.size(); i ++) {
        Pair<String,List<String>> p = _named.get(i);
        List<Symbol> body = new ArrayList<Symbol>();
        for (String name : p.getValue1()) {
          Symbol nt = Symbol.NT(name);
          body.add(_nts.contains(nt) ? nt : Symbol.T(name));
        }
        rules.set(_pending.get(i), new Rule(Symbol.NT(p.getValue0()), body));
      }
      Grammar g = new Grammar(_start, _nts, _ts, rules);
      g.validate(requireStartRules);
      return g;
    }

    private Symbol _start = null;
    private final LinkedHashSet<Symbol> _nts = new LinkedHashSet<Symbol>();
    private final LinkedHashSet<Symbol> _ts = new LinkedHashSet<Symbol>();
    private final List<Rule> _rules = new ArrayList<Rule>();
    /** slots in _rules still to be resolved from names */
    private final List<Integer> _pending = new ArrayList<Integer>();
    private final List<Pair<String,List<String>>> _named = new ArrayList<Pair<String,List<String>>>();
  }
}
