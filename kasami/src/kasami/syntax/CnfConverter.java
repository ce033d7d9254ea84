package kasami.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import kasami.util.CollectionUtils;

/**
 * Converts an arbitrary context-free grammar into Chomsky Normal Form.
 * <p>
 * The passes run in a fixed order, each relying on what the previous ones
 * established:
 * <ol>
 * <li>start isolation: a fresh start <code>@S0 -&gt; S</code></li>
 * <li>epsilon elimination</li>
 * <li>unit-production elimination</li>
 * <li>terminal isolation: terminals in long bodies are replaced by
 *     pre-terminals <code>@Tn -&gt; t</code></li>
 * <li>right-branching binarization with <code>@Bn</code> categories</li>
 * </ol>
 * Newly added categories are named {@link Symbol#MODPREFIX} plus a kind letter
 * and a counter; names already present in the input are skipped. A converter
 * instance is used for one conversion only.
 *
 * @date Oct 13, 2026
 */
public class CnfConverter {

  private CnfConverter(Grammar g) {
    _g = g;
    _start = g.start();
    _nts.addAll(g.nonTerminals());
    _rules.addAll(g.rules());
    for (Symbol s : g.nonTerminals())
      _used.add(s.name());
    for (Symbol s : g.terminals())
      _used.add(s.name());
  }

  /**
   * Returns a CNF grammar generating the same language as g. The input is
   * left untouched.
   */
  public static Grammar toCNF(Grammar g) {
    return new CnfConverter(g).convert();
  }

  private Grammar convert() {
    isolateStart();
    eliminateEpsilons();
    eliminateUnits();
    isolateTerminals();
    binarize();
    Grammar.Builder b = Grammar.builder().start(_start);
    for (Symbol nt : _nts)
      b.nonTerminal(nt);
    for (Symbol t : _g.terminals())
      b.terminal(t);
    for (Rule r : _rules)
      b.rule(r);
    try {
      // an empty language leaves the new start without rules
      return b.build(false);
    } catch (GrammarException ex) {
      throw new IllegalStateException("Normalization produced an invalid grammar", ex);
    }
  }

  /** PASS 1: the start symbol must not appear on any right-hand side */
  private void isolateStart() {
    Symbol s0 = fresh('S');
    List<Rule> rules = new ArrayList<Rule>();
    rules.add(new Rule(s0, _start));
    rules.addAll(_rules);
    _origStart = _start;
    _start = s0;
    _rules = rules;
  }

  /** PASS 2: remove epsilon rules, keeping at most one for the new start */
  private void eliminateEpsilons() {
    Set<Symbol> nullable = nullables(_rules);
    LinkedHashSet<Rule> rules = new LinkedHashSet<Rule>();
    for (Rule r : _rules) {
      if (!r.isEpsilon())
        expandNullables(r, nullable, rules);
    }
    if (nullable.contains(_start))
      rules.add(new Rule(_start, Collections.<Symbol>emptyList(), Collections.singletonList(_origStart)));
    _rules = new ArrayList<Rule>(rules);
  }

  /** non-terminals deriving the empty string, by fixpoint iteration */
  static Set<Symbol> nullables(List<Rule> rules) {
    Set<Symbol> nullable = new HashSet<Symbol>();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Rule r : rules) {
        if (nullable.contains(r.lhs()))
          continue;
        boolean all = true;
        for (Symbol s : r.body()) {
          if (!nullable.contains(s)) {
            all = false;
            break;
          }
        }
        if (all) {
          nullable.add(r.lhs());
          changed = true;
        }
      }
    }
    return nullable;
  }

  /** adds r and every non-empty variant with some nullable symbols deleted */
  private void expandNullables(Rule r, Set<Symbol> nullable, Set<Rule> out) {
    List<Integer> positions = new ArrayList<Integer>();
    for (int i = 0; i < r.arity(); i ++) {
      if (nullable.contains(r.rhs(i)))
        positions.add(i);
    }
    if (positions.size() >= 31)
      throw new IllegalStateException("Too many nullable symbols in rule " + r);
    int variants = 1 << positions.size();
    // mask bit i set: delete the symbol at positions[i]
    for (int mask = 0; mask < variants; mask ++) {
      List<Symbol> body = new ArrayList<Symbol>();
      int p = 0;
      for (int i = 0; i < r.arity(); i ++) {
        if (p < positions.size() && positions.get(p) == i) {
          boolean delete = (mask & (1 << p)) != 0;
          p ++;
          if (delete)
            continue;
        }
        body.add(r.rhs(i));
      }
      if (!body.isEmpty())
        out.add(new Rule(r.lhs(), body, r.chain()));
    }
  }

  /**
   * PASS 3: replace unit rules by the non-unit rules of every non-terminal
   * reachable through unit chains. Reachability is a BFS over unit edges, so
   * cycles and self-loops (A -&gt; A) terminate; the BFS path is stored as the
   * unit chain of the copied rule.
   */
  private void eliminateUnits() {
    LinkedHashMap<Symbol,List<Rule>> byHead = new LinkedHashMap<Symbol,List<Rule>>();
    for (Rule r : _rules)
      CollectionUtils.addToValueList(byHead, r.lhs(), r);
    LinkedHashSet<Rule> rules = new LinkedHashSet<Rule>();
    for (Symbol A : byHead.keySet()) {
      Map<Symbol,List<Symbol>> paths = unitClosure(A, byHead);
      for (Map.Entry<Symbol,List<Symbol>> e : paths.entrySet()) {
        for (Rule r : CollectionUtils.getValueList(byHead, e.getKey())) {
          if (r.isUnit())
            continue;
          rules.add(e.getKey().equals(A) ? r : r.lift(A, e.getValue()));
        }
      }
    }
    _rules = new ArrayList<Rule>(rules);
  }

  /** unit-reachable non-terminals of A (A included), each with its path */
  static Map<Symbol,List<Symbol>> unitClosure(Symbol A, Map<Symbol,List<Rule>> byHead) {
    LinkedHashMap<Symbol,List<Symbol>> paths = new LinkedHashMap<Symbol,List<Symbol>>();
    paths.put(A, Collections.<Symbol>emptyList());
    Queue<Symbol> q = new LinkedList<Symbol>();
    q.add(A);
    while (!q.isEmpty()) {
      Symbol B = q.poll();
      for (Rule r : CollectionUtils.getValueList(byHead, B)) {
        if (!r.isUnit())
          continue;
        Symbol C = r.rhs(0);
        if (paths.containsKey(C))
          continue;
        List<Symbol> path = new ArrayList<Symbol>(paths.get(B));
        path.add(C);
        paths.put(C, path);
        q.add(C);
      }
    }
    return paths;
  }

  /** PASS 4: make sure terminal symbols are only in unary rules */
  private void isolateTerminals() {
    LinkedHashMap<Symbol,Symbol> pts = new LinkedHashMap<Symbol,Symbol>();
    List<Rule> rules = new ArrayList<Rule>();
    for (Rule r : _rules) {
      if (r.arity() < 2) {
        rules.add(r);
        continue;
      }
      List<Symbol> body = new ArrayList<Symbol>();
      for (Symbol s : r.body()) {
        if (s.isTerminal()) {
          Symbol pt = pts.get(s);
          if (pt == null) {
            pt = fresh('T');
            pts.put(s, pt);
          }
          body.add(pt);
        } else {
          body.add(s);
        }
      }
      rules.add(new Rule(r.lhs(), body, r.chain()));
    }
    for (Map.Entry<Symbol,Symbol> e : pts.entrySet())
      rules.add(new Rule(e.getValue(), e.getKey()));
    _rules = rules;
  }

  /**
   * PASS 5: A -&gt; X1 X2 ... Xk becomes A -&gt; X1 @B1, @B1 -&gt; X2 @B2, ...,
   * @B(k-2) -&gt; X(k-1) Xk. The unit chain stays on the first rule.
   */
  private void binarize() {
    List<Rule> rules = new ArrayList<Rule>();
    for (Rule r : _rules) {
      if (r.arity() <= 2) {
        rules.add(r);
        continue;
      }
      Symbol current = r.lhs();
      List<Symbol> chain = r.chain();
      for (int i = 0; i < r.arity() - 2; i ++) {
        Symbol nt = fresh('B');
        rules.add(new Rule(current, Arrays.asList(r.rhs(i), nt), chain));
        chain = Collections.<Symbol>emptyList();
        current = nt;
      }
      rules.add(new Rule(current, Arrays.asList(r.rhs(r.arity() - 2), r.rhs(r.arity() - 1)), chain));
    }
    _rules = rules;
  }

  private Symbol fresh(char kind) {
    Integer x = _counters.get(kind);
    if (x == null)
      x = kind == 'S' ? 0 : 1;
    String name;
    do {
      name = "" + Symbol.MODPREFIX + kind + x;
      x ++;
    } while (_used.contains(name));
    _counters.put(kind, x);
    _used.add(name);
    Symbol nt = Symbol.syntheticNT(name);
    _nts.add(nt);
    return nt;
  }

  private final Grammar _g;
  private Symbol _start = null;
  private Symbol _origStart = null;
  private final LinkedHashSet<Symbol> _nts = new LinkedHashSet<Symbol>();
  private List<Rule> _rules = new ArrayList<Rule>();
  /** every symbol name taken so far, original and fresh */
  private final Set<String> _used = new HashSet<String>();
  private final HashMap<Character,Integer> _counters = new HashMap<Character,Integer>();
}
