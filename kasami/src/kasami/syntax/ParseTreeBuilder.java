package kasami.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Materializes the derivation recorded in a filled {@link CykChart}.
 * <p>
 * The result is CNF-shaped except for unit chains: a rule that unit
 * elimination lifted from A -&gt; B -&gt; body is expanded back into the
 * node chain A(B(...)). Synthetic nodes are kept; see
 * {@link Trees.SyntheticNodeStripper} for the collapsed form.
 *
 * @date Oct 15, 2026
 */
public class ParseTreeBuilder {

  public ParseTreeBuilder(CykChart chart) {
    _chart = chart;
  }

  /** tree for start over the whole input of length n */
  public static Tree<Symbol> build(CykChart chart, Symbol start, int n) {
    return new ParseTreeBuilder(chart).buildSubtree(0, n, start);
  }

  public Tree<Symbol> buildSubtree(int start, int end, Symbol A) {
    Witness w = _chart.witness(start, end, A);
    if (w == null)
      throw new IllegalStateException("No derivation of " + A + " over [" + start + "," + end + ")");
    List<Tree<Symbol>> children = new ArrayList<Tree<Symbol>>();
    if (w.isLexical()) {
      children.add(new Tree<Symbol>(w.terminal()));
    } else if (w.isBinary()) {
      children.add(buildSubtree(start, w.mid(), w.left()));
      children.add(buildSubtree(w.mid(), end, w.right()));
    }
    return unwind(w.rule(), children);
  }

  /** wraps children in the unit chain of r, innermost chain element first */
  static Tree<Symbol> unwind(Rule r, List<Tree<Symbol>> children) {
    List<Symbol> chain = r.chain();
    for (int i = chain.size() - 1; i >= 0; i --) {
      Tree<Symbol> node = new Tree<Symbol>(chain.get(i), children);
      children = new ArrayList<Tree<Symbol>>(Collections.singletonList(node));
    }
    return new Tree<Symbol>(r.lhs(), children);
  }

  private final CykChart _chart;
}
