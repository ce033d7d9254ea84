package kasami.syntax;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Labeled ordered tree. Parse trees are <code>Tree&lt;Symbol&gt;</code>:
 * terminals are leaves, pre-terminals have one terminal child.
 */
public class Tree<L> implements Serializable {

  private static final long serialVersionUID = 1L;

  L label;
  List<Tree<L>> children;

  public Tree(L label) {
    this(label, Collections.<Tree<L>>emptyList());
  }

  public Tree(L label, List<Tree<L>> children) {
    this.label = label;
    this.children = children;
  }

  public L getLabel() {
    return label;
  }

  public List<Tree<L>> getChildren() {
    return children;
  }

  public void setChildren(List<Tree<L>> children) {
    this.children = children;
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  public boolean isPreTerminal() {
    return children.size() == 1 && children.get(0).isLeaf();
  }

  public List<L> getYield() {
    List<L> yield = new ArrayList<L>();
    appendYield(this, yield);
    return yield;
  }

  private static <L> void appendYield(Tree<L> tree, List<L> yield) {
    if (tree.isLeaf()) {
      yield.add(tree.getLabel());
      return;
    }
    for (Tree<L> child : tree.getChildren())
      appendYield(child, yield);
  }

  public List<Tree<L>> getPreTerminals() {
    List<Tree<L>> pts = new ArrayList<Tree<L>>();
    appendPreTerminals(this, pts);
    return pts;
  }

  private static <L> void appendPreTerminals(Tree<L> tree, List<Tree<L>> pts) {
    if (tree.isLeaf())
      return;
    if (tree.isPreTerminal()) {
      pts.add(tree);
      return;
    }
    for (Tree<L> child : tree.getChildren())
      appendPreTerminals(child, pts);
  }

  public int depth() {
    int max = 0;
    for (Tree<L> child : children)
      max = Math.max(max, child.depth());
    return max + 1;
  }

  /** bracketed form, e.g. <code>(S (NP she) (VP (V eats) ...))</code> */
  public String toString() {
    StringBuilder sb = new StringBuilder();
    toStringBuilder(sb);
    return sb.toString();
  }

  public void toStringBuilder(StringBuilder sb) {
    if (!isLeaf()) sb.append('(');
    sb.append(label);
    for (Tree<L> child : children) {
      sb.append(' ');
      child.toStringBuilder(sb);
    }
    if (!isLeaf()) sb.append(')');
  }

  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Tree)) return false;
    final Tree<?> tree = (Tree<?>) o;
    if (label != null ? !label.equals(tree.label) : tree.label != null) return false;
    return children.equals(tree.children);
  }

  public int hashCode() {
    int result = (label != null ? label.hashCode() : 0);
    result = 29 * result + children.hashCode();
    return result;
  }
}
