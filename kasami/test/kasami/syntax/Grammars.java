package kasami.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Grammars shared by the tests, and a brute-force enumeration of the
 * sentences a grammar derives.
 */
public class Grammars {

  /** S -&gt; NP VP, VP -&gt; V NP, NP -&gt; Det N | he | she, ... */
  public static Grammar sentences() throws GrammarException {
    return Grammar.builder()
        .start("S")
        .nonTerminal("S", "NP", "VP", "V", "Det", "N")
        .terminal("he", "she", "eats", "drinks", "a", "the", "cake", "beer")
        .rule("S", "NP", "VP")
        .rule("VP", "V", "NP")
        .rule("NP", "Det", "N")
        .rule("NP", "he")
        .rule("NP", "she")
        .rule("V", "eats")
        .rule("V", "drinks")
        .rule("Det", "a")
        .rule("Det", "the")
        .rule("N", "cake")
        .rule("N", "beer")
        .build();
  }

  /** a^n b^n, n &gt;= 0 */
  public static Grammar anbn() throws GrammarException {
    return Grammar.builder()
        .start("S")
        .nonTerminal("S")
        .terminal("a", "b")
        .rule("S", "a", "S", "b")
        .rule("S")
        .build();
  }

  /** balanced parentheses, empty string included */
  public static Grammar parens() throws GrammarException {
    return Grammar.builder()
        .start("S")
        .nonTerminal("S")
        .terminal("(", ")")
        .rule("S", "(", "S", ")", "S")
        .rule("S")
        .build();
  }

  /** left-recursive expressions with unit rules E -&gt; T -&gt; F */
  public static Grammar arithmetic() throws GrammarException {
    return Grammar.builder()
        .start("E")
        .nonTerminal("E", "T", "F")
        .terminal("+", "*", "(", ")", "x")
        .rule("E", "E", "+", "T")
        .rule("E", "T")
        .rule("T", "T", "*", "F")
        .rule("T", "F")
        .rule("F", "(", "E", ")")
        .rule("F", "x")
        .build();
  }

  /** nullable symbols in long bodies and inside other nullable symbols */
  public static Grammar nullables() throws GrammarException {
    return Grammar.builder()
        .start("S")
        .nonTerminal("S", "A", "B", "C")
        .terminal("a", "b", "c", "d")
        .rule("S", "A", "B", "C")
        .rule("S", "d")
        .rule("A", "a")
        .rule("A")
        .rule("B", "b")
        .rule("B")
        .rule("C", "A", "B")
        .rule("C", "c")
        .build();
  }

  /** unit cycle S -&gt; A -&gt; B -&gt; A with a self loop on B */
  public static Grammar unitCycle() throws GrammarException {
    return Grammar.builder()
        .start("S")
        .nonTerminal("S", "A", "B")
        .terminal("a", "b")
        .rule("S", "A")
        .rule("A", "B")
        .rule("A", "a")
        .rule("B", "A")
        .rule("B", "B")
        .rule("B", "b")
        .build();
  }

  /** ambiguous E -&gt; E + E | x */
  public static Grammar ambiguous() throws GrammarException {
    return Grammar.builder()
        .start("E")
        .nonTerminal("E")
        .terminal("+", "x")
        .rule("E", "E", "+", "E")
        .rule("E", "x")
        .build();
  }

  public static List<String> tokens(String... toks) {
    return Arrays.asList(toks);
  }

  /**
   * All terminal strings of length up to maxlen derived by each non-terminal,
   * computed as a fixpoint over the rules.
   */
  public static Map<Symbol,Set<List<String>>> language(Grammar g, int maxlen) {
    Map<Symbol,Set<List<String>>> lang = new HashMap<Symbol,Set<List<String>>>();
    for (Symbol nt : g.nonTerminals())
      lang.put(nt, new HashSet<List<String>>());
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Rule r : g.rules()) {
        List<List<String>> partial = new ArrayList<List<String>>();
        partial.add(Collections.<String>emptyList());
        for (Symbol s : r.body()) {
          List<List<String>> next = new ArrayList<List<String>>();
          for (List<String> prefix : partial) {
            if (s.isTerminal()) {
              if (prefix.size() < maxlen)
                next.add(concat(prefix, Collections.singletonList(s.name())));
            } else {
              for (List<String> suffix : lang.get(s)) {
                if (prefix.size() + suffix.size() <= maxlen)
                  next.add(concat(prefix, suffix));
              }
            }
          }
          partial = next;
        }
        if (lang.get(r.lhs()).addAll(partial))
          changed = true;
      }
    }
    return lang;
  }

  /** every sequence over the terminals of g of length 0..maxlen */
  public static List<List<String>> allSequences(Grammar g, int maxlen) {
    List<String> alphabet = new ArrayList<String>();
    for (Symbol t : g.terminals())
      alphabet.add(t.name());
    List<List<String>> all = new ArrayList<List<String>>();
    List<List<String>> level = new ArrayList<List<String>>();
    level.add(Collections.<String>emptyList());
    all.addAll(level);
    for (int len = 1; len <= maxlen; len ++) {
      List<List<String>> next = new ArrayList<List<String>>();
      for (List<String> prefix : level) {
        for (String t : alphabet)
          next.add(concat(prefix, Collections.singletonList(t)));
      }
      all.addAll(next);
      level = next;
    }
    return all;
  }

  private static List<String> concat(List<String> a, List<String> b) {
    List<String> c = new ArrayList<String>(a);
    c.addAll(b);
    return c;
  }
}
