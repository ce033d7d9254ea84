package kasami.grammar;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.javatuples.Pair;

import kasami.syntax.Grammar;
import kasami.syntax.GrammarException;
import kasami.syntax.ParserException;
import kasami.syntax.Rule;

/**
 * Reads grammars written one head per line:
 * <pre>
 * # comment
 * S  -&gt; NP VP
 * NP -&gt; Det N | he | she
 * X  -&gt; a X | &lt;eps&gt;
 * </pre>
 * Symbols appearing as a head are non-terminals, all other body symbols are
 * terminals. Unless given, the start symbol is the first head.
 */
public class GrammarReader {

  public final static String ARROW = "->";
  public final static String BAR = "|";

  public static Grammar load(String filename) throws IOException, ParserException, GrammarException {
    return load(filename, null);
  }

  public static Grammar load(String filename, String start) throws IOException, ParserException, GrammarException {
    InputStream in = new FileInputStream(filename);
    try {
      return read(new InputStreamReader(in, StandardCharsets.UTF_8), filename, start);
    } finally {
      in.close();
    }
  }

  /** loads a grammar bundled on the classpath, e.g. <code>grammars/english.cfg</code> */
  public static Grammar loadResource(String resource, String start) throws IOException, ParserException, GrammarException {
    InputStream in = GrammarReader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null)
      throw new IOException("Grammar resource not found: " + resource);
    try {
      return read(new InputStreamReader(in, StandardCharsets.UTF_8), resource, start);
    } finally {
      in.close();
    }
  }

  public static Grammar read(Reader reader, String source, String start) throws IOException, ParserException, GrammarException {
    List<Pair<String,List<String>>> rules = readRules(reader, source);
    if (rules.isEmpty())
      throw new ParserException(ParserException.Kind.EMPTY_GRAMMAR, "No rules in grammar " + source);
    return fromPairs(start != null ? start : rules.get(0).getValue0(), rules);
  }

  /** one (head, body) pair per alternative, in file order */
  public static List<Pair<String,List<String>>> readRules(Reader reader, String source) throws IOException, ParserException {
    BufferedReader br = new BufferedReader(reader);
    List<Pair<String,List<String>>> rules = new ArrayList<Pair<String,List<String>>>();
    String line = null;
    int lineno = 0;
    while ((line = br.readLine()) != null) {
      lineno ++;
      int hash = line.indexOf('#');
      if (hash >= 0)
        line = line.substring(0, hash);
      line = line.trim();
      if (line.isEmpty())
        continue;
      String [] toks = line.split("\\s+");
      if (toks.length < 2 || !toks[1].equals(ARROW))
        throw new ParserException(ParserException.Kind.INVALID_LINE,
            "Invalid line " + lineno + " in grammar " + source + ": expected '<head> -> <body>'");
      String head = toks[0];
      List<String> body = new ArrayList<String>();
      for (int i = 2; i <= toks.length; i ++) {
        if (i == toks.length || toks[i].equals(BAR)) {
          rules.add(Pair.with(head, alternative(body, lineno, source)));
          body = new ArrayList<String>();
        } else if (toks[i].equals(ARROW)) {
          throw new ParserException(ParserException.Kind.INVALID_LINE,
              "Invalid line " + lineno + " in grammar " + source + ": more than one '" + ARROW + "'");
        } else {
          body.add(toks[i]);
        }
      }
    }
    return rules;
  }

  private static List<String> alternative(List<String> body, int lineno, String source) throws ParserException {
    if (body.isEmpty())
      throw new ParserException(ParserException.Kind.INVALID_LINE,
          "Invalid line " + lineno + " in grammar " + source + ": empty alternative, write " + Rule.EPSILON);
    if (body.contains(Rule.EPSILON)) {
      if (body.size() > 1)
        throw new ParserException(ParserException.Kind.INVALID_LINE,
            "Invalid line " + lineno + " in grammar " + source + ": " + Rule.EPSILON + " must stand alone");
      return Collections.emptyList();
    }
    return body;
  }

  /**
   * Builds a grammar from (head, body) pairs: heads are the non-terminals,
   * every other body symbol is a terminal.
   */
  public static Grammar fromPairs(String start, List<Pair<String,List<String>>> rules) throws GrammarException {
    Set<String> nts = new LinkedHashSet<String>();
    for (Pair<String,List<String>> p : rules)
      nts.add(p.getValue0());
    Set<String> ts = new LinkedHashSet<String>();
    for (Pair<String,List<String>> p : rules) {
      for (String s : p.getValue1()) {
        if (!nts.contains(s))
          ts.add(s);
      }
    }
    Grammar.Builder b = Grammar.builder().start(start);
    b.nonTerminal(nts.toArray(new String[nts.size()]));
    b.terminal(ts.toArray(new String[ts.size()]));
    for (Pair<String,List<String>> p : rules)
      b.rule(p.getValue0(), p.getValue1());
    return b.build();
  }

  public static Pair<String,List<String>> rule(String head, String... body) {
    return Pair.with(head, (List<String>)new ArrayList<String>(Arrays.asList(body)));
  }
}
