package kasami.syntax;

import static kasami.syntax.Grammars.tokens;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class ParserTest {

  private Parser _parser;

  @Before
  public void setUp() throws Exception {
    _parser = new Parser(CnfConverter.toCNF(Grammars.sentences()));
  }

  @Test
  public void acceptsSentence() throws ParserException {
    ParseResult result = _parser.parse(tokens("she", "eats", "a", "cake"));
    assertTrue(result.accepted());
    assertEquals("(S (NP she) (VP (V eats) (NP (Det a) (N cake))))", result.tree().toString());
    assertEquals("(@S0 (S (NP she) (VP (V eats) (NP (Det a) (N cake)))))", result.cnfTree().toString());
  }

  @Test
  public void rejectsIncompleteSentence() throws ParserException {
    ParseResult result = _parser.parse(tokens("she", "eats"));
    assertFalse(result.accepted());
    assertNull(result.tree());
    assertNull(result.cnfTree());
  }

  @Test
  public void rejectsUnknownToken() throws ParserException {
    ParseResult result = _parser.parse(tokens("quickly"));
    assertFalse(result.accepted());
    assertTrue(result.chart().cell(0, 1).isEmpty());
  }

  @Test
  public void rejectsEmptyInputWithoutEmptyRule() throws ParserException {
    assertFalse(_parser.parse(Collections.<String>emptyList()).accepted());
  }

  @Test
  public void acceptsEmptyInputWhenStartIsNullable() throws Exception {
    Parser parser = new Parser(CnfConverter.toCNF(Grammars.anbn()));
    ParseResult result = parser.parse(Collections.<String>emptyList());
    assertTrue(result.accepted());
    assertEquals("S", result.tree().toString());
    assertEquals("(@S0 S)", result.cnfTree().toString());
  }

  @Test
  public void chartCells() throws ParserException {
    CykChart chart = _parser.parse(tokens("she", "eats", "a", "cake")).chart();
    assertTrue(chart.cell(2, 2).contains(Symbol.NT("NP")));
    assertTrue(chart.cell(1, 3).contains(Symbol.NT("VP")));
    assertTrue(chart.cell(0, 4).contains(Symbol.NT("S")));
    assertTrue(chart.cell(0, 2).isEmpty());
    assertEquals(2, chart.witness(1, 4, Symbol.NT("VP")).mid());
    assertTrue(chart.witness(0, 1, Symbol.NT("NP")).isLexical());
  }

  @Test
  public void syntheticCategoriesAreRemoved() throws Exception {
    Parser parser = new Parser(CnfConverter.toCNF(Grammars.anbn()));
    ParseResult result = parser.parse(tokens("a", "a", "b", "b"));
    assertEquals("(S a (S a b) b)", result.tree().toString());
    assertEquals("(@S0 (S (@T1 a) (@B1 (S (@T1 a) (@T2 b)) (@T2 b))))", result.cnfTree().toString());
  }

  @Test
  public void unitChainsAreRestored() throws Exception {
    Parser parser = new Parser(CnfConverter.toCNF(Grammars.unitCycle()));
    assertEquals("(S (A (B b)))", parser.parse(tokens("b")).tree().toString());
    assertEquals("(S (A a))", parser.parse(tokens("a")).tree().toString());
  }

  @Test
  public void userSymbolsWithInternalPrefixAreKept() throws Exception {
    Grammar g = Grammar.builder()
        .start("S")
        .nonTerminal("S", "@S0", "@T1")
        .terminal("x", "y", "z")
        .rule("S", "@S0", "x", "y")
        .rule("@S0", "@T1")
        .rule("@T1", "z")
        .build();
    ParseResult result = Parser.parse(CnfConverter.toCNF(g), tokens("z", "x", "y"));
    assertEquals("(S (@S0 (@T1 z)) x y)", result.tree().toString());
  }

  @Test
  public void ambiguityIsResolvedDeterministically() throws Exception {
    Grammar cnf = CnfConverter.toCNF(Grammars.ambiguous());
    List<String> input = tokens("x", "+", "x", "+", "x");
    ParseResult first = new Parser(cnf).parse(input);
    ParseResult second = new Parser(cnf).parse(input);
    // leftmost split point first
    assertEquals("(E (E x) + (E (E x) + (E x)))", first.tree().toString());
    assertEquals(first.tree(), second.tree());
    assertEquals(first.cnfTree(), new Parser(cnf).parse(input).cnfTree());
  }

  @Test
  public void singleToken() throws Exception {
    Grammar g = Grammar.builder().start("S").nonTerminal("S").terminal("a").rule("S", "a").build();
    Parser parser = new Parser(CnfConverter.toCNF(g), 1);
    assertEquals("(S a)", parser.parse(tokens("a")).tree().toString());
    assertFalse(parser.parse(tokens("b")).accepted());
  }

  @Test
  public void inputTooLong() throws Exception {
    Parser parser = new Parser(CnfConverter.toCNF(Grammars.sentences()), 3);
    assertFalse(parser.parse(tokens("she", "eats", "a")).accepted());
    try {
      parser.parse(tokens("she", "eats", "a", "cake"));
      fail();
    } catch (ParserException ex) {
      assertEquals(ParserException.Kind.INPUT_TOO_LONG, ex.kind());
    }
    assertEquals(1, parser.stats().totalSentences);
  }

  @Test
  public void chartTooLarge() throws Exception {
    Parser parser = new Parser(CnfConverter.toCNF(Grammars.sentences()), 100000);
    List<String> input = new ArrayList<String>(Collections.nCopies(10000, "she"));
    try {
      parser.parse(input);
      fail();
    } catch (ParserException ex) {
      assertEquals(ParserException.Kind.INPUT_TOO_LONG, ex.kind());
    }
    assertEquals(0, parser.stats().totalSentences);
  }

  @Test
  public void grammarMustBeInNormalForm() throws Exception {
    try {
      new Parser(Grammars.anbn());
      fail();
    } catch (ParserException ex) {
      assertEquals(ParserException.Kind.NOT_CNF, ex.kind());
    }
    try {
      new Parser(null);
      fail();
    } catch (ParserException ex) {
      assertEquals(ParserException.Kind.EMPTY_GRAMMAR, ex.kind());
    }
  }

  @Test
  public void emptyLanguageRejectsEverything() throws Exception {
    Grammar g = Grammar.builder().start("S").nonTerminal("S").terminal("a")
        .rule("S", "S").rule("S", "S", "a").build();
    Parser parser = new Parser(CnfConverter.toCNF(g));
    assertFalse(parser.parse(Collections.<String>emptyList()).accepted());
    assertFalse(parser.parse(tokens("a")).accepted());
    assertFalse(parser.parse(tokens("a", "a")).accepted());
  }

  @Test
  public void statistics() throws ParserException {
    _parser.parse(tokens("she", "eats", "a", "cake"));
    _parser.parse(tokens("she", "eats"));
    Parser.Statistics stats = _parser.stats();
    assertEquals(2, stats.totalSentences);
    assertEquals(1, stats.successSentences);
    assertEquals(6, stats.totalTokens);
    assertEquals(4, stats.successTokens);
    assertEquals(2, stats.lastTokens);
    assertEquals(0.5, stats.coverage(), 1e-9);
    assertEquals(3.0, stats.averageSentenceLength(), 1e-9);
    assertTrue(stats.totalParseTime >= stats.lastParseTime);
  }

  @Test
  public void tokenize() {
    assertEquals(tokens("she", "eats", "a", "cake"), Parser.tokenize("  She eats\ta CAKE "));
    assertTrue(Parser.tokenize("   ").isEmpty());
  }
}
