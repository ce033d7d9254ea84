package kasami.syntax;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;

import org.junit.Test;

public class SymbolTableTest {

  @Test
  public void idsFollowRegistrationOrder() {
    SymbolTable st = new SymbolTable();
    assertEquals(0, st.register(Symbol.NT("S")));
    assertEquals(1, st.register(Symbol.NT("NP")));
    assertEquals(0, st.register(Symbol.NT("S")));
    assertEquals(2, st.size());
    assertEquals(Symbol.NT("NP"), st.lookup(1));
    assertEquals(1, st.lookup(Symbol.NT("NP")));
  }

  @Test
  public void unknownSymbolsAndIds() {
    SymbolTable st = new SymbolTable(Arrays.asList(Symbol.NT("S"), Symbol.NT("VP")));
    assertEquals(-1, st.lookup(Symbol.NT("PP")));
    assertEquals(-1, st.lookup(Symbol.T("S")));
    assertNull(st.lookup(2));
    assertNull(st.lookup(-1));
    assertEquals(Arrays.asList(Symbol.NT("S"), Symbol.NT("VP")), st.symbols());
  }
}
