package jabuti.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import jabuti.common.lang.VarType;
import jabuti.common.lang.Variable;

public class ClauseVariablesTest {

  private static Variable var(String name, VarType type) {
    return new Variable(IdentifierNames.synthesize(name), type);
  }

  @Test
  public void testInsertionOrder() {
    ClauseVariables vars = new ClauseVariables();
    vars.merge(var("weight", VarType.NUMBER));
    vars.merge(var("address", VarType.TEXT));
    vars.merge(var("paid", VarType.BOOLEAN));
    assertEquals(Arrays.asList(var("weight", VarType.NUMBER),
                               var("address", VarType.TEXT),
                               var("paid", VarType.BOOLEAN)),
                 vars.values());
  }

  @Test
  public void testDuplicateOverwritesInPlace() {
    ClauseVariables vars = new ClauseVariables();
    assertNull(vars.merge(var("amount", VarType.NUMBER)));
    vars.merge(var("status", VarType.TEXT));
    Variable replaced = vars.merge(var("amount", VarType.TEXT));

    assertEquals(var("amount", VarType.NUMBER), replaced);
    assertEquals(2, vars.size());
    assertEquals(Arrays.asList(var("amount", VarType.TEXT),
                               var("status", VarType.TEXT)),
                 vars.values());
  }

  @Test
  public void testKeyedByCamelName() {
    ClauseVariables vars = new ClauseVariables();
    // Amount and amount render to the same camel name
    vars.mergeAll(Arrays.asList(var("Amount", VarType.NUMBER),
                                var("amount", VarType.NUMBER)));
    assertEquals(1, vars.size());
    assertTrue(vars.contains("amount"));
    assertEquals("amount", vars.values().get(0).name().snake());
  }
}
