package jabuti.frontend;

import static jabuti.ast.Trees.comparison;
import static jabuti.ast.Trees.kw;
import static jabuti.ast.Trees.node;
import static jabuti.ast.Trees.operand;
import static jabuti.ast.Trees.presenceCheck;
import static jabuti.ast.Trees.sym;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import jabuti.ast.NodeKind;
import jabuti.common.exceptions.MalformedTreeError;
import jabuti.common.lang.MessageCondition;
import jabuti.common.lang.Operand.OperandKind;
import jabuti.common.lang.VarType;
import jabuti.common.lang.Variable;

public class MessageContentAnalyzerTest {

  private final MessageContentAnalyzer analyzer = new MessageContentAnalyzer();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Variable var(String base, VarType type, String... parts) {
    return new Variable(IdentifierNames.synthesize(base, parts), type);
  }

  @Test
  public void testPresenceCheck() {
    MessageCondition cond = analyzer.analyze(presenceCheck("invoice"), 3);
    assertTrue(cond.isPresenceCheck());
    assertFalse(cond.hasComparator());
    assertNull(cond.comparator());
    assertEquals(Arrays.asList(var("messageContent", VarType.BOOLEAN, "3")),
                 cond.variables());
    assertEquals("boolean", cond.variables().get(0).type().typeName());
  }

  @Test
  public void testVariableAgainstNumber() {
    MessageCondition cond = analyzer.analyze(comparison("amount", ">", "100"), 0);
    assertFalse(cond.isPresenceCheck());
    assertEquals(">", cond.comparator());
    assertEquals(Arrays.asList(var("amount", VarType.NUMBER)),
                 cond.variables());
    assertEquals("amount", cond.variables().get(0).name().camel());

    assertEquals(OperandKind.VARIABLE_REFERENCE, cond.left().kind());
    assertEquals(OperandKind.NUMERIC_LITERAL, cond.right().kind());
    assertEquals("100", cond.right().text());
    assertFalse(cond.right().hasVariable());
  }

  @Test
  public void testVariableAgainstQuotedText() {
    MessageCondition cond = analyzer.analyze(
                          comparison("status", "==", "\"DELIVERED\""), 2);
    assertEquals("==", cond.comparator());
    assertEquals(Arrays.asList(var("status", VarType.TEXT),
                               var("messageContent", VarType.TEXT, "2", "2")),
                 cond.variables());
    assertEquals("messageContent22", cond.variables().get(1).name().camel());
    assertEquals(OperandKind.QUOTED_LITERAL, cond.right().kind());
    assertEquals("\"DELIVERED\"", cond.right().text());
  }

  @Test
  public void testTypeComesFromComparator() {
    assertEquals(VarType.TEXT,
        analyzer.analyze(comparison("a", "!=", "b"), 0).variables().get(0).type());
    assertEquals(VarType.NUMBER,
        analyzer.analyze(comparison("a", "<=", "b"), 0).variables().get(0).type());
    // Quoted text compared with < is still a NUMBER comparison
    MessageCondition cond = analyzer.analyze(comparison("'x'", "<", "y"), 4);
    for (Variable v: cond.variables()) {
      assertEquals(VarType.NUMBER, v.type());
    }
    assertEquals("messageContent41", cond.variables().get(0).name().camel());
  }

  @Test
  public void testTwoQuotedLiterals() {
    MessageCondition cond = analyzer.analyze(
                          comparison("\"a\"", "==", "\"b\""), 0);
    assertEquals(Arrays.asList(var("messageContent", VarType.TEXT, "0", "1"),
                               var("messageContent", VarType.TEXT, "0", "2")),
                 cond.variables());
  }

  @Test
  public void testTwoNumericLiterals() {
    MessageCondition cond = analyzer.analyze(comparison("1", "<", "2.5"), 5);
    assertTrue(cond.variables().isEmpty());
    assertEquals("<", cond.comparator());
    assertEquals("1", cond.left().text());
    assertEquals("2.5", cond.right().text());
  }

  @Test
  public void testNegativeNumberIsLiteral() {
    MessageCondition cond = analyzer.analyze(comparison("balance", ">=", "-10"), 0);
    assertEquals(OperandKind.NUMERIC_LITERAL, cond.right().kind());
    assertEquals(1, cond.variables().size());
  }

  @Test
  public void testMalformedShape() {
    exception.expect(MalformedTreeError.class);
    exception.expectMessage("expected 4 or 6 children but had 5");
    analyzer.analyze(node(NodeKind.MESSAGE_CONTENT, kw("messageContent"),
                     sym("("), operand("a"), operand("b"), sym(")")), 0);
  }
}
