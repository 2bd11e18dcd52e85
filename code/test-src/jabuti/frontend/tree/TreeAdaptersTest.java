package jabuti.frontend.tree;

import static jabuti.ast.Trees.clause;
import static jabuti.ast.Trees.comparison;
import static jabuti.ast.Trees.kw;
import static jabuti.ast.Trees.leaf;
import static jabuti.ast.Trees.name;
import static jabuti.ast.Trees.node;
import static jabuti.ast.Trees.onBreach;
import static jabuti.ast.Trees.presenceCheck;
import static jabuti.ast.Trees.rolePlayer;
import static jabuti.ast.Trees.sym;
import static jabuti.ast.Trees.timeout;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import jabuti.ast.ContractAST;
import jabuti.ast.NodeKind;
import jabuti.common.exceptions.MalformedTreeError;

public class TreeAdaptersTest {

  @Test
  public void testLiterals() {
    assertTrue(Literals.isNumeric("100"));
    assertTrue(Literals.isNumeric("-2"));
    assertTrue(Literals.isNumeric("3.5"));
    assertFalse(Literals.isNumeric("weight"));
    assertFalse(Literals.isNumeric("\"100\""));
    assertFalse(Literals.isNumeric(""));
    assertFalse(Literals.isNumeric("1e5"));
    assertFalse(Literals.isNumeric("0x10"));

    assertTrue(Literals.isQuoted("\"Express\""));
    assertTrue(Literals.isQuoted("'Express'"));
    assertFalse(Literals.isQuoted("Express"));
  }

  @Test
  public void testClauseDecl() {
    ClauseDecl decl = ClauseDecl.fromAST(clause("obligation", "payFee",
                                                "application"));
    assertEquals("obligation", decl.getKind());
    assertEquals("payFee", decl.getLocalName());
    assertEquals("application", decl.getRolePlayer().getParty());
    assertEquals("application", decl.getRolePlayer().getOperation());
  }

  @Test(expected=MalformedTreeError.class)
  public void testClauseDeclWithoutName() {
    ClauseDecl.fromAST(node(NodeKind.CLAUSE, kw("right"), sym("{"),
                            rolePlayer("process"), sym("}")));
  }

  @Test(expected=MalformedTreeError.class)
  public void testRolePlayerWithoutIdentifier() {
    RolePlayer.fromAST(node(NodeKind.ROLE_PLAYER, kw("rolePlayer"),
                            sym("=")));
  }

  @Test
  public void testOnBreach() {
    assertEquals("\"late\"", OnBreach.message(onBreach("\"late\"")));
    assertEquals("", OnBreach.message(node(NodeKind.ON_BREACH,
                                           kw("onBreach"), sym("("))));
  }

  @Test
  public void testTimeoutOperation() {
    TimeoutOperation numeric = TimeoutOperation.fromAST(timeout("60"));
    assertTrue(numeric.isNumeric());
    assertEquals("60", numeric.getValue());

    TimeoutOperation named = TimeoutOperation.fromAST(timeout("deadline"));
    assertFalse(named.isNumeric());
    assertEquals("deadline", named.getValue());

    assertFalse(TimeoutOperation.fromAST(timeout("1e5")).isNumeric());

    TimeoutOperation empty = TimeoutOperation.fromAST(
        node(NodeKind.TIMEOUT, kw("timeout"), sym("=")));
    assertNull(empty.getOperand());
    assertFalse(empty.isNumeric());
    assertEquals("", empty.getValue());
  }

  @Test
  public void testMessageContentShapes() {
    MessageContentOperation check =
        MessageContentOperation.fromAST(presenceCheck("order"));
    assertTrue(check.isPresenceCheck());
    assertEquals("order", check.getArgument().text());
    assertNull(check.getComparator());

    MessageContentOperation cmp =
        MessageContentOperation.fromAST(comparison("weight", ">=", "10"));
    assertFalse(cmp.isPresenceCheck());
    assertNull(cmp.getArgument());
    assertEquals("weight", cmp.getLeft().text());
    assertEquals(">=", cmp.getComparator());
    assertEquals("10", cmp.getRight().text());
  }

  @Test(expected=MalformedTreeError.class)
  public void testMessageContentWrongArity() {
    MessageContentOperation.fromAST(node(NodeKind.MESSAGE_CONTENT,
        kw("messageContent"), sym("("), name("a"), name("b"), sym(")")));
  }

  @Test
  public void testDatesAndParties() {
    ContractAST begin = node(NodeKind.BEGIN_DATE, kw("beginDate"), sym("="),
                             leaf(NodeKind.DATE, "2024-03-01"));
    assertEquals("2024-03-01", Dates.dateLiteral(begin));
    assertNull(Dates.dateLiteral(node(NodeKind.DUE_DATE, kw("dueDate"))));

    ContractAST app = node(NodeKind.APPLICATION, kw("application"), sym("="),
                           leaf(NodeKind.LITERAL, "\"Store\""));
    assertEquals("\"Store\"", Parties.roleIdentifier(app));
    assertEquals("", Parties.roleIdentifier(
                        node(NodeKind.PROCESS, kw("process"))));
  }
}
