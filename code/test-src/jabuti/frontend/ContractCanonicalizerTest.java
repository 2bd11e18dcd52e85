package jabuti.frontend;

import static jabuti.ast.Trees.clause;
import static jabuti.ast.Trees.clauses;
import static jabuti.ast.Trees.comparison;
import static jabuti.ast.Trees.contract;
import static jabuti.ast.Trees.dates;
import static jabuti.ast.Trees.kw;
import static jabuti.ast.Trees.leaf;
import static jabuti.ast.Trees.name;
import static jabuti.ast.Trees.node;
import static jabuti.ast.Trees.onBreach;
import static jabuti.ast.Trees.parties;
import static jabuti.ast.Trees.presenceCheck;
import static jabuti.ast.Trees.sym;
import static jabuti.ast.Trees.terms;
import static jabuti.ast.Trees.timeout;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import jabuti.ast.ContractAST;
import jabuti.ast.NodeKind;
import jabuti.common.exceptions.MalformedTreeError;
import jabuti.common.lang.Clause;
import jabuti.common.lang.Contract;

public class ContractCanonicalizerTest {

  private final ContractCanonicalizer canonicalizer =
                                              new ContractCanonicalizer();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static ContractAST deliveryContract() {
    return contract("DeliveryHiring",
        dates("2023-01-01 00:00:00", "2023-12-31 23:59:59"),
        parties("\"Customer\"", "\"Carrier\""),
        clauses(
            clause("right", "requestDelivery", "application",
                terms(comparison("weight", "<=", "30"),
                      comparison("productValue", "<", "1000"),
                      timeout("86400")),
                onBreach("\"request outside the agreed limits\"")),
            clause("obligation", "deliver", "process",
                terms(presenceCheck("trackingCode")))));
  }

  @Test
  public void testContractHeader() {
    Contract c = canonicalizer.canonicalize(deliveryContract());
    assertEquals("DeliveryHiring", c.name());
    assertEquals("2023-01-01 00:00:00", c.beginDate());
    assertEquals("2023-12-31 23:59:59", c.dueDate());
    assertEquals("\"Customer\"", c.application());
    assertEquals("\"Carrier\"", c.process());
    assertTrue(c.variables().isEmpty());
  }

  @Test
  public void testClausesInSourceOrder() {
    Contract c = canonicalizer.canonicalize(deliveryContract());
    assertEquals(2, c.clauses().size());

    Clause first = c.clauses().get(0);
    assertEquals("RightRequestDelivery", first.name().pascal());
    assertEquals(3, first.terms().size());
    assertEquals(2, first.variables().size());
    assertEquals("RightRequestDeliveryTimeout2",
                 first.terms().get(2).name().pascal());

    Clause second = c.clauses().get(1);
    assertEquals("ObligationDeliver", second.name().pascal());
    assertEquals("process", second.rolePlayer());
    assertEquals("messageContent0", second.variables().get(0).name().camel());
  }

  @Test
  public void testNoClauses() {
    Contract c = canonicalizer.canonicalize(contract("Empty",
                      dates("2024-01-01", "2024-02-01"),
                      parties("a", "b")));
    assertTrue(c.clauses().isEmpty());
    assertEquals("a", c.application());
  }

  @Test
  public void testIdempotent() {
    ContractAST tree = deliveryContract();
    Contract first = canonicalizer.canonicalize(tree);
    Contract second = canonicalizer.canonicalize(tree);
    assertNotSame(first, second);
    assertEquals(first, second);
    assertEquals(first.toString(), second.toString());
    assertEquals(first, new ContractCanonicalizer().canonicalize(
                                                    deliveryContract()));
  }

  @Test
  public void testVariablesBlockIgnored() {
    ContractAST variables = node(NodeKind.VARIABLES, kw("variables"), sym("{"),
        node(NodeKind.VARIABLE_STATEMENT, name("heavy"), sym("="),
             node(NodeKind.TERM, comparison("weight", ">", "100"))),
        sym("}"));
    Contract c = canonicalizer.canonicalize(contract("WithVars", variables,
        clauses(clause("right", "r", "process", terms(timeout("5"))))));
    assertTrue(c.variables().isEmpty());
    assertEquals(1, c.clauses().size());
  }

  @Test
  public void testUnknownNodesSkipped() {
    ContractAST unknown = node(NodeKind.UNKNOWN,
        node(NodeKind.CLAUSE, kw("right")));
    ContractAST tree = contract("Skips", unknown,
        leaf(NodeKind.COMPARATOR, "=="),
        clauses(clause("right", "r", "process")));
    Contract c = canonicalizer.canonicalize(tree);
    assertEquals(1, c.clauses().size());
  }

  @Test
  public void testMissingNameAndSections() {
    ContractAST tree = node(NodeKind.CONTRACT, kw("contract"), sym("{"),
                            sym("}"));
    Contract c = canonicalizer.canonicalize(tree);
    assertEquals("", c.name());
    assertEquals("", c.beginDate());
    assertEquals("", c.dueDate());
    assertEquals("", c.application());
    assertEquals("", c.process());
  }

  @Test
  public void testLastDateWins() {
    ContractAST datesT = node(NodeKind.DATES, kw("dates"),
        node(NodeKind.BEGIN_DATE, kw("beginDate"), sym("="),
             leaf(NodeKind.DATE, "2024-01-01"),
             leaf(NodeKind.DATETIME, "2024-01-02 08:00:00")),
        node(NodeKind.DUE_DATE, kw("dueDate"), sym("=")));
    Contract c = canonicalizer.canonicalize(contract("Dates", datesT));
    assertEquals("2024-01-02 08:00:00", c.beginDate());
    assertEquals("", c.dueDate());
  }

  @Test
  public void testPartyWithoutIdentifier() {
    ContractAST partiesT = node(NodeKind.PARTIES,
        node(NodeKind.APPLICATION, kw("application")),
        node(NodeKind.PROCESS, kw("process"), sym("="),
             leaf(NodeKind.LITERAL, "p")));
    Contract c = canonicalizer.canonicalize(contract("P", partiesT));
    assertEquals("", c.application());
    assertEquals("p", c.process());
  }

  @Test
  public void testMalformedClauseAbortsCall() {
    ContractAST tree = contract("Broken", clauses(
        clause("right", "ok", "process"),
        node(NodeKind.CLAUSE, kw("right"), name("noRole"))));
    exception.expect(MalformedTreeError.class);
    canonicalizer.canonicalize(tree);
  }

  @Test
  public void testRootMustBeContract() {
    exception.expect(MalformedTreeError.class);
    exception.expectMessage("expected contract at root");
    canonicalizer.canonicalize(clauses());
  }
}
