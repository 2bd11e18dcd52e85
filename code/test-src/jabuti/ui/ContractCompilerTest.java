package jabuti.ui;

import static jabuti.ast.Trees.clause;
import static jabuti.ast.Trees.clauses;
import static jabuti.ast.Trees.contract;
import static jabuti.ast.Trees.kw;
import static jabuti.ast.Trees.node;
import static jabuti.ast.Trees.terms;
import static jabuti.ast.Trees.timeout;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import jabuti.ast.NodeKind;
import jabuti.common.Logging;
import jabuti.common.Settings;
import jabuti.common.exceptions.CompilerFatal;
import jabuti.common.exceptions.InvalidOptionException;
import jabuti.common.exceptions.MalformedTreeError;
import jabuti.common.lang.Contract;

public class ContractCompilerTest {

  private static final Logger logger = Logging.getJabutiLogger();

  @After
  public void resetSettings() {
    Settings.reset(Settings.DUMP_TREE);
  }

  @Test
  public void testCompile() {
    ContractCompiler compiler = new ContractCompiler(logger);
    Contract c = compiler.compile(contract("Simple",
        clauses(clause("right", "r", "process", terms(timeout("30"))))));
    assertEquals("Simple", c.name());
    assertEquals(1, c.clauses().get(0).terms().size());
  }

  @Test
  public void testCompileWithTreeDump() {
    Settings.set(Settings.DUMP_TREE, "true");
    Contract c = new ContractCompiler(logger).compile(contract("Dumped"));
    assertTrue(c.clauses().isEmpty());
  }

  @Test
  public void testMalformedTreeIsInternalError() {
    ContractCompiler compiler = new ContractCompiler(logger);
    try {
      compiler.compile(contract("Broken",
          clauses(node(NodeKind.CLAUSE, kw("right")))));
      fail("expected CompilerFatal");
    } catch (CompilerFatal e) {
      assertEquals(ExitCode.ERROR_INTERNAL.code(), e.exitCode);
      assertTrue(e.getCause() instanceof MalformedTreeError);
    }
  }

  @Test
  public void testBadSettingIsCommandError() {
    Settings.set(Settings.DUMP_TREE, "sometimes");
    try {
      new ContractCompiler(logger).compile(contract("C"));
      fail("expected CompilerFatal");
    } catch (CompilerFatal e) {
      assertEquals(ExitCode.ERROR_COMMAND.code(), e.exitCode);
      assertTrue(e.getCause() instanceof InvalidOptionException);
    }
  }

  @Test
  public void testFromSettings() throws InvalidOptionException {
    ContractCompiler compiler = ContractCompiler.fromSettings();
    assertEquals("C", compiler.compile(contract("C")).name());
  }
}
