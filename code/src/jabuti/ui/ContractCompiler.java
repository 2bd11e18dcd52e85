/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package jabuti.ui;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.apache.log4j.Logger;

import jabuti.ast.ContractAST;
import jabuti.common.Logging;
import jabuti.common.Settings;
import jabuti.common.exceptions.CompilerFatal;
import jabuti.common.exceptions.InvalidOptionException;
import jabuti.common.lang.Contract;
import jabuti.frontend.ContractCanonicalizer;

/**
 * This is the main entry point to the canonicalization stage of the
 * compiler.  Any failure in here is reported as an internal compiler error:
 * the syntax tree is expected to have been validated already.
 */
public class ContractCompiler {

  private final Logger logger;
  private final ContractCanonicalizer canonicalizer;

  public ContractCompiler(Logger logger) {
    this(logger, new ContractCanonicalizer());
  }

  public ContractCompiler(Logger logger, ContractCanonicalizer canonicalizer) {
    super();
    this.logger = logger;
    this.canonicalizer = canonicalizer;
  }

  /**
   * Create a compiler configured from system properties, with logging set
   * up as requested there.
   * @throws InvalidOptionException if a setting has an invalid value
   */
  public static ContractCompiler fromSettings() throws InvalidOptionException {
    Settings.initProperties();
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return new ContractCompiler(Logging.setupLogging(logfile, trace));
  }

  /**
   * Build the canonical contract for a parsed contract document.
   * @param tree root node of the syntax tree
   * @return the canonical contract
   * @throws CompilerFatal if canonicalization failed
   */
  public Contract compile(ContractAST tree) {
    try {
      logger.debug("Canonicalization starting");

      if (Settings.getBoolean(Settings.DUMP_TREE)) {
        logger.debug(tree.printTree());
      }

      Contract contract = canonicalizer.canonicalize(tree);

      logger.debug("Canonicalization done: " + contract.clauses().size()
                   + " clauses");
      return contract;
    }
    catch (CompilerFatal e) {
      // Rethrow
      throw e;
    }
    catch (InvalidOptionException e) {
      logger.error("jabuti error:");
      logger.error(e.getMessage());
      throw new CompilerFatal(ExitCode.ERROR_COMMAND.code(), e);
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new CompilerFatal(ExitCode.ERROR_INTERNAL.code(), e);
    }
    catch (RuntimeException e) {
      reportInternalError(e);
      throw new CompilerFatal(ExitCode.ERROR_INTERNAL.code(), e);
    }
  }

  private void reportInternalError(Throwable e) {
    logger.error("JABUTI INTERNAL ERROR: " + e.getMessage());
    logger.error("Please report this");
    if (compilerDebug()) {
      logger.error(stackTrace(e));
    }
  }

  private static boolean compilerDebug() {
    try {
      return Settings.getBoolean(Settings.COMPILER_DEBUG);
    } catch (InvalidOptionException e) {
      // Reporting an error already, so fall back to full output
      return true;
    }
  }

  private static String stackTrace(Throwable e) {
    StringWriter sw = new StringWriter();
    e.printStackTrace(new PrintWriter(sw));
    return sw.toString();
  }
}
