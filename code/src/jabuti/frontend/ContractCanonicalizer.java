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
package jabuti.frontend;

import java.util.ArrayList;
import java.util.List;

import jabuti.ast.ContractAST;
import jabuti.ast.NodeKind;
import jabuti.common.exceptions.MalformedTreeError;
import jabuti.common.lang.Clause;
import jabuti.common.lang.Contract;
import jabuti.frontend.tree.Dates;
import jabuti.frontend.tree.Parties;

/**
 * This class walks the contract syntax tree and builds the canonical
 * {@link Contract} from it.
 *
 * It walks the immediate children of the contract node once, in source
 * order.  Nodes of a kind it has no use for are skipped without looking at
 * their children.  No state is kept between calls.
 */
public class ContractCanonicalizer {

  private final ClauseLowerer clauseLowerer;

  public ContractCanonicalizer() {
    this(new ClauseLowerer());
  }

  public ContractCanonicalizer(ClauseLowerer clauseLowerer) {
    this.clauseLowerer = clauseLowerer;
  }

  public Contract canonicalize(ContractAST tree) {
    if (tree.kind() != NodeKind.CONTRACT) {
      throw new MalformedTreeError(tree, "expected contract at root");
    }

    ContractAST nameT = tree.firstChild(NodeKind.VARIABLE_NAME);
    String name = nameT == null ? "" : nameT.text();
    LogHelper.debug(tree, "Canonicalizing contract " + name);

    ContractHeader header = new ContractHeader();
    List<Clause> clauses = new ArrayList<Clause>();

    for (ContractAST child: tree.children()) {
      LogHelper.traceNode(0, child);
      switch (child.kind()) {
        case VARIABLES:
          walkVariables(child);
          break;
        case DATES:
          walkDates(header, child);
          break;
        case PARTIES:
          walkParties(header, child);
          break;
        case CLAUSES:
          for (ContractAST clause: child.children(NodeKind.CLAUSE)) {
            clauses.add(clauseLowerer.lower(clause));
          }
          break;
        default:
          // Keywords, name and braces
          break;
      }
    }

    return new Contract(name, header.beginDate, header.dueDate,
                        header.application, header.process, clauses);
  }

  /**
   * Contract-level variables get no canonical form in this pass.
   */
  private void walkVariables(ContractAST tree) {
    for (ContractAST stmt: tree.children(NodeKind.VARIABLE_STATEMENT)) {
      LogHelper.traceNode(2, stmt);
      ContractAST term = stmt.firstChild(NodeKind.TERM);
      if (term != null) {
        for (ContractAST operation: term.children()) {
          LogHelper.traceNode(4, operation);
        }
      }
    }
  }

  private void walkDates(ContractHeader header, ContractAST tree) {
    for (ContractAST date: tree.children()) {
      String literal;
      switch (date.kind()) {
        case BEGIN_DATE:
          literal = Dates.dateLiteral(date);
          if (literal != null) {
            header.beginDate = literal;
          }
          break;
        case DUE_DATE:
          literal = Dates.dateLiteral(date);
          if (literal != null) {
            header.dueDate = literal;
          }
          break;
        default:
          break;
      }
    }
  }

  private void walkParties(ContractHeader header, ContractAST tree) {
    for (ContractAST party: tree.children()) {
      switch (party.kind()) {
        case APPLICATION:
          header.application = Parties.roleIdentifier(party);
          break;
        case PROCESS:
          header.process = Parties.roleIdentifier(party);
          break;
        default:
          break;
      }
    }
  }

  /**
   * Contract fields collected while walking, empty until found
   */
  private static class ContractHeader {
    String beginDate = "";
    String dueDate = "";
    String application = "";
    String process = "";
  }
}
