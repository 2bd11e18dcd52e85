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
import jabuti.common.lang.Clause;
import jabuti.common.lang.IdentifierName;
import jabuti.common.lang.MessageCondition;
import jabuti.common.lang.Term;
import jabuti.common.lang.Term.TermKind;
import jabuti.frontend.tree.ClauseDecl;
import jabuti.frontend.tree.OnBreach;
import jabuti.frontend.tree.RolePlayer;
import jabuti.frontend.tree.TimeoutOperation;

/**
 * Lowers one clause node to its canonical {@link Clause}.
 *
 * Terms are numbered per clause in source order, and the number is part of
 * every generated term name, so term names are unique within the clause.
 */
public class ClauseLowerer {

  private final MessageContentAnalyzer analyzer;

  public ClauseLowerer() {
    this(new MessageContentAnalyzer());
  }

  public ClauseLowerer(MessageContentAnalyzer analyzer) {
    this.analyzer = analyzer;
  }

  public Clause lower(ContractAST tree) {
    ClauseDecl decl = ClauseDecl.fromAST(tree);
    IdentifierName clauseName = IdentifierNames.clauseName(decl.getKind(),
                                                   decl.getLocalName());
    LogHelper.debug(tree, "Lowering clause " + clauseName.pascal());

    ClauseState state = new ClauseState(clauseName);
    String breachMessage = "";

    for (ContractAST child: decl.getBody()) {
      switch (child.kind()) {
        case ON_BREACH:
          breachMessage = OnBreach.message(child);
          break;
        case TERMS:
          walkTerms(state, child);
          break;
        default:
          // Kind, name and role player were read by ClauseDecl
          LogHelper.traceNode(2, child);
          break;
      }
    }

    RolePlayer rolePlayer = decl.getRolePlayer();
    LogHelper.debug(tree, "Clause " + clauseName.pascal() + ": "
        + state.terms.size() + " terms, " + state.variables.size()
        + " variables");
    return new Clause(clauseName, decl.getKind(), rolePlayer.getParty(),
                      rolePlayer.getOperation(), state.variables.values(),
                      state.terms, new Clause.Messages(breachMessage, ""));
  }

  private void walkTerms(ClauseState state, ContractAST terms) {
    for (ContractAST termOrWhen: terms.children(NodeKind.TERM_OR_WHEN)) {
      for (ContractAST term: termOrWhen.children(NodeKind.TERM)) {
        for (ContractAST operation: term.children()) {
          switch (operation.kind()) {
            case TIMEOUT:
              lowerTimeout(state, operation);
              break;
            case MESSAGE_CONTENT:
              lowerMessageContent(state, operation);
              break;
            default:
              // Operations without a canonical form yet
              LogHelper.traceNode(4, operation);
              break;
          }
        }
      }
    }
  }

  private void lowerTimeout(ClauseState state, ContractAST tree) {
    TimeoutOperation timeout = TimeoutOperation.fromAST(tree);
    if (!timeout.isNumeric()) {
      LogHelper.debug(tree, "Skipping timeout with non-numeric value "
                      + timeout.getValue());
      return;
    }

    IdentifierName name = IdentifierNames.termName(state.clauseName,
                          TermKind.TIMEOUT.termType(), state.termIndex);
    state.terms.add(new Term.Timeout(name, timeout.getValue()));
    state.termIndex++;
  }

  private void lowerMessageContent(ClauseState state, ContractAST tree) {
    MessageCondition condition = analyzer.analyze(tree, state.termIndex);
    IdentifierName name = IdentifierNames.termName(state.clauseName,
                  TermKind.MESSAGE_CONTENT.termType(), state.termIndex);

    state.variables.mergeAll(condition.variables());
    state.terms.add(new Term.MessageContent(name, condition));
    // Advances even if the condition bound no variables
    state.termIndex++;
  }

  /**
   * Accumulators for a single call to lower()
   */
  private static class ClauseState {
    final IdentifierName clauseName;
    final List<Term> terms = new ArrayList<Term>();
    final ClauseVariables variables = new ClauseVariables();
    int termIndex = 0;

    ClauseState(IdentifierName clauseName) {
      this.clauseName = clauseName;
    }
  }
}
