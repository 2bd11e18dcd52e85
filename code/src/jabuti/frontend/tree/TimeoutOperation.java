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
package jabuti.frontend.tree;

import jabuti.ast.ContractAST;
import jabuti.ast.NodeKind;

/**
 * Timeout operation of a term: timeout = 86400
 */
public class TimeoutOperation {

  private final ContractAST operand;

  public TimeoutOperation(ContractAST operand) {
    this.operand = operand;
  }

  /**
   * @return operand node, null if the timeout has none
   */
  public ContractAST getOperand() {
    return operand;
  }

  /**
   * Only numeric timeouts produce a term
   */
  public boolean isNumeric() {
    return operand != null && Literals.isNumeric(operand.text());
  }

  public String getValue() {
    return operand == null ? "" : operand.text();
  }

  public static TimeoutOperation fromAST(ContractAST tree) {
    assert(tree.kind() == NodeKind.TIMEOUT);
    ContractAST operand = null;
    // Skip over keyword and '='
    for (ContractAST child: tree.children()) {
      NodeKind kind = child.kind();
      if (kind != NodeKind.KEYWORD && kind != NodeKind.SYMBOL) {
        operand = child;
        break;
      }
    }
    return new TimeoutOperation(operand);
  }
}
