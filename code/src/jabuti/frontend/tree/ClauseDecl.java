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

import java.util.List;

import jabuti.ast.ContractAST;
import jabuti.ast.NodeKind;
import jabuti.common.exceptions.MalformedTreeError;

/**
 * Clause declaration:
 *   right requestDelivery { rolePlayer = process  terms { ... } onBreach(...) }
 */
public class ClauseDecl {
  private static final int KIND_SLOT = 0;

  private final ContractAST tree;
  private final String kind;
  private final String localName;
  private final RolePlayer rolePlayer;

  public ClauseDecl(ContractAST tree, String kind, String localName,
                    RolePlayer rolePlayer) {
    this.tree = tree;
    this.kind = kind;
    this.localName = localName;
    this.rolePlayer = rolePlayer;
  }

  /**
   * @return clause kind keyword, e.g. right, obligation or prohibition
   */
  public String getKind() {
    return kind;
  }

  public String getLocalName() {
    return localName;
  }

  public RolePlayer getRolePlayer() {
    return rolePlayer;
  }

  /**
   * @return all children of the clause node, in source order
   */
  public List<ContractAST> getBody() {
    return tree.children();
  }

  public static ClauseDecl fromAST(ContractAST tree) {
    if (tree.kind() != NodeKind.CLAUSE) {
      throw new MalformedTreeError(tree, "expected clause");
    }
    String kind = tree.requiredChild(KIND_SLOT, "clause kind").text();

    ContractAST nameT = tree.firstChild(NodeKind.VARIABLE_NAME);
    if (nameT == null) {
      throw new MalformedTreeError(tree, "missing clause name");
    }

    ContractAST roleT = tree.firstChild(NodeKind.ROLE_PLAYER);
    if (roleT == null) {
      throw new MalformedTreeError(tree, "missing role player");
    }

    return new ClauseDecl(tree, kind, nameT.text(), RolePlayer.fromAST(roleT));
  }
}
