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
import jabuti.common.exceptions.MalformedTreeError;

/**
 * Role-player declaration of a clause: rolePlayer = application
 */
public class RolePlayer {
  private static final int IDENTIFIER_SLOT = 2;

  private final String identifier;

  public RolePlayer(String identifier) {
    this.identifier = identifier;
  }

  /**
   * @return party responsible for the clause, application or process
   */
  public String getParty() {
    return identifier;
  }

  /**
   * The grammar has no separate operation production yet, so this is read
   * from the same slot as the party.
   */
  public String getOperation() {
    return identifier;
  }

  public static RolePlayer fromAST(ContractAST tree) {
    if (tree.kind() != NodeKind.ROLE_PLAYER) {
      throw new MalformedTreeError(tree, "expected role player");
    }
    ContractAST id = tree.requiredChild(IDENTIFIER_SLOT,
                                        "role player identifier");
    return new RolePlayer(id.text());
  }
}
