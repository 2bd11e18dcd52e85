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

/**
 * Party declarations: application = "..." and process = "..."
 */
public class Parties {
  private static final int IDENTIFIER_SLOT = 2;

  /**
   * @param tree application or process node
   * @return identifier text of the party, empty if not given
   */
  public static String roleIdentifier(ContractAST tree) {
    if (tree.childCount() <= IDENTIFIER_SLOT) {
      return "";
    }
    return tree.child(IDENTIFIER_SLOT).text();
  }
}
