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
 * Begin and due date declarations: beginDate = 2023-01-01 00:00:00
 */
public class Dates {

  /**
   * @param tree begin date or due date node
   * @return text of the last date or datetime literal under the node,
   *         null if there is none
   */
  public static String dateLiteral(ContractAST tree) {
    String result = null;
    for (ContractAST child: tree.children()) {
      if (child.kind().isDate()) {
        result = child.text();
      }
    }
    return result;
  }
}
