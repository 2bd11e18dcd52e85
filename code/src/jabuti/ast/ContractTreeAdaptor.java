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
package jabuti.ast;

import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTreeAdaptor;

/**
 * Tree adaptor for parser front ends so that they build {@link ContractAST}
 * nodes instead of plain CommonTrees.
 */
public class ContractTreeAdaptor extends CommonTreeAdaptor {
  @Override
  public Object create(Token t) {
    return new ContractAST(t);
  }

  /**
   * Create a node of the given kind with the given token text
   */
  public ContractAST create(NodeKind kind, String text) {
    return (ContractAST)create(kind.tokenType(), text);
  }
}
