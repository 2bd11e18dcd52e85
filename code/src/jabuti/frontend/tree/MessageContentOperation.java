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
 * Message-content operation of a term, in one of two shapes:
 * <pre>
 *   messageContent ( name )               presence check
 *   messageContent ( left op right )      comparison
 * </pre>
 */
public class MessageContentOperation {
  private static final int PRESENCE_CHECK_CHILDREN = 4;
  private static final int COMPARISON_CHILDREN = 6;

  private static final int ARGUMENT_SLOT = 2;
  private static final int LEFT_SLOT = 2;
  private static final int COMPARATOR_SLOT = 3;
  private static final int RIGHT_SLOT = 4;

  private final ContractAST argument;
  private final ContractAST left;
  private final ContractAST comparator;
  private final ContractAST right;

  private MessageContentOperation(ContractAST argument, ContractAST left,
                          ContractAST comparator, ContractAST right) {
    this.argument = argument;
    this.left = left;
    this.comparator = comparator;
    this.right = right;
  }

  public boolean isPresenceCheck() {
    return comparator == null;
  }

  /**
   * @return checked name of a presence check, null for a comparison
   */
  public ContractAST getArgument() {
    return argument;
  }

  public ContractAST getLeft() {
    return left;
  }

  public String getComparator() {
    return comparator == null ? null : comparator.text();
  }

  public ContractAST getRight() {
    return right;
  }

  public static MessageContentOperation fromAST(ContractAST tree) {
    if (tree.kind() != NodeKind.MESSAGE_CONTENT) {
      throw new MalformedTreeError(tree, "expected message content");
    }
    int count = tree.childCount();
    if (count == PRESENCE_CHECK_CHILDREN) {
      return new MessageContentOperation(tree.child(ARGUMENT_SLOT),
                                         null, null, null);
    } else if (count == COMPARISON_CHILDREN) {
      return new MessageContentOperation(null, tree.child(LEFT_SLOT),
                    tree.child(COMPARATOR_SLOT), tree.child(RIGHT_SLOT));
    } else {
      throw new MalformedTreeError(tree, "expected " + PRESENCE_CHECK_CHILDREN
          + " or " + COMPARISON_CHILDREN + " children but had " + count);
    }
  }
}
