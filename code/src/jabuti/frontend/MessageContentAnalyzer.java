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

import jabuti.ast.ContractAST;
import jabuti.common.Logging;
import jabuti.common.lang.IdentifierName;
import jabuti.common.lang.MessageCondition;
import jabuti.common.lang.Operand;
import jabuti.common.lang.VarType;
import jabuti.common.lang.Variable;
import jabuti.frontend.tree.Literals;
import jabuti.frontend.tree.MessageContentOperation;

/**
 * Works out the shape of a message-content condition and the types of the
 * variables it binds.
 *
 * For a comparison the type comes from the operator alone and applies to
 * both sides: == and != compare TEXT, anything else compares NUMBERs.
 * Stateless, so a single instance can be shared between threads.
 */
public class MessageContentAnalyzer {

  static final String ANONYMOUS_BASE = "messageContent";

  static final String LEFT_POSITION = "1";
  static final String RIGHT_POSITION = "2";

  /**
   * @param tree message-content node
   * @param index index of the enclosing term within its clause
   */
  public MessageCondition analyze(ContractAST tree, int index) {
    MessageContentOperation op = MessageContentOperation.fromAST(tree);

    if (op.isPresenceCheck()) {
      Variable flag = new Variable(
          IdentifierNames.synthesize(ANONYMOUS_BASE, index), VarType.BOOLEAN);
      return MessageCondition.presenceCheck(flag);
    }

    String comparator = op.getComparator();
    VarType type = VarType.forComparator(comparator);
    Operand left = operand(op.getLeft(), index, LEFT_POSITION, type);
    Operand right = operand(op.getRight(), index, RIGHT_POSITION, type);

    MessageCondition result = MessageCondition.comparison(left, comparator,
                                                          right);
    if (result.variables().isEmpty()) {
      Logging.uniqueWarn("Comparison " + left.text() + " " + comparator + " "
          + right.text() + " at " + tree.position()
          + " only has literal operands");
    }
    return result;
  }

  private Operand operand(ContractAST tree, int index, String position,
                          VarType type) {
    String text = tree.text();
    if (Literals.isNumeric(text)) {
      return Operand.numericLiteral(text);
    } else if (!Literals.isQuoted(text)) {
      IdentifierName name = IdentifierNames.synthesize(text);
      return Operand.variableReference(text, new Variable(name, type));
    } else {
      IdentifierName name = IdentifierNames.synthesize(ANONYMOUS_BASE,
                                      String.valueOf(index), position);
      return Operand.quotedLiteral(text, new Variable(name, type));
    }
  }
}
