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
package jabuti.common.lang;

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * Analyzed form of a message-content condition: either a bare presence
 * check binding one boolean variable, or a comparison between two operands.
 */
public class MessageCondition {

  public static enum ConditionKind {
    PRESENCE_CHECK,
    COMPARISON,
  }

  private final ConditionKind kind;
  private final ImmutableList<Variable> variables;
  private final Operand left;
  private final String comparator;
  private final Operand right;

  private MessageCondition(ConditionKind kind, ImmutableList<Variable> variables,
                           Operand left, String comparator, Operand right) {
    this.kind = kind;
    this.variables = variables;
    this.left = left;
    this.comparator = comparator;
    this.right = right;
  }

  public static MessageCondition presenceCheck(Variable flag) {
    return new MessageCondition(ConditionKind.PRESENCE_CHECK,
                                ImmutableList.of(flag), null, null, null);
  }

  public static MessageCondition comparison(Operand left, String comparator,
                                            Operand right) {
    ImmutableList.Builder<Variable> vars = ImmutableList.builder();
    if (left.hasVariable()) {
      vars.add(left.variable());
    }
    if (right.hasVariable()) {
      vars.add(right.variable());
    }
    return new MessageCondition(ConditionKind.COMPARISON, vars.build(),
                                left, comparator, right);
  }

  public ConditionKind kind() {
    return kind;
  }

  public boolean isPresenceCheck() {
    return kind == ConditionKind.PRESENCE_CHECK;
  }

  /**
   * Variables bound by the condition, left before right.  Empty when
   * both sides of a comparison are numeric literals.
   */
  public List<Variable> variables() {
    return variables;
  }

  public boolean hasComparator() {
    return comparator != null;
  }

  /**
   * @return raw operator token, null for a presence check
   */
  public String comparator() {
    return comparator;
  }

  /**
   * @return left operand, null for a presence check
   */
  public Operand left() {
    return left;
  }

  /**
   * @return right operand, null for a presence check
   */
  public Operand right() {
    return right;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, variables, left, comparator, right);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof MessageCondition))
      return false;
    MessageCondition other = (MessageCondition) obj;
    return kind == other.kind && variables.equals(other.variables) &&
           Objects.equal(left, other.left) &&
           Objects.equal(comparator, other.comparator) &&
           Objects.equal(right, other.right);
  }

  @Override
  public String toString() {
    if (isPresenceCheck()) {
      return "present(" + variables.get(0) + ")";
    }
    return "(" + left + " " + comparator + " " + right + ")";
  }
}
