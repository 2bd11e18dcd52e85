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

import com.google.common.base.Objects;

/**
 * One side of a comparison in a message-content condition.
 */
public class Operand {

  public static enum OperandKind {
    /** Carried through as raw text, binds no variable */
    NUMERIC_LITERAL,
    /** Bare name, binds a variable with that name */
    VARIABLE_REFERENCE,
    /** Quoted text, binds an anonymous variable */
    QUOTED_LITERAL,
  }

  private final OperandKind kind;
  private final String text;
  private final Variable variable;

  private Operand(OperandKind kind, String text, Variable variable) {
    this.kind = kind;
    this.text = text;
    this.variable = variable;
  }

  public static Operand numericLiteral(String text) {
    return new Operand(OperandKind.NUMERIC_LITERAL, text, null);
  }

  public static Operand variableReference(String text, Variable variable) {
    return new Operand(OperandKind.VARIABLE_REFERENCE, text, variable);
  }

  public static Operand quotedLiteral(String text, Variable variable) {
    return new Operand(OperandKind.QUOTED_LITERAL, text, variable);
  }

  public OperandKind kind() {
    return kind;
  }

  /**
   * @return operand exactly as written in the source
   */
  public String text() {
    return text;
  }

  public boolean hasVariable() {
    return variable != null;
  }

  /**
   * @return bound variable, null for a numeric literal
   */
  public Variable variable() {
    return variable;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, text, variable);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Operand))
      return false;
    Operand other = (Operand) obj;
    return kind == other.kind && text.equals(other.text) &&
           Objects.equal(variable, other.variable);
  }

  @Override
  public String toString() {
    if (variable == null) {
      return text;
    }
    return text + "->" + variable;
  }
}
