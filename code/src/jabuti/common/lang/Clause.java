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
 * Canonical form of one clause: a named rule owned by a role player.
 */
public class Clause {

  private final IdentifierName name;
  private final String type;
  private final String rolePlayer;
  private final String operation;
  private final ImmutableList<Variable> variables;
  private final ImmutableList<Term> terms;
  private final Messages messages;

  public Clause(IdentifierName name, String type, String rolePlayer,
                String operation, List<Variable> variables, List<Term> terms,
                Messages messages) {
    this.name = name;
    this.type = type;
    this.rolePlayer = rolePlayer;
    this.operation = operation;
    this.variables = ImmutableList.copyOf(variables);
    this.terms = ImmutableList.copyOf(terms);
    this.messages = messages;
  }

  public IdentifierName name() {
    return name;
  }

  /**
   * @return clause kind keyword as written, e.g. right or obligation
   */
  public String type() {
    return type;
  }

  public String rolePlayer() {
    return rolePlayer;
  }

  public String operation() {
    return operation;
  }

  /**
   * Variables discovered in the clause's terms, unique by camel name, in
   * order of first discovery
   */
  public List<Variable> variables() {
    return variables;
  }

  public List<Term> terms() {
    return terms;
  }

  public Messages messages() {
    return messages;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, type, rolePlayer, operation, variables,
                            terms, messages);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Clause))
      return false;
    Clause other = (Clause) obj;
    return name.equals(other.name) && type.equals(other.type) &&
           rolePlayer.equals(other.rolePlayer) &&
           operation.equals(other.operation) &&
           variables.equals(other.variables) && terms.equals(other.terms) &&
           messages.equals(other.messages);
  }

  @Override
  public String toString() {
    return "clause " + name.pascal() + " (" + type + ", rolePlayer="
        + rolePlayer + ", operation=" + operation + ") variables="
        + variables + " terms=" + terms + " messages=" + messages;
  }

  /**
   * Messages reported when a clause is breached or satisfied
   */
  public static class Messages {
    private final String error;
    private final String success;

    public Messages(String error, String success) {
      this.error = error;
      this.success = success;
    }

    public String error() {
      return error;
    }

    /**
     * No production fills this in yet, so it is always empty
     */
    public String success() {
      return success;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(error, success);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof Messages))
        return false;
      Messages other = (Messages) obj;
      return error.equals(other.error) && success.equals(other.success);
    }

    @Override
    public String toString() {
      return "{error=" + error + ", success=" + success + "}";
    }
  }
}
