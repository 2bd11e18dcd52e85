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

/**
 * A single condition or timer inside a clause.
 */
public abstract class Term {

  public static enum TermKind {
    TIMEOUT("timeout"),
    MESSAGE_CONTENT("messageContent");

    private final String termType;

    private TermKind(String termType) {
      this.termType = termType;
    }

    /**
     * Name of the term type as used in generated symbol names
     */
    public String termType() {
      return termType;
    }
  }

  protected final IdentifierName name;

  protected Term(IdentifierName name) {
    this.name = name;
  }

  public IdentifierName name() {
    return name;
  }

  public abstract TermKind kind();

  /**
   * Clause must be completed before the timeout expires
   */
  public static class Timeout extends Term {
    private final String value;

    public Timeout(IdentifierName name, String value) {
      super(name);
      this.value = value;
    }

    @Override
    public TermKind kind() {
      return TermKind.TIMEOUT;
    }

    /**
     * @return raw numeric text of the timeout
     */
    public String value() {
      return value;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(name, value);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof Timeout))
        return false;
      Timeout other = (Timeout) obj;
      return name.equals(other.name) && value.equals(other.value);
    }

    @Override
    public String toString() {
      return "timeout " + name.camel() + " = " + value;
    }
  }

  /**
   * Condition over the content of the message that triggers the clause
   */
  public static class MessageContent extends Term {
    private final MessageCondition condition;

    public MessageContent(IdentifierName name, MessageCondition condition) {
      super(name);
      this.condition = condition;
    }

    @Override
    public TermKind kind() {
      return TermKind.MESSAGE_CONTENT;
    }

    public MessageCondition condition() {
      return condition;
    }

    public List<Variable> variables() {
      return condition.variables();
    }

    /**
     * @return raw operator token, null for a presence check
     */
    public String comparator() {
      return condition.comparator();
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(name, condition);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof MessageContent))
        return false;
      MessageContent other = (MessageContent) obj;
      return name.equals(other.name) && condition.equals(other.condition);
    }

    @Override
    public String toString() {
      return "messageContent " + name.camel() + " " + condition;
    }
  }
}
