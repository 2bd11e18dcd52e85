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
 * A variable discovered in a clause.  Two variables with the same camel
 * name denote the same generated symbol.
 */
public class Variable {
  private final IdentifierName name;
  private final VarType type;

  public Variable(IdentifierName name, VarType type) {
    this.name = name;
    this.type = type;
  }

  public IdentifierName name() {
    return name;
  }

  public VarType type() {
    return type;
  }

  /**
   * Key used to deduplicate variables within a clause
   */
  public String key() {
    return name.camel();
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, type);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Variable))
      return false;
    Variable other = (Variable) obj;
    return name.equals(other.name) && type == other.type;
  }

  @Override
  public String toString() {
    return name.camel() + ":" + type.typeName();
  }
}
