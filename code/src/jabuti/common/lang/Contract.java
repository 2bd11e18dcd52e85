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
 * Canonical, target-independent form of a contract, as handed to the code
 * generators.  Clause order is source order, which fixes the order of the
 * generated clause methods.
 */
public class Contract {

  private final String name;
  private final String beginDate;
  private final String dueDate;
  private final String application;
  private final String process;
  private final ImmutableList<Variable> variables;
  private final ImmutableList<Clause> clauses;

  public Contract(String name, String beginDate, String dueDate,
                  String application, String process, List<Clause> clauses) {
    this.name = name;
    this.beginDate = beginDate;
    this.dueDate = dueDate;
    this.application = application;
    this.process = process;
    // Contract-level variables are filled in by a later pass
    this.variables = ImmutableList.of();
    this.clauses = ImmutableList.copyOf(clauses);
  }

  public String name() {
    return name;
  }

  /**
   * @return begin date literal as written, not parsed
   */
  public String beginDate() {
    return beginDate;
  }

  /**
   * @return due date literal as written, not parsed
   */
  public String dueDate() {
    return dueDate;
  }

  public String application() {
    return application;
  }

  public String process() {
    return process;
  }

  public List<Variable> variables() {
    return variables;
  }

  public List<Clause> clauses() {
    return clauses;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, beginDate, dueDate, application, process,
                            variables, clauses);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Contract))
      return false;
    Contract other = (Contract) obj;
    return name.equals(other.name) && beginDate.equals(other.beginDate) &&
           dueDate.equals(other.dueDate) &&
           application.equals(other.application) &&
           process.equals(other.process) &&
           variables.equals(other.variables) &&
           clauses.equals(other.clauses);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("contract ").append(name).append(" {\n");
    sb.append("  beginDate=").append(beginDate).append('\n');
    sb.append("  dueDate=").append(dueDate).append('\n');
    sb.append("  application=").append(application).append('\n');
    sb.append("  process=").append(process).append('\n');
    for (Clause clause: clauses) {
      sb.append("  ").append(clause).append('\n');
    }
    sb.append("}");
    return sb.toString();
  }
}
