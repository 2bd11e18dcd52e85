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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import jabuti.common.lang.Variable;

/**
 * Ordered table of the variables discovered in one clause, keyed by camel
 * name.
 *
 * Adding a variable whose camel name is already present replaces the stored
 * variable, but the entry keeps the position of the first insertion.  So
 * two references to the same name yield one variable, typed as at the last
 * reference, listed where it was first seen.
 */
public class ClauseVariables {

  private final Map<String, Variable> variables =
                              new LinkedHashMap<String, Variable>();

  /**
   * @return the variable replaced, null if the name is new
   */
  public Variable merge(Variable var) {
    return variables.put(var.key(), var);
  }

  public void mergeAll(List<Variable> vars) {
    for (Variable var: vars) {
      merge(var);
    }
  }

  public boolean contains(String camelName) {
    return variables.containsKey(camelName);
  }

  public int size() {
    return variables.size();
  }

  /**
   * @return variables in order of first insertion
   */
  public List<Variable> values() {
    return ImmutableList.copyOf(variables.values());
  }
}
