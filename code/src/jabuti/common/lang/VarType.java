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

/**
 * Types a contract variable can be given.  A presence check binds a
 * boolean; the other two are inferred from a comparison operator, and keep
 * the upper-case spelling downstream templates switch on.
 */
public enum VarType {
  BOOLEAN("boolean"),
  TEXT("TEXT"),
  NUMBER("NUMBER");

  private final String typeName;

  private VarType(String typeName) {
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }

  /**
   * Equality operators compare text, all others compare numbers
   * @param comparator raw operator token
   */
  public static VarType forComparator(String comparator) {
    if (comparator.equals("==") || comparator.equals("!=")) {
      return TEXT;
    } else {
      return NUMBER;
    }
  }

  @Override
  public String toString() {
    return typeName;
  }
}
