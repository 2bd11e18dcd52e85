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
 * One logical symbol rendered in the three casing conventions used by the
 * code generators: field and type names (pascal), method and JSON names
 * (camel) and storage keys (snake).
 */
public class IdentifierName {
  private final String pascal;
  private final String camel;
  private final String snake;

  public IdentifierName(String pascal, String camel, String snake) {
    this.pascal = pascal;
    this.camel = camel;
    this.snake = snake;
  }

  public String pascal() {
    return pascal;
  }

  public String camel() {
    return camel;
  }

  public String snake() {
    return snake;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(pascal, camel, snake);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof IdentifierName))
      return false;
    IdentifierName other = (IdentifierName) obj;
    return pascal.equals(other.pascal) && camel.equals(other.camel) &&
           snake.equals(other.snake);
  }

  @Override
  public String toString() {
    return "{pascal=" + pascal + ", camel=" + camel + ", snake=" + snake + "}";
  }
}
