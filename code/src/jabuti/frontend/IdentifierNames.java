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

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import jabuti.common.lang.IdentifierName;

/**
 * Synthesizes generated symbol names in all three casing conventions.
 *
 * All functions are pure: the same inputs always give the same triple, and
 * the three renderings differ only in capitalization and separators.
 */
public class IdentifierNames {

  private static final String SNAKE_SEPARATOR = "_";

  /**
   * Name from a plain base name and suffix parts.
   *
   * E.g. base "messageContent" and parts ("3", "1") give MessageContent31,
   * messageContent31 and messageContent_3_1.
   */
  public static IdentifierName synthesize(String base, String... suffixParts) {
    StringBuilder pascal = new StringBuilder(StringUtils.capitalize(base));
    StringBuilder camel = new StringBuilder(StringUtils.uncapitalize(base));
    StringBuilder snake = new StringBuilder(base);
    appendParts(pascal, camel, snake, suffixParts);
    return new IdentifierName(pascal.toString(), camel.toString(),
                              snake.toString());
  }

  public static IdentifierName synthesize(String base, int index) {
    return synthesize(base, String.valueOf(index));
  }

  /**
   * Suffix an already composed name.  Each rendering of the composed name is
   * kept as constructed and the parts are appended to it.
   */
  public static IdentifierName extend(IdentifierName composed,
                                      String... suffixParts) {
    StringBuilder pascal = new StringBuilder(composed.pascal());
    StringBuilder camel = new StringBuilder(composed.camel());
    StringBuilder snake = new StringBuilder(composed.snake());
    appendParts(pascal, camel, snake, suffixParts);
    return new IdentifierName(pascal.toString(), camel.toString(),
                              snake.toString());
  }

  /**
   * Name of the term at the given index of a clause, e.g.
   * RightRequestDeliveryTimeout0
   */
  public static IdentifierName termName(IdentifierName clauseName,
                                        String termType, int termIndex) {
    return extend(clauseName, termType, String.valueOf(termIndex));
  }

  /**
   * Name of a clause from its kind keyword and local name.  The keyword is
   * normalized to lower case before capitalizing, so PENALTY and penalty
   * give the same pascal and camel names.
   */
  public static IdentifierName clauseName(String kind, String localName) {
    String lowerKind = kind.toLowerCase(Locale.ROOT);
    String capName = StringUtils.capitalize(localName);
    return new IdentifierName(
        StringUtils.capitalize(lowerKind) + capName,
        lowerKind + capName,
        kind + SNAKE_SEPARATOR + localName);
  }

  private static void appendParts(StringBuilder pascal, StringBuilder camel,
                           StringBuilder snake, String[] suffixParts) {
    for (String part: suffixParts) {
      String cap = StringUtils.capitalize(part);
      pascal.append(cap);
      camel.append(cap);
      snake.append(SNAKE_SEPARATOR).append(part);
    }
  }
}
