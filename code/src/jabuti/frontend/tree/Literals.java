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
package jabuti.frontend.tree;

import org.apache.commons.lang3.math.NumberUtils;

/**
 * Classification of raw literal text in operand positions
 */
public class Literals {

  /**
   * Numeric means a plain decimal, as the grammar's NUMBER token allows.
   * Exponent and hex forms such as 1e5 or 0x10 are not numeric.
   * @return true if text is a plain decimal number, e.g. 100, -2 or 3.5
   */
  public static boolean isNumeric(String text) {
    return NumberUtils.isParsable(text);
  }

  /**
   * @return true if text is a quoted string literal
   */
  public static boolean isQuoted(String text) {
    return text.startsWith("\"") || text.startsWith("'");
  }
}
