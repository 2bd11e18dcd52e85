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
package jabuti.ast;

import java.util.HashMap;
import java.util.Map;

import org.antlr.runtime.Token;

/**
 * Closed set of node kinds in the Jabuti contract syntax tree.
 *
 * Each kind corresponds to exactly one ANTLR token type, so that a parser
 * front end can create {@link ContractAST} nodes through
 * {@link ContractTreeAdaptor} and the frontend can discriminate them with
 * {@link ContractAST#kind()}.
 */
public enum NodeKind {
  /** Any token type outside the contract grammar */
  UNKNOWN(Token.INVALID_TOKEN_TYPE, false),

  // Grammar productions
  CONTRACT(4, true),
  VARIABLES(5, true),
  VARIABLE_STATEMENT(6, true),
  DATES(7, true),
  BEGIN_DATE(8, true),
  DUE_DATE(9, true),
  PARTIES(10, true),
  APPLICATION(11, true),
  PROCESS(12, true),
  CLAUSES(13, true),
  CLAUSE(14, true),
  ROLE_PLAYER(15, true),
  TERMS(16, true),
  TERM_OR_WHEN(17, true),
  WHEN(18, true),
  TERM(19, true),
  TIMEOUT(20, true),
  MESSAGE_CONTENT(21, true),
  MAX_NUMBER_OF_OPERATION(22, true),
  WEEK_DAYS_INTERVAL(23, true),
  TIME_INTERVAL(24, true),
  ON_BREACH(25, true),
  VARIABLE_NAME(26, true),
  NUMBER(27, true),
  STRING(28, true),
  DATE(29, true),
  DATETIME(30, true),

  // Terminals
  KEYWORD(31, false),
  SYMBOL(32, false),
  COMPARATOR(33, false),
  ID(34, false),
  LITERAL(35, false);

  private static final Map<Integer, NodeKind> byTokenType =
                                    new HashMap<Integer, NodeKind>();

  static {
    for (NodeKind kind: values()) {
      byTokenType.put(kind.tokenType, kind);
    }
  }

  private final int tokenType;
  private final boolean production;

  private NodeKind(int tokenType, boolean production) {
    this.tokenType = tokenType;
    this.production = production;
  }

  public int tokenType() {
    return tokenType;
  }

  /**
   * @return true if nodes of this kind stand for a grammar production
   *         rather than a single token
   */
  public boolean isProduction() {
    return production;
  }

  /**
   * True for the literal kinds that can hold a contract date
   */
  public boolean isDate() {
    return this == DATE || this == DATETIME;
  }

  /**
   * @param tokenType ANTLR token type of a node
   * @return the matching kind, or UNKNOWN if the token type is not part of
   *         the contract grammar
   */
  public static NodeKind fromTokenType(int tokenType) {
    NodeKind kind = byTokenType.get(tokenType);
    return kind == null ? UNKNOWN : kind;
  }
}
