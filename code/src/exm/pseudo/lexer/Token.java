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

package exm.pseudo.lexer;

import com.google.common.base.Preconditions;

/**
 * Immutable positioned lexical unit.
 *
 * For string literals the lexeme holds the decoded contents (no quotes,
 * escapes resolved).  For all other kinds it is the exact source text.
 */
public class Token {
  private final TokenKind kind;
  private final String lexeme;
  private final int line;
  private final int column;

  public Token(TokenKind kind, String lexeme, int line, int column) {
    Preconditions.checkNotNull(kind);
    Preconditions.checkNotNull(lexeme);
    Preconditions.checkArgument(line >= 1 && column >= 1,
        "Token positions are 1-based: %s:%s", line, column);
    this.kind = kind;
    this.lexeme = lexeme;
    this.line = line;
    this.column = column;
  }

  public TokenKind kind() {
    return kind;
  }

  public String lexeme() {
    return lexeme;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  /**
   * @return description used in error messages, e.g. "'x'" or
   *        "end of input"
   */
  public String describe() {
    switch (kind) {
      case EOF:
        return kind.description();
      case STRING_LITERAL:
        return "string \"" + lexeme + "\"";
      default:
        return "'" + lexeme + "'";
    }
  }

  @Override
  public String toString() {
    return line + ":" + column + " " + kind + " " + lexeme;
  }
}
