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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.pseudo.common.Logging;
import exm.pseudo.common.exceptions.LexicalError;

/**
 * Converts pseudocode source text into positioned tokens.
 *
 * Input is consumed left to right one code point at a time.  Lines and
 * columns are 1-based; a line break ("\n", "\r\n" or a lone "\r") moves to
 * column 1 of the next line and every other code point advances the
 * column by one.  Lexing stops at the first unrecognized character.
 */
public class Lexer {

  private static final Logger logger = Logging.getLogger();

  /** Unicode arrows accepted as the assignment operator */
  private static final int LEFT_ARROW = 0x2190;
  private static final int HEAVY_LEFT_ARROW = 0x1F868;

  /** Floor and ceiling brackets */
  private static final int LEFT_FLOOR = 0x230A;
  private static final int RIGHT_FLOOR = 0x230B;
  private static final int LEFT_CEILING = 0x2308;
  private static final int RIGHT_CEILING = 0x2309;

  private final String source;
  private final LexerOptions options;

  private int pos;
  private int line;
  private int column;
  private List<Token> tokens;

  public Lexer(String source, LexerOptions options) {
    this.source = source;
    this.options = options;
  }

  public Lexer(String source) {
    this(source, LexerOptions.defaults());
  }

  /**
   * @return all tokens in source order, terminated by a single EOF token
   * @throws LexicalError at the first character no rule matches
   */
  public List<Token> tokenize() throws LexicalError {
    pos = 0;
    line = 1;
    column = 1;
    tokens = new ArrayList<Token>();

    while (true) {
      skipTrivia();
      if (atEnd()) {
        break;
      }
      scanToken();
    }
    tokens.add(new Token(TokenKind.EOF, "", line, column));

    if (logger.isDebugEnabled()) {
      logger.debug("Lexed " + tokens.size() + " tokens from "
                   + line + " lines");
    }
    return tokens;
  }

  private void scanToken() throws LexicalError {
    int startLine = line;
    int startColumn = column;
    int start = pos;
    int c = peek();

    if (c >= '0' && c <= '9') {
      scanNumber(startLine, startColumn);
      return;
    }
    if (c == '"' || c == '\'') {
      scanString(startLine, startColumn);
      return;
    }
    if (Character.isLetter(c) || c == '_') {
      scanWord(startLine, startColumn);
      return;
    }

    advance();
    TokenKind kind;
    switch (c) {
      case '<':
        if (match('-')) {
          kind = TokenKind.ARROW;
        } else if (match('=')) {
          kind = TokenKind.LESS_EQUAL;
        } else if (match('>')) {
          kind = TokenKind.NOT_EQUAL;
        } else {
          kind = TokenKind.LESS;
        }
        break;
      case '>':
        kind = match('=') ? TokenKind.GREATER_EQUAL : TokenKind.GREATER;
        break;
      case '!':
        if (!match('=')) {
          throw new LexicalError(startLine, startColumn,
              "Unexpected character '!' (did you mean '!=' ?)");
        }
        kind = TokenKind.NOT_EQUAL;
        break;
      case LEFT_ARROW:
      case HEAVY_LEFT_ARROW:
        kind = TokenKind.ARROW;
        break;
      case '=': kind = TokenKind.EQUALS; break;
      case '+': kind = TokenKind.PLUS; break;
      case '-': kind = TokenKind.MINUS; break;
      case '*': kind = TokenKind.STAR; break;
      case '/': kind = TokenKind.SLASH; break;
      case '%': kind = TokenKind.PERCENT; break;
      case '(': kind = TokenKind.LPAREN; break;
      case ')': kind = TokenKind.RPAREN; break;
      case '[': kind = TokenKind.LBRACKET; break;
      case ']': kind = TokenKind.RBRACKET; break;
      case '{': kind = TokenKind.LBRACE; break;
      case '}': kind = TokenKind.RBRACE; break;
      case ',': kind = TokenKind.COMMA; break;
      case ';': kind = TokenKind.SEMICOLON; break;
      // A '.' right after digits was taken by scanNumber
      case '.': kind = TokenKind.DOT; break;
      case LEFT_FLOOR: kind = TokenKind.LFLOOR; break;
      case RIGHT_FLOOR: kind = TokenKind.RFLOOR; break;
      case LEFT_CEILING: kind = TokenKind.LCEIL; break;
      case RIGHT_CEILING: kind = TokenKind.RCEIL; break;
      default:
        throw new LexicalError(startLine, startColumn,
                "Unrecognized character " + describeChar(c));
    }
    addToken(kind, source.substring(start, pos), startLine, startColumn);
  }

  private void scanNumber(int startLine, int startColumn) {
    int start = pos;
    skipDigits();
    TokenKind kind = TokenKind.INT_LITERAL;
    if (!atEnd() && peek() == '.') {
      advance();
      skipDigits();
      kind = TokenKind.REAL_LITERAL;
    }
    addToken(kind, source.substring(start, pos), startLine, startColumn);
  }

  private void skipDigits() {
    while (!atEnd() && peek() >= '0' && peek() <= '9') {
      advance();
    }
  }

  private void scanString(int startLine, int startColumn)
                                          throws LexicalError {
    int quote = advance();
    StringBuilder value = new StringBuilder();
    while (true) {
      if (atEnd()) {
        throw new LexicalError(startLine, startColumn,
                               "Unterminated string literal");
      }
      int c = peek();
      if (c == '\n' || c == '\r') {
        throw new LexicalError(startLine, startColumn,
            "String literal may not span lines");
      }
      advance();
      if (c == quote) {
        break;
      }
      if (c == '\\' && !atEnd() && peek() != '\n' && peek() != '\r') {
        value.appendCodePoint(unescape(advance()));
      } else {
        value.appendCodePoint(c);
      }
    }
    addToken(TokenKind.STRING_LITERAL, value.toString(),
             startLine, startColumn);
  }

  private static int unescape(int c) {
    switch (c) {
      case 'n': return '\n';
      case 't': return '\t';
      case 'r': return '\r';
      default:
        // \\, \" and \' as well as unknown escapes keep the character
        return c;
    }
  }

  private void scanWord(int startLine, int startColumn) {
    int start = pos;
    while (!atEnd() && isWordPart(peek())) {
      advance();
    }
    String word = source.substring(start, pos);
    TokenKind kind = options.keywords().lookup(word);
    if (kind == null) {
      kind = TokenKind.IDENTIFIER;
    }
    addToken(kind, word, startLine, startColumn);
  }

  private static boolean isWordPart(int c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  /**
   * Skip whitespace and comments
   */
  private void skipTrivia() {
    while (!atEnd()) {
      int c = peek();
      if (Character.isWhitespace(c) || Character.isSpaceChar(c)
          || c == '\uFEFF') {
        advance();
      } else if (atCommentMarker()) {
        while (!atEnd() && peek() != '\n' && peek() != '\r') {
          advance();
        }
      } else {
        return;
      }
    }
  }

  private boolean atCommentMarker() {
    for (String marker: options.commentMarkers()) {
      if (source.startsWith(marker, pos)) {
        return true;
      }
    }
    return false;
  }

  private void addToken(TokenKind kind, String lexeme,
                        int startLine, int startColumn) {
    Token tok = new Token(kind, lexeme, startLine, startColumn);
    if (logger.isTraceEnabled()) {
      logger.trace("token " + tok);
    }
    tokens.add(tok);
  }

  private boolean atEnd() {
    return pos >= source.length();
  }

  private int peek() {
    return source.codePointAt(pos);
  }

  /**
   * Consume the next code point if it equals c
   */
  private boolean match(int c) {
    if (!atEnd() && peek() == c) {
      advance();
      return true;
    }
    return false;
  }

  /**
   * Consume one code point, updating line and column
   * @return the consumed code point
   */
  private int advance() {
    int c = source.codePointAt(pos);
    pos += Character.charCount(c);
    if (c == '\n') {
      newLine();
    } else if (c == '\r') {
      if (!atEnd() && source.charAt(pos) == '\n') {
        pos++;
      }
      newLine();
    } else {
      column++;
    }
    return c;
  }

  private void newLine() {
    line++;
    column = 1;
  }

  private static String describeChar(int c) {
    if (Character.isISOControl(c) || !Character.isDefined(c)) {
      return String.format("U+%04X", c);
    }
    return "'" + new String(Character.toChars(c)) + "'";
  }
}
