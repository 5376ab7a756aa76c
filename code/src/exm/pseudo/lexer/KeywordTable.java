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

import java.util.Locale;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Maps every accepted keyword spelling to one canonical {@link TokenKind}.
 * Built once per configuration and shared read-only between lexers.
 */
public class KeywordTable {

  private static final KeywordTable STANDARD = standardBuilder().build(true);

  /** Spellings, stored upper case */
  private final ImmutableMap<String, TokenKind> spellings;

  /** Spellings that only match when written exactly in upper case */
  private final ImmutableSet<String> exactCase;

  private final boolean caseInsensitive;

  private KeywordTable(ImmutableMap<String, TokenKind> spellings,
                       ImmutableSet<String> exactCase,
                       boolean caseInsensitive) {
    this.spellings = spellings;
    this.exactCase = exactCase;
    this.caseInsensitive = caseInsensitive;
  }

  /**
   * @return the bilingual table with case-insensitive lookup
   */
  public static KeywordTable standard() {
    return STANDARD;
  }

  public static KeywordTable standard(boolean caseInsensitive) {
    return caseInsensitive ? STANDARD : standardBuilder().build(false);
  }

  /**
   * @param word identifier-shaped source text
   * @return the keyword kind, or null if word is an ordinary identifier
   */
  public TokenKind lookup(String word) {
    String key = caseInsensitive ? word.toUpperCase(Locale.ROOT) : word;
    TokenKind kind = spellings.get(key);
    if (kind == null) {
      return null;
    }
    if (exactCase.contains(key) && !key.equals(word)) {
      // e.g. lower case y is a variable, not AND
      return null;
    }
    return kind;
  }

  public boolean isCaseInsensitive() {
    return caseInsensitive;
  }

  public static Builder standardBuilder() {
    return new Builder()
      .add(TokenKind.IF, "IF", "SI")
      .add(TokenKind.THEN, "THEN", "ENTONCES")
      .add(TokenKind.ELSE, "ELSE", "SINO")
      .add(TokenKind.END_IF, "END_IF", "FIN_SI")
      .add(TokenKind.WHILE, "WHILE", "MIENTRAS")
      .add(TokenKind.DO, "DO", "HACER")
      .add(TokenKind.END_WHILE, "END_WHILE", "FIN_MIENTRAS")
      .add(TokenKind.FOR, "FOR", "PARA")
      .add(TokenKind.TO, "TO", "HASTA")
      .add(TokenKind.STEP, "STEP", "PASO")
      .add(TokenKind.END_FOR, "END_FOR", "FIN_PARA")
      .add(TokenKind.REPEAT, "REPEAT", "REPETIR")
      .add(TokenKind.UNTIL, "UNTIL", "HASTA_QUE")
      .add(TokenKind.BEGIN, "BEGIN", "INICIO")
      .add(TokenKind.END, "END", "FIN")
      .add(TokenKind.FUNCTION, "FUNCTION", "FUNCION", "FUNCIÓN",
                               "PROCEDURE", "PROCEDIMIENTO")
      .add(TokenKind.END_FUNCTION, "END_FUNCTION", "FIN_FUNCION",
                      "FIN_FUNCIÓN", "END_PROCEDURE", "FIN_PROCEDIMIENTO")
      .add(TokenKind.RETURN, "RETURN", "RETORNAR", "DEVOLVER")
      .add(TokenKind.CALL, "CALL", "LLAMAR")
      .add(TokenKind.AND, "AND")
      .addExactCase(TokenKind.AND, "Y")
      .add(TokenKind.OR, "OR")
      .addExactCase(TokenKind.OR, "O")
      .add(TokenKind.NOT, "NOT", "NO")
      .add(TokenKind.MOD, "MOD")
      .add(TokenKind.DIV, "DIV")
      .add(TokenKind.TRUE, "TRUE", "VERDADERO")
      .add(TokenKind.FALSE, "FALSE", "FALSO")
      .add(TokenKind.INTEGER_TYPE, "INT", "INTEGER", "ENTERO")
      .add(TokenKind.REAL_TYPE, "REAL", "FLOAT")
      .add(TokenKind.STRING_TYPE, "STRING", "CADENA")
      .add(TokenKind.BOOLEAN_TYPE, "BOOLEAN", "BOOL", "BOOLEANO")
      .add(TokenKind.CHAR_TYPE, "CHAR", "CARACTER", "CARÁCTER");
  }

  public static class Builder {
    private final ImmutableMap.Builder<String, TokenKind> spellings =
                                              ImmutableMap.builder();
    private final ImmutableSet.Builder<String> exactCase =
                                              ImmutableSet.builder();

    public Builder add(TokenKind kind, String... words) {
      for (String word: words) {
        spellings.put(normalize(word), kind);
      }
      return this;
    }

    public Builder addExactCase(TokenKind kind, String... words) {
      for (String word: words) {
        String key = normalize(word);
        spellings.put(key, kind);
        exactCase.add(key);
      }
      return this;
    }

    private static String normalize(String word) {
      Preconditions.checkArgument(!word.isEmpty(), "empty keyword");
      return word.toUpperCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if a spelling was registered twice
     */
    public KeywordTable build(boolean caseInsensitive) {
      return new KeywordTable(spellings.build(), exactCase.build(),
                              caseInsensitive);
    }
  }
}
