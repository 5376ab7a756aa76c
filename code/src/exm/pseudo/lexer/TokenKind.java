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

/**
 * Canonical token kinds.  Every keyword spelling, in either language, maps
 * to exactly one of these, so the parser never sees which language a
 * program was written in.
 */
public enum TokenKind {
  // Control flow keywords
  IF("IF/SI"),
  THEN("THEN/ENTONCES"),
  ELSE("ELSE/SINO"),
  END_IF("END_IF/FIN_SI"),
  WHILE("WHILE/MIENTRAS"),
  DO("DO/HACER"),
  END_WHILE("END_WHILE/FIN_MIENTRAS"),
  FOR("FOR/PARA"),
  TO("TO/HASTA"),
  STEP("STEP/PASO"),
  END_FOR("END_FOR/FIN_PARA"),
  REPEAT("REPEAT/REPETIR"),
  UNTIL("UNTIL/HASTA_QUE"),
  BEGIN("BEGIN/INICIO"),
  END("END/FIN"),
  FUNCTION("FUNCTION/FUNCION"),
  END_FUNCTION("END_FUNCTION/FIN_FUNCION"),
  RETURN("RETURN/RETORNAR"),
  CALL("CALL/LLAMAR"),

  // Logical and arithmetic keywords
  AND("AND/Y"),
  OR("OR/O"),
  NOT("NOT/NO"),
  MOD("MOD"),
  DIV("DIV"),
  TRUE("TRUE/VERDADERO"),
  FALSE("FALSE/FALSO"),

  // Type keywords
  INTEGER_TYPE("INTEGER/ENTERO"),
  REAL_TYPE("REAL"),
  STRING_TYPE("STRING/CADENA"),
  BOOLEAN_TYPE("BOOLEAN/BOOLEANO"),
  CHAR_TYPE("CHAR/CARACTER"),

  // Names and literals
  IDENTIFIER("identifier"),
  INT_LITERAL("integer literal"),
  REAL_LITERAL("real literal"),
  STRING_LITERAL("string literal"),

  // Operators
  PLUS("'+'"),
  MINUS("'-'"),
  STAR("'*'"),
  SLASH("'/'"),
  PERCENT("'%'"),
  EQUALS("'='"),
  ARROW("'<-'"),
  NOT_EQUAL("'<>'"),
  LESS("'<'"),
  LESS_EQUAL("'<='"),
  GREATER("'>'"),
  GREATER_EQUAL("'>='"),

  // Punctuation
  LPAREN("'('"),
  RPAREN("')'"),
  LBRACKET("'['"),
  RBRACKET("']'"),
  LBRACE("'{'"),
  RBRACE("'}'"),
  COMMA("','"),
  SEMICOLON("';'"),
  DOT("'.'"),
  LFLOOR("'\u230A'"),
  RFLOOR("'\u230B'"),
  LCEIL("'\u2308'"),
  RCEIL("'\u2309'"),

  EOF("end of input");

  private final String description;

  private TokenKind(String description) {
    this.description = description;
  }

  /**
   * @return human readable name for diagnostics, listing both spellings
   *         for bilingual keywords
   */
  public String description() {
    return description;
  }

  public boolean isTypeKeyword() {
    switch (this) {
      case INTEGER_TYPE:
      case REAL_TYPE:
      case STRING_TYPE:
      case BOOLEAN_TYPE:
      case CHAR_TYPE:
        return true;
      default:
        return false;
    }
  }
}
