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

package exm.pseudo.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.commons.lang3.StringUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.pseudo.common.exceptions.LexicalError;
import exm.pseudo.common.exceptions.ParseError;
import exm.pseudo.common.exceptions.SyntaxError;
import exm.pseudo.lexer.TokenKind;

public class ParseErrorTest {

  @Rule
  public ExpectedException thrown = ExpectedException.none();

  /**
   * Parse source that must fail with a syntax error
   */
  private static SyntaxError syntaxError(String source) {
    try {
      PseudocodeParser.parseSource(source);
    } catch (SyntaxError e) {
      return e;
    } catch (ParseError e) {
      fail("Expected SyntaxError but got " + e);
    }
    fail("Expected SyntaxError for: " + source);
    return null;
  }

  private static void assertAt(ParseError e, int line, int column) {
    assertEquals(e.getMessage(), line, e.getLine());
    assertEquals(e.getMessage(), column, e.getColumn());
  }

  @Test
  public void testMissingEndWhile() {
    SyntaxError e = syntaxError("MIENTRAS x < 10 HACER x = x + 1");
    assertAt(e, 1, 1);
    assertTrue(e.getExpectedKinds().contains(TokenKind.END_WHILE));
    assertTrue(e.getMessage(), e.getMessage().contains("END_WHILE/FIN_MIENTRAS"));
    assertTrue(e.getMessage(), e.getMessage().contains("end of input"));
  }

  @Test
  public void testMissingEndIfReportsHeader() {
    // The FIN_PARA closing the loop must not be mistaken for the
    // missing terminator
    SyntaxError e = syntaxError(
        "PARA i = 1 HASTA n HACER\n" +
        "  SI i > 2 ENTONCES\n" +
        "    print(i)\n" +
        "FIN_PARA");
    assertAt(e, 2, 3);
    assertTrue(e.getExpectedKinds().contains(TokenKind.END_IF));
    assertTrue(e.getExpectedKinds().contains(TokenKind.ELSE));
    assertTrue(e.getDetail(), e.getDetail().contains("'FIN_PARA' at 4:1"));
  }

  @Test
  public void testMissingEndIfAfterElse() {
    SyntaxError e = syntaxError(
        "SI x ENTONCES\n  a <- 1\nSINO\n  a <- 2\n");
    assertAt(e, 1, 1);
    assertEquals(1, e.getExpectedKinds().size());
    assertTrue(e.getExpectedKinds().contains(TokenKind.END_IF));
  }

  @Test
  public void testMissingBlockEnd() {
    SyntaxError e = syntaxError("x <- 0\nINICIO\n  x <- 1\n");
    assertAt(e, 2, 1);
    assertTrue(e.getExpectedKinds().contains(TokenKind.END));

    e = syntaxError("{ x <- 1 END");
    assertAt(e, 1, 1);
    assertTrue(e.getExpectedKinds().contains(TokenKind.RBRACE));
  }

  @Test
  public void testMissingUntilAndEndFunction() {
    SyntaxError e = syntaxError("REPETIR x <- 1");
    assertTrue(e.getExpectedKinds().contains(TokenKind.UNTIL));

    e = syntaxError("\nFUNCION f(a)\n  RETORNAR a\n");
    assertAt(e, 2, 1);
    assertTrue(e.getExpectedKinds().contains(TokenKind.END_FUNCTION));
  }

  @Test
  public void testMissingThen() {
    SyntaxError e = syntaxError("SI x > 0\n  y <- 1\nFIN_SI");
    assertAt(e, 2, 3);
    assertTrue(e.getExpectedKinds().contains(TokenKind.THEN));
    assertTrue(e.getMessage(), e.getMessage().contains("THEN/ENTONCES"));
  }

  @Test
  public void testMissingDo() {
    SyntaxError e = syntaxError("PARA i = 1 HASTA 10\n  x <- i\nFIN_PARA");
    assertTrue(e.getExpectedKinds().contains(TokenKind.DO));
    e = syntaxError("PARA i HASTA 10 HACER FIN_PARA");
    assertAt(e, 1, 8);
    assertTrue(e.getExpectedKinds().contains(TokenKind.ARROW));
  }

  @Test
  public void testStrayTerminator() {
    SyntaxError e = syntaxError("x <- 1\nFIN_SI");
    assertAt(e, 2, 1);
    assertTrue(e.getMessage(), e.getMessage().contains("'FIN_SI'"));
  }

  @Test
  public void testNotAStatement() {
    SyntaxError e = syntaxError("5 <- x");
    assertAt(e, 1, 1);
    assertTrue(e.getExpectedKinds().contains(TokenKind.IDENTIFIER));
    assertTrue(e.getExpectedKinds().contains(TokenKind.IF));
  }

  @Test
  public void testBareIdentifier() {
    SyntaxError e = syntaxError("x + 1");
    assertAt(e, 1, 3);
    assertTrue(e.getExpectedKinds().contains(TokenKind.EQUALS));
  }

  @Test
  public void testBadAssignmentTarget() {
    SyntaxError e = syntaxError("f(x) <- 1");
    assertAt(e, 1, 1);
    e = syntaxError("f(x)[0] <- 1");
    assertAt(e, 1, 1);
  }

  @Test
  public void testMalformedExpressions() {
    SyntaxError e = syntaxError("x <- (1 + 2");
    assertAt(e, 1, 12);
    assertTrue(e.getExpectedKinds().contains(TokenKind.RPAREN));

    e = syntaxError("x <- 1 +");
    assertAt(e, 1, 9);
    assertTrue(e.getExpectedKinds().contains(TokenKind.INT_LITERAL));

    e = syntaxError("x <- A[1");
    assertTrue(e.getExpectedKinds().contains(TokenKind.RBRACKET));

    e = syntaxError("x <- f(1,)");
    assertAt(e, 1, 10);
  }

  @Test
  public void testCallKeywordNeedsArguments() {
    SyntaxError e = syntaxError("LLAMAR f");
    assertTrue(e.getExpectedKinds().contains(TokenKind.LPAREN));
  }

  @Test
  public void testDeclarationErrors() {
    // Dimensions after a name only for a single name
    SyntaxError e = syntaxError("ENTERO A[10], B");
    assertAt(e, 1, 13);
    e = syntaxError("ENTERO A, B[10]");
    assertAt(e, 1, 12);
    e = syntaxError("ENTERO[5] A[10]");
    assertAt(e, 1, 12);
    e = syntaxError("ENTERO = 5");
    assertTrue(e.getExpectedKinds().contains(TokenKind.IDENTIFIER));
  }

  @Test
  public void testHeaderFormParameters() {
    SyntaxError e = syntaxError("f(a, 1) INICIO FIN");
    assertAt(e, 1, 6);
  }

  @Test
  public void testLexicalErrorIsParseError() throws ParseError {
    thrown.expect(LexicalError.class);
    thrown.expectMessage("1:10: ");
    PseudocodeParser.parseSource("x <- 1 + @");
  }

  @Test
  public void testNoPartialResultOnError() {
    // Error deep in the program after valid statements
    SyntaxError e = syntaxError("a <- 1\nb <- 2\nc <- )");
    assertAt(e, 3, 6);
  }

  @Test
  public void testDeeplyNestedParentheses() {
    SyntaxError e = syntaxError("x <- " + StringUtils.repeat('(', 20000)
                                + "1" + StringUtils.repeat(')', 20000));
    assertEquals(1, e.getLine());
    assertTrue(e.getMessage(), e.getMessage().contains("nested too deeply"));
  }

  @Test
  public void testDeeplyNestedStatements() {
    int levels = Parser.MAX_NESTING + 1;
    String source = StringUtils.repeat("SI c ENTONCES\n", levels)
                    + StringUtils.repeat("FIN_SI\n", levels);
    SyntaxError e = syntaxError(source);
    // The innermost allowed IF has no room left for its condition
    assertAt(e, Parser.MAX_NESTING, 4);
    assertTrue(e.getMessage(), e.getMessage().contains("nested too deeply"));
  }

  @Test
  public void testDeeplyNestedPrefixOperators() {
    SyntaxError e = syntaxError("x <- " + StringUtils.repeat("- ", 20000)
                                + "1");
    assertTrue(e.getMessage(), e.getMessage().contains("nested too deeply"));
    e = syntaxError("x <- " + StringUtils.repeat("NO ", 20000) + "c");
    assertTrue(e.getMessage(), e.getMessage().contains("nested too deeply"));
  }

  @Test
  public void testNestingWithinLimit() throws ParseError {
    int levels = Parser.MAX_NESTING / 2;
    PseudocodeParser.parseSource("x <- " + StringUtils.repeat('(', levels)
                                 + "1" + StringUtils.repeat(')', levels));
  }

  @Test
  public void testFieldOfCallNotAssignable() {
    SyntaxError e = syntaxError("f(x).y <- 1");
    assertAt(e, 1, 1);
    assertTrue(e.getMessage(), e.getMessage().contains("field"));
  }

  @Test
  public void testUntilNeedsQue() {
    // HASTA without QUE does not close a REPEAT
    SyntaxError e = syntaxError("REPETIR x <- 1 HASTA x > 0");
    assertAt(e, 1, 16);
    assertTrue(e.getMessage(), e.getMessage().contains("HASTA"));
    assertTrue(e.getExpectedKinds().contains(TokenKind.IDENTIFIER));
  }
}
