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

import static exm.pseudo.ast.AstFixtures.bin;
import static exm.pseudo.ast.AstFixtures.bool;
import static exm.pseudo.ast.AstFixtures.call;
import static exm.pseudo.ast.AstFixtures.field;
import static exm.pseudo.ast.AstFixtures.id;
import static exm.pseudo.ast.AstFixtures.index;
import static exm.pseudo.ast.AstFixtures.num;
import static exm.pseudo.ast.AstFixtures.real;
import static exm.pseudo.ast.AstFixtures.str;
import static exm.pseudo.ast.AstFixtures.unary;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import exm.pseudo.ast.Assignment;
import exm.pseudo.ast.BinaryOperator;
import exm.pseudo.ast.Expression;
import exm.pseudo.ast.FieldAccess;
import exm.pseudo.ast.Literal;
import exm.pseudo.ast.UnaryOperator;
import exm.pseudo.common.exceptions.ParseError;
import exm.pseudo.common.exceptions.SyntaxError;
import exm.pseudo.lexer.TokenKind;

public class ExpressionParserTest {

  /**
   * Parse text as the right hand side of an assignment
   */
  private static Expression expr(String text) throws ParseError {
    Assignment stmt = (Assignment)PseudocodeParser.parseSource("r <- " + text)
                                                  .getStatements().get(0);
    return stmt.getValue();
  }

  @Test
  public void testLiterals() throws ParseError {
    assertEquals(num(42), expr("42"));
    assertEquals(real(3.5), expr("3.5"));
    assertEquals(real(3.0), expr("3."));
    assertEquals(str("a\nb"), expr("\"a\\nb\""));
    assertEquals(bool(true), expr("VERDADERO"));
    assertEquals(bool(false), expr("false"));
    assertEquals(Literal.LiteralKind.INTEGER, ((Literal)expr("7")).getKind());
    assertEquals(Long.MAX_VALUE,
                 ((Literal)expr("9223372036854775807")).getIntegerValue());
  }

  @Test
  public void testIntegerOverflow() throws ParseError {
    try {
      expr("9223372036854775808");
      fail("expected SyntaxError");
    } catch (SyntaxError e) {
      assertEquals(1, e.getLine());
      assertEquals(6, e.getColumn());
      assertTrue(e.getMessage(), e.getMessage().contains("out of range"));
    }
  }

  @Test
  public void testArithmeticPrecedence() throws ParseError {
    assertEquals(bin(BinaryOperator.ADD, num(1),
                     bin(BinaryOperator.MULTIPLY, num(2), num(3))),
                 expr("1 + 2 * 3"));
    assertEquals(bin(BinaryOperator.MULTIPLY,
                     bin(BinaryOperator.ADD, num(1), num(2)), num(3)),
                 expr("(1 + 2) * 3"));
  }

  @Test
  public void testLeftAssociativity() throws ParseError {
    assertEquals(bin(BinaryOperator.SUBTRACT,
                     bin(BinaryOperator.SUBTRACT, id("a"), id("b")), id("c")),
                 expr("a - b - c"));
    assertEquals(bin(BinaryOperator.MOD,
                  bin(BinaryOperator.INT_DIVIDE,
                   bin(BinaryOperator.MOD,
                    bin(BinaryOperator.DIVIDE, id("a"), id("b")),
                    id("c")),
                   id("d")),
                  id("e")),
                 expr("a / b MOD c DIV d % e"));
    assertEquals(bin(BinaryOperator.OR,
                     bin(BinaryOperator.OR, id("a"), id("b")), id("c")),
                 expr("a OR b O c"));
  }

  @Test
  public void testLogicalPrecedence() throws ParseError {
    assertEquals(bin(BinaryOperator.OR, id("a"),
                     bin(BinaryOperator.AND, id("b"), id("c"))),
                 expr("a O b Y c"));
    assertEquals(bin(BinaryOperator.AND,
                     unary(UnaryOperator.NOT, id("a")), id("b")),
                 expr("NOT a AND b"));
    // NOT binds looser than relational operators
    assertEquals(unary(UnaryOperator.NOT,
                       bin(BinaryOperator.EQUAL, id("x"), num(0))),
                 expr("NO x = 0"));
    assertEquals(bin(BinaryOperator.AND,
                     bin(BinaryOperator.LESS, num(0), id("i")),
                     bin(BinaryOperator.LESS_EQUAL, id("i"), id("n"))),
                 expr("0 < i AND i <= n"));
  }

  @Test
  public void testRelational() throws ParseError {
    assertEquals(bin(BinaryOperator.LESS,
                     bin(BinaryOperator.ADD, id("a"), num(1)),
                     bin(BinaryOperator.MULTIPLY, id("b"), num(2))),
                 expr("a + 1 < b * 2"));
    assertEquals(bin(BinaryOperator.NOT_EQUAL, id("a"), id("b")),
                 expr("a <> b"));
    assertEquals(expr("a <> b"), expr("a != b"));
    assertEquals(bin(BinaryOperator.GREATER_EQUAL, id("a"), id("b")),
                 expr("a >= b"));
    // Equality inside an expression, not a second assignment
    assertEquals(bin(BinaryOperator.EQUAL, id("a"), id("b")), expr("a = b"));
  }

  @Test
  public void testUnary() throws ParseError {
    assertEquals(unary(UnaryOperator.NEGATE, num(5)), expr("-5"));
    assertEquals(unary(UnaryOperator.NEGATE,
                       unary(UnaryOperator.NEGATE, id("x"))),
                 expr("- -x"));
    assertEquals(unary(UnaryOperator.PLUS, id("x")), expr("+x"));
    assertEquals(bin(BinaryOperator.MULTIPLY,
                     unary(UnaryOperator.NEGATE, id("a")), id("b")),
                 expr("-a * b"));
    assertEquals(bin(BinaryOperator.SUBTRACT, id("a"),
                     unary(UnaryOperator.NEGATE, id("b"))),
                 expr("a - -b"));
  }

  @Test
  public void testCalls() throws ParseError {
    assertEquals(call("max", id("a"), bin(BinaryOperator.ADD, id("b"), num(1))),
                 expr("max(a, b + 1)"));
    assertEquals(call("now"), expr("now()"));
    assertEquals(call("f", call("g", id("x"))), expr("f(g(x))"));
    assertEquals(expr("f(x)"), expr("LLAMAR f(x)"));
    assertEquals(bin(BinaryOperator.ADD, num(1), call("f", id("x"))),
                 expr("1 + CALL f(x)"));
  }

  @Test
  public void testArrayAccess() throws ParseError {
    assertEquals(index(id("A"), bin(BinaryOperator.SUBTRACT, id("i"), num(1))),
                 expr("A[i - 1]"));
    assertEquals(index(index(id("m"), id("i")), id("j")), expr("m[i][j]"));
    assertEquals(index(id("m"), id("i"), id("j")), expr("m[i, j]"));
    assertEquals(index(id("A"), index(id("B"), id("k"))), expr("A[B[k]]"));
    assertEquals(bin(BinaryOperator.ADD, index(id("A"), num(0)), num(1)),
                 expr("A[0] + 1"));
  }

  @Test
  public void testExpressionPositions() throws ParseError {
    Expression e = expr("a +\n  b * c");
    assertEquals(1, e.getLine());
    assertEquals(6, e.getPosition().column);
    Expression neg = expr("x * -y");
    assertEquals(6, neg.getPosition().column);
  }

  @Test
  public void testFloorAndCeiling() throws ParseError {
    assertEquals(unary(UnaryOperator.FLOOR,
        bin(BinaryOperator.DIVIDE,
            bin(BinaryOperator.ADD, id("i"), id("j")), num(2))),
        expr("\u230A(i + j) / 2\u230B"));
    assertEquals(unary(UnaryOperator.CEILING,
        bin(BinaryOperator.DIVIDE, id("n"), num(2))),
        expr("\u2308n / 2\u2309"));
    // Brackets bind like parentheses
    assertEquals(bin(BinaryOperator.MULTIPLY, num(2),
        unary(UnaryOperator.FLOOR, id("x"))),
        expr("2 * \u230Ax\u230B"));
    Expression e = expr("\u230Ax\u230B");
    assertEquals(1, e.getPosition().line);
    assertEquals(6, e.getPosition().column);
  }

  @Test
  public void testMismatchedFloorBracket() throws ParseError {
    try {
      expr("\u230Ax\u2309");
      fail("expected SyntaxError");
    } catch (SyntaxError e) {
      assertEquals(8, e.getColumn());
      assertTrue(e.getExpectedKinds().contains(TokenKind.RFLOOR));
    }
  }

  @Test
  public void testFieldAccess() throws ParseError {
    assertEquals(field(id("A"), "length"), expr("A.length"));
    assertEquals(field(index(id("A"), id("i")), "x"), expr("A[i].x"));
    assertEquals(index(field(id("p"), "items"), num(0)),
                 expr("p.items[0]"));
    assertEquals(bin(BinaryOperator.SUBTRACT, field(id("A"), "length"),
                     num(1)),
                 expr("A.length - 1"));
    // A '.' after digits stays part of the number
    assertEquals(real(3.5), expr("3.5"));
    FieldAccess access = (FieldAccess)expr("A.b.c");
    assertEquals(field(id("A"), "b"), access.getBase());
    assertEquals(id("A"), access.rootVariable());
  }

  @Test
  public void testFieldNameRequired() throws ParseError {
    try {
      expr("A.1");
      fail("expected SyntaxError");
    } catch (SyntaxError e) {
      assertEquals(8, e.getColumn());
      assertTrue(e.getExpectedKinds().contains(TokenKind.IDENTIFIER));
    }
  }
}
