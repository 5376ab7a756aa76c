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

package exm.pseudo.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

import exm.pseudo.common.exceptions.ParseError;
import exm.pseudo.parser.PseudocodeParser;

public class TreePrinterTest {

  private static String lines(String... lines) {
    String nl = System.lineSeparator();
    return StringUtils.join(lines, nl) + nl;
  }

  @Test
  public void testIfWithLines() throws ParseError {
    Program program = PseudocodeParser.parseSource(
        "SI x > 0 ENTONCES\n" +
        "  y <- 1\n" +
        "SINO\n" +
        "  y <- -2\n" +
        "FIN_SI");
    assertEquals(lines(
        "Program",
        "  @1 If",
        "    cond:",
        "      Binary >",
        "        Identifier x",
        "        Literal INTEGER 0",
        "    then:",
        "      @2 Assignment",
        "        Identifier y",
        "        Literal INTEGER 1",
        "    else:",
        "      @4 Assignment",
        "        Identifier y",
        "        Unary -",
        "          Literal INTEGER 2"),
        TreePrinter.print(program, true));
  }

  @Test
  public void testDeclarationsAndLoops() throws ParseError {
    Program program = PseudocodeParser.parseSource(
        "REAL[n] v = 0.5\n" +
        "PARA i <- 1 HASTA n PASO 2 HACER\n" +
        "  v[i] <- \"a\\tb\"\n" +
        "FIN_PARA");
    assertEquals(lines(
        "Program",
        "  VarDecl REAL[] v",
        "    dims:",
        "      Identifier n",
        "    init:",
        "      Literal REAL 0.5",
        "  For i",
        "    from:",
        "      Literal INTEGER 1",
        "    to:",
        "      Identifier n",
        "    step:",
        "      Literal INTEGER 2",
        "    body:",
        "      Assignment",
        "        Index",
        "          Identifier v",
        "          at:",
        "            Identifier i",
        "        Literal STRING \"a\\tb\""),
        TreePrinter.print(program));
  }

  @Test
  public void testFunctionsAndCalls() throws ParseError {
    Program program = PseudocodeParser.parseSource(
        "FUNCION f(a, b)\n" +
        "  RETORNAR a MOD b\n" +
        "FIN_FUNCION\n" +
        "REPETIR LLAMAR f(1, VERDADERO) HASTA_QUE NO listo\n" +
        "{ RETORNAR }");
    assertEquals(lines(
        "Program",
        "  Function f(a, b)",
        "    Return",
        "      Binary MOD",
        "        Identifier a",
        "        Identifier b",
        "  Repeat",
        "    body:",
        "      CallStmt",
        "        Call f",
        "          Literal INTEGER 1",
        "          Literal BOOLEAN true",
        "    until:",
        "      Unary NOT",
        "        Identifier listo",
        "  Block",
        "    Return"),
        TreePrinter.print(program));
  }

  @Test
  public void testFloorAndField() throws ParseError {
    Program program = PseudocodeParser.parseSource(
        "m <- \u230AA.length / 2\u230B + \u2308x\u2309");
    assertEquals(lines(
        "Program",
        "  Assignment",
        "    Identifier m",
        "    Binary +",
        "      Unary FLOOR",
        "        Binary /",
        "          Field length",
        "            Identifier A",
        "          Literal INTEGER 2",
        "      Unary CEILING",
        "        Identifier x"),
        TreePrinter.print(program));
  }

  @Test
  public void testNodeToString() throws ParseError {
    Program program = PseudocodeParser.parseSource("x <- a + 1");
    Node value = ((Assignment)program.getStatements().get(0)).getValue();
    assertTrue(value.toString(), value.toString().startsWith("Binary +"));
  }
}
