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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.pseudo.common.exceptions.ParseError;
import exm.pseudo.parser.PseudocodeParser;

public class AstScannerTest {

  /** Names of all called functions, in visit order */
  private static class CallCollector extends AstScanner<Void> {
    final List<String> callees = new ArrayList<String>();

    @Override
    public Void visitCall(CallExpr call) {
      callees.add(call.getCallee().getName());
      return super.visitCall(call);
    }
  }

  /** Counts identifier references, including declared names */
  private static class IdentifierCounter extends AstScanner<Integer> {
    int count = 0;

    @Override
    protected Integer defaultResult() {
      return count;
    }

    @Override
    public Integer visitIdentifier(Identifier identifier) {
      count++;
      return defaultResult();
    }
  }

  private static boolean isRecursive(FunctionDecl decl) {
    CallCollector calls = new CallCollector();
    calls.scanAll(decl.getBody());
    return calls.callees.contains(decl.getName().getName());
  }

  @Test
  public void testCollectCalls() throws ParseError {
    Program program = PseudocodeParser.parseSource(
        "x <- f(g(1), A[h(2)])\n" +
        "SI p(x) ENTONCES LLAMAR q() SINO r(x) FIN_SI\n" +
        "REPETIR s() HASTA_QUE t()\n" +
        "RETORNAR u(v)");
    CallCollector collector = new CallCollector();
    program.accept(collector);
    assertEquals(Arrays.asList("f", "g", "h", "p", "q", "r", "s", "t", "u"),
                 collector.callees);
  }

  @Test
  public void testRecursionDetection() throws ParseError {
    Program program = PseudocodeParser.parseSource(
        "FUNCION fib(n)\n" +
        "  SI n < 2 ENTONCES RETORNAR n FIN_SI\n" +
        "  RETORNAR fib(n - 1) + fib(n - 2)\n" +
        "FIN_FUNCION\n" +
        "FUNCION cuadrado(n)\n" +
        "  RETORNAR n * n\n" +
        "FIN_FUNCION\n");
    FunctionDecl fib = (FunctionDecl)program.getStatements().get(0);
    FunctionDecl square = (FunctionDecl)program.getStatements().get(1);
    assertTrue(isRecursive(fib));
    assertFalse(isRecursive(square));
  }

  @Test
  public void testVisitsEveryIdentifier() throws ParseError {
    Program program = PseudocodeParser.parseSource(
        "ENTERO[n] A, B = m\n" +
        "PARA i <- a HASTA b PASO c HACER A[i][j] <- -k FIN_PARA\n" +
        "RETORNAR\n" +
        "SI ok ENTONCES FIN_SI\n");
    IdentifierCounter counter = new IdentifierCounter();
    // n A B m, i a b c A i j k, ok
    assertEquals(Integer.valueOf(13), counter.scan(program));
  }

  @Test
  public void testFieldNamesAreNotReferences() throws ParseError {
    Program program = PseudocodeParser.parseSource(
        "A.length <- B[i].n + \u230Ac.x\u230B");
    // A, B i, c
    assertEquals(Integer.valueOf(4), new IdentifierCounter().scan(program));
  }

  @Test
  public void testScanNull() {
    assertEquals(Integer.valueOf(0), new IdentifierCounter().scan(null));
  }
}
