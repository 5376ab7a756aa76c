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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Shorthand constructors for expected trees.  Positions are arbitrary
 * since structural equality ignores them.
 */
public class AstFixtures {
  public static final SourcePosition P = new SourcePosition(1, 1);

  public static Identifier id(String name) {
    return new Identifier(P, name);
  }

  public static Literal num(long value) {
    return Literal.ofInteger(P, value);
  }

  public static Literal real(double value) {
    return Literal.ofReal(P, value);
  }

  public static Literal str(String value) {
    return Literal.ofString(P, value);
  }

  public static Literal bool(boolean value) {
    return Literal.ofBoolean(P, value);
  }

  public static BinaryExpr bin(BinaryOperator op, Expression left,
                               Expression right) {
    return new BinaryExpr(P, op, left, right);
  }

  public static UnaryExpr unary(UnaryOperator op, Expression operand) {
    return new UnaryExpr(P, op, operand);
  }

  public static ArrayAccess index(Expression base, Expression... indices) {
    return new ArrayAccess(P, base, Arrays.asList(indices));
  }

  public static FieldAccess field(Expression base, String name) {
    return new FieldAccess(P, base, id(name));
  }

  public static CallExpr call(String name, Expression... args) {
    return new CallExpr(P, id(name), Arrays.asList(args));
  }

  public static CallStmt callStmt(String name, Expression... args) {
    return new CallStmt(P, call(name, args));
  }

  public static Assignment assign(LValue target, Expression value) {
    return new Assignment(P, target, value);
  }

  public static Assignment assign(String name, Expression value) {
    return assign(id(name), value);
  }

  public static VarDecl decl(PrimitiveType type, List<Expression> dims,
                        Expression init, String... names) {
    List<Identifier> ids = new ArrayList<Identifier>();
    for (String name: names) {
      ids.add(id(name));
    }
    return new VarDecl(P, new TypeSpec(type, dims), ids, init);
  }

  public static VarDecl decl(PrimitiveType type, Expression init,
                             String... names) {
    return decl(type, Collections.<Expression>emptyList(), init, names);
  }

  public static List<Statement> stmts(Statement... statements) {
    return Arrays.asList(statements);
  }

  public static Program program(Statement... statements) {
    return new Program(P, Arrays.asList(statements));
  }
}
