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

/**
 * Double dispatch over the closed set of node kinds.  This is the contract
 * analyzers program against: one method per node class, so adding a node
 * kind breaks every visitor until it handles the new kind.
 *
 * @param <R> result of visiting a node; use Void for side-effecting walks
 */
public interface AstVisitor<R> {

  R visitProgram(Program program);

  // Statements
  R visitBlock(Block block);

  R visitVarDecl(VarDecl decl);

  R visitAssignment(Assignment assignment);

  R visitIf(IfStmt stmt);

  R visitWhile(WhileStmt stmt);

  R visitFor(ForStmt stmt);

  R visitRepeat(RepeatStmt stmt);

  R visitFunctionDecl(FunctionDecl decl);

  R visitCallStmt(CallStmt stmt);

  R visitReturn(ReturnStmt stmt);

  // Expressions
  R visitCall(CallExpr call);

  R visitBinary(BinaryExpr expr);

  R visitUnary(UnaryExpr expr);

  R visitArrayAccess(ArrayAccess access);

  R visitFieldAccess(FieldAccess access);

  R visitLiteral(Literal literal);

  R visitIdentifier(Identifier identifier);
}
