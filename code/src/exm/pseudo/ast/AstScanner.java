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

import java.util.List;

/**
 * Visitor that walks the whole tree depth first, children in source
 * order.  Subclasses override the methods for the nodes they care about
 * and call the super method to keep descending.
 *
 * Every method returns {@link #defaultResult()} unless overridden.
 */
public abstract class AstScanner<R> implements AstVisitor<R> {

  protected R defaultResult() {
    return null;
  }

  /**
   * Visit a possibly-null node
   */
  public R scan(Node node) {
    if (node == null) {
      return defaultResult();
    }
    return node.accept(this);
  }

  public R scanTarget(LValue lval) {
    return lval.accept(this);
  }

  public R scanAll(List<? extends Node> nodes) {
    if (nodes != null) {
      for (Node node: nodes) {
        node.accept(this);
      }
    }
    return defaultResult();
  }

  @Override
  public R visitProgram(Program program) {
    return scanAll(program.getStatements());
  }

  @Override
  public R visitBlock(Block block) {
    return scanAll(block.getStatements());
  }

  @Override
  public R visitVarDecl(VarDecl decl) {
    scanAll(decl.getType().getDimensions());
    scanAll(decl.getNames());
    scan(decl.getInitializer());
    return defaultResult();
  }

  @Override
  public R visitAssignment(Assignment assignment) {
    scanTarget(assignment.getTarget());
    scan(assignment.getValue());
    return defaultResult();
  }

  @Override
  public R visitIf(IfStmt stmt) {
    scan(stmt.getCondition());
    scanAll(stmt.getThenBranch());
    scanAll(stmt.getElseBranch());
    return defaultResult();
  }

  @Override
  public R visitWhile(WhileStmt stmt) {
    scan(stmt.getCondition());
    scanAll(stmt.getBody());
    return defaultResult();
  }

  @Override
  public R visitFor(ForStmt stmt) {
    scan(stmt.getLoopVar());
    scan(stmt.getFrom());
    scan(stmt.getTo());
    scan(stmt.getStep());
    scanAll(stmt.getBody());
    return defaultResult();
  }

  @Override
  public R visitRepeat(RepeatStmt stmt) {
    scanAll(stmt.getBody());
    scan(stmt.getCondition());
    return defaultResult();
  }

  @Override
  public R visitFunctionDecl(FunctionDecl decl) {
    scan(decl.getName());
    scanAll(decl.getParams());
    scanAll(decl.getBody());
    return defaultResult();
  }

  @Override
  public R visitCallStmt(CallStmt stmt) {
    return scan(stmt.getCall());
  }

  @Override
  public R visitReturn(ReturnStmt stmt) {
    return scan(stmt.getValue());
  }

  @Override
  public R visitCall(CallExpr call) {
    scan(call.getCallee());
    scanAll(call.getArgs());
    return defaultResult();
  }

  @Override
  public R visitBinary(BinaryExpr expr) {
    scan(expr.getLeft());
    scan(expr.getRight());
    return defaultResult();
  }

  @Override
  public R visitUnary(UnaryExpr expr) {
    return scan(expr.getOperand());
  }

  @Override
  public R visitArrayAccess(ArrayAccess access) {
    scan(access.getBase());
    scanAll(access.getIndices());
    return defaultResult();
  }

  /**
   * Scans the base only.  The field name is not a variable reference.
   */
  @Override
  public R visitFieldAccess(FieldAccess access) {
    scan(access.getBase());
    return defaultResult();
  }

  @Override
  public R visitLiteral(Literal literal) {
    return defaultResult();
  }

  @Override
  public R visitIdentifier(Identifier identifier) {
    return defaultResult();
  }
}
