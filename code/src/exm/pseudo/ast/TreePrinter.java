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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import org.apache.commons.lang3.StringEscapeUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders a tree as an indented outline, one node per line.  With line
 * numbers enabled each statement is prefixed by its source line, which is
 * how the command line tool shows the line-to-statement mapping.
 */
public class TreePrinter implements AstVisitor<Void> {

  private static final int INDENT = 2;

  private final PrintWriter writer;
  private final boolean showLines;
  private int indent = 0;

  public TreePrinter(PrintWriter writer, boolean showLines) {
    this.writer = writer;
    this.showLines = showLines;
  }

  public static String print(Node node) {
    return print(node, false);
  }

  public static String print(Node node, boolean showLines) {
    StringWriter sw = new StringWriter();
    PrintWriter pw = new PrintWriter(sw);
    node.accept(new TreePrinter(pw, showLines));
    pw.flush();
    return sw.toString();
  }

  private void line(String text) {
    writer.print(StringUtils.repeat(' ', indent));
    writer.println(text);
  }

  private void stmtLine(Statement stmt, String text) {
    if (showLines) {
      line("@" + stmt.getLine() + " " + text);
    } else {
      line(text);
    }
  }

  private void child(Node node) {
    indent += INDENT;
    node.accept(this);
    indent -= INDENT;
  }

  private void children(List<? extends Node> nodes) {
    for (Node node: nodes) {
      child(node);
    }
  }

  private void section(String label, Node node) {
    indent += INDENT;
    line(label + ":");
    child(node);
    indent -= INDENT;
  }

  private void section(String label, List<? extends Node> nodes) {
    indent += INDENT;
    line(label + ":");
    children(nodes);
    indent -= INDENT;
  }

  private static String names(List<Identifier> ids) {
    StringBuilder sb = new StringBuilder();
    for (Identifier id: ids) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(id.getName());
    }
    return sb.toString();
  }

  @Override
  public Void visitProgram(Program program) {
    line("Program");
    children(program.getStatements());
    return null;
  }

  @Override
  public Void visitBlock(Block block) {
    stmtLine(block, "Block");
    children(block.getStatements());
    return null;
  }

  @Override
  public Void visitVarDecl(VarDecl decl) {
    TypeSpec type = decl.getType();
    stmtLine(decl, "VarDecl " + type + " " + names(decl.getNames()));
    if (type.isArray()) {
      section("dims", type.getDimensions());
    }
    if (decl.hasInitializer()) {
      section("init", decl.getInitializer());
    }
    return null;
  }

  @Override
  public Void visitAssignment(Assignment assignment) {
    stmtLine(assignment, "Assignment");
    indent += INDENT;
    assignment.getTarget().accept(this);
    indent -= INDENT;
    child(assignment.getValue());
    return null;
  }

  @Override
  public Void visitIf(IfStmt stmt) {
    stmtLine(stmt, "If");
    section("cond", stmt.getCondition());
    section("then", stmt.getThenBranch());
    if (stmt.hasElse()) {
      section("else", stmt.getElseBranch());
    }
    return null;
  }

  @Override
  public Void visitWhile(WhileStmt stmt) {
    stmtLine(stmt, "While");
    section("cond", stmt.getCondition());
    section("body", stmt.getBody());
    return null;
  }

  @Override
  public Void visitFor(ForStmt stmt) {
    stmtLine(stmt, "For " + stmt.getLoopVar().getName());
    section("from", stmt.getFrom());
    section("to", stmt.getTo());
    if (stmt.hasStep()) {
      section("step", stmt.getStep());
    }
    section("body", stmt.getBody());
    return null;
  }

  @Override
  public Void visitRepeat(RepeatStmt stmt) {
    stmtLine(stmt, "Repeat");
    section("body", stmt.getBody());
    section("until", stmt.getCondition());
    return null;
  }

  @Override
  public Void visitFunctionDecl(FunctionDecl decl) {
    stmtLine(decl, "Function " + decl.getName().getName() + "("
                   + names(decl.getParams()) + ")");
    children(decl.getBody());
    return null;
  }

  @Override
  public Void visitCallStmt(CallStmt stmt) {
    stmtLine(stmt, "CallStmt");
    child(stmt.getCall());
    return null;
  }

  @Override
  public Void visitReturn(ReturnStmt stmt) {
    stmtLine(stmt, "Return");
    if (stmt.hasValue()) {
      child(stmt.getValue());
    }
    return null;
  }

  @Override
  public Void visitCall(CallExpr call) {
    line("Call " + call.getCallee().getName());
    children(call.getArgs());
    return null;
  }

  @Override
  public Void visitBinary(BinaryExpr expr) {
    line("Binary " + expr.getOp().symbol());
    child(expr.getLeft());
    child(expr.getRight());
    return null;
  }

  @Override
  public Void visitUnary(UnaryExpr expr) {
    line("Unary " + expr.getOp().symbol());
    child(expr.getOperand());
    return null;
  }

  @Override
  public Void visitArrayAccess(ArrayAccess access) {
    line("Index");
    child(access.getBase());
    section("at", access.getIndices());
    return null;
  }

  @Override
  public Void visitFieldAccess(FieldAccess access) {
    line("Field " + access.getField().getName());
    child(access.getBase());
    return null;
  }

  @Override
  public Void visitLiteral(Literal literal) {
    String text;
    if (literal.getKind() == Literal.LiteralKind.STRING) {
      text = "\"" + StringEscapeUtils.escapeJava(literal.getStringValue())
             + "\"";
    } else {
      text = String.valueOf(literal.getValue());
    }
    line("Literal " + literal.getKind() + " " + text);
    return null;
  }

  @Override
  public Void visitIdentifier(Identifier identifier) {
    line("Identifier " + identifier.getName());
    return null;
  }
}
