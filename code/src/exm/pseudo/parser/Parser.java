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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

import exm.pseudo.ast.ArrayAccess;
import exm.pseudo.ast.Assignment;
import exm.pseudo.ast.BinaryExpr;
import exm.pseudo.ast.BinaryOperator;
import exm.pseudo.ast.Block;
import exm.pseudo.ast.CallExpr;
import exm.pseudo.ast.CallStmt;
import exm.pseudo.ast.Expression;
import exm.pseudo.ast.FieldAccess;
import exm.pseudo.ast.ForStmt;
import exm.pseudo.ast.FunctionDecl;
import exm.pseudo.ast.Identifier;
import exm.pseudo.ast.IfStmt;
import exm.pseudo.ast.LValue;
import exm.pseudo.ast.Literal;
import exm.pseudo.ast.PrimitiveType;
import exm.pseudo.ast.Program;
import exm.pseudo.ast.RepeatStmt;
import exm.pseudo.ast.ReturnStmt;
import exm.pseudo.ast.SourcePosition;
import exm.pseudo.ast.Statement;
import exm.pseudo.ast.TypeSpec;
import exm.pseudo.ast.UnaryExpr;
import exm.pseudo.ast.UnaryOperator;
import exm.pseudo.ast.VarDecl;
import exm.pseudo.ast.WhileStmt;
import exm.pseudo.common.Logging;
import exm.pseudo.common.exceptions.PseudoRuntimeError;
import exm.pseudo.common.exceptions.SyntaxError;
import exm.pseudo.lexer.Token;
import exm.pseudo.lexer.TokenKind;

/**
 * Recursive descent parser over a token list, one token of lookahead and
 * no backtracking.  Every statement form is selected by its first token.
 *
 * A parser instance is used for a single parse and then discarded.  It
 * fails at the first token the grammar does not allow; a compound
 * statement missing its terminator is reported at the statement's header
 * so the error points at the construct left open.
 */
public class Parser {

  private static final Logger logger = Logging.getLogger();

  /** Tokens that end a statement list */
  private static final Set<TokenKind> LIST_ENDS = Sets.immutableEnumSet(
      TokenKind.END_IF, TokenKind.ELSE, TokenKind.END_WHILE,
      TokenKind.END_FOR, TokenKind.UNTIL, TokenKind.END,
      TokenKind.RBRACE, TokenKind.END_FUNCTION, TokenKind.EOF);

  private static final Set<TokenKind> STATEMENT_STARTS =
      Sets.immutableEnumSet(TokenKind.BEGIN, TokenKind.LBRACE,
          TokenKind.INTEGER_TYPE, TokenKind.REAL_TYPE,
          TokenKind.STRING_TYPE, TokenKind.BOOLEAN_TYPE,
          TokenKind.CHAR_TYPE, TokenKind.IF, TokenKind.WHILE,
          TokenKind.FOR, TokenKind.REPEAT, TokenKind.FUNCTION,
          TokenKind.RETURN, TokenKind.CALL, TokenKind.IDENTIFIER);

  private static final Set<TokenKind> EXPRESSION_STARTS =
      Sets.immutableEnumSet(TokenKind.IDENTIFIER, TokenKind.INT_LITERAL,
          TokenKind.REAL_LITERAL, TokenKind.STRING_LITERAL,
          TokenKind.TRUE, TokenKind.FALSE, TokenKind.LPAREN,
          TokenKind.MINUS, TokenKind.PLUS, TokenKind.NOT, TokenKind.CALL,
          TokenKind.LFLOOR, TokenKind.LCEIL);

  /**
   * Maximum depth of nested statements, parentheses and prefix operators
   * together.  Deeper input is rejected with a SyntaxError.
   */
  public static final int MAX_NESTING = 200;

  /** Spanish two-word spelling "HASTA QUE" of UNTIL, after HASTA */
  private static final String UNTIL_SECOND_WORD = "QUE";

  private final List<Token> tokens;
  private int current = 0;
  private int depth = 0;

  /**
   * @param tokens lexer output, ending with an EOF token
   */
  public Parser(List<Token> tokens) {
    Preconditions.checkArgument(!tokens.isEmpty() &&
        tokens.get(tokens.size() - 1).is(TokenKind.EOF),
        "token list must end with EOF");
    this.tokens = tokens;
  }

  public Program parseProgram() throws SyntaxError {
    List<Statement> statements = new ArrayList<Statement>();
    while (!check(TokenKind.EOF)) {
      Token tok = peek();
      if (LIST_ENDS.contains(tok.kind())) {
        throw new SyntaxError(tok.line(), tok.column(), "Unexpected "
            + tok.describe() + " with no open statement for it to close");
      }
      statements.add(parseStatement());
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed " + statements.size() + " top-level statements");
    }
    return new Program(new SourcePosition(1, 1), statements);
  }

  // ---------------------------------------------------------------------
  // Statements
  // ---------------------------------------------------------------------

  private Statement parseStatement() throws SyntaxError {
    Token tok = peek();
    Statement stmt;
    enterNested();
    try {
      stmt = parseStatementBody(tok);
    } finally {
      depth--;
    }
    // Terminator is optional
    match(TokenKind.SEMICOLON);

    if (logger.isTraceEnabled()) {
      logger.trace("line " + stmt.getLine() + ": "
                   + stmt.getClass().getSimpleName());
    }
    return stmt;
  }

  private Statement parseStatementBody(Token tok) throws SyntaxError {
    if (tok.kind().isTypeKeyword()) {
      return parseVarDecl();
    }
    Statement stmt;
    switch (tok.kind()) {
      case BEGIN:
      case LBRACE:
        stmt = parseBlock();
        break;
      case IF:
        stmt = parseIf();
        break;
      case WHILE:
        stmt = parseWhile();
        break;
      case FOR:
        stmt = parseFor();
        break;
      case REPEAT:
        stmt = parseRepeat();
        break;
      case FUNCTION:
        stmt = parseFunctionDecl();
        break;
      case RETURN:
        stmt = parseReturn();
        break;
      case CALL:
        stmt = parseCallStmt();
        break;
      case IDENTIFIER:
        stmt = parseAssignmentOrCall();
        break;
      default:
        throw new SyntaxError(tok.line(), tok.column(),
            "Expected a statement but found " + tok.describe(),
            STATEMENT_STARTS);
    }
    return stmt;
  }

  /**
   * Parse statements up to (not including) the next token that can end a
   * statement list.  The caller checks that it is the right one.
   */
  private List<Statement> parseStatementList() throws SyntaxError {
    List<Statement> statements = new ArrayList<Statement>();
    while (!LIST_ENDS.contains(peek().kind()) && !atSpacedUntil()) {
      statements.add(parseStatement());
    }
    return statements;
  }

  private Block parseBlock() throws SyntaxError {
    Token open = advance();
    List<Statement> body = parseBlockBody(open);
    return new Block(pos(open), body);
  }

  /**
   * @param open BEGIN or '{' token, already consumed
   * @return statements up to and including the matching closer
   */
  private List<Statement> parseBlockBody(Token open) throws SyntaxError {
    List<Statement> body = parseStatementList();
    if (open.is(TokenKind.BEGIN)) {
      close(open, TokenKind.END);
    } else {
      close(open, TokenKind.RBRACE);
    }
    return body;
  }

  private VarDecl parseVarDecl() throws SyntaxError {
    Token typeTok = advance();
    PrimitiveType primitive = primitiveType(typeTok);

    List<Expression> dims = parseDimensions();
    boolean dimsAfterName = false;

    List<Identifier> names = new ArrayList<Identifier>();
    names.add(expectIdentifier("as variable name"));
    if (check(TokenKind.LBRACKET)) {
      if (!dims.isEmpty()) {
        throw error(peek(), "Array dimensions given both after the type"
                            + " and after the variable name");
      }
      dims = parseDimensions();
      dimsAfterName = true;
    }

    while (check(TokenKind.COMMA)) {
      Token comma = advance();
      if (dimsAfterName) {
        throw error(comma, "Array dimensions in a declaration of several"
            + " names must follow the type keyword, e.g. "
            + typeTok.lexeme() + "[n] a, b");
      }
      names.add(expectIdentifier("as variable name"));
      if (check(TokenKind.LBRACKET)) {
        throw error(peek(), "Array dimensions in a declaration of several"
            + " names must follow the type keyword, e.g. "
            + typeTok.lexeme() + "[n] a, b");
      }
    }

    Expression initializer = null;
    if (check(TokenKind.EQUALS) || check(TokenKind.ARROW)) {
      advance();
      initializer = parseExpression();
    }
    return new VarDecl(pos(typeTok), new TypeSpec(primitive, dims), names,
                       initializer);
  }

  /**
   * Zero or more [size, ...] suffixes
   */
  private List<Expression> parseDimensions() throws SyntaxError {
    List<Expression> dims = new ArrayList<Expression>();
    while (check(TokenKind.LBRACKET)) {
      dims.addAll(parseBracketed(advance()));
    }
    return dims;
  }

  private static PrimitiveType primitiveType(Token tok) {
    switch (tok.kind()) {
      case INTEGER_TYPE:
        return PrimitiveType.INTEGER;
      case REAL_TYPE:
        return PrimitiveType.REAL;
      case STRING_TYPE:
        return PrimitiveType.STRING;
      case BOOLEAN_TYPE:
        return PrimitiveType.BOOLEAN;
      case CHAR_TYPE:
        return PrimitiveType.CHAR;
      default:
        throw new PseudoRuntimeError("Not a type keyword: " + tok);
    }
  }

  private IfStmt parseIf() throws SyntaxError {
    Token ifTok = advance();
    Expression condition = parseExpression();
    expect(TokenKind.THEN, "after IF condition");
    List<Statement> thenBranch = parseStatementList();
    List<Statement> elseBranch = null;
    if (match(TokenKind.ELSE)) {
      elseBranch = parseStatementList();
      close(ifTok, TokenKind.END_IF);
    } else {
      close(ifTok, TokenKind.END_IF, TokenKind.ELSE);
    }
    return new IfStmt(pos(ifTok), condition, thenBranch, elseBranch);
  }

  private WhileStmt parseWhile() throws SyntaxError {
    Token whileTok = advance();
    Expression condition = parseExpression();
    expect(TokenKind.DO, "after WHILE condition");
    List<Statement> body = parseStatementList();
    close(whileTok, TokenKind.END_WHILE);
    return new WhileStmt(pos(whileTok), condition, body);
  }

  private ForStmt parseFor() throws SyntaxError {
    Token forTok = advance();
    Identifier loopVar = expectIdentifier("as loop variable");
    expectAssignOp("after loop variable");
    Expression from = parseExpression();
    expect(TokenKind.TO, "after loop start value");
    Expression to = parseExpression();
    Expression step = null;
    if (match(TokenKind.STEP)) {
      step = parseExpression();
    }
    expect(TokenKind.DO, "after FOR header");
    List<Statement> body = parseStatementList();
    close(forTok, TokenKind.END_FOR);
    return new ForStmt(pos(forTok), loopVar, from, to, step, body);
  }

  private RepeatStmt parseRepeat() throws SyntaxError {
    Token repeatTok = advance();
    List<Statement> body = parseStatementList();
    if (atSpacedUntil()) {
      advance();
      advance();
    } else {
      close(repeatTok, TokenKind.UNTIL);
    }
    Expression condition = parseExpression();
    return new RepeatStmt(pos(repeatTok), body, condition);
  }

  /**
   * FUNCTION name(params) followed either by a block, or by statements
   * and END_FUNCTION
   */
  private FunctionDecl parseFunctionDecl() throws SyntaxError {
    Token fnTok = advance();
    Identifier name = expectIdentifier("as function name");
    Token open = expect(TokenKind.LPAREN, "after function name");
    List<Identifier> params = new ArrayList<Identifier>();
    if (!check(TokenKind.RPAREN)) {
      do {
        params.add(expectIdentifier("as parameter name"));
      } while (match(TokenKind.COMMA));
    }
    closeParen(open);

    List<Statement> body;
    if (check(TokenKind.BEGIN) || check(TokenKind.LBRACE)) {
      body = parseBlockBody(advance());
    } else {
      body = parseStatementList();
      close(fnTok, TokenKind.END_FUNCTION);
    }
    return new FunctionDecl(pos(fnTok), name, params, body);
  }

  /**
   * The form "name(a, b) BEGIN ... END", where the header was parsed as a
   * call before BEGIN showed it to be a definition.
   */
  private FunctionDecl functionFromHeader(Token start, CallExpr header)
                                                    throws SyntaxError {
    List<Identifier> params = new ArrayList<Identifier>();
    for (Expression arg: header.getArgs()) {
      if (!(arg instanceof Identifier)) {
        throw new SyntaxError(arg.getPosition().line,
            arg.getPosition().column, "Parameters of function "
            + header.getCallee().getName() + " must be plain names");
      }
      params.add((Identifier)arg);
    }
    List<Statement> body = parseBlockBody(advance());
    return new FunctionDecl(pos(start), header.getCallee(), params, body);
  }

  /**
   * RETURN with an optional value.  The value must start on the same line
   * as RETURN, since without terminators the next line is a new statement.
   */
  private ReturnStmt parseReturn() throws SyntaxError {
    Token returnTok = advance();
    Expression value = null;
    Token next = peek();
    if (next.line() == returnTok.line() &&
        EXPRESSION_STARTS.contains(next.kind())) {
      value = parseExpression();
    }
    return new ReturnStmt(pos(returnTok), value);
  }

  private CallStmt parseCallStmt() throws SyntaxError {
    Token callTok = peek();
    CallExpr call = parseKeywordCall();
    return new CallStmt(pos(callTok), call);
  }

  private Statement parseAssignmentOrCall() throws SyntaxError {
    Token start = peek();
    Expression target = parsePostfix();

    if (check(TokenKind.EQUALS) || check(TokenKind.ARROW)) {
      advance();
      LValue lval = toLValue(target);
      Expression value = parseExpression();
      return new Assignment(pos(start), lval, value);
    }

    if (target instanceof CallExpr) {
      CallExpr call = (CallExpr)target;
      if (check(TokenKind.BEGIN)) {
        return functionFromHeader(start, call);
      }
      return new CallStmt(pos(start), call);
    }

    Token tok = peek();
    throw new SyntaxError(tok.line(), tok.column(),
        "Expected '=' or '<-' after " + start.lexeme() + " but found "
        + tok.describe(), EnumSet.of(TokenKind.EQUALS, TokenKind.ARROW));
  }

  private static LValue toLValue(Expression target) throws SyntaxError {
    if (target instanceof LValue &&
        ((LValue)target).rootVariable() != null) {
      return (LValue)target;
    }
    throw new SyntaxError(target.getPosition().line,
        target.getPosition().column,
        "Left side of assignment must be a variable, array element"
        + " or field");
  }

  // ---------------------------------------------------------------------
  // Expressions, lowest precedence first
  // ---------------------------------------------------------------------

  public Expression parseExpression() throws SyntaxError {
    enterNested();
    try {
      return parseOr();
    } finally {
      depth--;
    }
  }

  private Expression parseOr() throws SyntaxError {
    Expression left = parseAnd();
    while (match(TokenKind.OR)) {
      Expression right = parseAnd();
      left = new BinaryExpr(left.getPosition(), BinaryOperator.OR,
                            left, right);
    }
    return left;
  }

  private Expression parseAnd() throws SyntaxError {
    Expression left = parseNot();
    while (match(TokenKind.AND)) {
      Expression right = parseNot();
      left = new BinaryExpr(left.getPosition(), BinaryOperator.AND,
                            left, right);
    }
    return left;
  }

  private Expression parseNot() throws SyntaxError {
    if (check(TokenKind.NOT)) {
      Token notTok = advance();
      Expression operand;
      enterNested();
      try {
        operand = parseNot();
      } finally {
        depth--;
      }
      return new UnaryExpr(pos(notTok), UnaryOperator.NOT, operand);
    }
    return parseRelational();
  }

  private Expression parseRelational() throws SyntaxError {
    Expression left = parseAdditive();
    while (true) {
      BinaryOperator op = relationalOp(peek().kind());
      if (op == null) {
        return left;
      }
      advance();
      Expression right = parseAdditive();
      left = new BinaryExpr(left.getPosition(), op, left, right);
    }
  }

  private static BinaryOperator relationalOp(TokenKind kind) {
    switch (kind) {
      case EQUALS:        return BinaryOperator.EQUAL;
      case NOT_EQUAL:     return BinaryOperator.NOT_EQUAL;
      case LESS:          return BinaryOperator.LESS;
      case LESS_EQUAL:    return BinaryOperator.LESS_EQUAL;
      case GREATER:       return BinaryOperator.GREATER;
      case GREATER_EQUAL: return BinaryOperator.GREATER_EQUAL;
      default:            return null;
    }
  }

  private Expression parseAdditive() throws SyntaxError {
    Expression left = parseMultiplicative();
    while (true) {
      BinaryOperator op;
      if (check(TokenKind.PLUS)) {
        op = BinaryOperator.ADD;
      } else if (check(TokenKind.MINUS)) {
        op = BinaryOperator.SUBTRACT;
      } else {
        return left;
      }
      advance();
      Expression right = parseMultiplicative();
      left = new BinaryExpr(left.getPosition(), op, left, right);
    }
  }

  private Expression parseMultiplicative() throws SyntaxError {
    Expression left = parseUnary();
    while (true) {
      BinaryOperator op = multiplicativeOp(peek().kind());
      if (op == null) {
        return left;
      }
      advance();
      Expression right = parseUnary();
      left = new BinaryExpr(left.getPosition(), op, left, right);
    }
  }

  private static BinaryOperator multiplicativeOp(TokenKind kind) {
    switch (kind) {
      case STAR:    return BinaryOperator.MULTIPLY;
      case SLASH:   return BinaryOperator.DIVIDE;
      case PERCENT:
      case MOD:     return BinaryOperator.MOD;
      case DIV:     return BinaryOperator.INT_DIVIDE;
      default:      return null;
    }
  }

  private Expression parseUnary() throws SyntaxError {
    UnaryOperator op;
    if (check(TokenKind.MINUS)) {
      op = UnaryOperator.NEGATE;
    } else if (check(TokenKind.PLUS)) {
      op = UnaryOperator.PLUS;
    } else if (check(TokenKind.NOT)) {
      op = UnaryOperator.NOT;
    } else {
      return parsePostfix();
    }
    Token opTok = advance();
    Expression operand;
    enterNested();
    try {
      operand = parseUnary();
    } finally {
      depth--;
    }
    return new UnaryExpr(pos(opTok), op, operand);
  }

  /**
   * Primary followed by any number of index and field suffixes, each of
   * which wraps everything to its left in a new ArrayAccess or
   * FieldAccess.
   */
  private Expression parsePostfix() throws SyntaxError {
    Expression expr = parsePrimary();
    while (true) {
      if (check(TokenKind.LBRACKET)) {
        List<Expression> indices = parseBracketed(advance());
        expr = new ArrayAccess(expr.getPosition(), expr, indices);
      } else if (match(TokenKind.DOT)) {
        Identifier field = expectIdentifier("as field name after '.'");
        expr = new FieldAccess(expr.getPosition(), expr, field);
      } else {
        return expr;
      }
    }
  }

  /**
   * @param open '[' token, already consumed
   * @return one or more comma separated expressions up to the closing ']'
   */
  private List<Expression> parseBracketed(Token open) throws SyntaxError {
    List<Expression> exprs = new ArrayList<Expression>();
    do {
      exprs.add(parseExpression());
    } while (match(TokenKind.COMMA));
    if (!check(TokenKind.RBRACKET)) {
      Token tok = peek();
      throw new SyntaxError(tok.line(), tok.column(), "Expected ']' to close"
          + " '[' at " + open.line() + ":" + open.column() + " but found "
          + tok.describe(), EnumSet.of(TokenKind.RBRACKET, TokenKind.COMMA));
    }
    advance();
    return exprs;
  }

  private Expression parsePrimary() throws SyntaxError {
    Token tok = peek();
    switch (tok.kind()) {
      case INT_LITERAL:
        advance();
        try {
          return Literal.ofInteger(pos(tok), Long.parseLong(tok.lexeme()));
        } catch (NumberFormatException e) {
          throw error(tok, "Integer literal " + tok.lexeme()
                           + " is out of range");
        }
      case REAL_LITERAL:
        advance();
        return Literal.ofReal(pos(tok), Double.parseDouble(tok.lexeme()));
      case STRING_LITERAL:
        advance();
        return Literal.ofString(pos(tok), tok.lexeme());
      case TRUE:
        advance();
        return Literal.ofBoolean(pos(tok), true);
      case FALSE:
        advance();
        return Literal.ofBoolean(pos(tok), false);
      case LPAREN: {
        advance();
        Expression inner = parseExpression();
        closeParen(tok);
        return inner;
      }
      case LFLOOR:
        advance();
        return parseRounding(tok, UnaryOperator.FLOOR, TokenKind.RFLOOR);
      case LCEIL:
        advance();
        return parseRounding(tok, UnaryOperator.CEILING, TokenKind.RCEIL);
      case CALL:
        return parseKeywordCall();
      case IDENTIFIER: {
        advance();
        Identifier id = new Identifier(pos(tok), tok.lexeme());
        if (check(TokenKind.LPAREN)) {
          return parseCallArgs(id);
        }
        return id;
      }
      default:
        throw new SyntaxError(tok.line(), tok.column(),
            "Expected an expression but found " + tok.describe(),
            EXPRESSION_STARTS);
    }
  }

  /**
   * Floor or ceiling brackets around an expression
   * @param open opening bracket, already consumed
   */
  private UnaryExpr parseRounding(Token open, UnaryOperator op,
                                  TokenKind closer) throws SyntaxError {
    Expression inner = parseExpression();
    if (!check(closer)) {
      Token tok = peek();
      throw new SyntaxError(tok.line(), tok.column(), "Expected "
          + closer.description() + " to close " + open.kind().description()
          + " at " + open.line() + ":" + open.column() + " but found "
          + tok.describe(), EnumSet.of(closer));
    }
    advance();
    return new UnaryExpr(pos(open), op, inner);
  }

  /**
   * CALL name(args)
   */
  private CallExpr parseKeywordCall() throws SyntaxError {
    advance();
    Identifier callee = expectIdentifier("after CALL");
    if (!check(TokenKind.LPAREN)) {
      Token tok = peek();
      throw new SyntaxError(tok.line(), tok.column(), "Expected '(' after "
          + callee.getName() + " but found " + tok.describe(),
          EnumSet.of(TokenKind.LPAREN));
    }
    return parseCallArgs(callee);
  }

  /**
   * @param callee already consumed; next token is '('
   */
  private CallExpr parseCallArgs(Identifier callee) throws SyntaxError {
    Token open = advance();
    List<Expression> args = new ArrayList<Expression>();
    if (!check(TokenKind.RPAREN)) {
      do {
        args.add(parseExpression());
      } while (match(TokenKind.COMMA));
    }
    closeParen(open);
    return new CallExpr(callee.getPosition(), callee, args);
  }

  // ---------------------------------------------------------------------
  // Token helpers
  // ---------------------------------------------------------------------

  private Token peek() {
    return tokens.get(current);
  }

  private boolean check(TokenKind kind) {
    return peek().is(kind);
  }

  /**
   * @return true if at HASTA followed by the word QUE in any case
   */
  private boolean atSpacedUntil() {
    if (!check(TokenKind.TO)) {
      return false;
    }
    Token next = tokens.get(current + 1);
    return next.is(TokenKind.IDENTIFIER) &&
        next.lexeme().equalsIgnoreCase(UNTIL_SECOND_WORD);
  }

  /**
   * Consume and return current token.  Never moves past EOF.
   */
  private Token advance() {
    Token tok = peek();
    if (!tok.is(TokenKind.EOF)) {
      current++;
    }
    return tok;
  }

  private boolean match(TokenKind kind) {
    if (check(kind)) {
      advance();
      return true;
    }
    return false;
  }

  private Token expect(TokenKind kind, String context) throws SyntaxError {
    if (check(kind)) {
      return advance();
    }
    Token tok = peek();
    throw new SyntaxError(tok.line(), tok.column(), "Expected "
        + kind.description() + " " + context + " but found "
        + tok.describe(), EnumSet.of(kind));
  }

  private Identifier expectIdentifier(String context) throws SyntaxError {
    Token tok = expect(TokenKind.IDENTIFIER, context);
    return new Identifier(pos(tok), tok.lexeme());
  }

  private void expectAssignOp(String context) throws SyntaxError {
    if (check(TokenKind.EQUALS) || check(TokenKind.ARROW)) {
      advance();
      return;
    }
    Token tok = peek();
    throw new SyntaxError(tok.line(), tok.column(), "Expected '=' or '<-' "
        + context + " but found " + tok.describe(),
        EnumSet.of(TokenKind.EQUALS, TokenKind.ARROW));
  }

  private void closeParen(Token open) throws SyntaxError {
    if (match(TokenKind.RPAREN)) {
      return;
    }
    Token tok = peek();
    throw new SyntaxError(tok.line(), tok.column(), "Expected ')' to close"
        + " '(' at " + open.line() + ":" + open.column() + " but found "
        + tok.describe(), EnumSet.of(TokenKind.RPAREN));
  }

  /**
   * Consume the terminator of a compound statement.  If the current token
   * is not one of the accepted kinds, the error is positioned at the
   * statement's opening token, naming what was expected and what was
   * found instead.
   * @param opener first token of the statement being closed
   * @param accepted terminator first, then any other kind allowed here
   */
  private Token close(Token opener, TokenKind... accepted)
                                                  throws SyntaxError {
    for (TokenKind kind: accepted) {
      if (check(kind)) {
        return kind == accepted[0] ? advance() : peek();
      }
    }
    Token found = peek();
    Set<TokenKind> expected = EnumSet.noneOf(TokenKind.class);
    Collections.addAll(expected, accepted);
    throw new SyntaxError(opener.line(), opener.column(), "Missing "
        + accepted[0].description() + " to close "
        + describeOpener(opener) + ": found " + found.describe() + " at "
        + found.line() + ":" + found.column(), expected);
  }

  private static String describeOpener(Token opener) {
    switch (opener.kind()) {
      case BEGIN:
        return "block opened with " + opener.lexeme();
      case LBRACE:
        return "block opened with '{'";
      default:
        return opener.lexeme() + " statement";
    }
  }

  /**
   * Count one more level of nesting.  The caller decrements depth when
   * the nested construct is done.
   */
  private void enterNested() throws SyntaxError {
    depth++;
    if (depth > MAX_NESTING) {
      Token tok = peek();
      throw new SyntaxError(tok.line(), tok.column(), "Program nested too"
          + " deeply: more than " + MAX_NESTING + " levels of statements,"
          + " parentheses and prefix operators");
    }
  }

  private static SyntaxError error(Token tok, String message) {
    return new SyntaxError(tok.line(), tok.column(), message);
  }

  private static SourcePosition pos(Token tok) {
    return new SourcePosition(tok.line(), tok.column());
  }
}
