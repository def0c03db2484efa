package loxfront;

import java.util.ArrayList;
import java.util.List;

import static loxfront.TokenType.*;

// Recursive descent over the expression grammar:
//
//   expression → equality
//   equality   → comparison ( ( "!=" | "==" ) comparison )*
//   comparison → term ( ( ">" | ">=" | "<" | "<=" ) term )*
//   term       → factor ( ( "-" | "+" ) factor )*
//   factor     → unary ( ( "/" | "*" ) unary )*
//   unary      → "-" unary | primary
//   primary    → NUMBER | STRING | "(" expression ")"
//
// Each method parses one rule and returns its syntax tree. A rule only calls
// rules of higher precedence (or itself after consuming a token), so there is
// no left recursion.
public class Parser {
  // Unwinds the descent back to parse() on the first error. It never escapes
  // this class; callers get a ParseResult.
  private static class ParseFailure extends RuntimeException {
    final ParseError error;

    ParseFailure(ParseError error) {
      super(null, null, false, false);
      this.error = error;
    }
  }

  // Each open group or prefix "-" costs a handful of Java stack frames. Past
  // this many the parse fails instead of overflowing the stack.
  static final int MAX_DEPTH = 255;

  private final List<Token> tokens;
  private int current = 0;
  private int depth = 0;

  public Parser(List<Token> tokens) {
    List<Token> copy = new ArrayList<>(tokens);
    // A hand-built list may lack the end marker; the parser relies on it.
    if (copy.isEmpty() || copy.get(copy.size() - 1).type != EOF) {
      int line = copy.isEmpty() ? 1 : copy.get(copy.size() - 1).line;
      copy.add(new Token(EOF, "", null, line));
    }
    this.tokens = copy;
  }

  // Parses one expression from the front of the token list. Whatever follows
  // it is left for the caller to deal with.
  public ParseResult parse() {
    try {
      return ParseResult.success(expression());
    } catch (ParseFailure failure) {
      return ParseResult.failure(failure.error);
    }
  }

  private Expr expression() {
    return equality();
  }

  // The ( ... )* loop in the rule maps to a while loop. Folding the new operand
  // onto the tree built so far makes the operator left-associative.
  private Expr equality() {
    Expr expr = comparison();

    while (match(BANG_EQUAL, EQUAL_EQUAL)) {
      Token operator = previous();
      Expr right = comparison();
      expr = new Expr.Binary(expr, operator, right);
    }

    return expr;
  }

  private Expr comparison() {
    Expr expr = term();

    while (match(GREATER, GREATER_EQUAL, LESS, LESS_EQUAL)) {
      Token operator = previous();
      Expr right = term();
      expr = new Expr.Binary(expr, operator, right);
    }

    return expr;
  }

  // Addition and subtraction (+ -)
  private Expr term() {
    Expr expr = factor();

    while (match(MINUS, PLUS)) {
      Token operator = previous();
      Expr right = factor();
      expr = new Expr.Binary(expr, operator, right);
    }

    return expr;
  }

  // Multiplication and division (* /)
  private Expr factor() {
    Expr expr = unary();

    while (match(SLASH, STAR)) {
      Token operator = previous();
      Expr right = unary();
      expr = new Expr.Binary(expr, operator, right);
    }

    return expr;
  }

  // Right-associative: "- - 5" is the negation of "- 5".
  private Expr unary() {
    if (match(MINUS)) {
      Token operator = previous();
      enterNested(operator);
      Expr right = unary();
      --depth;
      return new Expr.Unary(operator, right);
    }

    return primary();
  }

  private Expr primary() {
    if (match(NUMBER, STRING)) {
      return new Expr.Literal(previous().literal);
    }

    if (match(LEFT_PAREN)) {
      enterNested(previous());
      Expr expr = expression();
      --depth;
      consume(RIGHT_PAREN, "')' after expression");
      return new Expr.Grouping(expr);
    }

    throw error(peek(), "expression");
  }

  private void enterNested(Token token) {
    if (++depth > MAX_DEPTH)
      throw error(token, "expression (too deeply nested)");
  }

  // Consumes the current token if it has any of the given types.
  private boolean match(TokenType... types) {
    for (TokenType type : types) {
      if (check(type)) {
        advance();
        return true;
      }
    }

    return false;
  }

  private Token consume(TokenType type, String expected) {
    if (check(type))
      return advance();

    throw error(peek(), expected);
  }

  // Like match() but never consumes.
  private boolean check(TokenType type) {
    if (isAtEnd())
      return false;
    return peek().type == type;
  }

  private Token advance() {
    if (!isAtEnd())
      ++current;
    return previous();
  }

  private boolean isAtEnd() {
    return peek().type == EOF;
  }

  private Token peek() {
    return tokens.get(current);
  }

  private Token previous() {
    return tokens.get(current - 1);
  }

  private ParseFailure error(Token token, String expected) {
    return new ParseFailure(new ParseError(expected, token));
  }
}
