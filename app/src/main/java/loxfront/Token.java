package loxfront;

import java.util.Objects;

//
// A single Token class represents all kinds of lexemes. To distinguish the
// different kinds (the number 123 versus the string "123") there is the
// TokenType enum.
//
// Tokens for literals store the value, other kinds of lexemes leave it null.
//
public final class Token implements ScanResult {
  final TokenType type;
  final String lexeme;
  final Object literal;
  final int line;

  public Token(TokenType type, String lexeme, Object literal, int line) {
    this.type = Objects.requireNonNull(type, "type");
    this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
    this.literal = literal;
    this.line = line;
  }

  public TokenType type() {
    return type;
  }

  public String lexeme() {
    return lexeme;
  }

  public Object literal() {
    return literal;
  }

  @Override
  public int line() {
    return line;
  }

  @Override
  public boolean isError() {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Token))
      return false;
    Token other = (Token) o;
    return type == other.type
        && line == other.line
        && lexeme.equals(other.lexeme)
        && Objects.equals(literal, other.literal);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, lexeme, literal, line);
  }

  @Override
  public String toString() {
    return type + " " + lexeme + " " + literal;
  }
}
