package loxfront;

import java.util.Objects;

// Why a parse stopped: what the grammar wanted at that point and the token
// that was there instead.
public final class ParseError {
  final String expected;
  final Token actual;

  public ParseError(String expected, Token actual) {
    this.expected = Objects.requireNonNull(expected, "expected");
    this.actual = Objects.requireNonNull(actual, "actual");
  }

  // The construct the parser was looking for, e.g. "')' after expression".
  public String expected() {
    return expected;
  }

  public Token actual() {
    return actual;
  }

  public int line() {
    return actual.line;
  }

  public String message() {
    return "Expect " + expected + ".";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof ParseError))
      return false;
    ParseError other = (ParseError) o;
    return expected.equals(other.expected) && actual.equals(other.actual);
  }

  @Override
  public int hashCode() {
    return Objects.hash(expected, actual);
  }

  @Override
  public String toString() {
    String where = actual.type == TokenType.EOF ? " at end" : " at '" + actual.lexeme + "'";
    return "[line " + line() + "] Error" + where + ": " + message();
  }
}
