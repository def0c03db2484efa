package loxfront;

import java.util.Objects;

// A malformed lexeme or unterminated construct found while scanning. The
// record is terminal: the scanner moves on to the next character and nothing
// here describes how to recover.
public final class LexicalError implements ScanResult {
  final int line;
  final int column;
  final String message;

  public LexicalError(int line, int column, String message) {
    this.line = line;
    this.column = column;
    this.message = Objects.requireNonNull(message, "message");
  }

  @Override
  public int line() {
    return line;
  }

  // 1-based position within the line, in code points, where the error was detected.
  public int column() {
    return column;
  }

  public String message() {
    return message;
  }

  @Override
  public boolean isError() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof LexicalError))
      return false;
    LexicalError other = (LexicalError) o;
    return line == other.line && column == other.column && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, column, message);
  }

  @Override
  public String toString() {
    return "[line " + line + ":" + column + "] Error: " + message;
  }
}
