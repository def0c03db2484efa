package loxfront;

// Outcome of Parser.parse(): either a complete tree or the error that stopped
// the parse. There is never a partial tree.
public final class ParseResult {
  private final Expr expression;
  private final ParseError error;

  private ParseResult(Expr expression, ParseError error) {
    this.expression = expression;
    this.error = error;
  }

  public static ParseResult success(Expr expression) {
    if (expression == null)
      throw new NullPointerException("expression");
    return new ParseResult(expression, null);
  }

  public static ParseResult failure(ParseError error) {
    if (error == null)
      throw new NullPointerException("error");
    return new ParseResult(null, error);
  }

  public boolean isSuccess() {
    return expression != null;
  }

  public Expr expression() {
    if (expression == null)
      throw new IllegalStateException("Parse failed: " + error);
    return expression;
  }

  public ParseError error() {
    if (error == null)
      throw new IllegalStateException("Parse succeeded; there is no error");
    return error;
  }

  @Override
  public String toString() {
    return isSuccess() ? "ParseResult[" + new AstPrinter().print(expression) + "]"
        : "ParseResult[" + error + "]";
  }
}
