package loxfront;

// One entry of the scanner output: either a Token or a LexicalError, in source
// order. Errors travel in the same list so the caller sees exactly where they
// happened relative to the tokens around them. Those two are the only kinds
// the scanner produces; Lox.tokens() and Lox.errors() skip anything else.
public interface ScanResult {
  int line();

  boolean isError();
}
