package loxfront;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Runs one unit of source through the front end: scan, then parse, then print.
//
// Reading files or a prompt is left to whoever calls run(). Errors are reported
// through the log and handed back in the Outcome; nothing here exits the
// process.
public final class Lox {
  private static final Logger logger = LoggerFactory.getLogger(Lox.class);

  private Lox() {
  }

  // Result of running one unit of source.
  public static final class Outcome {
    private final List<Token> tokens;
    private final List<LexicalError> lexicalErrors;
    private final ParseResult parseResult;
    private final String printed;

    Outcome(List<Token> tokens, List<LexicalError> lexicalErrors, ParseResult parseResult,
        String printed) {
      this.tokens = tokens;
      this.lexicalErrors = lexicalErrors;
      this.parseResult = parseResult;
      this.printed = printed;
    }

    public List<Token> tokens() {
      return tokens;
    }

    public List<LexicalError> lexicalErrors() {
      return lexicalErrors;
    }

    // Null when lexical errors kept the parser from running.
    public ParseResult parseResult() {
      return parseResult;
    }

    public boolean hadError() {
      return !lexicalErrors.isEmpty() || !parseResult.isSuccess();
    }

    // The printed tree, or null if there was an error.
    public String printed() {
      return printed;
    }
  }

  public static Outcome run(String source) {
    List<ScanResult> scanned = new Scanner(source).scanTokens();
    List<Token> tokens = tokens(scanned);
    List<LexicalError> errors = errors(scanned);
    logger.debug("Scanned {} tokens with {} lexical errors", tokens.size(), errors.size());

    // Stop if there was a lexical error. All of them are reported first so the
    // user sees the whole batch at once.
    if (!errors.isEmpty()) {
      for (LexicalError error : errors) {
        report(error);
      }
      return new Outcome(tokens, errors, null, null);
    }

    ParseResult result = new Parser(tokens).parse();
    if (!result.isSuccess()) {
      report(result.error());
      return new Outcome(tokens, errors, result, null);
    }

    String printed = new AstPrinter().print(result.expression());
    logger.debug("Parsed {}", printed);
    return new Outcome(tokens, errors, result, printed);
  }

  public static List<Token> tokens(List<ScanResult> results) {
    List<Token> tokens = new ArrayList<>();
    for (ScanResult result : results) {
      if (result instanceof Token)
        tokens.add((Token) result);
    }
    return Collections.unmodifiableList(tokens);
  }

  public static List<LexicalError> errors(List<ScanResult> results) {
    List<LexicalError> errors = new ArrayList<>();
    for (ScanResult result : results) {
      if (result instanceof LexicalError)
        errors.add((LexicalError) result);
    }
    return Collections.unmodifiableList(errors);
  }

  static void report(LexicalError error) {
    logger.error("{}", error);
  }

  static void report(ParseError error) {
    logger.error("{}", error);
  }
}
