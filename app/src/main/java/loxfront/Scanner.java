package loxfront;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static loxfront.TokenType.*;

public class Scanner {
  private static final Map<String, TokenType> keywords;

  static {
    Map<String, TokenType> table = new HashMap<>();
    table.put("and", AND);
    table.put("class", CLASS);
    table.put("else", ELSE);
    table.put("false", FALSE);
    table.put("for", FOR);
    table.put("fun", FUN);
    table.put("if", IF);
    table.put("nil", NIL);
    table.put("or", OR);
    table.put("print", PRINT);
    table.put("return", RETURN);
    table.put("super", SUPER);
    table.put("this", THIS);
    table.put("true", TRUE);
    table.put("var", VAR);
    table.put("while", WHILE);
    keywords = Collections.unmodifiableMap(table);
  }

  private final String source;
  private final List<ScanResult> results = new ArrayList<>();
  private List<ScanResult> scanned;
  private int start = 0; // first character of the lexeme being scanned
  private int current = 0; // char index of the code point currently being considered
  private int line = 1;
  private int lineStart = 0; // index of the first character of the current line

  public Scanner(String source) {
    if (source == null)
      throw new NullPointerException("source");
    this.source = source;
  }

  // Scans the whole source once. Later calls hand back the same list.
  public List<ScanResult> scanTokens() {
    if (scanned != null)
      return scanned;

    while (!isAtEnd()) {
      // We are at the beginning of the next lexeme.
      start = current;
      scanToken();
    }

    results.add(new Token(EOF, "", null, line));
    scanned = Collections.unmodifiableList(results);
    return scanned;
  }

  private void scanToken() {
    int c = advance();
    switch (c) {
      case '(':
        addToken(LEFT_PAREN);
        break;
      case ')':
        addToken(RIGHT_PAREN);
        break;
      case '{':
        addToken(LEFT_BRACE);
        break;
      case '}':
        addToken(RIGHT_BRACE);
        break;
      case ',':
        addToken(COMMA);
        break;
      case '.':
        addToken(DOT);
        break;
      case '-':
        addToken(MINUS);
        break;
      case '+':
        addToken(PLUS);
        break;
      case ';':
        addToken(SEMICOLON);
        break;
      case '*':
        addToken(STAR);
        break;
      case '!':
        addToken(match('=') ? BANG_EQUAL : BANG);
        break;
      case '=':
        addToken(match('=') ? EQUAL_EQUAL : EQUAL);
        break;
      case '<':
        addToken(match('=') ? LESS_EQUAL : LESS);
        break;
      case '>':
        addToken(match('=') ? GREATER_EQUAL : GREATER);
        break;
      case '/':
        if (match('/')) {
          lineComment();
        } else {
          addToken(SLASH);
        }
        break;
      case ' ':
      case '\r':
      case '\t':
        // Ignore whitespace.
        break;
      case '\n':
        newLine();
        break;
      case '"':
        string();
        break;
      default:
        if (isDigit(c)) {
          number();
        } else if (Character.isLetter(c)) {
          identifier();
        } else {
          // Each invalid character is reported on its own; a run of them gives a
          // run of errors.
          error(column(start), "Unexpected character '" + new String(Character.toChars(c)) + "'.");
        }
        break;
    }
  }

  // A comment goes until the end of the line or the end of the input. The
  // newline itself is left for scanToken() so the line count stays right.
  private void lineComment() {
    while (peek() != '\n' && !isAtEnd())
      advance();
  }

  private void identifier() {
    while (isAlphaNumeric(peek()))
      advance();

    String text = source.substring(start, current);
    TokenType type = keywords.get(text);
    if (type == null) {
      addToken(IDENTIFIER, text);
    } else {
      addToken(type);
    }
  }

  private void number() {
    while (isDigit(peek()))
      advance();

    // Look for a fractional part. A "." with no digit after it is not ours.
    if (peek() == '.' && isDigit(peekNext())) {
      // Consume the "."
      advance();

      while (isDigit(peek()))
        advance();
    }

    String text = source.substring(start, current);
    try {
      addToken(NUMBER, Double.parseDouble(text));
    } catch (NumberFormatException e) {
      error(column(start), "Invalid number '" + text + "'.");
    }
  }

  private void string() {
    while (peek() != '"' && !isAtEnd()) {
      int c = advance();
      if (c == '\n')
        newLine();
    }

    if (isAtEnd()) {
      error(column(current), "Unterminated string.");
      return;
    }

    // The closing ".
    advance();

    // Trim the surrounding quotes. There are no escape sequences to unescape.
    String value = source.substring(start + 1, current - 1);
    addToken(STRING, value);
  }

  // Conditional advance(): only consumes the current character if it is the
  // one we are looking for.
  private boolean match(char expected) {
    if (isAtEnd())
      return false;
    if (source.charAt(current) != expected)
      return false;

    ++current;
    return true;
  }

  private int peek() {
    if (isAtEnd())
      return '\0';
    return source.codePointAt(current);
  }

  // Only used after a '.', which is a single char wide.
  private char peekNext() {
    if (current + 1 >= source.length())
      return '\0';
    return source.charAt(current + 1);
  }

  private boolean isAlphaNumeric(int c) {
    return Character.isLetter(c) || isDigit(c) || c == '_';
  }

  private boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private boolean isAtEnd() {
    return current >= source.length();
  }

  // Steps over one whole code point, so a character outside the BMP is never
  // split into its two surrogates.
  private int advance() {
    int c = source.codePointAt(current);
    current += Character.charCount(c);
    return c;
  }

  // 1-based column of the char index, counted in code points from the line start.
  private int column(int index) {
    return source.codePointCount(lineStart, index) + 1;
  }

  private void newLine() {
    ++line;
    lineStart = current;
  }

  private void addToken(TokenType type) {
    addToken(type, null);
  }

  private void addToken(TokenType type, Object literal) {
    String text = source.substring(start, current);
    results.add(new Token(type, text, literal, line));
  }

  private void error(int column, String message) {
    results.add(new LexicalError(line, column, message));
  }
}
