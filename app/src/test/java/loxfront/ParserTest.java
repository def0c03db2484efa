package loxfront;

import static loxfront.TokenType.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

class ParserTest {

  // Prints a tree as if every group had been written without parentheses.
  private static class UngroupedPrinter extends AstPrinter {
    @Override
    public String visitGroupingExpr(Expr.Grouping expr) {
      return expr.expression().accept(this);
    }
  }

  private static ParseResult parse(String source) {
    return new Parser(Lox.tokens(new Scanner(source).scanTokens())).parse();
  }

  private static String print(String source) {
    return new AstPrinter().print(parse(source).expression());
  }

  @Test
  void multiplicationBindsTighterThanAddition() {
    assertThat(print("1 + 2 * 3")).isEqualTo("(+ 1 (* 2 3))");

    UngroupedPrinter printer = new UngroupedPrinter();
    assertThat(printer.print(parse("1 + 2 * 3").expression()))
        .isEqualTo(printer.print(parse("1 + (2 * 3)").expression()));
  }

  @Test
  void binaryOperatorsAreLeftAssociative() {
    assertThat(print("1 - 2 - 3")).isEqualTo("(- (- 1 2) 3)");
    assertThat(print("8 / 4 / 2")).isEqualTo("(/ (/ 8 4) 2)");
    assertThat(print("1 == 2 != 3")).isEqualTo("(!= (== 1 2) 3)");
    assertThat(print("1 < 2 <= 3")).isEqualTo("(<= (< 1 2) 3)");
  }

  @Test
  void leftAssociativeTreeShape() {
    Expr expr = parse("1 - 2 - 3").expression();

    assertThat(expr).isInstanceOf(Expr.Binary.class);
    Expr.Binary outer = (Expr.Binary) expr;
    assertThat(outer.left()).isInstanceOf(Expr.Binary.class);
    assertThat(outer.right()).isInstanceOf(Expr.Literal.class);
    assertThat(((Expr.Literal) outer.right()).value()).isEqualTo(3.0);
  }

  @Test
  void groupingIsPreserved() {
    assertThat(print("(1 + 2) * 3")).isEqualTo("(* (group (+ 1 2)) 3)");
    assertThat(print("((1))")).isEqualTo("(group (group 1))");
  }

  @Test
  void unaryMinusIsRightAssociative() {
    ParseResult result = parse("- - 5");

    assertThat(result.isSuccess()).isTrue();
    assertThat(new AstPrinter().print(result.expression())).isEqualTo("(- (- 5))");
    assertThat(print("-1 * -2")).isEqualTo("(* (- 1) (- 2))");
  }

  @Test
  void equalityBindsLoosest() {
    assertThat(print("1 < 2 == 3 >= 4")).isEqualTo("(== (< 1 2) (>= 3 4))");
    assertThat(print("1 + 2 > 3 * 4")).isEqualTo("(> (+ 1 2) (* 3 4))");
  }

  @Test
  void endToEndExample() {
    assertThat(print("123 + 45 * 67 + 4")).isEqualTo("(+ (+ 123 (* 45 67)) 4)");
  }

  @Test
  void stringLiteralsBecomeLiterals() {
    assertThat(print("\"a\" + \"b\"")).isEqualTo("(+ a b)");
  }

  @Test
  void missingCloseParenReportsExpectedTokenAtEnd() {
    ParseResult result = parse("(1 + 2");

    assertThat(result.isSuccess()).isFalse();
    ParseError error = result.error();
    assertThat(error.expected()).isEqualTo("')' after expression");
    assertThat(error.actual().type()).isEqualTo(EOF);
    assertThat(error.line()).isEqualTo(1);
    assertThat(error.toString()).isEqualTo("[line 1] Error at end: Expect ')' after expression.");
  }

  @Test
  void missingCloseParenDoesNotConsumeOtherToken() {
    ParseResult result = parse("(1 + 2 3");

    assertThat(result.error().actual().lexeme()).isEqualTo("3");
    assertThat(result.error().toString()).isEqualTo("[line 1] Error at '3': Expect ')' after expression.");
  }

  @Test
  void unexpectedTokenIsFatal() {
    ParseResult result = parse("+ 1");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error().toString()).isEqualTo("[line 1] Error at '+': Expect expression.");
  }

  @Test
  void danglingOperatorFailsAtEnd() {
    ParseResult result = parse("1 +\n");

    assertThat(result.error().actual().type()).isEqualTo(EOF);
    assertThat(result.error().line()).isEqualTo(2);
  }

  @Test
  void bangIsNotAPrefixOperator() {
    assertThat(parse("!1").error().actual().type()).isEqualTo(BANG);
  }

  @Test
  void identifiersAndKeywordsAreNotPrimaries() {
    assertThat(parse("foo").isSuccess()).isFalse();
    assertThat(parse("true").isSuccess()).isFalse();
  }

  @Test
  void errorLineFollowsOffendingToken() {
    ParseResult result = parse("(1 +\n\n 2 ;");

    assertThat(result.error().line()).isEqualTo(3);
    assertThat(result.error().actual().type()).isEqualTo(SEMICOLON);
  }

  @Test
  void parsesOnlyALeadingExpression() {
    assertThat(print("1 2")).isEqualTo("1");
    assertThat(print("(1 + 2))")).isEqualTo("(group (+ 1 2))");
  }

  @Test
  void tokenListWithoutEofIsAccepted() {
    List<Token> tokens = List.of(new Token(NUMBER, "7", 7.0, 1));

    assertThat(new AstPrinter().print(new Parser(tokens).parse().expression())).isEqualTo("7");
  }

  @Test
  void emptyTokenListFailsAtEnd() {
    ParseResult result = new Parser(Collections.emptyList()).parse();

    assertThat(result.error().toString()).isEqualTo("[line 1] Error at end: Expect expression.");
  }

  @Test
  void nestingUpToLimitParses() {
    int depth = Parser.MAX_DEPTH;
    String source = "(".repeat(depth) + "1" + ")".repeat(depth);

    assertThat(parse(source).isSuccess()).isTrue();
  }

  @Test
  void groupingNestedPastLimitFails() {
    int depth = Parser.MAX_DEPTH + 1;
    ParseResult result = parse("(".repeat(depth) + "1" + ")".repeat(depth));

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error().actual().type()).isEqualTo(LEFT_PAREN);
    assertThat(result.error().toString())
        .isEqualTo("[line 1] Error at '(': Expect expression (too deeply nested).");
  }

  @Test
  void veryDeepInputFailsInsteadOfOverflowing() {
    ParseResult groups = parse("(".repeat(20000) + "1" + ")".repeat(20000));
    ParseResult negations = parse("-".repeat(20000) + "1");
    ParseResult mixed = parse("-(".repeat(10000) + "1" + ")".repeat(10000));

    assertThat(groups.error().expected()).isEqualTo("expression (too deeply nested)");
    assertThat(negations.error().actual().type()).isEqualTo(MINUS);
    assertThat(mixed.isSuccess()).isFalse();
  }

  @Test
  void siblingGroupsDoNotAddUpToDepth() {
    StringBuilder source = new StringBuilder("1");
    for (int i = 0; i < Parser.MAX_DEPTH * 2; i++) {
      source.append(" + (-").append(i).append(")");
    }

    assertThat(parse(source.toString()).isSuccess()).isTrue();
  }

  @Test
  void failedResultHasNoExpression() {
    ParseResult result = parse(")");

    assertThatThrownBy(result::expression).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void successfulResultHasNoError() {
    ParseResult result = parse("1");

    assertThatThrownBy(result::error).isInstanceOf(IllegalStateException.class);
  }
}
