package loxfront;

import java.util.Objects;

// Expression syntax tree. Every node owns its children outright and never
// changes after construction. New tree operations are added by implementing
// Visitor, not by touching the node classes.
public abstract class Expr {
  public interface Visitor<R> {
    R visitBinaryExpr(Binary expr);

    R visitGroupingExpr(Grouping expr);

    R visitLiteralExpr(Literal expr);

    R visitUnaryExpr(Unary expr);
  }

  public static final class Binary extends Expr {
    final Expr left;
    final Token operator;
    final Expr right;

    public Binary(Expr left, Token operator, Expr right) {
      this.left = Objects.requireNonNull(left, "left");
      this.operator = Objects.requireNonNull(operator, "operator");
      this.right = Objects.requireNonNull(right, "right");
    }

    public Expr left() {
      return left;
    }

    public Token operator() {
      return operator;
    }

    public Expr right() {
      return right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinaryExpr(this);
    }
  }

  // A parenthesized expression. Kept as its own node so later stages can still
  // see the explicit grouping.
  public static final class Grouping extends Expr {
    final Expr expression;

    public Grouping(Expr expression) {
      this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Expr expression() {
      return expression;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGroupingExpr(this);
    }
  }

  public static final class Literal extends Expr {
    final Object value;

    public Literal(Object value) {
      this.value = value;
    }

    public Object value() {
      return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLiteralExpr(this);
    }
  }

  public static final class Unary extends Expr {
    final Token operator;
    final Expr right;

    public Unary(Token operator, Expr right) {
      this.operator = Objects.requireNonNull(operator, "operator");
      this.right = Objects.requireNonNull(right, "right");
    }

    public Token operator() {
      return operator;
    }

    public Expr right() {
      return right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnaryExpr(this);
    }
  }

  public abstract <R> R accept(Visitor<R> visitor);
}
