package com.spotify.predicates;

import static java.util.Objects.requireNonNull;

public record Or<V extends Eval<C>, C>(Expr<V, C> left, Expr<V, C> right) implements AndOr<V, C> {

  public Or {
    requireNonNull(left, "left");
    requireNonNull(right, "right");
  }

  @Override
  public Type type() {
    return Type.OR;
  }

  @Override
  public Expr<V, C> simplify() {
    final Expr<V, C> a = left.simplify();
    final Expr<V, C> b = right.simplify();
    // a+a -> a
    return a.equals(b) ? a : Expr.or(a, b);
  }

  @Override
  public Expr<V, C> distributeOr() {
    if (left.isAnd()) {
      // q·r + p -> (p+q)·(p+r)
      final And<V, C> and = (And<V, C>) left;
      return Expr.and(Expr.or(right, and.left()), Expr.or(right, and.right()));
    } else if (right.isAnd()) {
      // p + q·r -> (p+q)·(p+r)
      final And<V, C> and = (And<V, C>) right;
      return Expr.and(Expr.or(left, and.left()), Expr.or(left, and.right()));
    }
    return this;
  }

  @Override
  public boolean eval(C context) {
    return left.eval(context) || right.eval(context);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Or<?, ?> other && sameOperands(other);
  }

  @Override
  public int hashCode() {
    return operandsHash();
  }

  @Override
  public String toString() {
    return name();
  }
}
