package com.spotify.predicates;

import static java.util.Objects.requireNonNull;

public record And<V extends Eval<C>, C>(Expr<V, C> left, Expr<V, C> right)
    implements AndOr<V, C> {

  public And {
    requireNonNull(left, "left");
    requireNonNull(right, "right");
  }

  @Override
  public Type type() {
    return Type.AND;
  }

  @Override
  public Expr<V, C> simplify() {
    final Expr<V, C> a = left.simplify();
    final Expr<V, C> b = right.simplify();
    // a·a -> a
    return a.equals(b) ? a : Expr.and(a, b);
  }

  @Override
  public Expr<V, C> distributeAnd() {
    // the left operand is checked first, so it wins when both are sums
    if (left.isOr()) {
      // (q+r)·p -> p·q + p·r
      final Or<V, C> or = (Or<V, C>) left;
      return Expr.or(Expr.and(right, or.left()), Expr.and(right, or.right()));
    } else if (right.isOr()) {
      // p·(q+r) -> p·q + p·r
      final Or<V, C> or = (Or<V, C>) right;
      return Expr.or(Expr.and(left, or.left()), Expr.and(left, or.right()));
    }
    return this;
  }

  @Override
  public boolean eval(C context) {
    return left.eval(context) && right.eval(context);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof And<?, ?> other && sameOperands(other);
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
