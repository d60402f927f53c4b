package com.spotify.predicates;

import java.util.List;
import java.util.Objects;

/** A binary node whose two operands are unordered for equality. */
sealed interface AndOr<V extends Eval<C>, C> extends Expr<V, C> permits And, Or {

  Expr<V, C> left();

  Expr<V, C> right();

  @Override
  default List<Expr<V, C>> operands() {
    return List.of(left(), right());
  }

  @Override
  default String name() {
    final String joined = left().name() + delimiter() + right().name();
    return isOr() ? "(" + joined + ")" : joined;
  }

  private String delimiter() {
    return type() == Type.AND ? "·" : " + ";
  }

  // commutative, but neither associative nor canonicalized below this node
  default boolean sameOperands(AndOr<?, ?> other) {
    return (left().equals(other.left()) && right().equals(other.right()))
        || (left().equals(other.right()) && right().equals(other.left()));
  }

  default int operandsHash() {
    // symmetric so that it agrees with sameOperands
    return Objects.hash(type(), left().hashCode() + right().hashCode());
  }
}
