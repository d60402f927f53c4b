package com.spotify.predicates;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/*
 * Expr ADT written with sealed interfaces and records.
 *
 * There is deliberately no empty/identity variant: And(Empty, x) and Or(Empty, x) have no obvious
 * meaning, so an absent expression is modelled with Optional<Expr> at the root instead.
 */
public sealed interface Expr<V extends Eval<C>, C> extends Eval<C> permits Literal, Not, AndOr {

  enum Type {
    LITERAL,
    NOT,
    OR,
    AND
  }

  Type type();

  String name();

  /** The children of this node, left to right. Empty for a literal. */
  List<Expr<V, C>> operands();

  static <V extends Eval<C>, C> Expr<V, C> literal(V value) {
    return new Literal<>(value);
  }

  static <V extends Eval<C>, C> Expr<V, C> not(Expr<V, C> operand) {
    return new Not<>(operand);
  }

  static <V extends Eval<C>, C> Expr<V, C> or(Expr<V, C> left, Expr<V, C> right) {
    return new Or<>(left, right);
  }

  static <V extends Eval<C>, C> Expr<V, C> and(Expr<V, C> left, Expr<V, C> right) {
    return new And<>(left, right);
  }

  default boolean isLiteral() {
    return this instanceof Literal;
  }

  default boolean isNot() {
    return this instanceof Not;
  }

  default boolean isOr() {
    return this instanceof Or;
  }

  default boolean isAnd() {
    return this instanceof And;
  }

  /**
   * Removes double negations and syntactically equal siblings, bottom-up, in a single pass. This
   * is not logical simplification: no absorption, no De Morgan and no constant detection.
   */
  default Expr<V, C> simplify() {
    return this;
  }

  /**
   * Pushes a root {@code Not} one level below an {@code And} or {@code Or}, or removes it if it is
   * above another {@code Not}. Any other expression is returned as is.
   */
  default Expr<V, C> pushdownNot() {
    return this;
  }

  /** Distributes a root {@code And} over an {@code Or} child. Otherwise returns this. */
  default Expr<V, C> distributeAnd() {
    return this;
  }

  /** Distributes a root {@code Or} over an {@code And} child. Otherwise returns this. */
  default Expr<V, C> distributeOr() {
    return this;
  }

  /**
   * Returns true if the expressions have the same representation, up to equality of the literals.
   * Unlike {@link #equals(Object)} the operands of {@code And} and {@code Or} are compared in
   * order.
   */
  default boolean eqRepr(Expr<V, C> other) {
    if (other == null || type() != other.type()) {
      return false;
    }
    if (isLiteral()) {
      return ((Literal<V, C>) this).value().equals(((Literal<V, C>) other).value());
    }
    final List<Expr<V, C>> mine = operands();
    final List<Expr<V, C>> theirs = other.operands();
    for (int i = 0; i < mine.size(); i++) {
      if (!mine.get(i).eqRepr(theirs.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** The distinct literal values of this expression in depth-first, left to right order. */
  default Set<V> literals() {
    final Set<V> literals = new LinkedHashSet<>();
    final Deque<Expr<V, C>> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      final Expr<V, C> expr = stack.pop();
      if (expr.isLiteral()) {
        literals.add(((Literal<V, C>) expr).value());
      } else {
        final List<Expr<V, C>> operands = expr.operands();
        for (int i = operands.size() - 1; i >= 0; i--) {
          stack.push(operands.get(i));
        }
      }
    }
    return literals;
  }
}
