package com.spotify.predicates;

import static java.util.Objects.requireNonNull;

import java.util.List;

public record Not<V extends Eval<C>, C>(Expr<V, C> operand) implements Expr<V, C> {

  public Not {
    requireNonNull(operand, "operand");
  }

  @Override
  public Type type() {
    return Type.NOT;
  }

  @Override
  public Expr<V, C> simplify() {
    final Expr<V, C> simplified = operand.simplify();

    if (simplified.isNot()) {
      // !!a -> a
      return ((Not<V, C>) simplified).operand();
    }

    return Expr.not(simplified);
  }

  @Override
  public Expr<V, C> pushdownNot() {
    return switch (operand.type()) {
      case LITERAL -> this;
      case NOT -> ((Not<V, C>) operand).operand().pushdownNot();
      case OR -> {
        // !(a+b) -> !a·!b
        final AndOr<V, C> or = (AndOr<V, C>) operand;
        yield Expr.and(Expr.not(or.left()), Expr.not(or.right()));
      }
      case AND -> {
        // !(a·b) -> !a+!b
        final AndOr<V, C> and = (AndOr<V, C>) operand;
        yield Expr.or(Expr.not(and.left()), Expr.not(and.right()));
      }
    };
  }

  @Override
  public boolean eval(C context) {
    return !operand.eval(context);
  }

  @Override
  public String name() {
    if (operand.isAnd()) {
      return "!(" + operand.name() + ")";
    }
    return "!" + operand.name();
  }

  @Override
  public List<Expr<V, C>> operands() {
    return List.of(operand);
  }

  @Override
  public String toString() {
    return name();
  }
}
