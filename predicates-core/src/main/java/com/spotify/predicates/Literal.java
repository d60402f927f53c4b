package com.spotify.predicates;

import static java.util.Objects.requireNonNull;

import java.util.List;

public record Literal<V extends Eval<C>, C>(V value) implements Expr<V, C> {

  public Literal {
    requireNonNull(value, "value");
  }

  @Override
  public Type type() {
    return Type.LITERAL;
  }

  @Override
  public String name() {
    return String.valueOf(value);
  }

  @Override
  public List<Expr<V, C>> operands() {
    return List.of();
  }

  @Override
  public boolean eval(C context) {
    return value.eval(context);
  }

  @Override
  public String toString() {
    return name();
  }
}
