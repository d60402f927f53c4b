package com.spotify.predicates;

import static java.util.Objects.requireNonNull;

import com.spotify.predicates.NormalFormExtractor.Form;
import java.util.Collection;
import java.util.List;

/**
 * A boolean expression in <a href="https://en.wikipedia.org/wiki/Disjunctive_normal_form">
 * Disjunctive Normal Form</a>: clauses that are implicitly OR-ed together.
 */
public final class Dnf<V extends Eval<C>, C> extends NormalForm<V, C> {

  private Dnf(final Collection<Expr<V, C>> clauses, final ClauseStorage storage) {
    super(clauses, storage);
  }

  public static <V extends Eval<C>, C> Dnf<V, C> from(final Expr<V, C> expression) {
    return from(expression, NormalFormOptions.defaults());
  }

  public static <V extends Eval<C>, C> Dnf<V, C> from(
      final Expr<V, C> expression, final NormalFormOptions options) {
    return from(expression, options.getStorage());
  }

  public static <V extends Eval<C>, C> Dnf<V, C> from(
      final Expr<V, C> expression, final ClauseStorage storage) {
    requireNonNull(expression, "expression");
    final Collection<Expr<V, C>> sink = storage.newCollection();
    return new Dnf<>(NormalFormExtractor.extract(expression, Form.DISJUNCTIVE, sink), storage);
  }

  /** Wraps clauses that are already in disjunctive form, without checking them. */
  public static <V extends Eval<C>, C> Dnf<V, C> ofClauses(final Iterable<Expr<V, C>> clauses) {
    return ofClauses(clauses, NormalFormOptions.defaults().getStorage());
  }

  public static <V extends Eval<C>, C> Dnf<V, C> ofClauses(
      final Iterable<Expr<V, C>> clauses, final ClauseStorage storage) {
    return new Dnf<>(collect(clauses, storage), storage);
  }

  /** A DNF without clauses, which is always false. */
  public static <V extends Eval<C>, C> Dnf<V, C> empty() {
    return empty(NormalFormOptions.defaults().getStorage());
  }

  public static <V extends Eval<C>, C> Dnf<V, C> empty(final ClauseStorage storage) {
    return ofClauses(List.of(), storage);
  }

  @Override
  Expr<V, C> join(final Expr<V, C> left, final Expr<V, C> right) {
    return Expr.or(left, right);
  }

  /** True iff any clause is true. */
  @Override
  public boolean eval(final C context) {
    return clauses().stream().anyMatch(clause -> clause.eval(context));
  }
}
