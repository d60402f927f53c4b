package com.spotify.predicates;

import static java.util.Objects.requireNonNull;

import com.spotify.predicates.NormalFormExtractor.Form;
import java.util.Collection;
import java.util.List;

/**
 * A boolean expression in <a href="https://en.wikipedia.org/wiki/Conjunctive_normal_form">
 * Conjunctive Normal Form</a>: clauses that are implicitly AND-ed together.
 */
public final class Cnf<V extends Eval<C>, C> extends NormalForm<V, C> {

  private Cnf(final Collection<Expr<V, C>> clauses, final ClauseStorage storage) {
    super(clauses, storage);
  }

  /** Normalizes {@code expression}, storing the clauses with the default options. */
  public static <V extends Eval<C>, C> Cnf<V, C> from(final Expr<V, C> expression) {
    return from(expression, NormalFormOptions.defaults());
  }

  public static <V extends Eval<C>, C> Cnf<V, C> from(
      final Expr<V, C> expression, final NormalFormOptions options) {
    return from(expression, options.getStorage());
  }

  /** Normalizes {@code expression}, storing the clauses as {@code storage} dictates. */
  public static <V extends Eval<C>, C> Cnf<V, C> from(
      final Expr<V, C> expression, final ClauseStorage storage) {
    requireNonNull(expression, "expression");
    final Collection<Expr<V, C>> sink = storage.newCollection();
    return new Cnf<>(NormalFormExtractor.extract(expression, Form.CONJUNCTIVE, sink), storage);
  }

  /**
   * Wraps clauses that are already in conjunctive form. They are neither normalized nor checked,
   * so an unflattened clause is evaluated as is.
   */
  public static <V extends Eval<C>, C> Cnf<V, C> ofClauses(final Iterable<Expr<V, C>> clauses) {
    return ofClauses(clauses, NormalFormOptions.defaults().getStorage());
  }

  public static <V extends Eval<C>, C> Cnf<V, C> ofClauses(
      final Iterable<Expr<V, C>> clauses, final ClauseStorage storage) {
    return new Cnf<>(collect(clauses, storage), storage);
  }

  /** A CNF without clauses, which is always true. */
  public static <V extends Eval<C>, C> Cnf<V, C> empty() {
    return empty(NormalFormOptions.defaults().getStorage());
  }

  public static <V extends Eval<C>, C> Cnf<V, C> empty(final ClauseStorage storage) {
    return ofClauses(List.of(), storage);
  }

  @Override
  Expr<V, C> join(final Expr<V, C> left, final Expr<V, C> right) {
    return Expr.and(left, right);
  }

  /** True iff every clause is true. */
  @Override
  public boolean eval(final C context) {
    return clauses().stream().allMatch(clause -> clause.eval(context));
  }
}
