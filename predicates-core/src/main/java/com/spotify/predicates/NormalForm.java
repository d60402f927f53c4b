package com.spotify.predicates;

import static java.util.Collections.unmodifiableCollection;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A boolean expression as a flat collection of clauses that are implicitly joined by a single
 * operator: AND for {@link Cnf}, OR for {@link Dnf}.
 *
 * <p>Instances are immutable once built.
 *
 * @param <V> the literal type
 * @param <C> the context the literals are evaluated against
 */
public abstract sealed class NormalForm<V extends Eval<C>, C>
    implements Eval<C>, Iterable<Expr<V, C>> permits Cnf, Dnf {

  private final Collection<Expr<V, C>> clauses;
  private final ClauseStorage storage;

  NormalForm(final Collection<Expr<V, C>> clauses, final ClauseStorage storage) {
    this.clauses = requireNonNull(clauses);
    this.storage = requireNonNull(storage);
  }

  static <V extends Eval<C>, C> Collection<Expr<V, C>> collect(
      final Iterable<Expr<V, C>> clauses, final ClauseStorage storage) {
    requireNonNull(clauses, "clauses");
    final Collection<Expr<V, C>> collected = requireNonNull(storage, "storage").newCollection();
    clauses.forEach(clause -> collected.add(requireNonNull(clause, "clause")));
    return collected;
  }

  /** Joins two clauses with the operator implied between them. */
  abstract Expr<V, C> join(Expr<V, C> left, Expr<V, C> right);

  public ClauseStorage storage() {
    return storage;
  }

  /** Returns the number of clauses. */
  public int size() {
    return clauses.size();
  }

  /** Returns true if there are no clauses. */
  public boolean isEmpty() {
    return clauses.isEmpty();
  }

  /** An unmodifiable view of the clauses. */
  public Collection<Expr<V, C>> clauses() {
    return unmodifiableCollection(clauses);
  }

  /** Returns the clauses as elements of a new {@code List}, in iteration order. */
  public List<Expr<V, C>> toList() {
    return new ArrayList<>(clauses);
  }

  /**
   * Folds the clauses back into a single expression, left to right in iteration order. Empty when
   * there are no clauses, as there is no empty expression.
   */
  public Optional<Expr<V, C>> toExpr() {
    return clauses.stream().reduce(this::join);
  }

  @Override
  public Iterator<Expr<V, C>> iterator() {
    return clauses().iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final NormalForm<?, ?> other = (NormalForm<?, ?>) o;
    return storage == other.storage && clauses.equals(other.clauses);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), storage, clauses);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("storage", storage)
        .add("clauses", clauses)
        .toString();
  }
}
