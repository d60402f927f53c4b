package com.spotify.predicates;

/**
 * Something that can be resolved to a truth value in the context of some external data.
 *
 * <p>Literal types implement this to be usable as leaves of an {@link Expr}. A literal type is
 * expected to implement {@code equals} and, when stored in a deduplicating {@link ClauseStorage},
 * a {@code hashCode} consistent with it. Evaluation must be deterministic and side effect free for
 * a given context.
 *
 * @param <C> the contextual data required to evaluate
 */
public interface Eval<C> {

  /** Evaluates against {@code context}, returning the truth value. */
  boolean eval(C context);
}
