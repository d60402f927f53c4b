package com.spotify.predicates;

import com.spotify.predicates.Expr.Type;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites an {@link Expr} into a flat collection of clauses.
 *
 * <p>A single negation pushdown and distribution step may only partially flatten a nested tree,
 * so the rewrite is driven by a work stack: every subexpression split off the top is rewritten
 * again until what remains is no longer joined by the splitting operator.
 */
final class NormalFormExtractor {

  private static final Logger log = LoggerFactory.getLogger(NormalFormExtractor.class);

  private NormalFormExtractor() {}

  enum Form {
    // an implicit AND of clauses, so Ands are split and Ors distributed
    CONJUNCTIVE(Type.AND) {
      @Override
      <V extends Eval<C>, C> Expr<V, C> distribute(Expr<V, C> expression) {
        return expression.distributeOr();
      }
    },
    // an implicit OR of clauses, so Ors are split and Ands distributed
    DISJUNCTIVE(Type.OR) {
      @Override
      <V extends Eval<C>, C> Expr<V, C> distribute(Expr<V, C> expression) {
        return expression.distributeAnd();
      }
    };

    private final Type splitOn;

    Form(Type splitOn) {
      this.splitOn = splitOn;
    }

    abstract <V extends Eval<C>, C> Expr<V, C> distribute(Expr<V, C> expression);
  }

  /**
   * Extracts the clauses of {@code expression} into {@code sink}. Whether equal clauses are
   * collapsed, and in which order they end up, is up to the sink's {@code add}.
   */
  static <V extends Eval<C>, C, S extends Collection<Expr<V, C>>> S extract(
      final Expr<V, C> expression, final Form form, final S sink) {
    final Deque<Expr<V, C>> stack = new ArrayDeque<>();
    stack.push(expression.simplify());

    int splits = 0;
    while (!stack.isEmpty()) {
      final Expr<V, C> rewritten = form.distribute(stack.pop().pushdownNot());

      if (rewritten.type() == form.splitOn) {
        final AndOr<V, C> split = (AndOr<V, C>) rewritten;
        stack.push(split.left());
        stack.push(split.right());
        splits++;
      } else {
        if (log.isTraceEnabled()) {
          log.trace("{} clause: {}", form, rewritten);
        }
        sink.add(rewritten);
      }
    }

    log.debug(
        "Extracted {} {} clauses from {} splits of {}", sink.size(), form, splits, expression);
    return sink;
  }
}
