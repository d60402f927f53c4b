package com.spotify.predicates;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;

/** How the clauses of a {@link NormalForm} are stored. */
public enum ClauseStorage {
  /**
   * Backed by a {@link HashSet}. Equal clauses collapse to one, and iteration order is unspecified.
   */
  SET {
    @Override
    <T> Collection<T> newCollection() {
      return new HashSet<>();
    }
  },
  /**
   * Backed by an {@link ArrayList}. Duplicates are kept, and clauses are iterated in the order they
   * were inserted.
   */
  LIST {
    @Override
    <T> Collection<T> newCollection() {
      return new ArrayList<>();
    }
  };

  abstract <T> Collection<T> newCollection();
}
