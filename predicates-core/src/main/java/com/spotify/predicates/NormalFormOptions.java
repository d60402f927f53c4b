package com.spotify.predicates;

import com.google.common.base.MoreObjects;

/**
 * Options applied when a {@link Cnf} or {@link Dnf} is extracted from an expression.
 *
 * <p>Currently this is only the {@link ClauseStorage} of the extracted clauses, which is {@link
 * ClauseStorage#SET} unless configured otherwise.
 */
public class NormalFormOptions {

  private static final NormalFormOptions DEFAULTS = new NormalFormOptions();

  private final ClauseStorage storage;

  /** A null {@code storage} falls back to {@link ClauseStorage#SET}. */
  public NormalFormOptions(ClauseStorage storage) {
    this.storage = storage != null ? storage : ClauseStorage.SET;
  }

  public NormalFormOptions() {
    this(ClauseStorage.SET);
  }

  public ClauseStorage getStorage() {
    return storage;
  }

  public static NormalFormOptions withStorage(ClauseStorage storage) {
    return new NormalFormOptions(storage);
  }

  /** Shared options with every setting at its default. */
  public static NormalFormOptions defaults() {
    return DEFAULTS;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("storage", storage).toString();
  }
}
