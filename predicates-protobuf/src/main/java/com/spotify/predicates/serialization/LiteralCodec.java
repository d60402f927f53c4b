package com.spotify.predicates.serialization;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.protobuf.Value;
import java.util.function.Function;

/**
 * Maps a literal type to and from a protobuf {@link Value}.
 *
 * @param <V> the literal type
 */
public interface LiteralCodec<V> {

  Value encode(V literal);

  /**
   * Decodes a literal.
   *
   * @throws Exceptions.ParseError if {@code value} does not represent a literal
   */
  V decode(Value value);

  static <V> LiteralCodec<V> of(
      Function<? super V, Value> encoder, Function<Value, ? extends V> decoder) {
    checkNotNull(encoder, "encoder");
    checkNotNull(decoder, "decoder");
    return new LiteralCodec<>() {
      @Override
      public Value encode(V literal) {
        return encoder.apply(literal);
      }

      @Override
      public V decode(Value value) {
        return decoder.apply(value);
      }
    };
  }
}
