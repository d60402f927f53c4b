package com.spotify.predicates.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.ListValue;
import com.google.protobuf.Value;
import com.google.protobuf.util.JsonFormat;
import com.google.protobuf.util.Structs;
import com.google.protobuf.util.Values;
import com.spotify.predicates.ClauseStorage;
import com.spotify.predicates.Cnf;
import com.spotify.predicates.Dnf;
import com.spotify.predicates.Expr;
import com.spotify.predicates.serialization.Exceptions.EncodingError;
import com.spotify.predicates.serialization.Exceptions.ParseError;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExprSerializerTest {

  private ExprSerializer<Flag, Set<String>> serializer;

  @BeforeEach
  public void setUp() {
    serializer =
        new ExprSerializer<>(
            LiteralCodec.of(
                flag -> Values.of(flag.name()),
                value -> {
                  if (value.getKindCase() != Value.KindCase.STRING_VALUE) {
                    throw new ParseError("Flag names are strings, got " + value.getKindCase());
                  }
                  return new Flag(value.getStringValue());
                }));
  }

  private static Expr<Flag, Set<String>> f(String name) {
    return Expr.literal(new Flag(name));
  }

  // (!a + b)·(!c + d)
  private static Expr<Flag, Set<String>> sample() {
    return Expr.and(Expr.or(Expr.not(f("a")), f("b")), Expr.or(Expr.not(f("c")), f("d")));
  }

  private static Value parse(String json) throws InvalidProtocolBufferException {
    final Value.Builder builder = Value.newBuilder();
    JsonFormat.parser().merge(json, builder);
    return builder.build();
  }

  @Test
  public void testLiteralValue() {
    assertThat(serializer.toValue(f("a")))
        .isEqualTo(Values.of(Structs.of("literal", Values.of("a"))));
  }

  @Test
  public void testStructure() throws InvalidProtocolBufferException {
    final Value expected =
        parse(
            "{\"and\": ["
                + "{\"or\": [{\"not\": {\"literal\": \"a\"}}, {\"literal\": \"b\"}]},"
                + "{\"or\": [{\"not\": {\"literal\": \"c\"}}, {\"literal\": \"d\"}]}"
                + "]}");

    assertThat(serializer.toValue(sample())).isEqualTo(expected);
    assertThat(parse(serializer.toJson(sample()))).isEqualTo(expected);
  }

  @Test
  public void testRoundTrip() {
    final Expr<Flag, Set<String>> expr = sample();

    final Expr<Flag, Set<String>> fromValue = serializer.fromValue(serializer.toValue(expr));
    final Expr<Flag, Set<String>> fromJson = serializer.fromJson(serializer.toJson(expr));

    assertThat(fromValue).isEqualTo(expr);
    assertThat(fromValue.eqRepr(expr)).isTrue();
    assertThat(fromJson).isEqualTo(expr);
    assertThat(fromJson.eqRepr(expr)).isTrue();
  }

  @Test
  public void testFromJson() {
    final Expr<Flag, Set<String>> expr =
        serializer.fromJson(
            "{\"or\": [{\"literal\": \"x\"},"
                + " {\"and\": [{\"literal\": \"y\"}, {\"literal\": \"z\"}]}]}");

    assertThat(expr.eqRepr(Expr.or(f("x"), Expr.and(f("y"), f("z"))))).isTrue();
    assertThat(expr.eval(Set.of("y", "z"))).isTrue();
    assertThat(expr.eval(Set.of("y"))).isFalse();
  }

  @Test
  public void testCnfRoundTrip() {
    final Cnf<Flag, Set<String>> cnf = Cnf.from(Expr.not(sample()), ClauseStorage.LIST);

    final ListValue list = serializer.toListValue(cnf);
    assertThat(list.getValuesCount()).isEqualTo(cnf.size());

    assertThat(serializer.cnfFromValue(list, ClauseStorage.LIST)).isEqualTo(cnf);
    assertThat(serializer.cnfFromJson(serializer.toJson(cnf), ClauseStorage.LIST)).isEqualTo(cnf);
  }

  @Test
  public void testDnfRoundTrip() {
    final Dnf<Flag, Set<String>> dnf = Dnf.from(sample());

    assertThat(serializer.dnfFromValue(serializer.toListValue(dnf))).isEqualTo(dnf);
    assertThat(serializer.dnfFromJson(serializer.toJson(dnf))).isEqualTo(dnf);
  }

  @Test
  public void testClausesAreReadAsIs() {
    final Dnf<Flag, Set<String>> dnf =
        serializer.dnfFromJson(
            "[{\"or\": [{\"literal\": \"a\"}, {\"literal\": \"b\"}]}, {\"literal\": \"a\"}]",
            ClauseStorage.LIST);

    assertThat(dnf.toList()).containsExactly(Expr.or(f("a"), f("b")), f("a"));
  }

  @Test
  public void testEmptyClauses() {
    assertThat(serializer.toJson(Cnf.<Flag, Set<String>>empty())).isEqualTo("[]");
    assertThat(serializer.cnfFromJson("[]").eval(Set.of())).isTrue();
    assertThat(serializer.dnfFromJson("[]").eval(Set.of())).isFalse();
  }

  @Test
  public void testRejectsMalformedJson() {
    assertThatThrownBy(() -> serializer.fromJson("{\"and\": ["))
        .isInstanceOf(ParseError.class)
        .hasCauseInstanceOf(InvalidProtocolBufferException.class);
    assertThatThrownBy(() -> serializer.cnfFromJson("{\"literal\": \"a\"}"))
        .isInstanceOf(ParseError.class);
  }

  @Test
  public void testRejectsBadShapes() {
    final List<String> inputs =
        List.of(
            "\"a\"",
            "{}",
            "{\"literal\": \"a\", \"not\": {\"literal\": \"b\"}}",
            "{\"xor\": [{\"literal\": \"a\"}, {\"literal\": \"b\"}]}",
            "{\"and\": [{\"literal\": \"a\"}]}",
            "{\"or\": {\"literal\": \"a\"}}",
            "{\"not\": [{\"literal\": \"a\"}]}",
            "{\"literal\": 1}");
    for (String input : inputs) {
      assertThatThrownBy(() -> serializer.fromJson(input))
          .as(input)
          .isInstanceOf(ParseError.class);
    }
  }

  @Test
  public void testWrapsCodecFailures() {
    final ExprSerializer<Flag, Set<String>> failing =
        new ExprSerializer<>(
            LiteralCodec.of(
                flag -> Values.of(flag.name()),
                value -> {
                  throw new IllegalStateException("boom");
                }));

    assertThatThrownBy(() -> failing.fromJson("{\"literal\": \"a\"}"))
        .isInstanceOf(ParseError.class)
        .hasCauseInstanceOf(IllegalStateException.class);

    final ExprSerializer<Flag, Set<String>> nulls =
        new ExprSerializer<>(LiteralCodec.of(flag -> Values.of(flag.name()), value -> null));
    assertThatThrownBy(() -> nulls.fromJson("{\"literal\": \"a\"}"))
        .isInstanceOf(ParseError.class);
  }

  @Test
  public void testEncodingErrorOnUnprintableLiteral() {
    final ExprSerializer<Flag, Set<String>> nonFinite =
        new ExprSerializer<>(
            LiteralCodec.of(flag -> Values.of(Double.NaN), value -> new Flag("a")));
    final Expr<Flag, Set<String>> expr = Expr.or(f("a"), Expr.not(f("b")));

    assertThatThrownBy(() -> nonFinite.toJson(expr))
        .isInstanceOf(EncodingError.class)
        .cause()
        .isInstanceOfAny(InvalidProtocolBufferException.class, IllegalArgumentException.class);
    assertThatThrownBy(() -> nonFinite.toJson(Cnf.ofClauses(List.of(expr))))
        .isInstanceOf(EncodingError.class)
        .cause()
        .isInstanceOfAny(InvalidProtocolBufferException.class, IllegalArgumentException.class);
  }
}
