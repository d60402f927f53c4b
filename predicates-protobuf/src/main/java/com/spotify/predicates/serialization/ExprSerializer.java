package com.spotify.predicates.serialization;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.stream.Collectors.toList;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.ListValue;
import com.google.protobuf.Message;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.Value;
import com.google.protobuf.util.JsonFormat;
import com.google.protobuf.util.Structs;
import com.google.protobuf.util.Values;
import com.spotify.predicates.ClauseStorage;
import com.spotify.predicates.Cnf;
import com.spotify.predicates.Dnf;
import com.spotify.predicates.Eval;
import com.spotify.predicates.Expr;
import com.spotify.predicates.Literal;
import com.spotify.predicates.NormalForm;
import com.spotify.predicates.NormalFormOptions;
import com.spotify.predicates.serialization.Exceptions.EncodingError;
import com.spotify.predicates.serialization.Exceptions.ParseError;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes expressions and clause collections to protobuf {@link Value}s, and from there to
 * JSON.
 *
 * <p>The structure is the wire format. Every expression is a struct with a single field naming the
 * variant:
 *
 * <pre>
 *   {"literal": &lt;literal&gt;}
 *   {"not": &lt;expr&gt;}
 *   {"or": [&lt;expr&gt;, &lt;expr&gt;]}
 *   {"and": [&lt;expr&gt;, &lt;expr&gt;]}
 * </pre>
 *
 * <p>A {@link Cnf} or {@link Dnf} is a list of its clauses. Clauses are read back as is, without
 * normalizing them again.
 *
 * @param <V> the literal type
 * @param <C> the context the literals are evaluated against
 */
public class ExprSerializer<V extends Eval<C>, C> {

  private static final Logger log = LoggerFactory.getLogger(ExprSerializer.class);
  private static final JsonFormat.Printer jsonPrinter =
      JsonFormat.printer().omittingInsignificantWhitespace();
  private static final JsonFormat.Parser jsonParser = JsonFormat.parser();

  static final String LITERAL = "literal";
  static final String NOT = "not";
  static final String OR = "or";
  static final String AND = "and";

  private final LiteralCodec<V> codec;

  public ExprSerializer(LiteralCodec<V> codec) {
    this.codec = checkNotNull(codec, "codec");
  }

  public Value toValue(Expr<V, C> expression) {
    return switch (expression.type()) {
      case LITERAL -> tagged(LITERAL, codec.encode(((Literal<V, C>) expression).value()));
      case NOT -> tagged(NOT, toValue(expression.operands().get(0)));
      case OR -> tagged(OR, operandsToValue(expression));
      case AND -> tagged(AND, operandsToValue(expression));
    };
  }

  public Expr<V, C> fromValue(Value value) {
    if (value.getKindCase() != Value.KindCase.STRUCT_VALUE) {
      throw new ParseError(
          String.format("Expected an expression struct, but got %s", value.getKindCase()));
    }

    final Map<String, Value> fields = value.getStructValue().getFieldsMap();
    if (fields.size() != 1) {
      throw new ParseError(
          String.format("Expected exactly one expression kind, but got %s", fields.keySet()));
    }

    final Map.Entry<String, Value> field = fields.entrySet().iterator().next();
    switch (field.getKey()) {
      case LITERAL:
        return Expr.literal(decodeLiteral(field.getValue()));
      case NOT:
        return Expr.not(fromValue(field.getValue()));
      case OR:
        {
          final List<Expr<V, C>> operands = operandsFromValue(OR, field.getValue());
          return Expr.or(operands.get(0), operands.get(1));
        }
      case AND:
        {
          final List<Expr<V, C>> operands = operandsFromValue(AND, field.getValue());
          return Expr.and(operands.get(0), operands.get(1));
        }
      default:
        throw new ParseError(String.format("Unknown expression kind '%s'", field.getKey()));
    }
  }

  public String toJson(Expr<V, C> expression) {
    return print(toValue(expression));
  }

  public Expr<V, C> fromJson(String json) {
    final Value.Builder builder = Value.newBuilder();
    merge(json, builder);
    return fromValue(builder.build());
  }

  public ListValue toListValue(NormalForm<V, C> normalForm) {
    return ListValue.newBuilder()
        .addAllValues(normalForm.clauses().stream().map(this::toValue).collect(toList()))
        .build();
  }

  public String toJson(NormalForm<V, C> normalForm) {
    return print(toListValue(normalForm));
  }

  public Cnf<V, C> cnfFromValue(ListValue clauses) {
    return cnfFromValue(clauses, NormalFormOptions.defaults().getStorage());
  }

  public Cnf<V, C> cnfFromValue(ListValue clauses, ClauseStorage storage) {
    return Cnf.ofClauses(clausesFromValue(clauses), storage);
  }

  public Dnf<V, C> dnfFromValue(ListValue clauses) {
    return dnfFromValue(clauses, NormalFormOptions.defaults().getStorage());
  }

  public Dnf<V, C> dnfFromValue(ListValue clauses, ClauseStorage storage) {
    return Dnf.ofClauses(clausesFromValue(clauses), storage);
  }

  public Cnf<V, C> cnfFromJson(String json) {
    return cnfFromJson(json, NormalFormOptions.defaults().getStorage());
  }

  public Cnf<V, C> cnfFromJson(String json, ClauseStorage storage) {
    final ListValue.Builder builder = ListValue.newBuilder();
    merge(json, builder);
    return cnfFromValue(builder.build(), storage);
  }

  public Dnf<V, C> dnfFromJson(String json) {
    return dnfFromJson(json, NormalFormOptions.defaults().getStorage());
  }

  public Dnf<V, C> dnfFromJson(String json, ClauseStorage storage) {
    final ListValue.Builder builder = ListValue.newBuilder();
    merge(json, builder);
    return dnfFromValue(builder.build(), storage);
  }

  private static Value tagged(String kind, Value content) {
    return Values.of(Structs.of(kind, content));
  }

  private Value operandsToValue(Expr<V, C> expression) {
    return Values.of(expression.operands().stream().map(this::toValue).collect(toList()));
  }

  private List<Expr<V, C>> operandsFromValue(String kind, Value value) {
    if (value.getKindCase() != Value.KindCase.LIST_VALUE
        || value.getListValue().getValuesCount() != 2) {
      throw new ParseError(
          String.format("Expected '%s' to have a list of two operands, but got %s", kind, value));
    }
    return clausesFromValue(value.getListValue());
  }

  private List<Expr<V, C>> clausesFromValue(ListValue values) {
    return values.getValuesList().stream().map(this::fromValue).collect(toList());
  }

  private V decodeLiteral(Value value) {
    final V literal;
    try {
      literal = codec.decode(value);
    } catch (ParseError e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ParseError(String.format("Could not decode literal %s", value), e);
    }
    if (literal == null) {
      throw new ParseError(String.format("Literal %s decoded to null", value));
    }
    return literal;
  }

  private static String print(MessageOrBuilder message) {
    try {
      return jsonPrinter.print(message);
    } catch (InvalidProtocolBufferException | IllegalArgumentException e) {
      throw new EncodingError("Could not print expression as JSON", e);
    }
  }

  private static void merge(String json, Message.Builder builder) {
    checkNotNull(json, "json");
    try {
      jsonParser.merge(json, builder);
    } catch (InvalidProtocolBufferException e) {
      log.warn("Rejected malformed expression JSON: {}", e.getMessage());
      throw new ParseError("Malformed expression JSON", e);
    }
  }
}
