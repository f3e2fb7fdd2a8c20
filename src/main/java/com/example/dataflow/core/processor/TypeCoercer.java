package com.example.dataflow.core.processor;

import com.example.dataflow.core.exception.CoercionException;
import com.example.dataflow.core.model.ColumnType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Best-effort conversion of a decoded JSON value into a value the destination store accepts,
 * based on the declared type of the target column.
 * <p>
 * Coercion is permissive: a value that cannot be converted is passed through unchanged and the
 * store has the final word on it. The only hard failure is a composite value (object or list)
 * that cannot be serialized to JSON text.
 * <p>
 * Stateless and thread-safe; used as a singleton bean.
 */
public class TypeCoercer {

    private static final Logger log = LoggerFactory.getLogger(TypeCoercer.class);

    static final DateTimeFormatter CANONICAL_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX", Locale.ROOT);

    // Optional fractional seconds, as in "2024-01-05 10:11:12.345"
    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter RFC_1123_OFFSET = DateTimeFormatter.RFC_1123_DATE_TIME
            .withResolverStyle(ResolverStyle.STRICT);

    // RFC 1123 with a zone name such as "UTC" or "EST"
    private static final DateTimeFormatter RFC_1123_ZONE_NAME = DateTimeFormatter
            .ofPattern("EEE, d MMM uuuu HH:mm:ss zzz", Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);

    // Tried in order, first match wins. Zone-less formats are read as UTC.
    // Every format resolves strictly, so an impossible date such as Feb 30 is left as text.
    private static final List<Function<String, OffsetDateTime>> TIMESTAMP_PARSERS = List.of(
            s -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME),
            s -> LocalDateTime.parse(s, SPACE_SEPARATED).atOffset(ZoneOffset.UTC),
            s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().atOffset(ZoneOffset.UTC),
            s -> ZonedDateTime.parse(s, RFC_1123_OFFSET).toOffsetDateTime(),
            s -> ZonedDateTime.parse(s, RFC_1123_ZONE_NAME).toOffsetDateTime()
    );

    private final ObjectWriter compositeWriter;

    public TypeCoercer(ObjectMapper objectMapper) {
        this.compositeWriter = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null")
                .writer()
                .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Converts a raw decoded value for a column of the given declared type.
     *
     * @param declaredType The column's declared data type (any case), e.g. "integer", "timestamp without time zone".
     * @param value        The decoded JSON value.
     * @return The store-ready value, possibly the input itself.
     * @throws CoercionException if a composite value cannot be serialized.
     */
    public Object coerce(String declaredType, Object value) {
        ColumnType type = ColumnType.of(declaredType);

        if (value == null) {
            return null;
        }

        // Number literals keep their JSON text until here
        if (value instanceof BigInteger || value instanceof BigDecimal) {
            return coerceNumberLiteral(value.toString());
        }

        if (value instanceof Double || value instanceof Float) {
            if (type == ColumnType.INTEGER) {
                return ((Number) value).longValue(); // truncates toward zero
            }
            return value;
        }

        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }

        if (value instanceof String) {
            return coerceText(type, (String) value);
        }

        if (value instanceof Map || value instanceof Collection) {
            try {
                return compositeWriter.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new CoercionException(null, "cannot marshal complex value: " + e.getOriginalMessage(), e);
            }
        }

        return value;
    }

    private Object coerceNumberLiteral(String literal) {
        try {
            return Long.parseLong(literal);
        } catch (NumberFormatException ignored) {
            // not an integer literal, try floating point
        }
        try {
            double d = Double.parseDouble(literal);
            if (!Double.isInfinite(d)) {
                return d;
            }
        } catch (NumberFormatException ignored) {
            // fall through to the literal text
        }
        log.debug("Number literal '{}' is out of range, passing it through as text", literal);
        return literal;
    }

    private Object coerceText(ColumnType type, String text) {
        switch (type) {
            case TEMPORAL:
                OffsetDateTime parsed = parseTimestamp(text);
                // Unknown formats are left for the database to parse
                return parsed != null ? CANONICAL_TIMESTAMP.format(parsed) : text;

            case INTEGER:
                try {
                    return Long.parseLong(text.trim());
                } catch (NumberFormatException e) {
                    return text;
                }

            case FLOATING:
                try {
                    return new BigDecimal(text.trim()).doubleValue();
                } catch (NumberFormatException e) {
                    return text;
                }

            case BOOLEAN:
                switch (text.toLowerCase(Locale.ROOT)) {
                    case "true":
                    case "t":
                    case "1":
                        return Boolean.TRUE;
                    case "false":
                    case "f":
                    case "0":
                        return Boolean.FALSE;
                    default:
                        return text;
                }

            default:
                return text;
        }
    }

    static OffsetDateTime parseTimestamp(String text) {
        for (Function<String, OffsetDateTime> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return null;
    }
}
