package com.salesanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.io.IOException;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A numeric metric that may be undefined.
 *
 * Undefined is not zero: it marks a value that could not be computed
 * (first period of a growth series, fewer than two periods, a standard
 * deviation over a single observation). Reading the number of an undefined
 * value fails, so missing data never leaks into arithmetic.
 *
 * JSON form is the plain number, or null when undefined.
 */
@JsonDeserialize(using = MetricValue.Deserializer.class)
public final class MetricValue {

    private static final MetricValue UNDEFINED = new MetricValue(Double.NaN, false);

    private final double value;
    private final boolean defined;

    private MetricValue(double value, boolean defined) {
        this.value = value;
        this.defined = defined;
    }

    /**
     * Defined value; non-finite input (division by zero upstream) becomes undefined.
     */
    public static MetricValue of(double value) {
        if (!Double.isFinite(value)) {
            return UNDEFINED;
        }
        return new MetricValue(value, true);
    }

    public static MetricValue undefined() {
        return UNDEFINED;
    }

    public static MetricValue ofNullable(Double value) {
        return value == null ? UNDEFINED : of(value);
    }

    public boolean isDefined() {
        return defined;
    }

    public double value() {
        if (!defined) {
            throw new IllegalStateException("Metric value is undefined");
        }
        return value;
    }

    public double orElse(double fallback) {
        return defined ? value : fallback;
    }

    public OptionalDouble asOptional() {
        return defined ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    @JsonValue
    public Double toNullable() {
        return defined ? value : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetricValue)) {
            return false;
        }
        MetricValue other = (MetricValue) o;
        if (!defined || !other.defined) {
            return defined == other.defined;
        }
        return Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return defined ? Objects.hash(value) : 0;
    }

    @Override
    public String toString() {
        return defined ? Double.toString(value) : "undefined";
    }

    public static class Deserializer extends JsonDeserializer<MetricValue> {

        @Override
        public MetricValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            return MetricValue.of(parser.getDoubleValue());
        }

        @Override
        public MetricValue getNullValue(DeserializationContext context) {
            return MetricValue.undefined();
        }
    }
}
