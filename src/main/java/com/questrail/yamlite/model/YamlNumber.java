package com.questrail.yamlite.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Numeric scalar.
 *
 * <p>
 * The decoder produces {@link Long} for integer literals, {@link BigInteger} for
 * integer literals outside the {@code long} range and {@link Double} for decimal
 * or exponent forms. The encoder prints {@link Number#toString()} unchanged.
 * </p>
 */
public record YamlNumber(Number value) implements YamlValue
{
    public YamlNumber {
        Objects.requireNonNull(value, "value");
    }

    public static YamlNumber of(long value)
    {
        return new YamlNumber(value);
    }

    public static YamlNumber of(double value)
    {
        return new YamlNumber(value);
    }

    /**
     * @return true if the literal had no fractional part or exponent
     */
    public boolean isIntegral()
    {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    public long longValue()
    {
        return value.longValue();
    }

    public double doubleValue()
    {
        return value.doubleValue();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof YamlNumber other)) {
            return false;
        }
        if (isIntegral() != other.isIntegral()) {
            return false;
        }
        if (isIntegral()) {
            return toBigInteger(value).equals(toBigInteger(other.value));
        }
        return Double.compare(value.doubleValue(), other.value.doubleValue()) == 0;
    }

    @Override
    public int hashCode()
    {
        return isIntegral() ? toBigInteger(value).hashCode() : Double.hashCode(value.doubleValue());
    }

    @Override
    public String toString()
    {
        return value.toString();
    }

    private static BigInteger toBigInteger(Number n)
    {
        if (n instanceof BigInteger big) {
            return big;
        }
        if (n instanceof BigDecimal dec) {
            return dec.toBigInteger();
        }
        return BigInteger.valueOf(n.longValue());
    }
}
