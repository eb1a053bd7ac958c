package com.esfront.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Writes numeric literal values the way JavaScript prints them: integral values
 * without a decimal point, NaN and infinities as {@code null}.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Object> {
    // 2^53: beyond this a double no longer holds every integer
    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (!(value instanceof Number number)) {
            gen.writeObject(value);
            return;
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            gen.writeNull();
        } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE_INTEGER) {
            gen.writeNumber((long) d);
        } else if (d == Math.floor(d) && Math.abs(d) < 1e21) {
            // JavaScript prints the shortest round-tripping digits padded with zeros, e.g. 72057594037927940
            gen.writeNumber(shortestDigits(d).toBigInteger());
        } else {
            gen.writeNumber(d);
        }
    }

    /** The decimal with the fewest significant digits that still reads back as {@code d}. */
    static BigDecimal shortestDigits(double d) {
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal rounded = exact.round(new MathContext(precision));
            if (rounded.doubleValue() == d) {
                return rounded;
            }
        }
        return exact.round(new MathContext(17));
    }
}
