package org.carball.cubeql.transform;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Reads typed values from JDBC-style rows. Drivers return counts as Long, BigInteger,
 * BigDecimal or even text depending on the engine.
 */
final class Rows {

    private Rows() {
    }

    static Double doubleValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return new BigDecimal(value.toString().trim()).doubleValue();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Column '" + column + "' is not numeric: " + value, e);
        }
    }

    static long longValue(Map<String, Object> row, String column) {
        Double value = doubleValue(row, column);
        return value == null ? 0L : Math.round(value);
    }

    static String stringValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }
}
