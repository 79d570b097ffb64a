package org.carball.cubeql.sql;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DatabaseEngine {
    POSTGRES("postgres"),
    MYSQL("mysql"),
    SQLITE("sqlite");

    private final String value;

    DatabaseEngine(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public SqlDialect dialect() {
        switch (this) {
            case MYSQL:
                return new MySqlDialect();
            case SQLITE:
                return new SqliteDialect();
            case POSTGRES:
            default:
                return new PostgresDialect();
        }
    }

    @JsonCreator
    public static DatabaseEngine fromValue(String value) {
        return Arrays.stream(values())
                .filter(e -> e.value.equalsIgnoreCase(value)
                        || ("postgresql".equalsIgnoreCase(value) && e == POSTGRES))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown database engine: " + value));
    }
}
