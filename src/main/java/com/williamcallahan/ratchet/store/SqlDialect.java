package com.williamcallahan.ratchet.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import javax.sql.DataSource;

/**
 * SQL differences between the production database and the embedded test database.
 */
public enum SqlDialect {
    POSTGRES("CAST(? AS jsonb)", "CAST(? AS vector)"),
    OTHER("?", "?");

    private final String jsonParameter;
    private final String vectorParameter;

    SqlDialect(String jsonParameter, String vectorParameter) {
        this.jsonParameter = jsonParameter;
        this.vectorParameter = vectorParameter;
    }

    /** Placeholder for a JSON text parameter written into a document column. */
    public String jsonParameter() {
        return jsonParameter;
    }

    /** Placeholder for a {@code [x,y,...]} text parameter written into an embedding column. */
    public String vectorParameter() {
        return vectorParameter;
    }

    /**
     * Resolves the dialect from the JDBC URL of a pooled connection.
     *
     * @throws IllegalStateException when no connection can be obtained
     */
    public static SqlDialect detect(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return fromJdbcUrl(connection.getMetaData().getURL());
        } catch (SQLException sqlException) {
            throw new IllegalStateException("Unable to determine database dialect", sqlException);
        }
    }

    static SqlDialect fromJdbcUrl(String url) {
        if (url == null) {
            return OTHER;
        }
        return url.toLowerCase(Locale.ROOT).contains(":postgresql:") ? POSTGRES : OTHER;
    }
}
