package com.graphrecall.repository.postgres;

import com.graphrecall.util.VectorUtil;
import org.springframework.r2dbc.core.DatabaseClient;

/**
 * Null-safe parameter binding for statements touching pgvector columns.
 */
final class PostgresBindings {

    private PostgresBindings() {
    }

    static DatabaseClient.GenericExecuteSpec bindText(DatabaseClient.GenericExecuteSpec spec, String name, String value) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, String.class);
    }

    /**
     * Binds the vector as its text literal; the SQL must wrap the parameter in {@code CAST(... AS vector)}.
     */
    static DatabaseClient.GenericExecuteSpec bindVector(DatabaseClient.GenericExecuteSpec spec, String name, float[] vector) {
        return vector != null ? spec.bind(name, VectorUtil.format(vector)) : spec.bindNull(name, String.class);
    }
}
