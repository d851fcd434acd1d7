package io.timeline.store.jdbc;

/**
 * SQL differences between supported engines for the {@code events} table.
 */
public enum SqlDialect {
    POSTGRES("TEXT") {
        @Override String dataColumnType(EventDataType t) {
            return switch (t) {
                case TEXT -> "TEXT";
                case JSON -> "JSON";
                case JSONB -> "JSONB";
            };
        }

        @Override String dataParameter(EventDataType t) {
            return switch (t) {
                case TEXT -> "?";
                case JSON -> "?::json";
                case JSONB -> "?::jsonb";
            };
        }

        @Override String dataSelect(EventDataType t) {
            return t == EventDataType.TEXT ? "data" : "data::text AS data";
        }

        @Override String upsert(String table, String dataParam) {
            return "INSERT INTO " + table + " (id, type, data, schema_version) VALUES (?, ?, " + dataParam + ", ?)"
                    + " ON CONFLICT (id) DO UPDATE SET type = EXCLUDED.type, data = EXCLUDED.data,"
                    + " schema_version = EXCLUDED.schema_version";
        }
    },

    SQLITE("TEXT") {
        @Override String dataColumnType(EventDataType t) {
            return t == EventDataType.JSONB ? "BLOB" : "TEXT";
        }

        @Override String dataParameter(EventDataType t) {
            return switch (t) {
                case TEXT -> "?";
                case JSON -> "json(?)";
                case JSONB -> "jsonb(?)";
            };
        }

        @Override String dataSelect(EventDataType t) {
            return t == EventDataType.TEXT ? "data" : "json(data) AS data";
        }

        @Override String upsert(String table, String dataParam) {
            return "INSERT OR REPLACE INTO " + table + " (id, type, data, schema_version) VALUES (?, ?, " + dataParam + ", ?)";
        }
    },

    H2("VARCHAR") {
        @Override String dataColumnType(EventDataType t) {
            return switch (t) {
                case TEXT -> "VARCHAR";
                case JSON -> "JSON";
                case JSONB -> throw new IllegalArgumentException("H2 has no binary JSON type");
            };
        }

        @Override String dataParameter(EventDataType t) {
            return t == EventDataType.JSON ? "? FORMAT JSON" : "?";
        }

        @Override String dataSelect(EventDataType t) { return "data"; }

        @Override String upsert(String table, String dataParam) {
            return "MERGE INTO " + table + " (id, type, data, schema_version) KEY (id) VALUES (?, ?, " + dataParam + ", ?)";
        }
    };

    private final String textType;

    SqlDialect(String textType) { this.textType = textType; }

    abstract String dataColumnType(EventDataType t);

    abstract String dataParameter(EventDataType t);

    abstract String dataSelect(EventDataType t);

    abstract String upsert(String table, String dataParam);

    String createTable(String table, EventDataType t) {
        return "CREATE TABLE IF NOT EXISTS " + table + " ("
                + "id " + textType + " PRIMARY KEY, "
                + "type " + textType + ", "
                + "data " + dataColumnType(t) + ", "
                + "schema_version " + textType + " DEFAULT '1.0.0')";
    }
}
