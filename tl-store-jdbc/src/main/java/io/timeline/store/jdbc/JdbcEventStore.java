package io.timeline.store.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.timeline.core.Event;
import io.timeline.core.EventCodec;
import io.timeline.core.Hlc;
import io.timeline.store.AbstractEventStore;
import io.timeline.store.EventProcessor;
import io.timeline.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Relational store over a single {@code events(id, type, data, schema_version)} table.
 *
 * <p>Writes are upserts keyed by id: a second event with the same id replaces the row
 * (last write wins). {@link #addAll} writes the whole batch in one transaction. Rows come back
 * sorted by id, since the canonical id string does not sort in clock order.
 */
public final class JdbcEventStore extends AbstractEventStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    public static final String TABLE = "events";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionOperations tx;
    private final SqlDialect dialect;
    private final EventDataType dataType;
    private final EventCodec codec;
    private final AutoCloseable owned;

    private final String upsertSql;
    private final String selectSql;

    public JdbcEventStore(JdbcTemplate jdbc, TransactionOperations tx, SqlDialect dialect,
                          EventDataType dataType, ObjectMapper json, EventProcessor processor) {
        this(jdbc, tx, dialect, dataType, json, processor, null);
    }

    private JdbcEventStore(JdbcTemplate jdbc, TransactionOperations tx, SqlDialect dialect,
                           EventDataType dataType, ObjectMapper json, EventProcessor processor,
                           AutoCloseable owned) {
        super(processor);
        this.jdbcTemplate = Objects.requireNonNull(jdbc);
        this.tx = Objects.requireNonNull(tx);
        this.dialect = Objects.requireNonNull(dialect);
        this.dataType = Objects.requireNonNull(dataType);
        this.codec = new EventCodec(json);
        this.owned = owned;

        var ddl = dialect.createTable(TABLE, dataType);
        this.upsertSql = dialect.upsert(TABLE, dialect.dataParameter(dataType));
        this.selectSql = "SELECT id, type, " + dialect.dataSelect(dataType) + ", schema_version FROM " + TABLE;
        jdbcTemplate.execute(ddl);
        log.debug("Event table ready ({} / {})", dialect, dataType);
    }

    /**
     * Store that owns {@code dataSource}: transactions run on a {@link DataSourceTransactionManager}
     * and the data source is closed on {@link #dispose()} when it is {@link AutoCloseable}.
     */
    public static JdbcEventStore open(DataSource dataSource, SqlDialect dialect, EventDataType dataType,
                                      ObjectMapper json, EventProcessor processor) {
        var tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        var owned = dataSource instanceof AutoCloseable c ? c : null;
        return new JdbcEventStore(new JdbcTemplate(dataSource), tx, dialect, dataType, json, processor, owned);
    }

    public SqlDialect dialect() { return dialect; }

    public EventDataType dataType() { return dataType; }

    @Override
    protected void persist(Event e) {
        jdbcTemplate.update(upsertSql, row(e));
    }

    @Override
    protected void persistAll(List<Event> sorted) {
        var rows = new ArrayList<Object[]>(sorted.size());
        for (var e : sorted) rows.add(row(e));
        tx.executeWithoutResult(status -> jdbcTemplate.batchUpdate(upsertSql, rows));
    }

    private Object[] row(Event e) {
        return new Object[]{e.id().format(), e.type(), codec.encodeData(e.data()), e.schemaVersion()};
    }

    @Override
    protected List<Event> loadAll() {
        var events = new ArrayList<>(jdbcTemplate.query(selectSql, mapper()));
        events.sort(BY_ID);
        return events;
    }

    @Override
    protected Optional<Event> load(Hlc id) {
        return jdbcTemplate.query(selectSql + " WHERE id = ?", mapper(), id.format()).stream().findFirst();
    }

    @Override
    protected void clear() {
        jdbcTemplate.update("DELETE FROM " + TABLE);
    }

    @Override
    protected void release() {
        if (owned == null) return;
        try {
            owned.close();
        } catch (Exception e) {
            throw new EventStoreException("Cannot close data source", e);
        }
    }

    private RowMapper<Event> mapper() {
        return (ResultSet rs, int rowNum) -> new Event(
                Hlc.parse(rs.getString("id")),
                rs.getString("type"),
                codec.decodeData(rs.getString("data")),
                rs.getString("schema_version"));
    }
}
