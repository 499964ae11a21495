package com.phillippitts.edgekeeper.service.telemetry;

import com.phillippitts.edgekeeper.domain.BufferedRecord;
import com.phillippitts.edgekeeper.exception.EdgeKeeperException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable, bounded FIFO queue of serialized telemetry payloads.
 *
 * <p>Backed by a single SQLite table in WAL mode:
 * <pre>
 * telemetry_queue(id INTEGER PRIMARY KEY AUTOINCREMENT, payload_json TEXT, created_at INTEGER)
 * </pre>
 * {@code created_at} holds epoch milliseconds; ordering is {@code created_at, id}.
 *
 * <p>The buffer is count-bounded: after every insert the oldest rows beyond {@code maxRows}
 * are deleted. All statements run on one connection under a single lock. Persistence errors
 * after construction are logged and swallowed; callers see {@code false}, {@code 0} or an
 * empty list.
 */
public class TelemetryBuffer implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(TelemetryBuffer.class);

    private static final int BUSY_TIMEOUT_MILLIS = 30_000;

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS telemetry_queue (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                payload_json TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """;
    private static final String CREATE_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_telemetry_queue_created ON telemetry_queue (created_at, id)";

    private final Path path;
    private final int maxRows;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbc;
    private boolean closed;

    public TelemetryBuffer(Path path, int maxRows) {
        this(path, maxRows, Clock.systemUTC());
    }

    TelemetryBuffer(Path path, int maxRows, Clock clock) {
        this.path = Objects.requireNonNull(path, "path");
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive");
        }
        this.maxRows = maxRows;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.dataSource = new SingleConnectionDataSource(open(path), true);
        this.jdbc = new JdbcTemplate(dataSource);
        jdbc.execute(CREATE_TABLE);
        jdbc.execute(CREATE_INDEX);
        LOG.info("Telemetry buffer initialized at {} (WAL, max {} rows)", path, maxRows);
    }

    private static Connection open(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            SQLiteConfig config = new SQLiteConfig();
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
            config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
            return config.createConnection("jdbc:sqlite:" + path.toAbsolutePath());
        } catch (IOException | SQLException e) {
            throw new EdgeKeeperException("Cannot open telemetry buffer at " + path, e);
        }
    }

    /**
     * Appends a serialized payload and evicts the oldest rows beyond the limit.
     *
     * @return true if the row was stored
     */
    public boolean insert(String payloadJson) {
        lock.lock();
        try {
            if (closed) {
                LOG.warn("Telemetry buffer closed; payload dropped");
                return false;
            }
            jdbc.update("INSERT INTO telemetry_queue (payload_json, created_at) VALUES (?, ?)",
                    payloadJson, clock.millis());
            enforceLimit();
            return true;
        } catch (DataAccessException e) {
            LOG.error("Failed to buffer payload: {}", e.getMessage(), e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void enforceLimit() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM telemetry_queue", Long.class);
        long excess = (count == null ? 0 : count) - maxRows;
        if (excess > 0) {
            jdbc.update("""
                    DELETE FROM telemetry_queue WHERE id IN (
                        SELECT id FROM telemetry_queue ORDER BY created_at, id LIMIT ?
                    )
                    """, excess);
            LOG.warn("Telemetry buffer full: evicted {} oldest payloads (limit {})", excess, maxRows);
        }
    }

    /**
     * Returns up to {@code limit} records, oldest first.
     */
    public List<BufferedRecord> oldest(int limit) {
        lock.lock();
        try {
            if (closed) {
                return List.of();
            }
            return jdbc.query(
                    "SELECT id, payload_json, created_at FROM telemetry_queue ORDER BY created_at, id LIMIT ?",
                    (rs, rowNum) -> new BufferedRecord(
                            rs.getLong("id"),
                            rs.getString("payload_json"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))),
                    limit);
        } catch (DataAccessException e) {
            LOG.error("Failed to read telemetry buffer: {}", e.getMessage(), e);
            return List.of();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes one record.
     *
     * @return true if a row was deleted
     */
    public boolean delete(long id) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            return jdbc.update("DELETE FROM telemetry_queue WHERE id = ?", id) > 0;
        } catch (DataAccessException e) {
            LOG.error("Failed to delete buffered payload {}: {}", id, e.getMessage(), e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of buffered records; 0 if the store cannot be read.
     */
    public long count() {
        lock.lock();
        try {
            if (closed) {
                return 0L;
            }
            Long count = jdbc.queryForObject("SELECT COUNT(*) FROM telemetry_queue", Long.class);
            return count == null ? 0L : count;
        } catch (DataAccessException e) {
            LOG.error("Failed to count telemetry buffer: {}", e.getMessage(), e);
            return 0L;
        } finally {
            lock.unlock();
        }
    }

    public Path path() {
        return path;
    }

    public int maxRows() {
        return maxRows;
    }

    /**
     * Closes the database connection. Idempotent; later operations are no-ops.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            dataSource.destroy();
            LOG.info("Telemetry buffer closed: {}", path);
        } finally {
            lock.unlock();
        }
    }
}
