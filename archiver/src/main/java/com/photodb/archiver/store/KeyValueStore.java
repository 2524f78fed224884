package com.photodb.archiver.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-writer embedded key-value table backed by one SQLite file.
 *
 * Keys and values are serialised to opaque bytes with Jackson. The store holds
 * one exclusive connection for the life of the process and every operation runs
 * under one store-wide lock, so workers can share a single instance.
 *
 * Only {@link #open} may throw. After that, reads return empty and writes return
 * false on any I/O or serialisation fault; the detail is logged here. Callers
 * therefore cannot tell "not found" from "error".
 *
 * Every write is its own committed transaction (WAL, synchronous=FULL): a crash
 * can lose at most the latest write, never earlier ones.
 */
@Slf4j
public class KeyValueStore implements AutoCloseable {

    private static final String SELECT = "SELECT v FROM kv WHERE k = ?";
    private static final String INSERT_IF_ABSENT = "INSERT OR IGNORE INTO kv (k, v) VALUES (?, ?)";
    private static final String UPSERT = "INSERT OR REPLACE INTO kv (k, v) VALUES (?, ?)";
    private static final String DELETE = "DELETE FROM kv WHERE k = ?";

    private final String name;
    private final Path file;
    private final ObjectMapper objectMapper;
    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean closed;

    private KeyValueStore(String name, Path file, ObjectMapper objectMapper,
                          SingleConnectionDataSource dataSource) {
        this.name = name;
        this.file = file;
        this.objectMapper = objectMapper;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    /**
     * Open (creating if needed) the table at {@code file} and take the exclusive
     * file lock.
     *
     * @throws StoreUnavailableException if the file cannot be opened or is locked
     *                                   by another process
     */
    public static KeyValueStore open(String name, Path file, ObjectMapper objectMapper) {
        Path absolute = file.toAbsolutePath().normalize();
        SingleConnectionDataSource dataSource = null;
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
            dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + absolute, true);
            KeyValueStore store = new KeyValueStore(name, absolute, objectMapper, dataSource);
            store.initialise();
            log.info("Opened {} store at {}", name, absolute);
            return store;
        } catch (IOException | DataAccessException e) {
            log.error("Cannot open {} store at {}: {}", name, absolute, e.getMessage(), e);
            if (dataSource != null) {
                dataSource.destroy();
            }
            throw new StoreUnavailableException("Cannot open " + name + " store at " + absolute, e);
        }
    }

    private void initialise() {
        jdbcTemplate.execute("PRAGMA locking_mode=EXCLUSIVE");
        jdbcTemplate.execute("PRAGMA journal_mode=WAL");
        jdbcTemplate.execute("PRAGMA synchronous=FULL");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS kv (k BLOB PRIMARY KEY, v BLOB NOT NULL)");
        // first read takes the exclusive lock; fails fast if another process holds it
        jdbcTemplate.queryForObject("SELECT count(*) FROM kv", Long.class);
    }

    public <T> Optional<T> get(Object key, Class<T> type) {
        lock.lock();
        try {
            if (closed) {
                log.warn("{} store is closed, get({}) returns nothing", name, key);
                return Optional.empty();
            }
            List<byte[]> rows = jdbcTemplate.query(SELECT, (rs, i) -> rs.getBytes(1), serialise(key));
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(rows.get(0), type));
        } catch (IOException | DataAccessException e) {
            log.error("{} store: get failed for key {}: {}", name, key, e.getMessage());
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a value.
     *
     * @param overwrite when false this is a conditional insert: it fails, leaving
     *                  the existing value untouched, if the key is already present
     * @return true if the value was written
     */
    public boolean put(Object key, Object value, boolean overwrite) {
        lock.lock();
        try {
            if (closed) {
                log.warn("{} store is closed, put({}) rejected", name, key);
                return false;
            }
            int rows = jdbcTemplate.update(overwrite ? UPSERT : INSERT_IF_ABSENT,
                    serialise(key), objectMapper.writeValueAsBytes(value));
            return rows == 1;
        } catch (IOException | DataAccessException e) {
            log.error("{} store: put failed for key {}: {}", name, key, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** @return true unless the delete itself failed; deleting a missing key succeeds */
    public boolean delete(Object key) {
        lock.lock();
        try {
            if (closed) {
                log.warn("{} store is closed, delete({}) rejected", name, key);
                return false;
            }
            jdbcTemplate.update(DELETE, (Object) serialise(key));
            return true;
        } catch (IOException | DataAccessException e) {
            log.error("{} store: delete failed for key {}: {}", name, key, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Delete {@code key} only while it still maps to {@code expected}. The read
     * and the delete run under the store lock, so a value written in between by
     * another caller is never removed.
     *
     * @return true if the expected value was found and deleted
     */
    public boolean delete(Object key, Object expected) {
        lock.lock();
        try {
            if (closed) {
                log.warn("{} store is closed, delete({}) rejected", name, key);
                return false;
            }
            byte[] serialisedKey = serialise(key);
            List<byte[]> rows = jdbcTemplate.query(SELECT, (rs, i) -> rs.getBytes(1), (Object) serialisedKey);
            if (rows.isEmpty() || !expected.equals(objectMapper.readValue(rows.get(0), expected.getClass()))) {
                log.debug("{} store: {} no longer holds the expected value, not deleted", name, key);
                return false;
            }
            jdbcTemplate.update(DELETE, (Object) serialisedKey);
            return true;
        } catch (IOException | DataAccessException e) {
            log.error("{} store: conditional delete failed for key {}: {}", name, key, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    public Path getFile() {
        return file;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (!closed) {
                closed = true;
                dataSource.destroy();
                log.info("Closed {} store at {}", name, file);
            }
        } finally {
            lock.unlock();
        }
    }

    private byte[] serialise(Object key) throws IOException {
        return objectMapper.writeValueAsBytes(key);
    }
}
