package org.netpreserve.roundabout.queue;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * A queue stored in its own SQLite database file. The file is deleted when the queue is closed empty.
 */
public class SqliteQueue<T> implements BackingQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(SqliteQueue.class);
    private final Path path;
    private final String location;
    private final Ordering ordering;
    private final Codec<T> codec;
    private final Handle handle;
    private int size;

    public SqliteQueue(Path path, String location, Ordering ordering, Codec<T> codec) throws IOException {
        this.path = path;
        this.location = location;
        this.ordering = ordering;
        this.codec = codec;
        try {
            this.handle = connect(path).open();
        } catch (JdbiException e) {
            throw new StorageException(path, "Unable to open queue", e);
        }
        try {
            handle.execute("CREATE TABLE IF NOT EXISTS queue (id INTEGER PRIMARY KEY AUTOINCREMENT, item BLOB NOT NULL)");
            this.size = handle.createQuery("SELECT COUNT(*) FROM queue").mapTo(Integer.class).one();
        } catch (JdbiException e) {
            handle.close();
            throw new StorageException(path, "Unable to initialize queue", e);
        }
        log.debug("Opened queue {} with {} entries", path, size);
    }

    @Override
    public void push(T item) throws IOException {
        byte[] data = codec.encode(item);
        try {
            handle.createUpdate("INSERT INTO queue (item) VALUES (:item)")
                    .bind("item", data)
                    .execute();
        } catch (JdbiException e) {
            throw new StorageException(path, "Failed to push to queue", e);
        }
        size++;
    }

    @Override
    public @Nullable T pop() throws IOException {
        if (size == 0) return null;
        String sql = ordering == Ordering.FIFO
                ? "SELECT id, item FROM queue ORDER BY id ASC LIMIT 1"
                : "SELECT id, item FROM queue ORDER BY id DESC LIMIT 1";
        T item;
        try {
            // a failed decode rolls back the delete
            item = handle.inTransaction(h -> {
                var next = h.createQuery(sql)
                        .map((rs, ctx) -> new Row(rs.getLong("id"), rs.getBytes("item")))
                        .findOne();
                if (next.isEmpty()) return null;
                T decoded = codec.decode(next.get().item());
                h.createUpdate("DELETE FROM queue WHERE id = :id")
                        .bind("id", next.get().id())
                        .execute();
                return decoded;
            });
        } catch (JdbiException e) {
            throw new StorageException(path, "Failed to pop from queue", e);
        }
        if (item == null) {
            size = 0;
            return null;
        }
        size--;
        return item;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public String location() {
        return location;
    }

    @Override
    public void close() throws IOException {
        try {
            handle.close();
        } catch (JdbiException e) {
            throw new StorageException(path, "Failed to close queue", e);
        }
        if (size == 0) {
            Files.deleteIfExists(path);
            log.debug("Deleted empty queue {}", path);
        }
    }

    private static Jdbi connect(Path path) {
        SQLiteConfig config = new SQLiteConfig();
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(60000);
        var jdbi = Jdbi.create("jdbc:sqlite:" + path, config.toProperties());
        jdbi.setSqlLogger(new SqlLogger() {
            @Override
            public void logAfterExecution(StatementContext context) {
                if (context.getExecutionMoment() == null || context.getCompletionMoment() == null) return;
                long durationMillis = Duration.between(context.getExecutionMoment(),
                        context.getCompletionMoment()).toMillis();
                if (durationMillis > 100) {
                    ParsedSql parsedSql = context.getParsedSql();
                    String sql = parsedSql != null ? parsedSql.getSql() : "<sql unavailable>";
                    log.warn("[Slow SQL] {}ms {} on {}", durationMillis, sql, path);
                }
            }
        });
        return jdbi;
    }

    public Path path() {
        return path;
    }

    private record Row(long id, byte[] item) {
    }
}
