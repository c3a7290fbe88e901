package io.memoryrunr.memory;

import io.memoryrunr.config.MemoryProperties;
import io.memoryrunr.embedding.EmbeddingProvider;
import io.memoryrunr.embedding.VectorCodec;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed memory store.
 *
 * <p>Schema: a single {@code memories} table. Vectors live in the {@code embedding} BLOB column in
 * {@link VectorCodec} format; timestamps are epoch milliseconds. Rows are never deleted: forgetting,
 * superseding and archiving only change {@code status}.</p>
 *
 * <p>One JDBC connection is shared by the interactive path and the formation worker; every statement
 * runs under {@link #lock} so the supersede transaction cannot interleave with other writes.
 * Embedding calls are made before taking the lock.</p>
 */
@Component
public class SQLiteMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteMemoryStore.class);

    static final int MAX_HISTORY_DEPTH = 100;

    private static final String COLUMNS = """
            id, agent_handle, path_scope, content, category, embedding, source_session_id, source_message_id,
            created_at, updated_at, confidence, last_accessed_at, access_count,
            supersedes_id, superseded_by_id, supersession_reason, status""";

    private static final String SCOPE_FILTER = """
            (agent_handle = ?1 OR agent_handle IS NULL OR ?1 IS NULL)
              AND (path_scope = ?2 OR path_scope IS NULL OR ?2 IS NULL)""";

    private final String dbPath;
    private final @Nullable EmbeddingProvider embeddingProvider;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private Connection connection;

    @Autowired
    public SQLiteMemoryStore(MemoryProperties properties, @Nullable EmbeddingProvider embeddingProvider) {
        Path dir = Path.of(properties.path());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create memory directory: {}", dir, e);
        }
        this.dbPath = dir.resolve("memories.db").toString();
        this.embeddingProvider = embeddingProvider;
        this.clock = Clock.systemUTC();
    }

    /** Constructor for testing with an explicit database file and clock. */
    public SQLiteMemoryStore(Path dbFile, @Nullable EmbeddingProvider embeddingProvider, Clock clock) {
        this.dbPath = dbFile.toString();
        this.embeddingProvider = embeddingProvider;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
                stmt.execute("PRAGMA foreign_keys=ON");
            }
            createSchema();
            log.info("SQLiteMemoryStore initialized at: {} (embeddings: {})", dbPath,
                    embeddingProvider != null ? embeddingProvider.name() : "none");
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite memory store at {}", dbPath, e);
            throw new MemoryStorageException("Memory store initialization failed", e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memories (
                    id TEXT PRIMARY KEY,
                    agent_handle TEXT,
                    path_scope TEXT,
                    content TEXT NOT NULL,
                    category TEXT NOT NULL DEFAULT 'fact'
                        CHECK (category IN ('preference', 'fact', 'correction', 'pattern')),
                    embedding BLOB,
                    source_session_id TEXT,
                    source_message_id TEXT,
                    created_at INTEGER NOT NULL,
                    updated_at INTEGER NOT NULL,
                    confidence REAL NOT NULL DEFAULT 1.0,
                    last_accessed_at INTEGER,
                    access_count INTEGER NOT NULL DEFAULT 0,
                    supersedes_id TEXT REFERENCES memories(id) ON DELETE SET NULL,
                    superseded_by_id TEXT REFERENCES memories(id) ON DELETE SET NULL,
                    supersession_reason TEXT,
                    status TEXT NOT NULL DEFAULT 'active'
                        CHECK (status IN ('active', 'superseded', 'archived', 'forgotten'))
                )
                """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_agent ON memories(agent_handle, status)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_path ON memories(path_scope, status)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_status ON memories(status)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_category ON memories(category)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_supersedes ON memories(supersedes_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_created ON memories(created_at DESC)");
        }
    }

    @Override
    public Memory create(MemoryDraft draft) {
        validate(draft);

        float[] vector = draft.embedding();
        if (vector == null && embeddingProvider != null) {
            try {
                vector = embeddingProvider.embed(draft.content());
            } catch (RuntimeException e) {
                // Stored without a vector: listable, but invisible to search.
                log.warn("Embedding failed, storing memory without vector: {}", e.getMessage());
            }
        }

        Instant now = now();
        Memory memory = new Memory(
                UUID.randomUUID().toString(),
                draft.agentHandle(),
                draft.pathScope(),
                draft.content().trim(),
                draft.category() != null ? draft.category() : MemoryCategory.FACT,
                vector,
                draft.confidence() != null ? draft.confidence() : 1.0,
                0,
                null,
                null,
                null,
                null,
                MemoryStatus.ACTIVE,
                draft.sourceSessionId(),
                draft.sourceMessageId(),
                now,
                now
        );

        String sql = """
            INSERT INTO memories (id, agent_handle, path_scope, content, category, embedding,
                source_session_id, source_message_id, created_at, updated_at, confidence, status)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        lock.lock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, memory.id());
            stmt.setString(2, memory.agentHandle());
            stmt.setString(3, memory.pathScope());
            stmt.setString(4, memory.content());
            stmt.setString(5, memory.category().value());
            stmt.setBytes(6, VectorCodec.encode(memory.embedding()));
            stmt.setString(7, memory.sourceSessionId());
            stmt.setString(8, memory.sourceMessageId());
            stmt.setLong(9, now.toEpochMilli());
            stmt.setLong(10, now.toEpochMilli());
            stmt.setDouble(11, memory.confidence());
            stmt.setString(12, memory.status().value());
            stmt.executeUpdate();
            log.debug("Stored memory {} [{}] agent={} embedded={}", memory.shortId(), memory.category(),
                    memory.agentHandle(), memory.hasEmbedding());
            return memory;
        } catch (SQLException e) {
            log.error("Failed to store memory", e);
            throw new MemoryStorageException("Failed to store memory", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Memory get(String id) {
        Memory memory = find(id).orElseThrow(() -> new MemoryNotFoundException(id));
        return touch(memory);
    }

    @Override
    public Memory getByPrefix(String prefix) {
        return touch(resolve(prefix));
    }

    @Override
    public Memory resolve(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new MemoryValidationException("Memory id must not be empty");
        }
        Optional<Memory> exact = find(prefix);
        if (exact.isPresent()) {
            return exact.get();
        }

        List<Memory> matches = query(
                "SELECT " + COLUMNS + " FROM memories WHERE substr(id, 1, ?) = ?",
                stmt -> {
                    stmt.setInt(1, prefix.length());
                    stmt.setString(2, prefix);
                });
        if (matches.isEmpty()) {
            throw new MemoryNotFoundException(prefix);
        }
        if (matches.size() > 1) {
            throw new AmbiguousMemoryIdException(prefix, matches.size());
        }
        return matches.get(0);
    }

    @Override
    public Optional<Memory> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        List<Memory> rows = query("SELECT " + COLUMNS + " FROM memories WHERE id = ?",
                stmt -> stmt.setString(1, id));
        return rows.stream().findFirst();
    }

    @Override
    public List<Memory> list(String agentHandle, int limit, int offset) {
        checkPage(limit, offset);
        if (agentHandle != null) {
            return query("""
                SELECT %s FROM memories
                WHERE status = 'active' AND agent_handle = ?
                ORDER BY created_at DESC, rowid DESC
                LIMIT ? OFFSET ?
                """.formatted(COLUMNS), stmt -> {
                stmt.setString(1, agentHandle);
                stmt.setInt(2, limit);
                stmt.setInt(3, offset);
            });
        }
        return query("""
            SELECT %s FROM memories
            WHERE status = 'active'
            ORDER BY created_at DESC, rowid DESC
            LIMIT ? OFFSET ?
            """.formatted(COLUMNS), stmt -> {
            stmt.setInt(1, limit);
            stmt.setInt(2, offset);
        });
    }

    @Override
    public List<Memory> listByCategory(MemoryCategory category, String agentHandle, int limit, int offset) {
        checkPage(limit, offset);
        return query("""
            SELECT %s FROM memories
            WHERE status = 'active' AND category = ?
              AND (agent_handle = ? OR ? IS NULL)
            ORDER BY created_at DESC, rowid DESC
            LIMIT ? OFFSET ?
            """.formatted(COLUMNS), stmt -> {
            stmt.setString(1, category.value());
            stmt.setString(2, agentHandle);
            stmt.setString(3, agentHandle);
            stmt.setInt(4, limit);
            stmt.setInt(5, offset);
        });
    }

    @Override
    public long count(String agentHandle) {
        lock.lock();
        try (var stmt = connection.prepareStatement(
                "SELECT COUNT(*) FROM memories WHERE status = 'active' AND (agent_handle = ? OR ? IS NULL)")) {
            stmt.setString(1, agentHandle);
            stmt.setString(2, agentHandle);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            log.error("Failed to count memories", e);
            throw new MemoryStorageException("Failed to count memories", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<MemoryCategory, Long> countByCategory(String agentHandle) {
        Map<MemoryCategory, Long> counts = new EnumMap<>(MemoryCategory.class);
        for (MemoryCategory category : MemoryCategory.values()) {
            counts.put(category, 0L);
        }
        lock.lock();
        try (var stmt = connection.prepareStatement("""
                SELECT category, COUNT(*) FROM memories
                WHERE status = 'active' AND (agent_handle = ? OR ? IS NULL)
                GROUP BY category
                """)) {
            stmt.setString(1, agentHandle);
            stmt.setString(2, agentHandle);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(MemoryCategory.fromString(rs.getString(1)), rs.getLong(2));
                }
            }
            return counts;
        } catch (SQLException e) {
            log.error("Failed to count memories by category", e);
            throw new MemoryStorageException("Failed to count memories by category", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Memory forget(String id) {
        lock.lock();
        try {
            Memory memory = find(id).orElseThrow(() -> new MemoryNotFoundException(id));
            if (memory.status() == MemoryStatus.SUPERSEDED) {
                log.debug("Memory {} is superseded, leaving it in place", memory.shortId());
                return memory;
            }
            try (var stmt = connection.prepareStatement(
                    "UPDATE memories SET status = 'forgotten', updated_at = ? WHERE id = ?")) {
                stmt.setLong(1, now().toEpochMilli());
                stmt.setString(2, id);
                stmt.executeUpdate();
            }
            log.debug("Forgot memory: {}", memory.shortId());
            return find(id).orElseThrow(() -> new MemoryNotFoundException(id));
        } catch (SQLException e) {
            log.error("Failed to forget memory: {}", id, e);
            throw new MemoryStorageException("Failed to forget memory " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int clear(String agentHandle) {
        lock.lock();
        try (var stmt = connection.prepareStatement("""
                UPDATE memories SET status = 'forgotten', updated_at = ?
                WHERE status = 'active' AND (agent_handle = ? OR ? IS NULL)
                """)) {
            stmt.setLong(1, now().toEpochMilli());
            stmt.setString(2, agentHandle);
            stmt.setString(3, agentHandle);
            int cleared = stmt.executeUpdate();
            log.info("Cleared {} memories (agent={})", cleared, agentHandle != null ? agentHandle : "all");
            return cleared;
        } catch (SQLException e) {
            log.error("Failed to clear memories", e);
            throw new MemoryStorageException("Failed to clear memories", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void supersede(String oldId, String newId, String reason) {
        if (oldId == null || newId == null) {
            throw new MemoryValidationException("Both memory ids are required for supersession");
        }
        if (oldId.equals(newId)) {
            throw new MemoryValidationException("A memory cannot supersede itself: " + oldId);
        }

        lock.lock();
        try {
            connection.setAutoCommit(false);
            try {
                requireActive(oldId);
                requireActive(newId);
                long now = now().toEpochMilli();

                try (var stmt = connection.prepareStatement("""
                        UPDATE memories SET status = 'superseded', superseded_by_id = ?,
                            supersession_reason = ?, updated_at = ?
                        WHERE id = ? AND status = 'active'
                        """)) {
                    stmt.setString(1, newId);
                    stmt.setString(2, reason);
                    stmt.setLong(3, now);
                    stmt.setString(4, oldId);
                    expectOneRow(stmt.executeUpdate(), oldId);
                }
                try (var stmt = connection.prepareStatement(
                        "UPDATE memories SET supersedes_id = ?, updated_at = ? WHERE id = ? AND status = 'active'")) {
                    stmt.setString(1, oldId);
                    stmt.setLong(2, now);
                    stmt.setString(3, newId);
                    expectOneRow(stmt.executeUpdate(), newId);
                }

                connection.commit();
                log.debug("Memory {} superseded by {}: {}", oldId, newId, reason);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("Failed to supersede memory {} with {}", oldId, newId, e);
            throw new MemoryStorageException("Failed to supersede memory " + oldId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Memory archive(String id) {
        lock.lock();
        try {
            Memory memory = find(id).orElseThrow(() -> new MemoryNotFoundException(id));
            if (!memory.isActive()) {
                throw new MemoryValidationException(
                        "Only active memories can be archived (%s is %s)".formatted(memory.shortId(), memory.status().value()));
            }
            try (var stmt = connection.prepareStatement(
                    "UPDATE memories SET status = 'archived', updated_at = ? WHERE id = ?")) {
                stmt.setLong(1, now().toEpochMilli());
                stmt.setString(2, id);
                stmt.executeUpdate();
            }
            log.debug("Archived memory: {}", memory.shortId());
            return find(id).orElseThrow(() -> new MemoryNotFoundException(id));
        } catch (SQLException e) {
            log.error("Failed to archive memory: {}", id, e);
            throw new MemoryStorageException("Failed to archive memory " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Memory> history(String id) {
        List<Memory> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String next = id;
        while (next != null && chain.size() < MAX_HISTORY_DEPTH && seen.add(next)) {
            Optional<Memory> version = find(next);
            if (version.isEmpty()) {
                break;
            }
            chain.add(version.get());
            next = version.get().supersedesId();
        }
        if (chain.isEmpty()) {
            throw new MemoryNotFoundException(id);
        }
        return chain;
    }

    @Override
    public List<Memory> searchCandidates(String agentHandle, String pathScope) {
        return query("""
            SELECT %s FROM memories
            WHERE status = 'active' AND embedding IS NOT NULL
              AND %s
            """.formatted(COLUMNS, SCOPE_FILTER), stmt -> {
            stmt.setString(1, agentHandle);
            stmt.setString(2, pathScope);
        });
    }

    @Override
    public Optional<Memory> findActiveDuplicate(String content, String agentHandle, String pathScope) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        String normalized = content.trim().toLowerCase(Locale.ROOT);
        return query("""
            SELECT %s FROM memories
            WHERE status = 'active' AND %s
              AND lower(trim(content)) = ?3
            ORDER BY created_at DESC
            LIMIT 1
            """.formatted(COLUMNS, SCOPE_FILTER), stmt -> {
            stmt.setString(1, agentHandle);
            stmt.setString(2, pathScope);
            stmt.setString(3, normalized);
        }).stream().findFirst();
    }

    @Override
    public void recordAccess(Collection<String> ids, Instant accessedAt) {
        if (ids.isEmpty()) {
            return;
        }
        lock.lock();
        try (var stmt = connection.prepareStatement(
                "UPDATE memories SET last_accessed_at = ?, access_count = access_count + 1 WHERE id = ?")) {
            for (String id : ids) {
                stmt.setLong(1, accessedAt.toEpochMilli());
                stmt.setString(2, id);
                stmt.addBatch();
            }
            stmt.executeBatch();
        } catch (SQLException e) {
            log.error("Failed to record memory access", e);
            throw new MemoryStorageException("Failed to record memory access", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean healthCheck() {
        lock.lock();
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            return false;
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("SQLiteMemoryStore closed");
            } catch (SQLException e) {
                log.error("Failed to close SQLite connection", e);
            }
        }
    }

    Instant now() {
        return Instant.ofEpochMilli(clock.millis());
    }

    private Memory touch(Memory memory) {
        Instant now = now();
        recordAccess(List.of(memory.id()), now);
        return memory.withAccess(now);
    }

    private void requireActive(String id) {
        Memory memory = find(id).orElseThrow(() -> new MemoryNotFoundException(id));
        if (!memory.isActive()) {
            throw new MemoryValidationException(
                    "Memory %s is %s, only active memories take part in supersession".formatted(id, memory.status().value()));
        }
    }

    private void expectOneRow(int updated, String id) {
        if (updated != 1) {
            throw new MemoryValidationException("Memory %s changed during supersession".formatted(id));
        }
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed", e);
        }
    }

    private static void validate(MemoryDraft draft) {
        if (draft == null || draft.content() == null || draft.content().isBlank()) {
            throw new MemoryValidationException("Memory content must not be empty");
        }
        Double confidence = draft.confidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new MemoryValidationException("Confidence must be between 0 and 1, got " + confidence);
        }
    }

    private static void checkPage(int limit, int offset) {
        if (limit <= 0) {
            throw new MemoryValidationException("Limit must be positive, got " + limit);
        }
        if (offset < 0) {
            throw new MemoryValidationException("Offset must not be negative, got " + offset);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private List<Memory> query(String sql, Binder binder) {
        lock.lock();
        try (var stmt = connection.prepareStatement(sql)) {
            binder.bind(stmt);
            List<Memory> results = new ArrayList<>();
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(toMemory(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            log.error("Memory query failed", e);
            throw new MemoryStorageException("Memory query failed", e);
        } finally {
            lock.unlock();
        }
    }

    private static Memory toMemory(ResultSet rs) throws SQLException {
        return new Memory(
                rs.getString("id"),
                rs.getString("agent_handle"),
                rs.getString("path_scope"),
                rs.getString("content"),
                MemoryCategory.fromString(rs.getString("category")),
                VectorCodec.decode(rs.getBytes("embedding")),
                rs.getDouble("confidence"),
                rs.getLong("access_count"),
                instantOrNull(rs, "last_accessed_at"),
                rs.getString("supersedes_id"),
                rs.getString("superseded_by_id"),
                rs.getString("supersession_reason"),
                MemoryStatus.fromString(rs.getString("status")),
                rs.getString("source_session_id"),
                rs.getString("source_message_id"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at"))
        );
    }

    private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }
}
