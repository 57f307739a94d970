package com.ngramengine.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 分析结果库：单个 SQLite 文件，保存消息表、消息-n-gram 计数表、n-gram 定义表与统计表。
 *
 * 写入按批次在事务中提交，已提交的批次不会因后续失败而损坏。
 */
public final class NgramResultStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(NgramResultStore.class);

    private static final String CREATE_MESSAGES_SQL = """
            CREATE TABLE IF NOT EXISTS message_authors (
                message_surrogate_id INTEGER PRIMARY KEY,
                user_id              TEXT NOT NULL,
                message_id           TEXT,
                message_text         TEXT NOT NULL,
                timestamp            TEXT
            )
            """;
    private static final String CREATE_MESSAGE_NGRAMS_SQL = """
            CREATE TABLE IF NOT EXISTS message_ngrams (
                message_surrogate_id INTEGER NOT NULL,
                ngram_id             INTEGER NOT NULL,
                count                INTEGER NOT NULL,
                PRIMARY KEY (message_surrogate_id, ngram_id)
            )
            """;
    private static final String CREATE_NGRAMS_SQL = """
            CREATE TABLE IF NOT EXISTS ngrams (
                ngram_id INTEGER PRIMARY KEY,
                words    TEXT NOT NULL,
                n        INTEGER NOT NULL
            )
            """;
    private static final String CREATE_STATS_SQL = """
            CREATE TABLE ngram_stats (
                ngram_id         INTEGER PRIMARY KEY,
                n                INTEGER NOT NULL,
                words            TEXT NOT NULL,
                total_reps       INTEGER NOT NULL,
                distinct_posters INTEGER NOT NULL
            )
            """;
    private static final String CREATE_FULL_SQL = """
            CREATE TABLE ngram_full (
                ngram_id             INTEGER NOT NULL,
                n                    INTEGER NOT NULL,
                words                TEXT NOT NULL,
                total_reps           INTEGER NOT NULL,
                distinct_posters     INTEGER NOT NULL,
                user_id              TEXT NOT NULL,
                reps_per_user        INTEGER NOT NULL,
                message_surrogate_id INTEGER NOT NULL,
                message_id           TEXT,
                message_text         TEXT NOT NULL,
                timestamp            TEXT
            )
            """;
    private static final String CREATE_IDX_NGRAM_SQL =
        "CREATE INDEX IF NOT EXISTS idx_message_ngrams_ngram ON message_ngrams(ngram_id)";
    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";
    private static final String STATS_ORDER = "n DESC, total_reps DESC, distinct_posters DESC, ngram_id";

    private final Connection connection;
    private final Path dbPath;

    private NgramResultStore(Path dbPath) {
        this.dbPath = dbPath;
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            try (Statement statement = connection.createStatement()) {
                statement.execute(ENABLE_WAL_SQL);
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("打开结果库失败: " + dbPath, sqlException);
        }
    }

    /**
     * 新建（或清空重建）结果库。
     */
    public static NgramResultStore create(Path dbPath) {
        NgramResultStore store = new NgramResultStore(dbPath);
        try {
            store.executeInTransaction(
                "DROP TABLE IF EXISTS ngram_full",
                "DROP TABLE IF EXISTS ngram_stats",
                "DROP TABLE IF EXISTS message_ngrams",
                "DROP TABLE IF EXISTS ngrams",
                "DROP TABLE IF EXISTS message_authors",
                CREATE_MESSAGES_SQL,
                CREATE_MESSAGE_NGRAMS_SQL,
                CREATE_NGRAMS_SQL,
                CREATE_IDX_NGRAM_SQL);
        } catch (SQLException sqlException) {
            store.close();
            throw new IllegalStateException("初始化结果库失败: " + dbPath, sqlException);
        }
        return store;
    }

    /**
     * 打开已有结果库，文件不存在时抛出异常。
     */
    public static NgramResultStore open(Path dbPath) {
        if (!Files.isRegularFile(dbPath)) {
            throw new IllegalStateException("结果库不存在: " + dbPath);
        }
        NgramResultStore store = new NgramResultStore(dbPath);
        try {
            store.executeInTransaction(CREATE_MESSAGES_SQL, CREATE_MESSAGE_NGRAMS_SQL, CREATE_NGRAMS_SQL,
                CREATE_IDX_NGRAM_SQL);
        } catch (SQLException sqlException) {
            store.close();
            throw new IllegalStateException("校验结果库结构失败: " + dbPath, sqlException);
        }
        return store;
    }

    public Path getDbPath() {
        return dbPath;
    }

    // ==================== message_authors ====================

    /**
     * 批量追加消息。
     */
    public void appendMessages(List<MessageRecord> messages) {
        String sql = """
                INSERT INTO message_authors(message_surrogate_id, user_id, message_id, message_text, timestamp)
                VALUES (?, ?, ?, ?, ?)
                """;
        executeBatch(sql, messages, (statement, message) -> {
            statement.setLong(1, message.surrogateId());
            statement.setString(2, message.userId());
            statement.setString(3, message.messageId());
            statement.setString(4, message.text());
            statement.setString(5, message.timestamp());
        }, "写入消息失败");
    }

    public long countMessages() {
        return queryLong("SELECT COUNT(*) FROM message_authors", "查询消息总数失败");
    }

    /**
     * 按代理编号顺序读取一段消息。
     */
    public List<MessageRecord> readMessages(long offset, int limit) {
        String sql = """
                SELECT message_surrogate_id, user_id, message_id, message_text, timestamp
                FROM message_authors
                ORDER BY message_surrogate_id
                LIMIT ? OFFSET ?
                """;
        List<MessageRecord> messages = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, limit);
            preparedStatement.setLong(2, offset);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    messages.add(new MessageRecord(
                        resultSet.getLong(1),
                        resultSet.getString(2),
                        resultSet.getString(3),
                        resultSet.getString(4),
                        resultSet.getString(5)));
                }
            }
            return messages;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取消息失败, offset=" + offset + ", limit=" + limit, sqlException);
        }
    }

    // ==================== message_ngrams / ngrams ====================

    public void appendMessageNgrams(List<MessageNgramCount> counts) {
        String sql = "INSERT INTO message_ngrams(message_surrogate_id, ngram_id, count) VALUES (?, ?, ?)";
        executeBatch(sql, counts, (statement, count) -> {
            statement.setLong(1, count.surrogateId());
            statement.setInt(2, count.ngramId());
            statement.setInt(3, count.count());
        }, "写入消息 n-gram 计数失败");
    }

    public void appendNgramDefinitions(List<NgramDefinition> definitions) {
        String sql = "INSERT INTO ngrams(ngram_id, words, n) VALUES (?, ?, ?)";
        executeBatch(sql, definitions, (statement, definition) -> {
            statement.setInt(1, definition.ngramId());
            statement.setString(2, definition.words());
            statement.setInt(3, definition.n());
        }, "写入 n-gram 定义失败");
    }

    public long countNgrams() {
        return queryLong("SELECT COUNT(*) FROM ngrams", "查询 n-gram 总数失败");
    }

    public long countMessageNgrams() {
        return queryLong("SELECT COUNT(*) FROM message_ngrams", "查询消息 n-gram 行数失败");
    }

    public Optional<NgramDefinition> findNgram(int ngramId) {
        String sql = "SELECT ngram_id, words, n FROM ngrams WHERE ngram_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, ngramId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(new NgramDefinition(resultSet.getInt(1), resultSet.getString(2), resultSet.getInt(3)));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询 n-gram 失败, ngramId=" + ngramId, sqlException);
        }
    }

    /**
     * 按编号顺序读取全部 n-gram 定义。
     */
    public List<NgramDefinition> readNgramDefinitions() {
        String sql = "SELECT ngram_id, words, n FROM ngrams ORDER BY ngram_id";
        List<NgramDefinition> definitions = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                definitions.add(new NgramDefinition(resultSet.getInt(1), resultSet.getString(2), resultSet.getInt(3)));
            }
            return definitions;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取 n-gram 定义失败", sqlException);
        }
    }

    /**
     * 按 (代理编号, n-gram 编号) 顺序读取全部计数行。
     */
    public List<MessageNgramCount> readMessageNgrams() {
        String sql = """
                SELECT message_surrogate_id, ngram_id, count
                FROM message_ngrams
                ORDER BY message_surrogate_id, ngram_id
                """;
        List<MessageNgramCount> counts = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                counts.add(new MessageNgramCount(resultSet.getLong(1), resultSet.getInt(2), resultSet.getInt(3)));
            }
            return counts;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取消息 n-gram 计数失败", sqlException);
        }
    }

    // ==================== ngram_stats / ngram_full ====================

    /**
     * 重建汇总统计表，返回写入行数。
     */
    public int rebuildStatsSummary() {
        String insertSql = """
                INSERT INTO ngram_stats(ngram_id, n, words, total_reps, distinct_posters)
                SELECT g.ngram_id, g.n, g.words, s.total_reps, s.distinct_posters
                FROM ngrams g
                JOIN (
                    SELECT mn.ngram_id AS ngram_id,
                           SUM(mn.count) AS total_reps,
                           COUNT(DISTINCT ma.user_id) AS distinct_posters
                    FROM message_ngrams mn
                    JOIN message_authors ma ON ma.message_surrogate_id = mn.message_surrogate_id
                    GROUP BY mn.ngram_id
                    HAVING SUM(mn.count) > 1
                ) s ON s.ngram_id = g.ngram_id
                ORDER BY g.n DESC, s.total_reps DESC, s.distinct_posters DESC, g.ngram_id
                """;
        try {
            executeInTransaction("DROP TABLE IF EXISTS ngram_stats", CREATE_STATS_SQL, insertSql);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("生成汇总统计失败: " + dbPath, sqlException);
        }
        int rows = (int) countStats();
        logger.debug("汇总统计已生成: rows={}", rows);
        return rows;
    }

    public long countStats() {
        return queryLong("SELECT COUNT(*) FROM ngram_stats", "查询汇总统计行数失败");
    }

    /**
     * 按 n、总次数、作者数降序读取一段汇总统计。
     */
    public List<NgramStat> readStats(long offset, int limit) {
        String sql = "SELECT ngram_id, n, words, total_reps, distinct_posters FROM ngram_stats ORDER BY "
            + STATS_ORDER + " LIMIT ? OFFSET ?";
        List<NgramStat> stats = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, limit);
            preparedStatement.setLong(2, offset);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    stats.add(new NgramStat(resultSet.getInt(1), resultSet.getInt(2), resultSet.getString(3),
                        resultSet.getLong(4), resultSet.getLong(5)));
                }
            }
            return stats;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取汇总统计失败, offset=" + offset, sqlException);
        }
    }

    /**
     * 清空并重建完整报告表。
     */
    public void resetFullReport() {
        try {
            executeInTransaction("DROP TABLE IF EXISTS ngram_full", CREATE_FULL_SQL);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("重建完整报告表失败: " + dbPath, sqlException);
        }
    }

    /**
     * 为一批 n-gram 追加完整报告行，返回写入行数。
     */
    public int appendFullReportChunk(List<Integer> ngramIds) {
        if (ngramIds.isEmpty()) {
            return 0;
        }
        String placeholders = String.join(", ", Collections.nCopies(ngramIds.size(), "?"));
        String sql = """
                INSERT INTO ngram_full(ngram_id, n, words, total_reps, distinct_posters, user_id, reps_per_user,
                                       message_surrogate_id, message_id, message_text, timestamp)
                SELECT s.ngram_id, s.n, s.words, s.total_reps, s.distinct_posters, ma.user_id,
                       SUM(mn.count) OVER (PARTITION BY mn.ngram_id, ma.user_id) AS reps_per_user,
                       ma.message_surrogate_id, ma.message_id, ma.message_text, ma.timestamp
                FROM ngram_stats s
                JOIN message_ngrams mn ON mn.ngram_id = s.ngram_id
                JOIN message_authors ma ON ma.message_surrogate_id = mn.message_surrogate_id
                WHERE s.ngram_id IN (%s)
                ORDER BY s.n DESC, s.total_reps DESC, s.distinct_posters DESC, reps_per_user DESC,
                         ma.user_id, ma.message_surrogate_id
                """.formatted(placeholders);
        try {
            connection.setAutoCommit(false);
            int inserted;
            try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
                for (int index = 0; index < ngramIds.size(); index++) {
                    preparedStatement.setInt(index + 1, ngramIds.get(index));
                }
                inserted = preparedStatement.executeUpdate();
            }
            connection.commit();
            return inserted;
        } catch (SQLException sqlException) {
            rollbackQuietly();
            throw new IllegalStateException("写入完整报告失败, ngramCount=" + ngramIds.size(), sqlException);
        } finally {
            restoreAutoCommitQuietly();
        }
    }

    public long countFullReport() {
        return queryLong("SELECT COUNT(*) FROM ngram_full", "查询完整报告行数失败");
    }

    /**
     * 读取某个 n-gram 的完整报告行。
     */
    public List<FullReportRow> readFullReport(int ngramId) {
        String sql = """
                SELECT ngram_id, n, words, total_reps, distinct_posters, user_id, reps_per_user,
                       message_surrogate_id, message_id, message_text, timestamp
                FROM ngram_full
                WHERE ngram_id = ?
                ORDER BY rowid
                """;
        List<FullReportRow> rows = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, ngramId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    rows.add(new FullReportRow(
                        resultSet.getInt(1),
                        resultSet.getInt(2),
                        resultSet.getString(3),
                        resultSet.getLong(4),
                        resultSet.getLong(5),
                        resultSet.getString(6),
                        resultSet.getLong(7),
                        resultSet.getLong(8),
                        resultSet.getString(9),
                        resultSet.getString(10),
                        resultSet.getString(11)));
                }
            }
            return rows;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取完整报告失败, ngramId=" + ngramId, sqlException);
        }
    }

    /**
     * 关闭数据库连接。
     */
    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败", sqlException);
        }
    }

    private <T> void executeBatch(String sql, List<T> rows, BatchBinder<T> binder, String errorMessage) {
        if (rows.isEmpty()) {
            return;
        }
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            for (T row : rows) {
                binder.bind(preparedStatement, row);
                preparedStatement.addBatch();
            }
            preparedStatement.executeBatch();
            connection.commit();
        } catch (SQLException sqlException) {
            rollbackQuietly();
            throw new IllegalStateException(errorMessage + ", batchSize=" + rows.size(), sqlException);
        } finally {
            restoreAutoCommitQuietly();
        }
    }

    private void executeInTransaction(String... statements) throws SQLException {
        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
            connection.commit();
        } catch (SQLException sqlException) {
            connection.rollback();
            throw sqlException;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private long queryLong(String sql, String errorMessage) {
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? resultSet.getLong(1) : 0L;
        } catch (SQLException sqlException) {
            throw new IllegalStateException(errorMessage, sqlException);
        }
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException rollbackException) {
            logger.warn("回滚事务失败: {}", dbPath, rollbackException);
        }
    }

    private void restoreAutoCommitQuietly() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException autoCommitException) {
            logger.warn("恢复自动提交失败: {}", dbPath, autoCommitException);
        }
    }

    @FunctionalInterface
    private interface BatchBinder<T> {
        void bind(PreparedStatement preparedStatement, T row) throws SQLException;
    }
}
