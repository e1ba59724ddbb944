package Model;

import org.h2.jdbcx.JdbcConnectionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.Objects;
import java.util.function.Consumer;

public final class FingerprintCorpus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FingerprintCorpus.class);

    private final JdbcConnectionPool pool;

    public FingerprintCorpus(String jdbcUrl, String user, String password) {
        pool = JdbcConnectionPool.create(jdbcUrl, user, password);
        try {
            init();
        } catch (SQLException e) {
            pool.dispose();
            throw new CorpusException("Cannot open H2 at " + jdbcUrl, e);
        }
    }

    private void init() throws SQLException {
        try (Connection conn = pool.getConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS image_fingerprint (
                  seq BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                  chat_id BIGINT NOT NULL,
                  message_id BIGINT NOT NULL,
                  fingerprint BIGINT NOT NULL,
                  chat_title VARCHAR NOT NULL,
                  CONSTRAINT uq_chat_message UNIQUE (chat_id, message_id)
                )
            """);
        }
    }

    /**
     * Stores a fingerprint. A second insert for the same chat and message is ignored.
     *
     * @return {@code true} if a row was written, {@code false} if the key already existed
     */
    public boolean insert(long chatId, long messageId, long fingerprint, String chatTitle) {
        try (Connection conn = pool.getConnection();
             PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO image_fingerprint (chat_id, message_id, fingerprint, chat_title)
                VALUES (?, ?, ?, ?)
             """)) {
            ps.setLong(1, chatId);
            ps.setLong(2, messageId);
            ps.setLong(3, fingerprint);
            ps.setString(4, Objects.requireNonNullElse(chatTitle, "<unknown>"));
            ps.executeUpdate();
            return true;
        } catch (SQLIntegrityConstraintViolationException e) {
            log.debug("message {} already present in chat {}, keeping the existing fingerprint", messageId, chatId);
            return false;
        } catch (SQLException e) {
            throw new CorpusException("insert failed for message " + messageId + " in chat " + chatId, e);
        }
    }

    public void scan(long chatId, Consumer<CorpusEntry> onEntry) {
        try (Connection conn = pool.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT message_id, fingerprint, chat_title, seq FROM image_fingerprint WHERE chat_id=? ORDER BY seq")) {
            ps.setLong(1, chatId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    onEntry.accept(new CorpusEntry(
                            chatId,
                            rs.getLong(1),
                            rs.getLong(2),
                            rs.getString(3),
                            rs.getLong(4)
                    ));
                }
            }
        } catch (SQLException e) {
            throw new CorpusException("scan failed for chat " + chatId, e);
        }
    }

    public long count(long chatId) {
        try (Connection conn = pool.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM image_fingerprint WHERE chat_id=?")) {
            ps.setLong(1, chatId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new CorpusException("count failed for chat " + chatId, e);
        }
    }

    @Override
    public void close() {
        pool.dispose();
    }
}
