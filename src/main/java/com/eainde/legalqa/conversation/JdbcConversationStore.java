package com.eainde.legalqa.conversation;

import com.eainde.legalqa.exception.ConversationStoreException;
import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.AnswerStatus;
import com.eainde.legalqa.model.ConversationTurn;
import com.eainde.legalqa.model.Session;
import com.eainde.legalqa.model.SourceReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ConversationStore} over two tables ({@code qa_session}, {@code qa_turn}, see
 * {@code schema.sql}). Structured columns are stored as JSON text.
 *
 * <p>Upserts use the H2/ANSI {@code MERGE ... KEY} form. For PostgreSQL use
 * {@code INSERT ... ON CONFLICT (id) DO UPDATE}.</p>
 *
 * <p>Turn numbers are taken as {@code MAX(seq) + 1}; the {@code (session_id, seq)} key rejects a
 * number claimed concurrently and the append is retried with a fresh one.</p>
 */
@Slf4j
public class JdbcConversationStore implements ConversationStore {

    private static final TypeReference<List<SourceReference>> SOURCES = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    static final int MAX_APPEND_ATTEMPTS = 10;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private final RowMapper<Session> sessionMapper = this::mapSession;
    private final RowMapper<ConversationTurn> turnMapper = this::mapTurn;

    public JdbcConversationStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    // =========================================================================
    //  Sessions
    // =========================================================================

    @Override
    public Optional<Session> findSession(String sessionId) {
        try {
            List<Session> rows = jdbcTemplate.query(
                    "SELECT * FROM qa_session WHERE id = ?", sessionMapper, sessionId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new ConversationStoreException("Failed to load session " + sessionId, e);
        }
    }

    @Override
    public Session saveSession(Session session) {
        try {
            jdbcTemplate.update("""
                    MERGE INTO qa_session (id, owner_id, title, created_at, last_activity, active,
                                           active_case, last_query, context_data, total_queries)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    session.id(),
                    session.ownerId(),
                    session.title(),
                    timestamp(session.createdAt()),
                    timestamp(session.lastActivity()),
                    session.active(),
                    toJson(session.activeCase()),
                    session.lastQuery(),
                    toJson(session.contextData()),
                    session.totalQueries());
            return session;
        } catch (DataAccessException e) {
            throw new ConversationStoreException("Failed to save session " + session.id(), e);
        }
    }

    @Override
    public List<Session> listSessions(String ownerId, boolean activeOnly) {
        StringBuilder sql = new StringBuilder("SELECT * FROM qa_session WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (ownerId != null) {
            sql.append(" AND owner_id = ?");
            args.add(ownerId);
        }
        if (activeOnly) {
            sql.append(" AND active = TRUE");
        }
        sql.append(" ORDER BY last_activity DESC");
        try {
            return jdbcTemplate.query(sql.toString(), sessionMapper, args.toArray());
        } catch (DataAccessException e) {
            throw new ConversationStoreException("Failed to list sessions for " + ownerId, e);
        }
    }

    @Override
    public boolean archiveSession(String sessionId) {
        try {
            return jdbcTemplate.update("UPDATE qa_session SET active = FALSE WHERE id = ?", sessionId) > 0;
        } catch (DataAccessException e) {
            throw new ConversationStoreException("Failed to archive session " + sessionId, e);
        }
    }

    // =========================================================================
    //  Turns
    // =========================================================================

    @Override
    public ConversationTurn appendTurn(ConversationTurn turn) {
        for (int attempt = 1; ; attempt++) {
            ConversationTurn stored = turn.withSequence(nextSequence(turn.sessionId()));
            try {
                insertTurn(stored);
                return stored;
            } catch (DuplicateKeyException e) {
                // another writer took this sequence first
                if (attempt >= MAX_APPEND_ATTEMPTS) {
                    throw new ConversationStoreException("Failed to append turn to session " + turn.sessionId()
                            + " after " + attempt + " attempts", e);
                }
                log.debug("Sequence {} of session {} taken, retrying", stored.sequence(), turn.sessionId());
            } catch (DataAccessException e) {
                throw new ConversationStoreException(
                        "Failed to append turn " + stored.sequence() + " to session " + turn.sessionId(), e);
            }
        }
    }

    private int nextSequence(String sessionId) {
        try {
            Integer next = jdbcTemplate.queryForObject(
                    "SELECT COALESCE(MAX(seq), 0) + 1 FROM qa_turn WHERE session_id = ?", Integer.class, sessionId);
            return next == null ? 1 : next;
        } catch (DataAccessException e) {
            throw new ConversationStoreException("Failed to read the next turn number of session " + sessionId, e);
        }
    }

    private void insertTurn(ConversationTurn turn) {
        jdbcTemplate.update("""
                INSERT INTO qa_turn (session_id, seq, query, standalone_query, answer, status,
                                     confidence, case_id, sources, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                turn.sessionId(),
                turn.sequence(),
                turn.query(),
                turn.standaloneQuery(),
                turn.answer(),
                turn.status() == null ? null : turn.status().name(),
                turn.confidence(),
                turn.caseId(),
                toJson(turn.sources()),
                timestamp(turn.createdAt()));
    }

    @Override
    public List<ConversationTurn> recentTurns(String sessionId, int limit) {
        try {
            List<ConversationTurn> newestFirst = jdbcTemplate.query(
                    "SELECT * FROM qa_turn WHERE session_id = ? ORDER BY seq DESC LIMIT ?",
                    turnMapper, sessionId, Math.max(0, limit));
            List<ConversationTurn> ordered = new ArrayList<>(newestFirst);
            Collections.reverse(ordered);
            return ordered;
        } catch (DataAccessException e) {
            throw new ConversationStoreException("Failed to load turns for session " + sessionId, e);
        }
    }

    @Override
    public int countTurns(String sessionId) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM qa_turn WHERE session_id = ?", Integer.class, sessionId);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new ConversationStoreException("Failed to count turns for session " + sessionId, e);
        }
    }

    // =========================================================================
    //  Active case
    // =========================================================================

    @Override
    public void saveActiveCase(String sessionId, ActiveCaseContext activeCase) {
        updateActiveCase(sessionId, toJson(activeCase));
    }

    @Override
    public void clearActiveCase(String sessionId) {
        updateActiveCase(sessionId, null);
    }

    private void updateActiveCase(String sessionId, String json) {
        try {
            int rows = jdbcTemplate.update("UPDATE qa_session SET active_case = ? WHERE id = ?", json, sessionId);
            if (rows == 0) {
                throw new ConversationStoreException("Unknown session " + sessionId);
            }
        } catch (DataAccessException e) {
            throw new ConversationStoreException("Failed to update active case for session " + sessionId, e);
        }
    }

    // =========================================================================
    //  Mapping
    // =========================================================================

    private Session mapSession(ResultSet rs, int rowNum) throws SQLException {
        Map<String, String> contextData = fromJson(rs.getString("context_data"), STRING_MAP);
        return new Session(
                rs.getString("id"),
                rs.getString("owner_id"),
                rs.getString("title"),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("last_activity")),
                rs.getBoolean("active"),
                fromJson(rs.getString("active_case"), ActiveCaseContext.class),
                rs.getString("last_query"),
                contextData,
                rs.getInt("total_queries"));
    }

    private ConversationTurn mapTurn(ResultSet rs, int rowNum) throws SQLException {
        String status = rs.getString("status");
        List<SourceReference> sources = fromJson(rs.getString("sources"), SOURCES);
        return new ConversationTurn(
                rs.getString("session_id"),
                rs.getInt("seq"),
                rs.getString("query"),
                rs.getString("standalone_query"),
                rs.getString("answer"),
                status == null ? null : AnswerStatus.valueOf(status),
                rs.getDouble("confidence"),
                rs.getString("case_id"),
                sources,
                instant(rs.getTimestamp("created_at")));
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ConversationStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ConversationStoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ConversationStoreException("Failed to deserialize " + type.getType(), e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
