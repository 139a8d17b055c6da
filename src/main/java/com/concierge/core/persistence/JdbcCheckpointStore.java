package com.concierge.core.persistence;

import com.concierge.core.state.StateSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC-based {@link CheckpointStore} that persists checkpoints to a
 * {@code concierge_checkpoints} table.
 * <p>
 * Each checkpoint is one row keyed by {@code (conversation_id, step_index)},
 * with the state snapshot and metadata stored as JSON. The table is created
 * via {@link #createTables()}.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    private static final String TABLE_NAME = "concierge_checkpoints";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                conversation_id VARCHAR(255) NOT NULL,
                step_index      INTEGER NOT NULL,
                agent_name      VARCHAR(255),
                state           TEXT NOT NULL,
                metadata        TEXT NOT NULL,
                created_at      TIMESTAMP NOT NULL,
                PRIMARY KEY (conversation_id, step_index)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (conversation_id, step_index, agent_name, state, metadata, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_CONVERSATION_SQL = """
            SELECT step_index, agent_name, state, metadata, created_at
            FROM %s
            WHERE conversation_id = ?
            ORDER BY step_index ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_CONVERSATION_IDS_SQL = """
            SELECT DISTINCT conversation_id FROM %s ORDER BY conversation_id
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void append(StateCheckpoint checkpoint) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, checkpoint.conversationId());
            stmt.setInt(2, checkpoint.stepIndex());
            stmt.setString(3, checkpoint.agentName());
            stmt.setString(4, objectMapper.writeValueAsString(checkpoint.state()));
            stmt.setString(5, objectMapper.writeValueAsString(checkpoint.metadata()));
            stmt.setTimestamp(6, Timestamp.from(checkpoint.timestamp()));
            stmt.executeUpdate();
            log.debug("Saved checkpoint {} for conversation '{}'", checkpoint.stepIndex(), checkpoint.conversationId());
        } catch (SQLException | JsonProcessingException e) {
            throw new CheckpointStoreException("Failed to save checkpoint " + checkpoint.stepIndex()
                    + " for conversation '" + checkpoint.conversationId() + "'", e);
        }
    }

    @Override
    public List<StateCheckpoint> list(String conversationId) {
        List<StateCheckpoint> checkpoints = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_CONVERSATION_SQL)) {
            stmt.setString(1, conversationId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(fromResultSet(rs));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new CheckpointStoreException("Failed to list checkpoints for conversation '" + conversationId + "'", e);
        }
        return checkpoints;
    }

    @Override
    public List<String> conversationIds() {
        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CONVERSATION_IDS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to list conversation ids", e);
        }
        return ids;
    }

    private StateCheckpoint fromResultSet(ResultSet rs) throws SQLException, JsonProcessingException {
        StateSnapshot state = objectMapper.readValue(rs.getString("state"), StateSnapshot.class);
        Map<String, Object> metadata = objectMapper.readValue(rs.getString("metadata"), METADATA_TYPE);
        return new StateCheckpoint(
                rs.getInt("step_index"),
                state,
                rs.getString("agent_name"),
                rs.getTimestamp("created_at").toInstant(),
                metadata);
    }
}
