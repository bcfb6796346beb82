package com.williamcallahan.ratchet.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.ratchet.domain.ChannelAttributes;
import com.williamcallahan.ratchet.domain.ChannelRecord;
import com.williamcallahan.ratchet.domain.Incident;
import com.williamcallahan.ratchet.domain.IncidentPriority;
import com.williamcallahan.ratchet.domain.IncidentTag;
import com.williamcallahan.ratchet.domain.MessageAttributes;
import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.domain.StoredMessage;
import com.williamcallahan.ratchet.domain.ThreadMessageRecord;
import com.williamcallahan.ratchet.domain.errors.MessageNotFoundException;
import com.williamcallahan.ratchet.domain.errors.UnknownChannelException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

/**
 * {@link MessageStore} over plain JDBC.
 *
 * <p>Attribute bags are JSON documents; embeddings use the pgvector text form. Duplicate keys are
 * absorbed with {@code ON CONFLICT DO NOTHING} rather than caught, which keeps the surrounding
 * PostgreSQL transaction usable.</p>
 */
public class JdbcMessageStore implements MessageStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcMessageStore.class);

    private static final String NUMERIC_TS = "CAST(ts AS DECIMAL(20,6))";
    private static final String INCIDENT_COLUMNS = "incident_id, channel_id, slack_ts, service, alert, priority, "
            + "start_timestamp, end_timestamp, close_slack_ts, duration_micros";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final SqlDialect dialect;

    public JdbcMessageStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, SqlDialect dialect) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    // ---------------------------------------------------------------- channels

    @Override
    public boolean addChannel(String channelId) {
        String sql = "INSERT INTO channels (id, attrs) VALUES (?, " + dialect.jsonParameter() + ") ON CONFLICT DO NOTHING";
        int inserted = jdbcTemplate.update(sql, channelId, writeJson(ChannelAttributes.empty()));
        if (inserted > 0) {
            log.info("[STORE] Registered channel {}", channelId);
        }
        return inserted > 0;
    }

    @Override
    public Optional<ChannelRecord> findChannel(String channelId) {
        List<ChannelRecord> rows = jdbcTemplate.query(
                "SELECT id, attrs, latest_slack_ts, enabled FROM channels WHERE id = ?", channelMapper(), channelId);
        return rows.stream().findFirst();
    }

    @Override
    public List<ChannelRecord> listChannels() {
        return jdbcTemplate.query("SELECT id, attrs, latest_slack_ts, enabled FROM channels ORDER BY id", channelMapper());
    }

    @Override
    public ChannelAttributes updateChannelAttributes(String channelId, ChannelAttributes patch) {
        List<String> current = jdbcTemplate.query(
                "SELECT attrs FROM channels WHERE id = ? FOR UPDATE", (rs, rowNum) -> rs.getString(1), channelId);
        if (current.isEmpty()) {
            throw new UnknownChannelException(channelId);
        }
        ChannelAttributes merged = readJson(current.get(0), ChannelAttributes.class).merge(patch);
        jdbcTemplate.update(
                "UPDATE channels SET attrs = " + dialect.jsonParameter() + " WHERE id = ?", writeJson(merged), channelId);
        return merged;
    }

    @Override
    public void setChannelEnabled(String channelId, boolean enabled) {
        int updated = jdbcTemplate.update("UPDATE channels SET enabled = ? WHERE id = ?", enabled, channelId);
        if (updated == 0) {
            throw new UnknownChannelException(channelId);
        }
    }

    @Override
    public Optional<SlackTimestamp> lockWatermark(String channelId) {
        List<Optional<SlackTimestamp>> rows = jdbcTemplate.query(
                "SELECT latest_slack_ts FROM channels WHERE id = ? FOR UPDATE",
                (rs, rowNum) -> Optional.ofNullable(rs.getString(1)).map(SlackTimestamp::parse),
                channelId);
        if (rows.isEmpty()) {
            throw new UnknownChannelException(channelId);
        }
        return rows.get(0);
    }

    @Override
    public void writeWatermark(String channelId, SlackTimestamp watermark) {
        int updated = jdbcTemplate.update(
                "UPDATE channels SET latest_slack_ts = ? WHERE id = ?", watermark.value(), channelId);
        if (updated == 0) {
            throw new UnknownChannelException(channelId);
        }
    }

    // ---------------------------------------------------------------- messages

    @Override
    public boolean insertMessage(String channelId, SlackTimestamp ts, MessageAttributesV1 attributes) {
        String sql = "INSERT INTO messages (channel_id, ts, attrs) VALUES (?, ?, " + dialect.jsonParameter()
                + ") ON CONFLICT DO NOTHING";
        try {
            return jdbcTemplate.update(sql, channelId, ts.value(), writeAttributes(attributes)) > 0;
        } catch (DataIntegrityViolationException constraintViolation) {
            throw new UnknownChannelException(channelId, constraintViolation);
        }
    }

    @Override
    public boolean insertThreadMessage(
            String channelId, SlackTimestamp parentTs, SlackTimestamp ts, MessageAttributesV1 attributes) {
        Integer parents = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM messages WHERE channel_id = ? AND ts = ?",
                Integer.class,
                channelId,
                parentTs.value());
        if (parents == null || parents == 0) {
            log.debug("[STORE] Skipping reply {} in {}: parent {} not stored", ts, channelId, parentTs);
            return false;
        }
        String sql = "INSERT INTO thread_messages (channel_id, parent_ts, ts, attrs) VALUES (?, ?, ?, "
                + dialect.jsonParameter() + ") ON CONFLICT DO NOTHING";
        return jdbcTemplate.update(sql, channelId, parentTs.value(), ts.value(), writeAttributes(attributes)) > 0;
    }

    @Override
    public Optional<StoredMessage> findMessage(String channelId, SlackTimestamp ts) {
        List<StoredMessage> rows = jdbcTemplate.query(
                "SELECT channel_id, ts, attrs, embedding FROM messages WHERE channel_id = ? AND ts = ?",
                messageMapper(),
                channelId,
                ts.value());
        return rows.stream().findFirst();
    }

    @Override
    public List<StoredMessage> listMessages(String channelId) {
        return jdbcTemplate.query(
                "SELECT channel_id, ts, attrs, embedding FROM messages WHERE channel_id = ? ORDER BY " + NUMERIC_TS,
                messageMapper(),
                channelId);
    }

    @Override
    public List<ThreadMessageRecord> listThreadMessages(String channelId, SlackTimestamp parentTs) {
        return jdbcTemplate.query(
                "SELECT channel_id, parent_ts, ts, attrs FROM thread_messages WHERE channel_id = ? AND parent_ts = ? "
                        + "ORDER BY " + NUMERIC_TS,
                (rs, rowNum) -> new ThreadMessageRecord(
                        rs.getString("channel_id"),
                        SlackTimestamp.parse(rs.getString("parent_ts")),
                        SlackTimestamp.parse(rs.getString("ts")),
                        readAttributes(rs.getString("attrs"))),
                channelId,
                parentTs.value());
    }

    @Override
    public void updateMessage(String channelId, SlackTimestamp ts, MessageAttributesV1 attributes, float[] embedding) {
        int updated;
        if (embedding == null) {
            updated = jdbcTemplate.update(
                    "UPDATE messages SET attrs = " + dialect.jsonParameter() + " WHERE channel_id = ? AND ts = ?",
                    writeAttributes(attributes),
                    channelId,
                    ts.value());
        } else {
            updated = jdbcTemplate.update(
                    "UPDATE messages SET attrs = " + dialect.jsonParameter() + ", embedding = "
                            + dialect.vectorParameter() + " WHERE channel_id = ? AND ts = ?",
                    writeAttributes(attributes),
                    VectorText.format(embedding),
                    channelId,
                    ts.value());
        }
        if (updated == 0) {
            throw new MessageNotFoundException(channelId, ts.value());
        }
    }

    @Override
    public boolean tagMessage(String channelId, SlackTimestamp ts, IncidentTag tag) {
        Optional<MessageAttributesV1> current = lockMessageAttributes("messages", channelId, ts);
        if (current.isEmpty()) {
            return false;
        }
        writeMessageAttributes("messages", channelId, ts, current.get().withIncident(tag));
        return true;
    }

    @Override
    public boolean applyReaction(String channelId, SlackTimestamp ts, String reaction, int delta) {
        for (String table : List.of("messages", "thread_messages")) {
            Optional<MessageAttributesV1> current = lockMessageAttributes(table, channelId, ts);
            if (current.isPresent()) {
                writeMessageAttributes(table, channelId, ts, current.get().withReactionDelta(reaction, delta));
                return true;
            }
        }
        return false;
    }

    @Override
    public int deleteMessagesBefore(String channelId, SlackTimestamp cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM messages WHERE channel_id = ? AND " + NUMERIC_TS + " < ?",
                channelId,
                cutoff.numericValue());
    }

    private Optional<MessageAttributesV1> lockMessageAttributes(String table, String channelId, SlackTimestamp ts) {
        List<MessageAttributesV1> rows = jdbcTemplate.query(
                "SELECT attrs FROM " + table + " WHERE channel_id = ? AND ts = ? FOR UPDATE",
                (rs, rowNum) -> readAttributes(rs.getString(1)),
                channelId,
                ts.value());
        return rows.stream().findFirst();
    }

    private void writeMessageAttributes(String table, String channelId, SlackTimestamp ts, MessageAttributesV1 attributes) {
        jdbcTemplate.update(
                "UPDATE " + table + " SET attrs = " + dialect.jsonParameter() + " WHERE channel_id = ? AND ts = ?",
                writeAttributes(attributes),
                channelId,
                ts.value());
    }

    // ---------------------------------------------------------------- incidents

    @Override
    public Optional<Long> insertIncident(
            String channelId, SlackTimestamp openTs, String service, String alert, IncidentPriority priority) {
        String sql = "INSERT INTO incidents (channel_id, slack_ts, service, alert, priority, start_timestamp) "
                + "VALUES (?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        int inserted;
        try {
            inserted = jdbcTemplate.update(
                    connection -> {
                        PreparedStatement statement = connection.prepareStatement(sql, new String[] {"incident_id"});
                        statement.setString(1, channelId);
                        statement.setString(2, openTs.value());
                        statement.setString(3, service);
                        statement.setString(4, alert);
                        statement.setString(5, priority == null ? null : priority.name());
                        statement.setObject(6, toOffset(openTs.toInstant()));
                        return statement;
                    },
                    keyHolder);
        } catch (DataIntegrityViolationException constraintViolation) {
            throw new UnknownChannelException(channelId, constraintViolation);
        }
        Number key = keyHolder.getKey();
        if (inserted == 0 || key == null) {
            return Optional.empty();
        }
        return Optional.of(key.longValue());
    }

    @Override
    public Optional<Incident> findIncidentByKey(String channelId, String service, String alert, SlackTimestamp openTs) {
        List<Incident> rows = jdbcTemplate.query(
                "SELECT " + INCIDENT_COLUMNS + " FROM incidents "
                        + "WHERE channel_id = ? AND service = ? AND alert = ? AND slack_ts = ?",
                incidentMapper(),
                channelId,
                service,
                alert,
                openTs.value());
        return rows.stream().findFirst();
    }

    @Override
    public Optional<Incident> findLatestOpenIncidentBefore(String channelId, String service, String alert, Instant before) {
        List<Incident> rows = jdbcTemplate.query(
                "SELECT " + INCIDENT_COLUMNS + " FROM incidents "
                        + "WHERE channel_id = ? AND service = ? AND alert = ? AND end_timestamp IS NULL "
                        + "AND start_timestamp < ? ORDER BY start_timestamp DESC, incident_id DESC LIMIT 1",
                incidentMapper(),
                channelId,
                service,
                alert,
                toOffset(before));
        return rows.stream().findFirst();
    }

    @Override
    public boolean closeIncident(long incidentId, SlackTimestamp closeTs, Instant endTimestamp, Duration duration) {
        long durationMicros = duration.toNanos() / 1_000L;
        return jdbcTemplate.update(
                        "UPDATE incidents SET end_timestamp = ?, close_slack_ts = ?, duration_micros = ? "
                                + "WHERE incident_id = ? AND end_timestamp IS NULL",
                        toOffset(endTimestamp),
                        closeTs.value(),
                        durationMicros,
                        incidentId)
                > 0;
    }

    @Override
    public Optional<Incident> findIncident(long incidentId) {
        List<Incident> rows = jdbcTemplate.query(
                "SELECT " + INCIDENT_COLUMNS + " FROM incidents WHERE incident_id = ?", incidentMapper(), incidentId);
        return rows.stream().findFirst();
    }

    @Override
    public List<Incident> listIncidents(String channelId) {
        return jdbcTemplate.query(
                "SELECT " + INCIDENT_COLUMNS + " FROM incidents WHERE channel_id = ? ORDER BY start_timestamp, incident_id",
                incidentMapper(),
                channelId);
    }

    // ---------------------------------------------------------------- mapping

    private RowMapper<ChannelRecord> channelMapper() {
        return (rs, rowNum) -> new ChannelRecord(
                rs.getString("id"),
                readJson(rs.getString("attrs"), ChannelAttributes.class),
                Optional.ofNullable(rs.getString("latest_slack_ts")).map(SlackTimestamp::parse).orElse(null),
                rs.getBoolean("enabled"));
    }

    private RowMapper<StoredMessage> messageMapper() {
        return (rs, rowNum) -> new StoredMessage(
                rs.getString("channel_id"),
                SlackTimestamp.parse(rs.getString("ts")),
                readAttributes(rs.getString("attrs")),
                VectorText.parse(rs.getString("embedding")));
    }

    private RowMapper<Incident> incidentMapper() {
        return (rs, rowNum) -> {
            String priority = rs.getString("priority");
            String closeTs = rs.getString("close_slack_ts");
            long durationMicros = rs.getLong("duration_micros");
            boolean hasDuration = !rs.wasNull();
            return new Incident(
                    rs.getLong("incident_id"),
                    rs.getString("channel_id"),
                    SlackTimestamp.parse(rs.getString("slack_ts")),
                    rs.getString("service"),
                    rs.getString("alert"),
                    priority == null ? null : IncidentPriority.valueOf(priority),
                    readInstant(rs, "start_timestamp"),
                    readInstant(rs, "end_timestamp"),
                    closeTs == null ? null : SlackTimestamp.parse(closeTs),
                    hasDuration ? Duration.of(durationMicros, ChronoUnit.MICROS) : null);
        };
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private String writeAttributes(MessageAttributesV1 attributes) {
        try {
            return objectMapper.writerFor(MessageAttributes.class).writeValueAsString(attributes);
        } catch (JsonProcessingException serializationFailure) {
            throw new IllegalStateException("Unable to serialize message attributes", serializationFailure);
        }
    }

    private MessageAttributesV1 readAttributes(String json) {
        return readJson(json, MessageAttributes.class).latest();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException serializationFailure) {
            throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), serializationFailure);
        }
    }

    private <T> T readJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json == null || json.isBlank() ? "{}" : json, type);
        } catch (JsonProcessingException parseFailure) {
            throw new IllegalStateException("Stored " + type.getSimpleName() + " is not valid JSON", parseFailure);
        }
    }
}
