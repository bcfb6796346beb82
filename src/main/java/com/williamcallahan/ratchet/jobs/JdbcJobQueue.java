package com.williamcallahan.ratchet.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.ratchet.store.SqlDialect;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
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
 * {@link JobQueue} backed by the {@code jobs} table.
 *
 * <p>{@code unique_key} carries a live UNIQUE constraint while a job waits to run; {@code unique_spec}
 * remembers the requested key so a failed attempt can take it back. When a successor already holds
 * the key the failed attempt is discarded as superseded.</p>
 */
public class JdbcJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobQueue.class);

    /** Attempts before a job is discarded. */
    public static final int DEFAULT_MAX_ATTEMPTS = 25;

    private static final int MAX_ERROR_LENGTH = 2_000;
    private static final String RUNNABLE_STATES = "('available', 'scheduled', 'retryable')";
    private static final String COLUMNS = "id, kind, args, state, priority, attempt, max_attempts, scheduled_at, "
            + "attempted_at, unique_spec, last_error";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final SqlDialect dialect;
    private final Clock clock;
    private final int maxAttempts;

    public JdbcJobQueue(
            JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, SqlDialect dialect, Clock clock, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxAttempts = maxAttempts;
    }

    @Override
    public Optional<Long> enqueue(JobArgs args, InsertOptions options) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(options, "options");
        Instant now = clock.instant();
        Instant runAt = options.scheduledAt() == null ? now : options.scheduledAt();
        JobState state = runAt.isAfter(now) ? JobState.SCHEDULED : JobState.AVAILABLE;
        String uniqueKey = options.uniqueKey() == null ? null : args.kind() + ":" + options.uniqueKey();
        String payload = writeArgs(args);

        String sql = "INSERT INTO jobs (kind, args, state, priority, max_attempts, scheduled_at, unique_spec, unique_key) "
                + "VALUES (?, " + dialect.jsonParameter() + ", ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        int inserted = jdbcTemplate.update(
                connection -> {
                    PreparedStatement statement = connection.prepareStatement(sql, new String[] {"id"});
                    statement.setString(1, args.kind());
                    statement.setString(2, payload);
                    statement.setString(3, state.column());
                    statement.setInt(4, options.priority());
                    statement.setInt(5, maxAttempts);
                    statement.setObject(6, toOffset(runAt));
                    setNullableString(statement, 7, uniqueKey);
                    setNullableString(statement, 8, uniqueKey);
                    return statement;
                },
                keyHolder);
        Number key = keyHolder.getKey();
        if (inserted == 0 || key == null) {
            log.debug("[JOBS] Dropped duplicate {} job for key {}", args.kind(), uniqueKey);
            return Optional.empty();
        }
        return Optional.of(key.longValue());
    }

    @Override
    public List<JobRow> claim(String kind, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        OffsetDateTime now = toOffset(clock.instant());
        List<Long> candidates = jdbcTemplate.queryForList(
                "SELECT id FROM jobs WHERE kind = ? AND state IN " + RUNNABLE_STATES + " AND scheduled_at <= ? "
                        + "ORDER BY priority, scheduled_at, id LIMIT ?",
                Long.class,
                kind,
                now,
                limit);
        List<JobRow> claimed = new ArrayList<>(candidates.size());
        for (Long candidate : candidates) {
            int updated = jdbcTemplate.update(
                    "UPDATE jobs SET state = 'running', attempt = attempt + 1, attempted_at = ?, unique_key = NULL "
                            + "WHERE id = ? AND state IN " + RUNNABLE_STATES,
                    now,
                    candidate);
            if (updated == 1) {
                find(candidate).ifPresent(claimed::add);
            }
        }
        return claimed;
    }

    @Override
    public void complete(JobRow job) {
        jdbcTemplate.update(
                "UPDATE jobs SET state = 'completed', finalized_at = ?, unique_key = NULL WHERE id = ?",
                toOffset(clock.instant()),
                job.id());
    }

    @Override
    public JobState fail(JobRow job, Duration retryDelay, String error) {
        if (job.attemptsExhausted()) {
            log.warn("[JOBS] Discarding {} job {} after {} attempts: {}", job.kind(), job.id(), job.attempt(), error);
            discard(job, error);
            return JobState.DISCARDED;
        }
        Instant retryAt = clock.instant().plus(retryDelay == null ? Duration.ZERO : retryDelay);
        int updated;
        try {
            updated = jdbcTemplate.update(
                    "UPDATE jobs SET state = 'retryable', scheduled_at = ?, last_error = ?, unique_key = ? "
                            + "WHERE id = ? AND state = 'running' "
                            + "AND NOT EXISTS (SELECT 1 FROM jobs holder WHERE holder.unique_key = ?)",
                    toOffset(retryAt),
                    truncate(error),
                    job.uniqueSpec(),
                    job.id(),
                    job.uniqueSpec());
        } catch (DataIntegrityViolationException keyTaken) {
            updated = 0;
        }
        if (updated == 1) {
            return JobState.RETRYABLE;
        }
        if (job.uniqueSpec() != null) {
            log.info("[JOBS] {} job {} superseded by a newer job holding {}", job.kind(), job.id(), job.uniqueSpec());
            discard(job, "superseded: " + truncate(error));
            return JobState.DISCARDED;
        }
        return find(job.id()).map(JobRow::state).orElse(JobState.DISCARDED);
    }

    @Override
    public void discard(JobRow job, String error) {
        jdbcTemplate.update(
                "UPDATE jobs SET state = 'discarded', finalized_at = ?, last_error = ?, unique_key = NULL WHERE id = ?",
                toOffset(clock.instant()),
                truncate(error),
                job.id());
    }

    @Override
    public int rescueStuck(Duration runningFor) {
        OffsetDateTime cutoff = toOffset(clock.instant().minus(runningFor));
        List<JobRow> stuck = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM jobs WHERE state = 'running' AND attempted_at < ?", jobMapper(), cutoff);
        for (JobRow job : stuck) {
            JobState outcome = fail(job, Duration.ZERO, "rescued after running longer than " + runningFor);
            log.warn("[JOBS] Rescued stuck {} job {} -> {}", job.kind(), job.id(), outcome.column());
        }
        return stuck.size();
    }

    @Override
    public int deleteFinalizedBefore(Instant cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM jobs WHERE state IN ('completed', 'discarded') AND finalized_at < ?", toOffset(cutoff));
    }

    @Override
    public Optional<JobRow> find(long jobId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM jobs WHERE id = ?", jobMapper(), jobId).stream()
                .findFirst();
    }

    @Override
    public List<JobRow> listByKind(String kind) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM jobs WHERE kind = ? ORDER BY id", jobMapper(), kind);
    }

    @Override
    public <A extends JobArgs> A decodeArgs(JobRow job, Class<A> argsType) {
        try {
            return objectMapper.readValue(job.argsJson(), argsType);
        } catch (JsonProcessingException parseFailure) {
            throw new IllegalArgumentException(
                    "Job " + job.id() + " args are not a valid " + argsType.getSimpleName(), parseFailure);
        }
    }

    private String writeArgs(JobArgs args) {
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException serializationFailure) {
            throw new IllegalArgumentException("Unable to serialize " + args.kind() + " job args", serializationFailure);
        }
    }

    private RowMapper<JobRow> jobMapper() {
        return (rs, rowNum) -> new JobRow(
                rs.getLong("id"),
                rs.getString("kind"),
                rs.getString("args"),
                JobState.fromColumn(rs.getString("state")),
                rs.getInt("priority"),
                rs.getInt("attempt"),
                rs.getInt("max_attempts"),
                readInstant(rs, "scheduled_at"),
                readInstant(rs, "attempted_at"),
                rs.getString("unique_spec"),
                rs.getString("last_error"));
    }

    private static void setNullableString(PreparedStatement statement, int index, String value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.VARCHAR);
        } else {
            statement.setString(index, value);
        }
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
