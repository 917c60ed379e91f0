package com.programmersdiary.chatscheduler.scheduling;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of scheduled jobs. Every transition is guarded by the job's current status, so the
 * store alone decides which caller wins a transition; callers never lock in process.
 */
@Repository
public class ScheduledJobRepository {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobRepository.class);

    private static final String COLUMNS =
            "id, channel_id, kind, content, run_at, repeat_interval, created_by, status, error, created_at, sent_at";

    private static final RowMapper<ScheduledJob> ROW_MAPPER = (rs, rowNum) -> new ScheduledJob(
            rs.getLong("id"),
            rs.getString("channel_id"),
            rs.getString("kind"),
            rs.getString("content"),
            rs.getLong("run_at"),
            readRepeatInterval(rs.getString("repeat_interval")),
            rs.getString("created_by"),
            JobStatus.fromString(rs.getString("status")),
            rs.getString("error"),
            rs.getLong("created_at"),
            rs.getObject("sent_at", Long.class));

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public ScheduledJobRepository(JdbcTemplate jdbc, TransactionTemplate tx) {
        this.jdbc = jdbc;
        this.tx = tx;
    }

    @PostConstruct
    void init() {
        jdbc.execute("""
                CREATE TABLE IF NOT EXISTS scheduled_messages (
                    id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    channel_id      VARCHAR(255) NOT NULL,
                    kind            VARCHAR(64) DEFAULT 'text' NOT NULL,
                    content         VARCHAR NOT NULL,
                    run_at          BIGINT NOT NULL,
                    repeat_interval VARCHAR(16),
                    created_by      VARCHAR(255),
                    status          VARCHAR(16) DEFAULT 'pending' NOT NULL,
                    error           VARCHAR,
                    created_at      BIGINT NOT NULL,
                    sent_at         BIGINT
                )
                """);
        // tables created before kinds and repeats existed
        jdbc.execute("ALTER TABLE scheduled_messages ADD COLUMN IF NOT EXISTS kind VARCHAR(64) DEFAULT 'text' NOT NULL");
        jdbc.execute("ALTER TABLE scheduled_messages ADD COLUMN IF NOT EXISTS repeat_interval VARCHAR(16)");
        jdbc.execute("""
                CREATE INDEX IF NOT EXISTS idx_scheduled_messages_status_run_at
                    ON scheduled_messages (status, run_at)
                """);
    }

    public long create(String channelId, String kind, String content, long runAt,
                       RepeatInterval repeatInterval, String createdBy, long createdAt) {
        var keyHolder = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement("""
                    INSERT INTO scheduled_messages
                      (channel_id, kind, content, run_at, repeat_interval, created_by, status, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, 'pending', ?)
                    """, new String[]{"id"});
            ps.setString(1, channelId);
            ps.setString(2, kind);
            ps.setString(3, content);
            ps.setLong(4, runAt);
            if (repeatInterval != null) {
                ps.setString(5, repeatInterval.toValue());
            } else {
                ps.setNull(5, Types.VARCHAR);
            }
            if (createdBy != null) {
                ps.setString(6, createdBy);
            } else {
                ps.setNull(6, Types.VARCHAR);
            }
            ps.setLong(7, createdAt);
            return ps;
        }, keyHolder);
        return keyHolder.getKeyAs(Long.class);
    }

    public Optional<ScheduledJob> findById(long id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM scheduled_messages WHERE id = ?", ROW_MAPPER, id)
                .stream()
                .findFirst();
    }

    /**
     * Jobs ordered by run time. Filters are conjunctive; without {@code includeNonPending} only
     * pending jobs are returned.
     */
    public List<ScheduledJob> list(String channelId, String createdBy, boolean includeNonPending, int limit) {
        var where = new ArrayList<String>();
        var params = new ArrayList<Object>();
        if (channelId != null) {
            where.add("channel_id = ?");
            params.add(channelId);
        }
        if (createdBy != null) {
            where.add("created_by = ?");
            params.add(createdBy);
        }
        if (!includeNonPending) {
            where.add("status = 'pending'");
        }
        var whereSql = where.isEmpty() ? "" : "WHERE " + String.join(" AND ", where);
        params.add(limit);
        return jdbc.query("SELECT " + COLUMNS + " FROM scheduled_messages " + whereSql
                + " ORDER BY run_at ASC, id ASC LIMIT ?", ROW_MAPPER, params.toArray());
    }

    /**
     * Moves a pending job to canceled. When {@code requesterId} is given the job must have been
     * created by that requester. Missing, non-pending and foreign jobs all yield {@code false}.
     */
    public boolean cancel(long id, String requesterId) {
        int updated;
        if (requesterId == null) {
            updated = jdbc.update("""
                    UPDATE scheduled_messages SET status = 'canceled'
                    WHERE id = ? AND status = 'pending'
                    """, id);
        } else {
            updated = jdbc.update("""
                    UPDATE scheduled_messages SET status = 'canceled'
                    WHERE id = ? AND status = 'pending' AND created_by = ?
                    """, id, requesterId);
        }
        return updated > 0;
    }

    /**
     * Claims up to {@code limit} due pending jobs by moving them to sending, in one transaction.
     * Candidates are row-locked; a candidate another claimer moved first fails the status guard
     * and is left out, so no id is ever handed to two claimers. A claimed row whose stored repeat
     * interval is not recognised is failed on the spot instead of being returned.
     */
    public List<ScheduledJob> claimDue(long now, int limit) {
        var claimed = tx.execute(status -> {
            var candidates = jdbc.query("""
                    SELECT id, repeat_interval FROM scheduled_messages
                    WHERE status = 'pending' AND run_at <= ?
                    ORDER BY run_at ASC, id ASC
                    LIMIT ?
                    FOR UPDATE
                    """, (rs, rowNum) -> new Candidate(rs.getLong("id"), rs.getString("repeat_interval")), now, limit);
            var result = new ArrayList<ScheduledJob>(candidates.size());
            for (var candidate : candidates) {
                int updated = jdbc.update(
                        "UPDATE scheduled_messages SET status = 'sending' WHERE id = ? AND status = 'pending'",
                        candidate.id());
                if (updated != 1) {
                    continue;
                }
                var repeatError = repeatIntervalError(candidate.repeatInterval());
                if (repeatError != null) {
                    markFailed(candidate.id(), repeatError);
                    log.warn("Job {} failed at claim: {}", candidate.id(), repeatError);
                    continue;
                }
                findById(candidate.id()).ifPresent(result::add);
            }
            return result;
        });
        return claimed != null ? claimed : Collections.emptyList();
    }

    public void markSent(long id, long sentAt) {
        jdbc.update("""
                UPDATE scheduled_messages SET status = 'sent', sent_at = ?
                WHERE id = ? AND status = 'sending'
                """, sentAt, id);
    }

    public void markFailed(long id, String error) {
        jdbc.update("""
                UPDATE scheduled_messages SET status = 'failed', error = ?
                WHERE id = ? AND status = 'sending'
                """, error, id);
    }

    public void rescheduleRepeat(long id, long sentAt, long nextRunAt) {
        jdbc.update("""
                UPDATE scheduled_messages SET status = 'pending', run_at = ?, sent_at = ?, error = NULL
                WHERE id = ? AND status = 'sending'
                """, nextRunAt, sentAt, id);
    }

    /** Unknown stored values read as no interval; {@link #claimDue} fails such rows before they run. */
    private static RepeatInterval readRepeatInterval(String value) {
        return repeatIntervalError(value) == null ? RepeatInterval.fromString(value) : null;
    }

    private static String repeatIntervalError(String value) {
        try {
            RepeatInterval.fromString(value);
            return null;
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
    }

    private record Candidate(long id, String repeatInterval) {
    }
}
