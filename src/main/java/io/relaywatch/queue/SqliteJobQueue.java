package io.relaywatch.queue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.store.Database;
import io.relaywatch.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link JobQueue} over the {@code jobs} table of one queue name.
 *
 * <p>Every state change out of ACTIVE is fenced on {@code lease_token} and
 * {@code lease_epoch}: once a job has been reclaimed and claimed again, the
 * earlier holder can no longer complete or fail it.
 */
public final class SqliteJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(SqliteJobQueue.class);
    private static final String COLUMNS =
            "seq,job_id,queue_name,kind,payload,dedup_key,state,attempt,lease_owner,lease_token,lease_epoch,"
                    + "locked_until_ms,available_at_ms,last_error,created_at_ms,updated_at_ms";

    private final Database database;
    private final String queueName;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public SqliteJobQueue(Database database, String queueName, RetryPolicy retryPolicy) {
        this(database, queueName, retryPolicy, Clock.systemUTC());
    }

    public SqliteJobQueue(Database database, String queueName, RetryPolicy retryPolicy, Clock clock) {
        this.database = database;
        this.queueName = queueName;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    @Override
    public String queueName() {
        return queueName;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    public Optional<Job> add(String kind, ObjectNode payload, String dedupKey) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("job kind must not be blank");
        }
        long nowMs = clock.millis();
        String jobId = UUID.randomUUID().toString();
        String sql = """
                INSERT OR IGNORE INTO jobs(job_id,queue_name,kind,dedup_key,payload,state,attempt,lease_epoch,
                                           available_at_ms,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,0,0,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ps.setString(2, queueName);
            ps.setString(3, kind);
            if (dedupKey == null || dedupKey.isBlank()) {
                ps.setNull(4, Types.VARCHAR);
            } else {
                ps.setString(4, dedupKey);
            }
            ps.setString(5, Jsons.toCompactJson(payload == null ? Jsons.object() : payload));
            ps.setString(6, JobState.WAITING.name());
            ps.setLong(7, nowMs);
            ps.setLong(8, nowMs);
            ps.setLong(9, nowMs);
            if (ps.executeUpdate() == 0) {
                return Optional.empty();
            }
            return readJob(c, jobId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to enqueue job: " + kind, e);
        }
    }

    @Override
    public Optional<Job> claimNext(String owner, Duration lockDuration) {
        long nowMs = clock.millis();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement next = c.prepareStatement(
                    "SELECT job_id FROM jobs WHERE queue_name=? AND state=? AND available_at_ms<=? ORDER BY seq ASC LIMIT 1");
                 PreparedStatement claim = c.prepareStatement(
                         "UPDATE jobs SET state=?,lease_owner=?,lease_token=?,lease_epoch=lease_epoch+1,locked_until_ms=?,updated_at_ms=? "
                                 + "WHERE job_id=? AND state=?")) {
                next.setString(1, queueName);
                next.setString(2, JobState.WAITING.name());
                next.setLong(3, nowMs);
                String jobId;
                try (ResultSet rs = next.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return Optional.empty();
                    }
                    jobId = rs.getString("job_id");
                }
                claim.setString(1, JobState.ACTIVE.name());
                claim.setString(2, owner);
                claim.setString(3, UUID.randomUUID().toString());
                claim.setLong(4, nowMs + lockDuration.toMillis());
                claim.setLong(5, nowMs);
                claim.setString(6, jobId);
                claim.setString(7, JobState.WAITING.name());
                if (claim.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                Optional<Job> claimed = readJob(c, jobId);
                c.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim job from " + queueName, e);
        }
    }

    @Override
    public boolean complete(Job job) {
        long nowMs = clock.millis();
        String sql = """
                UPDATE jobs SET state=?,lease_owner=NULL,lease_token=NULL,locked_until_ms=NULL,last_error=NULL,
                                finished_at_ms=?,updated_at_ms=?
                WHERE job_id=? AND state=? AND lease_token=? AND lease_epoch=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, JobState.COMPLETED.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, job.jobId());
            ps.setString(5, JobState.ACTIVE.name());
            ps.setString(6, job.leaseToken());
            ps.setLong(7, job.leaseEpoch());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete job: " + job.jobId(), e);
        }
    }

    @Override
    public FailureResolution fail(Job job, String error) {
        long nowMs = clock.millis();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement current = c.prepareStatement(
                    "SELECT attempt FROM jobs WHERE job_id=? AND state=? AND lease_token=? AND lease_epoch=?");
                 PreparedStatement retry = c.prepareStatement(
                         "UPDATE jobs SET state=?,attempt=?,lease_owner=NULL,lease_token=NULL,locked_until_ms=NULL,"
                                 + "available_at_ms=?,last_error=?,updated_at_ms=? WHERE job_id=?");
                 PreparedStatement failed = c.prepareStatement(
                         "UPDATE jobs SET state=?,attempt=?,lease_owner=NULL,lease_token=NULL,locked_until_ms=NULL,"
                                 + "last_error=?,finished_at_ms=?,updated_at_ms=? WHERE job_id=?")) {
                current.setString(1, job.jobId());
                current.setString(2, JobState.ACTIVE.name());
                current.setString(3, job.leaseToken());
                current.setLong(4, job.leaseEpoch());
                int attempt;
                try (ResultSet rs = current.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return FailureResolution.staleLease();
                    }
                    attempt = rs.getInt("attempt") + 1;
                }
                FailureResolution resolution;
                if (attempt >= retryPolicy.maxAttempts()) {
                    failed.setString(1, JobState.FAILED.name());
                    failed.setInt(2, attempt);
                    failed.setString(3, error);
                    failed.setLong(4, nowMs);
                    failed.setLong(5, nowMs);
                    failed.setString(6, job.jobId());
                    failed.executeUpdate();
                    resolution = FailureResolution.failed(attempt);
                } else {
                    long nextAttemptAtMs = nowMs + computeBackoffMs(attempt);
                    retry.setString(1, JobState.WAITING.name());
                    retry.setInt(2, attempt);
                    retry.setLong(3, nextAttemptAtMs);
                    retry.setString(4, error);
                    retry.setLong(5, nowMs);
                    retry.setString(6, job.jobId());
                    retry.executeUpdate();
                    resolution = FailureResolution.retryScheduled(attempt, nextAttemptAtMs);
                }
                c.commit();
                return resolution;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record job failure: " + job.jobId(), e);
        }
    }

    @Override
    public boolean extendLock(Job job, Duration lockDuration) {
        long nowMs = clock.millis();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE jobs SET locked_until_ms=?,updated_at_ms=? WHERE job_id=? AND state=? AND lease_token=? AND lease_epoch=?")) {
            ps.setLong(1, nowMs + lockDuration.toMillis());
            ps.setLong(2, nowMs);
            ps.setString(3, job.jobId());
            ps.setString(4, JobState.ACTIVE.name());
            ps.setString(5, job.leaseToken());
            ps.setLong(6, job.leaseEpoch());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to extend job lock: " + job.jobId(), e);
        }
    }

    @Override
    public ReclaimSummary reclaimExpired(long nowMs, int limit) {
        List<ReclaimCandidate> candidates = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT job_id,lease_epoch,stalled_count FROM jobs WHERE queue_name=? AND state=? AND locked_until_ms<=? "
                             + "ORDER BY seq ASC LIMIT ?")) {
            ps.setString(1, queueName);
            ps.setString(2, JobState.ACTIVE.name());
            ps.setLong(3, nowMs);
            ps.setInt(4, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    candidates.add(new ReclaimCandidate(
                            rs.getString("job_id"),
                            rs.getLong("lease_epoch"),
                            rs.getInt("stalled_count")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed reclaim scan of " + queueName, e);
        }

        List<String> redelivered = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        String sql = """
                UPDATE jobs SET state=?,lease_owner=NULL,lease_token=NULL,locked_until_ms=NULL,
                                stalled_count=stalled_count+1,last_error=?,finished_at_ms=?,updated_at_ms=?
                WHERE job_id=? AND state=? AND lease_epoch=? AND locked_until_ms<=?
                """;
        for (ReclaimCandidate candidate : candidates) {
            boolean giveUp = candidate.stalledCount() + 1 > retryPolicy.maxStalledCount();
            try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, giveUp ? JobState.FAILED.name() : JobState.WAITING.name());
                ps.setString(2, giveUp ? "job stalled more than allowable limit" : "lock expired");
                if (giveUp) {
                    ps.setLong(3, nowMs);
                } else {
                    ps.setNull(3, Types.BIGINT);
                }
                ps.setLong(4, nowMs);
                ps.setString(5, candidate.jobId());
                ps.setString(6, JobState.ACTIVE.name());
                ps.setLong(7, candidate.leaseEpoch());
                ps.setLong(8, nowMs);
                if (ps.executeUpdate() == 0) {
                    log.debug("Job {} changed hands before reclaim, skipped", candidate.jobId());
                    continue;
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed reclaim candidate: " + candidate.jobId(), e);
            }
            if (giveUp) {
                failed.add(candidate.jobId());
            } else {
                redelivered.add(candidate.jobId());
            }
        }
        return new ReclaimSummary(redelivered, failed);
    }

    @Override
    public Optional<Job> get(String jobId) {
        try (Connection c = database.openConnection()) {
            return readJob(c, jobId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read job: " + jobId, e);
        }
    }

    @Override
    public List<Job> list(JobState state, int limit) {
        String sql = state == null
                ? "SELECT " + COLUMNS + " FROM jobs WHERE queue_name=? ORDER BY seq ASC LIMIT ?"
                : "SELECT " + COLUMNS + " FROM jobs WHERE queue_name=? AND state=? ORDER BY seq ASC LIMIT ?";
        List<Job> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, queueName);
            if (state != null) {
                ps.setString(i++, state.name());
            }
            ps.setInt(i, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapJob(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list jobs of " + queueName, e);
        }
    }

    @Override
    public Map<JobState, Integer> counts() {
        Map<JobState, Integer> out = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            out.put(state, 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT state, COUNT(*) AS c FROM jobs WHERE queue_name=? GROUP BY state")) {
            ps.setString(1, queueName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(JobState.fromString(rs.getString("state")), rs.getInt("c"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs of " + queueName, e);
        }
    }

    @Override
    public int purgeFinished(long finishedBeforeMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "DELETE FROM jobs WHERE queue_name=? AND state=? AND finished_at_ms<?")) {
            ps.setString(1, queueName);
            ps.setString(2, JobState.COMPLETED.name());
            ps.setLong(3, finishedBeforeMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge completed jobs of " + queueName, e);
        }
    }

    private Optional<Job> readJob(Connection c, String jobId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM jobs WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapJob(rs));
            }
        }
    }

    private Job mapJob(ResultSet rs) throws SQLException {
        long lockedUntil = rs.getLong("locked_until_ms");
        Long lockedUntilMs = rs.wasNull() ? null : lockedUntil;
        return new Job(
                rs.getLong("seq"),
                rs.getString("job_id"),
                rs.getString("queue_name"),
                rs.getString("kind"),
                Jsons.readObject(rs.getString("payload")),
                rs.getString("dedup_key"),
                JobState.fromString(rs.getString("state")),
                rs.getInt("attempt"),
                rs.getString("lease_owner"),
                rs.getString("lease_token"),
                rs.getLong("lease_epoch"),
                lockedUntilMs,
                rs.getLong("available_at_ms"),
                rs.getString("last_error"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private long computeBackoffMs(int attempt) {
        long base = retryPolicy.baseBackoffMs();
        long max = retryPolicy.maxBackoffMs();
        long backoff = base;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= max / 2L) {
                backoff = max;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, max);
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return Math.min(max, backoff + jitter);
    }

    private record ReclaimCandidate(String jobId, long leaseEpoch, int stalledCount) {
    }
}
