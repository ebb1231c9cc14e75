/*
 * Where: jobs data access
 * What: insert, atomic claim, completion and rescheduling of rows in the jobs table
 * Why: the claim statement is the only thing that keeps two workers, in this process or another, off the same job
 */
package com.example.jobs.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.jobs.model.JobKind;
import com.example.jobs.model.JobRecord;
import com.example.jobs.model.JobStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobRepository {

  private static final String COLUMNS =
      """
      job_id, job, type, resource, resource_id, payload_json::text AS payload_json_text, status,
      scheduled_at, attempts_left, locked_by, locked_at, lease_until, last_error, created_at
      """;

  // RETURNING does not preserve the CTE order
  private static final Comparator<JobRecord> DUE_ORDER =
      Comparator.comparing(
              (JobRecord record) ->
                  record.scheduledAt() != null ? record.scheduledAt() : record.createdAt())
          .thenComparing(JobRecord::createdAt);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(JobRecord record) {
    final String sql =
        """
        INSERT INTO jobs (
          job_id,
          job,
          type,
          resource,
          resource_id,
          payload_json,
          status,
          scheduled_at,
          attempts_left,
          locked_by,
          locked_at,
          lease_until,
          last_error,
          created_at
        ) VALUES (
          :jobId,
          :job,
          :type,
          :resource,
          :resourceId,
          :payloadJson::jsonb,
          :status,
          :scheduledAt,
          :attemptsLeft,
          :lockedBy,
          :lockedAt,
          :leaseUntil,
          :lastError,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", record.jobId())
            .addValue("job", record.kind().columnValue())
            .addValue("type", record.type())
            .addValue("resource", record.resource())
            .addValue("resourceId", record.resourceId())
            .addValue("payloadJson", record.payloadJson())
            .addValue("status", record.status().name())
            .addValue("scheduledAt", toTimestamp(record.scheduledAt()))
            .addValue("attemptsLeft", record.attemptsLeft())
            .addValue("lockedBy", record.lockedBy())
            .addValue("lockedAt", toTimestamp(record.lockedAt()))
            .addValue("leaseUntil", toTimestamp(record.leaseUntil()))
            .addValue("lastError", record.lastError())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.jobId();
  }

  /**
   * Claims up to {@code limit} due jobs for {@code lockedBy}.
   *
   * <p>Due means PENDING with no schedule or a schedule that has passed, or PROCESSING with an
   * expired lease (the previous owner died or hung mid-job). Reclaiming an expired lease consumes
   * one attempt; a row whose lease expired on its last attempt is left to {@link
   * #failExpiredLeases}. FAILED rows and rows without attempts left are never returned. Rows locked by a concurrent claim are skipped rather than waited for, so two
   * callers never receive the same row.
   */
  public List<JobRecord> claimDue(int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM jobs
          WHERE attempts_left > 0
            AND (
              (
                status = 'PENDING'
                AND (scheduled_at IS NULL OR scheduled_at <= :now)
              )
              OR (
                status = 'PROCESSING'
                AND attempts_left > 1
                AND (lease_until IS NULL OR lease_until <= :now)
              )
            )
          ORDER BY COALESCE(scheduled_at, created_at), created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE jobs j
        SET status = 'PROCESSING',
            attempts_left = CASE
              WHEN j.status = 'PROCESSING' THEN j.attempts_left - 1
              ELSE j.attempts_left
            END,
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE j.job_id = cte.job_id
        RETURNING j.job_id, j.job, j.type, j.resource, j.resource_id,
                  j.payload_json::text AS payload_json_text, j.status,
                  j.scheduled_at, j.attempts_left, j.locked_by, j.locked_at, j.lease_until,
                  j.last_error, j.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    final List<JobRecord> claimed = new ArrayList<>(jdbcTemplate.query(sql, params, this::mapRow));
    claimed.sort(DUE_ORDER);
    return claimed;
  }

  /**
   * Marks as FAILED every claimed row whose lease expired while it was on its last attempt.
   *
   * @return number of rows marked FAILED
   */
  public int failExpiredLeases(Instant now, String lastError) {
    final String sql =
        """
        UPDATE jobs
        SET status = 'FAILED',
            attempts_left = 0,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE status = 'PROCESSING'
          AND attempts_left <= 1
          AND (lease_until IS NULL OR lease_until <= :now)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("lastError", lastError);
    return jdbcTemplate.update(sql, params);
  }

  public int complete(UUID jobId, String lockedBy) {
    final String sql =
        """
        DELETE FROM jobs
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int reschedule(
      UUID jobId, Instant scheduledAt, int attemptsLeft, String lastError, String lockedBy) {
    final String sql =
        """
        UPDATE jobs
        SET status = 'PENDING',
            scheduled_at = :scheduledAt,
            attempts_left = :attemptsLeft,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduledAt", toTimestamp(scheduledAt))
            .addValue("attemptsLeft", attemptsLeft)
            .addValue("lastError", lastError)
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** Puts a claimed job back with a new schedule without consuming an attempt. */
  public int reanchor(UUID jobId, Instant scheduledAt, String lockedBy) {
    final String sql =
        """
        UPDATE jobs
        SET status = 'PENDING',
            scheduled_at = :scheduledAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduledAt", toTimestamp(scheduledAt))
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID jobId, String lastError, String lockedBy) {
    final String sql =
        """
        UPDATE jobs
        SET status = 'FAILED',
            attempts_left = 0,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lastError", lastError)
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public Map<JobStatus, Integer> countByStatus() {
    final String sql =
        """
        SELECT status, COUNT(*) AS job_count
        FROM jobs
        GROUP BY status
        """;
    final Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      counts.put(status, 0);
    }
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(JobStatus.valueOf(rs.getString("status")), rs.getInt("job_count"));
        });
    return counts;
  }

  public List<JobRecord> findAll() {
    final String sql = "SELECT " + COLUMNS + " FROM jobs ORDER BY created_at, job_id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public int deleteFailedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM jobs
        WHERE created_at < :threshold
          AND status = 'FAILED'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM jobs
        WHERE created_at < :threshold
          AND status IN ('PENDING', 'PROCESSING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String resourceId = rs.getString("resource_id");
    return new JobRecord(
        UUID.fromString(rs.getString("job_id")),
        JobKind.fromColumnValue(rs.getString("job")),
        rs.getString("type"),
        rs.getString("resource"),
        resourceId == null ? null : UUID.fromString(resourceId),
        rs.getString("payload_json_text"),
        JobStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("scheduled_at")),
        rs.getInt("attempts_left"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
