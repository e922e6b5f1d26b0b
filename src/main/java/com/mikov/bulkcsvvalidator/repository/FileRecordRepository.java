package com.mikov.bulkcsvvalidator.repository;

import com.mikov.bulkcsvvalidator.model.JobRecord;
import com.mikov.bulkcsvvalidator.model.JobStats;
import com.mikov.bulkcsvvalidator.model.JobStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Job rows in the {@code files} table. Status updates only match rows in an allowed source
 * state, which keeps terminal states terminal.
 *
 * @author zahari.mikov
 */
@Repository
public class FileRecordRepository {
    private static final RowMapper<JobRecord> RECORD_MAPPER = (rs, rowNum) -> JobRecord.builder()
        .fileId(rs.getString("file_id"))
        .userId(rs.getString("user_id"))
        .userEmail(rs.getString("user_email"))
        .status(JobStatus.valueOf(rs.getString("status")))
        .stats(new JobStats(
            rs.getInt("total_emails"),
            rs.getInt("valid_emails"),
            rs.getInt("invalid_emails"),
            rs.getInt("unverifiable_emails"),
            rs.getInt("processed_emails")))
        .creditsConsumed(rs.getLong("credits_consumed"))
        .errorMessage(rs.getString("error_message"))
        .objectStorageId(rs.getString("object_storage_id"))
        .createdAt(rs.getTimestamp("created_at").toInstant())
        .updatedAt(rs.getTimestamp("updated_at").toInstant())
        .build();

    private final NamedParameterJdbcTemplate jdbc;

    public FileRecordRepository(final NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(final JobRecord record) {
        final var stats = record.getStats() == null ? new JobStats(0) : record.getStats();
        jdbc.update(
            """
                INSERT INTO files (file_id, user_id, user_email, status, total_emails, valid_emails,
                                   invalid_emails, unverifiable_emails, processed_emails, credits_consumed,
                                   error_message, object_storage_id, created_at, updated_at)
                VALUES (:fileId, :userId, :userEmail, :status, :total, :valid, :invalid, :unverifiable,
                        :processed, :credits, :error, :objectStorageId, :createdAt, :createdAt)
                """,
            new MapSqlParameterSource()
                .addValue("fileId", record.getFileId())
                .addValue("userId", record.getUserId())
                .addValue("userEmail", record.getUserEmail())
                .addValue("status", record.getStatus().name())
                .addValue("total", stats.getTotal())
                .addValue("valid", stats.getValid())
                .addValue("invalid", stats.getInvalid())
                .addValue("unverifiable", stats.getUnverifiable())
                .addValue("processed", stats.getProcessed())
                .addValue("credits", record.getCreditsConsumed())
                .addValue("error", record.getErrorMessage())
                .addValue("objectStorageId", record.getObjectStorageId())
                .addValue("createdAt", Timestamp.from(record.getCreatedAt()))
        );
    }

    public Optional<JobRecord> findById(final String fileId) {
        return jdbc.query(
            "SELECT * FROM files WHERE file_id = :fileId",
            new MapSqlParameterSource("fileId", fileId),
            RECORD_MAPPER
        ).stream().findFirst();
    }

    /**
     * @return number of rows moved, 0 when the job is missing or not in {@code from}
     */
    public int updateStatus(final String fileId, final List<JobStatus> from, final JobStatus to) {
        return jdbc.update(
            """
                UPDATE files SET status = :to, updated_at = :now
                WHERE file_id = :fileId AND status IN (:from)
                """,
            transition(fileId, from, to)
        );
    }

    public int complete(final String fileId, final JobStats stats, final long creditsConsumed) {
        return jdbc.update(
            """
                UPDATE files
                SET status = :to, total_emails = :total, valid_emails = :valid, invalid_emails = :invalid,
                    unverifiable_emails = :unverifiable, processed_emails = :processed,
                    credits_consumed = :credits, error_message = NULL, updated_at = :now
                WHERE file_id = :fileId AND status IN (:from)
                """,
            transition(fileId, List.of(JobStatus.VALIDATING), JobStatus.COMPLETED)
                .addValue("total", stats.getTotal())
                .addValue("valid", stats.getValid())
                .addValue("invalid", stats.getInvalid())
                .addValue("unverifiable", stats.getUnverifiable())
                .addValue("processed", stats.getProcessed())
                .addValue("credits", creditsConsumed)
        );
    }

    public int fail(final String fileId, final String errorMessage) {
        return jdbc.update(
            """
                UPDATE files SET status = :to, error_message = :error, updated_at = :now
                WHERE file_id = :fileId AND status IN (:from)
                """,
            transition(fileId, List.of(JobStatus.IN_QUEUE, JobStatus.VALIDATING), JobStatus.ERROR)
                .addValue("error", errorMessage)
        );
    }

    private static MapSqlParameterSource transition(final String fileId, final List<JobStatus> from,
                                                    final JobStatus to) {
        return new MapSqlParameterSource()
            .addValue("fileId", fileId)
            .addValue("to", to.name())
            .addValue("from", from.stream().map(JobStatus::name).collect(Collectors.toList()))
            .addValue("now", Timestamp.from(Instant.now()));
    }
}
