package czm.dabs_be.briefing;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class BriefingDao {
    private final JdbcTemplate jdbc;

    public record BriefingRow(long id,
                              long projectId,
                              LocalDate date,
                              BriefingStatus status,
                              Long createdBy,
                              OffsetDateTime lastUpdated) {}

    private static final String COLUMNS = "id, project_id, date, status, created_by, last_updated";

    private static final RowMapper<BriefingRow> BRIEFING_MAPPER = (rs, rn) -> new BriefingRow(
            rs.getLong("id"),
            rs.getLong("project_id"),
            rs.getObject("date", LocalDate.class),
            BriefingStatus.fromValue(rs.getString("status")),
            rs.getObject("created_by", Long.class),
            rs.getObject("last_updated", OffsetDateTime.class));

    public BriefingDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<BriefingRow> findByProjectAndDate(long projectId, LocalDate date) {
        List<BriefingRow> rows = jdbc.query("SELECT " + COLUMNS + " FROM briefings WHERE project_id = ? AND date = ?",
                BRIEFING_MAPPER, projectId, date);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<BriefingRow> findById(long projectId, long briefingId) {
        List<BriefingRow> rows = jdbc.query("SELECT " + COLUMNS + " FROM briefings WHERE project_id = ? AND id = ?",
                BRIEFING_MAPPER, projectId, briefingId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Inserts a draft briefing unless one already exists for the pair. Empty when another writer won.
     */
    public Optional<BriefingRow> insertIfAbsent(long projectId, LocalDate date, long createdBy) {
        List<BriefingRow> rows = jdbc.query(
                """
                INSERT INTO briefings (project_id, date, status, created_by, updated_by, last_updated)
                VALUES (?, ?, 'draft', ?, ?, NOW())
                ON CONFLICT (project_id, date) DO NOTHING
                RETURNING id, project_id, date, status, created_by, last_updated
                """,
                BRIEFING_MAPPER, projectId, date, createdBy, createdBy);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public boolean existsForDate(long projectId, LocalDate date) {
        Boolean exists = jdbc.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM briefings WHERE project_id = ? AND date = ?)",
                Boolean.class, projectId, date);
        return Boolean.TRUE.equals(exists);
    }
}
