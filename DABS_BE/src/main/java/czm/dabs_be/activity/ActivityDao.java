package czm.dabs_be.activity;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access for activities. Project scoping goes through the owning briefing.
 */
@Repository
public class ActivityDao {
    private final JdbcTemplate jdbc;

    public record ActivityRow(long id,
                              long briefingId,
                              LocalDate date,
                              LocalTime time,
                              String title,
                              String description,
                              String area,
                              String priority,
                              int laborCount,
                              String contractors,
                              String assignedTo,
                              OffsetDateTime createdAt,
                              OffsetDateTime updatedAt) {}

    /**
     * Full column set written by insert and update. {@code contractors} is the serialised id list.
     */
    public record ActivityMutation(long briefingId,
                                   LocalDate date,
                                   LocalTime time,
                                   String title,
                                   String description,
                                   String area,
                                   String priority,
                                   int laborCount,
                                   String contractors,
                                   String assignedTo) {}

    private static final String COLUMNS = """
            a.id, a.briefing_id, a.date, a.time, a.title, a.description, a.area, a.priority,
            a.labor_count, a.contractors, a.assigned_to, a.created_at, a.updated_at
            """;

    private static final String RETURNING = """
            RETURNING id, briefing_id, date, time, title, description, area, priority,
                      labor_count, contractors, assigned_to, created_at, updated_at
            """;

    private static final RowMapper<ActivityRow> ACTIVITY_MAPPER = (rs, rn) -> new ActivityRow(
            rs.getLong("id"),
            rs.getLong("briefing_id"),
            rs.getObject("date", LocalDate.class),
            rs.getObject("time", LocalTime.class),
            rs.getString("title"),
            rs.getString("description"),
            rs.getString("area"),
            rs.getString("priority"),
            rs.getInt("labor_count"),
            rs.getString("contractors"),
            rs.getString("assigned_to"),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class));

    public ActivityDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Day order: area, then priority from critical down to unspecified, then title.
     */
    public List<ActivityRow> listByBriefing(long briefingId) {
        return jdbc.query("SELECT " + COLUMNS + """
                FROM activities a
                WHERE a.briefing_id = ?
                ORDER BY a.area ASC NULLS FIRST,
                         CASE a.priority
                             WHEN 'critical' THEN 4
                             WHEN 'high' THEN 3
                             WHEN 'medium' THEN 2
                             WHEN 'low' THEN 1
                             ELSE 0
                         END DESC,
                         a.title ASC,
                         a.id ASC
                """, ACTIVITY_MAPPER, briefingId);
    }

    public Optional<ActivityRow> findById(long projectId, long activityId) {
        List<ActivityRow> rows = jdbc.query("SELECT " + COLUMNS + """
                FROM activities a
                JOIN briefings b ON b.id = a.briefing_id
                WHERE a.id = ? AND b.project_id = ?
                """, ACTIVITY_MAPPER, activityId, projectId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public ActivityRow insert(ActivityMutation mutation) {
        ActivityRow inserted = jdbc.queryForObject(
                """
                INSERT INTO activities (briefing_id, date, time, title, description, area, priority,
                                        labor_count, contractors, assigned_to, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW())
                """ + RETURNING,
                ACTIVITY_MAPPER,
                mutation.briefingId(),
                mutation.date(),
                mutation.time(),
                mutation.title(),
                mutation.description(),
                mutation.area(),
                mutation.priority(),
                mutation.laborCount(),
                mutation.contractors(),
                mutation.assignedTo());
        if (inserted == null) {
            throw new IllegalStateException("Failed to insert activity");
        }
        return inserted;
    }

    public Optional<ActivityRow> update(long activityId, ActivityMutation mutation) {
        List<ActivityRow> rows = jdbc.query(
                """
                UPDATE activities
                SET briefing_id = ?, date = ?, time = ?, title = ?, description = ?, area = ?, priority = ?,
                    labor_count = ?, contractors = ?, assigned_to = ?, updated_at = NOW()
                WHERE id = ?
                """ + RETURNING,
                ACTIVITY_MAPPER,
                mutation.briefingId(),
                mutation.date(),
                mutation.time(),
                mutation.title(),
                mutation.description(),
                mutation.area(),
                mutation.priority(),
                mutation.laborCount(),
                mutation.contractors(),
                mutation.assignedTo(),
                activityId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int delete(long activityId) {
        return jdbc.update("DELETE FROM activities WHERE id = ?", activityId);
    }

    public int countByBriefing(long briefingId) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM activities WHERE briefing_id = ?",
                Integer.class, briefingId);
        return count != null ? count : 0;
    }
}
