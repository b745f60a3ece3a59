package czm.dabs_be.stats;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only queries behind the resource statistics. Every date here is the briefing date, never the
 * copy stored on the activity row.
 */
@Repository
public class ResourceStatsRepository {
    private final JdbcTemplate jdbc;

    public ResourceStatsRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public record StatActivityRow(long activityId,
                                  LocalDate date,
                                  String title,
                                  String area,
                                  int laborCount,
                                  String contractors,
                                  String assignedTo) {}

    public record AreaUsageRow(String area,
                               long activityCount,
                               long totalLabor,
                               long monthsUsed,
                               LocalDate firstUsed,
                               LocalDate lastUsed) {}

    public List<StatActivityRow> listActivities(long projectId, LocalDate from, LocalDate to) {
        return jdbc.query("""
                SELECT a.id, b.date, a.title, a.area, a.labor_count, a.contractors, a.assigned_to
                FROM briefings b
                JOIN activities a ON a.briefing_id = b.id
                WHERE b.project_id = ? AND b.date BETWEEN ? AND ?
                ORDER BY b.date ASC, a.area ASC NULLS FIRST, a.id ASC
                """,
                (rs, rn) -> new StatActivityRow(
                        rs.getLong("id"),
                        rs.getObject("date", LocalDate.class),
                        rs.getString("title"),
                        rs.getString("area"),
                        rs.getInt("labor_count"),
                        rs.getString("contractors"),
                        rs.getString("assigned_to")),
                projectId, from, to);
    }

    /**
     * Dates in the range that have a briefing, with or without activities.
     */
    public List<LocalDate> listBriefingDates(long projectId, LocalDate from, LocalDate to) {
        return jdbc.query("""
                SELECT date FROM briefings
                WHERE project_id = ? AND date BETWEEN ? AND ?
                ORDER BY date ASC
                """,
                (rs, rn) -> rs.getObject("date", LocalDate.class),
                projectId, from, to);
    }

    /**
     * Lifetime usage of every named area of the project, busiest first.
     */
    public List<AreaUsageRow> listAreaUsage(long projectId) {
        return jdbc.query("""
                SELECT a.area,
                       COUNT(a.id) AS activity_count,
                       COALESCE(SUM(a.labor_count), 0) AS total_labor,
                       COUNT(DISTINCT to_char(b.date, 'YYYY-MM')) AS months_used,
                       MIN(b.date) AS first_used,
                       MAX(b.date) AS last_used
                FROM activities a
                JOIN briefings b ON b.id = a.briefing_id
                WHERE b.project_id = ?
                  AND a.area IS NOT NULL AND TRIM(a.area) <> ''
                GROUP BY a.area
                ORDER BY activity_count DESC, a.area ASC
                """,
                (rs, rn) -> new AreaUsageRow(
                        rs.getString("area"),
                        rs.getLong("activity_count"),
                        rs.getLong("total_labor"),
                        rs.getLong("months_used"),
                        rs.getObject("first_used", LocalDate.class),
                        rs.getObject("last_used", LocalDate.class)),
                projectId);
    }
}
