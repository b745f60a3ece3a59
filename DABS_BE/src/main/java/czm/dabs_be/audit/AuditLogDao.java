package czm.dabs_be.audit;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Append-only access to the <code>activity_log</code> table.
 */
@Repository
public class AuditLogDao {
    private final JdbcTemplate jdbc;

    public AuditLogDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(long userId, long projectId, String action, String details) {
        jdbc.update("INSERT INTO activity_log (user_id, project_id, action, details, timestamp) VALUES (?, ?, ?, ?, NOW())",
                userId, projectId, action, details);
    }
}
