package czm.dabs_be.contractor;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC access for the project scoped subcontractor registry.
 *
 * Every query is filtered by project id; a contractor of another project is indistinguishable from
 * a missing one.
 */
@Repository
public class ContractorDao {
    private final JdbcTemplate jdbc;

    public record ContractorRow(long id,
                                long projectId,
                                String name,
                                String trade,
                                String status,
                                String contactName,
                                String phone,
                                String email,
                                String createdBy,
                                OffsetDateTime createdAt,
                                OffsetDateTime updatedAt) {}

    public record ContractorMutation(String name,
                                     String trade,
                                     ContractorStatus status,
                                     String contactName,
                                     String phone,
                                     String email) {}

    private static final String SELECT_COLUMNS = """
            SELECT id, project_id, name, trade, status, contact_name, phone, email,
                   created_by, created_at, updated_at
            FROM contractors
            """;

    private static final RowMapper<ContractorRow> CONTRACTOR_MAPPER = (rs, rn) -> new ContractorRow(
            rs.getLong("id"),
            rs.getLong("project_id"),
            rs.getString("name"),
            rs.getString("trade"),
            rs.getString("status"),
            rs.getString("contact_name"),
            rs.getString("phone"),
            rs.getString("email"),
            rs.getString("created_by"),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class));

    public ContractorDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Lists the registry in status order (Active, Standby, Delayed, Complete, Offsite, anything else),
     * then by name.
     */
    public List<ContractorRow> listByProject(long projectId) {
        return jdbc.query(SELECT_COLUMNS + """
                WHERE project_id = ?
                ORDER BY CASE status
                             WHEN 'Active' THEN 1
                             WHEN 'Standby' THEN 2
                             WHEN 'Delayed' THEN 3
                             WHEN 'Complete' THEN 4
                             WHEN 'Offsite' THEN 5
                             ELSE 6
                         END,
                         name ASC,
                         id ASC
                """, CONTRACTOR_MAPPER, projectId);
    }

    public Optional<ContractorRow> findById(long projectId, long id) {
        List<ContractorRow> rows = jdbc.query(SELECT_COLUMNS + " WHERE project_id = ? AND id = ?",
                CONTRACTOR_MAPPER, projectId, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<ContractorRow> findByNameIgnoreCase(long projectId, String name) {
        List<ContractorRow> rows = jdbc.query(SELECT_COLUMNS + " WHERE project_id = ? AND LOWER(name) = ?",
                CONTRACTOR_MAPPER, projectId, name.toLowerCase(Locale.ROOT));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public ContractorRow insert(long projectId, ContractorMutation mutation, String createdBy) {
        ContractorRow inserted = jdbc.queryForObject(
                """
                INSERT INTO contractors (project_id, name, trade, status, contact_name, phone, email, created_by)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                RETURNING id, project_id, name, trade, status, contact_name, phone, email,
                          created_by, created_at, updated_at
                """,
                CONTRACTOR_MAPPER,
                projectId,
                mutation.name(),
                mutation.trade(),
                mutation.status().label(),
                mutation.contactName(),
                mutation.phone(),
                mutation.email(),
                createdBy);
        if (inserted == null) {
            throw new IllegalStateException("Failed to insert contractor");
        }
        return inserted;
    }

    public Optional<ContractorRow> update(long projectId, long id, ContractorMutation mutation) {
        List<ContractorRow> rows = jdbc.query(
                """
                UPDATE contractors
                SET name = ?, trade = ?, status = ?, contact_name = ?, phone = ?, email = ?, updated_at = NOW()
                WHERE project_id = ? AND id = ?
                RETURNING id, project_id, name, trade, status, contact_name, phone, email,
                          created_by, created_at, updated_at
                """,
                CONTRACTOR_MAPPER,
                mutation.name(),
                mutation.trade(),
                mutation.status().label(),
                mutation.contactName(),
                mutation.phone(),
                mutation.email(),
                projectId,
                id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Removes the contractor row. Activities keep the dangling identifier.
     */
    public int delete(long projectId, long id) {
        return jdbc.update("DELETE FROM contractors WHERE project_id = ? AND id = ?", projectId, id);
    }

    /**
     * Returns the subset of the given ids that exist in the project.
     */
    public Set<Long> findExistingIds(long projectId, Collection<Long> ids) {
        Set<Long> existing = new HashSet<>();
        if (ids == null || ids.isEmpty()) {
            return existing;
        }
        String inClause = ids.stream().map(id -> "?").reduce((a, b) -> a + "," + b).orElse("?");
        List<Object> params = new ArrayList<>();
        params.add(projectId);
        params.addAll(ids);
        jdbc.query("SELECT id FROM contractors WHERE project_id = ? AND id IN (" + inClause + ")",
                rs -> {
                    existing.add(rs.getLong("id"));
                },
                params.toArray());
        return existing;
    }

    /**
     * Number of distinct names among contractors currently marked Active.
     */
    public long countActiveNames(long projectId) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(DISTINCT name) FROM contractors WHERE project_id = ? AND status = 'Active'",
                Long.class, projectId);
        return count != null ? count : 0L;
    }
}
