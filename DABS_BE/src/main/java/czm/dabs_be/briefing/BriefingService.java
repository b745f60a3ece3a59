package czm.dabs_be.briefing;

import czm.dabs_be.audit.AuditLogService;
import czm.dabs_be.briefing.BriefingDao.BriefingRow;
import czm.dabs_be.web.ApiException;
import czm.dabs_be.web.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Optional;

/**
 * One briefing per project and calendar date, created on the first write that needs it.
 */
@Service
public class BriefingService {
    private static final Logger log = LoggerFactory.getLogger(BriefingService.class);

    private final BriefingDao dao;
    private final AuditLogService audit;

    public record EnsuredBriefing(BriefingRow briefing, boolean created) {}

    public BriefingService(BriefingDao dao, AuditLogService audit) {
        this.dao = dao;
        this.audit = audit;
    }

    public BriefingRow getOrCreateBriefing(RequestContext ctx, LocalDate date) {
        return ensureBriefing(ctx, date).briefing();
    }

    /**
     * Returns the briefing for the date, inserting a draft when none exists. Concurrent callers race on
     * the (project, date) unique constraint; the loser re-reads the winner's row.
     */
    public EnsuredBriefing ensureBriefing(RequestContext ctx, LocalDate date) {
        if (date == null) {
            throw ApiException.validation("Briefing date is required.", "date_required");
        }
        Optional<BriefingRow> existing = dao.findByProjectAndDate(ctx.projectId(), date);
        if (existing.isPresent()) {
            return new EnsuredBriefing(existing.get(), false);
        }
        Optional<BriefingRow> inserted = dao.insertIfAbsent(ctx.projectId(), date, ctx.actorId());
        if (inserted.isEmpty()) {
            BriefingRow winner = dao.findByProjectAndDate(ctx.projectId(), date)
                    .orElseThrow(() -> new IllegalStateException(
                            "Briefing for project " + ctx.projectId() + " on " + date + " vanished after conflict"));
            log.debug("Briefing for project {} on {} was created concurrently, reusing {}",
                    ctx.projectId(), date, winner.id());
            return new EnsuredBriefing(winner, false);
        }
        BriefingRow created = inserted.get();
        log.info("Created briefing {} for project {} on {}", created.id(), ctx.projectId(), date);
        audit.record(ctx, AuditLogService.CREATE_BRIEFING, "Created new briefing for date: " + date);
        return new EnsuredBriefing(created, true);
    }

    /**
     * Read-only probe, never creates.
     */
    public Optional<BriefingRow> findBriefing(RequestContext ctx, LocalDate date) {
        if (date == null) {
            return Optional.empty();
        }
        return dao.findByProjectAndDate(ctx.projectId(), date);
    }

    public BriefingRow requireBriefing(RequestContext ctx, long briefingId) {
        return dao.findById(ctx.projectId(), briefingId)
                .orElseThrow(() -> ApiException.validation(
                        "Briefing does not belong to this project.", "briefing_not_in_project"));
    }

    public BriefingRow getBriefing(RequestContext ctx, LocalDate date) {
        return findBriefing(ctx, date)
                .orElseThrow(() -> ApiException.notFound("No briefing exists for " + date + ".", "briefing"));
    }

    public boolean briefingExists(RequestContext ctx, LocalDate date) {
        return dao.existsForDate(ctx.projectId(), date);
    }
}
