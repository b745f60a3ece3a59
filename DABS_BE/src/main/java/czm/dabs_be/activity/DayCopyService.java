package czm.dabs_be.activity;

import czm.dabs_be.activity.ActivityDao.ActivityMutation;
import czm.dabs_be.activity.ActivityDao.ActivityRow;
import czm.dabs_be.audit.AuditLogService;
import czm.dabs_be.briefing.BriefingDao.BriefingRow;
import czm.dabs_be.briefing.BriefingService;
import czm.dabs_be.web.ApiException;
import czm.dabs_be.web.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Duplicates one day's activity set into another day of the same project.
 *
 * <p>Checks run in a fixed order: the source briefing must exist, the target briefing is then resolved
 * (and created when missing), the target must hold no activities and the source must hold at least one.
 * A rejection after the target briefing was created leaves that empty briefing in place.</p>
 *
 * <p>Copies are inserted one by one and never rolled back. A failed insert is logged and counted; the
 * copies inserted before it stay.</p>
 */
@Service
public class DayCopyService {
    private static final Logger log = LoggerFactory.getLogger(DayCopyService.class);
    private static final DateTimeFormatter UK_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private final ActivityDao activities;
    private final BriefingService briefings;
    private final ActivityInputNormalizer normalizer;
    private final AuditLogService audit;

    public DayCopyService(ActivityDao activities,
                          BriefingService briefings,
                          ActivityInputNormalizer normalizer,
                          AuditLogService audit) {
        this.activities = activities;
        this.briefings = briefings;
        this.normalizer = normalizer;
        this.audit = audit;
    }

    public record CopyResult(LocalDate sourceDate,
                             LocalDate targetDate,
                             long targetBriefingId,
                             int copiedCount,
                             int failedCount) {}

    /**
     * @param rawTarget target day, today when missing or unreadable
     * @param rawSource source day, the day before the target when missing
     */
    public CopyResult copyDay(RequestContext ctx, String rawSource, String rawTarget) {
        LocalDate target = normalizer.date(rawTarget);
        LocalDate source = rawSource == null || rawSource.isBlank()
                ? target.minusDays(1)
                : normalizer.date(rawSource);
        if (source.equals(target)) {
            throw ApiException.validation("Source and target dates must differ.", "copy_same_day");
        }
        log.debug("Copying activities of project {} from {} to {}", ctx.projectId(), source, target);

        BriefingRow sourceBriefing = briefings.findBriefing(ctx, source)
                .orElseThrow(() -> ApiException.noSourceData(
                        "No activities found for " + source.format(UK_DATE) + ".", "source_briefing_missing"));

        BriefingRow targetBriefing = briefings.getOrCreateBriefing(ctx, target);
        int existing = activities.countByBriefing(targetBriefing.id());
        if (existing > 0) {
            throw ApiException.targetNotEmpty(
                    target.format(UK_DATE) + " already has " + existing + " activities. Delete them before copying.",
                    "target_has_activities");
        }

        List<ActivityRow> sourceActivities = activities.listByBriefing(sourceBriefing.id());
        if (sourceActivities.isEmpty()) {
            throw ApiException.nothingToCopy(
                    "No activities to copy from " + source.format(UK_DATE) + ".", "source_empty");
        }

        int copied = 0;
        int failed = 0;
        for (ActivityRow activity : sourceActivities) {
            try {
                activities.insert(copyOf(activity, targetBriefing));
                copied++;
            } catch (DataAccessException ex) {
                failed++;
                log.error("Failed to copy activity {} of project {} from {} to {}",
                        activity.id(), ctx.projectId(), source, target, ex);
            }
        }

        log.info("Copied {} of {} activities of project {} from {} to {}",
                copied, sourceActivities.size(), ctx.projectId(), source, target);
        audit.record(ctx, AuditLogService.COPY_ACTIVITIES,
                "Copied " + copied + " activities from " + source.format(UK_DATE) + " to " + target.format(UK_DATE));
        return new CopyResult(source, target, targetBriefing.id(), copied, failed);
    }

    private static ActivityMutation copyOf(ActivityRow activity, BriefingRow target) {
        // contractor ids are carried verbatim, they were filtered when the source was written
        return new ActivityMutation(
                target.id(),
                target.date(),
                activity.time(),
                activity.title(),
                activity.description(),
                activity.area(),
                activity.priority(),
                activity.laborCount(),
                activity.contractors(),
                activity.assignedTo());
    }
}
