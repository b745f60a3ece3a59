package czm.dabs_be.activity;

import czm.dabs_be.activity.ActivityDao.ActivityMutation;
import czm.dabs_be.activity.ActivityDao.ActivityRow;
import czm.dabs_be.audit.AuditLogService;
import czm.dabs_be.briefing.BriefingDao.BriefingRow;
import czm.dabs_be.briefing.BriefingService;
import czm.dabs_be.contractor.ContractorDescriptor;
import czm.dabs_be.contractor.ContractorLookup;
import czm.dabs_be.contractor.ContractorResolver;
import czm.dabs_be.contractor.ContractorService;
import czm.dabs_be.web.ApiException;
import czm.dabs_be.web.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Commands and queries over the activities of a project's briefings.
 */
@Service
public class ActivityService {
    private static final Logger log = LoggerFactory.getLogger(ActivityService.class);

    static final String UNSPECIFIED_AREA = "Unspecified";
    private static final int MAX_TITLE_LENGTH = 255;
    private static final int MAX_AREA_LENGTH = 255;
    private static final int MAX_ASSIGNED_TO_LENGTH = 100;

    private final ActivityDao dao;
    private final BriefingService briefings;
    private final ContractorService contractors;
    private final ContractorResolver resolver;
    private final ContractorIdCodec codec;
    private final ActivityInputNormalizer normalizer;
    private final AuditLogService audit;
    private final TransactionTemplate txTemplate;

    public ActivityService(ActivityDao dao,
                           BriefingService briefings,
                           ContractorService contractors,
                           ContractorResolver resolver,
                           ContractorIdCodec codec,
                           ActivityInputNormalizer normalizer,
                           AuditLogService audit,
                           PlatformTransactionManager transactionManager) {
        this.dao = dao;
        this.briefings = briefings;
        this.contractors = contractors;
        this.resolver = resolver;
        this.codec = codec;
        this.normalizer = normalizer;
        this.audit = audit;
        this.txTemplate = new TransactionTemplate(transactionManager);
    }

    public record DaySchedule(LocalDate date,
                              Long briefingId,
                              List<ActivityResponse> activities,
                              Map<String, List<ActivityResponse>> activitiesByArea,
                              int totalLabor,
                              int uniqueContractors,
                              boolean previousDayHasBriefing) {}

    public record DeletedActivity(boolean deleted, ActivityResponse prior) {}

    /**
     * Activities of the day in display order, grouped by area as well. Reading a day never creates
     * its briefing.
     */
    public DaySchedule listDay(RequestContext ctx, String rawDate) {
        LocalDate date = normalizer.date(rawDate);
        boolean previousDayHasBriefing = briefings.briefingExists(ctx, date.minusDays(1));
        Optional<BriefingRow> briefing = briefings.findBriefing(ctx, date);
        if (briefing.isEmpty()) {
            return new DaySchedule(date, null, List.of(), Map.of(), 0, 0, previousDayHasBriefing);
        }
        List<ActivityResponse> activities = listActivities(ctx, briefing.get());
        Map<String, List<ActivityResponse>> byArea = new LinkedHashMap<>();
        int totalLabor = 0;
        Set<String> contractorNames = new LinkedHashSet<>();
        for (ActivityResponse activity : activities) {
            String area = activity.area() == null || activity.area().isBlank() ? UNSPECIFIED_AREA : activity.area();
            byArea.computeIfAbsent(area, key -> new ArrayList<>()).add(activity);
            totalLabor += activity.laborCount();
            for (ContractorDescriptor contractor : activity.contractors()) {
                contractorNames.add(contractor.name());
            }
        }
        return new DaySchedule(date, briefing.get().id(), activities, byArea, totalLabor, contractorNames.size(),
                previousDayHasBriefing);
    }

    /**
     * Lists one briefing's activities; the contractor lookup is built once for the whole list.
     */
    public List<ActivityResponse> listActivities(RequestContext ctx, BriefingRow briefing) {
        if (briefing.projectId() != ctx.projectId()) {
            throw ApiException.notFound("Briefing was not found.", "briefing");
        }
        List<ActivityRow> rows = dao.listByBriefing(briefing.id());
        if (rows.isEmpty()) {
            return List.of();
        }
        ContractorLookup lookup = resolver.lookupFor(ctx.projectId());
        return rows.stream().map(row -> toResponse(row, lookup)).toList();
    }

    public ActivityResponse get(RequestContext ctx, long activityId) {
        ActivityRow row = requireActivity(ctx, activityId);
        return toResponse(row, resolver.lookupFor(ctx.projectId()));
    }

    /**
     * Adds an activity to the given briefing, or to the briefing of the given date when no briefing id
     * is sent.
     */
    public ActivityResponse add(RequestContext ctx, ActivityRequest request) {
        if (request == null) {
            throw ApiException.validation("Request body is required.", "request_required");
        }
        validateFields(request);
        BriefingRow briefing = request.briefingId() != null
                ? briefings.requireBriefing(ctx, request.briefingId())
                : briefings.getOrCreateBriefing(ctx, normalizer.date(request.date()));
        ActivityRow inserted = dao.insert(toMutation(ctx, briefing, request));
        log.info("Activity {} added to briefing {} of project {}", inserted.id(), briefing.id(), ctx.projectId());
        audit.record(ctx, AuditLogService.ADD_ACTIVITY,
                "Added activity: " + inserted.title() + " for date: " + inserted.date());
        return toResponse(inserted, resolver.lookupFor(ctx.projectId()));
    }

    /**
     * Replaces every field of the activity. The briefing may change to another one of the project; the
     * activity date always follows its briefing.
     */
    public ActivityResponse update(RequestContext ctx, long activityId, ActivityRequest request) {
        if (request == null) {
            throw ApiException.validation("Request body is required.", "request_required");
        }
        ActivityRow existing = requireActivity(ctx, activityId);
        validateFields(request);
        BriefingRow briefing;
        if (request.briefingId() != null) {
            briefing = briefings.requireBriefing(ctx, request.briefingId());
        } else if (request.date() != null && !request.date().isBlank()) {
            briefing = briefings.getOrCreateBriefing(ctx, normalizer.date(request.date()));
        } else {
            briefing = briefings.requireBriefing(ctx, existing.briefingId());
        }
        ActivityRow updated = dao.update(activityId, toMutation(ctx, briefing, request))
                .orElseThrow(() -> ApiException.notFound("Activity was not found.", "activity"));
        audit.record(ctx, AuditLogService.UPDATE_ACTIVITY,
                "Updated activity ID: " + activityId + " - " + updated.title());
        return toResponse(updated, resolver.lookupFor(ctx.projectId()));
    }

    public DeletedActivity delete(RequestContext ctx, long activityId) {
        ActivityRow prior = txTemplate.execute(status -> {
            ActivityRow row = requireActivity(ctx, activityId);
            if (dao.delete(activityId) == 0) {
                throw ApiException.notFound("Activity was not found.", "activity");
            }
            return row;
        });
        if (prior == null) {
            throw new IllegalStateException("Delete of activity " + activityId + " returned no snapshot");
        }
        log.info("Activity {} deleted from briefing {} of project {}", activityId, prior.briefingId(), ctx.projectId());
        audit.record(ctx, AuditLogService.DELETE_ACTIVITY,
                "Deleted activity ID: " + activityId + " - " + prior.title());
        return new DeletedActivity(true, toResponse(prior, resolver.lookupFor(ctx.projectId())));
    }

    ActivityResponse toResponse(ActivityRow row, ContractorLookup lookup) {
        List<Long> ids = codec.decode(row.contractors());
        return new ActivityResponse(
                row.id(),
                row.briefingId(),
                row.date(),
                row.time(),
                row.title(),
                row.description(),
                row.area(),
                row.priority(),
                row.laborCount(),
                ids,
                resolver.resolve(ids, lookup),
                row.assignedTo(),
                row.createdAt(),
                row.updatedAt());
    }

    private ActivityRow requireActivity(RequestContext ctx, long activityId) {
        return dao.findById(ctx.projectId(), activityId)
                .orElseThrow(() -> ApiException.notFound("Activity was not found.", "activity"));
    }

    private void validateFields(ActivityRequest request) {
        String title = normalizer.text(request.title());
        if (title == null) {
            throw ApiException.validation("Activity title is required.", "title_required");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw ApiException.validation("Activity title may have at most " + MAX_TITLE_LENGTH + " characters.",
                    "title_too_long");
        }
        String area = normalizer.text(request.area());
        if (area != null && area.length() > MAX_AREA_LENGTH) {
            throw ApiException.validation("Area may have at most " + MAX_AREA_LENGTH + " characters.",
                    "area_too_long");
        }
        String assignedTo = normalizer.text(request.assignedTo());
        if (assignedTo != null && assignedTo.length() > MAX_ASSIGNED_TO_LENGTH) {
            throw ApiException.validation("Assignee may have at most " + MAX_ASSIGNED_TO_LENGTH + " characters.",
                    "assigned_to_too_long");
        }
        if (request.laborCount() != null && request.laborCount() < 0) {
            throw ApiException.validation("Labor count must not be negative.", "labor_count_negative");
        }
    }

    private ActivityMutation toMutation(RequestContext ctx, BriefingRow briefing, ActivityRequest request) {
        List<Long> contractorIds = contractors.retainProjectContractors(ctx.projectId(), request.contractorIds());
        LocalTime time = normalizer.time(request.time());
        return new ActivityMutation(
                briefing.id(),
                briefing.date(),
                time,
                normalizer.text(request.title()),
                normalizer.text(request.description()),
                normalizer.text(request.area()),
                normalizer.priority(request.priority()).value(),
                request.laborCount() != null ? request.laborCount() : 0,
                codec.encode(contractorIds),
                normalizer.text(request.assignedTo()));
    }
}
