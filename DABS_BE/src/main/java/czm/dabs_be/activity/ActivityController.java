package czm.dabs_be.activity;

import czm.dabs_be.activity.ActivityService.DaySchedule;
import czm.dabs_be.activity.ActivityService.DeletedActivity;
import czm.dabs_be.activity.DayCopyService.CopyResult;
import czm.dabs_be.web.RequestContext;
import czm.dabs_be.web.RequestContextFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/activities")
@Tag(name = "Activities", description = "Daily activity schedule")
public class ActivityController {
    private final ActivityService service;
    private final DayCopyService dayCopy;
    private final RequestContextFactory contexts;

    public ActivityController(ActivityService service, DayCopyService dayCopy, RequestContextFactory contexts) {
        this.service = service;
        this.dayCopy = dayCopy;
        this.contexts = contexts;
    }

    @GetMapping
    @Operation(summary = "Day schedule",
            description = "Activities of the day ordered by area, priority and title, with resolved contractors.")
    public DaySchedule list(@PathVariable long projectId,
                            @Parameter(description = "yyyy-MM-dd or dd/MM/yyyy, today when missing")
                            @RequestParam(value = "date", required = false) String date,
                            @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.listDay(contexts.create(projectId, actorId), date);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Activity detail")
    public ActivityResponse get(@PathVariable long projectId,
                                @PathVariable long id,
                                @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.get(contexts.create(projectId, actorId), id);
    }

    @PostMapping
    @Operation(summary = "Add activity",
            description = "Uses the given briefing, or the briefing of the given date, creating it when missing.")
    @ApiResponse(responseCode = "201", description = "Activity was created.")
    public ResponseEntity<ActivityResponse> create(@PathVariable long projectId,
                                                   @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId,
                                                   @RequestBody ActivityRequest request) {
        ActivityResponse response = service.add(contexts.create(projectId, actorId), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update activity", description = "Replaces every field of the activity.")
    public ActivityResponse update(@PathVariable long projectId,
                                   @PathVariable long id,
                                   @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId,
                                   @RequestBody ActivityRequest request) {
        return service.update(contexts.create(projectId, actorId), id, request);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete activity", description = "Returns the state of the activity before deletion.")
    public DeletedActivity delete(@PathVariable long projectId,
                                  @PathVariable long id,
                                  @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.delete(contexts.create(projectId, actorId), id);
    }

    @PostMapping("/copy-day")
    @Operation(summary = "Copy a day",
            description = "Copies every activity of the source day into an empty target day.")
    public CopyResult copyDay(@PathVariable long projectId,
                              @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId,
                              @RequestBody(required = false) CopyDayRequest request) {
        String source = request != null ? request.sourceDate() : null;
        String target = request != null ? request.targetDate() : null;
        return dayCopy.copyDay(contexts.create(projectId, actorId), source, target);
    }

    public record CopyDayRequest(String sourceDate, String targetDate) {
    }
}
