package czm.dabs_be.stats;

import czm.dabs_be.stats.ResourceStatsService.AreaUsage;
import czm.dabs_be.stats.ResourceStatsService.ContractorDay;
import czm.dabs_be.stats.ResourceStatsService.DailyTotals;
import czm.dabs_be.stats.ResourceStatsService.RangeTotals;
import czm.dabs_be.web.RequestContext;
import czm.dabs_be.web.RequestContextFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}/stats")
@Tag(name = "Resource statistics", description = "Labor and activity aggregates")
public class ResourceStatsController {
    private final ResourceStatsService service;
    private final RequestContextFactory contexts;

    public ResourceStatsController(ResourceStatsService service, RequestContextFactory contexts) {
        this.service = service;
        this.contexts = contexts;
    }

    @GetMapping("/daily")
    @Operation(summary = "Daily totals", description = "Zeros when the day has no briefing.")
    public DailyTotals daily(@PathVariable long projectId,
                             @Parameter(description = "yyyy-MM-dd or dd/MM/yyyy, today when missing")
                             @RequestParam(value = "date", required = false) String date,
                             @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.dailyTotals(contexts.create(projectId, actorId), date);
    }

    @GetMapping("/range")
    @Operation(summary = "Range totals",
            description = "Inclusive range, the current week by default. An inverted range returns an empty result.")
    public RangeTotals range(@PathVariable long projectId,
                             @RequestParam(value = "start", required = false) String start,
                             @RequestParam(value = "end", required = false) String end,
                             @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.rangeTotals(contexts.create(projectId, actorId), start, end);
    }

    @GetMapping("/week")
    @Operation(summary = "Weekly totals", description = "Monday to Sunday week containing the date.")
    public RangeTotals week(@PathVariable long projectId,
                            @RequestParam(value = "date", required = false) String date,
                            @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.weekTotals(contexts.create(projectId, actorId), date);
    }

    @GetMapping("/contractor-daily")
    @Operation(summary = "Rolling workers per assignee", description = "One entry per day of the window ending at the date.")
    public List<ContractorDay> contractorDaily(@PathVariable long projectId,
                                               @RequestParam(value = "end", required = false) String end,
                                               @RequestParam(value = "window", required = false) Integer window,
                                               @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.rollingContractorDaily(contexts.create(projectId, actorId), end, window);
    }

    @GetMapping("/areas")
    @Operation(summary = "Area usage", description = "Lifetime usage per area, busiest first.")
    public AreaUsage areas(@PathVariable long projectId,
                           @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.areaUsageStats(contexts.create(projectId, actorId));
    }
}
