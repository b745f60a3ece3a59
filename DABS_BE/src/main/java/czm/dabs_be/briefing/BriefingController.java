package czm.dabs_be.briefing;

import czm.dabs_be.briefing.BriefingService.EnsuredBriefing;
import czm.dabs_be.web.RequestContext;
import czm.dabs_be.web.RequestContextFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/projects/{projectId}/briefings")
@Tag(name = "Briefings", description = "Daily briefing records")
public class BriefingController {
    private final BriefingService service;
    private final RequestContextFactory contexts;

    public BriefingController(BriefingService service, RequestContextFactory contexts) {
        this.service = service;
        this.contexts = contexts;
    }

    @GetMapping("/{date}")
    @Operation(summary = "Briefing for a date", description = "Does not create a briefing; 404 when none exists.")
    public BriefingResponse get(@PathVariable long projectId,
                                @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return BriefingResponse.from(service.getBriefing(contexts.create(projectId, actorId), date));
    }

    @PutMapping("/{date}")
    @Operation(summary = "Ensure briefing", description = "Creates a draft briefing for the date when none exists.")
    public ResponseEntity<BriefingResponse> ensure(@PathVariable long projectId,
                                                   @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                                   @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        EnsuredBriefing ensured = service.ensureBriefing(contexts.create(projectId, actorId), date);
        HttpStatus status = ensured.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(BriefingResponse.from(ensured.briefing()));
    }
}
