package czm.dabs_be.contractor;

import czm.dabs_be.web.RequestContext;
import czm.dabs_be.web.RequestContextFactory;
import io.swagger.v3.oas.annotations.Operation;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}/contractors")
@Tag(name = "Contractors", description = "Project subcontractor registry")
public class ContractorController {
    private final ContractorService service;
    private final RequestContextFactory contexts;

    public ContractorController(ContractorService service, RequestContextFactory contexts) {
        this.service = service;
        this.contexts = contexts;
    }

    @GetMapping
    @Operation(summary = "List contractors", description = "Ordered by status (Active first) and then by name.")
    public List<ContractorResponse> list(@PathVariable long projectId,
                                         @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.list(contexts.create(projectId, actorId));
    }

    @PostMapping
    @Operation(summary = "Add contractor", description = "Names are unique per project regardless of letter case.")
    @ApiResponse(responseCode = "201", description = "Contractor was created.")
    public ResponseEntity<ContractorResponse> create(@PathVariable long projectId,
                                                     @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId,
                                                     @RequestBody ContractorRequest request) {
        ContractorResponse response = service.add(contexts.create(projectId, actorId), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Contractor detail")
    public ContractorResponse get(@PathVariable long projectId,
                                  @PathVariable long id,
                                  @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.get(contexts.create(projectId, actorId), id);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update contractor", description = "Replaces every editable field. Unknown status becomes Active.")
    public ContractorResponse update(@PathVariable long projectId,
                                     @PathVariable long id,
                                     @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId,
                                     @RequestBody ContractorRequest request) {
        return service.update(contexts.create(projectId, actorId), id, request);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete contractor",
            description = "Returns the removed record. Activities keep the identifier, which no longer resolves.")
    public ContractorResponse delete(@PathVariable long projectId,
                                     @PathVariable long id,
                                     @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) Long actorId) {
        return service.delete(contexts.create(projectId, actorId), id);
    }
}
