package czm.dabs_be.contractor;

import czm.dabs_be.audit.AuditLogService;
import czm.dabs_be.contractor.ContractorDao.ContractorMutation;
import czm.dabs_be.contractor.ContractorDao.ContractorRow;
import czm.dabs_be.web.ApiException;
import czm.dabs_be.web.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Project scoped subcontractor registry.
 *
 * <p>Names are unique per project ignoring case. The registry owns no activity data: removing a
 * contractor leaves its identifier in existing activities, where resolution skips it.</p>
 */
@Service
public class ContractorService {
    private static final Logger log = LoggerFactory.getLogger(ContractorService.class);

    private static final int MAX_NAME_LENGTH = 255;
    private static final int MAX_PHONE_LENGTH = 50;
    static final String UNNAMED = "Unnamed Contractor";
    static final String NO_TRADE = "No Trade";

    private final ContractorDao dao;
    private final AuditLogService audit;

    public ContractorService(ContractorDao dao, AuditLogService audit) {
        this.dao = dao;
        this.audit = audit;
    }

    public List<ContractorResponse> list(RequestContext ctx) {
        return dao.listByProject(ctx.projectId()).stream()
                .map(ContractorResponse::from)
                .toList();
    }

    public ContractorResponse get(RequestContext ctx, long contractorId) {
        return ContractorResponse.from(requireContractor(ctx.projectId(), contractorId));
    }

    /**
     * Builds fresh identifier maps for the project. Never cached, the registry may change between calls.
     */
    public ContractorLookup buildLookupMaps(long projectId) {
        List<ContractorRow> rows = dao.listByProject(projectId);
        Map<Long, String> names = new HashMap<>();
        Map<Long, String> trades = new HashMap<>();
        Map<Long, ContractorDescriptor> descriptors = new HashMap<>();
        for (ContractorRow row : rows) {
            names.put(row.id(), isBlank(row.name()) ? UNNAMED : row.name());
            trades.put(row.id(), isBlank(row.trade()) ? NO_TRADE : row.trade());
            descriptors.put(row.id(), new ContractorDescriptor(
                    row.id(),
                    row.name(),
                    row.trade(),
                    row.status(),
                    row.contactName(),
                    row.phone(),
                    row.email()));
        }
        log.debug("Built contractor lookup for project {} with {} entries", projectId, rows.size());
        return new ContractorLookup(Map.copyOf(names), Map.copyOf(trades), Map.copyOf(descriptors));
    }

    public ContractorResponse add(RequestContext ctx, ContractorRequest request) {
        ContractorMutation mutation = normalize(request);
        dao.findByNameIgnoreCase(ctx.projectId(), mutation.name()).ifPresent(existing -> {
            throw duplicateName(mutation.name());
        });
        ContractorRow inserted;
        try {
            inserted = dao.insert(ctx.projectId(), mutation, String.valueOf(ctx.actorId()));
        } catch (DuplicateKeyException ex) {
            throw duplicateName(mutation.name());
        }
        log.info("Contractor {} '{}' added to project {}", inserted.id(), inserted.name(), ctx.projectId());
        audit.record(ctx, AuditLogService.ADD_CONTRACTOR,
                "Added contractor " + inserted.name() + " (" + inserted.trade() + ")");
        return ContractorResponse.from(inserted);
    }

    /**
     * Replaces every editable field of the contractor.
     */
    public ContractorResponse update(RequestContext ctx, long contractorId, ContractorRequest request) {
        requireContractor(ctx.projectId(), contractorId);
        ContractorMutation mutation = normalize(request);
        dao.findByNameIgnoreCase(ctx.projectId(), mutation.name())
                .filter(existing -> existing.id() != contractorId)
                .ifPresent(existing -> {
                    throw duplicateName(mutation.name());
                });
        ContractorRow updated;
        try {
            updated = dao.update(ctx.projectId(), contractorId, mutation)
                    .orElseThrow(() -> ApiException.notFound("Contractor was not found.", "contractor"));
        } catch (DuplicateKeyException ex) {
            throw duplicateName(mutation.name());
        }
        audit.record(ctx, AuditLogService.UPDATE_CONTRACTOR, "Updated contractor " + updated.name());
        return ContractorResponse.from(updated);
    }

    /**
     * Deletes the contractor and returns its last state. Activities referencing it are left untouched.
     */
    public ContractorResponse delete(RequestContext ctx, long contractorId) {
        ContractorRow existing = requireContractor(ctx.projectId(), contractorId);
        int removed = dao.delete(ctx.projectId(), contractorId);
        if (removed == 0) {
            throw ApiException.notFound("Contractor was not found.", "contractor");
        }
        log.info("Contractor {} '{}' removed from project {}", existing.id(), existing.name(), ctx.projectId());
        audit.record(ctx, AuditLogService.DELETE_CONTRACTOR, "Deleted contractor " + existing.name());
        return ContractorResponse.from(existing);
    }

    /**
     * Keeps the ids that belong to the project, in first-seen order and without duplicates. Unknown ids
     * are dropped, not rejected.
     */
    public List<Long> retainProjectContractors(long projectId, Collection<Long> requestedIds) {
        if (requestedIds == null || requestedIds.isEmpty()) {
            return List.of();
        }
        Set<Long> unique = new LinkedHashSet<>();
        for (Long id : requestedIds) {
            if (id != null && id > 0) {
                unique.add(id);
            }
        }
        if (unique.isEmpty()) {
            return List.of();
        }
        Set<Long> existing = dao.findExistingIds(projectId, unique);
        List<Long> retained = unique.stream().filter(existing::contains).toList();
        if (retained.size() < requestedIds.size()) {
            log.debug("Dropped contractor ids {} for project {}", requestedIds, projectId);
        }
        return retained;
    }

    public long countActiveContractors(long projectId) {
        return dao.countActiveNames(projectId);
    }

    private ContractorRow requireContractor(long projectId, long contractorId) {
        return dao.findById(projectId, contractorId)
                .orElseThrow(() -> ApiException.notFound("Contractor was not found.", "contractor"));
    }

    private ContractorMutation normalize(ContractorRequest request) {
        if (request == null) {
            throw ApiException.validation("Request body is required.", "request_required");
        }
        String name = trimToEmpty(request.name());
        String trade = trimToEmpty(request.trade());
        if (name.isEmpty()) {
            throw ApiException.validation("Contractor name is required.", "name_required");
        }
        if (trade.isEmpty()) {
            throw ApiException.validation("Contractor trade is required.", "trade_required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw ApiException.validation("Contractor name may have at most " + MAX_NAME_LENGTH + " characters.",
                    "name_too_long");
        }
        if (trade.length() > MAX_NAME_LENGTH) {
            throw ApiException.validation("Trade may have at most " + MAX_NAME_LENGTH + " characters.",
                    "trade_too_long");
        }
        String phone = trimToEmpty(request.phone());
        if (phone.length() > MAX_PHONE_LENGTH) {
            throw ApiException.validation("Phone may have at most " + MAX_PHONE_LENGTH + " characters.",
                    "phone_too_long");
        }
        String email = trimToEmpty(request.email());
        return new ContractorMutation(
                name,
                trade,
                ContractorStatus.coerce(request.status()),
                trimToEmpty(request.contactName()),
                phone,
                email.isEmpty() ? null : email);
    }

    private static ApiException duplicateName(String name) {
        return ApiException.duplicateName("A contractor named '" + name + "' already exists in this project.",
                "contractor_name_taken");
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
