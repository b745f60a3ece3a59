package czm.dabs_be.contractor;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Expands embedded contractor identifier lists into descriptors.
 */
@Component
public class ContractorResolver {

    private final ContractorService contractors;

    public ContractorResolver(ContractorService contractors) {
        this.contractors = contractors;
    }

    /**
     * Lookup maps for one request. Build once, then resolve every activity of the response against it.
     */
    public ContractorLookup lookupFor(long projectId) {
        return contractors.buildLookupMaps(projectId);
    }

    /**
     * Resolves ids in stored order. Ids without a registry entry (contractor deleted after assignment)
     * are omitted.
     */
    public List<ContractorDescriptor> resolve(Collection<Long> contractorIds, ContractorLookup lookup) {
        if (contractorIds == null || contractorIds.isEmpty()) {
            return List.of();
        }
        List<ContractorDescriptor> resolved = new ArrayList<>(contractorIds.size());
        for (Long id : contractorIds) {
            ContractorDescriptor descriptor = id == null ? null : lookup.descriptors().get(id);
            if (descriptor != null) {
                resolved.add(descriptor);
            }
        }
        return resolved;
    }
}
