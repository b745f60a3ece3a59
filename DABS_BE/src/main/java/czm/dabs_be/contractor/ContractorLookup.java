package czm.dabs_be.contractor;

import java.util.Map;

/**
 * Identifier maps for one project, built once per request and shared by every activity resolved in it.
 *
 * @param names       id to display name ("Unnamed Contractor" when the stored name is blank)
 * @param trades      id to trade ("No Trade" when the stored trade is blank)
 * @param descriptors id to full descriptor
 */
public record ContractorLookup(Map<Long, String> names,
                               Map<Long, String> trades,
                               Map<Long, ContractorDescriptor> descriptors) {

    public static ContractorLookup empty() {
        return new ContractorLookup(Map.of(), Map.of(), Map.of());
    }

    public int size() {
        return descriptors.size();
    }
}
