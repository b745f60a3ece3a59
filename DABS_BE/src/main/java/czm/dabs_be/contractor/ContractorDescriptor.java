package czm.dabs_be.contractor;

/**
 * Resolved view of a contractor as attached to activities and statistics rows.
 */
public record ContractorDescriptor(long id,
                                   String name,
                                   String trade,
                                   String status,
                                   String contactName,
                                   String phone,
                                   String email) {
}
