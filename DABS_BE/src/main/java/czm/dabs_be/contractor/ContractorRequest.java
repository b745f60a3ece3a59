package czm.dabs_be.contractor;

public record ContractorRequest(String name,
                                String trade,
                                String status,
                                String contactName,
                                String phone,
                                String email) {
}
