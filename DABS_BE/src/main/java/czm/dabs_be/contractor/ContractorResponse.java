package czm.dabs_be.contractor;

import java.time.OffsetDateTime;

public record ContractorResponse(long id,
                                 String name,
                                 String trade,
                                 String status,
                                 String contactName,
                                 String phone,
                                 String email,
                                 String createdBy,
                                 OffsetDateTime createdAt,
                                 OffsetDateTime updatedAt) {

    static ContractorResponse from(ContractorDao.ContractorRow row) {
        return new ContractorResponse(
                row.id(),
                row.name(),
                row.trade(),
                row.status(),
                row.contactName(),
                row.phone(),
                row.email(),
                row.createdBy(),
                row.createdAt(),
                row.updatedAt());
    }
}
