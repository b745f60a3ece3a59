package czm.dabs_be.activity;

import czm.dabs_be.contractor.ContractorDescriptor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;

public record ActivityResponse(long id,
                               long briefingId,
                               LocalDate date,
                               LocalTime time,
                               String title,
                               String description,
                               String area,
                               String priority,
                               int laborCount,
                               List<Long> contractorIds,
                               List<ContractorDescriptor> contractors,
                               String assignedTo,
                               OffsetDateTime createdAt,
                               OffsetDateTime updatedAt) {
}
