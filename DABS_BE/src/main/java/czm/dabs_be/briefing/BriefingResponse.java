package czm.dabs_be.briefing;

import java.time.LocalDate;
import java.time.OffsetDateTime;

public record BriefingResponse(long id,
                               LocalDate date,
                               String status,
                               Long createdBy,
                               OffsetDateTime lastUpdated) {

    public static BriefingResponse from(BriefingDao.BriefingRow row) {
        return new BriefingResponse(row.id(), row.date(), row.status().value(), row.createdBy(), row.lastUpdated());
    }
}
