package czm.dabs_be.activity;

import java.util.List;

/**
 * Activity fields as sent by the client. Dates and times are strings because the default substitution
 * rules accept several forms.
 */
public record ActivityRequest(Long briefingId,
                              String date,
                              String time,
                              String title,
                              String description,
                              String area,
                              String priority,
                              Integer laborCount,
                              List<Long> contractorIds,
                              String assignedTo) {
}
