package czm.dabs_be.audit;

import czm.dabs_be.web.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget audit sink. A failed audit write never fails the operation being audited.
 */
@Service
public class AuditLogService {
    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    public static final String CREATE_BRIEFING = "create_briefing";
    public static final String ADD_ACTIVITY = "add_activity";
    public static final String UPDATE_ACTIVITY = "update_activity";
    public static final String DELETE_ACTIVITY = "delete_activity";
    public static final String COPY_ACTIVITIES = "copy_activities";
    public static final String ADD_CONTRACTOR = "add_contractor";
    public static final String UPDATE_CONTRACTOR = "update_contractor";
    public static final String DELETE_CONTRACTOR = "delete_contractor";

    private final AuditLogDao dao;

    public AuditLogService(AuditLogDao dao) {
        this.dao = dao;
    }

    public void record(RequestContext ctx, String action, String details) {
        try {
            dao.insert(ctx.actorId(), ctx.projectId(), action, details);
        } catch (DataAccessException ex) {
            log.warn("Audit entry '{}' for project {} by actor {} was not stored ({})",
                    action, ctx.projectId(), ctx.actorId(), details, ex);
        }
    }
}
