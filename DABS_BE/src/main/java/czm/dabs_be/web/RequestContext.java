package czm.dabs_be.web;

/**
 * Caller identity handed to every core operation: the project the request is scoped to and the actor
 * recorded in audit entries. Supplied by the authentication layer in front of this service.
 */
public record RequestContext(long projectId, long actorId) {

    public static final String ACTOR_HEADER = "X-Actor-Id";

    public RequestContext {
        if (projectId <= 0) {
            throw ApiException.validation("Project id must be positive.", "project_id_invalid");
        }
    }
}
