package czm.dabs_be.web;

import czm.dabs_be.config.DabsProperties;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link RequestContext} for a controller call from the project path variable and the
 * optional actor header.
 */
@Component
public class RequestContextFactory {
    private final DabsProperties properties;

    public RequestContextFactory(DabsProperties properties) {
        this.properties = properties;
    }

    public RequestContext create(long projectId, Long actorId) {
        if (actorId != null && actorId <= 0) {
            throw ApiException.validation("Actor id must be positive.", "actor_id_invalid");
        }
        return new RequestContext(projectId, actorId != null ? actorId : properties.getDefaultActorId());
    }
}
