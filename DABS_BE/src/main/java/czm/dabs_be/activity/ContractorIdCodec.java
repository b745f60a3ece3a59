package czm.dabs_be.activity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reads and writes the contractor identifier list embedded in an activity row as a JSON array.
 */
@Component
public class ContractorIdCodec {
    private static final Logger log = LoggerFactory.getLogger(ContractorIdCodec.class);

    private final ObjectMapper objectMapper;

    public ContractorIdCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Collection<Long> ids) {
        List<Long> values = ids == null ? List.of() : List.copyOf(ids);
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialise contractor ids " + values, ex);
        }
    }

    /**
     * Lenient read: numeric strings are accepted, anything that is not an id list yields no ids.
     */
    public List<Long> decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring unreadable contractor list '{}': {}", raw, ex.getOriginalMessage());
            return List.of();
        }
        if (root == null || !root.isArray()) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            if (node.canConvertToLong() && node.isIntegralNumber()) {
                ids.add(node.asLong());
            } else if (node.isTextual()) {
                try {
                    ids.add(Long.parseLong(node.asText().trim()));
                } catch (NumberFormatException ex) {
                    log.debug("Skipping non-numeric contractor id '{}'", node.asText());
                }
            }
        }
        return List.copyOf(ids);
    }
}
