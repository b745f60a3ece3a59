package czm.dabs_be.activity;

import czm.dabs_be.config.DabsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Default substitution for loosely typed activity input. Each rule replaces an unusable value with a
 * fixed default instead of rejecting the request.
 */
@Component
public class ActivityInputNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ActivityInputNormalizer.class);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT));
    private static final List<DateTimeFormatter> TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("HH:mm"),
            DateTimeFormatter.ofPattern("HH:mm:ss"));

    private final Clock clock;
    private final DabsProperties properties;

    public ActivityInputNormalizer(Clock clock, DabsProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Accepts yyyy-MM-dd and dd/MM/yyyy. Anything else is today in the site time zone.
     */
    public LocalDate date(String raw) {
        if (raw == null || raw.isBlank()) {
            return today();
        }
        String value = raw.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            TemporalAccessor parsed = tryParse(value, format);
            if (parsed != null) {
                return LocalDate.from(parsed);
            }
        }
        log.debug("Unparseable date '{}', using today", value);
        return today();
    }

    public LocalTime time(String raw) {
        if (raw == null || raw.isBlank()) {
            return properties.getDefaultActivityTime();
        }
        String value = raw.trim();
        for (DateTimeFormatter format : TIME_FORMATS) {
            TemporalAccessor parsed = tryParse(value, format);
            if (parsed != null) {
                return LocalTime.from(parsed);
            }
        }
        log.debug("Unparseable time '{}', using {}", value, properties.getDefaultActivityTime());
        return properties.getDefaultActivityTime();
    }

    public ActivityPriority priority(String raw) {
        return ActivityPriority.coerce(raw);
    }

    private static TemporalAccessor tryParse(String value, DateTimeFormatter format) {
        try {
            return format.parse(value);
        } catch (DateTimeParseException ex) {
            log.trace("'{}' does not match {}: {}", value, format, ex.getMessage());
            return null;
        }
    }

    public String text(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
