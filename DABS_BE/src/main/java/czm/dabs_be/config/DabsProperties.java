package czm.dabs_be.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.LocalTime;

@Validated
@ConfigurationProperties(prefix = "dabs")
public class DabsProperties {
    /** Site time zone; "today" and default dates are resolved in it. */
    @NotBlank
    private String zoneId = "Europe/London";
    /** Actor recorded in audit entries when the caller sends no X-Actor-Id header. */
    private long defaultActorId = 1L;
    /** Substituted when an activity arrives without a usable time of day. */
    private LocalTime defaultActivityTime = LocalTime.of(8, 0);
    /** Largest window (in days) accepted by the rolling per-contractor breakdown. */
    @Min(1)
    @Max(3660)
    private int maxWindowDays = 366;
    /** Window used by the rolling per-contractor breakdown when the caller sends none. */
    @Min(1)
    private int rollingWindowDays = 7;

    public String getZoneId() { return zoneId; }
    public void setZoneId(String zoneId) { this.zoneId = zoneId; }
    public long getDefaultActorId() { return defaultActorId; }
    public void setDefaultActorId(long defaultActorId) { this.defaultActorId = defaultActorId; }
    public LocalTime getDefaultActivityTime() { return defaultActivityTime; }
    public void setDefaultActivityTime(LocalTime defaultActivityTime) { this.defaultActivityTime = defaultActivityTime; }
    public int getMaxWindowDays() { return maxWindowDays; }
    public void setMaxWindowDays(int maxWindowDays) { this.maxWindowDays = maxWindowDays; }
    public int getRollingWindowDays() { return rollingWindowDays; }
    public void setRollingWindowDays(int rollingWindowDays) { this.rollingWindowDays = rollingWindowDays; }
}
