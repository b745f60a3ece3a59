package czm.dabs_be.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public Clock siteClock(DabsProperties props) {
        return Clock.system(ZoneId.of(props.getZoneId()));
    }
}
