package czm.dabs_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DabsBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DabsBeApplication.class, args);
    }

}
