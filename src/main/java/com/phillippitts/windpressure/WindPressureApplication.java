package com.phillippitts.windpressure;

import com.phillippitts.windpressure.config.properties.CorrectionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        CorrectionProperties.class
})
@EnableScheduling
public class WindPressureApplication {

    public static void main(String[] args) {
        SpringApplication.run(WindPressureApplication.class, args);
    }

}
