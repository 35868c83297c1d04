package com.phillippitts.multishot;

import com.phillippitts.multishot.config.properties.EngineProperties;
import com.phillippitts.multishot.config.properties.MetricsStoreProperties;
import com.phillippitts.multishot.config.properties.OutputProperties;
import com.phillippitts.multishot.config.properties.RunnerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RunnerProperties.class,
        EngineProperties.class,
        OutputProperties.class,
        MetricsStoreProperties.class
})
public class MultiShotApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultiShotApplication.class, args);
    }

}
