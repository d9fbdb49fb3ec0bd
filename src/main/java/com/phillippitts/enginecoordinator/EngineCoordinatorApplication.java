package com.phillippitts.enginecoordinator;

import com.phillippitts.enginecoordinator.config.properties.CoordinationProperties;
import com.phillippitts.enginecoordinator.config.properties.CreativeProperties;
import com.phillippitts.enginecoordinator.config.properties.HealthProperties;
import com.phillippitts.enginecoordinator.config.properties.ProviderProperties;
import com.phillippitts.enginecoordinator.config.properties.RecallProperties;
import com.phillippitts.enginecoordinator.config.properties.RoutingProperties;
import com.phillippitts.enginecoordinator.config.properties.ThreadPoolProperties;
import com.phillippitts.enginecoordinator.config.properties.WorkerPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ProviderProperties.class,
        HealthProperties.class,
        RoutingProperties.class,
        WorkerPoolProperties.class,
        RecallProperties.class,
        CreativeProperties.class,
        CoordinationProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class EngineCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngineCoordinatorApplication.class, args);
    }

}
