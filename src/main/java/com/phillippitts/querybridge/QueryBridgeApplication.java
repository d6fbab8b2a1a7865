package com.phillippitts.querybridge;

import com.phillippitts.querybridge.config.properties.CacheProperties;
import com.phillippitts.querybridge.config.properties.QueryValidationProperties;
import com.phillippitts.querybridge.config.properties.QueueProperties;
import com.phillippitts.querybridge.config.properties.WorkerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        WorkerProperties.class,
        QueryValidationProperties.class,
        QueueProperties.class,
        CacheProperties.class
})
@EnableScheduling
public class QueryBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryBridgeApplication.class, args);
    }

}
