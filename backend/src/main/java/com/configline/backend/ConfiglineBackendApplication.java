package com.configline.backend;

import com.configline.backend.publish.PublishProperties;
import com.configline.backend.replication.ReplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ReplicationProperties.class,
        PublishProperties.class
})
public class ConfiglineBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(ConfiglineBackendApplication.class, args);
    }
}
