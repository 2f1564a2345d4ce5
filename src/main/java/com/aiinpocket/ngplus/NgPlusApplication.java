package com.aiinpocket.ngplus;

import com.aiinpocket.ngplus.config.ProgressionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ProgressionProperties.class)
public class NgPlusApplication {

    public static void main(String[] args) {
        SpringApplication.run(NgPlusApplication.class, args);
    }

}
