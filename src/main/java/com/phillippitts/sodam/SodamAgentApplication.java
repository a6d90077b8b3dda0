package com.phillippitts.sodam;

import com.phillippitts.sodam.config.properties.BackendApiProperties;
import com.phillippitts.sodam.config.properties.PostSessionProperties;
import com.phillippitts.sodam.config.properties.SessionProperties;
import com.phillippitts.sodam.config.properties.TakeoverProperties;
import com.phillippitts.sodam.config.properties.ThreadPoolProperties;
import com.phillippitts.sodam.config.properties.TranscriptProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ThreadPoolProperties.class,
        SessionProperties.class,
        TakeoverProperties.class,
        TranscriptProperties.class,
        PostSessionProperties.class,
        BackendApiProperties.class
})
@EnableScheduling
public class SodamAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(SodamAgentApplication.class, args);
    }

}
