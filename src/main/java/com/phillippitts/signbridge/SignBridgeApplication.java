package com.phillippitts.signbridge;

import com.phillippitts.signbridge.config.properties.CacheProperties;
import com.phillippitts.signbridge.config.properties.IdleStateProperties;
import com.phillippitts.signbridge.config.properties.PhraseProperties;
import com.phillippitts.signbridge.config.properties.PipelineProperties;
import com.phillippitts.signbridge.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        CacheProperties.class,
        IdleStateProperties.class,
        PhraseProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class SignBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignBridgeApplication.class, args);
    }

}
