package com.phillippitts.livenesswatch;

import com.phillippitts.livenesswatch.config.properties.NotificationProperties;
import com.phillippitts.livenesswatch.config.properties.ThreadPoolProperties;
import com.phillippitts.livenesswatch.config.properties.WatchdogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        WatchdogProperties.class,
        NotificationProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class LivenessWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LivenessWatchApplication.class, args);
    }

}
