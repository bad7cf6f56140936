package com.phillippitts.callagent;

import com.phillippitts.callagent.config.properties.AudioLibraryProperties;
import com.phillippitts.callagent.config.properties.FallbackProperties;
import com.phillippitts.callagent.config.properties.ProfileProperties;
import com.phillippitts.callagent.config.properties.RecordingProperties;
import com.phillippitts.callagent.config.properties.StreamingProperties;
import com.phillippitts.callagent.config.properties.TimeoutProperties;
import com.phillippitts.callagent.config.properties.TurnProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        TurnProperties.class,
        TimeoutProperties.class,
        StreamingProperties.class,
        RecordingProperties.class,
        AudioLibraryProperties.class,
        FallbackProperties.class,
        ProfileProperties.class
})
@EnableScheduling
public class CallAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallAgentApplication.class, args);
    }

}
