package com.phillippitts.speakruntime;

import com.phillippitts.speakruntime.config.properties.LifecycleProperties;
import com.phillippitts.speakruntime.config.properties.MemoryMonitorProperties;
import com.phillippitts.speakruntime.config.properties.ResourceRegistryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ResourceRegistryProperties.class,
        MemoryMonitorProperties.class,
        LifecycleProperties.class
})
@EnableScheduling
public class SpeakRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakRuntimeApplication.class, args);
    }

}
