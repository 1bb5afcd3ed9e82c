package com.phillippitts.watchkeeper;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        WatchkeeperProperties.class
})
@EnableScheduling
public class WatchkeeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatchkeeperApplication.class, args);
    }

}
