package com.phillippitts.tunemerge;

import com.phillippitts.tunemerge.config.properties.MatcherProperties;
import com.phillippitts.tunemerge.config.properties.SearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        MatcherProperties.class,
        SearchProperties.class
})
@EnableScheduling
public class TuneMergeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TuneMergeApplication.class, args);
    }

}
