package com.phillippitts.culinara;

import com.phillippitts.culinara.config.properties.CacheProperties;
import com.phillippitts.culinara.config.properties.GenerationProperties;
import com.phillippitts.culinara.config.properties.QueryProperties;
import com.phillippitts.culinara.config.properties.ScrapeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        QueryProperties.class,
        ScrapeProperties.class,
        GenerationProperties.class,
        CacheProperties.class
})
@EnableScheduling
public class CulinaraApplication {

    public static void main(String[] args) {
        SpringApplication.run(CulinaraApplication.class, args);
    }

}
