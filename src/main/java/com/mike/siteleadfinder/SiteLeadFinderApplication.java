package com.mike.siteleadfinder;

import com.mike.siteleadfinder.config.LeadFinderProperties;
import com.mike.siteleadfinder.config.OutreachProperties;
import com.mike.siteleadfinder.config.SerpApiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({LeadFinderProperties.class, OutreachProperties.class, SerpApiProperties.class})
public class SiteLeadFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiteLeadFinderApplication.class, args);
    }

}
