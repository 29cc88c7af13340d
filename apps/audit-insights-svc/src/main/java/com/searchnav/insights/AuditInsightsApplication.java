package com.searchnav.insights;

import com.searchnav.insights.config.InsightsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(InsightsProperties.class)
public class AuditInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditInsightsApplication.class, args);
    }
}
