package org.jagriti.casesearch.services;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CaseSearchProperties.class)
public class CaseSearchConfig {
}
