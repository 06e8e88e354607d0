package com.fitlog.backend.workout.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SampleDataProperties.class)
public class SampleDataConfig {}
