package com.fitlog.backend.workout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sample-data")
public class SampleDataProperties {

    /** Run the sample inserts at start-up. */
    private boolean enabled = false;

    /** Insert the "Strength Training" workout type. */
    private boolean seedWorkoutType = true;

    /** Record the sample workout for this user; skipped when null. */
    private Long userId;
}
