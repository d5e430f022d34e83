package com.basketgov;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "governance")
public class GovernanceProperties {

    /** Upper bound on a single validator call. */
    private Duration validatorTimeout = Duration.ofSeconds(5);

    private Timeline timeline = new Timeline();

    public Duration getValidatorTimeout() { return validatorTimeout; }
    public void setValidatorTimeout(Duration validatorTimeout) { this.validatorTimeout = validatorTimeout; }

    public Timeline getTimeline() { return timeline; }
    public void setTimeline(Timeline timeline) { this.timeline = timeline; }

    public static class Timeline {
        private int defaultPageSize = 10;
        private int maxPageSize = 100;

        public int getDefaultPageSize() { return defaultPageSize; }
        public void setDefaultPageSize(int defaultPageSize) { this.defaultPageSize = defaultPageSize; }

        public int getMaxPageSize() { return maxPageSize; }
        public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }
    }
}
