package com.adlanda.phoneadvisor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the phone advisor.
 *
 * Maps to properties prefixed with 'advisor' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "advisor")
public class AdvisorProperties {

    private final Seed seed = new Seed();
    private final Generation generation = new Generation();

    public Seed getSeed() {
        return seed;
    }

    public Generation getGeneration() {
        return generation;
    }

    public static class Seed {

        /**
         * Whether the bundled catalog is loaded at startup.
         * Records whose model name already exists are skipped.
         */
        private boolean enabled = true;

        /**
         * Location of the JSON seed file.
         */
        private String location = "classpath:seed/phones.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Generation {

        /**
         * Whether answers are written by the chat model.
         * When false, every answer comes from the built-in templates.
         */
        private boolean enabled = true;

        /**
         * Model tried first.
         */
        private String primaryModel = "gpt-4o-mini";

        /**
         * Model tried when the primary fails. Blank disables the second attempt.
         */
        private String secondaryModel = "gpt-3.5-turbo";

        /**
         * Upper bound for each model call.
         */
        private Duration timeout = Duration.ofSeconds(20);

        /**
         * How many records are described in the prompt.
         */
        private int maxPromptRecords = 5;

        /**
         * Threads available for model calls.
         */
        private int maxConcurrentCalls = 4;

        /**
         * Model calls that may wait for a thread before new ones are rejected.
         */
        private int queueCapacity = 16;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPrimaryModel() {
            return primaryModel;
        }

        public void setPrimaryModel(String primaryModel) {
            this.primaryModel = primaryModel;
        }

        public String getSecondaryModel() {
            return secondaryModel;
        }

        public void setSecondaryModel(String secondaryModel) {
            this.secondaryModel = secondaryModel;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxPromptRecords() {
            return maxPromptRecords;
        }

        public void setMaxPromptRecords(int maxPromptRecords) {
            this.maxPromptRecords = maxPromptRecords;
        }

        public int getMaxConcurrentCalls() {
            return maxConcurrentCalls;
        }

        public void setMaxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = maxConcurrentCalls;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
