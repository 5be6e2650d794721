package com.queryinsight.ask.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the ask pipeline.
 *
 * Polling cadence and deadlines apply per stage: the SQL generation stage and the
 * summarization stage each get their own timeout, measured from the start of that stage.
 */
@Configuration
@ConfigurationProperties(prefix = "ask")
@Data
public class AskProperties {

    /**
     * AI inference service (SQL generation and summarization jobs)
     */
    private Endpoint aiService = new Endpoint("http://localhost:5555");

    /**
     * Query engine used for previewing generated SQL
     */
    private Endpoint engine = new Endpoint("http://localhost:8080");

    private Polling polling = new Polling();

    private Http http = new Http();

    /**
     * Rows sampled from the generated SQL and handed to the summarization job
     */
    private int defaultSampleSize = 500;

    /**
     * Answer language when neither the request nor the project specifies one
     */
    private String defaultLanguage = "English";

    /**
     * Ask the AI service to stop an in-flight SQL generation job when the client goes away
     */
    private boolean stopJobOnDisconnect = true;

    @Data
    public static class Endpoint {
        private String baseUrl;

        public Endpoint() {
        }

        public Endpoint(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    @Data
    public static class Polling {
        /** Sleep between two status fetches */
        private Duration interval = Duration.ofSeconds(1);

        /** Hard deadline of the SQL generation stage */
        private Duration sqlGenerationTimeout = Duration.ofMinutes(3);

        /** Hard deadline of the summarization stage */
        private Duration summaryTimeout = Duration.ofMinutes(3);
    }

    @Data
    public static class Http {
        private int connectTimeoutMs = 10000;

        /** Must outlast the longest pause of a provider text stream */
        private int readTimeoutMs = 180000;

        private String userAgent = "QueryInsight-Ask/1.0";
    }
}
