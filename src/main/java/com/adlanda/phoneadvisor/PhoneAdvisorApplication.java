package com.adlanda.phoneadvisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Samsung Phone Advisor - Main Application
 *
 * Answers natural-language questions about a catalog of Samsung phones: specs lookups,
 * side-by-side comparisons and ranked recommendations.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring Data JPA over PostgreSQL for the phone catalog
 * - Spring AI for answer generation via OpenAI, with template answers as fallback
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class PhoneAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhoneAdvisorApplication.class, args);
    }
}
