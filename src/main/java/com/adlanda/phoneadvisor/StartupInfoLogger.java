package com.adlanda.phoneadvisor;

import com.adlanda.phoneadvisor.generation.AnswerRenderer;
import com.adlanda.phoneadvisor.generation.GenerationStrategy;
import com.adlanda.phoneadvisor.repository.PhoneCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Prints the catalog size, the answer chain and the endpoints once the application is up.
 */
@Component
@Order(2) // Run after CatalogSeedRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final PhoneCatalog catalog;
    private final AnswerRenderer answerRenderer;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(PhoneCatalog catalog, AnswerRenderer answerRenderer) {
        this.catalog = catalog;
        this.answerRenderer = answerRenderer;
    }

    @Override
    public void run(ApplicationArguments args) {
        long phones = catalog.count();
        log.info("""

            Samsung Phone Advisor v{}
            Catalog: {} phones
            Answers: {}

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/ask
              GET  http://localhost:{}/api/v1/phones
              GET  http://localhost:{}/api/v1/phones/{modelName}

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, phones, answerChain(answerRenderer.strategies()), port, port, port, port, port
        );
        if (phones == 0) {
            log.warn("Catalog is empty, every question will be answered with the no-phones-found message");
        }
    }

    static String answerChain(List<GenerationStrategy> strategies) {
        return Stream.concat(strategies.stream().map(GenerationStrategy::name), Stream.of("templates"))
                .collect(Collectors.joining(" -> "));
    }
}
