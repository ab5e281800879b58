package com.adlanda.phoneadvisor;

import com.adlanda.phoneadvisor.config.AdvisorProperties;
import com.adlanda.phoneadvisor.service.CatalogSeedService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogSeedRunnerTest {

    @Mock
    private CatalogSeedService seedService;

    private AdvisorProperties properties;
    private CatalogSeedRunner runner;

    @BeforeEach
    void setUp() {
        properties = new AdvisorProperties();
        runner = new CatalogSeedRunner(seedService, properties);
    }

    @Test
    void run_enabled_seedsCatalog() throws IOException {
        when(seedService.seed()).thenReturn(new CatalogSeedService.SeedSummary(30, 0));

        runner.run(new DefaultApplicationArguments());

        verify(seedService).seed();
    }

    @Test
    void run_disabled_skipsSeeding() {
        properties.getSeed().setEnabled(false);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(seedService);
    }

    @Test
    void run_unreadableSeedFile_doesNotFailStartup() throws IOException {
        when(seedService.seed()).thenThrow(new IOException("Seed file not found: classpath:seed/phones.json"));

        assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    }
}
