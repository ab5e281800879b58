package com.adlanda.phoneadvisor.ranking;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpecParserTest {

    @Test
    void batteryMah_readsFirstCapacity() {
        assertThat(SpecParser.batteryMah("5000 mAh, 45W wired charging, 15W wireless")).hasValue(5000);
        assertThat(SpecParser.batteryMah("Li-Ion 4400mAh")).hasValue(4400);
    }

    @Test
    void mainCameraMp_readsFirstListedSensor() {
        assertThat(SpecParser.mainCameraMp("200 MP main | 50 MP periscope telephoto | 12 MP ultrawide"))
                .hasValue(200);
    }

    @Test
    void ramGb_readsNumberNextToUnit() {
        assertThat(SpecParser.ramGb("12 GB")).hasValue(12);
        assertThat(SpecParser.ramGb("8/12 GB")).hasValue(12);
    }

    @Test
    void intParsers_missingOrUnrecognizedText_returnEmpty() {
        assertThat(SpecParser.batteryMah(null)).isEmpty();
        assertThat(SpecParser.batteryMah("N/A")).isEmpty();
        assertThat(SpecParser.mainCameraMp("")).isEmpty();
        assertThat(SpecParser.ramGb("unknown")).isEmpty();
    }

    @Test
    void price_prefersDollars() {
        assertThat(SpecParser.price("$1299 / €1449")).hasValue(1299.0);
        assertThat(SpecParser.price("€1449 / $1299")).hasValue(1299.0);
    }

    @Test
    void price_fallsBackToEuros() {
        assertThat(SpecParser.price("About €899")).hasValue(899.0);
    }

    @Test
    void price_acceptsThousandsSeparatorsAndDecimals() {
        assertThat(SpecParser.price("$1,299.99")).hasValue(1299.99);
    }

    @Test
    void price_noAmount_returnsEmpty() {
        assertThat(SpecParser.price("N/A")).isEmpty();
        assertThat(SpecParser.price(null)).isEmpty();
    }

    @Test
    void displayFlags_detectRefreshRateAndPanel() {
        String display = "6.8 inches, Dynamic AMOLED 2X, 120Hz, 1440 x 3120 pixels";

        assertThat(SpecParser.hasHighRefreshRate(display)).isTrue();
        assertThat(SpecParser.hasAmoledPanel(display)).isTrue();
        assertThat(SpecParser.hasHighRefreshRate("6.7 inches, Super AMOLED Plus, 60Hz")).isFalse();
        assertThat(SpecParser.hasAmoledPanel("6.5 inches, PLS LCD, 90Hz")).isFalse();
        assertThat(SpecParser.hasAmoledPanel(null)).isFalse();
    }
}
