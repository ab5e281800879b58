package com.adlanda.phoneadvisor.query;

import com.adlanda.phoneadvisor.model.Focus;
import com.adlanda.phoneadvisor.model.Intent;
import com.adlanda.phoneadvisor.model.QueryAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CriteriaExtractorTest {

    private CriteriaExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new CriteriaExtractor();
    }

    @Test
    void classify_comparisonForPhotography_returnsComparisonWithCameraFocus() {
        QueryAnalysis analysis = extractor.classify("Compare Galaxy S23 Ultra and S22 Ultra for photography");

        assertThat(analysis.intent()).isEqualTo(Intent.COMPARISON);
        assertThat(analysis.criteria().focus()).isEqualTo(Focus.CAMERA);
        assertThat(analysis.criteria().priceMax()).isNull();
    }

    @Test
    void classify_bestBatteryUnderBudget_returnsRecommendationWithCriteria() {
        QueryAnalysis analysis = extractor.classify("Which Samsung phone has the best battery under $1000?");

        assertThat(analysis.intent()).isEqualTo(Intent.RECOMMENDATION);
        assertThat(analysis.criteria().focus()).isEqualTo(Focus.BATTERY);
        assertThat(analysis.criteria().priceMax()).isEqualTo(1000.0);
    }

    @Test
    void classify_specsQuestion_returnsSpecsWithoutCriteria() {
        QueryAnalysis analysis = extractor.classify("What are the specs of Galaxy S23 Ultra?");

        assertThat(analysis.intent()).isEqualTo(Intent.SPECS);
        assertThat(analysis.criteria().focusIfSet()).isEmpty();
        assertThat(analysis.criteria().hasPriceMax()).isFalse();
    }

    @Test
    void classify_bareModelName_returnsGeneral() {
        assertThat(extractor.classify("Galaxy S24 Ultra").intent()).isEqualTo(Intent.GENERAL);
    }

    @Test
    void classify_comparisonKeywordOutranksRecommendationKeyword() {
        assertThat(extractor.classify("Which is better, the S24 or the S23?").intent())
                .isEqualTo(Intent.COMPARISON);
    }

    @Test
    void classify_tellMeAbout_returnsSpecs() {
        assertThat(extractor.classify("Tell me about the Z Flip 6").intent()).isEqualTo(Intent.SPECS);
    }

    @Test
    void detectFocus_severalGroups_lastGroupWins() {
        assertThat(extractor.classify("Which phone has the best camera and screen?").criteria().focus())
                .isEqualTo(Focus.DISPLAY);
        assertThat(extractor.classify("Long lasting battery and a good camera").criteria().focus())
                .isEqualTo(Focus.CAMERA);
    }

    @Test
    void detectFocus_noSignal_returnsNull() {
        assertThat(extractor.detectFocus(QueryTokenizer.tokenize("recommend me a phone"))).isNull();
    }

    @Test
    void extractPriceMax_acceptsCommasAndDecimals() {
        assertThat(extractor.extractPriceMax("something below 1,200 please")).isEqualTo(1200.0);
        assertThat(extractor.extractPriceMax("under $799.99")).isEqualTo(799.99);
    }

    @Test
    void extractPriceMax_severalCeilings_firstWins() {
        assertThat(extractor.extractPriceMax("under $500 or maybe under $900")).isEqualTo(500.0);
    }

    @Test
    void extractPriceMax_noCeiling_returnsNull() {
        assertThat(extractor.extractPriceMax("best phone for $1000")).isNull();
        assertThat(extractor.extractPriceMax(null)).isNull();
    }
}
