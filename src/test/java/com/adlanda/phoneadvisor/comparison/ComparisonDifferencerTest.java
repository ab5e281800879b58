package com.adlanda.phoneadvisor.comparison;

import com.adlanda.phoneadvisor.model.AttributeDifference;
import com.adlanda.phoneadvisor.model.ComparisonResult;
import com.adlanda.phoneadvisor.model.PhoneAttribute;
import com.adlanda.phoneadvisor.model.PhoneRecord;
import org.junit.jupiter.api.Test;

import static com.adlanda.phoneadvisor.TestPhones.phone;
import static org.assertj.core.api.Assertions.assertThat;

class ComparisonDifferencerTest {

    private final ComparisonDifferencer differencer = new ComparisonDifferencer();

    private final PhoneRecord newer = phone("Galaxy S23 Ultra", "5000 mAh", "200 MP main", "12 GB", "$1199");
    private final PhoneRecord older = phone("Galaxy S22 Ultra", "5000 mAh", "108 MP main", "12 GB", "$1099");

    @Test
    void diff_listsDifferingAttributesInCanonicalOrder() {
        ComparisonResult result = differencer.diff(newer, older);

        assertThat(result.recordA()).isEqualTo(newer);
        assertThat(result.recordB()).isEqualTo(older);
        assertThat(result.differences()).containsExactly(
                new AttributeDifference(PhoneAttribute.CAMERA, "200 MP main", "108 MP main"),
                new AttributeDifference(PhoneAttribute.PRICE, "$1199", "$1099"));
    }

    @Test
    void diff_isSymmetric() {
        ComparisonResult forward = differencer.diff(newer, older);
        ComparisonResult backward = differencer.diff(older, newer);

        assertThat(backward.differences()).extracting(AttributeDifference::attribute)
                .containsExactlyElementsOf(forward.differences().stream().map(AttributeDifference::attribute).toList());
        for (int i = 0; i < forward.differences().size(); i++) {
            assertThat(backward.differences().get(i).valueA()).isEqualTo(forward.differences().get(i).valueB());
            assertThat(backward.differences().get(i).valueB()).isEqualTo(forward.differences().get(i).valueA());
        }
    }

    @Test
    void diff_identicalRecords_hasNoDifferences() {
        assertThat(differencer.diff(newer, newer).differences()).isEmpty();
    }

    @Test
    void diff_comparesTextVerbatim() {
        PhoneRecord spaced = phone("Galaxy A", "5000 mAh", "50 MP", "8 GB", "$499");
        PhoneRecord compact = phone("Galaxy B", "5000 mAh", "50 MP", "8GB", "$499");

        assertThat(differencer.diff(spaced, compact).differences())
                .extracting(AttributeDifference::attribute)
                .containsExactly(PhoneAttribute.RAM);
    }

    @Test
    void diff_missingValueOnOneSide_countsAsDifference() {
        PhoneRecord withoutPrice = phone("Galaxy S23 Ultra", "5000 mAh", "200 MP main", "12 GB", null);

        assertThat(differencer.diff(newer, withoutPrice).differences())
                .containsExactly(new AttributeDifference(PhoneAttribute.PRICE, "$1199", null));
    }
}
