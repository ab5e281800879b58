package com.adlanda.phoneadvisor.comparison;

import com.adlanda.phoneadvisor.model.AttributeDifference;
import com.adlanda.phoneadvisor.model.ComparisonResult;
import com.adlanda.phoneadvisor.model.PhoneAttribute;
import com.adlanda.phoneadvisor.model.PhoneRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lists the attributes whose text differs between two records, in canonical attribute
 * order. Values are compared verbatim; "8 GB" and "8GB" count as different.
 */
@Component
public class ComparisonDifferencer {

    public ComparisonResult diff(PhoneRecord recordA, PhoneRecord recordB) {
        List<AttributeDifference> differences = new ArrayList<>();
        for (PhoneAttribute attribute : PhoneAttribute.values()) {
            String valueA = attribute.valueOf(recordA);
            String valueB = attribute.valueOf(recordB);
            if (!Objects.equals(valueA, valueB)) {
                differences.add(new AttributeDifference(attribute, valueA, valueB));
            }
        }
        return new ComparisonResult(recordA, recordB, differences);
    }
}
