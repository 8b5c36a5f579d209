package com.netcourier.docstruct.service.dedup;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DateValuesTest {

    @ParameterizedTest
    @ValueSource(strings = {"2024-01-05", "2024/1/5", "01/05/2024", "5-Jan-2024", "05-JAN-24", "5 January 2024", "Jan 5, 2024", " 05.01.2024 "})
    void recognisesCommonWritingsOfTheSameDate(String value) {
        assertThat(DateValues.parse(value)).contains(LocalDate.of(2024, 1, 5));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "INV-2024-01", "35 years", "2024-13-45", "Jaipur"})
    void ignoresValuesThatAreNotDates(String value) {
        assertThat(DateValues.parse(value)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Invoice Date", "invoice date.", "  INVOICE   DATE: "})
    void keysNormalizeToOneForm(String key) {
        assertThat(TextNormalizer.normalizeKey(key)).isEqualTo("invoice date");
    }
}
