package org.carball.cubeql.sql;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class IsoDurationTest {

    @Test
    public void shouldParseDateAndTimeParts() {
        // When
        IsoDuration duration = IsoDuration.parse("P1DT2H30M");

        // Then
        assertThat(duration.days()).isEqualTo(1);
        assertThat(duration.hours()).isEqualTo(2);
        assertThat(duration.minutes()).isEqualTo(30);
        assertThat(duration.seconds()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(duration.totalSeconds()).isEqualTo(86_400 + 2 * 3600 + 30 * 60);
    }

    @Test
    public void shouldCountWeeksAsSevenDays() {
        IsoDuration duration = IsoDuration.parse("P2W");

        assertThat(duration.totalSeconds()).isEqualTo(14 * 86_400L);
        assertThat(duration.toIntervalText()).isEqualTo("14 days");
    }

    @Test
    public void shouldRenderIntervalText() {
        assertThat(IsoDuration.parse("P1D").toIntervalText()).isEqualTo("1 days");
        assertThat(IsoDuration.parse("PT2H30M").toIntervalText()).isEqualTo("2 hours 30 minutes");
        assertThat(IsoDuration.parse("PT1.5S").toIntervalText()).isEqualTo("1.5 seconds");
        assertThat(IsoDuration.parse("P1Y2M").toIntervalText()).isEqualTo("1 years 2 months");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "P", "PT", "1D", "P1H", "PXD", "P1DT", "7 days"})
    public void shouldRejectMalformedDurations(String value) {
        assertThat(IsoDuration.isValid(value)).isFalse();
        assertThatThrownBy(() -> IsoDuration.parse(value))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid ISO-8601 duration");
    }

    @Test
    public void shouldTreatNullAsInvalid() {
        assertThat(IsoDuration.parseOptional(null)).isEmpty();
    }
}
