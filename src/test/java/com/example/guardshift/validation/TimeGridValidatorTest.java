package com.example.guardshift.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeGridValidatorTest {

    private final TimeGridValidator validator = new TimeGridValidator(30);

    @Test
    void validate_acceptsTimesOnTheGrid() {
        assertThat(validator.validate("08:00")).isEqualTo(TimeValidationResponse.ok());
        assertThat(validator.validate("23:30").valid()).isTrue();
    }

    @Test
    void validate_suggestsNearestGridTime() {
        TimeValidationResponse response = validator.validate("08:20");

        assertThat(response.valid()).isFalse();
        assertThat(response.closestTime()).isEqualTo("08:30");
        assertThat(response.message()).isEqualTo("Minutes must be a multiple of 30");

        assertThat(validator.validate("08:10").closestTime()).isEqualTo("08:00");
        assertThat(validator.validate("08:15").closestTime()).isEqualTo("08:30");
        assertThat(validator.validate("08:45").closestTime()).isEqualTo("09:00");
    }

    @Test
    void validate_wrapsSuggestionPastMidnight() {
        assertThat(validator.validate("23:50").closestTime()).isEqualTo("00:00");
    }

    @Test
    void validate_rejectsMalformedInput() {
        assertThat(validator.validate("0800").message()).isEqualTo("Invalid time format. Use HH:MM format");
        assertThat(validator.validate("08:00:00").message()).isEqualTo("Invalid time format. Use HH:MM format");
        assertThat(validator.validate("ab:cd").message()).isEqualTo("Invalid time format. Use HH:MM format with numbers");
        assertThat(validator.validate("24:00").message()).isEqualTo("Hour must be between 00 and 23");
        assertThat(validator.validate("12:60").message()).isEqualTo("Minute must be between 00 and 59");
        assertThat(validator.validate("12:60").closestTime()).isNull();
    }

    @Test
    void constructor_rejectsGridThatDoesNotDivideAnHour() {
        assertThatThrownBy(() -> new TimeGridValidator(7)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new TimeGridValidator(15).validate("08:20").closestTime()).isEqualTo("08:15");
    }
}
