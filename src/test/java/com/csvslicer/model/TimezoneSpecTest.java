package com.csvslicer.model;

import com.csvslicer.exception.SlicerConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimezoneSpecTest {

    @Test
    @DisplayName("Splits hours from the zone at the first colon")
    void parse() {
        assertThat(TimezoneSpec.parse("3.5:UTC")).contains(new TimezoneSpec(3.5, "UTC"));
        assertThat(TimezoneSpec.parse("-5:America/New_York")).contains(new TimezoneSpec(-5, "America/New_York"));
        assertThat(TimezoneSpec.parse(" ")).isEqualTo(Optional.empty());
    }

    @Test
    @DisplayName("Missing zone or non-numeric hours are rejected")
    void parse_invalid() {
        assertThatThrownBy(() -> TimezoneSpec.parse("UTC")).isInstanceOf(SlicerConfigException.class);
        assertThatThrownBy(() -> TimezoneSpec.parse("east:UTC")).isInstanceOf(SlicerConfigException.class);
    }
}
