package com.phillippitts.windpressure.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DynamicResponseTest {

    @Test
    void regionSuppliesNormativePressure() {
        DynamicResponse response = DynamicResponse.of(WindRegion.REGION_4, 0.8, Decrement.D015);

        assertThat(response.windPressure()).hasValue(480.0);
        assertThat(response.naturalFrequency()).hasValue(0.8);
    }

    @Test
    void customRegionUsesExplicitPressure() {
        assertThat(DynamicResponse.ofCustomPressure(512.5, 1.0, Decrement.D03).windPressure()).hasValue(512.5);
        assertThat(new DynamicResponse(true, 1.0, Decrement.D03, WindRegion.CUSTOM, null).windPressure()).isEmpty();
    }

    @Test
    void notApplicableCarriesNothing() {
        DynamicResponse response = DynamicResponse.notApplicable();

        assertThat(response.frequencyKnown()).isFalse();
        assertThat(response.windPressure()).isEmpty();
        assertThat(response.naturalFrequency()).isEmpty();
    }

    @Test
    void regionsResolveByLabel() {
        assertThat(WindRegion.fromLabel("1a")).isEqualTo(WindRegion.REGION_1A);
        assertThat(WindRegion.fromLabel("CUSTOM")).isEqualTo(WindRegion.CUSTOM);
        assertThat(WindRegion.REGION_7.normativePressure()).hasValue(850.0);
        assertThatThrownBy(() -> WindRegion.fromLabel("8")).isInstanceOf(IllegalArgumentException.class);
    }
}
