package org.jagriti.casesearch.clients.jagriti;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Jagriti Client Properties tests")
class JagritiClientPropertiesTest {

    @Test
    @DisplayName("Unset values fall back to the portal defaults")
    void defaults() {
        final JagritiClientProperties props =
                new JagritiClientProperties(null, null, null, null, 0, 0, 0, false, null);

        assertThat(props.baseUrl()).isEqualTo("https://e-jagriti.gov.in");
        assertThat(props.statesPath()).isEqualTo("/services/report/report/getStateCommissionAndCircuitBench");
        assertThat(props.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.maxRetries()).isEqualTo(3);
        assertThat(props.backoffUnitMs()).isEqualTo(1000);
        assertThat(props.headers())
                .containsEntry("Origin", "https://e-jagriti.gov.in")
                .containsEntry("Referer", "https://e-jagriti.gov.in/")
                .containsEntry("Content-Type", "application/json");
    }

    @Test
    @DisplayName("Configured headers override the browser defaults")
    void headerOverrides() {
        final JagritiClientProperties props = new JagritiClientProperties(
                "http://portal.test", null, null, null, 5000, 2, 10, true, Map.of("User-Agent", "probe/1.0"));

        assertThat(props.headers())
                .containsEntry("User-Agent", "probe/1.0")
                .containsEntry("Origin", "http://portal.test");
        assertThat(props.maxRetries()).isEqualTo(2);
    }
}
