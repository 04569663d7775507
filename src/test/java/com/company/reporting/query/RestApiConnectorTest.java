package com.company.reporting.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestApiConnectorTest {

    @Mock
    private RestTemplate restTemplate;

    private RestApiConnector connector;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        connector = new RestApiConnector(restTemplate, new ObjectMapper());
    }

    @Test
    void parseRows_array_oneRowPerElement() {
        List<Map<String, Object>> rows = connector.parseRows("[{\"a\":1,\"b\":\"x\"},{\"a\":2}]", null);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsEntry("a", 1).containsEntry("b", "x");
        assertThat(rows.get(0).keySet()).containsExactly("a", "b");
    }

    @Test
    void parseRows_singleObject_becomesOneRow() {
        assertThat(connector.parseRows("{\"total\":42}", null))
                .containsExactly(Map.of("total", 42));
    }

    @Test
    void parseRows_recordsPath_readsNestedArray() {
        List<Map<String, Object>> rows = connector.parseRows("{\"data\":[{\"id\":7}],\"page\":1}", "data");

        assertThat(rows).containsExactly(Map.of("id", 7));
    }

    @Test
    void parseRows_blankBody_empty() {
        assertThat(connector.parseRows("  ", null)).isEmpty();
    }

    @Test
    void parseRows_scalar_rejected() {
        assertThatThrownBy(() -> connector.parseRows("\"hello\"", null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void parseRows_malformedJson_rejected() {
        assertThatThrownBy(() -> connector.parseRows("[{", null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("malformed");
    }
}
