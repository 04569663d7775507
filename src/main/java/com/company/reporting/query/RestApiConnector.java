package com.company.reporting.query;

import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.domain.enums.SourceKind;
import com.company.reporting.exception.ReportValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fetches rows from an external HTTP endpoint returning a JSON array of objects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RestApiConnector implements DataSourceConnector {

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public SourceKind getKind() {
        return SourceKind.API;
    }

    @Override
    public List<Map<String, Object>> fetch(QueryRequest request) {
        DataSourceDescriptor source = request.getSource();
        URI uri = buildUri(source, request.getParameters(), request.getFilters());

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        Object configuredHeaders = source.configValue("headers");
        if (configuredHeaders instanceof Map<?, ?> headerMap) {
            headerMap.forEach((name, value) -> headers.add(String.valueOf(name), String.valueOf(value)));
        }

        log.debug("Calling API source {}", uri);

        ResponseEntity<String> response = restTemplate.exchange(
                uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);

        return parseRows(response.getBody(), (String) source.configValue("records_path"));
    }

    private URI buildUri(DataSourceDescriptor source, Map<String, Object> parameters, Map<String, Object> filters) {
        Object url = source.configValue("url");
        if (url == null) {
            throw new ReportValidationException("API source must declare 'url'");
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(String.valueOf(url));
        parameters.forEach((name, value) -> builder.queryParam(name, value));
        filters.forEach((name, value) -> {
            if (value instanceof Collection<?> values) {
                builder.queryParam(name, values.stream().map(String::valueOf).collect(Collectors.joining(",")));
            } else {
                builder.queryParam(name, value);
            }
        });
        return builder.build().encode().toUri();
    }

    List<Map<String, Object>> parseRows(String body, String recordsPath) {
        if (body == null || body.isBlank()) {
            return Collections.emptyList();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("API source returned malformed JSON", e);
        }

        JsonNode records = recordsPath != null ? root.path(recordsPath) : root;
        if (records.isObject()) {
            return List.of(objectMapper.convertValue(records, ROW_TYPE));
        }
        if (!records.isArray()) {
            throw new IllegalStateException("API source did not return a JSON array of records");
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode record : records) {
            rows.add(objectMapper.convertValue(record, ROW_TYPE));
        }
        return rows;
    }
}
