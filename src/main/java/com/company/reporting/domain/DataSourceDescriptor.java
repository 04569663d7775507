package com.company.reporting.domain;

import com.company.reporting.domain.enums.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceDescriptor {
    private String type;
    private Map<String, Object> config;

    public SourceKind kind() {
        return SourceKind.fromString(type);
    }

    public Object configValue(String key) {
        return config != null ? config.get(key) : null;
    }
}
