package com.company.reporting.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutputArtifact {
    private String format;
    private String filename;
    private String path;
    private long sizeBytes;
}
