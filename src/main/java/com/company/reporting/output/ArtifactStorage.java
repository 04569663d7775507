package com.company.reporting.output;

import com.company.reporting.domain.OutputArtifact;
import com.company.reporting.domain.enums.OutputFormat;

import java.io.IOException;

/**
 * Where rendered report files end up.
 */
public interface ArtifactStorage {

    OutputArtifact store(String filename, OutputFormat format, byte[] content) throws IOException;
}
