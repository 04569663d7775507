package com.company.reporting.output;

import com.company.reporting.domain.OutputArtifact;
import com.company.reporting.domain.enums.OutputFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Component
@Slf4j
public class LocalArtifactStorage implements ArtifactStorage {

    private final Path storageDirectory;

    public LocalArtifactStorage(@Value("${reporting.output.storage-path:./report-output}") String storagePath) {
        this.storageDirectory = Paths.get(storagePath);
    }

    @Override
    public OutputArtifact store(String filename, OutputFormat format, byte[] content) throws IOException {
        Files.createDirectories(storageDirectory);
        Path target = storageDirectory.resolve(filename);
        Files.write(target, content);

        log.debug("Stored {} artifact {} ({} bytes)", format.getValue(), target, content.length);

        return OutputArtifact.builder()
                .format(format.getValue())
                .filename(filename)
                .path(target.toAbsolutePath().toString())
                .sizeBytes(content.length)
                .build();
    }
}
