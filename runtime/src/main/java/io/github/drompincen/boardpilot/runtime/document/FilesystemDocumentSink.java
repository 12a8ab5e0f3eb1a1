package io.github.drompincen.boardpilot.runtime.document;

import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@code <projectRoot>/docs/<TYPE>.md}, creating the docs directory when needed.
 */
@Component
public class FilesystemDocumentSink implements DocumentFileSink {

    private static final Logger log = LoggerFactory.getLogger(FilesystemDocumentSink.class);

    @Override
    public Path write(String projectRoot, DocumentType type, String content) throws IOException {
        Path docsDir = Path.of(projectRoot).resolve("docs");
        Files.createDirectories(docsDir);
        Path file = docsDir.resolve(type.fileName());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        log.info("Wrote {} to {}", type.displayName(), file);
        return file;
    }
}
