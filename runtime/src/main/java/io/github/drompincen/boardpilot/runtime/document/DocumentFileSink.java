package io.github.drompincen.boardpilot.runtime.document;

import io.github.drompincen.boardpilot.protocol.api.DocumentType;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a rendered planning document outside the database.
 */
public interface DocumentFileSink {

    Path write(String projectRoot, DocumentType type, String content) throws IOException;
}
