package io.github.drompincen.boardpilot.protocol.api;

/**
 * Result of generating one planning document. {@code error} is set when generation failed;
 * {@code fileError} when only the best-effort file write failed.
 */
public record GeneratedDocumentDto(
        DocumentType type,
        boolean success,
        Integer version,
        String cardId,
        ReviewStatus reviewStatus,
        String todoId,
        String filePath,
        String fileError,
        String error
) {
    public static GeneratedDocumentDto failure(DocumentType type, String error) {
        return new GeneratedDocumentDto(type, false, null, null, null, null, null, null, error);
    }
}
