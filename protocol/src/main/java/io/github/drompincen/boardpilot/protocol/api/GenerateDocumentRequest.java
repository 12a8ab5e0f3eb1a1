package io.github.drompincen.boardpilot.protocol.api;

public record GenerateDocumentRequest(
        String projectId,
        String documentType,
        Boolean createReviewCard,
        Boolean createTodo
) {
    public GenerateDocumentRequest(String projectId, DocumentType type) {
        this(projectId, type.value(), true, true);
    }

    public boolean shouldCreateReviewCard() {
        return createReviewCard == null || createReviewCard;
    }

    public boolean shouldCreateTodo() {
        return createTodo == null || createTodo;
    }
}
