package com.phillippitts.enginecoordinator.domain;

/**
 * Memory lookup by text key or by embedding vector. At least one of the two must be present;
 * the vector wins when both are given.
 *
 * @param query  text key (nullable when vector is given)
 * @param vector embedding (nullable when query is given)
 * @param topK   maximum hits to return
 */
public record RecallPayload(String query, float[] vector, int topK) implements TaskPayload {

    public RecallPayload {
        boolean hasQuery = query != null && !query.isBlank();
        boolean hasVector = vector != null && vector.length > 0;
        if (!hasQuery && !hasVector) {
            throw new IllegalArgumentException("recall requires a query or a vector");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got: " + topK);
        }
    }

    @Override
    public TaskKind kind() {
        return TaskKind.RECALL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRecall(this);
    }
}
