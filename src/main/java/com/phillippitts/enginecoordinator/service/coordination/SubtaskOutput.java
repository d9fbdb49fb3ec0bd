package com.phillippitts.enginecoordinator.service.coordination;

/**
 * Output of one prompt of a parallel batch.
 *
 * @param index      position of the prompt in the batch
 * @param text       completion text; null when the sub-task failed
 * @param providerId provider that served it; null when failed
 * @param error      failure description; null on success
 */
public record SubtaskOutput(int index, String text, String providerId, String error) {

    public boolean succeeded() {
        return error == null;
    }
}
