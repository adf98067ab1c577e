package fr.lapetina.ai.gateway.domain.model;

/**
 * One step of a reasoning trace extracted from a model answer.
 *
 * @param step       1-based step number as written by the model
 * @param thought    the text of the step
 * @param confidence confidence percentage (0-100)
 */
public record ReasoningStep(int step, String thought, int confidence) {
}
