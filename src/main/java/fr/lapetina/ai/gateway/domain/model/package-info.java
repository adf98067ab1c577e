/**
 * Domain model shared by providers, resilience primitives and callers.
 *
 * <p>This package contains immutable value objects and the error taxonomy.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest} - Immutable request sent to a provider</li>
 *   <li>{@link fr.lapetina.ai.gateway.domain.model.ChatCompletionResponse} - Complete answer from a provider</li>
 *   <li>{@link fr.lapetina.ai.gateway.domain.model.ChatCompletionChunk} - One element of a streamed answer</li>
 *   <li>{@link fr.lapetina.ai.gateway.domain.model.ErrorKind} - Closed set of failure categories</li>
 *   <li>{@link fr.lapetina.ai.gateway.domain.model.GatewayException} - Classified failure carrying an {@code ErrorKind}</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All records in this package are immutable; list components are copied on construction.
 */
package fr.lapetina.ai.gateway.domain.model;
