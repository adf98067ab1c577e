/**
 * HTTP adapters for OpenAI-compatible chat completion backends.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.http.OpenAiCompatibleProvider} - Shared request,
 *       streaming and error mapping logic</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.http.OpenAiChatProvider} - OpenAI API</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.http.AzureOpenAiChatProvider} - Azure OpenAI deployments</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.http.OpenAiWireFormat} - JSON and SSE mapping</li>
 * </ul>
 *
 * <h2>Error Mapping</h2>
 * <table>
 *   <caption>HTTP status to error kind</caption>
 *   <tr><th>Status</th><th>Kind</th></tr>
 *   <tr><td>401</td><td>AUTHENTICATION_FAILURE</td></tr>
 *   <tr><td>403</td><td>AUTHORIZATION_FAILURE</td></tr>
 *   <tr><td>429</td><td>RATE_LIMITED</td></tr>
 *   <tr><td>502</td><td>NETWORK_FAILURE</td></tr>
 *   <tr><td>504</td><td>TIMEOUT</td></tr>
 *   <tr><td>other &gt;= 400</td><td>EXTERNAL_API_FAILURE</td></tr>
 * </table>
 *
 * <h2>Streaming</h2>
 * <p>Streaming responses are read as server-sent events; each {@code data:} line is one chunk and
 * {@code data: [DONE]} ends the stream. Only opening the stream is retried.
 */
package fr.lapetina.ai.gateway.infrastructure.http;
