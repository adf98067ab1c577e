/**
 * Configuration loading and start-up validation.
 *
 * <p>This package builds the gateway configuration from YAML or environment variables and
 * checks the environment for legacy setups before any provider is created.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.config.ProviderConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.config.ConfigLoader} - YAML and environment loading</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.config.ConfigurationValidator} - Legacy variable detection and required variable checks</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.config.MigrationGuides} - Remediation texts</li>
 * </ul>
 *
 * <h2>Legacy Variables</h2>
 * <p>{@code OPENAI_ACCESS_TOKEN}, {@code CHATGPT_ACCESS_TOKEN}, {@code API_REVERSE_PROXY} and
 * {@code REVERSE_PROXY_URL} are rejected at start-up with a migration guide describing how to
 * move to an API key.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code provider} - Provider tag ({@code openai} or {@code azure})</li>
 *   <li>{@code openai} / {@code azure} - Provider credentials and endpoints</li>
 *   <li>{@code retry} - Retry policy for outbound calls</li>
 *   <li>{@code circuitBreaker} - Circuit breaker thresholds</li>
 *   <li>{@code rateLimit} - Serial dispatch with minimum spacing</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.ai.gateway.infrastructure.config.ProviderConfig
 * @see fr.lapetina.ai.gateway.infrastructure.config.ConfigurationValidator
 */
package fr.lapetina.ai.gateway.infrastructure.config;
