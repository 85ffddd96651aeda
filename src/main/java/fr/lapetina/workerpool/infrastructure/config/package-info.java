/**
 * YAML configuration loading.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.workerpool.infrastructure.config.OrchestratorConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.workerpool.infrastructure.config.ConfigLoader} - YAML loading from file, classpath or stream</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code pool} - instance bounds, recycle limits, health check cadence</li>
 *   <li>{@code strategy} - default load balancing strategy</li>
 *   <li>{@code dispatcher} - ring buffer, concurrency limit, execution timeout</li>
 *   <li>{@code retry} - attempts and exponential backoff</li>
 *   <li>{@code rateLimit} - per-caller sliding window</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.workerpool.infrastructure.config.OrchestratorConfig
 */
package fr.lapetina.workerpool.infrastructure.config;
