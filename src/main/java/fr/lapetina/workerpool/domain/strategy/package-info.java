/**
 * Load balancing strategies for picking a worker instance.
 *
 * <p>Strategies only see eligible instances (idle and {@code HEALTHY}); the
 * {@link fr.lapetina.workerpool.domain.strategy.LoadBalancer} filters candidates and
 * is invoked by the pool manager while it holds its lock.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th><th>Best For</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Shared cursor modulo eligible count</td><td>Homogeneous workers</td></tr>
 *   <tr><td>{@code least-connections}</td><td>Fewest in-flight jobs</td><td>Uneven job durations</td></tr>
 *   <tr><td>{@code weighted-random}</td><td>Random draw proportional to weight</td><td>Heterogeneous capacities</td></tr>
 *   <tr><td>{@code response-time}</td><td>Lowest average latency</td><td>Latency-sensitive traffic</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LoadBalancer balancer = new LoadBalancer("least-connections");
 * WorkerInstance instance = pool.acquire(Duration.ofSeconds(30), balancer.selector("response-time"));
 * }</pre>
 *
 * @see fr.lapetina.workerpool.domain.strategy.LoadBalancingStrategy
 * @see fr.lapetina.workerpool.domain.strategy.StrategyFactory
 */
package fr.lapetina.workerpool.domain.strategy;
