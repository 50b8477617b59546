/**
 * Configuration loading.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, worker threads)</li>
 *   <li>{@code clustering} - Rest clustering mile variance threshold</li>
 *   <li>{@code segments} - Number of critical segments reported</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.ultra.comparison.infrastructure.config.ConfigLoader
 */
package fr.lapetina.ultra.comparison.infrastructure.config;
