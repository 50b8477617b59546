/**
 * Ultra comparison - side-by-side aggregation of per-runner ultra-race analyses.
 *
 * <p>Given analyses computed independently for each runner (fatigue progression, course
 * segment performance, detected rest periods), the engine aligns rest stops across runners,
 * picks one representative stop per runner, ranks the hardest segments and derives per-runner
 * summary figures. Missing or malformed data for one runner never prevents the comparison of
 * the others.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ultra.comparison.pipeline.ComparisonPipeline} - Main entry point</li>
 *   <li>{@link fr.lapetina.ultra.comparison.UltraComparisonApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ComparisonPipeline pipeline = ComparisonPipeline.withDefaults();
 * ComparisonReport report = pipeline.compare(
 *         ComparisonRequest.of("runner-1", "runner-2"),
 *         analysesJson);
 * report.restClusters().forEach(row -> System.out.println(row.meanMile() + " " + row.aidStation()));
 * }</pre>
 *
 * @see fr.lapetina.ultra.comparison.pipeline.ComparisonPipeline
 */
package fr.lapetina.ultra.comparison;
