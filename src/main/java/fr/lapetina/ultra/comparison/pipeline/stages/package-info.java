/**
 * Pipeline stages, in execution order.
 *
 * <ol>
 *   <li>{@link fr.lapetina.ultra.comparison.pipeline.stages.AnalysisIngestor} - Request validation
 *       and normalization of producer field names</li>
 *   <li>{@link fr.lapetina.ultra.comparison.pipeline.stages.RestPeriodClusterer} - Greedy alignment
 *       of rest events into aid-station clusters</li>
 *   <li>{@link fr.lapetina.ultra.comparison.pipeline.stages.SegmentAggregator} - Critical segments
 *       and the aligned segment table</li>
 *   <li>{@link fr.lapetina.ultra.comparison.pipeline.stages.SummaryStatsBuilder} - Per-runner
 *       summary figures with sentinel defaults</li>
 *   <li>{@link fr.lapetina.ultra.comparison.pipeline.stages.ComparisonReportAssembler} - Runs the
 *       {@link fr.lapetina.ultra.comparison.pipeline.stages.RestSelector} per cluster and builds
 *       the report</li>
 * </ol>
 *
 * <h2>Fault isolation</h2>
 * <p>Only the ingestor may reject a request. Every later stage accepts any ingested analysis,
 * including the absent stand-ins, without throwing.
 */
package fr.lapetina.ultra.comparison.pipeline.stages;
