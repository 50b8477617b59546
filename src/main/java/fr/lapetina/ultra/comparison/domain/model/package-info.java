/**
 * Immutable domain types.
 *
 * <p>Ingested types ({@link fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis} and its
 * sections) never carry producer field names; derived types
 * ({@link fr.lapetina.ultra.comparison.domain.model.RestCluster},
 * {@link fr.lapetina.ultra.comparison.domain.model.ComparisonReport}, ...) live for one request.
 */
package fr.lapetina.ultra.comparison.domain.model;
