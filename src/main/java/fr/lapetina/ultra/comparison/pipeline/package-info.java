/**
 * Synchronous comparison pipeline.
 *
 * <p>A comparison is a pure function of the selection and the raw analyses: every call builds
 * its own intermediate structures and discards them once the report is assembled.
 *
 * @see fr.lapetina.ultra.comparison.pipeline.stages
 */
package fr.lapetina.ultra.comparison.pipeline;
