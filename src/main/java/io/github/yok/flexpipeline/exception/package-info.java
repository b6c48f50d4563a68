/**
 * Exceptions raised by the pipeline.
 *
 * <p>
 * Gating errors ({@code ConfigurationException}, {@code SourceUnreadableException},
 * {@code RuleViolationException}) abort the run; {@code ProjectionBuildException} is confined to
 * the failing projection.
 * </p>
 */
package io.github.yok.flexpipeline.exception;
