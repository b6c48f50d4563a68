/**
 * Pipeline stages and their orchestration.
 *
 * <p>
 * {@link io.github.yok.flexpipeline.core.PipelineOrchestrator} runs
 * {@link io.github.yok.flexpipeline.core.SchemaValidator},
 * {@link io.github.yok.flexpipeline.core.DeduplicationEngine},
 * {@link io.github.yok.flexpipeline.core.RuleValidator} and
 * {@link io.github.yok.flexpipeline.core.ProjectionBuilder} in order and hands every artifact to
 * {@link io.github.yok.flexpipeline.core.ExportReporter}.
 * </p>
 */
package io.github.yok.flexpipeline.core;
