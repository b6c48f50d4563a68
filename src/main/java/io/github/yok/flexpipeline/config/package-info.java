/**
 * Application configuration models for FlexPipeline.
 *
 * <p>
 * Defines classes bound from {@code application.yml}: output paths, query engine connection,
 * DBUnit settings and pipeline tuning. The per-entity transformations file is read separately by
 * {@code io.github.yok.flexpipeline.store}.
 * </p>
 */
package io.github.yok.flexpipeline.config;
