/**
 * Transformations configuration store.
 *
 * <p>
 * Reads the per-entity YAML file (source, settings, validations, projections) and turns each entity
 * into a validated {@link io.github.yok.flexpipeline.model.EntitySpec}. Configuration errors are
 * raised here, before any pipeline stage runs.
 * </p>
 */
package io.github.yok.flexpipeline.store;
