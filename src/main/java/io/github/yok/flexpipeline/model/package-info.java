/**
 * Immutable domain model of a pipeline run.
 *
 * <p>
 * Defines the entity definition ({@link io.github.yok.flexpipeline.model.EntitySpec}) built from
 * the transformations configuration, the dataset row type, and the error and removal records
 * produced by each stage.
 * </p>
 */
package io.github.yok.flexpipeline.model;
