/**
 * In-memory tabular dataset abstraction and its CSV reader.
 */
package io.github.yok.flexpipeline.dataset;
