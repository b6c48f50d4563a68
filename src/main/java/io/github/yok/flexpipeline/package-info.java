/**
 * FlexPipeline: configuration-driven validation, deduplication and projection of CSV data.
 */
package io.github.yok.flexpipeline;
