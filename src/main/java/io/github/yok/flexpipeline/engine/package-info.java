/**
 * Query engine abstraction and its embedded H2 implementation.
 */
package io.github.yok.flexpipeline.engine;
