/**
 * Projection expression grammar: tokenizer, parser and the structured query rendered to SQL with
 * quoted identifiers.
 */
package io.github.yok.flexpipeline.engine.query;
