/**
 * Small shared helpers: fatal error reporting and CSV writing.
 */
package io.github.yok.flexpipeline.util;
