/**
 * Utility package for HireLink.
 *
 * <p>
 * Provides stateless helpers used across the project: ISO-8601 timestamp parsing and formatting,
 * SQLState classification, and CLI error reporting.
 * </p>
 */
package io.github.yok.hirelink.util;
