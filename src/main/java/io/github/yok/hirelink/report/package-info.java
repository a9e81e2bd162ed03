/**
 * Reporting package for HireLink.
 *
 * <p>
 * Read-only aggregates over hired employees, kept apart from the ingestion paths.
 * </p>
 */
package io.github.yok.hirelink.report;
