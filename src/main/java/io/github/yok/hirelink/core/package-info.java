/**
 * Core ingestion package for HireLink.
 *
 * <p>
 * Contains the batch validator, the transactional writer and the three ingestion paths: real-time
 * batch insert, backup/restore and historical migration. Every failure surfaces as a
 * {@link io.github.yok.hirelink.core.WorkforceException} classified by
 * {@link io.github.yok.hirelink.core.ErrorKind}.
 * </p>
 */
package io.github.yok.hirelink.core;
