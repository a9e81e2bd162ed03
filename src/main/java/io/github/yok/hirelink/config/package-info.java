/**
 * Configuration package for HireLink.
 *
 * <p>
 * Holds the {@code @ConfigurationProperties} classes bound from {@code application.yml}: store
 * connection, DBUnit behavior, data paths, ingestion limits and object storage.
 * </p>
 */
package io.github.yok.hirelink.config;
