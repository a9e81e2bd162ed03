/**
 * Storage package for HireLink.
 *
 * <p>
 * {@link io.github.yok.hirelink.storage.ObjectStorage} reads historical CSV objects from Amazon S3
 * or a local directory. {@link io.github.yok.hirelink.storage.ArtifactStore} keeps backup
 * artifacts on the file system.
 * </p>
 */
package io.github.yok.hirelink.storage;
