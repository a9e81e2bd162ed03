/**
 * Row codecs for HireLink.
 *
 * <p>
 * {@link io.github.yok.hirelink.codec.AvroSnapshotCodec} writes and reads the binary backup
 * format; {@link io.github.yok.hirelink.codec.TabularCsvCodec} reads historical CSV files.
 * Neither performs I/O beyond in-memory buffers.
 * </p>
 */
package io.github.yok.hirelink.codec;
