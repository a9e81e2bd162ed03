/**
 * Typed workforce rows and table definitions.
 *
 * <p>
 * The relational store is the system of record; these classes are plain value holders that flow
 * between the codecs, the validator and the writer.
 * </p>
 */
package io.github.yok.hirelink.model;
