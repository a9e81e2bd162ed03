/**
 * Request parsing package for HireLink.
 *
 * <p>
 * Turns the JSON batch-insert document into nullable request rows with Jackson.
 * </p>
 */
package io.github.yok.hirelink.parser;
