package org.marionette.compiler.api;

/**
 * Handle of a declared resource inside one compilation.
 *
 * @param index Position of the resource in declaration order.
 */
public record NodeId(int index) {}
