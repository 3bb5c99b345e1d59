package com.raditha.smells.model;

/**
 * A declared parameter.
 *
 * @param name             Parameter name ("this" for a receiver parameter)
 * @param position         Zero-based position in the declaration
 * @param implicitReceiver True for Java's explicit receiver parameter
 *                         ({@code void m(Foo this, ...)})
 */
public record ParameterDef(String name, int position, boolean implicitReceiver) {
}
