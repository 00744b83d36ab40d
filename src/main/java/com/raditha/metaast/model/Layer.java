package com.raditha.metaast.model;

/**
 * Conformance layer of a node kind.
 * Declared in increasing order so that the layer of a tree is the maximum
 * ordinal over its nodes.
 */
public enum Layer {
    CORE,
    EXTENDED,
    STRUCTURAL,
    NATIVE;

    /**
     * Return the higher of two layers.
     */
    public Layer max(Layer other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
