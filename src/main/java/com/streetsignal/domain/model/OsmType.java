package com.streetsignal.domain.model;

/**
 * OpenStreetMap element type. Nodes are points, ways and relations are areas
 * whose position is reported as a centre.
 */
public enum OsmType {
    node,
    way,
    relation;

    public boolean isArea() {
        return this != node;
    }
}
