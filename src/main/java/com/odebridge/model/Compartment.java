package com.odebridge.model;

public final class Compartment {
    public final String id;
    public final double size;
    public final int spatialDimensions;

    public Compartment(String id, double size) {
        this.id = id;
        this.size = size;
        this.spatialDimensions = 3;
    }

    @Override
    public String toString() {
        return "Compartment{" + id + ", size=" + size + "}";
    }
}
