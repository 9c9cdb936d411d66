package com.odebridge.model;

public final class SpeciesReference {
    public final String species;
    public final double stoichiometry;

    public SpeciesReference(String species, double stoichiometry) {
        this.species = species;
        this.stoichiometry = stoichiometry;
    }

    @Override
    public String toString() {
        return (stoichiometry == 1.0 ? "" : stoichiometry + " ") + species;
    }
}
