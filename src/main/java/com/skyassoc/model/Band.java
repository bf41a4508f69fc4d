package com.skyassoc.model;

/** Photometric bands carrying per-band counters on a DIA object. */
public enum Band {
    U("u"), G("g"), R("r"), I("i"), Z("z"), Y("y");

    private final String letter;

    Band(String letter) {
        this.letter = letter;
    }

    public String letter() {
        return letter;
    }

    /** Column name of the per-band PSF flux measurement count, e.g. {@code gPSFluxNdata}. */
    public String psFluxNdataColumn() {
        return letter + "PSFluxNdata";
    }
}
