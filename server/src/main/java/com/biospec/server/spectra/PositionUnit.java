package com.biospec.server.spectra;

public enum PositionUnit {
    PIXEL,
    NANOMETER
}
