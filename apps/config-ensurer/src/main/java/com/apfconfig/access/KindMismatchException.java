package com.apfconfig.access;

public class KindMismatchException extends ConfigurationException {

    public KindMismatchException(String expected, Object actual) {
        super("object is not a " + expected + " type: "
                + (actual == null ? "<null>" : actual.getClass().getSimpleName()));
    }
}
