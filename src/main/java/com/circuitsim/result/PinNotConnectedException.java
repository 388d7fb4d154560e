package com.circuitsim.result;

import java.util.List;

/** The component was not part of the circuit when its nodes were resolved. */
public class PinNotConnectedException extends ResultLookupException {
    public PinNotConnectedException(String pin, List<String> knownComponents) {
        super("Pin " + pin + " is not part of the resolved circuit", pin, knownComponents);
    }
}
