package org.nowstart.cadence.signal.core;

public interface SignalSource {

    String name();

    Signal produceSignal();
}
