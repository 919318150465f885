package io.github.jakubt4.transitfinder.ephemeris;

import org.hipparchus.ode.events.Action;
import org.orekit.propagation.SpacecraftState;
import org.orekit.propagation.events.EventDetector;
import org.orekit.propagation.events.handlers.EventHandler;
import org.orekit.time.AbsoluteDate;

import java.util.ArrayList;
import java.util.List;

/**
 * Records horizon crossings reported by an elevation detector and keeps propagating.
 * One instance per propagation run; not thread-safe.
 */
class HorizonCrossingHandler implements EventHandler {

    record Crossing(AbsoluteDate date, boolean rising) {
    }

    private final List<Crossing> crossings = new ArrayList<>();

    @Override
    public Action eventOccurred(final SpacecraftState s, final EventDetector detector, final boolean increasing) {
        crossings.add(new Crossing(s.getDate(), increasing));
        return Action.CONTINUE;
    }

    @Override
    public SpacecraftState resetState(final EventDetector detector, final SpacecraftState oldState) {
        return oldState;
    }

    List<Crossing> crossings() {
        return List.copyOf(crossings);
    }
}
