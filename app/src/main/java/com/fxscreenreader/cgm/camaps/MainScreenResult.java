package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.GlucoseReading;
import com.fxscreenreader.utilitymodels.PumpState;

import java.util.EnumSet;

import lombok.Value;

/**
 * Outcome of reading the main screen: either a reading or the reason it was refused.
 */
@Value
public class MainScreenResult {

    public enum Category {
        // not the main screen of the expected application
        IDENTITY,
        // the screen is right but the value must not be used
        SAFETY
    }

    public enum Rejection {
        NO_UNIT(Category.IDENTITY),
        NO_INFO_BUTTON(Category.IDENTITY),
        NO_APP_MARKER(Category.IDENTITY),
        SIGNAL_LOSS(Category.SAFETY),
        NO_VALUE(Category.SAFETY),
        OUT_OF_RANGE(Category.SAFETY);

        private final Category category;

        Rejection(final Category category) {
            this.category = category;
        }

        public Category getCategory() {
            return category;
        }
    }

    GlucoseReading reading;
    Rejection rejection;
    EnumSet<PumpState> pumpStates;

    static MainScreenResult accepted(final GlucoseReading reading, final EnumSet<PumpState> pumpStates) {
        return new MainScreenResult(reading, null, pumpStates);
    }

    static MainScreenResult rejected(final Rejection rejection) {
        return new MainScreenResult(null, rejection, EnumSet.noneOf(PumpState.class));
    }

    public boolean isAccepted() {
        return reading != null;
    }

    public boolean isSafetyRejection() {
        return rejection != null && rejection.getCategory() == Category.SAFETY;
    }
}
