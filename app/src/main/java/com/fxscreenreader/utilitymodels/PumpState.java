package com.fxscreenreader.utilitymodels;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Pump mode flags
 * Should not be used directly, but thru an EnumSet<PumpState>
 */
public enum PumpState {
	// CamAPS FX main screen modes
	AUTO_MODE("auto mode", "auto-modus", "mode auto"),
	BOOST("boost"),
	EASE_OFF("ease-off", "ease off");

	private final String[] markers;

	PumpState(final String... markers) {
		this.markers = markers;
	}

	public static EnumSet<PumpState> fromTexts(final List<String> texts) {
		final EnumSet<PumpState> states = EnumSet.noneOf(PumpState.class);
		for (final String text : texts) {
			final String lower = text.toLowerCase(Locale.ROOT);
			for (final PumpState state : values()) {
				for (final String marker : state.markers) {
					if (lower.contains(marker)) {
						states.add(state);
					}
				}
			}
		}
		return states;
	}
}
