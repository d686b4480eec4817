package com.fxscreenreader.services;

import com.fxscreenreader.models.JoH;

/**
 * Waits for the observed application to settle after an action.
 */
public interface Sleeper {

    Sleeper REAL = JoH::threadSleep;

    void sleep(long millis);
}
