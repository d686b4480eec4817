package com.fxscreenreader.services;

import com.fxscreenreader.models.UiNode;

import java.awt.image.BufferedImage;

/**
 * UI automation host: gives access to the foreground window and performs actions on it.
 */
public interface UiHost {

    /**
     * Current tree of the active window, or null when none is available.
     */
    UiNode getRootInActiveWindow();

    boolean click(UiNode node);

    boolean performGlobalBack();

    /**
     * @return the screen contents, or null when capture failed
     */
    BufferedImage takeScreenshot();
}
