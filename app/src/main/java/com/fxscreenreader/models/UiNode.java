package com.fxscreenreader.models;

import java.util.List;

/**
 * Snapshot of one element of the foreground application's accessibility tree.
 * Nodes carry no identity between polling cycles.
 */
public interface UiNode {

    String getText();

    String getContentDescription();

    String getClassName();

    String getViewIdResourceName();

    boolean isClickable();

    /**
     * Ordered children, never null.
     */
    List<UiNode> getChildren();
}
