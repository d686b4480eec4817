package com.fxscreenreader.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable node used by host adapters to hand over a copied tree, and by tests.
 */
@Value
@Builder
public class SimpleUiNode implements UiNode {

    String text;
    String contentDescription;
    String className;
    String viewIdResourceName;
    boolean clickable;
    @Singular
    List<UiNode> children;

    public static SimpleUiNode text(final String text) {
        return SimpleUiNode.builder().text(text).className("android.widget.TextView").build();
    }

    public static SimpleUiNode button(final String text, final String description) {
        return SimpleUiNode.builder().text(text).contentDescription(description)
                .className("android.widget.Button").clickable(true).build();
    }

    public static SimpleUiNode group(final UiNode... children) {
        final SimpleUiNodeBuilder builder = SimpleUiNode.builder().className("android.view.ViewGroup");
        for (final UiNode child : children) {
            builder.child(child);
        }
        return builder.build();
    }
}
