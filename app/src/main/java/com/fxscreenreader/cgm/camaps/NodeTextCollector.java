package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.UiNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a node tree into its visible strings, parent before children, text before description.
 */
public class NodeTextCollector {

    public static final int MAX_DEPTH = 20;

    private NodeTextCollector() {
    }

    public static List<String> collect(final UiNode root) {
        return collect(root, MAX_DEPTH);
    }

    public static List<String> collect(final UiNode root, final int maxDepth) {
        final List<String> output = new ArrayList<>();
        getTexts(output, root, 0, maxDepth);
        return output;
    }

    private static void getTexts(final List<String> output, final UiNode node, final int depth, final int maxDepth) {
        if (node == null || depth > maxDepth) return;
        addIfPresent(output, node.getText());
        addIfPresent(output, node.getContentDescription());
        for (final UiNode child : node.getChildren()) {
            getTexts(output, child, depth + 1, maxDepth);
        }
    }

    private static void addIfPresent(final List<String> output, final String value) {
        if (value != null && !value.trim().isEmpty()) {
            output.add(value);
        }
    }
}
