package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.UiNode;
import com.fxscreenreader.models.UserError;

/**
 * Locates interactive elements by their keyword tables. A null result means the element is not
 * available this cycle.
 */
public class ElementFinder {

    private static final String TAG = ElementFinder.class.getSimpleName();

    public static final int MAX_DEPTH = 20;

    private ElementFinder() {
    }

    public static UiNode find(final UiNode root, final ElementType type) {
        if (root == null) return null;
        if (type.isDeepestMatch()) {
            final Deepest deepest = new Deepest();
            findDeepest(root, type, 0, deepest);
            if (deepest.node != null) {
                UserError.Log.d(TAG, type + " found at depth " + deepest.depth);
            }
            return deepest.node;
        }
        return findFirst(root, type, 0);
    }

    public static boolean isPresent(final UiNode root, final ElementType type) {
        return find(root, type) != null;
    }

    private static UiNode findFirst(final UiNode node, final ElementType type, final int depth) {
        if (node == null || depth > type.getMaxDepth()) return null;
        if (type.matches(node)) return node;
        for (final UiNode child : node.getChildren()) {
            final UiNode found = findFirst(child, type, depth + 1);
            if (found != null) return found;
        }
        return null;
    }

    private static final class Deepest {
        UiNode node;
        int depth = -1;
    }

    // strictly deeper replaces, so ties keep the first encountered
    private static void findDeepest(final UiNode node, final ElementType type, final int depth, final Deepest best) {
        if (node == null || depth > type.getMaxDepth()) return;
        if (type.matches(node) && depth > best.depth) {
            best.node = node;
            best.depth = depth;
        }
        for (final UiNode child : node.getChildren()) {
            findDeepest(child, type, depth + 1, best);
        }
    }
}
