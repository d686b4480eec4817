package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.UiNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Interactive elements the collector needs, each described by keyword tables in German, English and French.
 * All comparisons are case-insensitive; only clickable nodes qualify.
 */
public enum ElementType {

    INFO_BUTTON(
            list("info", "information", "hilfe", "help", "aide", "detail"),
            list("info"),
            list("i"),
            list("info"),
            ElementFinder.MAX_DEPTH, false),

    CLOSE_BUTTON(
            list("close", "schließen", "fermer", "zurück", "back", "retour", "quittieren", "acknowledge",
                    "confirmer", "ablehnen", "dismiss", "rejeter", "geschlossene optionen", "closed options",
                    "options fermées"),
            list("schließen", "close", "fermer", "quittieren", "ok"),
            list("x", "×"),
            list("close", "back"),
            ElementFinder.MAX_DEPTH, false),

    MENU_BUTTON(
            list("menu", "menü", "navigation", "hamburger", "drawer", "open drawer", "ouvrir le tiroir", "öffnen",
                    "open", "ouvrir", "offene optionen", "open options", "options ouvertes", "optionen", "options"),
            list("☰", "≡"),
            list(),
            list("menu", "burger", "drawer", "navigation"),
            15, false),

    BACK_BUTTON(
            list("back", "zurück", "navigate up", "nach oben", "revenir"),
            list("←", "back"),
            list(),
            list("back", "up"),
            15, false),

    // acknowledge buttons of alarms and notices covering the main screen
    ALERT_DISMISS_BUTTON(
            list("quittieren", "acknowledge", "ablehnen", "dismiss", "verstanden", "understood", "compris"),
            list("quittieren", "ablehnen", "schließen", "verstanden", "understood", "compris", "dismiss"),
            list("ok"),
            list("dismiss", "acknowledge"),
            ElementFinder.MAX_DEPTH, false),

    // several icons can carry "rotate" labels; the innermost one is the actual button
    ROTATE_BUTTON(
            list("bildschirm drehen", "rotate screen", "rotation écran", "rotate", "landscape", "querformat", "paysage"),
            list("bildschirm drehen", "rotate screen"),
            list(),
            list("rotate", "landscape"),
            ElementFinder.MAX_DEPTH, true);

    private final List<String> descriptionKeywords;
    private final List<String> textKeywords;
    private final List<String> exactTexts;
    private final List<String> viewIdKeywords;
    private final int maxDepth;
    private final boolean deepestMatch;

    ElementType(final List<String> descriptionKeywords, final List<String> textKeywords, final List<String> exactTexts,
                final List<String> viewIdKeywords, final int maxDepth, final boolean deepestMatch) {
        this.descriptionKeywords = descriptionKeywords;
        this.textKeywords = textKeywords;
        this.exactTexts = exactTexts;
        this.viewIdKeywords = viewIdKeywords;
        this.maxDepth = maxDepth;
        this.deepestMatch = deepestMatch;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isDeepestMatch() {
        return deepestMatch;
    }

    public boolean matches(final UiNode node) {
        if (node == null || !node.isClickable()) return false;
        final String desc = lower(node.getContentDescription());
        final String text = lower(node.getText());
        final String viewId = lower(node.getViewIdResourceName());
        return containsAny(desc, descriptionKeywords)
                || containsAny(text, textKeywords)
                || exactTexts.contains(text.trim())
                || containsAny(viewId, viewIdKeywords);
    }

    private static boolean containsAny(final String value, final List<String> keywords) {
        if (value.isEmpty()) return false;
        for (final String keyword : keywords) {
            if (value.contains(keyword)) return true;
        }
        return false;
    }

    private static String lower(final String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static List<String> list(final String... values) {
        return Collections.unmodifiableList(Arrays.asList(values));
    }
}
