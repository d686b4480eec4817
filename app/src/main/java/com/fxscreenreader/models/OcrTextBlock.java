package com.fxscreenreader.models;

import lombok.Value;

/**
 * Recognised text with its bounding box in screenshot pixels.
 */
@Value
public class OcrTextBlock {
    String text;
    int left;
    int top;
    int right;
    int bottom;

    public int centerX() {
        return (left + right) / 2;
    }
}
