package com.fxscreenreader.services;

import com.fxscreenreader.models.OcrTextBlock;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;

/**
 * Text recognition over a screenshot. Blocks come back in no particular order.
 */
public interface OcrEngine {

    List<OcrTextBlock> recognize(BufferedImage image) throws IOException;
}
