package com.prism.documents.pdf;

import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.List;

/**
 * Emits a line break only where the text baseline moves by more than
 * {@code baselineThreshold}; runs sharing a baseline are joined by a space.
 */
class LineAwareTextStripper extends PDFTextStripper {

    private final float baselineThreshold;
    private Float lastBaseline;

    LineAwareTextStripper(float baselineThreshold) {
        this.baselineThreshold = baselineThreshold;
        setSortByPosition(true);
        setLineSeparator(" ");
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
        lastBaseline = null;
        super.startPage(page);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (!textPositions.isEmpty()) {
            float baseline = textPositions.get(0).getYDirAdj();
            if (lastBaseline != null && Math.abs(baseline - lastBaseline) > baselineThreshold) {
                output.write("\n");
            }
            lastBaseline = baseline;
        }
        super.writeString(text, textPositions);
    }
}
