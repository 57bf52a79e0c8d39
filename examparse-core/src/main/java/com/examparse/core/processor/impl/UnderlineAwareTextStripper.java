package com.examparse.core.processor.impl;

import com.examparse.llm.prompt.ExtractionPrompts;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Text stripper that wraps underlined runs in {@code [[u]]...[[/u]]}.
 *
 * <p>A run is a whitespace-delimited sequence of glyphs. It counts as underlined when one of the
 * page's {@link UnderlineSegment}s lies just under its baseline and covers more than half its width.
 */
class UnderlineAwareTextStripper extends PDFTextStripper {

    static final float MAX_ABOVE_BASELINE = 1.5f;
    static final float MAX_BELOW_BASELINE = 5.0f;
    static final float MIN_OVERLAP_RATIO = 0.5f;

    private final List<UnderlineSegment> segments;

    UnderlineAwareTextStripper(List<UnderlineSegment> segments) {
        this.segments = segments;
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (segments.isEmpty() || textPositions == null || textPositions.isEmpty()) {
            super.writeString(text, textPositions);
            return;
        }

        StringBuilder glyphText = new StringBuilder();
        textPositions.forEach(tp -> glyphText.append(tp.getUnicode()));
        if (!glyphText.toString().equals(text)) {
            // normalised or reordered text, judge the word as a whole
            writeString(isUnderlined(textPositions) ? wrap(text) : text);
            return;
        }

        StringBuilder out = new StringBuilder();
        List<TextPosition> run = new ArrayList<>();
        StringBuilder runText = new StringBuilder();
        for (TextPosition position : textPositions) {
            String unicode = position.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                flushRun(out, run, runText);
                out.append(unicode == null ? "" : unicode);
            } else {
                run.add(position);
                runText.append(unicode);
            }
        }
        flushRun(out, run, runText);
        writeString(out.toString());
    }

    private void flushRun(StringBuilder out, List<TextPosition> run, StringBuilder runText) {
        if (run.isEmpty()) {
            return;
        }
        out.append(isUnderlined(run) ? wrap(runText.toString()) : runText);
        run.clear();
        runText.setLength(0);
    }

    private boolean isUnderlined(List<TextPosition> run) {
        float minX = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        float baseline = 0;
        for (TextPosition tp : run) {
            minX = Math.min(minX, tp.getXDirAdj());
            maxX = Math.max(maxX, tp.getXDirAdj() + tp.getWidthDirAdj());
            baseline = Math.max(baseline, tp.getYDirAdj());
        }
        float spanWidth = maxX - minX;
        if (spanWidth <= 0) {
            return false;
        }

        for (UnderlineSegment segment : segments) {
            float dy = segment.getY() - baseline;
            if (dy < -MAX_ABOVE_BASELINE || dy > MAX_BELOW_BASELINE) {
                continue;
            }
            float overlap = Math.min(maxX, segment.getMaxX()) - Math.max(minX, segment.getMinX());
            if (overlap > spanWidth * MIN_OVERLAP_RATIO) {
                return true;
            }
        }
        return false;
    }

    private static String wrap(String text) {
        return ExtractionPrompts.UNDERLINE_START + text + ExtractionPrompts.UNDERLINE_END;
    }
}
