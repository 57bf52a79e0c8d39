package com.examparse.core.processor.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks a page's content stream and keeps the vector primitives that look like underlines:
 * stroked horizontal lines and thin rectangles, filled or stroked.
 */
@Slf4j
class UnderlineCollector extends PDFGraphicsStreamEngine {

    static final float MAX_LINE_SLOPE = 1.0f;
    static final float MAX_RECT_HEIGHT = 2.0f;
    static final float MIN_WIDTH = 3.0f;

    private final float pageHeight;
    private final float originX;
    private final float originY;

    private final List<UnderlineSegment> segments = new ArrayList<>();
    private final List<Point2D[]> pathLines = new ArrayList<>();
    private final List<Rectangle2D> pathRects = new ArrayList<>();
    private Point2D currentPoint;
    private Point2D subpathStart;

    UnderlineCollector(PDPage page) {
        super(page);
        PDRectangle cropBox = page.getCropBox();
        this.pageHeight = cropBox.getHeight();
        this.originX = cropBox.getLowerLeftX();
        this.originY = cropBox.getLowerLeftY();
    }

    /**
     * Underline candidates of the page. Any parsing problem yields an empty list.
     */
    List<UnderlineSegment> collect() {
        try {
            processPage(getPage());
            return List.copyOf(segments);
        } catch (IOException | RuntimeException e) {
            log.debug("[PDF] Underline scan failed, continuing without markers | error={}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {
        Rectangle2D rect = new Rectangle2D.Double(p0.getX(), p0.getY(), 0, 0);
        rect.add(p1);
        rect.add(p2);
        rect.add(p3);
        pathRects.add(rect);
        currentPoint = p0;
        subpathStart = p0;
    }

    @Override
    public void moveTo(float x, float y) {
        currentPoint = new Point2D.Float(x, y);
        subpathStart = currentPoint;
    }

    @Override
    public void lineTo(float x, float y) {
        Point2D next = new Point2D.Float(x, y);
        if (currentPoint != null) {
            pathLines.add(new Point2D[]{currentPoint, next});
        }
        currentPoint = next;
    }

    @Override
    public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {
        currentPoint = new Point2D.Float(x3, y3);
    }

    @Override
    public Point2D getCurrentPoint() {
        return currentPoint;
    }

    @Override
    public void closePath() {
        if (currentPoint != null && subpathStart != null) {
            pathLines.add(new Point2D[]{currentPoint, subpathStart});
            currentPoint = subpathStart;
        }
    }

    @Override
    public void endPath() {
        clearPath();
    }

    @Override
    public void strokePath() {
        for (Point2D[] line : pathLines) {
            addLine(line[0], line[1]);
        }
        pathRects.forEach(this::addThinRectangle);
        clearPath();
    }

    @Override
    public void fillPath(int windingRule) {
        pathRects.forEach(this::addThinRectangle);
        clearPath();
    }

    @Override
    public void fillAndStrokePath(int windingRule) {
        strokePath();
    }

    @Override
    public void clip(int windingRule) {
        // clipping paths are not drawn
    }

    @Override
    public void drawImage(PDImage pdImage) {
    }

    @Override
    public void shadingFill(COSName shadingName) {
    }

    private void addLine(Point2D a, Point2D b) {
        if (Math.abs(a.getY() - b.getY()) > MAX_LINE_SLOPE) {
            return;
        }
        double width = Math.abs(a.getX() - b.getX());
        if (width < MIN_WIDTH) {
            return;
        }
        double y = (a.getY() + b.getY()) / 2;
        segments.add(toSegment(Math.min(a.getX(), b.getX()), Math.max(a.getX(), b.getX()), y));
    }

    private void addThinRectangle(Rectangle2D rect) {
        if (rect.getHeight() <= MAX_RECT_HEIGHT && rect.getWidth() >= MIN_WIDTH) {
            segments.add(toSegment(rect.getMinX(), rect.getMaxX(), rect.getCenterY()));
        }
    }

    private UnderlineSegment toSegment(double minX, double maxX, double pdfY) {
        return new UnderlineSegment(
            (float) (minX - originX),
            (float) (maxX - originX),
            (float) (pageHeight - (pdfY - originY)));
    }

    private void clearPath() {
        pathLines.clear();
        pathRects.clear();
        currentPoint = null;
        subpathStart = null;
    }
}
