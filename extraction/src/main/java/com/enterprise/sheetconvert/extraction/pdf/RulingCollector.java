package com.enterprise.sheetconvert.extraction.pdf;

import com.enterprise.sheetconvert.extraction.layout.Ruling;
import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks a page's content stream and records the horizontal and vertical lines it draws.
 * Stroked segments and rectangle edges count, as do filled rectangles thin enough to
 * read as a line. Coordinates are flipped to a top-left origin to match text positions.
 */
class RulingCollector extends PDFGraphicsStreamEngine {

    private static final float THIN_FILL = 2f;

    private final float originX;
    private final float originY;
    private final List<Ruling> rulings = new ArrayList<>();
    private final List<float[]> segments = new ArrayList<>();
    private final List<float[]> rectangles = new ArrayList<>();
    private Point2D.Float current = new Point2D.Float();
    private Point2D.Float subpathStart = new Point2D.Float();

    RulingCollector(PDPage page) {
        super(page);
        PDRectangle box = page.getCropBox();
        this.originX = box.getLowerLeftX();
        this.originY = box.getUpperRightY();
    }

    List<Ruling> collect() throws IOException {
        processPage(getPage());
        List<Ruling> axisAligned = new ArrayList<>();
        for (Ruling ruling : rulings) {
            if (ruling.isVertical() || ruling.isHorizontal()) {
                axisAligned.add(ruling);
            }
        }
        return axisAligned;
    }

    @Override
    public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) throws IOException {
        segments.add(segment(p0, p1));
        segments.add(segment(p1, p2));
        segments.add(segment(p2, p3));
        segments.add(segment(p3, p0));
        float minX = (float) Math.min(Math.min(p0.getX(), p1.getX()), Math.min(p2.getX(), p3.getX()));
        float maxX = (float) Math.max(Math.max(p0.getX(), p1.getX()), Math.max(p2.getX(), p3.getX()));
        float minY = (float) Math.min(Math.min(p0.getY(), p1.getY()), Math.min(p2.getY(), p3.getY()));
        float maxY = (float) Math.max(Math.max(p0.getY(), p1.getY()), Math.max(p2.getY(), p3.getY()));
        rectangles.add(new float[] { minX, minY, maxX, maxY });
        current = new Point2D.Float((float) p0.getX(), (float) p0.getY());
        subpathStart = current;
    }

    @Override
    public void moveTo(float x, float y) throws IOException {
        current = new Point2D.Float(x, y);
        subpathStart = current;
    }

    @Override
    public void lineTo(float x, float y) throws IOException {
        Point2D.Float next = new Point2D.Float(x, y);
        segments.add(segment(current, next));
        current = next;
    }

    @Override
    public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) throws IOException {
        // curves never form table rulings
        current = new Point2D.Float(x3, y3);
    }

    @Override
    public Point2D getCurrentPoint() throws IOException {
        return current;
    }

    @Override
    public void closePath() throws IOException {
        segments.add(segment(current, subpathStart));
        current = subpathStart;
    }

    @Override
    public void endPath() throws IOException {
        resetPath();
    }

    @Override
    public void strokePath() throws IOException {
        for (float[] s : segments) {
            rulings.add(toRuling(s[0], s[1], s[2], s[3]));
        }
        resetPath();
    }

    @Override
    public void fillPath(int windingRule) throws IOException {
        for (float[] r : rectangles) {
            float width = r[2] - r[0];
            float height = r[3] - r[1];
            if (width <= THIN_FILL && height > THIN_FILL) {
                float x = r[0] + (width / 2f);
                rulings.add(toRuling(x, r[1], x, r[3]));
            } else if (height <= THIN_FILL && width > THIN_FILL) {
                float y = r[1] + (height / 2f);
                rulings.add(toRuling(r[0], y, r[2], y));
            }
        }
        resetPath();
    }

    @Override
    public void fillAndStrokePath(int windingRule) throws IOException {
        List<float[]> pendingRectangles = new ArrayList<>(rectangles);
        strokePath();
        rectangles.addAll(pendingRectangles);
        fillPath(windingRule);
    }

    @Override
    public void drawImage(PDImage pdImage) throws IOException {
        // images carry no rulings
    }

    @Override
    public void clip(int windingRule) throws IOException {
        // the path that follows a clip is ended with endPath, which discards it
    }

    @Override
    public void shadingFill(COSName shadingName) throws IOException {
        // shadings carry no rulings
    }

    private void resetPath() {
        segments.clear();
        rectangles.clear();
    }

    private static float[] segment(Point2D from, Point2D to) {
        return new float[] { (float) from.getX(), (float) from.getY(), (float) to.getX(), (float) to.getY() };
    }

    private Ruling toRuling(float x1, float y1, float x2, float y2) {
        return new Ruling(x1 - originX, originY - y1, x2 - originX, originY - y2);
    }
}
