package com.enterprise.sheetconvert.extraction.pdf;

import com.enterprise.sheetconvert.extraction.TransientExtractionException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Renders PDF pages to grayscale PNG for the recognition fallback. A page whose image
 * exceeds the size limit is rendered again at a lower resolution.
 */
public class PageRasterizer {

    private static final Logger log = LoggerFactory.getLogger(PageRasterizer.class);

    public static final int DEFAULT_DPI = 200;
    public static final int MIN_DPI = 72;

    // synchronous AnalyzeDocument rejects larger images
    public static final long MAX_IMAGE_BYTES = 5L * 1024 * 1024;

    private final int dpi;
    private final long maxImageBytes;

    public PageRasterizer(int dpi) {
        this(dpi, MAX_IMAGE_BYTES);
    }

    PageRasterizer(int dpi, long maxImageBytes) {
        if (dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive: " + dpi);
        }
        this.dpi = dpi;
        this.maxImageBytes = maxImageBytes;
    }

    /**
     * Steps the resolution down by a quarter at a time, never below {@link #MIN_DPI},
     * until the encoded image fits. The last rendering is returned even if it does not.
     *
     * @param pageNumber 1-based
     * @throws TransientExtractionException when the JVM runs out of memory rendering the page
     */
    public RenderedPage render(PDDocument document, int pageNumber) throws IOException {
        PDRectangle box = document.getPage(pageNumber - 1).getCropBox();
        PDFRenderer renderer = new PDFRenderer(document);
        int current = dpi;
        while (true) {
            byte[] png = encode(renderer, pageNumber, current);
            if (png.length <= maxImageBytes || current <= MIN_DPI) {
                if (png.length > maxImageBytes) {
                    log.warn("Page {} is {} bytes at {} dpi, above the {} byte image limit",
                            pageNumber, png.length, current, maxImageBytes);
                }
                return new RenderedPage(pageNumber, png, box.getWidth(), box.getHeight(), current);
            }
            int lower = Math.max(MIN_DPI, current * 3 / 4);
            log.debug("Page {} is {} bytes at {} dpi, rendering again at {} dpi", pageNumber, png.length, current, lower);
            current = lower;
        }
    }

    private static byte[] encode(PDFRenderer renderer, int pageNumber, int dpi) throws IOException {
        BufferedImage image;
        try {
            image = renderer.renderImageWithDPI(pageNumber - 1, dpi, ImageType.GRAY);
        } catch (OutOfMemoryError e) {
            throw new TransientExtractionException("Out of memory rendering page " + pageNumber + " at " + dpi + " dpi", e);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    public int dpi() {
        return dpi;
    }

    /**
     * A page image plus the page size in points, so recognised boxes can be mapped back.
     */
    public static final class RenderedPage {

        private final int pageNumber;
        private final byte[] png;
        private final float widthPt;
        private final float heightPt;
        private final int dpi;

        RenderedPage(int pageNumber, byte[] png, float widthPt, float heightPt, int dpi) {
            this.pageNumber = pageNumber;
            this.png = png;
            this.widthPt = widthPt;
            this.heightPt = heightPt;
            this.dpi = dpi;
        }

        public int pageNumber() {
            return pageNumber;
        }

        public byte[] png() {
            return png;
        }

        public float widthPt() {
            return widthPt;
        }

        public float heightPt() {
            return heightPt;
        }

        /** Resolution the image was finally rendered at. */
        public int dpi() {
            return dpi;
        }
    }
}
