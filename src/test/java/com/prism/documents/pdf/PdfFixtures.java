package com.prism.documents.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Builds small PDFs in memory for extraction and rendering tests.
 */
public final class PdfFixtures {

    private PdfFixtures() {
    }

    /**
     * One page per entry; each string in a page is written on its own line.
     */
    public static byte[] textPdf(List<List<String>> pages) {
        try (PDDocument document = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (List<String> lines : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(font, 12);
                    content.newLineAtOffset(72, 700);
                    for (String line : lines) {
                        content.showText(line);
                        content.newLineAtOffset(0, -20);
                    }
                    content.endText();
                }
            }
            return save(document);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Pages carrying only vector graphics, no text layer.
     */
    public static byte[] graphicsOnlyPdf(int pageCount) {
        try (PDDocument document = new PDDocument()) {
            for (int i = 0; i < pageCount; i++) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.setNonStrokingColor(Color.DARK_GRAY);
                    content.addRect(100, 100, 300, 400);
                    content.fill();
                }
            }
            return save(document);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Two pages with embedded images. Page 1 holds a 240x160 diagram and a
     * 40x40 icon. Page 2 holds a second copy of the same diagram, then a
     * distinct 150x220 chart.
     */
    public static byte[] embeddedImagesPdf() {
        try (PDDocument document = new PDDocument()) {
            BufferedImage diagram = filledImage(240, 160, Color.BLUE);
            BufferedImage icon = filledImage(40, 40, Color.RED);
            BufferedImage chart = filledImage(150, 220, Color.GREEN);

            PDPage first = new PDPage(PDRectangle.LETTER);
            document.addPage(first);
            try (PDPageContentStream content = new PDPageContentStream(document, first)) {
                content.drawImage(LosslessFactory.createFromImage(document, diagram), 72, 500);
                content.drawImage(LosslessFactory.createFromImage(document, icon), 72, 700);
            }

            PDPage second = new PDPage(PDRectangle.LETTER);
            document.addPage(second);
            try (PDPageContentStream content = new PDPageContentStream(document, second)) {
                PDImageXObject copy = LosslessFactory.createFromImage(document, diagram);
                content.drawImage(copy, 72, 500);
                content.drawImage(LosslessFactory.createFromImage(document, chart), 72, 200);
            }
            return save(document);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] numberedPdf(int pageCount) {
        return textPdf(java.util.stream.IntStream.rangeClosed(1, pageCount)
            .mapToObj(i -> List.of("Page " + i + " of the maintenance guide"))
            .toList());
    }

    private static BufferedImage filledImage(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, width, height);
            graphics.setColor(color);
            graphics.fillRect(10, 10, width - 20, height - 20);
        } finally {
            graphics.dispose();
        }
        return image;
    }

    private static byte[] save(PDDocument document) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        return out.toByteArray();
    }
}
