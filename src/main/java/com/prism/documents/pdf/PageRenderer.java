package com.prism.documents.pdf;

import com.prism.documents.config.RenderProperties;
import com.prism.documents.exception.RenderException;
import com.prism.documents.infra.LocalFileStorage;
import com.prism.documents.model.PageImage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Rasterizes PDF pages to JPEG files under the document's image directory and
 * saves the images embedded in those pages next to them.
 * <p>
 * A page render has image index 0; embedded images are numbered from 1 in
 * the order the page lists them. Embedded images smaller than
 * {@value #MIN_EMBEDDED_SIZE} px on either side are skipped, and an image
 * whose encoded content was already saved from an earlier page is saved only
 * once. A failing page or image is skipped and never aborts the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageRenderer {

    static final String FORMAT = "jpg";
    static final int MIN_EMBEDDED_SIZE = 100;

    private final RenderProperties properties;
    private final LocalFileStorage storage;

    public List<PageImage> renderPages(UUID documentId, byte[] pdf) {
        Path outputDir = storage.imagesDir(documentId);

        try (PDDocument document = Loader.loadPDF(pdf)) {
            Files.createDirectories(outputDir);

            PDFRenderer renderer = new PDFRenderer(document);
            int pages = Math.min(document.getNumberOfPages(), properties.maxPages());
            if (document.getNumberOfPages() > pages) {
                log.info("Doc {}: rendering first {} of {} pages", documentId, pages, document.getNumberOfPages());
            }

            List<PageImage> images = new ArrayList<>(pages);
            Set<String> seenHashes = new HashSet<>();
            int renderedPages = 0;
            int embedded = 0;
            for (int pageIndex = 0; pageIndex < pages; pageIndex++) {
                try {
                    images.add(renderPage(renderer, pageIndex, outputDir));
                    renderedPages++;
                } catch (RenderException e) {
                    log.warn("Doc {}: page {} failed to render: {}", documentId, e.getPageNumber(), e.getMessage());
                }
                List<PageImage> pageImages = extractEmbedded(documentId, document, pageIndex, outputDir, seenHashes);
                images.addAll(pageImages);
                embedded += pageImages.size();
            }

            log.info("Doc {}: rendered {}/{} pages, saved {} embedded images",
                documentId, renderedPages, pages, embedded);
            return images;
        } catch (IOException e) {
            log.error("Doc {}: cannot render PDF: {}", documentId, e.getMessage());
            return List.of();
        }
    }

    public boolean deleteDocumentImages(UUID documentId) {
        return storage.deleteImagesDir(documentId);
    }

    BufferedImage rasterize(PDFRenderer renderer, int pageIndex) throws IOException {
        return renderer.renderImage(pageIndex, properties.scale(), ImageType.ARGB);
    }

    private PageImage renderPage(PDFRenderer renderer, int pageIndex, Path outputDir) {
        int pageNumber = pageIndex + 1;
        try {
            BufferedImage source = rasterize(renderer, pageIndex);
            BufferedImage opaque = onWhite(source);

            Path file = outputDir.resolve(String.format("page_%04d.%s", pageNumber, FORMAT));
            writeJpeg(opaque, file);

            return PageImage.rendered(
                pageNumber,
                file.toString(),
                opaque.getWidth(),
                opaque.getHeight(),
                FORMAT,
                Files.size(file)
            );
        } catch (IOException | RuntimeException e) {
            throw new RenderException(pageNumber, e);
        }
    }

    private List<PageImage> extractEmbedded(
        UUID documentId, PDDocument document, int pageIndex, Path outputDir, Set<String> seenHashes
    ) {
        int pageNumber = pageIndex + 1;
        PDResources resources = document.getPage(pageIndex).getResources();
        if (resources == null) {
            return List.of();
        }

        List<PageImage> extracted = new ArrayList<>();
        int imageIndex = 0;
        for (COSName name : resources.getXObjectNames()) {
            try {
                PDXObject xObject = resources.getXObject(name);
                if (!(xObject instanceof PDImageXObject image)) {
                    continue;
                }
                imageIndex++;
                if (image.getWidth() < MIN_EMBEDDED_SIZE || image.getHeight() < MIN_EMBEDDED_SIZE) {
                    log.debug("Doc {}: page {} image {} is {}x{}, too small to keep",
                        documentId, pageNumber, imageIndex, image.getWidth(), image.getHeight());
                    continue;
                }
                if (!seenHashes.add(contentHash(image))) {
                    log.debug("Doc {}: page {} image {} is a duplicate", documentId, pageNumber, imageIndex);
                    continue;
                }
                extracted.add(saveEmbedded(image, pageNumber, imageIndex, outputDir));
            } catch (IOException | RuntimeException e) {
                log.warn("Doc {}: embedded image {} on page {} could not be saved: {}",
                    documentId, name.getName(), pageNumber, e.getMessage());
            }
        }
        return extracted;
    }

    private PageImage saveEmbedded(PDImageXObject image, int pageNumber, int imageIndex, Path outputDir)
        throws IOException {
        BufferedImage opaque = onWhite(image.getImage());

        Path file = outputDir.resolve(String.format("page_%04d_img_%02d.%s", pageNumber, imageIndex, FORMAT));
        writeJpeg(opaque, file);

        return PageImage.embedded(
            pageNumber,
            imageIndex,
            file.toString(),
            opaque.getWidth(),
            opaque.getHeight(),
            FORMAT,
            Files.size(file)
        );
    }

    private static String contentHash(PDImageXObject image) throws IOException {
        try (InputStream raw = image.getCOSObject().createRawInputStream()) {
            return DigestUtils.md5DigestAsHex(raw);
        }
    }

    private static BufferedImage onWhite(BufferedImage source) {
        BufferedImage target = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, source.getWidth(), source.getHeight());
            graphics.drawImage(source, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return target;
    }

    private void writeJpeg(BufferedImage image, Path file) throws IOException {
        ImageWriter writer = ImageIO.getImageWritersByFormatName("jpeg").next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(properties.quality() / 100f);

        try (ImageOutputStream out = ImageIO.createImageOutputStream(file.toFile())) {
            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }
}
