package com.prism.documents.infra;

import com.prism.documents.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Uploaded PDFs and rendered page images on the local file system.
 * Images live under {@code imagesDir/<documentId>/}, owned by that document.
 */
@Slf4j
@Component
public class LocalFileStorage {

    private final Path uploadDir;
    private final Path imagesRoot;

    public LocalFileStorage(StorageProperties properties) {
        this.uploadDir = Paths.get(properties.uploadDir()).toAbsolutePath().normalize();
        this.imagesRoot = Paths.get(properties.imagesDir()).toAbsolutePath().normalize();
    }

    public Path storeUpload(InputStream content, String originalName) {
        String extension = originalName != null && originalName.toLowerCase().endsWith(".pdf") ? ".pdf" : "";
        Path target = uploadDir.resolve(UUID.randomUUID() + extension);
        try {
            Files.createDirectories(uploadDir);
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store upload " + originalName, e);
        }
        log.debug("Stored upload {} at {}", originalName, target);
        return target;
    }

    public byte[] readBytes(String path) {
        try {
            return Files.readAllBytes(Paths.get(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public Path imagesDir(UUID documentId) {
        return imagesRoot.resolve(documentId.toString());
    }

    /**
     * Recursive delete; a directory that is already gone is not an error.
     */
    public boolean deleteImagesDir(UUID documentId) {
        Path dir = imagesDir(documentId);
        try {
            return FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Failed to delete image directory {}: {}", dir, e.getMessage());
            return false;
        }
    }

    public boolean deleteFile(String path) {
        if (path == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(Paths.get(path));
        } catch (IOException e) {
            log.warn("Failed to delete file {}: {}", path, e.getMessage());
            return false;
        }
    }
}
