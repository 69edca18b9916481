package uk.gegc.qbank.features.export.domain.model;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.function.Supplier;

/**
 * A built package ready for download.
 */
public record ExportFile(
        String filename,
        String contentType,
        Supplier<InputStream> contentSupplier,
        long contentLength
) {
    public ExportFile {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type cannot be null or blank");
        }
        if (contentSupplier == null) {
            throw new IllegalArgumentException("Content supplier cannot be null");
        }
        if (contentLength < 0) {
            contentLength = -1; // Unknown length
        }
    }

    public static ExportFile ofBytes(String filename, String contentType, byte[] bytes) {
        return new ExportFile(filename, contentType, () -> new ByteArrayInputStream(bytes), bytes.length);
    }

    public byte[] readAllBytes() {
        try (InputStream in = contentSupplier.get()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read export content: " + filename, e);
        }
    }
}
