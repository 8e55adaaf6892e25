package io.graphsight.core.graph;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import javax.imageio.ImageIO;

/// Opaque diagram image handed to the oracle.
///
/// The engine never inspects pixels; it only forwards the bytes. Width and height are
/// informational and are `0` when the format cannot be decoded locally.
///
/// @param name source name for logging, never null
/// @param data encoded image bytes, not empty
/// @param mimeType MIME type such as `image/png`, not null
/// @param width pixel width, or 0 when unknown
/// @param height pixel height, or 0 when unknown
public record DiagramImage(String name, byte[] data, String mimeType, int width, int height) {

    private static final Logger logger = Logger.getLogger(DiagramImage.class.getName());

    public DiagramImage {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(mimeType, "mimeType must not be null");
        if (data.length == 0) {
            throw new IllegalArgumentException("image data must not be empty");
        }
        name = name != null ? name : "image";
        data = data.clone();
    }

    /// Wraps raw bytes, reading dimensions when the format is decodable.
    ///
    /// @param name source name, may be null
    /// @param data encoded bytes, not empty
    /// @param mimeType MIME type, not null
    /// @return the image, never null
    public static DiagramImage of(String name, byte[] data, String mimeType) {
        int[] size = readDimensions(data);
        return new DiagramImage(name, data, mimeType, size[0], size[1]);
    }

    /// Loads an image file, deriving the MIME type from its extension.
    ///
    /// @param path image file, not null
    /// @return the image, never null
    /// @throws IOException if the file cannot be read
    public static DiagramImage load(Path path) throws IOException {
        byte[] data = Files.readAllBytes(path);
        return of(path.getFileName().toString(), data, mimeTypeFor(path));
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /// Returns the image bytes as standard base64 text.
    public String base64() {
        return Base64.getEncoder().encodeToString(data);
    }

    public int sizeInBytes() {
        return data.length;
    }

    static String mimeTypeFor(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".jpg") || fileName.endsWith(".jpeg")) {
            return "image/jpeg";
        } else if (fileName.endsWith(".gif")) {
            return "image/gif";
        } else if (fileName.endsWith(".webp")) {
            return "image/webp";
        }
        return "image/png";
    }

    private static int[] readDimensions(byte[] data) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image != null) {
                return new int[] {image.getWidth(), image.getHeight()};
            }
        } catch (IOException e) {
            logger.fine("Could not read image dimensions: " + e.getMessage());
        }
        return new int[] {0, 0};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiagramImage other)) return false;
        return name.equals(other.name)
                && mimeType.equals(other.mimeType)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, mimeType, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return "DiagramImage{name="
                + name
                + ", mimeType="
                + mimeType
                + ", bytes="
                + data.length
                + ", size="
                + width
                + "x"
                + height
                + "}";
    }
}
