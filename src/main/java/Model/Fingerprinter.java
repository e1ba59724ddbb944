package Model;

import dev.brachtendorf.jimagehash.hash.Hash;
import dev.brachtendorf.jimagehash.hashAlgorithms.HashingAlgorithm;
import dev.brachtendorf.jimagehash.hashAlgorithms.PerceptiveHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class Fingerprinter {

    public static final int FINGERPRINT_BITS = 64;

    private static final Logger log = LoggerFactory.getLogger(Fingerprinter.class);

    private final HashingAlgorithm hasher;

    public Fingerprinter() {
        this.hasher = new PerceptiveHash(FINGERPRINT_BITS);
        // fail fast on a hasher that cannot produce 64-bit keys
        toFingerprint(hasher.hash(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB)));
    }

    public long fingerprint(byte[] bytes) throws UnsupportedImageException {
        if (bytes == null || bytes.length == 0) {
            throw new UnsupportedImageException("empty input");
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new UnsupportedImageException("corrupt image data", e);
        }
        if (image == null) {
            throw new UnsupportedImageException("no reader recognizes the image format");
        }

        long fp = toFingerprint(hasher.hash(image));
        log.trace("fingerprint {} for {}x{} image", Long.toHexString(fp), image.getWidth(), image.getHeight());
        return fp;
    }

    public long fingerprint(Path file) throws UnsupportedImageException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UnsupportedImageException("cannot read " + file, e);
        }
        return fingerprint(bytes);
    }

    public static int distance(long a, long b) {
        return Long.bitCount(a ^ b);
    }

    private static long toFingerprint(Hash h) {
        if (h.getBitResolution() != FINGERPRINT_BITS) {
            throw new IllegalStateException("hash was not exactly " + FINGERPRINT_BITS
                    + " bits but " + h.getBitResolution());
        }
        return h.getHashValue().longValue();
    }
}
