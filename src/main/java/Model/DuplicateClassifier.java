package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.*;

public final class DuplicateClassifier {

    private static final Logger log = LoggerFactory.getLogger(DuplicateClassifier.class);
    private static final int LOCK_STRIPES = 64;

    private final Fingerprinter fingerprinter;
    private final FingerprintCorpus corpus;
    private final NearestMatchSearch search;
    private final int threshold;
    private final Object[] chatLocks = new Object[LOCK_STRIPES];
    private final ExecutorService pool;

    public DuplicateClassifier(Fingerprinter fingerprinter, FingerprintCorpus corpus, int threshold) {
        if (threshold < 0 || threshold > Fingerprinter.FINGERPRINT_BITS) {
            throw new IllegalArgumentException("threshold must be within 0.." + Fingerprinter.FINGERPRINT_BITS + ": " + threshold);
        }
        this.fingerprinter = fingerprinter;
        this.corpus = corpus;
        this.search = new NearestMatchSearch(corpus);
        this.threshold = threshold;
        for (int i = 0; i < chatLocks.length; i++) chatLocks[i] = new Object();
        this.pool = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors() / 2));
    }

    /**
     * Automatic mode. {@code NewImage} is also returned when the message id is already
     * recorded for this chat; the stored fingerprint is kept and nothing is written.
     */
    public Classification classifyNewImage(long chatId, long messageId, String chatTitle, byte[] image) {
        long fp;
        try {
            fp = fingerprinter.fingerprint(image);
        } catch (UnsupportedImageException e) {
            log.debug("message {} in {} ({}) is not a usable image: {}", messageId, chatTitle, chatId, e.getMessage());
            return new Classification.NotAnImage();
        }

        synchronized (lockFor(chatId)) {
            Optional<Match> match = search.findClosest(chatId, fp, OptionalLong.empty(), OptionalInt.of(threshold));
            if (match.isPresent()) {
                Match m = match.get();
                log.debug("message {} in {} ({}) duplicates message {} (dst {})",
                        messageId, chatTitle, chatId, m.messageId(), m.distance());
                return new Classification.Duplicate(m.distance(), m.messageId());
            }

            log.debug("new image sent to {} ({}). adding hash to memory", chatTitle, chatId);
            if (!corpus.insert(chatId, messageId, fp, chatTitle)) {
                log.debug("message {} in {} ({}) was already recorded, fingerprint not stored", messageId, chatTitle, chatId);
            }
            return new Classification.NewImage();
        }
    }

    public Classification classifyManual(long chatId, long queryMessageId, byte[] image) {
        long fp;
        try {
            fp = fingerprinter.fingerprint(image);
        } catch (UnsupportedImageException e) {
            log.debug("referenced message {} in chat {} is not a usable image: {}", queryMessageId, chatId, e.getMessage());
            return new Classification.NotAnImage();
        }

        return search.findClosest(chatId, fp, OptionalLong.of(queryMessageId), OptionalInt.empty())
                .<Classification>map(m -> new Classification.ManualMatch(m.distance(), m.messageId()))
                .orElseGet(Classification.NoCorpus::new);
    }

    public CompletableFuture<Classification> classifyNewImageAsync(long chatId, long messageId, String chatTitle, byte[] image) {
        return CompletableFuture.supplyAsync(() -> classifyNewImage(chatId, messageId, chatTitle, image), pool);
    }

    public CompletableFuture<Classification> classifyManualAsync(long chatId, long queryMessageId, byte[] image) {
        return CompletableFuture.supplyAsync(() -> classifyManual(chatId, queryMessageId, image), pool);
    }

    // chats sharing a stripe also share the lock
    private Object lockFor(long chatId) {
        return chatLocks[Math.floorMod(Long.hashCode(chatId), chatLocks.length)];
    }

    public int threshold() {
        return threshold;
    }

    public void shutdown() {
        pool.shutdownNow();
    }
}
