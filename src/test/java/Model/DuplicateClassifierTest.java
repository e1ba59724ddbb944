package Model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DuplicateClassifierTest {

    private static final Fingerprinter FINGERPRINTER = new Fingerprinter();

    private FingerprintCorpus corpus;
    private DuplicateClassifier classifier;

    @BeforeEach
    void open() {
        corpus = FingerprintCorpusTest.inMemory();
        classifier = new DuplicateClassifier(FINGERPRINTER, corpus, 5);
    }

    @AfterEach
    void close() {
        classifier.shutdown();
        corpus.close();
    }

    private List<Long> messageIds(long chatId) {
        List<Long> ids = new ArrayList<>();
        corpus.scan(chatId, e -> ids.add(e.messageId()));
        return ids;
    }

    @Test
    void repostOfSameBytes_isDuplicateOfOriginal() {
        byte[] x = TestImages.png(TestImages.tiles(11, 256));

        assertThat(classifier.classifyNewImage(1, 10, "chat", x)).isEqualTo(new Classification.NewImage());
        assertThat(classifier.classifyNewImage(1, 11, "chat", x.clone()))
                .isEqualTo(new Classification.Duplicate(0, 10));

        assertThat(messageIds(1)).containsExactly(10L);
    }

    @Test
    void recompressedRepost_isStillDuplicate() {
        var img = TestImages.tiles(12, 256);
        classifier.classifyNewImage(1, 10, "chat", TestImages.png(img));

        assertThat(classifier.classifyNewImage(1, 11, "chat", TestImages.jpeg(img, 0.85f)))
                .isInstanceOfSatisfying(Classification.Duplicate.class, d -> {
                    assertThat(d.messageId()).isEqualTo(10);
                    assertThat(d.distance()).isLessThanOrEqualTo(5);
                });
    }

    @Test
    void differentPicture_isNewAndRecorded() {
        classifier.classifyNewImage(1, 10, "chat", TestImages.png(TestImages.tiles(13, 256)));

        assertThat(classifier.classifyNewImage(1, 11, "chat", TestImages.png(TestImages.tiles(14, 256))))
                .isEqualTo(new Classification.NewImage());
        assertThat(messageIds(1)).containsExactly(10L, 11L);
    }

    @Test
    void reusedMessageId_keepsFirstFingerprint() throws Exception {
        byte[] first = TestImages.png(TestImages.tiles(21, 256));
        byte[] second = TestImages.png(TestImages.tiles(22, 256));

        assertThat(classifier.classifyNewImage(1, 10, "chat", first)).isEqualTo(new Classification.NewImage());
        assertThat(classifier.classifyNewImage(1, 10, "chat", second)).isEqualTo(new Classification.NewImage());

        List<Long> stored = new ArrayList<>();
        corpus.scan(1, e -> stored.add(e.fingerprint()));
        assertThat(stored).containsExactly(FINGERPRINTER.fingerprint(first));
        assertThat(classifier.classifyNewImage(1, 11, "chat", first))
                .isEqualTo(new Classification.Duplicate(0, 10));
    }

    @Test
    void webpImage_isClassified() throws Exception {
        byte[] webp;
        try (InputStream in = getClass().getResourceAsStream("/images/pixel.webp")) {
            webp = in.readAllBytes();
        }

        assertThat(classifier.classifyNewImage(1, 10, "chat", webp)).isEqualTo(new Classification.NewImage());
        assertThat(classifier.classifyNewImage(1, 11, "chat", webp)).isEqualTo(new Classification.Duplicate(0, 10));
    }

    @Test
    void chatsOnTheSameLockStripe_stayIndependent() {
        byte[] x = TestImages.png(TestImages.tiles(23, 256));

        assertThat(classifier.classifyNewImage(1, 10, "one", x)).isEqualTo(new Classification.NewImage());
        assertThat(classifier.classifyNewImage(65, 10, "sixty-five", x)).isEqualTo(new Classification.NewImage());
        assertThat(classifier.classifyNewImage(65, 11, "sixty-five", x)).isEqualTo(new Classification.Duplicate(0, 10));
        assertThat(corpus.count(1)).isEqualTo(1);
        assertThat(corpus.count(65)).isEqualTo(1);
    }

    @Test
    void samePictureInAnotherChat_isNew() {
        byte[] x = TestImages.png(TestImages.tiles(15, 256));
        classifier.classifyNewImage(1, 10, "one", x);

        assertThat(classifier.classifyNewImage(2, 10, "two", x)).isEqualTo(new Classification.NewImage());
    }

    @Test
    void nonImage_isSkippedWithoutTouchingCorpus() {
        byte[] text = "hello".getBytes(StandardCharsets.UTF_8);

        assertThat(classifier.classifyNewImage(1, 10, "chat", text)).isEqualTo(new Classification.NotAnImage());
        assertThat(classifier.classifyManual(1, 10, text)).isEqualTo(new Classification.NotAnImage());
        assertThat(corpus.count(1)).isZero();
    }

    @Test
    void manualQuery_reportsClosestOtherMessageWhateverTheDistance() throws Exception {
        byte[] a = TestImages.png(TestImages.tiles(16, 256));
        byte[] b = TestImages.png(TestImages.tiles(17, 256));
        classifier.classifyNewImage(1, 10, "chat", a);
        classifier.classifyNewImage(1, 20, "chat", b);
        int expected = Fingerprinter.distance(FINGERPRINTER.fingerprint(a), FINGERPRINTER.fingerprint(b));

        assertThat(expected).isGreaterThan(5);
        assertThat(classifier.classifyManual(1, 10, a)).isEqualTo(new Classification.ManualMatch(expected, 20));
        assertThat(messageIds(1)).containsExactly(10L, 20L);
    }

    @Test
    void manualQuery_withNothingElseInChat_isNoCorpus() {
        byte[] a = TestImages.png(TestImages.tiles(18, 256));

        assertThat(classifier.classifyManual(1, 10, a)).isEqualTo(new Classification.NoCorpus());
        classifier.classifyNewImage(1, 10, "chat", a);
        assertThat(classifier.classifyManual(1, 10, a)).isEqualTo(new Classification.NoCorpus());
    }

    @Test
    void concurrentCopiesInOneChat_recordOnlyOne() throws Exception {
        byte[] x = TestImages.png(TestImages.tiles(19, 256));
        List<CompletableFuture<Classification>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(classifier.classifyNewImageAsync(1, 100 + i, "chat", x));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        long fresh = futures.stream().map(CompletableFuture::join)
                .filter(c -> c instanceof Classification.NewImage).count();
        assertThat(fresh).isEqualTo(1);
        assertThat(futures).map(CompletableFuture::join)
                .filteredOn(c -> c instanceof Classification.Duplicate)
                .hasSize(7)
                .allSatisfy(c -> assertThat(((Classification.Duplicate) c).distance()).isZero());
        assertThat(corpus.count(1)).isEqualTo(1);
    }

    @Test
    void manualAsync_completes() throws Exception {
        byte[] a = TestImages.png(TestImages.tiles(20, 256));
        classifier.classifyNewImage(1, 10, "chat", a);

        assertThat(classifier.classifyManualAsync(1, 11, a).get(30, TimeUnit.SECONDS))
                .isEqualTo(new Classification.ManualMatch(0, 10));
    }

    @Test
    void thresholdOutsideBitWidth_isRejected() {
        assertThatThrownBy(() -> new DuplicateClassifier(FINGERPRINTER, corpus, 65))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(classifier.threshold()).isEqualTo(5);
    }
}
