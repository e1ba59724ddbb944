package Model;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

public final class NearestMatchSearch {

    private final FingerprintCorpus corpus;

    public NearestMatchSearch(FingerprintCorpus corpus) {
        this.corpus = corpus;
    }

    /**
     * Finds the entry of {@code chatId} closest to {@code query}.
     * Ties on distance go to the earliest inserted entry.
     *
     * @param excludeMessageId entry to leave out of the comparison, if any
     * @param maxDistance      when present, only a match at or below this distance (inclusive) is returned
     */
    public Optional<Match> findClosest(long chatId, long query, OptionalLong excludeMessageId, OptionalInt maxDistance) {
        if (maxDistance.isPresent()) {
            int max = maxDistance.getAsInt();
            if (max < 0 || max > Fingerprinter.FINGERPRINT_BITS) {
                throw new IllegalArgumentException("maxDistance must be within 0.." + Fingerprinter.FINGERPRINT_BITS + ": " + max);
            }
        }

        Closest closest = new Closest();
        corpus.scan(chatId, e -> {
            if (excludeMessageId.isPresent() && e.messageId() == excludeMessageId.getAsLong()) return;
            closest.offer(e, Fingerprinter.distance(query, e.fingerprint()));
        });

        if (closest.best == null) return Optional.empty();
        if (maxDistance.isPresent() && closest.distance > maxDistance.getAsInt()) return Optional.empty();

        return Optional.of(new Match(closest.best.messageId(), closest.distance));
    }

    private static final class Closest {
        CorpusEntry best;
        int distance = Integer.MAX_VALUE;

        void offer(CorpusEntry e, int d) {
            if (d < distance || (d == distance && e.seq() < best.seq())) {
                best = e;
                distance = d;
            }
        }
    }
}
