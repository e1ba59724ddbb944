package Model;

public record CorpusEntry(long chatId, long messageId, long fingerprint, String chatTitle, long seq) {}
