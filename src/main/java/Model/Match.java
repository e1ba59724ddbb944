package Model;

public record Match(long messageId, int distance) {}
