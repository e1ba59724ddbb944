package Model;

public final class CorpusException extends RuntimeException {

    public CorpusException(String message, Throwable cause) {
        super(message, cause);
    }
}
