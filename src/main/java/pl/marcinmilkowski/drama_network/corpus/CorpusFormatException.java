package pl.marcinmilkowski.drama_network.corpus;

/**
 * Thrown when a play file does not have the structure the reader expects.
 */
public class CorpusFormatException extends IllegalArgumentException {

    public CorpusFormatException(String message) {
        super(message);
    }

    public CorpusFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
