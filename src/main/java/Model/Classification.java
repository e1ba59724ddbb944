package Model;

public interface Classification {

    record NewImage() implements Classification {}

    record Duplicate(int distance, long messageId) implements Classification {}

    record ManualMatch(int distance, long messageId) implements Classification {}

    record NoCorpus() implements Classification {}

    record NotAnImage() implements Classification {}
}
