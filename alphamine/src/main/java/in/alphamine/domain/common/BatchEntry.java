package in.alphamine.domain.common;

/**
 * One input of a batch paired with its outcome.
 *
 * @param index position of the input in the submitted list
 */
public record BatchEntry<I, R>(int index, I input, Outcome<R> outcome) {

    public boolean isSuccess() {
        return outcome.isSuccess();
    }
}
