package intervalsequence;

/**
 * Thrown when an offset does not match an occupied slot of an {@link IntervalSequence}
 */
public class InvalidIndexException extends IndexOutOfBoundsException {

    private static final long serialVersionUID = 1L;

    private final int offset;

    public InvalidIndexException(int offset) {
        super(offset + " is an invalid offset in the current sequence");
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
