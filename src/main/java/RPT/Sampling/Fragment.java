package RPT.Sampling;

import net.automatalib.word.Word;

/**
 * Contiguous slice of the input word, occupying positions [start, start + content.length()).
 *
 * @param <I> - Input symbol type
 */
public record Fragment<I>(int start, Word<I> content) {

    /**
     * Slice of u starting at start, clamped to the end of u.
     */
    public static <I> Fragment<I> of(Word<I> u, int start, long length) {
        if (start < 0 || start > u.length()) {
            throw new IndexOutOfBoundsException("fragment start " + start + " not in [0, " + u.length() + "]");
        }
        if (length < 0) {
            throw new IllegalArgumentException("negative fragment length " + length);
        }
        final int end = length >= u.length() - start ? u.length() : start + (int) length;
        return new Fragment<>(start, u.subWord(start, end));
    }

    public int end() {
        return start + content.length();
    }

    public int length() {
        return content.length();
    }

    /**
     * Symbol at absolute position pos of the input word.
     */
    public I symbolAt(int pos) {
        return content.getSymbol(pos - start);
    }
}
