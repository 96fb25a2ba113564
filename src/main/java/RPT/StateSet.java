package RPT;

import java.util.Arrays;

/**
 * Set of automaton states, stored as a bit vector of fixed length (numStates).
 * The length never changes, so two sets taken from the same automaton can be combined word by word.
 */
public final class StateSet {
  private final long[] bits; // Array of longs holding the bits
  private final int numStates;
  private final long lastWordMask; // mask off bits beyond numStates in the last word

  /**
   * Creates an empty StateSet. The internally allocated long array will be exactly the size needed
   * to accommodate numStates bits.
   *
   * @param numStates the number of states of the owning automaton
   */
  public StateSet(final int numStates) {
    if (numStates < 0) {
      throw new IllegalArgumentException("numStates < 0: " + numStates);
    }
    this.numStates = numStates;
    this.bits = new long[numStates == 0 ? 0 : ((numStates - 1) >> 6) + 1];
    final int r = numStates & 63;
    this.lastWordMask = (r == 0) ? -1L : (-1L >>> (64 - r));
  }

  private StateSet(final StateSet other) {
    this.numStates = other.numStates;
    this.bits = other.bits.clone();
    this.lastWordMask = other.lastWordMask;
  }

  public static StateSet of(final int numStates, final int... states) {
    final StateSet result = new StateSet(numStates);
    for (int s : states) {
      result.set(s);
    }
    return result;
  }

  public static StateSet full(final int numStates) {
    final StateSet result = new StateSet(numStates);
    result.setAll();
    return result;
  }

  public StateSet copy() {
    return new StateSet(this);
  }

  /** Number of states this set ranges over (not the number of members). */
  public int length() {
    return numStates;
  }

  public boolean get(final int state) {
    checkState(state);
    return (bits[state >> 6] & (1L << (state & 63))) != 0;
  }

  public void set(final int state) {
    checkState(state);
    bits[state >> 6] |= 1L << (state & 63);
  }

  public void clear(final int state) {
    checkState(state);
    bits[state >> 6] &= ~(1L << (state & 63));
  }

  public void setAll() {
    if (bits.length == 0) {
      return;
    }
    Arrays.fill(bits, -1L);
    bits[bits.length - 1] &= lastWordMask; // clear tail beyond numStates
  }

  public void or(final StateSet other) {
    checkSameLength(other);
    for (int i = 0; i < bits.length; i++) bits[i] |= other.bits[i];
  }

  public void and(final StateSet other) {
    checkSameLength(other);
    for (int i = 0; i < bits.length; i++) bits[i] &= other.bits[i];
  }

  public boolean intersects(final StateSet other) {
    checkSameLength(other);
    for (int i = 0; i < bits.length; i++) {
      if ((bits[i] & other.bits[i]) != 0) {
        return true;
      }
    }
    return false;
  }

  /**
   * Determine if this is a subset of sup.
   */
  public boolean isSubsetOf(final StateSet sup) {
    checkSameLength(sup);
    for (int i = 0; i < bits.length; i++) {
      if ((bits[i] & ~sup.bits[i]) != 0) {
        return false;
      }
    }
    return true;
  }

  public boolean isEmpty() {
    for (long word : bits) {
      if (word != 0) {
        return false;
      }
    }
    return true;
  }

  public int cardinality() {
    int sum = 0;
    for (long word : bits) {
      sum += Long.bitCount(word);
    }
    return sum;
  }

  /**
   * Returns the first member at or after index, or -1 if there is none.
   */
  public int nextSetBit(final int index) {
    if (index < 0) {
      throw new IndexOutOfBoundsException("index < 0: " + index);
    }
    int i = index >> 6;
    if (i >= bits.length) {
      return -1;
    }

    // discard the bits below 'index' in its own word
    long word = bits[i] & (-1L << (index & 63));
    while (true) {
      if (word != 0) {
        return (i << 6) + Long.numberOfTrailingZeros(word);
      }
      if (++i == bits.length) {
        return -1;
      }
      word = bits[i];
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StateSet)) {
      return false;
    }
    final StateSet other = (StateSet) o;
    return numStates == other.numStates && Arrays.equals(bits, other.bits);
  }

  @Override
  public int hashCode() {
    return 31 * numStates + Arrays.hashCode(bits);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("{");
    for (int i = nextSetBit(0); i >= 0; i = nextSetBit(i + 1)) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(i);
    }
    return sb.append('}').toString();
  }

  private void checkState(final int state) {
    if (state < 0 || state >= numStates) {
      throw new IndexOutOfBoundsException("state " + state + " not in [0, " + numStates + ")");
    }
  }

  private void checkSameLength(final StateSet other) {
    if (other.numStates != numStates) {
      throw new IllegalArgumentException(
          "StateSet length mismatch: " + numStates + " vs " + other.numStates);
    }
  }
}
