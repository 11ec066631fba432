package org.trypticon.termfst.automaton;

/**
 * One cell of a {@link LevenshteinAutomaton}: the automaton may be at {@code position}
 * in the pattern having spent {@code errors} edits.
 */
public final class LevenshteinState {

  static final LevenshteinState INVALID = new LevenshteinState(-1, -1, false);

  private final int position;
  private final int errors;
  private final boolean valid;

  LevenshteinState(int position, int errors, boolean valid) {
    this.position = position;
    this.errors = errors;
    this.valid = valid;
  }

  public int getPosition() {
    return position;
  }

  public int getErrors() {
    return errors;
  }

  public boolean isValid() {
    return valid;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof LevenshteinState)) {
      return false;
    }
    LevenshteinState other = (LevenshteinState) obj;
    return position == other.position && errors == other.errors && valid == other.valid;
  }

  @Override
  public int hashCode() {
    int result = position;
    result = 31 * result + errors;
    return 31 * result + (valid ? 1 : 0);
  }

  @Override
  public String toString() {
    return valid ? "(" + position + "," + errors + ")" : "(invalid)";
  }
}
