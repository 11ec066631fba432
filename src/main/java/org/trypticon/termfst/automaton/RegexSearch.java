package org.trypticon.termfst.automaton;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.trypticon.termfst.fst.FSA;
import org.trypticon.termfst.fst.KeyIterator;
import org.trypticon.termfst.util.BytesRef;

/**
 * Filters the keys of an {@link FSA} by a {@link Pattern}. Keys are decoded as UTF-8 and
 * tested with {@link Matcher#find()}, so an unanchored pattern matches anywhere in the
 * key; anchor it with {@code ^...$} for a whole-key match.
 */
public final class RegexSearch {

  private RegexSearch() {} // no instance

  /**
   * @throws java.util.regex.PatternSyntaxException if the expression is malformed.
   */
  public static List<BytesRef> search(FSA fsa, String regex) {
    return collect(fsa.iterator(), Pattern.compile(regex));
  }

  /** Same as {@link #search} but only over keys starting with {@code prefix}. */
  public static List<BytesRef> prefixSearch(FSA fsa, BytesRef prefix, String regex) {
    return collect(fsa.prefixIterator(prefix), Pattern.compile(regex));
  }

  public static boolean matches(Pattern pattern, BytesRef key) {
    return pattern.matcher(key.utf8ToString()).find();
  }

  private static List<BytesRef> collect(KeyIterator iterator, Pattern pattern) {
    List<BytesRef> results = new ArrayList<>();
    while (iterator.next()) {
      BytesRef key = iterator.key();
      if (matches(pattern, key)) {
        results.add(BytesRef.deepCopyOf(key));
      }
    }
    return results;
  }
}
