package io.intellixity.vecta.schema;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Screens caller-supplied names before they are used as parameter placeholders. */
public final class Identifiers {
  private static final Pattern BARE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  // Substrings that indicate an injection attempt rather than a name
  private static final List<String> SUSPICIOUS = List.of(
      ";", "--", "/*", "*/", "'", "\"", "`", "\\",
      " or ", " and ", "drop ", "delete ", "insert ",
      "update ", "select ", "union ", "exec ", "execute ");

  private Identifiers() {}

  public static boolean isValid(String s) {
    if (s == null || s.isEmpty()) return false;
    if (!BARE.matcher(s).matches()) return false;
    String lower = s.toLowerCase(Locale.ROOT);
    for (String p : SUSPICIOUS) {
      if (lower.contains(p)) return false;
    }
    return true;
  }
}
