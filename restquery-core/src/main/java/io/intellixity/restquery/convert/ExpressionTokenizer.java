package io.intellixity.restquery.convert;

import java.util.ArrayList;
import java.util.List;

/**
 * Nesting- and quote-aware scanner shared by the select, logical and array-value grammars.
 * <p>
 * Separators inside parentheses or inside single/double quotes never split. Inside quotes a backslash
 * escapes the next character.
 */
public final class ExpressionTokenizer {
  private ExpressionTokenizer() {}

  /** Splits on top-level commas, trimming tokens and dropping empty ones. */
  public static List<String> splitTopLevel(String input) {
    return splitTopLevel(input, ',');
  }

  public static List<String> splitTopLevel(String input, char separator) {
    List<String> out = new ArrayList<>();
    if (input == null || input.isEmpty()) return out;

    int depth = 0;
    char quote = 0;
    int start = 0;
    for (int i = 0; i < input.length(); i++) {
      char ch = input.charAt(i);
      if (quote != 0) {
        if (ch == '\\') i++;
        else if (ch == quote) quote = 0;
        continue;
      }
      if (ch == '"' || ch == '\'') {
        quote = ch;
      } else if (ch == '(') {
        depth++;
      } else if (ch == ')') {
        if (depth > 0) depth--;
      } else if (ch == separator && depth == 0) {
        addToken(out, input.substring(start, i));
        start = i + 1;
      }
    }
    addToken(out, input.substring(start));
    return out;
  }

  /**
   * Index of the parenthesis closing the one at {@code openIndex}, or -1 when unbalanced.
   */
  public static int matchingClose(String input, int openIndex) {
    if (input == null || openIndex < 0 || openIndex >= input.length() || input.charAt(openIndex) != '(') return -1;
    int depth = 0;
    char quote = 0;
    for (int i = openIndex; i < input.length(); i++) {
      char ch = input.charAt(i);
      if (quote != 0) {
        if (ch == '\\') i++;
        else if (ch == quote) quote = 0;
        continue;
      }
      if (ch == '"' || ch == '\'') quote = ch;
      else if (ch == '(') depth++;
      else if (ch == ')') {
        depth--;
        if (depth == 0) return i;
      }
    }
    return -1;
  }

  /** {@code "(a,b)"} becomes {@code "a,b"}; input not wrapped by one balanced pair is returned trimmed. */
  public static String stripOuterParens(String input) {
    if (input == null) return null;
    String s = input.trim();
    if (isWrapped(s)) return s.substring(1, s.length() - 1);
    return s;
  }

  /** True when the whole string is one balanced parenthesized group. */
  public static boolean isWrapped(String s) {
    return s != null && s.startsWith("(") && matchingClose(s, 0) == s.length() - 1;
  }

  public static boolean isQuoted(String s) {
    if (s == null || s.length() < 2) return false;
    char first = s.charAt(0);
    return (first == '"' || first == '\'') && s.charAt(s.length() - 1) == first;
  }

  private static void addToken(List<String> out, String raw) {
    String t = raw.trim();
    if (!t.isEmpty()) out.add(t);
  }
}
