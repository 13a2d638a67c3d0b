package io.intellixity.restquery.convert;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Literal coercion for REST filter values, applied in order: {@code null}, booleans, all-digit integers,
 * {@code digits.digits} floats, quoted strings, then the raw text.
 */
public final class ValueCoercion {
  private static final Pattern INTEGER = Pattern.compile("^\\d+$");
  private static final Pattern DECIMAL = Pattern.compile("^\\d+\\.\\d+$");

  private ValueCoercion() {}

  /** Parses a scalar or a parenthesized {@code (v1,v2,...)} list. */
  public static Object parse(String raw) {
    if (raw == null) return null;
    String s = raw.trim();
    if (ExpressionTokenizer.isWrapped(s)) {
      List<Object> values = new ArrayList<>();
      for (String item : ExpressionTokenizer.splitTopLevel(s.substring(1, s.length() - 1))) {
        values.add(coerce(item));
      }
      return values;
    }
    return coerce(s);
  }

  public static Object coerce(String raw) {
    if (raw == null) return null;
    if ("null".equals(raw)) return null;
    if ("true".equals(raw)) return Boolean.TRUE;
    if ("false".equals(raw)) return Boolean.FALSE;
    if (INTEGER.matcher(raw).matches()) return integer(raw);
    if (DECIMAL.matcher(raw).matches()) return Double.parseDouble(raw);
    if (ExpressionTokenizer.isQuoted(raw)) return unquote(raw);
    return raw;
  }

  private static Object integer(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      try {
        return Long.parseLong(digits);
      } catch (NumberFormatException tooLong) {
        return new BigInteger(digits);
      }
    }
  }

  private static String unquote(String quoted) {
    char q = quoted.charAt(0);
    String body = quoted.substring(1, quoted.length() - 1);
    StringBuilder sb = new StringBuilder(body.length());
    for (int i = 0; i < body.length(); i++) {
      char ch = body.charAt(i);
      if (ch == '\\' && i + 1 < body.length() && (body.charAt(i + 1) == q || body.charAt(i + 1) == '\\')) {
        sb.append(body.charAt(++i));
      } else {
        sb.append(ch);
      }
    }
    return sb.toString();
  }
}
