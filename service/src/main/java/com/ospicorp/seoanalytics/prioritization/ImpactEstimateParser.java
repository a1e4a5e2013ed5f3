package com.ospicorp.seoanalytics.prioritization;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls numbers out of free-text impact estimates such as
 * {@code "+300 clicks, 12 conversions, $15k revenue"}.
 *
 * <p>Grammar, case-insensitive, first match wins:
 * <pre>
 *   count  := ['+'] ws* digits ws* unit      e.g. "+1,200 clicks", "12 conversions"
 *   dollar := '$' ws* digits ['.' digits] ['k']   e.g. "$15,000", "$12k", "$2.5k"
 *   digits := [0-9] [0-9,]*                  commas are thousands separators
 * </pre>
 * A unit matches as a prefix, so {@code click} also matches {@code clicks}.
 */
public final class ImpactEstimateParser {

  private static final Pattern CLICKS = countPattern("click");
  private static final Pattern CONVERSIONS = countPattern("conversion");
  private static final Pattern DOLLARS =
      Pattern.compile("\\$\\s*([0-9][0-9,]*(?:\\.[0-9]+)?)\\s*(k\\b)?", Pattern.CASE_INSENSITIVE);

  private ImpactEstimateParser() {
  }

  public static double clicks(String text) {
    return firstNumber(CLICKS, text);
  }

  public static double conversions(String text) {
    return firstNumber(CONVERSIONS, text);
  }

  /** Dollar amount, with a {@code k} suffix multiplying by 1000; 0 when absent. */
  public static double dollars(String text) {
    if (text == null) {
      return 0d;
    }
    Matcher m = DOLLARS.matcher(text);
    if (!m.find()) {
      return 0d;
    }
    double amount = Double.parseDouble(m.group(1).replace(",", ""));
    return m.group(2) != null ? amount * 1000 : amount;
  }

  /** True for a dollar sign or the words "revenue" or "value". */
  public static boolean mentionsMonetaryValue(String text) {
    if (text == null) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    return lower.contains("$") || lower.contains("revenue") || lower.contains("value");
  }

  static Pattern countPattern(String unit) {
    return Pattern.compile("\\+?\\s*([0-9][0-9,]*)\\s*" + Pattern.quote(unit),
        Pattern.CASE_INSENSITIVE);
  }

  private static double firstNumber(Pattern pattern, String text) {
    if (text == null || text.isBlank()) {
      return 0d;
    }
    Matcher m = pattern.matcher(text);
    if (!m.find()) {
      return 0d;
    }
    String digits = m.group(1).replace(",", "");
    return digits.isEmpty() ? 0d : Double.parseDouble(digits);
  }
}
