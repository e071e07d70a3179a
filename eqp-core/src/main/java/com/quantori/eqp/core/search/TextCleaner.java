package com.quantori.eqp.core.search;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns filing markup into plain searchable text.
 */
final class TextCleaner {
  private static final Pattern SCRIPT_OR_STYLE =
      Pattern.compile("<(script|style)[^>]*>.*?</\\1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern TAG = Pattern.compile("<[^>]*>");
  private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x?[0-9a-fA-F]+);");
  private static final Map<String, String> NAMED_ENTITIES = Map.of(
      "&nbsp;", " ", "&amp;", "&", "&lt;", "<", "&gt;", ">", "&quot;", "\"", "&apos;", "'",
      "&#39;", "'", "&rsquo;", "'", "&ldquo;", "\"", "&rdquo;", "\"");

  private TextCleaner() {
  }

  static String clean(String raw) {
    if (StringUtils.isEmpty(raw)) {
      return "";
    }
    String text = SCRIPT_OR_STYLE.matcher(raw).replaceAll(" ");
    text = TAG.matcher(text).replaceAll(" ");
    for (Map.Entry<String, String> entity : NAMED_ENTITIES.entrySet()) {
      text = text.replace(entity.getKey(), entity.getValue());
    }
    text = decodeNumericEntities(text);
    return StringUtils.normalizeSpace(text);
  }

  private static String decodeNumericEntities(String text) {
    Matcher matcher = NUMERIC_ENTITY.matcher(text);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String code = matcher.group(1);
      String replacement;
      try {
        int codePoint = code.startsWith("x") ? Integer.parseInt(code.substring(1), 16) : Integer.parseInt(code);
        replacement = new String(Character.toChars(codePoint));
      } catch (IllegalArgumentException e) {
        replacement = " ";
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
