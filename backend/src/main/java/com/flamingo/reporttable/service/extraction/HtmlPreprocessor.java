package com.flamingo.reporttable.service.extraction;

import java.util.regex.Pattern;

/**
 * Repairs malformed table markup that report generators commonly emit, so the tokenizer sees
 * balanced structural tags.
 *
 * <p>Only structural tags are rewritten; text inside cells is never touched.
 */
final class HtmlPreprocessor {

  // <table class="a"></table style="b"> -> <table class="a" style="b">
  private static final Pattern MISPLACED_TABLE_ATTRIBUTES =
      Pattern.compile("<table([^>]*?)></table\\s+([^>]*?)>", Pattern.CASE_INSENSITIVE);

  // <td class="x"/> -> <td class="x"></td>
  private static final Pattern SELF_CLOSING_CELL =
      Pattern.compile("<(td|th)([^>]*?)/>", Pattern.CASE_INSENSITIVE);

  private static final Pattern DOUBLED_TABLE_CLOSE =
      Pattern.compile("</table>\\s*</table>", Pattern.CASE_INSENSITIVE);

  private HtmlPreprocessor() {}

  static String clean(String html) {
    if (html == null || html.isEmpty()) {
      return html;
    }
    String cleaned = MISPLACED_TABLE_ATTRIBUTES.matcher(html).replaceAll("<table$1 $2>");
    cleaned = SELF_CLOSING_CELL.matcher(cleaned).replaceAll("<$1$2></$1>");
    return DOUBLED_TABLE_CLOSE.matcher(cleaned).replaceAll("</table>");
  }
}
