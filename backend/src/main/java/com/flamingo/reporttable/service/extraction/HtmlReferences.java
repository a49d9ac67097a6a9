package com.flamingo.reporttable.service.extraction;

import org.jsoup.nodes.Entities;
import org.jsoup.parser.Parser;

/**
 * Decodes HTML entity and numeric character references the way browsers do. Decoding never fails:
 * values that are not Unicode scalar values become U+FFFD.
 */
final class HtmlReferences {

  static final String REPLACEMENT = "\uFFFD";

  private HtmlReferences() {}

  /**
   * Decodes a named entity written with its terminating {@code ;}, such as {@code amp} or
   * {@code nbsp}.
   *
   * @return the literal characters, or {@code null} when the name is not a known entity
   */
  static String decodeNamed(String name) {
    if (!Entities.isNamedEntity(name)) {
      return null;
    }
    return Entities.getByName(name);
  }

  /**
   * Length of the longest prefix of {@code name} that is a legacy entity, one that may be written
   * without {@code ;} (for example {@code nbsp} in {@code &nbsp} or {@code amp} in {@code &ampD}).
   *
   * @return the prefix length, or 0 when no prefix is a legacy entity
   */
  static int legacyPrefixLength(String name) {
    for (int end = name.length(); end >= 2; end--) {
      if (Entities.isBaseNamedEntity(name.substring(0, end))) {
        return end;
      }
    }
    return 0;
  }

  /**
   * Decodes the digits of a numeric character reference. Leading zeros are allowed. Zero,
   * surrogates and values above U+10FFFF decode to U+FFFD, and 0x80 to 0x9F are read as
   * windows-1252.
   *
   * @param digits decimal or hexadecimal digits, without {@code &#}, {@code x} or {@code ;}
   * @param hex whether {@code digits} are hexadecimal
   */
  static String decodeNumeric(String digits, boolean hex) {
    if (digits.chars().allMatch(c -> c == '0')) {
      return REPLACEMENT;
    }
    return Parser.unescapeEntities("&#" + (hex ? "x" : "") + digits + ";", false);
  }
}
