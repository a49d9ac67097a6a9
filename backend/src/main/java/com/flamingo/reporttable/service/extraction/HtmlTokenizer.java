package com.flamingo.reporttable.service.extraction;

import com.flamingo.reporttable.exception.MalformedHtmlException;
import java.util.Locale;
import java.util.Set;

/**
 * Single-pass lexer that turns HTML text into tag, text and reference events.
 *
 * <p>The lexer is lenient. A {@code <} or {@code &} that does not start markup or a reference is
 * plain text, and quoted attribute values may contain {@code >}. The bodies of {@code script} and
 * {@code style} are reported as text without looking for tags. References are decoded the way
 * browsers decode them and never stop the lexer. It only gives up on constructs it cannot get
 * past, such as a tag that is still open at the end of the input.
 *
 * <p>Instances are single-use and not thread-safe.
 */
final class HtmlTokenizer {

  private static final Set<String> RAW_TEXT_ELEMENTS = Set.of("script", "style");

  private final String html;
  private final HtmlTokenHandler handler;
  private final int length;

  private int pos;
  private int textStart;

  private HtmlTokenizer(String html, HtmlTokenHandler handler) {
    this.html = html;
    this.handler = handler;
    this.length = html.length();
  }

  /**
   * Streams the events of {@code html} into {@code handler} until the input is exhausted or the
   * handler reports it is finished.
   *
   * @throws MalformedHtmlException when the input cannot be tokenized past some point
   */
  static void tokenize(String html, HtmlTokenHandler handler) {
    new HtmlTokenizer(html, handler).run();
  }

  private void run() {
    while (pos < length && !handler.isFinished()) {
      char c = html.charAt(pos);
      if (c == '<' && startsMarkup()) {
        flushText();
        readMarkup();
        textStart = pos;
      } else if (c == '&') {
        readReference();
      } else {
        pos++;
      }
    }
    if (!handler.isFinished()) {
      flushText();
    }
  }

  private boolean startsMarkup() {
    if (pos + 1 >= length) {
      return false;
    }
    char next = html.charAt(pos + 1);
    if (isAsciiLetter(next) || next == '!' || next == '?') {
      return true;
    }
    if (next == '/' && pos + 2 < length) {
      char afterSlash = html.charAt(pos + 2);
      return isAsciiLetter(afterSlash) || afterSlash == '>';
    }
    return false;
  }

  private void flushText() {
    if (pos > textStart) {
      handler.text(html.substring(textStart, pos));
    }
    textStart = pos;
  }

  private void readMarkup() {
    int start = pos;
    char next = html.charAt(pos + 1);
    if (html.startsWith("<!--", pos)) {
      int end = html.indexOf("-->", pos + 4);
      if (end < 0) {
        throw new MalformedHtmlException("Unterminated comment", start);
      }
      pos = end + 3;
    } else if (next == '!' || next == '?') {
      pos = closingBracket(start, "declaration") + 1;
    } else if (next == '/') {
      readEndTag(start);
    } else {
      readStartTag(start);
    }
  }

  private void readEndTag(int start) {
    int nameStart = start + 2;
    int nameEnd = scanName(nameStart);
    pos = closingBracket(start, "end tag") + 1;
    if (nameEnd > nameStart) {
      handler.endTag(html.substring(nameStart, nameEnd).toLowerCase(Locale.ROOT));
    }
  }

  private void readStartTag(int start) {
    int nameStart = start + 1;
    int nameEnd = scanName(nameStart);
    String name = html.substring(nameStart, nameEnd).toLowerCase(Locale.ROOT);

    boolean selfClosing = false;
    int i = nameEnd;
    while (true) {
      if (i >= length) {
        throw new MalformedHtmlException("Unterminated start tag <" + name + ">", start);
      }
      char c = html.charAt(i);
      if (c == '"' || c == '\'') {
        int close = html.indexOf(c, i + 1);
        if (close < 0) {
          throw new MalformedHtmlException("Unterminated attribute value in <" + name + ">", i);
        }
        i = close + 1;
        selfClosing = false;
      } else if (c == '>') {
        break;
      } else {
        if (!Character.isWhitespace(c)) {
          selfClosing = c == '/';
        }
        i++;
      }
    }
    pos = i + 1;

    handler.startTag(name);
    if (selfClosing) {
      handler.endTag(name);
    } else if (RAW_TEXT_ELEMENTS.contains(name)) {
      readRawText(name);
    }
  }

  // The body of script/style runs up to its own end tag and is reported as plain text.
  private void readRawText(String name) {
    String closeTag = "</" + name;
    int end = pos;
    while (end < length && !html.regionMatches(true, end, closeTag, 0, closeTag.length())) {
      end++;
    }
    if (end > pos && !handler.isFinished()) {
      handler.text(html.substring(pos, end));
    }
    pos = end;
  }

  private void readReference() {
    int start = pos;
    int i = pos + 1;
    if (i < length && html.charAt(i) == '#') {
      i++;
      boolean hex = i < length && (html.charAt(i) == 'x' || html.charAt(i) == 'X');
      if (hex) {
        i++;
      }
      int digitsStart = i;
      while (i < length && Character.digit(html.charAt(i), hex ? 16 : 10) >= 0) {
        i++;
      }
      if (i == digitsStart) {
        pos = start + 1;
        return;
      }
      String decoded = HtmlReferences.decodeNumeric(html.substring(digitsStart, i), hex);
      if (i < length && html.charAt(i) == ';') {
        i++;
      }
      emitReference(start, i, decoded);
      return;
    }

    while (i < length && isAsciiLetterOrDigit(html.charAt(i))) {
      i++;
    }
    String name = html.substring(start + 1, i);
    if (i < length && html.charAt(i) == ';') {
      String decoded = HtmlReferences.decodeNamed(name);
      if (decoded != null) {
        emitReference(start, i + 1, decoded);
        return;
      }
    }
    // Legacy entities may omit the ';' and run into the following text.
    int prefix = HtmlReferences.legacyPrefixLength(name);
    if (prefix == 0) {
      pos = start + 1;
      return;
    }
    emitReference(
        start, start + 1 + prefix, HtmlReferences.decodeNamed(name.substring(0, prefix)));
  }

  private void emitReference(int start, int end, String decoded) {
    pos = start;
    flushText();
    handler.reference(decoded);
    pos = end;
    textStart = end;
  }

  private int closingBracket(int start, String construct) {
    int end = html.indexOf('>', pos);
    if (end < 0) {
      throw new MalformedHtmlException("Unterminated " + construct, start);
    }
    return end;
  }

  private int scanName(int from) {
    int i = from;
    while (i < length) {
      char c = html.charAt(i);
      if (!isAsciiLetterOrDigit(c) && c != '-' && c != '_' && c != ':') {
        break;
      }
      i++;
    }
    return i;
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isAsciiLetterOrDigit(char c) {
    return isAsciiLetter(c) || (c >= '0' && c <= '9');
  }
}
