package com.flamingo.reporttable.service.extraction;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Scratch state of one open table cell, resolving its final text.
 *
 * <p>Two accumulators are fed by the same events. The raw buffer receives every piece of text in
 * the cell. The capture buffer receives the text of the first meaningful nested element (see
 * {@link #MEANINGFUL_TAGS}) from its start tag to its own end tag. A non-blank capture takes
 * precedence over the raw text; once taken it never changes, and later nested elements only
 * contribute to the raw buffer. A capture that turns out blank is dropped and the next meaningful
 * element gets its turn.
 */
final class CellContext {

  static final Set<String> MEANINGFUL_TAGS =
      Set.of("div", "span", "a", "p", "strong", "em", "b", "i");

  private static final int NOT_CAPTURING = -1;

  private final boolean header;
  private final Deque<String> openElements = new ArrayDeque<>();
  private final StringBuilder raw = new StringBuilder();
  private final StringBuilder capture = new StringBuilder();

  // Depth of openElements at which the capturing element sits.
  private int captureDepth = NOT_CAPTURING;
  private String firstNestedText;

  CellContext(boolean header) {
    this.header = header;
  }

  boolean isHeader() {
    return header;
  }

  void openElement(String tag) {
    if (!MEANINGFUL_TAGS.contains(tag)) {
      return;
    }
    openElements.push(tag);
    if (firstNestedText == null && captureDepth == NOT_CAPTURING) {
      captureDepth = openElements.size();
      capture.setLength(0);
    }
  }

  void closeElement(String tag) {
    if (!MEANINGFUL_TAGS.contains(tag) || !openElements.contains(tag)) {
      return;
    }
    // Unclosed children of the closing element are closed with it.
    String closed;
    do {
      closed = openElements.pop();
    } while (!tag.equals(closed));
    if (captureDepth != NOT_CAPTURING && openElements.size() < captureDepth) {
      finishCapture();
    }
  }

  void append(String text) {
    raw.append(text);
    if (captureDepth != NOT_CAPTURING) {
      capture.append(text);
    }
  }

  /** The resolved cell text, never {@code null}. */
  String resolve() {
    if (firstNestedText != null) {
      return firstNestedText;
    }
    return trim(raw);
  }

  /** Trims whitespace, counting non-breaking and other Unicode spaces as whitespace. */
  static String trim(CharSequence text) {
    int start = 0;
    int end = text.length();
    while (start < end && isSpace(text.charAt(start))) {
      start++;
    }
    while (end > start && isSpace(text.charAt(end - 1))) {
      end--;
    }
    return text.subSequence(start, end).toString();
  }

  private static boolean isSpace(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c);
  }

  private void finishCapture() {
    String captured = trim(capture);
    if (!captured.isEmpty()) {
      firstNestedText = captured;
    }
    captureDepth = NOT_CAPTURING;
    capture.setLength(0);
  }
}
