package com.flamingo.reporttable.service.extraction;

/**
 * Receives the events produced by {@link HtmlTokenizer}, in document order.
 *
 * <p>Tag names are lower-cased. References arrive already decoded to their literal characters.
 */
interface HtmlTokenHandler {

  void startTag(String name);

  void endTag(String name);

  void text(String text);

  /** A named entity or numeric character reference, decoded. */
  void reference(String decoded);

  /** Lets the handler stop the scan early once it has what it needs. */
  default boolean isFinished() {
    return false;
  }
}
