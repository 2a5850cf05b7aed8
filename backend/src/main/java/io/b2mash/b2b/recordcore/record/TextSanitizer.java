package io.b2mash.b2b.recordcore.record;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

/** Strips all markup from free-text input. */
public final class TextSanitizer {

  private static final Document.OutputSettings OUTPUT =
      new Document.OutputSettings().prettyPrint(false);

  private TextSanitizer() {}

  /**
   * Removes every tag (and script/style content), decodes entities and trims.
   *
   * @return the plain text, or null if nothing is left
   */
  public static String plainText(String value) {
    if (value == null) {
      return null;
    }
    String cleaned = Jsoup.clean(value, "", Safelist.none(), OUTPUT);
    String text = Parser.unescapeEntities(cleaned, false).trim();
    return text.isEmpty() ? null : text;
  }
}
