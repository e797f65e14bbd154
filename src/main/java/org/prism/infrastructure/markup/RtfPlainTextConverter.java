package org.prism.infrastructure.markup;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.prism.application.port.MarkupTextConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MarkupTextConverter} that reduces RTF to plain text.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Groups marked {@code \*} and known destinations (font, color and style tables, document info,
 *       pictures, headers, footers) are dropped with their contents.</li>
 *   <li>{@code \par}, {@code \line}, {@code \row}, {@code \sect}, {@code \page} and backslash-newline become
 *       {@code \n}; {@code \tab} and {@code \cell} become {@code \t}.</li>
 *   <li>{@code \'hh} is decoded with the document code page ({@code \ansicpgN}, default windows-1252);
 *       <code>&#92;uN</code> yields the code unit and skips the next <code>&#92;ucN</code> fallback characters.</li>
 *   <li>Raw CR and LF are ignored; every other character, including control characters, passes through.
 *       Control characters also end any pending fallback skip, so a marker right after <code>&#92;uN</code> survives.</li>
 *   <li>All remaining control words are discarded.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; each call uses its own parse state.</p>
 *
 * @since 0.1.0
 */
public final class RtfPlainTextConverter implements MarkupTextConverter {
  private static final Logger log = LoggerFactory.getLogger(RtfPlainTextConverter.class);
  private static final Charset DEFAULT_CODE_PAGE = Charset.forName("windows-1252");

  private static final Set<String> DESTINATIONS = Set.of(
      "aftncn", "aftnsep", "aftnsepc", "annotation", "atnauthor", "atndate", "atnicn", "atnid", "atnparent",
      "atnref", "atntime", "atrfend", "atrfstart", "author", "background", "bkmkend", "bkmkstart", "buptim",
      "colorschememapping", "colortbl", "comment", "company", "creatim", "datafield", "datastore", "doccomm",
      "docvar", "dptxbxtext", "expandedcolortbl", "falt", "fchars", "ffdeftext", "ffentrymcr", "ffexitmcr",
      "ffformat", "ffhelptext", "ffl", "ffname", "ffstattext", "filetbl", "fldinst", "fontemb", "fontfile",
      "fonttbl", "footer", "footerf", "footerl", "footerr", "footnote", "formfield", "ftncn", "ftnsep",
      "ftnsepc", "generator", "header", "headerf", "headerl", "headerr", "info", "keycode", "keywords",
      "latentstyles", "levelnumbers", "leveltext", "lfolevel", "linkval", "list", "listlevel", "listname",
      "listoverride", "listoverridetable", "listpicture", "liststylename", "listtable", "listtext",
      "lsdlockedexcept", "macc", "maccPr", "mailmerge", "manager", "mmconnectstrdata", "nesttableprops",
      "nextfile", "nonesttables", "objalias", "objclass", "objdata", "object", "objname", "objsect",
      "objtime", "oldcprops", "oldpprops", "oldsprops", "oldtprops", "operator", "panose", "password",
      "passwordhash", "pgp", "pgptbl", "picprop", "pict", "pn", "pnseclvl", "pntext", "pntxta", "pntxtb",
      "printim", "private", "propname", "protend", "protstart", "protusertbl", "pxe", "result", "revtbl",
      "revtim", "rsidtbl", "rxe", "shp", "shpgrp", "shpinst", "shppict", "shprslt", "shptxt", "sn", "sp",
      "staticval", "stylesheet", "subject", "sv", "svb", "tc", "template", "themedata", "title", "txe",
      "ud", "upr", "userprops", "wgrffmtfilter", "windowcaption", "writereservation",
      "writereservhash", "xe", "xform", "xmlattrname", "xmlattrvalue", "xmlclose", "xmlname", "xmlnstbl",
      "xmlopen");

  private static final Map<String, String> SPECIAL_WORDS = Map.ofEntries(
      Map.entry("par", "\n"),
      Map.entry("line", "\n"),
      Map.entry("row", "\n"),
      Map.entry("sect", "\n\n"),
      Map.entry("page", "\n\n"),
      Map.entry("tab", "\t"),
      Map.entry("cell", "\t"),
      Map.entry("emdash", "\u2014"),
      Map.entry("endash", "\u2013"),
      Map.entry("emspace", "\u2003"),
      Map.entry("enspace", "\u2002"),
      Map.entry("qmspace", "\u2005"),
      Map.entry("bullet", "\u2022"),
      Map.entry("lquote", "\u2018"),
      Map.entry("rquote", "\u2019"),
      Map.entry("ldblquote", "\u201C"),
      Map.entry("rdblquote", "\u201D"));

  /**
   * Creates a converter.
   */
  public RtfPlainTextConverter() {}

  @Override
  public String toPlainText(String markup) {
    Objects.requireNonNull(markup, "markup");
    return new Pass(markup).run();
  }

  private record GroupState(boolean ignorable, int unicodeSkip) {}

  private static final class Pass {
    private final String in;
    private final StringBuilder out;
    private final Deque<GroupState> stack = new ArrayDeque<>();
    private boolean ignorable;
    private int unicodeSkip = 1;
    private int pendingSkip;
    private Charset codePage = DEFAULT_CODE_PAGE;
    private int pos;

    private Pass(String in) {
      this.in = in;
      this.out = new StringBuilder(in.length());
    }

    String run() {
      int n = in.length();
      while (pos < n) {
        char c = in.charAt(pos);
        switch (c) {
          case '{' -> {
            stack.push(new GroupState(ignorable, unicodeSkip));
            pendingSkip = 0;
            pos++;
          }
          case '}' -> {
            GroupState restored = stack.poll();
            if (restored != null) {
              ignorable = restored.ignorable();
              unicodeSkip = restored.unicodeSkip();
            }
            pendingSkip = 0;
            pos++;
          }
          case '\\' -> controlSequence();
          case '\r', '\n' -> pos++;
          default -> {
            if (c < 0x20) {
              // protected color-change markers are never consumed as unicode fallback characters
              pendingSkip = 0;
              emit(String.valueOf(c));
            } else {
              text(String.valueOf(c));
            }
            pos++;
          }
        }
      }
      if (!stack.isEmpty()) {
        log.debug("RTF input ended with {} unclosed groups", stack.size());
      }
      return out.toString();
    }

    private void controlSequence() {
      int n = in.length();
      if (pos + 1 >= n) {
        pos++;
        return;
      }
      char next = in.charAt(pos + 1);
      if (isAsciiLetter(next)) {
        controlWord();
        return;
      }
      pos += 2;
      switch (next) {
        case '\\', '{', '}' -> text(String.valueOf(next));
        case '\'' -> hexEscape();
        case '*' -> ignorable = true;
        case '\n', '\r' -> text("\n");
        case '~' -> text("\u00A0");
        case '_' -> text("\u2011");
        default -> {
          // \- optional hyphen, \| and \: index symbols: nothing to emit
        }
      }
    }

    private void controlWord() {
      int n = in.length();
      int start = pos + 1;
      int i = start;
      while (i < n && isAsciiLetter(in.charAt(i))) {
        i++;
      }
      String word = in.substring(start, i);
      Integer parameter = null;
      int paramStart = i;
      if (i < n && in.charAt(i) == '-') {
        i++;
      }
      int digitsStart = i;
      while (i < n && in.charAt(i) >= '0' && in.charAt(i) <= '9' && i - digitsStart < 10) {
        i++;
      }
      if (i > digitsStart) {
        parameter = parseParameter(in.substring(paramStart, i));
      } else {
        i = paramStart;
      }
      if (i < n && in.charAt(i) == ' ') {
        i++;
      }
      pos = i;
      word(word, parameter);
    }

    private void word(String word, Integer parameter) {
      if (DESTINATIONS.contains(word)) {
        ignorable = true;
        return;
      }
      switch (word) {
        case "u" -> {
          if (parameter != null) {
            int value = parameter < 0 ? parameter + 65536 : parameter;
            emit(String.valueOf((char) value));
            pendingSkip = unicodeSkip;
          }
        }
        case "uc" -> unicodeSkip = parameter == null ? 1 : Math.max(0, parameter);
        case "ansicpg" -> codePage = codePage(parameter);
        default -> {
          String special = SPECIAL_WORDS.get(word);
          if (special != null) {
            text(special);
          }
        }
      }
    }

    private void hexEscape() {
      int n = in.length();
      if (pos + 1 >= n) {
        pos = n;
        return;
      }
      int high = Character.digit(in.charAt(pos), 16);
      int low = Character.digit(in.charAt(pos + 1), 16);
      pos += 2;
      if (high < 0 || low < 0) {
        return;
      }
      byte[] raw = {(byte) ((high << 4) | low)};
      text(new String(raw, codePage));
    }

    /** Emits text subject to <code>&#92;ucN</code> fallback skipping. */
    private void text(String value) {
      if (pendingSkip > 0) {
        pendingSkip--;
        return;
      }
      emit(value);
    }

    private void emit(String value) {
      if (!ignorable) {
        out.append(value);
      }
    }

    private static Integer parseParameter(String digits) {
      try {
        return Integer.valueOf(digits);
      } catch (NumberFormatException ex) {
        log.debug("Ignoring out-of-range RTF parameter {}", digits);
        return null;
      }
    }

    private Charset codePage(Integer parameter) {
      if (parameter == null) {
        return codePage;
      }
      String name = parameter == 65001 ? "UTF-8" : "windows-" + parameter;
      try {
        if (Charset.isSupported(name)) {
          return Charset.forName(name);
        }
        if (Charset.isSupported("cp" + parameter)) {
          return Charset.forName("cp" + parameter);
        }
      } catch (IllegalCharsetNameException ex) {
        log.debug("Invalid code page name {}", name, ex);
      }
      log.debug("Unsupported RTF code page {}; keeping {}", parameter, codePage);
      return codePage;
    }

    private static boolean isAsciiLetter(char c) {
      return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
  }
}
