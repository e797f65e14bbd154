package org.prism.domain.transcript;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.prism.domain.error.UnparsableFilenameException;

/**
 * <strong>What:</strong> Derives a {@link CaseKey} from camel-cased document names such as
 * {@code marcelCharacterDefense.rtf}.
 * <p><strong>Rule:</strong> the stem is split into alphabetic runs that are either all lower-case or one upper-case
 * letter followed by lower-case letters. The first run, capitalized, is the client name; the remaining runs,
 * lower-cased and concatenated, form the category. Characters outside {@code [A-Za-z]} separate runs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class CaseNameParser {
  private static final Pattern RUN = Pattern.compile("[a-z]+|[A-Z][a-z]*");

  private CaseNameParser() {}

  /**
   * Parses the file name of {@code path}.
   *
   * @param path document path; only the file name is considered
   * @return client/category key
   * @throws UnparsableFilenameException if fewer than two alphabetic runs are found
   */
  public static CaseKey parse(Path path) throws UnparsableFilenameException {
    Objects.requireNonNull(path, "path");
    Path name = path.getFileName();
    if (name == null) {
      throw new UnparsableFilenameException(path.toString(), "has no file name component");
    }
    return parse(name.toString());
  }

  /**
   * Parses a file name, ignoring its final extension.
   *
   * @param fileName file name such as {@code meganDenial.rtf}
   * @return client/category key
   * @throws UnparsableFilenameException if fewer than two alphabetic runs are found
   */
  public static CaseKey parse(String fileName) throws UnparsableFilenameException {
    Objects.requireNonNull(fileName, "fileName");
    List<String> runs = runs(stem(fileName));
    if (runs.size() < 2) {
      throw new UnparsableFilenameException(fileName,
          "is not partitionable into a client name and a category (found " + runs.size() + " name parts)");
    }
    String clientName = capitalize(runs.get(0));
    StringBuilder category = new StringBuilder();
    for (String run : runs.subList(1, runs.size())) {
      category.append(run.toLowerCase(Locale.ROOT));
    }
    return new CaseKey(clientName, category.toString());
  }

  static String stem(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  private static List<String> runs(String stem) {
    List<String> runs = new ArrayList<>();
    Matcher matcher = RUN.matcher(stem);
    while (matcher.find()) {
      runs.add(matcher.group());
    }
    return runs;
  }

  private static String capitalize(String run) {
    return run.substring(0, 1).toUpperCase(Locale.ROOT) + run.substring(1).toLowerCase(Locale.ROOT);
  }
}
