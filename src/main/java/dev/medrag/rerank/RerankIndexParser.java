package dev.medrag.rerank;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Parses the candidate indices a language model returns for a rerank prompt.
 *
 * <p>Tokens are separated by ASCII or full-width commas, enumeration commas or whitespace. Tokens
 * that are not plain non-negative integers, indices outside {@code [0, candidateCount)} and
 * repeated indices are skipped. The model's order is kept and the list is cut to {@code topK}.
 */
public final class RerankIndexParser {

  private static final Pattern SEPARATORS = Pattern.compile("[,，、\\s]+");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private RerankIndexParser() {}

  public static List<Integer> parse(@Nullable String response, int candidateCount, int topK) {
    if (response == null || response.isBlank() || topK <= 0) {
      return List.of();
    }
    Set<Integer> indices = new LinkedHashSet<>();
    for (String token : SEPARATORS.split(response.strip())) {
      if (!DIGITS.matcher(token).matches()) {
        continue;
      }
      int index;
      try {
        index = Integer.parseInt(token);
      } catch (NumberFormatException e) {
        // too many digits for an int, cannot be a candidate index
        continue;
      }
      if (index < candidateCount) {
        indices.add(index);
      }
      if (indices.size() == topK) {
        break;
      }
    }
    return new ArrayList<>(indices);
  }
}
