package dev.medrag.augment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Subset of the Bing Web Search v7 response used for augmentation. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BingSearchResponse(@Nullable WebPages webPages) {

  /** The {@code webPages} answer. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WebPages(List<WebPage> value) {
    public WebPages {
      value = value == null ? List.of() : List.copyOf(value);
    }
  }

  /** A single web result. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WebPage(@Nullable String name, @Nullable String url, @Nullable String snippet) {}

  public List<WebPage> pages() {
    return webPages == null ? List.of() : webPages.value();
  }
}
