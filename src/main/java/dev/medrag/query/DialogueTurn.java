package dev.medrag.query;

import org.jspecify.annotations.Nullable;

/**
 * One prior turn of the consultation, used only to resolve references during query rewriting.
 *
 * @param role speaker, e.g. {@code user} or {@code assistant}
 * @param content what was said
 */
public record DialogueTurn(@Nullable String role, @Nullable String content) {

  /** True when both role and content carry text. */
  public boolean isRenderable() {
    return role != null && !role.isBlank() && content != null && !content.isBlank();
  }
}
