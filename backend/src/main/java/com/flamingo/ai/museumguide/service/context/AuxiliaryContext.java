package com.flamingo.ai.museumguide.service.context;

/**
 * What the auxiliary provider knows about a visitor.
 *
 * @param description free-text visual description, empty when unavailable
 * @param available whether the provider had a description for the session
 */
public record AuxiliaryContext(String description, boolean available) {

  public AuxiliaryContext {
    description = description == null ? "" : description.trim();
    available = available && !description.isEmpty();
  }

  public static AuxiliaryContext unavailable() {
    return new AuxiliaryContext("", false);
  }

  public static AuxiliaryContext of(String description) {
    return new AuxiliaryContext(description, true);
  }
}
