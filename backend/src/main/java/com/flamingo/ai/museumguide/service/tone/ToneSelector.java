package com.flamingo.ai.museumguide.service.tone;

import com.flamingo.ai.museumguide.domain.enums.ToneProfile;

/** Picks the communication style for a visitor from a description of how they look. */
public interface ToneSelector {

  /**
   * Selects a tone profile.
   *
   * @param auxiliaryContext visual description of the visitor; may be null or blank
   * @return the selected profile, {@link ToneProfile#CASUAL_FRIENDLY} when nothing decides
   */
  ToneProfile select(String auxiliaryContext);
}
