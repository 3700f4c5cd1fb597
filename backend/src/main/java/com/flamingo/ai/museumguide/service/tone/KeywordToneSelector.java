package com.flamingo.ai.museumguide.service.tone;

import com.flamingo.ai.museumguide.domain.enums.ToneProfile;
import com.flamingo.ai.museumguide.service.rag.chunking.CjkText;
import com.google.common.annotations.VisibleForTesting;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rule-based {@link ToneSelector}.
 *
 * <p>Each of the child, elder and professional profiles collects one point per cue found in the
 * description: English cues must match whole words, Chinese cues match as substrings. An explicit
 * age ("8 years old", "70歲") is worth two points for child (under 18) or elder (65 and over). The
 * best score wins; no cue at all, or a tie at the top, selects {@link ToneProfile#CASUAL_FRIENDLY}.
 */
@Component
@Slf4j
public class KeywordToneSelector implements ToneSelector {

  private static final int AGE_WEIGHT = 2;
  private static final int CHILD_MAX_AGE = 17;
  private static final int ELDER_MIN_AGE = 65;

  private static final Pattern AGE =
      Pattern.compile("(\\d{1,3})\\s*(?:-\\s*)?(?:years?[\\s-]*old|year-old|yrs?\\s+old|歲|岁)");

  private static final Map<ToneProfile, List<String>> CUES = new EnumMap<>(ToneProfile.class);

  static {
    CUES.put(
        ToneProfile.CHILD_FRIENDLY,
        List.of(
            "child", "children", "kid", "kids", "boy", "girl", "little", "young", "teen",
            "teenager", "toddler", "student", "school uniform", "backpack", "小朋友", "小孩",
            "兒童", "儿童", "男孩", "女孩", "學生", "学生", "校服", "少年"));
    CUES.put(
        ToneProfile.ELDER_FRIENDLY,
        List.of(
            "elderly", "old", "senior", "gray hair", "grey hair", "white hair",
            "wrinkles", "cane", "walking stick", "wheelchair", "grandma", "grandpa",
            "grandmother", "grandfather", "老", "長輩", "长辈", "爺爺", "爷爷", "奶奶", "白髮",
            "白发", "拐杖", "輪椅", "轮椅"));
    CUES.put(
        ToneProfile.PROFESSIONAL_FRIENDLY,
        List.of(
            "business", "suit", "formal", "office", "tie", "blazer", "laptop", "corporate",
            "executive", "conference", "briefcase", "professional", "西裝", "西装", "商務", "商务",
            "辦公室", "办公室", "正式", "會議", "会议"));
  }

  private final Map<ToneProfile, List<Pattern>> patterns = new EnumMap<>(ToneProfile.class);

  public KeywordToneSelector() {
    CUES.forEach(
        (profile, cues) ->
            patterns.put(profile, cues.stream().map(KeywordToneSelector::cuePattern).toList()));
  }

  @Override
  public ToneProfile select(String auxiliaryContext) {
    if (auxiliaryContext == null || auxiliaryContext.isBlank()) {
      return ToneProfile.CASUAL_FRIENDLY;
    }
    Map<ToneProfile, Integer> scores = score(auxiliaryContext);

    ToneProfile best = ToneProfile.CASUAL_FRIENDLY;
    int bestScore = 0;
    boolean tie = false;
    for (Map.Entry<ToneProfile, Integer> entry : scores.entrySet()) {
      int value = entry.getValue();
      if (value > bestScore) {
        best = entry.getKey();
        bestScore = value;
        tie = false;
      } else if (value == bestScore && value > 0) {
        tie = true;
      }
    }
    ToneProfile selected = tie ? ToneProfile.CASUAL_FRIENDLY : best;
    log.debug("Tone scores {} -> {} for '{}'", scores, selected, auxiliaryContext);
    return selected;
  }

  @VisibleForTesting
  Map<ToneProfile, Integer> score(String description) {
    String text = description.toLowerCase(Locale.ROOT);
    // "30 years old" is an age, not an elder cue; ages are scored below
    String cueText = AGE.matcher(text).replaceAll(" ");
    Map<ToneProfile, Integer> scores = new EnumMap<>(ToneProfile.class);
    patterns.forEach(
        (profile, cuePatterns) -> {
          int hits = 0;
          for (Pattern cue : cuePatterns) {
            if (cue.matcher(cueText).find()) {
              hits++;
            }
          }
          scores.put(profile, hits);
        });

    Matcher age = AGE.matcher(text);
    while (age.find()) {
      int years = Integer.parseInt(age.group(1));
      if (years <= CHILD_MAX_AGE) {
        scores.merge(ToneProfile.CHILD_FRIENDLY, AGE_WEIGHT, Integer::sum);
      } else if (years >= ELDER_MIN_AGE) {
        scores.merge(ToneProfile.ELDER_FRIENDLY, AGE_WEIGHT, Integer::sum);
      }
    }
    return scores;
  }

  private static Pattern cuePattern(String cue) {
    if (CjkText.containsCjk(cue)) {
      return Pattern.compile(Pattern.quote(cue));
    }
    return Pattern.compile("\\b" + Pattern.quote(cue) + "\\b");
  }
}
