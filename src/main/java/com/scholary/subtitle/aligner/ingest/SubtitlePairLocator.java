package com.scholary.subtitle.aligner.ingest;

import com.scholary.subtitle.aligner.config.AlignmentProperties;
import com.scholary.subtitle.aligner.ingest.PairingPlan.NamedPair;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pairs subtitle files by name.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>Only files ending with {@code _<primary>.srt} or {@code _<secondary>.srt} are considered
 *       (case-insensitive)
 *   <li>Files sharing the same base name before the language suffix form a pair
 *   <li>Unmatched singles and other files are reported as unpaired
 * </ul>
 */
@Component
public class SubtitlePairLocator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitlePairLocator.class);

  private final Pattern primaryPattern;
  private final Pattern secondaryPattern;

  public SubtitlePairLocator(AlignmentProperties properties) {
    this.primaryPattern = suffixPattern(properties.pairing().primaryLanguage());
    this.secondaryPattern = suffixPattern(properties.pairing().secondaryLanguage());
  }

  /**
   * Group file names into pairs.
   *
   * @param fileNames bare file names (no directories)
   * @return pairs ordered by base name, plus everything that could not be paired
   */
  public PairingPlan locate(Collection<String> fileNames) {
    Map<String, String> primaries = new TreeMap<>();
    Map<String, String> secondaries = new TreeMap<>();
    List<String> unpaired = new ArrayList<>();

    for (String name : fileNames) {
      Matcher primary = primaryPattern.matcher(name);
      Matcher secondary = secondaryPattern.matcher(name);
      if (primary.matches()) {
        register(primaries, primary.group("base"), name, unpaired);
      } else if (secondary.matches()) {
        register(secondaries, secondary.group("base"), name, unpaired);
      } else {
        unpaired.add(name);
      }
    }

    List<NamedPair> pairs = new ArrayList<>();
    for (Map.Entry<String, String> entry : primaries.entrySet()) {
      String secondaryName = secondaries.remove(entry.getKey());
      if (secondaryName == null) {
        unpaired.add(entry.getValue());
      } else {
        pairs.add(new NamedPair(entry.getKey(), entry.getValue(), secondaryName));
      }
    }
    unpaired.addAll(secondaries.values());

    LOGGER.info("Located {} subtitle pairs, {} files unpaired", pairs.size(), unpaired.size());
    return new PairingPlan(pairs, unpaired);
  }

  private void register(
      Map<String, String> byBase, String baseName, String fileName, List<String> unpaired) {
    if (byBase.putIfAbsent(baseName, fileName) != null) {
      LOGGER.warn("Duplicate subtitle file for '{}': {}", baseName, fileName);
      unpaired.add(fileName);
    }
  }

  private static Pattern suffixPattern(String language) {
    return Pattern.compile(
        "^(?<base>.+)_" + Pattern.quote(language) + "\\.srt$", Pattern.CASE_INSENSITIVE);
  }
}
