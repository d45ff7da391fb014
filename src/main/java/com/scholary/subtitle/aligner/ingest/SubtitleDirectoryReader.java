package com.scholary.subtitle.aligner.ingest;

import com.scholary.subtitle.aligner.ingest.PairingPlan.NamedPair;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads subtitle pairs from a directory tree.
 *
 * <p>Files are paired by their bare names, wherever they sit in the tree. If two files share a
 * name, the first one found wins.
 */
@Component
public class SubtitleDirectoryReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleDirectoryReader.class);

  private final SubtitlePairLocator locator;

  public SubtitleDirectoryReader(SubtitlePairLocator locator) {
    this.locator = locator;
  }

  /**
   * Walk a directory and load every complete pair.
   *
   * @param directory root directory to scan
   * @return loaded pairs and the names of files left unpaired
   * @throws IOException if the directory cannot be walked or a paired file cannot be read
   */
  public DirectoryScan read(Path directory) throws IOException {
    Map<String, Path> filesByName = new LinkedHashMap<>();
    List<String> unpaired = new ArrayList<>();

    try (Stream<Path> paths = Files.walk(directory)) {
      for (Path path : paths.filter(Files::isRegularFile).sorted().toList()) {
        String name = path.getFileName().toString();
        if (filesByName.putIfAbsent(name, path) != null) {
          LOGGER.warn("Ignoring {}: a file with the same name was already found", path);
          unpaired.add(name);
        }
      }
    }

    PairingPlan plan = locator.locate(filesByName.keySet());
    unpaired.addAll(plan.unpaired());

    List<SubtitleFilePair> pairs = new ArrayList<>(plan.pairs().size());
    for (NamedPair pair : plan.pairs()) {
      pairs.add(
          new SubtitleFilePair(
              pair.baseName(),
              pair.primaryName(),
              Files.readAllBytes(filesByName.get(pair.primaryName())),
              pair.secondaryName(),
              Files.readAllBytes(filesByName.get(pair.secondaryName()))));
    }

    LOGGER.info("Read {} subtitle pairs from {}", pairs.size(), directory);
    return new DirectoryScan(pairs, unpaired);
  }

  /**
   * Pairs loaded from a directory.
   *
   * @param pairs complete pairs ordered by base name
   * @param unpaired names of files that were not paired
   */
  public record DirectoryScan(List<SubtitleFilePair> pairs, List<String> unpaired) {}
}
