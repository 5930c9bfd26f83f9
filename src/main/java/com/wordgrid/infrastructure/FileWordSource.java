package com.wordgrid.infrastructure;

import com.wordgrid.application.DictionaryLoadException;
import com.wordgrid.application.port.WordSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Word list read from a UTF-8 text file, one candidate per line. */
@Component
@ConditionalOnProperty(name = "wordgrid.dictionary.source", havingValue = "file", matchIfMissing = true)
public class FileWordSource implements WordSource {
  private static final Logger log = LoggerFactory.getLogger(FileWordSource.class);

  private final Path path;

  public FileWordSource(@Value("${wordgrid.dictionary.path:words.txt}") String path) {
    this.path = Path.of(Objects.requireNonNull(path, "wordgrid.dictionary.path"));
  }

  @Override
  public List<String> words() {
    Path file = path.toAbsolutePath().normalize();
    if (Files.notExists(file)) {
      throw new DictionaryLoadException("Dictionary file not found: " + file);
    }
    List<String> lines = new ArrayList<>();
    try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = in.readLine()) != null) {
        lines.add(line);
      }
    } catch (IOException e) {
      throw new DictionaryLoadException("Cannot read dictionary file " + file + ": " + e, e);
    }
    log.debug("Read {} lines from {}", lines.size(), file);
    return lines;
  }

  @Override
  public String describe() {
    return path.toString();
  }
}
