package com.wordgrid.application.port;

import java.util.List;

/** Supplies the raw candidate words a dictionary is built from. */
public interface WordSource {
  /**
   * @return every candidate, one entry per stored line or row, unfiltered
   * @throws com.wordgrid.application.DictionaryLoadException if the backing resource cannot be read
   */
  List<String> words();

  default String describe() {
    return getClass().getSimpleName();
  }
}
