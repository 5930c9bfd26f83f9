package com.wordgrid.application;

/** The dictionary resource is missing or cannot be read. */
public class DictionaryLoadException extends IllegalStateException {
  public DictionaryLoadException(String message) {
    super(message);
  }

  public DictionaryLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
