package com.wordgrid.dto;

public record ErrorMessage(String type, String message) {
  public ErrorMessage(String message) {
    this("error", message);
  }
}
