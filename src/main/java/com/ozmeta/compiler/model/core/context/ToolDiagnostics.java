package com.ozmeta.compiler.model.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics (errors/warnings/info) accumulated while compiling one target.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();

  public boolean hasErrors() {
	  return !this.errors.isEmpty();
  }

  public void error(String message) {
	  errors.add(message);
  }

  public void warn(String message) {
	  warnings.add(message);
  }

  public void info(String message) {
	  infos.add(message);
  }
}
