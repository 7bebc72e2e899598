package io.bakky.persistence.jdbc;

import io.bakky.persistence.error.QueryException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Loads statements kept in {@code .sql} files. */
public final class SqlFiles {
  private SqlFiles() {}

  /**
   * First {@code ;}-terminated statement of the file, trimmed, without the semicolon.
   * Full-line {@code --} comments are skipped. A file without a semicolon yields its whole text.
   *
   * @throws QueryException when the file cannot be read or holds no statement
   */
  public static String firstStatement(Path file) {
    final String text;
    try {
      text = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new QueryException("Cannot read SQL file " + file + ": " + e.getMessage(), e);
    }
    return firstStatement(text, file.toString());
  }

  static String firstStatement(String text, String source) {
    StringBuilder sb = new StringBuilder();
    for (String line : text.split("\\R")) {
      if (line.trim().startsWith("--")) continue;
      sb.append(line).append('\n');
    }
    String body = sb.toString();
    int semi = body.indexOf(';');
    String stmt = (semi < 0 ? body : body.substring(0, semi)).trim();
    if (stmt.isEmpty()) throw new QueryException("No SQL statement in " + source);
    return stmt;
  }
}
