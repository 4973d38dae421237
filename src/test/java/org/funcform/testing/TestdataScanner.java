/*
 * Copyright 2025 The Funcform Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.funcform.testing;

import com.google.testing.junit.testparameterinjector.TestParameter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Provides a TestProgram for each chunk of source code in the files of a testdata directory. Each
 * file is split at each match of a comment pattern; the text before the match is the chunk's code,
 * and the pattern's first group is its comment.
 */
@SuppressWarnings("deprecation") // TestParameterValuesProvider
public class TestdataScanner implements TestParameter.TestParameterValuesProvider {

  /** A chunk of source code and the comment that follows it. */
  public record TestProgram(String file, int line, String code, @Nullable String comment) {
    /** Identifies the program by file name and starting line. */
    public String name() {
      return file + ":" + line;
    }

    @Override
    public String toString() {
      return name();
    }
  }

  private final Path dir;
  private final String extension;
  private final Pattern commentPattern;

  protected TestdataScanner(Path dir, String extension, Pattern commentPattern) {
    this.dir = dir;
    this.extension = extension;
    this.commentPattern = commentPattern;
  }

  @Override
  public List<TestProgram> provideValues() {
    List<TestProgram> result = new ArrayList<>();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : files.filter(f -> f.toString().endsWith(extension)).sorted().toList()) {
        scan(file.getFileName().toString(), Files.readString(file), result);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result;
  }

  private void scan(String fileName, String contents, List<TestProgram> result) {
    Matcher matcher = commentPattern.matcher(contents);
    int start = 0;
    int line = 1;
    while (matcher.find()) {
      String code = contents.substring(start, matcher.start());
      result.add(new TestProgram(fileName, line, code, matcher.group(1)));
      line += countLines(contents.substring(start, matcher.end()));
      start = matcher.end();
    }
    String rest = contents.substring(start);
    if (!rest.isBlank()) {
      result.add(new TestProgram(fileName, line, rest, null));
    }
  }

  private static int countLines(String s) {
    return (int) s.chars().filter(c -> c == '\n').count();
  }
}
