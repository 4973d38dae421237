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


package org.funcform.compiler;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.CharStreams;
import org.funcform.testing.TestdataScanner;
import org.funcform.testing.TestdataScanner.TestProgram;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Lowers each function definition in the .fpy files in the testdata directory, and checks the
 * result against the LOWER comment that follows it.
 */
@RunWith(TestParameterInjector.class)
public class CompilerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/funcform/compiler/testdata");

  /**
   * Each definition is expected to be followed by a string that begins {@code """LOWER}. There are
   * three variants:
   *
   * <ul>
   *   <li>With nothing else before the closing quotes: the test passes if the definition is
   *       lowered successfully.
   *   <li>With an error message (e.g. {@code """LOWER: Varargs are not allowed."""}): the test
   *       passes if lowering fails with an error whose message starts with the given text.
   *   <li>With a colon followed by a newline and the expected global table: the test passes if the
   *       definition is lowered and the printed global table matches.
   * </ul>
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n\"\"\"LOWER(.*?)\"\"\"\\n*", Pattern.DOTALL);

  /** A pattern to parse the first line of a LOWER comment (beginning immediately after "LOWER"). */
  private static final Pattern FIRST_LINE_PATTERN = Pattern.compile(" *(:.*\n?)?");

  @Test
  public void lowerTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    checkNotNull(testProgram.comment(), "No LOWER comment found");
    Matcher partsMatcher = FIRST_LINE_PATTERN.matcher(testProgram.comment());
    assertWithMessage("Bad LOWER comment").that(partsMatcher.lookingAt()).isTrue();
    String errMsg = partsMatcher.group(1);
    String expected = null;
    if (errMsg != null) {
      errMsg = errMsg.trim();
      if (errMsg.length() == 1) {
        errMsg = null;
        expected = testProgram.comment().substring(partsMatcher.end());
      } else {
        // Drop the colon
        errMsg = errMsg.substring(1);
        assertWithMessage("Noise after error message in LOWER comment")
            .that(partsMatcher.end())
            .isEqualTo(testProgram.comment().length());
      }
    }
    GlobalEnv globals = new GlobalEnv();
    Locator locator = new Locator(testProgram.file(), testProgram.line());
    try {
      Compiler.lower(CharStreams.fromString(testProgram.code()), locator, globals);
      assertWithMessage("Expected error, lowered OK").that(errMsg).isNull();
      String result = globals.toString();
      System.out.format("** %s:\n%s\n", testProgram.name(), result);
      if (expected != null) {
        assertWithMessage("Lowering results don't match")
            .that(cleanLines(result))
            .isEqualTo(cleanLines(expected));
      }
    } catch (CompileError e) {
      errMsg = (errMsg == null) ? "(no error expected)" : errMsg.trim();
      assertWithMessage("Unexpected error %s", e).that(e.getMessage()).startsWith(errMsg);
    }
  }

  /** Provides a TestProgram for each definition in an ".fpy" file in our testdata directory. */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, ".fpy", COMMENT_PATTERN);
    }
  }

  /**
   * Removes all whitespace at the beginning and end of lines in the given output, and removes all
   * completely blank lines.
   */
  private static String cleanLines(String output) {
    return output.replaceAll(" *\n[ \n]*", "\n").trim();
  }
}
