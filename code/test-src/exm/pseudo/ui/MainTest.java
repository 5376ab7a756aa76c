/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.pseudo.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.pseudo.common.Settings;
import exm.pseudo.common.exceptions.PseudoFatal;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private String source(String text) throws IOException {
    File f = tmp.newFile("prog.pseudo");
    FileUtils.writeStringToFile(f, text, StandardCharsets.UTF_8);
    return f.getPath();
  }

  private static void assertExit(ExitCode expected, String... args) {
    try {
      Main.run(args);
      fail("expected exit code " + expected);
    } catch (PseudoFatal e) {
      assertEquals(expected.code(), e.exitCode);
    }
  }

  @Test
  public void testParseSuccess() throws IOException {
    Main.run(new String[] {source("ENTERO x = 5\nSI x > 0 ENTONCES print(x) FIN_SI")});
    Main.run(new String[] {"--tokens", source("x <- 1")});
  }

  @Test
  public void testSyntaxError() throws IOException {
    assertExit(ExitCode.ERROR_SYNTAX, source("MIENTRAS x < 10 HACER x = x + 1"));
  }

  @Test
  public void testLexicalError() throws IOException {
    assertExit(ExitCode.ERROR_LEXICAL, source("x <- @"));
    assertExit(ExitCode.ERROR_LEXICAL, "-t", tmp.getRoot() + "/prog.pseudo");
  }

  @Test
  public void testMissingInput() {
    assertExit(ExitCode.ERROR_IO,
               new File(tmp.getRoot(), "missing.pseudo").getPath());
  }

  @Test
  public void testBadArguments() throws IOException {
    String input = source("x <- 1");
    assertExit(ExitCode.ERROR_COMMAND);
    assertExit(ExitCode.ERROR_COMMAND, input, input);
    assertExit(ExitCode.ERROR_COMMAND, "--no-such-flag", input);
    assertExit(ExitCode.ERROR_COMMAND, "-D", "pseudo.unknown=1", input);
    assertExit(ExitCode.ERROR_COMMAND,
               "-D", "pseudo.lexer.case-insensitive=perhaps", input);
  }

  @Test
  public void testSettingsFromCommandLine() throws IOException {
    String input = source("si x entonces fin_si");
    // Lower case keywords are identifiers once case-insensitivity is off
    assertExit(ExitCode.ERROR_SYNTAX,
               "-D", "pseudo.lexer.case-insensitive=false", input);
    Main.run(new String[] {input});
  }

  @Test
  public void testHelpListsSettings() throws IOException {
    ByteArrayOutputStream buf = new ByteArrayOutputStream();
    PrintStream saved = System.out;
    System.setOut(new PrintStream(buf, true, "UTF-8"));
    try {
      assertExit(ExitCode.SUCCESS, "--help");
    } finally {
      System.setOut(saved);
    }
    String help = new String(buf.toByteArray(), StandardCharsets.UTF_8);
    assertTrue(help, help.contains("--tokens"));
    for (String key: Settings.defaults().getKeys()) {
      assertTrue(help, help.contains(key));
    }
  }
}
