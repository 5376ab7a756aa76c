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

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.pseudo.ast.Program;
import exm.pseudo.ast.TreePrinter;
import exm.pseudo.common.Logging;
import exm.pseudo.common.Settings;
import exm.pseudo.common.exceptions.InvalidOptionException;
import exm.pseudo.common.exceptions.LexicalError;
import exm.pseudo.common.exceptions.ParseError;
import exm.pseudo.common.exceptions.PseudoFatal;
import exm.pseudo.lexer.Token;
import exm.pseudo.parser.PseudocodeParser;

/**
 * Command line interface to the pseudocode front end.  Parses one file and
 * prints either its token stream or its syntax tree.  Front end options
 * can be given as -D key=value; --help lists the keys.
 */
public class Main {
  private static final String TOKENS_FLAG = "t";
  private static final String LOG_FILE_FLAG = "l";
  private static final String TRACE_FLAG = "v";
  private static final String SETTING_FLAG = "D";
  private static final String HELP_FLAG = "h";

  public static void main(String[] args) {
    try {
      run(args);
    } catch (PseudoFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  /**
   * @throws PseudoFatal with the exit code if anything fails
   */
  static void run(String[] args) {
    Args pseudoArgs = processArgs(args);

    Settings settings;
    try {
      settings = Settings.load(pseudoArgs.settings);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      throw new PseudoFatal(ExitCode.ERROR_COMMAND.code());
    }

    Logger logger;
    try {
      logger = setupLogging(settings);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      throw new PseudoFatal(ExitCode.ERROR_COMMAND.code());
    }

    String source = readInput(pseudoArgs.inputFilename);
    PrintWriter out = new PrintWriter(System.out, true);
    try {
      PseudocodeParser parser = new PseudocodeParser(settings);
      if (pseudoArgs.tokensOnly) {
        List<Token> tokens = parser.tokenize(source);
        for (Token tok: tokens) {
          out.println(tok);
        }
      } else {
        Program program = parser.parse(source);
        new TreePrinter(out, true).visitProgram(program);
      }
      out.flush();
    } catch (LexicalError ex) {
      reportError(pseudoArgs.inputFilename, ex);
      throw new PseudoFatal(ExitCode.ERROR_LEXICAL.code());
    } catch (ParseError ex) {
      reportError(pseudoArgs.inputFilename, ex);
      throw new PseudoFatal(ExitCode.ERROR_SYNTAX.code());
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      throw new PseudoFatal(ExitCode.ERROR_COMMAND.code());
    } catch (RuntimeException ex) {
      reportInternalError(logger, ex);
      throw new PseudoFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(TOKENS_FLAG, "tokens", false,
                   "Print token stream instead of syntax tree");
    opts.addOption(LOG_FILE_FLAG, "log-file", true, "Write log to file");
    opts.addOption(TRACE_FLAG, "trace", false, "Enable trace logging");
    opts.addOption(HELP_FLAG, "help", false, "Print this message");

    Option setting = new Option(SETTING_FLAG, true,
                                "Front end setting, as key=value");
    setting.setArgs(2);
    setting.setValueSeparator('=');
    opts.addOption(setting);
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      throw new PseudoFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      throw new PseudoFatal(ExitCode.SUCCESS.code());
    }

    Map<String, String> settings = new HashMap<String, String>();
    Properties defs = cmd.getOptionProperties(SETTING_FLAG);
    for (String key: defs.stringPropertyNames()) {
      settings.put(key, defs.getProperty(key));
    }
    if (cmd.hasOption(LOG_FILE_FLAG)) {
      settings.put(Settings.LOG_FILE, cmd.getOptionValue(LOG_FILE_FLAG));
    }
    if (cmd.hasOption(TRACE_FLAG)) {
      settings.put(Settings.LOG_TRACE, "true");
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      throw new PseudoFatal(ExitCode.ERROR_COMMAND.code());
    }

    return new Args(remainingArgs[0], cmd.hasOption(TOKENS_FLAG), settings);
  }

  private static Logger setupLogging(Settings settings)
                                    throws InvalidOptionException {
    String logfile = settings.get(Settings.LOG_FILE);
    boolean trace = settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    String footer = "Settings for -" + SETTING_FLAG + ": "
        + StringUtils.join(Settings.defaults().getKeys(), ", ");
    fmt.printHelp("pseudoc [options] <input>", "", opts, footer);
  }

  private static String readInput(String filename) {
    File input = new File(filename);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      throw new PseudoFatal(ExitCode.ERROR_IO.code());
    }
    try {
      return FileUtils.readFileToString(input, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      System.err.println("Error reading " + input + ": " + ex.getMessage());
      throw new PseudoFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void reportError(String filename, ParseError ex) {
    System.err.println("pseudoc error: " + filename + ":" + ex.getMessage());
  }

  private static void reportInternalError(Logger logger, Throwable t) {
    logger.error("Internal error", t);
    System.err.println("PSEUDOC INTERNAL ERROR");
    System.err.println("Please report this");
    t.printStackTrace();
  }

  private static class Args {
    public final String inputFilename;
    public final boolean tokensOnly;
    public final Map<String, String> settings;

    public Args(String inputFilename, boolean tokensOnly,
                Map<String, String> settings) {
      this.inputFilename = inputFilename;
      this.tokensOnly = tokensOnly;
      this.settings = settings;
    }
  }
}
