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

package exm.pseudo.common;

import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Appender;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.pseudo.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String PSEUDO_LOGGER_NAME = "exm.pseudo";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getLogger()
  {
    return Logger.getLogger(PSEUDO_LOGGER_NAME);
  }

  /**
   * Route front end logging to a file or to stderr.  Without a log file
   * only warnings reach the console unless trace is set.
   * @param logfile path of log file, or empty for stderr
   * @param trace if true, log everything including per-token detail
   * @return the configured logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                        throws InvalidOptionException
  {
    Logger logger = getLogger();
    Layout layout = new PatternLayout(LOG_PATTERN);
    Appender appender;
    if (StringUtils.isBlank(logfile)) {
      appender = new ConsoleAppender(layout, ConsoleAppender.SYSTEM_ERR);
      logger.setLevel(trace ? Level.TRACE : Level.WARN);
    } else {
      try {
        appender = new FileAppender(layout, logfile, false);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file "
                                         + logfile + ": " + e.getMessage());
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    logger.removeAllAppenders();
    logger.addAppender(appender);
    logger.setAdditivity(false);
    return logger;
  }
}
