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
package jabuti.common;

import java.io.IOException;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

import jabuti.common.exceptions.CanonicalizerRuntimeError;

public class Logging {
  private static final String JABUTI_LOGGER_NAME = "jabuti";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  static final String FILE_APPENDER_NAME = "jabuti-file";

  /**
   * Messages already emitted, by level.
   */
  private static final SetMultimap<Level, String> emitted =
          HashMultimap.create();

  public static Logger getJabutiLogger() {
    return Logger.getLogger(JABUTI_LOGGER_NAME);
  }

  /**
   * Send compiler log output to a file.
   * @param logfile path of log file, empty to leave log4j configuration alone
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the compiler logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger jabutiLogger = getJabutiLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      return jabutiLogger;
    }

    // Replace the appender from any earlier setup
    Appender previous = jabutiLogger.getAppender(FILE_APPENDER_NAME);
    if (previous != null) {
      jabutiLogger.removeAppender(previous);
      previous.close();
    }

    try {
      FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                               logfile, false);
      appender.setName(FILE_APPENDER_NAME);
      jabutiLogger.addAppender(appender);
    } catch (IOException e) {
      throw new CanonicalizerRuntimeError("Could not open log file \""
                                          + logfile + "\"", e);
    }
    jabutiLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return jabutiLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.put(level, msg);
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getJabutiLogger().warn(msg);
    } else {
      Logging.getJabutiLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
