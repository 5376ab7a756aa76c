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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.pseudo.common.exceptions.InvalidOptionException;
import exm.pseudo.lexer.KeywordTable;
import exm.pseudo.lexer.LexerOptions;

/**
 * Front end settings.
 *
 * An immutable snapshot of properties: built-in defaults, overridden by
 * Java system properties of the same name, overridden in turn by values
 * passed explicitly (e.g. -D on the command line).  Values are validated
 * when the snapshot is created.
 * */
public class Settings
{
  public static final String CASE_INSENSITIVE_KEYWORDS =
                                      "pseudo.lexer.case-insensitive";
  /** Comma-separated list of line comment markers */
  public static final String COMMENT_MARKERS = "pseudo.lexer.comment-markers";

  public static final String LOG_FILE = "pseudo.log.file";
  public static final String LOG_TRACE = "pseudo.log.trace";

  private static final Properties DEFAULTS;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(CASE_INSENSITIVE_KEYWORDS, "true");
    defaults.setProperty(COMMENT_MARKERS,
        StringUtils.join(LexerOptions.DEFAULT_COMMENT_MARKERS, ','));
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    DEFAULTS = defaults;
  }

  private final Properties properties;

  private Settings(Properties properties) {
    this.properties = properties;
  }

  public static Settings defaults() {
    return new Settings(copy(DEFAULTS));
  }

  /**
   * @param overrides explicit values, taking precedence over system
   *        properties
   * @throws InvalidOptionException if a key is unknown or a value is
   *        malformed
   */
  public static Settings load(Map<String, String> overrides)
                                  throws InvalidOptionException {
    Properties props = copy(DEFAULTS);
    for (String key: DEFAULTS.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        props.setProperty(key, sysVal);
      }
    }
    for (Map.Entry<String, String> e: overrides.entrySet()) {
      if (!DEFAULTS.containsKey(e.getKey())) {
        throw new InvalidOptionException("Unknown setting " + e.getKey()
            + ", expected one of: " + StringUtils.join(keys(DEFAULTS), ", "));
      }
      props.setProperty(e.getKey(), e.getValue());
    }
    Settings settings = new Settings(props);
    settings.validate();
    return settings;
  }

  private void validate() throws InvalidOptionException {
    getBoolean(CASE_INSENSITIVE_KEYWORDS);
    getBoolean(LOG_TRACE);
    getList(COMMENT_MARKERS);
  }

  public String get(String key) {
    return properties.getProperty(key);
  }

  public boolean getBoolean(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    val = val.trim();
    if (val.equalsIgnoreCase("true")) {
      return true;
    } else if (val.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option "
          + key + ": '" + val + "'");
    }
  }

  /**
   * @return non-empty list of trimmed comma-separated values
   */
  public List<String> getList(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    List<String> result = new ArrayList<String>();
    if (val != null) {
      for (String part: StringUtils.split(val, ',')) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
          result.add(trimmed);
        }
      }
    }
    if (result.isEmpty()) {
      throw new InvalidOptionException("Expected comma-separated list for "
                                       + key + " but was '" + val + "'");
    }
    return result;
  }

  /**
   * Build the lexer configuration these settings describe
   */
  public LexerOptions lexerOptions() throws InvalidOptionException {
    KeywordTable keywords =
        KeywordTable.standard(getBoolean(CASE_INSENSITIVE_KEYWORDS));
    return new LexerOptions(keywords, getList(COMMENT_MARKERS));
  }

  public List<String> getKeys() {
    return keys(properties);
  }

  private static List<String> keys(Properties props) {
    List<String> keys = new ArrayList<String>(props.stringPropertyNames());
    Collections.sort(keys);
    return ImmutableList.copyOf(keys);
  }

  private static Properties copy(Properties src) {
    Properties dst = new Properties();
    for (String key: src.stringPropertyNames()) {
      dst.setProperty(key, src.getProperty(key));
    }
    return dst;
  }
}
