/*
 * Copyright © 2022,2023 James Crawford
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
 *
 */

package io.mathtex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Properties;

/**
 * Load ~/.mathtexrc file and apply the defaults it lists to a context builder.
 * The file is in Java properties format:
 * <pre>
 *   fontSize=48
 *   width=600
 *   height=400
 *   margin=10
 *   failOnUnknownCommand=true
 *   allowUnclosed=false
 * </pre>
 * Unknown keys are ignored. Options given on the command line are applied after
 * these so they take precedence.
 */
public class MathTexOptions {
  private static final Logger log = LogManager.getLogger(MathTexOptions.class);

  final static String OPTIONS_FILE     = System.getProperty("user.home") + "/.mathtexrc";
  final static String FONT_SIZE        = "fontSize";
  final static String MARGIN           = "margin";
  final static String WIDTH            = "width";
  final static String HEIGHT           = "height";
  final static String FAIL_ON_UNKNOWN  = "failOnUnknownCommand";
  final static String ALLOW_UNCLOSED   = "allowUnclosed";

  private final Properties properties;

  private MathTexOptions(Properties properties) {
    this.properties = properties;
  }

  /**
   * Load options from ~/.mathtexrc if it exists
   * @return the options (empty if there is no file)
   */
  public static MathTexOptions initOptions() {
    return initOptions(new File(OPTIONS_FILE));
  }

  public static MathTexOptions initOptions(File file) {
    Properties properties = new Properties();
    if (!file.exists()) {
      return new MathTexOptions(properties);
    }
    try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      properties.load(reader);
      log.debug("Loaded {} option(s) from {}", properties.size(), file);
      return new MathTexOptions(properties);
    }
    catch (IOException e) {
      throw new MathTexError("Error loading options from " + file, e);
    }
  }

  /**
   * Apply any options that were set to the builder
   * @param builder  the builder
   * @return the builder
   */
  public MathTexContext.MathTexContextBuilder applyTo(MathTexContext.MathTexContextBuilder builder) {
    if (properties.containsKey(FONT_SIZE))       { builder.fontSize(intValue(FONT_SIZE)); }
    if (properties.containsKey(MARGIN))          { builder.margin(intValue(MARGIN)); }
    if (properties.containsKey(WIDTH))           { builder.width(intValue(WIDTH)); }
    if (properties.containsKey(HEIGHT))          { builder.height(intValue(HEIGHT)); }
    if (properties.containsKey(FAIL_ON_UNKNOWN)) { builder.failOnUnknownCommand(booleanValue(FAIL_ON_UNKNOWN)); }
    if (properties.containsKey(ALLOW_UNCLOSED))  { builder.allowUnclosed(booleanValue(ALLOW_UNCLOSED)); }
    return builder;
  }

  private int intValue(String key) {
    return Utils.parseInt(key, properties.getProperty(key));
  }

  private boolean booleanValue(String key) {
    String value = properties.getProperty(key).trim();
    if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
      throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "' is not true or false");
    }
    return Boolean.parseBoolean(value);
  }
}
