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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Utils {

  /**
   * Options read from the command line by {@link #parseArgs}
   */
  public static class Args {
    private final Map<Character,Integer> flags  = new HashMap<>();
    private final Map<Character,String>  values = new HashMap<>();
    private final List<String>           files  = new ArrayList<>();

    public boolean has(char opt) {
      return flags.containsKey(opt) || values.containsKey(opt);
    }

    /**
     * @return how many times a flag was given (0 if not given)
     */
    public int count(char opt) {
      return flags.getOrDefault(opt, 0);
    }

    public String value(char opt) {
      return values.get(opt);
    }

    /**
     * @return the args that are not options, in order
     */
    public List<String> files() {
      return files;
    }
  }

  /**
   * Parse command line args. Flags can be grouped ("-tv") and repeated ("-dd"), in
   * which case they are counted. Valued options take the rest of the arg ("-s12") or
   * the next arg ("-s 12") and can only be given once. "-h" stops parsing and "--"
   * makes all remaining args into files.
   * @param args        the args
   * @param flags       the flag chars (e.g. "tvd")
   * @param valueOpts   the chars of options taking a value (e.g. "es")
   * @return the parsed options
   * @throws IllegalArgumentException for unknown options or missing or repeated values
   */
  public static Args parseArgs(String[] args, String flags, String valueOpts) {
    Args    result      = new Args();
    boolean optionsDone = false;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (optionsDone || !arg.startsWith("-") || arg.length() == 1) {
        result.files.add(arg);
        continue;
      }
      if (arg.equals("--")) {
        optionsDone = true;
        continue;
      }
      for (int j = 1; j < arg.length(); j++) {
        char opt = arg.charAt(j);
        if (opt == 'h') {
          result.flags.put('h', 1);
          return result;
        }
        if (flags.indexOf(opt) != -1) {
          result.flags.merge(opt, 1, Integer::sum);
          continue;
        }
        if (valueOpts.indexOf(opt) == -1) {
          throw new IllegalArgumentException("Unknown option '-" + opt + "'");
        }
        if (result.values.containsKey(opt)) {
          throw new IllegalArgumentException("Multiple values specified for '-" + opt + "'");
        }
        String value = j + 1 < arg.length() ? arg.substring(j + 1) : i + 1 < args.length ? args[++i] : null;
        if (value == null) {
          throw new IllegalArgumentException("Missing value for option '-" + opt + "'");
        }
        result.values.put(opt, value);
        break;
      }
    }
    return result;
  }

  /**
   * Parse an integer option value
   * @param name   name of option for error message
   * @param value  the value
   * @return the int value
   * @throws IllegalArgumentException if not a valid int
   */
  public static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + name + ": '" + value + "' is not an integer");
    }
  }
}
