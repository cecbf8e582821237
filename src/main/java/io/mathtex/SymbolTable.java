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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static io.mathtex.LexemeKind.*;

/**
 * Static lookup from single characters and backslash commands to their
 * {@link LexemeKind}. Lookups never fail: anything not in the table comes back
 * as {@link LexemeKind#UNKNOWN}. No attempt is made to decide whether a command
 * is valid LaTeX.
 */
public final class SymbolTable {

  private SymbolTable() {}

  // Single char symbols indexed by char for quick lookup
  private static final LexemeKind[] charLookup = new LexemeKind[128];

  private static final Map<String,LexemeKind> commands;

  static {
    Map<String,LexemeKind> map = new HashMap<>();
    Arrays.stream(LexemeKind.values())
          .filter(kind -> kind.asString != null)
          .filter(kind -> kind != LINE_BREAK)
          .forEach(kind -> {
            if (kind.asString.length() == 1) {
              charLookup[kind.asString.charAt(0)] = kind;
            }
            else {
              map.put(kind.asString, kind);
            }
          });

    // Alternative spellings
    map.put("\\le", LESS_THAN_EQUAL);
    map.put("\\ge", GREATER_THAN_EQUAL);
    map.put("\\ne", NOT_EQUAL);

    commands = Collections.unmodifiableMap(map);
  }

  /**
   * Look up a single non-alphanumeric character.
   * @param c  the character
   * @return the kind or UNKNOWN if not a known symbol
   */
  public static LexemeKind lookup(char c) {
    LexemeKind kind = c < charLookup.length ? charLookup[c] : null;
    return kind == null ? UNKNOWN : kind;
  }

  /**
   * Look up a backslash command such as <code>\alpha</code>.
   * @param command  the command including its leading backslash
   * @return the kind or UNKNOWN if command is not known
   */
  public static LexemeKind lookupCommand(String command) {
    return commands.getOrDefault(command, UNKNOWN);
  }

  public static boolean isKnownCommand(String command) {
    return commands.containsKey(command);
  }

  /**
   * @return all command spellings (including aliases) in the table
   */
  public static Set<String> commandNames() {
    return Collections.unmodifiableSet(new TreeSet<>(commands.keySet()));
  }
}
