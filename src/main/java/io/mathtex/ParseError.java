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

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Structural error found while assembling the tree. Parsing stops at the first
 * one: there is no recovery and no partial tree.
 */
public class ParseError extends MathTexError {

  public enum Type {
    DANGLING_ATTACHMENT,     // '_' or '^' with nothing to attach to
    DUPLICATE_ATTACHMENT,    // second '_' or '^' for same node
    DELIMITER_MISMATCH,      // closing delimiter does not match innermost opener
    MALFORMED_ENVIRONMENT,   // \begin/\end not followed by {name}
    ENVIRONMENT_MISMATCH,    // \end{name} does not match innermost \begin{name}
    UNKNOWN_COMMAND,         // only when unknown commands are configured as errors
    UNCLOSED_SCOPE           // group, argument list, or environment still open
  }

  private final Type type;

  /**
   * Create a parse error
   * @param type    the kind of structural problem
   * @param error   the error message
   * @param lexeme  the location where error occurred
   */
  public ParseError(Type type, String error, Location lexeme) {
    super(error, lexeme);
    this.type = type;
  }

  public Type getType() {
    return type;
  }

  public String getMessage(boolean verbose) {
    if (!verbose) {
      return getMessage();
    }
    StringWriter stringWriter = new StringWriter();
    try (PrintWriter out = new PrintWriter(stringWriter)) {
      printStackTrace(out);
    }
    return stringWriter.toString();
  }
}
