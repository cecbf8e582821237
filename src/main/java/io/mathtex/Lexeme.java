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

/**
 * This class represents a single lexeme read from the markup. Each lexeme
 * keeps track of where it is in the source so that structural errors can
 * show exactly which part of the input they refer to.
 *
 * The kind is never set independently of the text: the Tokeniser decides it
 * from the shape of the text (digits, letters, breaks) or by looking the text
 * up in the {@link SymbolTable}.
 */
public class Lexeme extends Location {
  private LexemeKind kind;     // Lexeme kind
  private int        length;   // Length of lexeme in source

  /**
   * Partially construct a lexeme whose kind and length are not yet known
   * @param source the markup being tokenised
   * @param offset the offset in source where lexeme starts
   */
  public Lexeme(String source, int offset) {
    super(source, offset);
  }

  /**
   * Set kind of lexeme
   * @param kind  the LexemeKind
   * @return the lexeme
   */
  Lexeme setKind(LexemeKind kind) {
    this.kind = kind;
    return this;
  }

  /**
   * Get the kind of the lexeme
   * @return the LexemeKind for the lexeme
   */
  public LexemeKind getKind() { return kind; }

  /**
   * Check if kind of lexeme matches any of kinds passed in
   * @param kinds  the kinds to check
   * @return true if kind matches one of the supplied kinds
   */
  public boolean is(LexemeKind... kinds) {
    for (LexemeKind kind: kinds) {
      if (kind == this.kind) {
        return true;
      }
    }
    return false;
  }

  public boolean isNot(LexemeKind... kinds) {
    return !is(kinds);
  }

  Lexeme setLength(int length) {
    this.length = length;
    return this;
  }

  public int getLength() {
    return length;
  }

  /**
   * Get the actual characters of the lexeme in the source
   * @return the text of the lexeme
   */
  public String getText() {
    return source.substring(offset, offset + length);
  }

  /**
   * True if lexeme was a backslash command (including unrecognised ones).
   * Line breaks are not commands.
   */
  public boolean isCommand() {
    return length > 0 && source.charAt(offset) == '\\' && isNot(LexemeKind.LINE_BREAK);
  }

  /**
   * For a backslash command return the name without the backslash. A backslash
   * not followed by any letters has an empty name.
   * @return the command name or null if lexeme is not a command
   */
  public String getCommandName() {
    return isCommand() ? getText().substring(1) : null;
  }

  @Override
  public String toString() {
    return "Lexeme{" +
           "kind='" + kind +
           "', text='" + getText() + '\'' +
           '}';
  }
}
