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

import java.util.NoSuchElementException;

import static io.mathtex.LexemeKind.*;

/**
 * This class represents the tokeniser for a piece of markup. It is constructed with
 * the source and then reads it left to right, returning one lexeme per call to
 * {@link #next()}. Apart from {@link #peek()}, which holds on to a single lexeme,
 * no lookahead is buffered.
 *
 * Spaces are never returned. A single new line is treated as a space: only a blank
 * line (which becomes a PARAGRAPH_BREAK) or a double backslash (a LINE_BREAK) are
 * significant. Digit runs and letter runs are read with maximal munch so that
 * "123" is one NUMBER and "abc" is one ALPHABET lexeme.
 */
public class Tokeniser {
  private       Lexeme currentLexeme;     // Lexeme already read by peek() but not yet returned
  private       Lexeme previousLexeme;    // The last lexeme returned by next()
  private final String source;            // The markup being tokenised
  private final int    length;            // Length of source
  private       int    offset = 0;        // The current position in the source

  /**
   * Constructor
   * @param source  the markup to tokenise
   */
  public Tokeniser(String source) {
    // Strip trailing new lines so that end of input errors point to somewhere useful
    // and a trailing blank line does not open an empty paragraph
    int end = source.length();
    while (end > 0 && (source.charAt(end - 1) == '\n' || source.charAt(end - 1) == '\r')) {
      end--;
    }
    this.source = source.substring(0, end);
    this.length = end;
  }

  /**
   * @return true if there is at least one more lexeme
   */
  public boolean hasNext() {
    if (currentLexeme != null) {
      return true;
    }
    skipSpaces();
    return available(1);
  }

  /**
   * Get the next lexeme and advance past it.
   * @return the next lexeme
   * @throws NoSuchElementException if there are no more lexemes
   */
  public Lexeme next() {
    Lexeme result  = peek();
    previousLexeme = result;
    currentLexeme  = null;
    return result;
  }

  /**
   * Return the next lexeme without advancing
   * @return the next lexeme
   * @throws NoSuchElementException if there are no more lexemes
   */
  public Lexeme peek() {
    if (currentLexeme == null) {
      if (!hasNext()) {
        throw new NoSuchElementException("No more lexemes in source");
      }
      currentLexeme = parseLexeme();
    }
    return currentLexeme;
  }

  /**
   * @return the last lexeme returned by next() or null if none returned yet
   */
  public Lexeme previous() {
    return previousLexeme;
  }

  /**
   * @return location just after the last character of the source
   */
  public Location endOfInput() {
    return new Location(source, length);
  }

  public String getSource() {
    return source;
  }

  //////////////////////////////////////////////////////////////////

  /**
   * This is the main method that reads chars and decides what kind of lexeme to return.
   * Must only be invoked once spaces have been skipped and there is something left.
   * @return the next lexeme from the source
   */
  private Lexeme parseLexeme() {
    Lexeme lexeme = createLexeme();
    int    c      = charAt(0);

    // Single new lines have already been skipped so we must have a blank line
    if (c == '\n') {
      int start = offset;
      advance(charAt(1) == '\r' ? 3 : 2);
      // Further blank lines belong to the same break
      while (isBlankLine()) {
        advance(1);
      }
      return lexeme.setKind(PARAGRAPH_BREAK).setLength(offset - start);
    }

    if (c == '\\') {
      return parseCommand(lexeme);
    }

    if (isDigit(c)) {
      int i = runLength(Tokeniser::isDigit);
      advance(i);
      return lexeme.setKind(NUMBER).setLength(i);
    }

    if (isLetter(c)) {
      int i = runLength(Tokeniser::isLetter);
      advance(i);
      return lexeme.setKind(ALPHABET).setLength(i);
    }

    // Anything else is a single character (treating surrogate pairs as one character)
    int charLength = Character.charCount(source.codePointAt(offset));
    advance(charLength);
    return lexeme.setKind(charLength == 1 ? SymbolTable.lookup((char)c) : UNKNOWN)
                 .setLength(charLength);
  }

  /**
   * Parse either a double backslash or a backslash followed by letters. A backslash
   * followed by anything else is returned on its own as an UNKNOWN command with
   * an empty name and the following character is left for the next lexeme.
   */
  private Lexeme parseCommand(Lexeme lexeme) {
    if (available(2) && charAt(1) == '\\') {
      advance(2);
      return lexeme.setKind(LINE_BREAK).setLength(2);
    }
    advance(1);
    int letters = runLength(Tokeniser::isLetter);
    advance(letters);
    lexeme.setLength(letters + 1);
    return lexeme.setKind(letters == 0 ? UNKNOWN : SymbolTable.lookupCommand(lexeme.getText()));
  }

  private interface CharTest { boolean test(int c); }

  private int runLength(CharTest test) {
    int i = 0;
    while (available(i + 1) && test.test(charAt(i))) { i++; }
    return i;
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isLetter(int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isSpace(int c) {
    return c == ' ' || c == '\t' || c == '\r';
  }

  private boolean isBlankLine() {
    return charAt(0) == '\n' &&
           (charAt(1) == '\n' || (charAt(1) == '\r' && charAt(2) == '\n'));
  }

  private void skipSpaces() {
    while (available(1)) {
      int c = charAt(0);
      if (isSpace(c) || (c == '\n' && !isBlankLine())) {
        advance(1);
        continue;
      }
      break;
    }
  }

  /**
   * Get character given number of positions ahead of current position
   * @param lookahead  how many characters ahead of current offset
   * @return character at given location or -1 if past end of source
   */
  private int charAt(int lookahead) {
    return available(lookahead + 1) ? source.charAt(offset + lookahead) : -1;
  }

  private boolean available(int avail) {
    return offset + avail <= length;
  }

  private void advance(int count) {
    offset += count;
  }

  private Lexeme createLexeme() {
    return new Lexeme(source, offset);
  }
}
