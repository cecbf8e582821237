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
 * A position within the markup being parsed. Line and column are worked out
 * lazily from the offset since they are only needed when reporting errors.
 */
public class Location {
  protected final String source;
  protected final int    offset;

  private int lineStart = -1;    // Offset of first char of the line holding offset
  private int lineNum;

  public Location(String source, int offset) {
    this.source = source;
    this.offset = offset;
  }

  public String getSource() { return source; }
  public int    getOffset() { return offset; }

  /**
   * @return the source line holding this location, without its new line
   */
  public String getLine() {
    findLine();
    int lineEnd = source.indexOf('\n', lineStart);
    return source.substring(lineStart, lineEnd == -1 ? source.length() : lineEnd);
  }

  /**
   * @return line number starting at 1
   */
  public int getLineNum() {
    findLine();
    return lineNum;
  }

  /**
   * @return column starting at 1
   */
  public int getColumn() {
    findLine();
    return offset - lineStart + 1;
  }

  /**
   * Source line followed by a second line with a '^' under this location, for use in
   * error messages
   */
  public String getMarkedSourceLine() {
    return String.format("%s%n%s^", getLine(), " ".repeat(getColumn() - 1));
  }

  private void findLine() {
    if (lineStart != -1) {
      return;
    }
    if (offset < 0 || offset > source.length()) {
      throw new IllegalStateException("Internal error: offset " + offset + " outside source of length " + source.length());
    }
    int count = 1;
    int start = 0;
    for (int i = 0; i < offset; i++) {
      if (source.charAt(i) == '\n') {
        count++;
        start = i + 1;
      }
    }
    lineNum   = count;
    lineStart = start;
  }
}
