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
 * Settings for parsing and rendering. A built context can be shared between threads
 * since every parse creates its own tokeniser and stacks.
 * <pre>
 *   MathTexContext context = MathTexContext.create()
 *                                          .failOnUnknownCommand(true)
 *                                          .fontSize(48)
 *                                          .build();
 * </pre>
 */
public class MathTexContext {

  public static final int DEFAULT_FONT_SIZE = 20;
  public static final int DEFAULT_MARGIN    = 10;
  public static final int DEFAULT_WIDTH     = 200;
  public static final int DEFAULT_HEIGHT    = 200;

  boolean failOnUnknownCommand = false;   // Whether unknown commands are errors or passed through as is
  boolean allowUnclosed        = false;   // Whether open groups/environments at a break or at end are tolerated

  // 0 = none, 1 = print tree before rendering
  int debugLevel = 0;

  int fontSize = DEFAULT_FONT_SIZE;
  int margin   = DEFAULT_MARGIN;
  int width    = DEFAULT_WIDTH;
  int height   = DEFAULT_HEIGHT;

  ///////////////////////////////

  public static MathTexContextBuilder create() {
    return new MathTexContext().getMathTexContextBuilder();
  }

  private MathTexContext() {}

  private MathTexContextBuilder getMathTexContextBuilder() {
    return new MathTexContextBuilder();
  }

  public class MathTexContextBuilder {
    private MathTexContextBuilder() {}

    public MathTexContextBuilder failOnUnknownCommand(boolean value) { failOnUnknownCommand = value; return this; }
    public MathTexContextBuilder allowUnclosed(boolean value)        { allowUnclosed        = value; return this; }
    public MathTexContextBuilder debug(int value)                    { debugLevel           = value; return this; }
    public MathTexContextBuilder fontSize(int value)                 { fontSize = positive("fontSize", value); return this; }
    public MathTexContextBuilder margin(int value)                   { margin   = nonNegative("margin", value); return this; }
    public MathTexContextBuilder width(int value)                    { width    = positive("width", value);  return this; }
    public MathTexContextBuilder height(int value)                   { height   = positive("height", value); return this; }

    public MathTexContext build() {
      return MathTexContext.this;
    }
  }

  private static int positive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be greater than 0 but was " + value);
    }
    return value;
  }

  private static int nonNegative(String name, int value) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " cannot be negative but was " + value);
    }
    return value;
  }

  public boolean failOnUnknownCommand() { return failOnUnknownCommand; }
  public boolean allowUnclosed()        { return allowUnclosed; }
  public int     debugLevel()           { return debugLevel; }
  public int     fontSize()             { return fontSize; }
  public int     margin()               { return margin; }
  public int     width()                { return width; }
  public int     height()               { return height; }
}
