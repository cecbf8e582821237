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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MathTexContextTest {

  @Test public void defaults() {
    MathTexContext context = MathTexContext.create().build();
    assertEquals(20, context.fontSize());
    assertEquals(10, context.margin());
    assertEquals(200, context.width());
    assertEquals(200, context.height());
    assertEquals(0, context.debugLevel());
    assertFalse(context.failOnUnknownCommand());
    assertFalse(context.allowUnclosed());
  }

  @Test public void builder() {
    MathTexContext context = MathTexContext.create()
                                           .fontSize(30)
                                           .margin(0)
                                           .width(640)
                                           .height(480)
                                           .debug(1)
                                           .failOnUnknownCommand(true)
                                           .allowUnclosed(true)
                                           .build();
    assertEquals(30, context.fontSize());
    assertEquals(0, context.margin());
    assertEquals(640, context.width());
    assertEquals(480, context.height());
    assertEquals(1, context.debugLevel());
    assertTrue(context.failOnUnknownCommand());
    assertTrue(context.allowUnclosed());
  }

  @Test public void invalidValues() {
    assertThrows(IllegalArgumentException.class, () -> MathTexContext.create().fontSize(0));
    assertThrows(IllegalArgumentException.class, () -> MathTexContext.create().width(-5));
    assertThrows(IllegalArgumentException.class, () -> MathTexContext.create().height(0));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> MathTexContext.create().margin(-1));
    assertEquals("margin cannot be negative but was -1", e.getMessage());
  }

  @Test public void contextControlsParsing() {
    MathTexContext strict = MathTexContext.create().failOnUnknownCommand(true).build();
    assertThrows(ParseError.class, () -> MathTex.parse("\\foo", strict));
    assertNotNull(MathTex.parse("\\foo"));

    MathTexContext lenient = MathTexContext.create().allowUnclosed(true).build();
    assertNotNull(MathTex.parse("(a", lenient));
    assertThrows(ParseError.class, () -> MathTex.parse("(a"));
  }
}
