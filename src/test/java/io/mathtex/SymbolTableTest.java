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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static io.mathtex.LexemeKind.*;
import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

  @Test public void singleChars() {
    assertEquals(PLUS, SymbolTable.lookup('+'));
    assertEquals(SUPERSCRIPT, SymbolTable.lookup('^'));
    assertEquals(LEFT_BRACE, SymbolTable.lookup('{'));
    assertEquals(UNKNOWN, SymbolTable.lookup('a'));
    assertEquals(UNKNOWN, SymbolTable.lookup('\\'));
    assertEquals(UNKNOWN, SymbolTable.lookup('\u00e9'));
    assertEquals(UNKNOWN, SymbolTable.lookup('\uffff'));
  }

  @Test public void commands() {
    assertEquals(DFRAC, SymbolTable.lookupCommand("\\dfrac"));
    assertEquals(LESS_THAN_EQUAL, SymbolTable.lookupCommand("\\le"));
    assertEquals(LESS_THAN_EQUAL, SymbolTable.lookupCommand("\\leq"));
    assertEquals(UNKNOWN, SymbolTable.lookupCommand("dfrac"));
    assertEquals(UNKNOWN, SymbolTable.lookupCommand("\\\\"));
    assertEquals(UNKNOWN, SymbolTable.lookupCommand("\\"));
    assertTrue(SymbolTable.isKnownCommand("\\ne"));
    assertFalse(SymbolTable.isKnownCommand("\\foo"));
  }

  @Test public void everyCommandKindIsRegistered() {
    Arrays.stream(LexemeKind.values())
          .filter(kind -> kind.asString != null && kind.asString.startsWith("\\") && kind != LINE_BREAK)
          .forEach(kind -> assertEquals(kind, SymbolTable.lookupCommand(kind.asString), kind.asString));
    Arrays.stream(LexemeKind.values())
          .filter(kind -> kind.asString != null && kind.asString.length() == 1)
          .forEach(kind -> assertEquals(kind, SymbolTable.lookup(kind.asString.charAt(0)), kind.asString));
  }

  @Test public void commandNamesSorted() {
    Set<String>  names  = SymbolTable.commandNames();
    List<String> sorted = new ArrayList<>(names);
    sorted.sort(null);
    assertEquals(sorted, new ArrayList<>(names));
    assertTrue(names.contains("\\ge"));
    assertTrue(names.contains("\\begin"));
    assertFalse(names.contains("\\\\"));
    assertFalse(names.contains("+"));
    assertThrows(UnsupportedOperationException.class, () -> SymbolTable.commandNames().clear());
  }

  @Test public void kindCategories() {
    assertTrue(ALPHA.isGreekLetter());
    assertTrue(UPPER_OMEGA.isGreekLetter());
    assertFalse(SIN.isGreekLetter());
    assertTrue(LEFT_BRACE.isOpeningDelimiter());
    assertTrue(RIGHT_SQUARE.isClosingDelimiter());
    assertTrue(SUBSCRIPT.isScriptMarker());
    assertTrue(CDOT.isOperator());
    assertTrue(APPROX.isRelation());
    assertTrue(BOTTOM.isGeometrySymbol());
    assertTrue(LOG.isNamedFunction());
    assertTrue(PRODUCT.isBigOperator());
    assertTrue(MILLILITER.isUnit());
    assertEquals(2, DFRAC.arity());
    assertEquals(1, SQUARE_ROOT.arity());
    assertEquals(1, SUPERSCRIPT.arity());
    assertEquals(0, SUM.arity());
    assertEquals(0, LIM.arity());
    assertEquals("\\sqrt", SQUARE_ROOT.toString());
    assertEquals("NUMBER", NUMBER.toString());
  }
}
