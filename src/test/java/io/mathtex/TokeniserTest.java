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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiConsumer;
import java.util.function.Function;

import static io.mathtex.LexemeKind.*;
import static org.junit.jupiter.api.Assertions.*;

class TokeniserTest {

  private static List<Lexeme> lexemes(String source) {
    Tokeniser    tokeniser = new Tokeniser(source);
    List<Lexeme> result    = new ArrayList<>();
    while (tokeniser.hasNext()) {
      result.add(tokeniser.next());
    }
    return result;
  }

  @Test public void simpleTokens() {
    BiConsumer<String,LexemeKind> doTest = (source,kind) -> {
      Tokeniser tokeniser = new Tokeniser(source);
      assertTrue(tokeniser.hasNext());
      Lexeme lexeme = tokeniser.next();
      assertEquals(kind, lexeme.getKind());
      assertTrue(lexeme.is(kind));
      assertEquals(source.trim(), lexeme.getText());
      assertFalse(tokeniser.hasNext());
    };
    doTest.accept("(", LEFT_PAREN);
    doTest.accept(")", RIGHT_PAREN);
    doTest.accept("[", LEFT_SQUARE);
    doTest.accept("]", RIGHT_SQUARE);
    doTest.accept("{", LEFT_BRACE);
    doTest.accept("}", RIGHT_BRACE);
    doTest.accept(",", COMMA);
    doTest.accept(".", PERIOD);
    doTest.accept(":", COLON);
    doTest.accept(";", SEMICOLON);
    doTest.accept("_", SUBSCRIPT);
    doTest.accept("^", SUPERSCRIPT);
    doTest.accept("+", PLUS);
    doTest.accept("-", MINUS);
    doTest.accept("*", STAR);
    doTest.accept("/", SLASH);
    doTest.accept("%", PERCENT);
    doTest.accept("@", AT);
    doTest.accept("!", BANG);
    doTest.accept("|", PIPE);
    doTest.accept("=", EQUAL);
    doTest.accept("<", LESS_THAN);
    doTest.accept(">", GREATER_THAN);
    doTest.accept("  x  ", ALPHABET);
    doTest.accept("\t7\r", NUMBER);
    doTest.accept("&", UNKNOWN);
    doTest.accept("~", UNKNOWN);
    doTest.accept("é", UNKNOWN);
  }

  @Test public void commands() {
    BiConsumer<String,LexemeKind> doTest = (source,kind) -> {
      Tokeniser tokeniser = new Tokeniser(source);
      Lexeme    lexeme    = tokeniser.next();
      assertEquals(kind, lexeme.getKind(), source);
      assertEquals(source, lexeme.getText());
      assertTrue(lexeme.isCommand());
      assertEquals(source.substring(1), lexeme.getCommandName());
      assertFalse(tokeniser.hasNext());
    };
    doTest.accept("\\alpha", ALPHA);
    doTest.accept("\\Omega", UPPER_OMEGA);
    doTest.accept("\\omega", OMEGA);
    doTest.accept("\\times", TIMES);
    doTest.accept("\\div", DIVIDE);
    doTest.accept("\\pm", PLUS_MINUS);
    doTest.accept("\\cdot", CDOT);
    doTest.accept("\\leq", LESS_THAN_EQUAL);
    doTest.accept("\\le", LESS_THAN_EQUAL);
    doTest.accept("\\ge", GREATER_THAN_EQUAL);
    doTest.accept("\\ne", NOT_EQUAL);
    doTest.accept("\\approx", APPROX);
    doTest.accept("\\triangle", TRIANGLE);
    doTest.accept("\\bot", BOTTOM);
    doTest.accept("\\sin", SIN);
    doTest.accept("\\lim", LIM);
    doTest.accept("\\sum", SUM);
    doTest.accept("\\int", INTEGRAL);
    doTest.accept("\\sqrt", SQUARE_ROOT);
    doTest.accept("\\frac", FRAC);
    doTest.accept("\\dfrac", DFRAC);
    doTest.accept("\\liter", LITER);
    doTest.accept("\\ell", ELL);
    doTest.accept("\\begin", BEGIN);
    doTest.accept("\\end", END);
    doTest.accept("\\foo", UNKNOWN);
    doTest.accept("\\Alpha", UNKNOWN);
    doTest.accept("\\", UNKNOWN);
  }

  @Test public void loneBackslash() {
    List<Lexeme> result = lexemes("\\ x\\1");
    assertEquals(4, result.size());
    assertEquals(UNKNOWN, result.get(0).getKind());
    assertEquals("\\", result.get(0).getText());
    assertEquals("", result.get(0).getCommandName());
    assertEquals(ALPHABET, result.get(1).getKind());
    assertEquals(UNKNOWN, result.get(2).getKind());
    assertEquals(NUMBER, result.get(3).getKind());
  }

  @Test public void maximalMunch() {
    Function<String,String> doTest = source -> {
      StringBuilder sb = new StringBuilder();
      lexemes(source).forEach(lexeme -> sb.append(lexeme.getKind().name()).append(':').append(lexeme.getText()).append(' '));
      return sb.toString().trim();
    };
    assertEquals("NUMBER:123", doTest.apply("123"));
    assertEquals("NUMBER:123 ALPHABET:abc", doTest.apply("123abc"));
    assertEquals("ALPHABET:abc NUMBER:123", doTest.apply("abc123"));
    assertEquals("NUMBER:1 PERIOD:. NUMBER:5", doTest.apply("1.5"));
    assertEquals("UNKNOWN:\\alphabet", doTest.apply("\\alphabet"));
    assertEquals("ALPHA:\\alpha NUMBER:2", doTest.apply("\\alpha2"));
    assertEquals("ALPHA:\\alpha ALPHABET:x", doTest.apply("\\alpha x"));
    assertEquals("ALPHABET:x SUPERSCRIPT:^ NUMBER:22", doTest.apply("x^22"));
    assertEquals("ALPHABET:a ALPHABET:b", doTest.apply("a  b"));
    assertEquals("LINE_BREAK:\\\\ UNKNOWN:\\", doTest.apply("\\\\\\"));
    assertEquals("LINE_BREAK:\\\\ LINE_BREAK:\\\\", doTest.apply("\\\\\\\\"));
  }

  @Test public void lineBreaks() {
    List<Lexeme> result = lexemes("a \\\\ b");
    assertEquals(3, result.size());
    assertEquals(LINE_BREAK, result.get(1).getKind());
    assertFalse(result.get(1).isCommand());
    assertNull(result.get(1).getCommandName());
  }

  @Test public void paragraphBreaks() {
    BiConsumer<String,Integer> doTest = (source,breakLength) -> {
      List<Lexeme> result = lexemes(source);
      assertEquals(3, result.size(), source);
      assertEquals(ALPHABET, result.get(0).getKind());
      assertEquals(PARAGRAPH_BREAK, result.get(1).getKind());
      assertEquals(breakLength, result.get(1).getLength());
      assertEquals(ALPHABET, result.get(2).getKind());
    };
    doTest.accept("a\n\nb", 2);
    doTest.accept("a \n\n b", 2);
    doTest.accept("a\n\r\nb", 3);
    doTest.accept("a\r\n\r\nb", 3);
    doTest.accept("a\n\n\nb", 2);
    doTest.accept("a\n\n\n\nb", 3);

    // Single new line is just a space
    assertEquals(2, lexemes("a\nb").size());
    assertEquals(2, lexemes("a\r\nb").size());
    assertEquals(2, lexemes("a\n \nb").size());
  }

  @Test public void trailingNewLines() {
    assertEquals(1, lexemes("a\n\n").size());
    assertEquals(1, lexemes("a\r\n\r\n\r\n").size());
    assertEquals(0, lexemes("\n\n").size());
    assertEquals(0, lexemes("").size());
    assertEquals(0, lexemes("   \t ").size());
  }

  @Test public void longNewLineRuns() {
    String newLines = "\n".repeat(200_000);
    assertTimeout(Duration.ofSeconds(5), () -> {
      assertEquals(1, lexemes("a" + newLines).size());
      List<Lexeme> result = lexemes("a" + newLines + "b");
      assertEquals(3, result.size());
      assertEquals(PARAGRAPH_BREAK, result.get(1).getKind());
      assertEquals(newLines.length() - 1, result.get(1).getLength());
    });
  }

  @Test public void positions() {
    List<Lexeme> result = lexemes("ab\n  \\beta\n(x)");
    assertEquals(5, result.size());
    assertEquals(1, result.get(0).getLineNum());
    assertEquals(1, result.get(0).getColumn());
    assertEquals(BETA, result.get(1).getKind());
    assertEquals(2, result.get(1).getLineNum());
    assertEquals(3, result.get(1).getColumn());
    assertEquals(5, result.get(1).getOffset());
    assertEquals("  \\beta", result.get(1).getLine());
    assertEquals(3, result.get(3).getLineNum());
    assertEquals(2, result.get(3).getColumn());
    assertEquals("(x)\n ^", result.get(3).getMarkedSourceLine().replace("\r\n", "\n"));
  }

  @Test public void endOfInput() {
    Tokeniser tokeniser = new Tokeniser("ab\ncd\n\n");
    while (tokeniser.hasNext()) {
      tokeniser.next();
    }
    Location end = tokeniser.endOfInput();
    assertEquals("ab\ncd", tokeniser.getSource());
    assertEquals(5, end.getOffset());
    assertEquals(2, end.getLineNum());
    assertEquals(3, end.getColumn());
  }

  @Test public void peekAndPrevious() {
    Tokeniser tokeniser = new Tokeniser("x + y");
    assertNull(tokeniser.previous());
    Lexeme peeked = tokeniser.peek();
    assertSame(peeked, tokeniser.peek());
    assertSame(peeked, tokeniser.next());
    assertSame(peeked, tokeniser.previous());
    assertEquals(PLUS, tokeniser.next().getKind());
    assertEquals(ALPHABET, tokeniser.peek().getKind());
    assertEquals(PLUS, tokeniser.previous().getKind());
    assertEquals("y", tokeniser.next().getText());
    assertFalse(tokeniser.hasNext());
    assertThrows(NoSuchElementException.class, tokeniser::peek);
    assertThrows(NoSuchElementException.class, tokeniser::next);
  }

  @Test public void surrogatePairs() {
    List<Lexeme> result = lexemes("a\uD83D\uDE00b");
    assertEquals(3, result.size());
    assertEquals(UNKNOWN, result.get(1).getKind());
    assertEquals(2, result.get(1).getLength());
    assertEquals("b", result.get(2).getText());
  }

  @Test public void lexemeToString() {
    assertEquals("Lexeme{kind='\\sqrt', text='\\sqrt'}", lexemes("\\sqrt").get(0).toString());
    assertEquals("Lexeme{kind='NUMBER', text='42'}", lexemes("42").get(0).toString());
  }
}
