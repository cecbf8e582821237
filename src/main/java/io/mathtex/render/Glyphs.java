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

package io.mathtex.render;

import io.mathtex.Lexeme;
import io.mathtex.LexemeKind;

import java.util.EnumMap;
import java.util.Map;

import static io.mathtex.LexemeKind.*;

/**
 * Text to paint for each kind of lexeme.
 */
final class Glyphs {

  private Glyphs() {}

  private static final Map<LexemeKind,String> glyphs = new EnumMap<>(LexemeKind.class);

  static {
    glyphs.put(MINUS,              "−");
    glyphs.put(STAR,               "∗");
    glyphs.put(TIMES,              "×");
    glyphs.put(DIVIDE,             "÷");
    glyphs.put(MODULUS,            "mod");
    glyphs.put(PLUS_MINUS,         "±");
    glyphs.put(CDOT,               "·");
    glyphs.put(LESS_THAN_EQUAL,    "≤");
    glyphs.put(GREATER_THAN_EQUAL, "≥");
    glyphs.put(NOT_EQUAL,          "≠");
    glyphs.put(APPROX,             "≈");
    glyphs.put(TRIANGLE,           "△");
    glyphs.put(CIRCLE,             "○");
    glyphs.put(SQUARE,             "□");
    glyphs.put(BOTTOM,             "⊥");
    glyphs.put(SUM,                "∑");
    glyphs.put(INTEGRAL,           "∫");
    glyphs.put(PRODUCT,            "∏");
    glyphs.put(SQUARE_ROOT,        "√");
    glyphs.put(LITER,              "L");
    glyphs.put(MILLILITER,         "mL");
    glyphs.put(ELL,                "ℓ");

    String lower = "αβγδεζηθικλμ" +
                   "νξοπρστυφχψω";
    LexemeKind[] lowerKinds = { ALPHA, BETA, GAMMA, DELTA, EPSILON, ZETA, ETA, THETA, IOTA, KAPPA, LAMBDA, MU,
                                NU, XI, OMICRON, PI, RHO, SIGMA, TAU, UPSILON, PHI, CHI, PSI, OMEGA };
    for (int i = 0; i < lowerKinds.length; i++) {
      glyphs.put(lowerKinds[i], String.valueOf(lower.charAt(i)));
    }
    glyphs.put(UPPER_GAMMA,  "Γ");
    glyphs.put(UPPER_DELTA,  "Δ");
    glyphs.put(UPPER_THETA,  "Θ");
    glyphs.put(UPPER_LAMBDA, "Λ");
    glyphs.put(UPPER_XI,     "Ξ");
    glyphs.put(UPPER_PI,     "Π");
    glyphs.put(UPPER_SIGMA,  "Σ");
    glyphs.put(UPPER_PHI,    "Φ");
    glyphs.put(UPPER_PSI,    "Ψ");
    glyphs.put(UPPER_OMEGA,  "Ω");
  }

  /**
   * @param lexeme  the lexeme
   * @return text to paint for the lexeme
   */
  static String glyphFor(Lexeme lexeme) {
    String glyph = glyphs.get(lexeme.getKind());
    if (glyph != null) {
      return glyph;
    }
    // Named functions are painted as their name
    if (lexeme.getKind().isNamedFunction()) {
      return lexeme.getCommandName();
    }
    return lexeme.getText();
  }

  /**
   * Variables and lower case Greek letters are painted in italics
   */
  static boolean isItalic(LexemeKind kind) {
    return kind == ALPHABET || (kind.isGreekLetter() && kind.ordinal() <= OMEGA.ordinal());
  }
}
