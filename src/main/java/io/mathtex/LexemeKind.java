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
 * Enum for the different kinds of lexeme the Tokeniser can produce. Kinds with a
 * fixed spelling carry it in {@link #asString} and are registered in the
 * {@link SymbolTable} from there.
 */
public enum LexemeKind {
  //= Structural punctuation
  LEFT_PAREN("("),
  RIGHT_PAREN(")"),
  LEFT_SQUARE("["),
  RIGHT_SQUARE("]"),
  LEFT_BRACE("{"),
  RIGHT_BRACE("}"),
  COMMA(","),
  PERIOD("."),
  COLON(":"),
  SEMICOLON(";"),

  //= Scripts
  SUBSCRIPT("_"),
  SUPERSCRIPT("^"),

  //= Operators
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  SLASH("/"),
  PERCENT("%"),
  AT("@"),
  BANG("!"),
  PIPE("|"),
  TIMES("\\times"),
  DIVIDE("\\div"),
  MODULUS("\\mod"),
  PLUS_MINUS("\\pm"),
  CDOT("\\cdot"),

  //= Relations
  EQUAL("="),
  LESS_THAN("<"),
  GREATER_THAN(">"),
  LESS_THAN_EQUAL("\\leq"),
  GREATER_THAN_EQUAL("\\geq"),
  NOT_EQUAL("\\neq"),
  APPROX("\\approx"),

  //= Geometry symbols
  TRIANGLE("\\triangle"),
  CIRCLE("\\circle"),
  SQUARE("\\square"),
  BOTTOM("\\bot"),

  //= Greek letters
  ALPHA("\\alpha"),
  BETA("\\beta"),
  GAMMA("\\gamma"),
  DELTA("\\delta"),
  EPSILON("\\epsilon"),
  ZETA("\\zeta"),
  ETA("\\eta"),
  THETA("\\theta"),
  IOTA("\\iota"),
  KAPPA("\\kappa"),
  LAMBDA("\\lambda"),
  MU("\\mu"),
  NU("\\nu"),
  XI("\\xi"),
  OMICRON("\\omicron"),
  PI("\\pi"),
  RHO("\\rho"),
  SIGMA("\\sigma"),
  TAU("\\tau"),
  UPSILON("\\upsilon"),
  PHI("\\phi"),
  CHI("\\chi"),
  PSI("\\psi"),
  OMEGA("\\omega"),
  UPPER_GAMMA("\\Gamma"),
  UPPER_DELTA("\\Delta"),
  UPPER_THETA("\\Theta"),
  UPPER_LAMBDA("\\Lambda"),
  UPPER_XI("\\Xi"),
  UPPER_PI("\\Pi"),
  UPPER_SIGMA("\\Sigma"),
  UPPER_PHI("\\Phi"),
  UPPER_PSI("\\Psi"),
  UPPER_OMEGA("\\Omega"),

  //= Named functions
  SIN("\\sin"),
  COS("\\cos"),
  TAN("\\tan"),
  LOG("\\log"),
  LIM("\\lim"),

  //= Big operators
  SUM("\\sum"),
  INTEGRAL("\\int"),
  PRODUCT("\\prod"),

  //= Layout commands
  SQUARE_ROOT("\\sqrt"),
  FRAC("\\frac"),
  DFRAC("\\dfrac"),

  //= Units
  LITER("\\liter"),
  MILLILITER("\\milliliter"),
  ELL("\\ell"),

  //= Environments
  BEGIN("\\begin"),
  END("\\end"),

  //= Runs
  NUMBER(),
  ALPHABET(),

  //= Breaks
  LINE_BREAK("\\\\"),
  PARAGRAPH_BREAK(),

  //= Anything not otherwise recognised
  UNKNOWN();

  public final String asString;

  LexemeKind(String str) {
    this.asString = str;
  }
  LexemeKind()           { this.asString = null; }

  public boolean is(LexemeKind... kinds) {
    for (LexemeKind kind: kinds) {
      if (this == kind) {
        return true;
      }
    }
    return false;
  }

  public boolean isOpeningDelimiter() {
    return is(LEFT_PAREN, LEFT_SQUARE, LEFT_BRACE);
  }

  public boolean isClosingDelimiter() {
    return is(RIGHT_PAREN, RIGHT_SQUARE, RIGHT_BRACE);
  }

  public boolean isScriptMarker() {
    return is(SUBSCRIPT, SUPERSCRIPT);
  }

  public boolean isOperator() {
    return is(PLUS, MINUS, STAR, SLASH, PERCENT, AT, BANG, PIPE, TIMES, DIVIDE, MODULUS, PLUS_MINUS, CDOT);
  }

  public boolean isRelation() {
    return is(EQUAL, LESS_THAN, GREATER_THAN, LESS_THAN_EQUAL, GREATER_THAN_EQUAL, NOT_EQUAL, APPROX);
  }

  public boolean isGeometrySymbol() {
    return is(TRIANGLE, CIRCLE, SQUARE, BOTTOM);
  }

  public boolean isGreekLetter() {
    return ordinal() >= ALPHA.ordinal() && ordinal() <= UPPER_OMEGA.ordinal();
  }

  public boolean isNamedFunction() {
    return is(SIN, COS, TAN, LOG, LIM);
  }

  public boolean isBigOperator() {
    return is(SUM, INTEGRAL, PRODUCT);
  }

  public boolean isUnit() {
    return is(LITER, MILLILITER, ELL);
  }

  /**
   * Number of argument nodes a lexeme of this kind consumes once it has been
   * added to the tree. Zero means the lexeme takes no arguments.
   * @return the arity
   */
  public int arity() {
    switch (this) {
      case SUBSCRIPT:
      case SUPERSCRIPT:
      case SQUARE_ROOT:
      case SIN:
      case COS:
      case TAN:
      case LOG:
        return 1;
      case FRAC:
      case DFRAC:
        return 2;
      default:
        return 0;
    }
  }

  @Override
  public String toString() {
    return asString != null ? asString : super.toString();
  }
}
