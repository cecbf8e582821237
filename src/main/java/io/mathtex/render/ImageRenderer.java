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

import io.mathtex.LexemeKind;
import io.mathtex.MathTexContext;
import io.mathtex.MathTexError;
import io.mathtex.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Paint a parsed tree onto an image.
 * <p>
 * The tree is walked depth first keeping a stack of {@link RenderState}s. Each visit
 * paints its node at the current pen position and returns how far it moved the pen
 * horizontally. Lines and paragraphs move the pen down, subscripts and superscripts
 * are painted at half the font size below or above the baseline.
 * </p>
 * To centre fractions the width of a subtree is needed before painting it so the
 * same visitor can run in a measuring mode where nothing is drawn.
 */
public class ImageRenderer implements Node.Visitor<Integer> {

  private static final Logger log = LogManager.getLogger(ImageRenderer.class);

  private static final String FONT_NAME = Font.SERIF;

  private final Graphics2D         graphics;
  private final MathTexContext     context;
  private final Deque<RenderState> states  = new ArrayDeque<>();
  private       boolean            drawing = true;

  private ImageRenderer(Graphics2D graphics, MathTexContext context) {
    this.graphics = graphics;
    this.context  = context;
  }

  /**
   * Paint the tree onto a new image with white background
   * @param document  the parsed document
   * @param context   the context giving image size and font size
   * @return the image
   */
  public static BufferedImage render(Node.Document document, MathTexContext context) {
    BufferedImage image    = new BufferedImage(context.width(), context.height(), BufferedImage.TYPE_INT_RGB);
    Graphics2D    graphics = image.createGraphics();
    try {
      graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
      graphics.setColor(Color.WHITE);
      graphics.fillRect(0, 0, context.width(), context.height());
      graphics.setColor(Color.BLACK);

      ImageRenderer renderer = new ImageRenderer(graphics, context);
      renderer.states.push(new RenderState(context.margin() * 2, context.fontSize() + context.margin() * 2, context.fontSize()));
      int width = document.accept(renderer);
      log.debug("Rendered document: width={}, image={}x{}", width, context.width(), context.height());
      return image;
    }
    finally {
      graphics.dispose();
    }
  }

  /**
   * Write image to file. Format is taken from the file extension and defaults to PNG.
   * @param image  the image
   * @param file   the file to write
   * @throws MathTexError if the file cannot be written
   */
  public static void write(BufferedImage image, File file) {
    String name      = file.getName();
    int    dot       = name.lastIndexOf('.');
    String format    = dot == -1 ? "png" : name.substring(dot + 1).toLowerCase();
    if (!ImageIO.getImageWritersByFormatName(format).hasNext()) {
      format = "png";
    }
    try {
      if (!ImageIO.write(image, format, file)) {
        throw new MathTexError("No image writer for format " + format);
      }
      log.debug("Wrote {} image to {}", format, file);
    }
    catch (IOException e) {
      throw new MathTexError("Error writing image to " + file, e);
    }
  }

  //////////////////////////////////////////////

  @Override public Integer visitDocument(Node.Document node) {
    return node.getEnvironment().accept(this);
  }

  /**
   * Environments stack their lines downwards starting at the current baseline and
   * leave the pen to the right of the widest line. A "cases" environment also gets a
   * left brace spanning all its lines.
   */
  @Override public Integer visitEnvironment(Node.Environment node) {
    RenderState state  = state();
    int         startX = state.x;
    int         startY = state.y;
    boolean     cases  = node.getName().equals("cases");
    int         left   = startX + (cases ? textWidth("{", state.fontSize) + spacing() : 0);
    int         right  = left;
    int         y      = startY;
    boolean     first  = true;
    for (Node paragraph: node.getChildren()) {
      if (!first) {
        y += lineAdvance() / 2;
      }
      for (Node line: paragraph.getChildren()) {
        if (!first) {
          y += lineAdvance();
        }
        first = false;
        state.x = left;
        state.y = y;
        line.accept(this);
        right = Math.max(right, state.x);
      }
    }
    if (cases) {
      paintBrace(startX, startY, y, state.fontSize);
    }
    state.x = right;
    state.y = startY;
    return right - startX;
  }

  @Override public Integer visitParagraph(Node.Paragraph node) {
    return paintAll(node.getChildren());
  }

  @Override public Integer visitLine(Node.Line node) {
    return paintAll(node.getChildren());
  }

  @Override public Integer visitPlain(Node.Plain node) {
    RenderState state  = state();
    int         startX = state.x;
    LexemeKind  kind   = node.getKind();
    switch (kind) {
      case SUBSCRIPT:
      case SUPERSCRIPT:
        // Marker itself is not painted, just its argument
        return paintAll(node.getChildren());
      case FRAC:
      case DFRAC:
        paintFraction(node);
        break;
      case SQUARE_ROOT:
        paintSquareRoot(node);
        break;
      default:
        text(Glyphs.glyphFor(node.getLexeme()), Glyphs.isItalic(kind));
        paintAll(node.getChildren());
        break;
    }
    paintScripts(node);
    return state.x - startX;
  }

  @Override public Integer visitParenGroup(Node.ParenGroup node)     { return paintGroup(node, "(", ")"); }
  @Override public Integer visitBracketGroup(Node.BracketGroup node) { return paintGroup(node, "[", "]"); }
  @Override public Integer visitBraceGroup(Node.BraceGroup node)     { return paintGroup(node, null, null); }

  //////////////////////////////////////////////

  private int paintGroup(Node node, String open, String close) {
    RenderState state  = state();
    int         startX = state.x;
    if (open != null) {
      text(open, false);
    }
    paintAll(node.getChildren());
    if (close != null) {
      text(close, false);
    }
    paintScripts(node);
    return state.x - startX;
  }

  private int paintAll(List<Node> nodes) {
    int startX = state().x;
    nodes.forEach(child -> child.accept(this));
    return state().x - startX;
  }

  /**
   * Superscript is raised and subscript lowered, both starting at the same x. The pen
   * ends up after the wider of the two.
   */
  private void paintScripts(Node node) {
    if (node.getSubscript() == null && node.getSuperscript() == null) {
      return;
    }
    RenderState state      = state();
    int         scriptSize = (state.fontSize + 1) / 2;
    int         dx         = 0;
    if (node.getSuperscript() != null) {
      dx = Math.max(dx, paintAt(node.getSuperscript(), state.x, state.y - state.fontSize * 2 / 5, scriptSize));
    }
    if (node.getSubscript() != null) {
      dx = Math.max(dx, paintAt(node.getSubscript(), state.x, state.y + state.fontSize / 4, scriptSize));
    }
    state.x += dx;
  }

  /**
   * Numerator is centred above the bar and denominator below it. \frac uses a smaller
   * font than \dfrac.
   */
  private void paintFraction(Node.Plain node) {
    RenderState state    = state();
    int         size     = node.getKind() == LexemeKind.DFRAC ? state.fontSize : Math.max(1, state.fontSize * 7 / 10);
    List<Node>  args     = node.getChildren();
    Node        top      = args.size() > 0 ? args.get(0) : null;
    Node        bottom   = args.size() > 1 ? args.get(1) : null;
    int         topW     = top    == null ? 0 : measure(top, size);
    int         bottomW  = bottom == null ? 0 : measure(bottom, size);
    int         width    = Math.max(topW, bottomW);
    int         axis     = state.y - state.fontSize * 3 / 10;
    int         x        = state.x;
    if (top != null) {
      paintAt(top, x + (width - topW) / 2, axis - size / 4, size);
    }
    if (bottom != null) {
      paintAt(bottom, x + (width - bottomW) / 2, axis + size * 9 / 10, size);
    }
    if (drawing) {
      graphics.drawLine(x, axis, x + width, axis);
    }
    state.x += width + spacing();
  }

  private void paintSquareRoot(Node.Plain node) {
    RenderState state = state();
    text(Glyphs.glyphFor(node.getLexeme()), false);
    int argStart = state.x;
    int top      = state.y - ascent(state.fontSize);
    paintAll(node.getChildren());
    if (drawing) {
      graphics.drawLine(argStart - spacing(), top, state.x, top);
    }
  }

  private void paintBrace(int x, int topBaseline, int bottomBaseline, int fontSize) {
    if (!drawing) {
      return;
    }
    int   height = bottomBaseline - topBaseline + fontSize;
    float scale  = Math.max(1.0f, height / (float)fontSize);
    Font  font   = font(fontSize, false).deriveFont(AffineTransform.getScaleInstance(1.0, scale));
    graphics.setFont(font);
    int ascent = graphics.getFontMetrics(font(fontSize, false)).getAscent();
    graphics.drawString("{", x, topBaseline - ascent + Math.round(ascent * scale));
  }

  /**
   * Paint node at given position with given font size and return its width.
   */
  private int paintAt(Node node, int x, int y, int fontSize) {
    states.push(new RenderState(x, y, fontSize));
    try {
      return node.accept(this);
    }
    finally {
      states.pop();
    }
  }

  private int measure(Node node, int fontSize) {
    boolean wasDrawing = drawing;
    drawing = false;
    try {
      RenderState state = state();
      return paintAt(node, state.x, state.y, fontSize);
    }
    finally {
      drawing = wasDrawing;
    }
  }

  private void text(String text, boolean italic) {
    RenderState state = state();
    Font        font  = font(state.fontSize, italic);
    if (drawing) {
      graphics.setFont(font);
      graphics.drawString(text, state.x, state.y);
    }
    state.x += graphics.getFontMetrics(font).stringWidth(text) + spacing();
  }

  private int textWidth(String text, int fontSize) {
    return graphics.getFontMetrics(font(fontSize, false)).stringWidth(text);
  }

  private int ascent(int fontSize) {
    return graphics.getFontMetrics(font(fontSize, false)).getAscent();
  }

  private int lineAdvance() {
    FontMetrics metrics = graphics.getFontMetrics(font(context.fontSize(), false));
    return metrics.getHeight() + context.margin();
  }

  /**
   * Gap after each glyph, scaled with the current font size
   */
  private int spacing() {
    return context.margin() * state().fontSize / context.fontSize();
  }

  private Font font(int size, boolean italic) {
    return new Font(FONT_NAME, italic ? Font.ITALIC : Font.PLAIN, size);
  }

  private RenderState state() {
    return states.peek();
  }
}
