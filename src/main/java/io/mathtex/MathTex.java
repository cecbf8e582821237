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

import io.mathtex.render.ImageRenderer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * <p>The MathTex class is the main entry point for parsing and rendering markup.
 * It provides a main() method for the commandline utility as well as static
 * methods for parsing, printing and rendering markup from within an application.</p>
 * <p>To parse markup into a tree:</p>
 * <pre>
 *   Node.Document doc = MathTex.parse("x^2 + \\dfrac{1}{2}");
 * </pre>
 * <p>To render markup to a PNG file using a specific context:</p>
 * <pre>
 *   MathTexContext context = MathTexContext.create().fontSize(48).width(600).build();
 *   MathTex.renderToFile("\\sqrt{a^2+b^2}", new File("out.png"), context);
 * </pre>
 */
public class MathTex {

  private static final Logger log = LogManager.getLogger(MathTex.class);

  /**
   * Parse markup using default context
   * @param source  the markup
   * @return the Document node of the tree
   * @throws ParseError if the markup is not well-formed
   */
  public static Node.Document parse(String source) {
    return parse(source, MathTexContext.create().build());
  }

  /**
   * Parse markup. With a debug level above 0 the tree is logged at info level.
   * @param source   the markup
   * @param context  the context controlling strictness
   * @return the Document node of the tree
   * @throws ParseError if the markup is not well-formed
   */
  public static Node.Document parse(String source, MathTexContext context) {
    Node.Document document = new Parser(new Tokeniser(source), context).parse();
    if (context.debugLevel() > 0) {
      log.info("Parsed tree:\n{}", TreePrinter.print(document));
    }
    return document;
  }

  /**
   * Indented dump of a tree
   * @param node  the root of the tree or any node within it
   * @return the tree as a string
   */
  public static String print(Node node) {
    return TreePrinter.print(node);
  }

  /**
   * Parse markup and return indented dump of the tree
   * @param source  the markup
   * @return the tree as a string
   */
  public static String print(String source) {
    return print(parse(source));
  }

  /**
   * Parse and render markup to an image
   * @param source   the markup
   * @param context  the context giving image and font size
   * @return the image
   */
  public static BufferedImage render(String source, MathTexContext context) {
    return ImageRenderer.render(parse(source, context), context);
  }

  /**
   * Parse and render markup to a file
   * @param source   the markup
   * @param file     the output file
   * @param context  the context giving image and font size
   * @throws MathTexError if the file cannot be written
   */
  public static void renderToFile(String source, File file, MathTexContext context) {
    ImageRenderer.write(render(source, context), file);
  }

  ////////////////////////////////////////////

  /**
   * Mainline for the commandline utility
   * @param args   - run with "-h" to get a summary of usage
   */
  public static void main(String[] args) {
    System.exit(new MathTex(System.out, System.err).run(args));
  }

  ////////////////////////////////////

  final static String DEFAULT_OUTPUT = "output.png";

  final static String usage =
    "Usage: mathtex [options] (-e markup | markupFile) [-o output.png]\n" +
    "         -e markup        : markup string to parse (markupFile not used)\n" +
    "         -o file          : image file to write (default " + DEFAULT_OUTPUT + ")\n" +
    "         -t               : print the tree instead of rendering an image\n" +
    "         -s size          : font size in pixels\n" +
    "         -W width         : image width in pixels\n" +
    "         -H height        : image height in pixels\n" +
    "         -m margin        : margin in pixels\n" +
    "         -u               : fail on unknown commands\n" +
    "         -a               : allow unclosed scopes at end of input\n" +
    "         -c               : do not read .mathtexrc config file\n" +
    "         -v               : show verbose errors (give stack trace)\n" +
    "         -d               : debug: log the parsed tree\n" +
    "         -h               : print this help\n";

  private final PrintStream out;
  private final PrintStream err;
  private       boolean     verbose;

  MathTex(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  /**
   * Run with given commandline args
   * @return the exit code
   */
  int run(String[] args) {
    try {
      Utils.Args options;
      try {
        options = Utils.parseArgs(args, "tuacvd", "eosWHm");
      }
      catch (IllegalArgumentException e) {
        err.println(usage);
        return error(e.getMessage());
      }
      if (options.has('h')) {
        out.println(usage);
        return 0;
      }
      verbose = options.has('v');

      String source;
      if (options.has('e')) {
        source = options.value('e');
      }
      else {
        if (options.files().isEmpty()) {
          err.println(usage);
          return error("Missing '-e' option and no markupFile specified");
        }
        source = new String(Files.readAllBytes(Paths.get(options.files().get(0))), StandardCharsets.UTF_8);
      }

      MathTexContext.MathTexContextBuilder builder = MathTexContext.create();
      if (!options.has('c')) {
        MathTexOptions.initOptions().applyTo(builder);
      }
      if (options.has('s')) { builder.fontSize(Utils.parseInt("-s", options.value('s'))); }
      if (options.has('W')) { builder.width(Utils.parseInt("-W", options.value('W'))); }
      if (options.has('H')) { builder.height(Utils.parseInt("-H", options.value('H'))); }
      if (options.has('m')) { builder.margin(Utils.parseInt("-m", options.value('m'))); }
      if (options.has('u')) { builder.failOnUnknownCommand(true); }
      if (options.has('a')) { builder.allowUnclosed(true); }
      builder.debug(options.count('d'));
      MathTexContext context = builder.build();

      Node.Document document = parse(source, context);
      if (options.has('t')) {
        out.print(print(document));
        return 0;
      }
      File output = new File(options.has('o') ? options.value('o') : DEFAULT_OUTPUT);
      ImageRenderer.write(ImageRenderer.render(document, context), output);
      return 0;
    }
    catch (Throwable t) {
      return error(t);
    }
  }

  private int error(Throwable t) {
    if (t instanceof ParseError) {
      return error(((ParseError) t).getMessage(verbose));
    }
    if (verbose) {
      t.printStackTrace(err);
      return 1;
    }
    if (t instanceof MathTexError || t instanceof IllegalArgumentException) {
      return error(t.getMessage());
    }
    if (t instanceof IOException) {
      return error("Error reading markup: " + t.getMessage());
    }
    return error(t.getClass().getName() + ": " + t.getMessage());
  }

  private int error(String msg) {
    err.println(msg);
    return 1;
  }
}
