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
 * Produce an indented dump of a tree, one node per line. Subscripts and superscripts
 * are shown under their node prefixed with "_:" and "^:". For example "x^2" gives:
 * <pre>
 * Document
 *   Environment(document)
 *     Paragraph
 *       Line
 *         Plain(ALPHABET 'x')
 *           ^: Plain(^ '^')
 *             Plain(NUMBER '2')
 * </pre>
 */
public class TreePrinter implements Node.Visitor<Void> {

  private final StringBuilder sb     = new StringBuilder();
  private       int           depth  = 0;
  private       String        prefix = "";

  public static String print(Node node) {
    TreePrinter printer = new TreePrinter();
    node.accept(printer);
    return printer.sb.toString();
  }

  private TreePrinter() {}

  @Override public Void visitDocument(Node.Document node)            { return print(node, "Document"); }
  @Override public Void visitEnvironment(Node.Environment node)      { return print(node, "Environment(" + node.getName() + ")"); }
  @Override public Void visitParagraph(Node.Paragraph node)          { return print(node, "Paragraph"); }
  @Override public Void visitLine(Node.Line node)                    { return print(node, "Line"); }
  @Override public Void visitPlain(Node.Plain node)                  { return print(node, "Plain(" + node.getKind() + " '" + node.getText() + "')"); }
  @Override public Void visitParenGroup(Node.ParenGroup node)        { return print(node, "ParenGroup"); }
  @Override public Void visitBracketGroup(Node.BracketGroup node)    { return print(node, "BracketGroup"); }
  @Override public Void visitBraceGroup(Node.BraceGroup node)        { return print(node, "BraceGroup"); }

  private Void print(Node node, String description) {
    sb.append("  ".repeat(depth)).append(prefix).append(description).append('\n');
    prefix = "";
    depth++;
    if (node.getSubscript() != null) {
      prefix = "_: ";
      node.getSubscript().accept(this);
    }
    if (node.getSuperscript() != null) {
      prefix = "^: ";
      node.getSuperscript().accept(this);
    }
    node.getChildren().forEach(child -> child.accept(this));
    depth--;
    return null;
  }
}
