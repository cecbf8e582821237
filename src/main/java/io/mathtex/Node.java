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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node classes for the tree built by the {@link Parser}.
 * <p>
 * Every node owns an ordered list of children. {@link Plain} nodes and the three
 * group nodes can additionally own a single subscript and a single superscript
 * which are kept out of the ordinary children.
 * </p><p>
 * The structural nodes always come in the same shape: a {@link Document} owns one
 * implicit {@link Environment} called "document", every Environment owns at least
 * one {@link Paragraph} and every Paragraph owns at least one {@link Line}.
 * </p>
 * Consumers should only read the tree, normally through a {@link Visitor}.
 */
public abstract class Node {

  public enum NodeType {
    DOCUMENT,
    ENVIRONMENT,
    PARAGRAPH,
    LINE,
    PLAIN,
    PAREN_GROUP,
    BRACKET_GROUP,
    BRACE_GROUP
  }

  final List<Node> children = new ArrayList<>();

  public abstract NodeType getType();

  public abstract <T> T accept(Visitor<T> visitor);

  /**
   * @return the lexeme this node was created from or null for structural nodes
   */
  public Lexeme getLexeme()        { return null; }

  public List<Node> getChildren()  { return Collections.unmodifiableList(children); }
  public Node       getSubscript()   { return null; }
  public Node       getSuperscript() { return null; }

  public boolean is(NodeType... types) {
    for (NodeType type: types) {
      if (type == getType()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Children with any brace group child replaced by its own children. Since braces
   * only group arguments, "x^2" and "x^{2}" give the same arguments for the '^'.
   * @return the children with brace groups expanded
   */
  public List<Node> getArguments() {
    List<Node> arguments = new ArrayList<>();
    for (Node child: children) {
      if (child.is(NodeType.BRACE_GROUP)) {
        arguments.addAll(child.children);
      }
      else {
        arguments.add(child);
      }
    }
    return arguments;
  }

  void addChild(Node child) {
    children.add(child);
  }

  Node lastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  /**
   * Whether subscripts and superscripts can be attached to this node
   */
  boolean canAttach() {
    return false;
  }

  //////////////////////////////////////////

  /**
   * Nodes that can have a subscript and superscript attached. Each slot can only be
   * filled once.
   */
  public abstract static class Scriptable extends Node {
    Node subscript;
    Node superscript;

    @Override public Node getSubscript()   { return subscript; }
    @Override public Node getSuperscript() { return superscript; }
    @Override boolean canAttach()          { return true; }
  }

  public static class Document extends Node {
    final Environment environment;

    Document() {
      environment = new Environment("document", null);
      addChild(environment);
    }

    /**
     * @return the implicit "document" environment
     */
    public Environment getEnvironment()                { return environment; }
    @Override public NodeType getType()                { return NodeType.DOCUMENT; }
    @Override public <T> T accept(Visitor<T> visitor)  { return visitor.visitDocument(this); }
  }

  public static class Environment extends Node {
    final String name;
    final Lexeme begin;   // null for implicit document environment

    Environment(String name, Lexeme begin) {
      this.name  = name;
      this.begin = begin;
      addChild(new Paragraph());
    }

    public String getName()                            { return name; }
    @Override public Lexeme getLexeme()                { return begin; }
    @Override public NodeType getType()                { return NodeType.ENVIRONMENT; }
    @Override public <T> T accept(Visitor<T> visitor)  { return visitor.visitEnvironment(this); }

    Paragraph currentParagraph() {
      return (Paragraph)lastChild();
    }

    Paragraph newParagraph() {
      Paragraph paragraph = new Paragraph();
      addChild(paragraph);
      return paragraph;
    }
  }

  public static class Paragraph extends Node {
    Paragraph() {
      addChild(new Line());
    }

    @Override public NodeType getType()                { return NodeType.PARAGRAPH; }
    @Override public <T> T accept(Visitor<T> visitor)  { return visitor.visitParagraph(this); }

    Line currentLine() {
      return (Line)lastChild();
    }

    Line newLine() {
      Line line = new Line();
      addChild(line);
      return line;
    }
  }

  public static class Line extends Node {
    @Override public NodeType getType()                { return NodeType.LINE; }
    @Override public <T> T accept(Visitor<T> visitor)  { return visitor.visitLine(this); }
  }

  public static class Plain extends Scriptable {
    final Lexeme lexeme;

    Plain(Lexeme lexeme) {
      this.lexeme = lexeme;
    }

    public String     getText()                        { return lexeme.getText(); }
    public LexemeKind getKind()                        { return lexeme.getKind(); }
    @Override public Lexeme getLexeme()                { return lexeme; }
    @Override public NodeType getType()                { return NodeType.PLAIN; }
    @Override public <T> T accept(Visitor<T> visitor)  { return visitor.visitPlain(this); }
  }

  /**
   * Node for a delimited group. Only closes when the matching closing delimiter is seen.
   */
  public abstract static class Group extends Scriptable {
    final Lexeme open;

    Group(Lexeme open) {
      this.open = open;
    }

    @Override public Lexeme getLexeme()  { return open; }

    /**
     * @return the kind of lexeme that closes this group
     */
    public abstract LexemeKind closingKind();
  }

  public static class ParenGroup extends Group {
    ParenGroup(Lexeme open)                            { super(open); }
    @Override public LexemeKind closingKind()          { return LexemeKind.RIGHT_PAREN; }
    @Override public NodeType getType()                { return NodeType.PAREN_GROUP; }
    @Override public <T> T accept(Visitor<T> visitor)  { return visitor.visitParenGroup(this); }
  }

  public static class BracketGroup extends Group {
    BracketGroup(Lexeme open)                          { super(open); }
    @Override public LexemeKind closingKind()          { return LexemeKind.RIGHT_SQUARE; }
    @Override public NodeType getType()                { return NodeType.BRACKET_GROUP; }
    @Override public <T> T accept(Visitor<T> visitor)  { return visitor.visitBracketGroup(this); }
  }

  public static class BraceGroup extends Group {
    BraceGroup(Lexeme open)                            { super(open); }
    @Override public LexemeKind closingKind()          { return LexemeKind.RIGHT_BRACE; }
    @Override public NodeType getType()                { return NodeType.BRACE_GROUP; }
    @Override public <T> T accept(Visitor<T> visitor)  { return visitor.visitBraceGroup(this); }
  }

  //////////////////////////////////////////

  public interface Visitor<T> {
    T visitDocument(Document node);
    T visitEnvironment(Environment node);
    T visitParagraph(Paragraph node);
    T visitLine(Line node);
    T visitPlain(Plain node);
    T visitParenGroup(ParenGroup node);
    T visitBracketGroup(BracketGroup node);
    T visitBraceGroup(BraceGroup node);
  }
}
